package com.phillippitts.interviewengine.config.properties;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Typed properties for TURN relay credentials ({@code relay.credential.*}).
 *
 * <p>The shared secret has no default. A blank secret stops startup unless
 * {@code allow-development-secret} is set.
 */
@Validated
@ConfigurationProperties(prefix = "relay.credential")
public class RelayCredentialProperties {

    private final String secret;

    private final boolean allowDevelopmentSecret;

    @NotNull
    private final Duration defaultTtl;

    @NotNull
    private final Duration sessionTtl;

    @NotBlank
    private final String serverHost;

    @Min(1)
    @Max(65535)
    private final int stunPort;

    @Min(1)
    @Max(65535)
    private final int turnsPort;

    @ConstructorBinding
    public RelayCredentialProperties(String secret,
                                     Boolean allowDevelopmentSecret,
                                     Duration defaultTtl,
                                     Duration sessionTtl,
                                     String serverHost,
                                     Integer stunPort,
                                     Integer turnsPort) {
        this.secret = secret;
        this.allowDevelopmentSecret = allowDevelopmentSecret != null && allowDevelopmentSecret;
        this.defaultTtl = defaultTtl == null ? Duration.ofHours(24) : defaultTtl;
        this.sessionTtl = sessionTtl == null ? Duration.ofHours(1) : sessionTtl;
        this.serverHost = serverHost == null ? "localhost" : serverHost;
        this.stunPort = stunPort == null ? 3478 : stunPort;
        this.turnsPort = turnsPort == null ? 5349 : turnsPort;
    }

    /**
     * Convenience constructor for tests: given secret, all other values defaulted.
     */
    public RelayCredentialProperties(String secret) {
        this(secret, false, null, null, null, null, null);
    }

    public String getSecret() {
        return secret;
    }

    public boolean isAllowDevelopmentSecret() {
        return allowDevelopmentSecret;
    }

    public Duration getDefaultTtl() {
        return defaultTtl;
    }

    public Duration getSessionTtl() {
        return sessionTtl;
    }

    public String getServerHost() {
        return serverHost;
    }

    public int getStunPort() {
        return stunPort;
    }

    public int getTurnsPort() {
        return turnsPort;
    }
}
