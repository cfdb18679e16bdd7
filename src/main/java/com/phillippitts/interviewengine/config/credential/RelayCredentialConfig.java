package com.phillippitts.interviewengine.config.credential;

import com.phillippitts.interviewengine.config.properties.RelayCredentialProperties;
import com.phillippitts.interviewengine.exception.InterviewConfigurationException;
import com.phillippitts.interviewengine.service.credential.RelayCredentialIssuer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Wires the {@link RelayCredentialIssuer}.
 *
 * <p>The shared secret comes from {@code relay.credential.secret} (normally the
 * {@code RELAY_CREDENTIAL_SECRET} environment variable). Startup fails without one unless
 * {@code relay.credential.allow-development-secret=true}, in which case a fixed development
 * secret is used and a warning is logged.
 */
@Configuration
public class RelayCredentialConfig {

    private static final Logger LOG = LogManager.getLogger(RelayCredentialConfig.class);

    static final String DEVELOPMENT_SECRET = "development-relay-secret";

    @Bean
    public RelayCredentialIssuer relayCredentialIssuer(RelayCredentialProperties props, Clock clock) {
        return RelayCredentialIssuer.builder()
                .secret(resolveSecret(props))
                .clock(clock)
                .defaultTtl(props.getDefaultTtl())
                .sessionTtl(props.getSessionTtl())
                .serverHost(props.getServerHost())
                .stunPort(props.getStunPort())
                .turnsPort(props.getTurnsPort())
                .build();
    }

    static String resolveSecret(RelayCredentialProperties props) {
        String secret = props.getSecret();
        if (secret != null && !secret.isBlank()) {
            return secret;
        }
        if (props.isAllowDevelopmentSecret()) {
            LOG.warn("relay.credential.secret not set; using the development secret. "
                    + "Relay credentials issued by this instance are not secure.");
            return DEVELOPMENT_SECRET;
        }
        throw new InterviewConfigurationException("relay.credential.secret",
                "Relay credential secret is required (set RELAY_CREDENTIAL_SECRET)");
    }
}
