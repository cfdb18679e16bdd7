package com.phillippitts.interviewengine.service.credential;

import com.phillippitts.interviewengine.domain.IceServer;
import com.phillippitts.interviewengine.domain.RelayCredential;
import com.phillippitts.interviewengine.exception.InterviewConfigurationException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeFormatter;
import java.util.Base64;
import java.util.List;
import java.util.Objects;

/**
 * Issues and validates time-limited TURN relay credentials (the TURN REST API scheme).
 *
 * <p>Username is {@code "<expiryUnixSeconds>:<identity>"}; the credential is the base64 encoded
 * HMAC-SHA1 of the username under the shared secret. The relay server recomputes the same HMAC,
 * so nothing is stored here. Output is deterministic for a given identity, ttl, clock instant
 * and secret.
 *
 * <p>Validation fails closed: null input, an unparseable expiry, or an expiry in the past all
 * yield {@code false}. Credentials are compared in constant time.
 */
public final class RelayCredentialIssuer {

    private static final Logger LOG = LogManager.getLogger(RelayCredentialIssuer.class);

    static final String HMAC_ALGORITHM = "HmacSHA1";

    /** Shortest ttl a credential can carry; expiry is stored in whole seconds. */
    public static final Duration MIN_TTL = Duration.ofSeconds(1);

    private final SecretKeySpec key;
    private final Clock clock;
    private final Duration defaultTtl;
    private final Duration sessionTtl;
    private final String serverHost;
    private final int stunPort;
    private final int turnsPort;

    private RelayCredentialIssuer(Builder builder) {
        this.key = new SecretKeySpec(builder.secret.getBytes(StandardCharsets.UTF_8), HMAC_ALGORITHM);
        this.clock = builder.clock;
        this.defaultTtl = builder.defaultTtl;
        this.sessionTtl = builder.sessionTtl;
        this.serverHost = builder.serverHost;
        this.stunPort = builder.stunPort;
        this.turnsPort = builder.turnsPort;
        // Fail at construction rather than on the first request.
        sign("0:startup-check");
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Issues a credential with the default ttl.
     */
    public RelayCredential issue(String identity) {
        return issue(identity, defaultTtl);
    }

    /**
     * Issues a credential for {@code identity} valid for {@code ttl} from now. The username
     * carries whole epoch seconds, so a fractional ttl is rounded up to the next second.
     *
     * @throws IllegalArgumentException if identity is blank or ttl is shorter than one second
     */
    public RelayCredential issue(String identity, Duration ttl) {
        if (identity == null || identity.isBlank()) {
            throw new IllegalArgumentException("identity must not be blank");
        }
        Objects.requireNonNull(ttl, "ttl must not be null");
        if (ttl.compareTo(MIN_TTL) < 0) {
            throw new IllegalArgumentException("ttl must be at least one second, got " + ttl);
        }
        long ttlSeconds = ttl.getNano() == 0 ? ttl.getSeconds() : ttl.getSeconds() + 1;
        long expiry = clock.instant().getEpochSecond() + ttlSeconds;
        String username = expiry + ":" + identity;
        String credential = sign(username);
        Instant expiresAt = Instant.ofEpochSecond(expiry);
        return new RelayCredential(
                username,
                credential,
                ttlSeconds,
                expiresAt,
                DateTimeFormatter.ISO_INSTANT.format(expiresAt),
                iceServers(username, credential));
    }

    /**
     * Issues a session-scoped credential with identity {@code "<userId>_<sessionId>"}, or the
     * session id alone when no user id is given, using the session ttl.
     */
    public RelayCredential issueForSession(String sessionId, String userId) {
        if (sessionId == null || sessionId.isBlank()) {
            throw new IllegalArgumentException("sessionId must not be blank");
        }
        String identity = (userId == null || userId.isBlank()) ? sessionId : userId + "_" + sessionId;
        return issue(identity, sessionTtl);
    }

    /**
     * Checks a username/credential pair: not expired and signed with this issuer's secret.
     */
    public boolean validate(String username, String credential) {
        if (username == null || credential == null) {
            return false;
        }
        int sep = username.indexOf(':');
        if (sep <= 0) {
            return false;
        }
        long expiry;
        try {
            expiry = Long.parseLong(username.substring(0, sep));
        } catch (NumberFormatException e) {
            LOG.debug("Rejecting relay username with unparseable expiry");
            return false;
        }
        if (expiry < clock.instant().getEpochSecond()) {
            return false;
        }
        byte[] expected = sign(username).getBytes(StandardCharsets.UTF_8);
        return MessageDigest.isEqual(expected, credential.getBytes(StandardCharsets.UTF_8));
    }

    private String sign(String username) {
        try {
            Mac mac = Mac.getInstance(HMAC_ALGORITHM);
            mac.init(key);
            byte[] digest = mac.doFinal(username.getBytes(StandardCharsets.UTF_8));
            return Base64.getEncoder().encodeToString(digest);
        } catch (GeneralSecurityException e) {
            throw new InterviewConfigurationException("relay.credential.secret",
                    "Unable to initialise " + HMAC_ALGORITHM, e);
        }
    }

    private List<IceServer> iceServers(String username, String credential) {
        return List.of(
                IceServer.stun("stun:" + serverHost + ":" + stunPort),
                new IceServer(List.of(
                        "turn:" + serverHost + ":" + stunPort + "?transport=udp",
                        "turn:" + serverHost + ":" + stunPort + "?transport=tcp"),
                        username, credential),
                new IceServer(List.of("turns:" + serverHost + ":" + turnsPort + "?transport=tcp"),
                        username, credential));
    }

    /**
     * Builder for {@link RelayCredentialIssuer}. Only the secret is required.
     */
    public static final class Builder {
        private String secret;
        private Clock clock = Clock.systemUTC();
        private Duration defaultTtl = Duration.ofHours(24);
        private Duration sessionTtl = Duration.ofHours(1);
        private String serverHost = "localhost";
        private int stunPort = 3478;
        private int turnsPort = 5349;

        private Builder() {
        }

        public Builder secret(String secret) {
            this.secret = secret;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public Builder defaultTtl(Duration defaultTtl) {
            this.defaultTtl = defaultTtl;
            return this;
        }

        public Builder sessionTtl(Duration sessionTtl) {
            this.sessionTtl = sessionTtl;
            return this;
        }

        public Builder serverHost(String serverHost) {
            this.serverHost = serverHost;
            return this;
        }

        public Builder stunPort(int stunPort) {
            this.stunPort = stunPort;
            return this;
        }

        public Builder turnsPort(int turnsPort) {
            this.turnsPort = turnsPort;
            return this;
        }

        /**
         * @throws InterviewConfigurationException if the secret is missing or a ttl is shorter
         *                                         than one second
         */
        public RelayCredentialIssuer build() {
            if (secret == null || secret.isBlank()) {
                throw new InterviewConfigurationException("relay.credential.secret",
                        "Relay credential secret is not configured");
            }
            Objects.requireNonNull(clock, "clock must not be null");
            Objects.requireNonNull(defaultTtl, "defaultTtl must not be null");
            Objects.requireNonNull(sessionTtl, "sessionTtl must not be null");
            if (defaultTtl.compareTo(MIN_TTL) < 0 || sessionTtl.compareTo(MIN_TTL) < 0) {
                throw new InterviewConfigurationException("relay.credential.ttl",
                        "Relay credential ttls must be at least one second");
            }
            Objects.requireNonNull(serverHost, "serverHost must not be null");
            return new RelayCredentialIssuer(this);
        }
    }
}
