package com.phillippitts.interviewengine.service.credential;

import com.phillippitts.interviewengine.domain.IceServer;
import com.phillippitts.interviewengine.domain.RelayCredential;
import com.phillippitts.interviewengine.exception.InterviewConfigurationException;
import com.phillippitts.interviewengine.testutil.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.Base64;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RelayCredentialIssuerTest {

    private static final String SECRET = "s3cret";
    private static final Instant NOW = Instant.ofEpochSecond(1_700_000_000L);

    private MutableClock clock;
    private RelayCredentialIssuer issuer;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(NOW);
        issuer = RelayCredentialIssuer.builder()
                .secret(SECRET)
                .clock(clock)
                .serverHost("relay.example.org")
                .build();
    }

    private static String hmac(String secret, String data) throws Exception {
        Mac mac = Mac.getInstance("HmacSHA1");
        mac.init(new SecretKeySpec(secret.getBytes(StandardCharsets.UTF_8), "HmacSHA1"));
        return Base64.getEncoder().encodeToString(mac.doFinal(data.getBytes(StandardCharsets.UTF_8)));
    }

    @Test
    void usernameCarriesExpiryAndIdentity() throws Exception {
        RelayCredential credential = issuer.issue("alice", Duration.ofHours(1));

        assertThat(credential.username()).isEqualTo("1700003600:alice");
        assertThat(credential.credential()).isEqualTo(hmac(SECRET, "1700003600:alice"));
        assertThat(credential.ttlSeconds()).isEqualTo(3600);
        assertThat(credential.expiresAt()).isEqualTo(Instant.ofEpochSecond(1_700_003_600L));
        assertThat(credential.validUntil()).isEqualTo("2023-11-14T23:13:20Z");
    }

    @Test
    void defaultTtlIsOneDay() {
        assertThat(issuer.issue("alice").username()).isEqualTo("1700086400:alice");
    }

    @Test
    void iceServersListStunAndTurnEndpoints() {
        RelayCredential credential = issuer.issue("alice");
        List<IceServer> servers = credential.iceServers();

        assertThat(servers).hasSize(3);
        assertThat(servers.get(0).urls()).containsExactly("stun:relay.example.org:3478");
        assertThat(servers.get(0).username()).isNull();
        assertThat(servers.get(1).urls()).containsExactly(
                "turn:relay.example.org:3478?transport=udp",
                "turn:relay.example.org:3478?transport=tcp");
        assertThat(servers.get(1).username()).isEqualTo(credential.username());
        assertThat(servers.get(2).urls()).containsExactly("turns:relay.example.org:5349?transport=tcp");
        assertThat(servers.get(2).credential()).isEqualTo(credential.credential());
    }

    @Test
    void issuanceIsDeterministicForSameInstant() {
        assertThat(issuer.issue("bob", Duration.ofMinutes(5)))
                .isEqualTo(issuer.issue("bob", Duration.ofMinutes(5)));
    }

    @Test
    void freshCredentialValidates() {
        RelayCredential credential = issuer.issue("alice", Duration.ofHours(1));

        assertThat(issuer.validate(credential.username(), credential.credential())).isTrue();
    }

    @Test
    void expiredCredentialIsRejected() {
        RelayCredential credential = issuer.issue("alice", Duration.ofHours(1));

        clock.advance(Duration.ofHours(1).plusSeconds(1));

        assertThat(issuer.validate(credential.username(), credential.credential())).isFalse();
    }

    @Test
    void tamperedUsernameOrCredentialIsRejected() {
        RelayCredential credential = issuer.issue("alice", Duration.ofHours(1));

        assertThat(issuer.validate("1700003600:mallory", credential.credential())).isFalse();
        assertThat(issuer.validate("1800000000:alice", credential.credential())).isFalse();
        assertThat(issuer.validate(credential.username(), credential.credential() + "x")).isFalse();
    }

    @Test
    void singleCharacterFlipIsRejected() {
        RelayCredential credential = issuer.issue("alice", Duration.ofHours(1));

        assertThat(issuer.validate(credential.username(), flipAt(credential.credential(), 5))).isFalse();
        assertThat(issuer.validate(flipAt(credential.username(), credential.username().length() - 1),
                credential.credential())).isFalse();
        assertThat(flipAt(credential.username(), 9)).isEqualTo("1700003601:alice");
        assertThat(issuer.validate(flipAt(credential.username(), 9), credential.credential())).isFalse();
    }

    private static String flipAt(String value, int index) {
        char[] chars = value.toCharArray();
        chars[index] = (char) (chars[index] ^ 1);
        return new String(chars);
    }

    @Test
    void credentialFromAnotherSecretIsRejected() {
        RelayCredentialIssuer other = RelayCredentialIssuer.builder().secret("other").clock(clock).build();
        RelayCredential foreign = other.issue("alice");

        assertThat(issuer.validate(foreign.username(), foreign.credential())).isFalse();
    }

    @Test
    void malformedInputFailsClosed() {
        assertThat(issuer.validate(null, "x")).isFalse();
        assertThat(issuer.validate("1700003600:alice", null)).isFalse();
        assertThat(issuer.validate("alice", "x")).isFalse();
        assertThat(issuer.validate(":alice", "x")).isFalse();
        assertThat(issuer.validate("soon:alice", "x")).isFalse();
    }

    @Test
    void sessionCredentialCombinesUserAndSession() {
        assertThat(issuer.issueForSession("s-1", "u-1").username()).isEqualTo("1700003600:u-1_s-1");
        assertThat(issuer.issueForSession("s-1", null).username()).isEqualTo("1700003600:s-1");
    }

    @Test
    void rejectsInvalidArguments() {
        assertThatThrownBy(() -> issuer.issue(" ", Duration.ofHours(1)))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> issuer.issue("alice", Duration.ZERO))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> issuer.issue("alice", Duration.ofMillis(999)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("at least one second");
        assertThatThrownBy(() -> issuer.issueForSession("", "u"))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void fractionalTtlIsRoundedUpToWholeSeconds() {
        RelayCredential credential = issuer.issue("alice", Duration.ofMillis(1_500));

        assertThat(credential.ttlSeconds()).isEqualTo(2);
        assertThat(credential.username()).isEqualTo("1700000002:alice");
        assertThat(credential.expiresAt()).isEqualTo(NOW.plusSeconds(2));
    }

    @Test
    void subSecondConfiguredTtlIsAConfigurationError() {
        assertThatThrownBy(() -> RelayCredentialIssuer.builder()
                .secret(SECRET)
                .sessionTtl(Duration.ofMillis(500))
                .build())
                .isInstanceOf(InterviewConfigurationException.class)
                .satisfies(e -> assertThat(((InterviewConfigurationException) e).getProperty())
                        .isEqualTo("relay.credential.ttl"));
    }

    @Test
    void missingSecretIsAConfigurationError() {
        assertThatThrownBy(() -> RelayCredentialIssuer.builder().secret("  ").build())
                .isInstanceOf(InterviewConfigurationException.class)
                .satisfies(e -> assertThat(((InterviewConfigurationException) e).getProperty())
                        .isEqualTo("relay.credential.secret"));
    }
}
