package com.phillippitts.interviewengine.config.credential;

import com.phillippitts.interviewengine.config.properties.RelayCredentialProperties;
import com.phillippitts.interviewengine.exception.InterviewConfigurationException;
import com.phillippitts.interviewengine.service.credential.RelayCredentialIssuer;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RelayCredentialConfigTest {

    private final Clock clock = Clock.fixed(Instant.ofEpochSecond(1_700_000_000L), ZoneOffset.UTC);

    @Test
    void configuredSecretIsUsed() {
        assertThat(RelayCredentialConfig.resolveSecret(new RelayCredentialProperties("s3cret"))).isEqualTo("s3cret");
    }

    @Test
    void missingSecretFailsStartup() {
        assertThatThrownBy(() -> new RelayCredentialConfig()
                .relayCredentialIssuer(new RelayCredentialProperties("  "), clock))
                .isInstanceOf(InterviewConfigurationException.class)
                .hasMessageContaining("relay.credential.secret");
    }

    @Test
    void developmentSecretOnlyWhenAllowed() {
        RelayCredentialProperties props =
                new RelayCredentialProperties(null, true, null, null, null, null, null);

        assertThat(RelayCredentialConfig.resolveSecret(props)).isEqualTo(RelayCredentialConfig.DEVELOPMENT_SECRET);
    }

    @Test
    void issuerUsesConfiguredHostPortsAndSessionTtl() {
        RelayCredentialProperties props = new RelayCredentialProperties("s3cret", false, Duration.ofHours(2),
                Duration.ofMinutes(30), "turn.example.org", 3479, 5350);

        RelayCredentialIssuer issuer = new RelayCredentialConfig().relayCredentialIssuer(props, clock);

        assertThat(issuer.issueForSession("s-1", "u-1").username()).isEqualTo("1700001800:u-1_s-1");
        assertThat(issuer.issue("u-1").username()).isEqualTo("1700007200:u-1");
        assertThat(issuer.issue("u-1").iceServers().get(0).urls()).containsExactly("stun:turn.example.org:3479");
        assertThat(issuer.issue("u-1").iceServers().get(2).urls())
                .containsExactly("turns:turn.example.org:5350?transport=tcp");
    }
}
