package com.streamhub.unit.auth;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.streamhub.auth.JwtPeerIdentityVerifier;
import com.streamhub.exception.UnauthorizedException;
import com.streamhub.support.MutableClock;
import java.time.Duration;
import java.time.Instant;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class JwtPeerIdentityVerifierTest {

    private static final String SECRET = "test-secret-that-is-at-least-32-bytes-long!!";

    private MutableClock clock;
    private JwtPeerIdentityVerifier verifier;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2025-03-01T10:00:00Z"));
        verifier = new JwtPeerIdentityVerifier(SECRET, clock);
    }

    @Test
    @DisplayName("a valid token resolves to its subject")
    void validToken() {
        String token = verifier.issueToken("alice", Duration.ofHours(1));

        assertThat(verifier.verifyCaller(token)).isEqualTo("alice");
    }

    @Test
    @DisplayName("an expired token is rejected")
    void expiredToken() {
        String token = verifier.issueToken("alice", Duration.ofMinutes(5));
        clock.advance(Duration.ofMinutes(10));

        assertThatThrownBy(() -> verifier.verifyCaller(token))
                .isInstanceOf(UnauthorizedException.class)
                .hasMessage("Invalid or expired token");
    }

    @Test
    @DisplayName("a token signed with another key is rejected")
    void foreignSignature() {
        JwtPeerIdentityVerifier other =
                new JwtPeerIdentityVerifier("another-secret-that-is-also-32-bytes-long!!", clock);
        String token = other.issueToken("mallory", Duration.ofHours(1));

        assertThatThrownBy(() -> verifier.verifyCaller(token)).isInstanceOf(UnauthorizedException.class);
    }

    @Test
    void garbageAndBlankRejected() {
        assertThatThrownBy(() -> verifier.verifyCaller("not-a-jwt")).isInstanceOf(UnauthorizedException.class);
        assertThatThrownBy(() -> verifier.verifyCaller(" ")).isInstanceOf(UnauthorizedException.class);
    }
}
