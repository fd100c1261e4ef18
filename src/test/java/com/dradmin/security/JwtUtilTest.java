package com.dradmin.security;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

class JwtUtilTest {

    private static final String SECRET = "test-secret-key-that-is-long-enough-for-hs256";

    private final JwtUtil jwtUtil = new JwtUtil(SECRET, 60_000L);

    @Test
    void tokenCarriesSubjectAndRole() {
        String token = jwtUtil.generateToken("ops@dradmin.local", "SUPPORT");

        assertThat(jwtUtil.extractUsername(token)).isEqualTo("ops@dradmin.local");
        assertThat(jwtUtil.extractRole(token)).isEqualTo("SUPPORT");
        assertThat(jwtUtil.validateToken(token, "OPS@dradmin.local")).isTrue();
    }

    @Test
    void tokenForAnotherUserIsInvalid() {
        String token = jwtUtil.generateToken("ops@dradmin.local", "ADMIN");

        assertThat(jwtUtil.validateToken(token, "someone@dradmin.local")).isFalse();
    }

    @Test
    void expiredTokenIsInvalid() {
        JwtUtil shortLived = new JwtUtil(SECRET, -1_000L);
        String token = shortLived.generateToken("ops@dradmin.local", "ADMIN");

        assertThat(shortLived.validateToken(token, "ops@dradmin.local")).isFalse();
    }

    @Test
    void tokenSignedWithOtherKeyIsInvalid() {
        JwtUtil other = new JwtUtil("another-secret-key-that-is-also-long-enough", 60_000L);
        String token = other.generateToken("ops@dradmin.local", "ADMIN");

        assertThat(jwtUtil.validateToken(token, "ops@dradmin.local")).isFalse();
        assertThat(jwtUtil.validateToken("not-a-jwt", "ops@dradmin.local")).isFalse();
    }

    @Test
    void shortSecretIsRejected() {
        assertThatThrownBy(() -> new JwtUtil("too-short", 60_000L)).isInstanceOf(IllegalArgumentException.class);
    }
}
