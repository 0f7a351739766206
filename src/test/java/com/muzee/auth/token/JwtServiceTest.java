package com.muzee.auth.token;

import com.muzee.auth.config.AuthConfiguration;
import com.muzee.auth.config.AuthProperties;
import com.muzee.support.MutableClock;
import com.muzee.support.TestAuthProperties;
import com.muzee.user.domain.User;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.Base64;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

class JwtServiceTest {

    private MutableClock clock;
    private JwtService jwtService;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2025-01-01T00:00:00Z"));
        jwtService = newService(TestAuthProperties.create(), clock);
    }

    private static JwtService newService(AuthProperties properties, MutableClock clock) {
        AuthConfiguration configuration = new AuthConfiguration(properties);
        return new JwtService(configuration.jwtEncoder(), configuration.jwtDecoder(clock), properties, clock);
    }

    @Test
    void issuedAccessTokenValidatesWithClaims() {
        User user = User.builder().id(7L).email("a@b.com").build();

        TokenPair pair = jwtService.issueTokenPair(user);

        AccessTokenClaims claims = jwtService.validateAccessToken(pair.accessToken()).orElseThrow();
        assertThat(claims.userId()).isEqualTo(7L);
        assertThat(claims.email()).isEqualTo("a@b.com");
        assertThat(claims.issuedAt()).isEqualTo(clock.instant());
        assertThat(claims.expiresAt()).isEqualTo(clock.instant().plus(Duration.ofMinutes(15)));
        assertThat(pair.refreshToken()).isNotBlank();
    }

    @Test
    void headerDeclaresHs256() {
        String token = jwtService.issueAccessToken(1L, "a@b.com");

        String header = new String(Base64.getUrlDecoder().decode(token.substring(0, token.indexOf('.'))));
        assertThat(header).contains("\"alg\":\"HS256\"");
    }

    @Test
    void refreshTokenIsRandomUuid() {
        String first = jwtService.issueRefreshToken();
        String second = jwtService.issueRefreshToken();

        assertThat(UUID.fromString(first).toString()).isEqualTo(first);
        assertThat(first).isNotEqualTo(second);
    }

    @Test
    void expiredTokenIsRejected() {
        String token = jwtService.issueAccessToken(1L, "a@b.com");

        clock.advance(Duration.ofMinutes(15).plusSeconds(1));

        assertThat(jwtService.validateAccessToken(token)).isEmpty();
    }

    @Test
    void tamperedSignatureIsRejected() {
        String token = jwtService.issueAccessToken(1L, "a@b.com");
        int signatureStart = token.lastIndexOf('.') + 1;
        char first = token.charAt(signatureStart);
        String tampered = token.substring(0, signatureStart) + (first == 'A' ? 'B' : 'A') + token.substring(signatureStart + 1);

        assertThat(jwtService.validateAccessToken(tampered)).isEmpty();
    }

    @Test
    void tokenSignedWithAnotherSecretIsRejected() {
        AuthProperties other = TestAuthProperties.create();
        other.getJwt().setSecret("another-secret-for-muzee-auth-0123456789abcdef");
        String foreign = newService(other, clock).issueAccessToken(1L, "a@b.com");

        assertThat(jwtService.validateAccessToken(foreign)).isEmpty();
    }

    @Test
    void garbageIsRejected() {
        assertThat(jwtService.validateAccessToken("not-a-jwt")).isEmpty();
        assertThat(jwtService.validateAccessToken("")).isEmpty();
        assertThat(jwtService.validateAccessToken(null)).isEmpty();
    }
}
