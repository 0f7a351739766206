package com.muzee.auth.config;

import com.muzee.support.TestAuthProperties;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AuthConfigurationTest {

    @Test
    void secretShorterThan32BytesIsRejected() {
        assertThatThrownBy(() -> AuthConfiguration.hmacKey("too-short"))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("32");
        assertThatThrownBy(() -> AuthConfiguration.hmacKey(null))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void secretOf32BytesIsAccepted() {
        assertThat(AuthConfiguration.hmacKey("0123456789abcdef0123456789abcdef").getAlgorithm())
                .isEqualTo("HmacSHA256");
    }

    @Test
    void passwordEncoderUsesConfiguredStrength() {
        AuthProperties properties = TestAuthProperties.create();
        AuthConfiguration configuration = new AuthConfiguration(properties);

        String hash = configuration.passwordEncoder().encode("password123");

        assertThat(hash).startsWith("$2a$04$");
        assertThat(configuration.passwordEncoder().matches("password123", hash)).isTrue();
    }
}
