package com.muzee.auth.verification;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.muzee.support.InMemoryKeyValueStore;
import com.muzee.support.MutableClock;
import com.muzee.support.TestAuthProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SignupSessionStoreTest {

    private MutableClock clock;
    private InMemoryKeyValueStore kv;
    private SignupSessionStore store;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2025-01-01T00:00:00Z"));
        kv = new InMemoryKeyValueStore(clock);
        store = new SignupSessionStore(kv, new ObjectMapper(), TestAuthProperties.create(), clock);
    }

    @Test
    void savedSessionIsReadable() {
        store.save("a@b.com", "$2a$hash", "123456");

        PendingSignup session = store.find("a@b.com").orElseThrow();
        assertThat(session.passwordHash()).isEqualTo("$2a$hash");
        assertThat(session.code()).isEqualTo("123456");
        assertThat(session.createdAt()).isEqualTo(clock.instant().getEpochSecond());
        assertThat(kv.get("signup:a@b.com").orElseThrow())
                .contains("\"password_hash\"", "\"code\"", "\"created_at\"");
    }

    @Test
    void saveOverwritesPreviousSession() {
        store.save("a@b.com", "hash", "111111");
        store.save("a@b.com", "hash", "222222");

        assertThat(store.find("a@b.com")).get().extracting(PendingSignup::code).isEqualTo("222222");
    }

    @Test
    void sessionExpiresAfterFifteenMinutes() {
        store.save("a@b.com", "hash", "123456");

        clock.advance(Duration.ofMinutes(15));

        assertThat(store.find("a@b.com")).isEmpty();
    }

    @Test
    void deleteRemovesSession() {
        store.save("a@b.com", "hash", "123456");

        store.delete("a@b.com");

        assertThat(store.find("a@b.com")).isEmpty();
    }

    @Test
    void corruptedValueIsAnError() {
        kv.set("signup:a@b.com", "not-json", Duration.ofMinutes(1));

        assertThatThrownBy(() -> store.find("a@b.com")).isInstanceOf(IllegalStateException.class);
    }
}
