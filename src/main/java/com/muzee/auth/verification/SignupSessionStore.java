package com.muzee.auth.verification;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.muzee.auth.config.AuthProperties;
import com.muzee.auth.kv.KeyValueStore;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.Optional;

/**
 * 注册会话存储。
 * <p>
 * 键空间：`signup:{email}`，值为 {@link PendingSignup} 的 JSON，TTL 默认 15 分钟。
 * 同一邮箱只保留一个会话，重复写入直接覆盖并重置 TTL。
 * 本层不做邮箱或密码校验。
 */
@Component
@RequiredArgsConstructor
public class SignupSessionStore {

    private final KeyValueStore store;
    private final ObjectMapper objectMapper;
    private final AuthProperties properties;
    private final Clock clock;

    /**
     * 保存（覆盖）注册会话。
     *
     * @param email        标准化后的邮箱。
     * @param passwordHash 密码哈希。
     * @param code         验证码。
     */
    public void save(String email, String passwordHash, String code) {
        PendingSignup session = new PendingSignup(passwordHash, code, clock.instant().getEpochSecond());
        store.set(key(email), write(session), properties.getSignup().getSessionTtl());
    }

    /**
     * 读取注册会话。
     *
     * @param email 标准化后的邮箱。
     * @return 会话；不存在或已过期时为空。
     */
    public Optional<PendingSignup> find(String email) {
        return store.get(key(email)).map(this::read);
    }

    /**
     * 删除注册会话。
     *
     * @param email 标准化后的邮箱。
     */
    public void delete(String email) {
        store.delete(key(email));
    }

    private String write(PendingSignup session) {
        try {
            return objectMapper.writeValueAsString(session);
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Failed to serialize signup session", ex);
        }
    }

    private PendingSignup read(String json) {
        try {
            return objectMapper.readValue(json, PendingSignup.class);
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Corrupted signup session", ex);
        }
    }

    private static String key(String email) {
        return "signup:" + email;
    }
}
