package com.muzee.auth.token;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.muzee.auth.config.AuthProperties;
import com.muzee.auth.kv.KeyValueStore;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.Optional;

/**
 * 刷新令牌存储。
 * <p>
 * 键空间：`refresh_token:{token}`，值为 {@link RefreshTokenRecord} 的 JSON，TTL 默认 30 天。
 * 不维护用户到令牌的索引，同一用户可在多个客户端同时持有有效令牌。
 */
@Component
@RequiredArgsConstructor
public class RefreshTokenStore {

    private final KeyValueStore store;
    private final ObjectMapper objectMapper;
    private final AuthProperties properties;
    private final Clock clock;

    /**
     * 保存刷新令牌记录。
     *
     * @param token    刷新令牌。
     * @param userId   用户 ID。
     * @param clientId 客户端标识。
     */
    public void save(String token, long userId, String clientId) {
        RefreshTokenRecord record = new RefreshTokenRecord(userId, clientId, clock.instant().getEpochSecond());
        store.set(key(token), write(record), properties.getJwt().getRefreshTokenTtl());
    }

    /**
     * 查询刷新令牌记录。
     *
     * @param token 刷新令牌。
     * @return 记录；不存在或已过期时为空。
     */
    public Optional<RefreshTokenRecord> find(String token) {
        return store.get(key(token)).map(this::read);
    }

    /**
     * 删除刷新令牌。
     *
     * @param token 刷新令牌。
     * @return 是否删除了存在的记录。
     */
    public boolean delete(String token) {
        return store.delete(key(token));
    }

    private String write(RefreshTokenRecord record) {
        try {
            return objectMapper.writeValueAsString(record);
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Failed to serialize refresh token", ex);
        }
    }

    private RefreshTokenRecord read(String json) {
        try {
            return objectMapper.readValue(json, RefreshTokenRecord.class);
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Corrupted refresh token record", ex);
        }
    }

    private static String key(String token) {
        return "refresh_token:" + token;
    }
}
