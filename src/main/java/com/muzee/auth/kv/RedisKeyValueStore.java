package com.muzee.auth.kv;

import org.springframework.data.redis.RedisSystemException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Optional;

/**
 * 基于 Redis 的键值存储实现。
 * <p>
 * 字符串值使用 SET EX 写入；计数使用 INCR，首次自增（计数为 1）时追加 EXPIRE，
 * 因此窗口从第一次请求开始固定计时。
 */
@Component
public class RedisKeyValueStore implements KeyValueStore {

    private final StringRedisTemplate redisTemplate;

    public RedisKeyValueStore(StringRedisTemplate redisTemplate) {
        this.redisTemplate = redisTemplate;
    }

    @Override
    public Optional<String> get(String key) {
        return Optional.ofNullable(redisTemplate.opsForValue().get(key));
    }

    @Override
    public void set(String key, String value, Duration ttl) {
        redisTemplate.opsForValue().set(key, value, ttl);
    }

    @Override
    public boolean delete(String key) {
        return Boolean.TRUE.equals(redisTemplate.delete(key));
    }

    /**
     * 自增计数并在首次自增时设置 TTL。
     *
     * @param key 键名。
     * @param ttl 窗口长度。
     * @return 自增后的计数。
     * @throws RedisSystemException 当 INCR 未返回结果（如在管道/事务中调用）时抛出。
     */
    @Override
    public long incrementAndExpire(String key, Duration ttl) {
        Long count = redisTemplate.opsForValue().increment(key);
        if (count == null) {
            throw new RedisSystemException("INCR returned no result for " + key, null);
        }
        if (count == 1L) {
            redisTemplate.expire(key, ttl);
        }
        return count;
    }
}
