package com.muzee.auth.kv;

import java.time.Duration;
import java.util.Optional;

/**
 * 键值存储接口。
 * <p>
 * 认证模块的全部共享状态（注册会话、刷新令牌、限流计数）都经由该接口读写，
 * 实现可使用 Redis 或其它支持 TTL 与原子自增的存储。
 * 存储层的连接异常直接向上抛出，本层不做重试。
 */
public interface KeyValueStore {

    /**
     * 读取键值。
     *
     * @param key 键名。
     * @return 值；键不存在或已过期时为空。
     */
    Optional<String> get(String key);

    /**
     * 写入键值并设置过期时间，覆盖已有值。
     *
     * @param key   键名。
     * @param value 值。
     * @param ttl   生存时间。
     */
    void set(String key, String value, Duration ttl);

    /**
     * 删除键。
     *
     * @param key 键名。
     * @return 是否确实删除了一个存在的键。
     */
    boolean delete(String key);

    /**
     * 原子自增计数，并仅在本次自增后计数为 1 时设置过期时间。
     *
     * @param key 键名。
     * @param ttl 窗口长度。
     * @return 自增后的计数。
     */
    long incrementAndExpire(String key, Duration ttl);
}
