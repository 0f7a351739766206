package com.muzee.auth.ratelimit;

import lombok.Getter;

/**
 * 受限流保护的操作，键名片段用于拼接 `rate_limit:{key}:{identity}`。
 */
@Getter
public enum RateLimitOperation {
    SEND_CODE("send_code"),
    LOGIN("login");

    private final String key;

    RateLimitOperation(String key) {
        this.key = key;
    }
}
