package com.muzee.auth.ratelimit;

import com.muzee.auth.config.AuthProperties;
import com.muzee.auth.exception.BusinessException;
import com.muzee.auth.exception.ErrorCode;
import com.muzee.auth.kv.KeyValueStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * 固定窗口限流器。
 * <p>
 * 每次请求对 `rate_limit:{operation}:{identity}` 原子自增，首次自增时设置窗口 TTL；
 * 计数超过上限即拒绝。窗口不滑动，跨窗口边界的突发最多可放行两倍上限。
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RateLimiter {

    private final KeyValueStore store;
    private final AuthProperties properties;

    /**
     * 记录一次尝试并校验是否超限。
     *
     * @param operation 操作类型。
     * @param identity  限流主体（标准化后的邮箱）。
     * @throws BusinessException 当窗口内次数超过上限时抛出 {@link ErrorCode#RATE_LIMIT_EXCEEDED}。
     */
    public void check(RateLimitOperation operation, String identity) {
        AuthProperties.Rule rule = ruleOf(operation);
        long count = store.incrementAndExpire(key(operation, identity), rule.getWindow());
        if (count > rule.getLimit()) {
            log.info("Rate limit exceeded operation={} identity={} count={}", operation.getKey(), identity, count);
            throw new BusinessException(ErrorCode.RATE_LIMIT_EXCEEDED);
        }
    }

    private AuthProperties.Rule ruleOf(RateLimitOperation operation) {
        return switch (operation) {
            case SEND_CODE -> properties.getRateLimit().getSendCode();
            case LOGIN -> properties.getRateLimit().getLogin();
        };
    }

    static String key(RateLimitOperation operation, String identity) {
        return "rate_limit:%s:%s".formatted(operation.getKey(), identity);
    }
}
