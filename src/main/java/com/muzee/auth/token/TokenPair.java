package com.muzee.auth.token;

/**
 * 访问令牌与刷新令牌的组合。
 * <p>
 * 字段说明：
 * - accessToken：访问令牌（HS256 JWT，Bearer 使用）；
 * - refreshToken：刷新令牌（随机 UUID，含义仅由存储记录决定）。
 */
public record TokenPair(
        String accessToken,
        String refreshToken
) {
}
