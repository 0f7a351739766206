package com.muzee.auth.token;

import java.time.Instant;

/**
 * 访问令牌中解析出的声明。
 */
public record AccessTokenClaims(
        long userId,
        String email,
        Instant issuedAt,
        Instant expiresAt
) {
}
