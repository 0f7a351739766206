package com.muzee.auth.api.dto;

/**
 * 令牌刷新响应。
 */
public record TokenResponse(
        String accessToken,
        String refreshToken,
        String tokenType,
        long expiresIn
) {
}
