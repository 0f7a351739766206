package com.muzee.auth.api.dto;

/**
 * 认证响应。
 * <p>
 * 注册验证成功或登录成功后返回：令牌对、令牌类型、访问令牌有效秒数与用户概要。
 */
public record AuthResponse(
        String message,
        String accessToken,
        String refreshToken,
        String tokenType,
        long expiresIn,
        AuthUserResponse user
) {
}
