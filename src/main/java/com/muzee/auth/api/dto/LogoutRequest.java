package com.muzee.auth.api.dto;

/**
 * 登出请求。
 * <p>
 * `refreshToken` 可省略，此时从 `refresh_token` Cookie 读取。
 * 缺少令牌时返回 `missing_refresh_token`，而非通用的校验错误，因此此处不加约束注解。
 */
public record LogoutRequest(String refreshToken) {
}
