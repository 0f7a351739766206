package com.muzee.auth.api.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

/**
 * 刷新令牌请求。
 * <p>
 * `refreshToken` 可省略，此时从 `refresh_token` Cookie 读取；两处都缺失时返回 `missing_refresh_token`。
 * `clientId` 必须与签发时一致，否则旧令牌被视为泄露并立即作废。
 */
public record RefreshTokenRequest(
        String refreshToken,
        @NotBlank(message = "必填项") @Size(max = 255, message = "不能超过255个字符") String clientId
) {

    public RefreshTokenRequest withRefreshToken(String token) {
        return new RefreshTokenRequest(token, clientId);
    }
}
