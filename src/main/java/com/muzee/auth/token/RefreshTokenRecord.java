package com.muzee.auth.token;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * 刷新令牌记录。
 * <p>
 * 以 JSON 形式保存在 `refresh_token:{token}`，令牌本身不携带任何含义。
 *
 * @param userId    所属用户 ID。
 * @param clientId  签发时客户端提供的设备/客户端标识。
 * @param createdAt 创建时间（epoch 秒）。
 */
public record RefreshTokenRecord(
        @JsonProperty("user_id") long userId,
        @JsonProperty("client_id") String clientId,
        @JsonProperty("created_at") long createdAt
) {
}
