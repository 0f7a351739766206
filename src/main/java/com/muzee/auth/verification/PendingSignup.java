package com.muzee.auth.verification;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * 待验证的注册会话。
 * <p>
 * 以 JSON 形式保存在 `signup:{email}`，过期由存储 TTL 控制，`createdAt` 仅作记录。
 *
 * @param passwordHash 密码哈希（BCrypt）。
 * @param code         当前有效的验证码。
 * @param createdAt    创建时间（epoch 秒）。
 */
public record PendingSignup(
        @JsonProperty("password_hash") String passwordHash,
        @JsonProperty("code") String code,
        @JsonProperty("created_at") long createdAt
) {
}
