package com.muzee.user.api.dto;

import java.time.Instant;

/**
 * 当前用户信息响应。
 */
public record UserResponse(
        Long id,
        String email,
        Instant createdAt,
        Instant updatedAt
) {
}
