package com.muzee.auth.api.dto;

/**
 * 认证用户概要。
 */
public record AuthUserResponse(
        Long id,
        String email
) {
}
