package com.muzee.auth.api.dto;

/**
 * 发送/重发验证码响应。
 * <p>
 * 返回标准化后的邮箱与注册会话有效期（秒）。
 */
public record SendCodeResponse(
        String message,
        String email,
        long expiresIn
) {
}
