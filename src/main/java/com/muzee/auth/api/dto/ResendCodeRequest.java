package com.muzee.auth.api.dto;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

/**
 * 重发注册验证码请求。
 */
public record ResendCodeRequest(
        @NotBlank(message = "必填项") @Email(message = "请输入有效的邮箱地址") @Size(max = 255, message = "不能超过255个字符") String email
) {
}
