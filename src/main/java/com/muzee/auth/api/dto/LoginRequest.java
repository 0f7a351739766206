package com.muzee.auth.api.dto;

import com.muzee.auth.api.validation.MaxUtf8Bytes;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

/**
 * 登录请求。
 */
public record LoginRequest(
        @NotBlank(message = "必填项") @Email(message = "请输入有效的邮箱地址") @Size(max = 255, message = "不能超过255个字符") String email,
        @NotBlank(message = "必填项") @Size(min = 8, max = 72, message = "长度需在8-72个字符之间")
        @MaxUtf8Bytes(value = 72, message = "不能超过72个字节") String password,
        @NotBlank(message = "必填项") @Size(max = 255, message = "不能超过255个字符") String clientId
) {
}
