package com.muzee.auth.api.dto;

import com.muzee.auth.api.validation.MaxUtf8Bytes;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

/**
 * 发送注册验证码请求。
 * <p>
 * 密码在此阶段即完成哈希并随注册会话暂存，验证码校验通过后才真正创建用户。
 */
public record SendCodeRequest(
        @NotBlank(message = "必填项") @Email(message = "请输入有效的邮箱地址") @Size(max = 255, message = "不能超过255个字符") String email,
        @NotBlank(message = "必填项") @Size(min = 8, max = 72, message = "长度需在8-72个字符之间")
        @MaxUtf8Bytes(value = 72, message = "不能超过72个字节") String password
) {
}
