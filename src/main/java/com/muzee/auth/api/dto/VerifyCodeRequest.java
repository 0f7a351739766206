package com.muzee.auth.api.dto;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;

/**
 * 校验注册验证码请求。
 * <p>
 * `clientId` 为客户端自行生成的设备标识，签发的刷新令牌与之绑定。
 */
public record VerifyCodeRequest(
        @NotBlank(message = "必填项") @Email(message = "请输入有效的邮箱地址") @Size(max = 255, message = "不能超过255个字符") String email,
        @NotBlank(message = "必填项") @Pattern(regexp = "^\\d{6}$", message = "请输入6位数字") String code,
        @NotBlank(message = "必填项") @Size(max = 255, message = "不能超过255个字符") String clientId
) {
}
