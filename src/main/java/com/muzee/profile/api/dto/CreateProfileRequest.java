package com.muzee.profile.api.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

/**
 * 创建个人资料请求。
 */
public record CreateProfileRequest(
        @NotBlank(message = "必填项") @Size(max = 100, message = "不能超过100个字符") String name,
        @NotBlank(message = "必填项") @Size(max = 50, message = "不能超过50个字符") String username,
        @Size(max = 255, message = "不能超过255个字符") String iconPath
) {
}
