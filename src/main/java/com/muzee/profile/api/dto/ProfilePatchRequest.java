package com.muzee.profile.api.dto;

import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;

/**
 * 资料局部更新请求（PATCH）。
 * <p>
 * 客户端仅需提交欲更新的字段；未提交的字段保持不变。发送相同值的重复请求为幂等操作。
 * 提交的 name/username 必须包含非空白字符。
 */
public record ProfilePatchRequest(
        @Size(min = 1, max = 100, message = "长度需在 1-100 之间")
        @Pattern(regexp = "(?s).*\\S.*", message = "不能为空白") String name,
        @Size(min = 1, max = 50, message = "长度需在 1-50 之间")
        @Pattern(regexp = "(?s).*\\S.*", message = "不能为空白") String username,
        @Size(max = 255, message = "不能超过255个字符") String iconPath
) {

    public boolean isEmpty() {
        return name == null && username == null && iconPath == null;
    }
}
