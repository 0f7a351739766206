package com.muzee.user.api;

import com.muzee.auth.exception.BusinessException;
import com.muzee.auth.exception.ErrorCode;
import com.muzee.auth.token.JwtService;
import com.muzee.user.api.dto.UserResponse;
import com.muzee.user.domain.User;
import com.muzee.user.service.UserService;
import lombok.RequiredArgsConstructor;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1/users")
@RequiredArgsConstructor
public class UserController {

    private final UserService userService;
    private final JwtService jwtService;

    /**
     * 查询当前登录用户信息。
     * <p>
     * 基于 Spring Security 注入的 `Jwt` 令牌提取用户 ID；令牌签发后用户被删除时返回 401。
     *
     * @param jwt 当前请求绑定的 JWT 令牌（来自 `Authorization: Bearer`）。
     * @return 用户信息响应。
     */
    @GetMapping("/me")
    public UserResponse me(@AuthenticationPrincipal Jwt jwt) {
        long userId = jwtService.extractUserId(jwt);
        User user = userService.findById(userId)
                .orElseThrow(() -> new BusinessException(ErrorCode.USER_NOT_FOUND));
        return new UserResponse(user.getId(), user.getEmail(), user.getCreatedAt(), user.getUpdatedAt());
    }
}
