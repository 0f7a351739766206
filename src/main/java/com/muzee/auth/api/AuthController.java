package com.muzee.auth.api;

import com.muzee.auth.api.dto.*;
import com.muzee.auth.service.AuthService;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

/**
 * 认证 API 控制器。
 * <p>
 * 暴露 REST 接口：注册验证码发送/重发/校验、登录、刷新令牌、登出。
 * 请求体在边界处做 Bean Validation，业务规则由 {@link AuthService} 负责。
 * 签发令牌的接口同时写入 HttpOnly Cookie（见 {@link AuthCookies}），浏览器客户端可不在请求体中携带刷新令牌。
 */
@RestController
@RequestMapping("/v1/auth")
@RequiredArgsConstructor
@Validated
public class AuthController {

    private final AuthService authService;
    private final AuthCookies authCookies;

    /**
     * 发送注册验证码。
     * <p>
     * 暂存密码哈希与验证码，验证码通过邮件发送，15 分钟内有效。
     *
     * @param request 请求体，包含：email、password（8~72 位）。
     * @return 响应体，包含提示、标准化邮箱与有效秒数。
     */
    @PostMapping("/signup/send-code")
    public SendCodeResponse sendCode(@Valid @RequestBody SendCodeRequest request) {
        return authService.sendCode(request);
    }

    /**
     * 重新发送注册验证码，旧验证码随即失效。
     *
     * @param request 请求体，包含：email。
     * @return 响应体，包含提示、标准化邮箱与有效秒数。
     */
    @PostMapping("/signup/resend-code")
    public SendCodeResponse resendCode(@Valid @RequestBody ResendCodeRequest request) {
        return authService.resendCode(request);
    }

    /**
     * 校验验证码，创建账号并自动登录。
     *
     * @param request  请求体，包含：email、code（6 位数字）、client_id。
     * @param response 用于写入令牌 Cookie。
     * @return HTTP 201，认证响应包含令牌对与用户概要。
     */
    @PostMapping("/signup/verify-code")
    public ResponseEntity<AuthResponse> verifyCode(@Valid @RequestBody VerifyCodeRequest request,
                                                   HttpServletResponse response) {
        AuthResponse body = authService.verifyCode(request);
        authCookies.writeTokens(response, body.accessToken(), body.refreshToken());
        return ResponseEntity.status(HttpStatus.CREATED).body(body);
    }

    /**
     * 邮箱密码登录并获取令牌对。
     *
     * @param request  请求体，包含：email、password、client_id。
     * @param response 用于写入令牌 Cookie。
     * @return 认证响应，包含令牌对与用户概要。
     */
    @PostMapping("/login")
    public AuthResponse login(@Valid @RequestBody LoginRequest request, HttpServletResponse response) {
        AuthResponse body = authService.login(request);
        authCookies.writeTokens(response, body.accessToken(), body.refreshToken());
        return body;
    }

    /**
     * 使用刷新令牌换取新的令牌对，旧刷新令牌作废。
     *
     * @param request     请求体，包含：refresh_token（可省略，回退到 Cookie）、client_id。
     * @param httpRequest 用于读取刷新令牌 Cookie。
     * @param response    用于写入新的令牌 Cookie。
     * @return 新的令牌响应。
     */
    @PostMapping("/refresh")
    public TokenResponse refresh(@Valid @RequestBody RefreshTokenRequest request,
                                 HttpServletRequest httpRequest,
                                 HttpServletResponse response) {
        String refreshToken = authCookies.resolveRefreshToken(httpRequest, request.refreshToken());
        TokenResponse body = authService.refresh(request.withRefreshToken(refreshToken));
        authCookies.writeTokens(response, body.accessToken(), body.refreshToken());
        return body;
    }

    /**
     * 登出：删除刷新令牌并清除令牌 Cookie。
     *
     * @param request     请求体，包含：refresh_token；请求体或字段缺省时回退到 Cookie。
     * @param httpRequest 用于读取刷新令牌 Cookie。
     * @param response    用于清除令牌 Cookie。
     * @return 提示信息。
     */
    @PostMapping("/logout")
    public MessageResponse logout(@RequestBody(required = false) LogoutRequest request,
                                  HttpServletRequest httpRequest,
                                  HttpServletResponse response) {
        String bodyToken = request == null ? null : request.refreshToken();
        String refreshToken = authCookies.resolveRefreshToken(httpRequest, bodyToken);
        MessageResponse body = authService.logout(new LogoutRequest(refreshToken));
        authCookies.clearTokens(response);
        return body;
    }
}
