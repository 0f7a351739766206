package com.muzee.auth.api;

import com.muzee.auth.config.AuthProperties;
import jakarta.servlet.http.Cookie;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseCookie;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import org.springframework.web.util.WebUtils;

import java.time.Duration;

/**
 * 令牌 Cookie 读写。
 * <p>
 * 浏览器客户端通过 HttpOnly Cookie 持有令牌：
 * - `access_token`：路径 `/`，有效期与访问令牌一致；
 * - `refresh_token`：路径限定为认证接口，有效期与刷新令牌一致。
 * 请求体中的刷新令牌优先，缺省时回退到 Cookie。
 */
@Component
@RequiredArgsConstructor
public class AuthCookies {

    public static final String ACCESS_TOKEN_COOKIE = "access_token";
    public static final String REFRESH_TOKEN_COOKIE = "refresh_token";

    private final AuthProperties properties;

    /**
     * 写入访问令牌与刷新令牌 Cookie。
     *
     * @param response     HTTP 响应。
     * @param accessToken  访问令牌。
     * @param refreshToken 刷新令牌。
     */
    public void writeTokens(HttpServletResponse response, String accessToken, String refreshToken) {
        AuthProperties.Jwt jwt = properties.getJwt();
        addCookie(response, ACCESS_TOKEN_COOKIE, accessToken, "/", jwt.getAccessTokenTtl());
        addCookie(response, REFRESH_TOKEN_COOKIE, refreshToken,
                properties.getCookie().getRefreshTokenPath(), jwt.getRefreshTokenTtl());
    }

    /**
     * 清除令牌 Cookie（Max-Age=0）。
     *
     * @param response HTTP 响应。
     */
    public void clearTokens(HttpServletResponse response) {
        addCookie(response, ACCESS_TOKEN_COOKIE, "", "/", Duration.ZERO);
        addCookie(response, REFRESH_TOKEN_COOKIE, "", properties.getCookie().getRefreshTokenPath(), Duration.ZERO);
    }

    /**
     * 解析刷新令牌：请求体有值时使用请求体，否则读取 Cookie。
     *
     * @param request   HTTP 请求。
     * @param bodyValue 请求体中的刷新令牌，可为空。
     * @return 刷新令牌；两处都没有时返回 null。
     */
    public String resolveRefreshToken(HttpServletRequest request, String bodyValue) {
        if (StringUtils.hasText(bodyValue)) {
            return bodyValue;
        }
        Cookie cookie = WebUtils.getCookie(request, REFRESH_TOKEN_COOKIE);
        return cookie != null && StringUtils.hasText(cookie.getValue()) ? cookie.getValue() : null;
    }

    private void addCookie(HttpServletResponse response, String name, String value, String path, Duration maxAge) {
        ResponseCookie cookie = ResponseCookie.from(name, value)
                .httpOnly(true)
                .secure(properties.getCookie().isSecure())
                .sameSite(properties.getCookie().getSameSite())
                .path(path)
                .maxAge(maxAge)
                .build();
        response.addHeader(HttpHeaders.SET_COOKIE, cookie.toString());
    }
}
