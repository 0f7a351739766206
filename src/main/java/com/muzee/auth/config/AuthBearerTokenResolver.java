package com.muzee.auth.config;

import com.muzee.auth.api.AuthCookies;
import jakarta.servlet.http.Cookie;
import jakarta.servlet.http.HttpServletRequest;
import org.springframework.security.oauth2.server.resource.web.BearerTokenResolver;
import org.springframework.security.oauth2.server.resource.web.DefaultBearerTokenResolver;
import org.springframework.security.web.util.matcher.RequestMatcher;
import org.springframework.util.StringUtils;
import org.springframework.web.util.WebUtils;

/**
 * 访问令牌解析器。
 * <p>
 * - 公开接口不解析令牌，携带过期的 `Authorization` 头也不会被拦截；
 * - 其余接口优先读取 `Authorization: Bearer`，缺省时读取 `access_token` Cookie。
 */
public class AuthBearerTokenResolver implements BearerTokenResolver {

    private final BearerTokenResolver headerResolver = new DefaultBearerTokenResolver();
    private final RequestMatcher publicEndpoints;

    public AuthBearerTokenResolver(RequestMatcher publicEndpoints) {
        this.publicEndpoints = publicEndpoints;
    }

    @Override
    public String resolve(HttpServletRequest request) {
        if (publicEndpoints.matches(request)) {
            return null;
        }
        String token = headerResolver.resolve(request);
        if (token != null) {
            return token;
        }
        Cookie cookie = WebUtils.getCookie(request, AuthCookies.ACCESS_TOKEN_COOKIE);
        return cookie != null && StringUtils.hasText(cookie.getValue()) ? cookie.getValue() : null;
    }
}
