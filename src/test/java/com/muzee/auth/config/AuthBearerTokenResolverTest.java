package com.muzee.auth.config;

import com.muzee.auth.api.AuthCookies;
import jakarta.servlet.http.Cookie;
import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.security.oauth2.server.resource.InvalidBearerTokenException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AuthBearerTokenResolverTest {

    private final AuthBearerTokenResolver resolver = new AuthBearerTokenResolver(SecurityConfig.publicEndpoints());

    private static MockHttpServletRequest request(String method, String path) {
        MockHttpServletRequest request = new MockHttpServletRequest(method, path);
        request.setServletPath(path);
        return request;
    }

    @Test
    void publicAuthRoutesIgnoreAuthorizationHeader() {
        MockHttpServletRequest request = request("POST", "/v1/auth/refresh");
        request.addHeader("Authorization", "Bearer stale");

        assertThat(resolver.resolve(request)).isNull();
    }

    @Test
    void usernameCheckIgnoresAccessCookie() {
        MockHttpServletRequest request = request("GET", "/v1/user-profiles/check-username");
        request.setCookies(new Cookie(AuthCookies.ACCESS_TOKEN_COOKIE, "stale"));

        assertThat(resolver.resolve(request)).isNull();
    }

    @Test
    void protectedRoutePrefersHeaderOverCookie() {
        MockHttpServletRequest request = request("GET", "/v1/users/me");
        request.addHeader("Authorization", "Bearer from-header");
        request.setCookies(new Cookie(AuthCookies.ACCESS_TOKEN_COOKIE, "from-cookie"));

        assertThat(resolver.resolve(request)).isEqualTo("from-header");
    }

    @Test
    void protectedRouteFallsBackToAccessCookie() {
        MockHttpServletRequest request = request("GET", "/v1/me/profile");
        request.setCookies(new Cookie(AuthCookies.ACCESS_TOKEN_COOKIE, "from-cookie"));

        assertThat(resolver.resolve(request)).isEqualTo("from-cookie");
    }

    @Test
    void protectedRouteWithoutTokenResolvesNull() {
        MockHttpServletRequest request = request("GET", "/v1/users/me");
        request.setCookies(new Cookie(AuthCookies.ACCESS_TOKEN_COOKIE, ""));

        assertThat(resolver.resolve(request)).isNull();
    }

    @Test
    void malformedHeaderOnProtectedRouteIsRejected() {
        MockHttpServletRequest request = request("GET", "/v1/users/me");
        request.addHeader("Authorization", "Bearer not a token");

        assertThatThrownBy(() -> resolver.resolve(request)).isInstanceOf(InvalidBearerTokenException.class);
    }
}
