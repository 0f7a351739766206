package com.muzee.auth.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.muzee.auth.api.dto.ErrorResponse;
import com.muzee.auth.exception.ErrorCode;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.security.config.Customizer;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.annotation.web.configuration.EnableWebSecurity;
import org.springframework.security.config.annotation.web.configurers.AbstractHttpConfigurer;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.oauth2.server.resource.InvalidBearerTokenException;
import org.springframework.security.oauth2.server.resource.web.BearerTokenResolver;
import org.springframework.security.web.AuthenticationEntryPoint;
import org.springframework.security.web.SecurityFilterChain;
import org.springframework.security.web.util.matcher.OrRequestMatcher;
import org.springframework.security.web.util.matcher.RequestMatcher;
import org.springframework.web.cors.CorsConfiguration;
import org.springframework.web.cors.CorsConfigurationSource;
import org.springframework.web.cors.UrlBasedCorsConfigurationSource;

import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.springframework.security.web.util.matcher.AntPathRequestMatcher.antMatcher;

/**
 * Spring Security 安全配置。
 * <p>
 * - 关闭 CSRF（纯 API，使用 JWT 无会话）；
 * - 启用 CORS，当前允许所有来源；
 * - 无状态会话；
 * - 公开认证接口、健康检查与用户名可用性查询，其余接口需携带访问令牌（Bearer 头或 `access_token` Cookie）；
 * - 公开接口不解析访问令牌，过期令牌不影响刷新与登录；
 * - 未认证或令牌无效时返回 JSON 格式的 401。
 */
@Configuration
@EnableWebSecurity
@RequiredArgsConstructor
public class SecurityConfig {

    private final ObjectMapper objectMapper;

    /**
     * 配置 Spring Security 过滤链。
     *
     * @param http Spring 的 {@link HttpSecurity} 构建器。
     * @return 构建完成的 {@link SecurityFilterChain}。
     * @throws Exception 构建过滤链过程中可能抛出的异常。
     */
    @Bean
    public SecurityFilterChain securityFilterChain(HttpSecurity http) throws Exception {
        AuthenticationEntryPoint entryPoint = jsonAuthenticationEntryPoint();
        RequestMatcher publicEndpoints = publicEndpoints();
        http
                .csrf(AbstractHttpConfigurer::disable)
                .cors(Customizer.withDefaults())
                .sessionManagement(session -> session.sessionCreationPolicy(SessionCreationPolicy.STATELESS))
                .authorizeHttpRequests(auth -> auth
                        .requestMatchers(publicEndpoints).permitAll()
                        .anyRequest().authenticated()
                )
                .exceptionHandling(ex -> ex.authenticationEntryPoint(entryPoint))
                .oauth2ResourceServer(oauth -> oauth
                        .bearerTokenResolver(bearerTokenResolver())
                        .jwt(Customizer.withDefaults())
                        .authenticationEntryPoint(entryPoint));
        return http.build();
    }

    /**
     * 访问令牌解析器：公开接口跳过解析，其余接口支持 Bearer 头与 `access_token` Cookie。
     *
     * @return {@link BearerTokenResolver}。
     */
    @Bean
    public BearerTokenResolver bearerTokenResolver() {
        return new AuthBearerTokenResolver(publicEndpoints());
    }

    /**
     * 无需登录的接口。
     */
    static RequestMatcher publicEndpoints() {
        return new OrRequestMatcher(
                antMatcher("/health"),
                antMatcher("/actuator/health"),
                antMatcher(HttpMethod.POST, "/v1/auth/**"),
                antMatcher(HttpMethod.GET, "/v1/user-profiles/check-username")
        );
    }

    /**
     * 未认证入口：令牌缺失返回 `unauthorized`，令牌无效或过期返回 `invalid_token`。
     *
     * @return JSON 响应的 {@link AuthenticationEntryPoint}。
     */
    @Bean
    public AuthenticationEntryPoint jsonAuthenticationEntryPoint() {
        return (request, response, authException) -> {
            ErrorCode errorCode = authException instanceof InvalidBearerTokenException
                    ? ErrorCode.INVALID_TOKEN
                    : ErrorCode.UNAUTHORIZED;
            response.setStatus(HttpServletResponse.SC_UNAUTHORIZED);
            response.setContentType(MediaType.APPLICATION_JSON_VALUE);
            response.setCharacterEncoding(StandardCharsets.UTF_8.name());
            objectMapper.writeValue(response.getOutputStream(),
                    ErrorResponse.of(errorCode.getCode(), errorCode.getDefaultMessage()));
        };
    }

    /**
     * 定义并提供 CORS 配置源。
     *
     * @return {@link CorsConfigurationSource}，用于为所有路径注册 CORS 规则。
     */
    @Bean
    public CorsConfigurationSource corsConfigurationSource() {
        CorsConfiguration configuration = new CorsConfiguration();
        configuration.setAllowedOrigins(List.of("*"));
        configuration.setAllowedMethods(List.of("GET", "POST", "PATCH", "OPTIONS"));
        configuration.setAllowedHeaders(List.of("Authorization", "Content-Type", "X-Requested-With"));
        configuration.setAllowCredentials(false);
        UrlBasedCorsConfigurationSource source = new UrlBasedCorsConfigurationSource();
        source.registerCorsConfiguration("/**", configuration);
        return source;
    }
}
