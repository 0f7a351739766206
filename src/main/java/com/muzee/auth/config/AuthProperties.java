package com.muzee.auth.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * 认证相关配置属性，绑定前缀 {@code muzee.auth.*}。
 *
 * <p>包含以下分组：</p>
 * - Jwt：令牌签发与验证配置；
 * - Signup：注册会话与验证码配置；
 * - RateLimit：发送验证码与登录的固定窗口限流；
 * - Password：密码加密强度配置；
 * - Cookie：令牌 Cookie 的安全属性。
 */
@Data
@ConfigurationProperties(prefix = "muzee.auth")
public class AuthProperties {

    /** JWT 配置项。 */
    private final Jwt jwt = new Jwt();
    /** 注册会话配置项。 */
    private final Signup signup = new Signup();
    /** 限流配置项。 */
    private final RateLimit rateLimit = new RateLimit();
    /** 密码策略配置项。 */
    private final Password password = new Password();
    /** 令牌 Cookie 配置项。 */
    private final Cookie cookie = new Cookie();

    @Data
    public static class Jwt {
        /** HS256 签名密钥，至少 32 字节。 */
        private String secret;
        /** JWT 签发者标识（iss），为空时不写入。 */
        private String issuer = "muzee";
        /** 访问令牌有效期（TTL）。 */
        private Duration accessTokenTtl = Duration.ofMinutes(15);
        /** 刷新令牌有效期（TTL）。 */
        private Duration refreshTokenTtl = Duration.ofDays(30);
    }

    /**
     * 注册会话配置：验证码位数与待验证会话有效期。
     */
    @Data
    public static class Signup {
        /** 验证码位数。 */
        private int codeLength = 6;
        /** 待验证注册会话的有效期。 */
        private Duration sessionTtl = Duration.ofMinutes(15);
    }

    /**
     * 固定窗口限流配置。窗口从首次请求开始计时，不滑动。
     */
    @Data
    public static class RateLimit {
        /** 发送/重发验证码：每个邮箱的窗口与上限。 */
        private final Rule sendCode = new Rule(3, Duration.ofMinutes(5));
        /** 登录：每个邮箱的窗口与上限。 */
        private final Rule login = new Rule(5, Duration.ofMinutes(15));
    }

    @Data
    public static class Rule {
        /** 窗口内允许的最大次数。 */
        private int limit;
        /** 窗口长度。 */
        private Duration window;

        public Rule() {
        }

        public Rule(int limit, Duration window) {
            this.limit = limit;
            this.window = window;
        }
    }

    /** 密码策略配置。 */
    @Data
    public static class Password {
        /** 密码哈希强度（BCrypt cost）。 */
        private int bcryptStrength = 10;
    }

    /**
     * 令牌 Cookie 配置。Cookie 一律 HttpOnly，本地开发环境可关闭 Secure。
     */
    @Data
    public static class Cookie {
        /** 是否仅通过 HTTPS 发送。 */
        private boolean secure = true;
        /** SameSite 策略。 */
        private String sameSite = "Lax";
        /** 刷新令牌 Cookie 的路径，仅认证接口可见。 */
        private String refreshTokenPath = "/v1/auth";
    }
}
