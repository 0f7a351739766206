package com.muzee.auth.service;

import com.muzee.auth.api.dto.*;
import com.muzee.auth.config.AuthProperties;
import com.muzee.auth.exception.BusinessException;
import com.muzee.auth.exception.ErrorCode;
import com.muzee.auth.ratelimit.RateLimitOperation;
import com.muzee.auth.ratelimit.RateLimiter;
import com.muzee.auth.token.JwtService;
import com.muzee.auth.token.RefreshTokenRecord;
import com.muzee.auth.token.RefreshTokenStore;
import com.muzee.auth.token.TokenPair;
import com.muzee.auth.util.EmailNormalizer;
import com.muzee.auth.verification.PendingSignup;
import com.muzee.auth.verification.SignupSessionStore;
import com.muzee.auth.verification.VerificationCodeGenerator;
import com.muzee.auth.verification.VerificationMailService;
import com.muzee.user.domain.User;
import com.muzee.user.service.UserService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.Objects;
import java.util.Optional;

/**
 * 认证业务服务。
 * <p>
 * 职责：注册验证码发送/重发/校验、登录、刷新令牌、登出。
 * 注册状态机（按邮箱）：无会话 → 待验证（验证码 + 密码哈希）→ 校验成功后删除；
 * 待验证会话 15 分钟未使用由存储自动过期。
 * 安全策略：
 * - 发送验证码与登录按邮箱做固定窗口限流；
 * - 登录失败不区分“用户不存在”与“密码错误”；
 * - 刷新令牌一次性使用，每次刷新都会删除旧令牌；客户端标识不一致时视为令牌泄露并立即作废。
 * 存储层异常直接上抛，由全局异常处理统一返回 500，本层不做重试。
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AuthService {

    static final String TOKEN_TYPE = "Bearer";

    private final UserService userService;
    private final RateLimiter rateLimiter;
    private final SignupSessionStore signupSessionStore;
    private final RefreshTokenStore refreshTokenStore;
    private final VerificationCodeGenerator codeGenerator;
    private final VerificationMailService verificationMailService;
    private final PasswordEncoder passwordEncoder;
    private final JwtService jwtService;
    private final AuthProperties authProperties;

    /**
     * 发送注册验证码。
     * <p>
     * 依次执行：邮箱占用检查、限流、密码哈希、生成验证码、保存注册会话（覆盖旧会话）、发送邮件。
     * 邮件发送失败仅记录日志，会话已写入，仍返回成功。
     *
     * @param request 请求体，包含：邮箱、密码。
     * @return 响应体，包含标准化邮箱与会话有效秒数。
     * @throws BusinessException 邮箱已注册或触发限流时抛出。
     */
    public SendCodeResponse sendCode(SendCodeRequest request) {
        String email = EmailNormalizer.normalize(request.email());
        if (userService.existsByEmail(email)) {
            throw new BusinessException(ErrorCode.EMAIL_ALREADY_EXISTS);
        }
        rateLimiter.check(RateLimitOperation.SEND_CODE, email);

        String passwordHash = passwordEncoder.encode(request.password());
        String code = codeGenerator.generate();
        signupSessionStore.save(email, passwordHash, code);
        sendVerificationMail(email, code);

        return new SendCodeResponse("验证码已发送，请查收邮件", email, sessionTtlSeconds());
    }

    /**
     * 重发注册验证码。
     * <p>
     * 要求存在待验证会话；沿用会话中的密码哈希，生成新验证码并覆盖，旧验证码立即失效。
     *
     * @param request 请求体，包含：邮箱。
     * @return 响应体，包含标准化邮箱与会话有效秒数。
     * @throws BusinessException 会话不存在或触发限流时抛出。
     */
    public SendCodeResponse resendCode(ResendCodeRequest request) {
        String email = EmailNormalizer.normalize(request.email());
        PendingSignup session = signupSessionStore.find(email)
                .orElseThrow(() -> new BusinessException(ErrorCode.SESSION_NOT_FOUND));
        rateLimiter.check(RateLimitOperation.SEND_CODE, email);

        String code = codeGenerator.generate();
        signupSessionStore.save(email, session.passwordHash(), code);
        sendVerificationMail(email, code);

        return new SendCodeResponse("验证码已重新发送，请查收邮件", email, sessionTtlSeconds());
    }

    /**
     * 校验注册验证码并创建用户。
     * <p>
     * 验证码错误时保留会话，允许在有效期内重试；成功后创建用户、签发令牌并绑定客户端标识，
     * 最后尽力删除注册会话（删除失败只记录日志，账号已创建）。
     *
     * @param request 请求体，包含：邮箱、验证码、客户端标识。
     * @return 认证响应，包含令牌对与用户概要。
     * @throws BusinessException 会话不存在、验证码错误或邮箱已被并发注册时抛出。
     */
    public AuthResponse verifyCode(VerifyCodeRequest request) {
        String email = EmailNormalizer.normalize(request.email());
        PendingSignup session = signupSessionStore.find(email)
                .orElseThrow(() -> new BusinessException(ErrorCode.SESSION_NOT_FOUND));
        if (!codeMatches(session.code(), request.code())) {
            throw new BusinessException(ErrorCode.INVALID_CODE);
        }

        User user = User.builder()
                .email(email)
                .passwordHash(session.passwordHash())
                .build();
        try {
            userService.createUser(user);
        } catch (DuplicateKeyException ex) {
            throw new BusinessException(ErrorCode.EMAIL_ALREADY_EXISTS);
        }
        log.info("User registered userId={} email={}", user.getId(), email);

        TokenPair tokenPair = issueAndStore(user, request.clientId());
        deleteSignupSessionQuietly(email);

        return mapAuth("注册成功", tokenPair, user);
    }

    /**
     * 邮箱密码登录。
     *
     * @param request 请求体，包含：邮箱、密码、客户端标识。
     * @return 认证响应，包含令牌对与用户概要。
     * @throws BusinessException 触发限流或凭证错误时抛出。
     */
    public AuthResponse login(LoginRequest request) {
        String email = EmailNormalizer.normalize(request.email());
        rateLimiter.check(RateLimitOperation.LOGIN, email);

        Optional<User> userOptional = userService.findByEmail(email);
        if (userOptional.isEmpty()
                || !StringUtils.hasText(userOptional.get().getPasswordHash())
                || !passwordEncoder.matches(request.password(), userOptional.get().getPasswordHash())) {
            throw new BusinessException(ErrorCode.INVALID_CREDENTIALS);
        }
        User user = userOptional.get();
        TokenPair tokenPair = issueAndStore(user, request.clientId());
        return mapAuth("登录成功", tokenPair, user);
    }

    /**
     * 使用刷新令牌换取新的令牌对（轮换）。
     * <p>
     * 旧令牌在客户端标识校验后立即删除，之后的任何失败都不会让它恢复可用。
     * 删除与签发之间不具备事务性，若中途崩溃，用户需要重新登录。
     *
     * @param request 请求体，包含：刷新令牌、客户端标识。
     * @return 新的令牌响应。
     * @throws BusinessException 缺少令牌、令牌无效、客户端不匹配或用户已不存在时抛出。
     */
    public TokenResponse refresh(RefreshTokenRequest request) {
        String refreshToken = request.refreshToken();
        if (!StringUtils.hasText(refreshToken)) {
            throw new BusinessException(ErrorCode.MISSING_REFRESH_TOKEN);
        }
        RefreshTokenRecord record = refreshTokenStore.find(refreshToken)
                .orElseThrow(() -> new BusinessException(ErrorCode.REFRESH_TOKEN_INVALID));

        if (!Objects.equals(record.clientId(), request.clientId())) {
            refreshTokenStore.delete(refreshToken);
            log.warn("Refresh token client mismatch, token revoked userId={}", record.userId());
            throw new BusinessException(ErrorCode.CLIENT_ID_MISMATCH);
        }
        refreshTokenStore.delete(refreshToken);

        User user = userService.findById(record.userId())
                .orElseThrow(() -> new BusinessException(ErrorCode.REFRESH_TOKEN_INVALID));
        TokenPair tokenPair = issueAndStore(user, record.clientId());
        return new TokenResponse(tokenPair.accessToken(), tokenPair.refreshToken(), TOKEN_TYPE, accessTtlSeconds());
    }

    /**
     * 登出：删除指定刷新令牌。
     * <p>
     * 非幂等：令牌不存在（含重复登出）时返回错误。已签发的访问令牌在过期前仍然有效。
     *
     * @param request 请求体，包含：刷新令牌。
     * @return 提示信息。
     * @throws BusinessException 缺少令牌或令牌不存在时抛出。
     */
    public MessageResponse logout(LogoutRequest request) {
        String refreshToken = request.refreshToken();
        if (!StringUtils.hasText(refreshToken)) {
            throw new BusinessException(ErrorCode.MISSING_REFRESH_TOKEN);
        }
        if (!refreshTokenStore.delete(refreshToken)) {
            throw new BusinessException(ErrorCode.TOKEN_NOT_FOUND);
        }
        return new MessageResponse("已登出");
    }

    /**
     * 签发令牌对并保存刷新令牌记录。
     *
     * @param user     用户实体。
     * @param clientId 客户端标识。
     * @return 令牌对。
     */
    private TokenPair issueAndStore(User user, String clientId) {
        TokenPair tokenPair = jwtService.issueTokenPair(user);
        refreshTokenStore.save(tokenPair.refreshToken(), user.getId(), clientId);
        return tokenPair;
    }

    /**
     * 逐字节比较验证码，耗时与内容无关。
     */
    private static boolean codeMatches(String expected, String actual) {
        if (expected == null || actual == null) {
            return false;
        }
        return MessageDigest.isEqual(expected.getBytes(StandardCharsets.UTF_8), actual.getBytes(StandardCharsets.UTF_8));
    }

    private void sendVerificationMail(String email, String code) {
        try {
            verificationMailService.sendVerificationCode(email, code);
        } catch (RuntimeException ex) {
            log.warn("Verification mail delivery failed email={}", email, ex);
        }
    }

    private void deleteSignupSessionQuietly(String email) {
        try {
            signupSessionStore.delete(email);
        } catch (DataAccessException ex) {
            log.warn("Failed to delete signup session email={}", email, ex);
        }
    }

    private AuthResponse mapAuth(String message, TokenPair tokenPair, User user) {
        return new AuthResponse(
                message,
                tokenPair.accessToken(),
                tokenPair.refreshToken(),
                TOKEN_TYPE,
                accessTtlSeconds(),
                new AuthUserResponse(user.getId(), user.getEmail())
        );
    }

    private long accessTtlSeconds() {
        return authProperties.getJwt().getAccessTokenTtl().toSeconds();
    }

    private long sessionTtlSeconds() {
        return authProperties.getSignup().getSessionTtl().toSeconds();
    }
}
