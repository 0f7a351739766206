package com.muzee.auth.token;

import com.muzee.auth.config.AuthProperties;
import com.muzee.user.domain.User;
import lombok.RequiredArgsConstructor;
import org.springframework.security.oauth2.jose.jws.MacAlgorithm;
import org.springframework.security.oauth2.jwt.*;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.time.Clock;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

/**
 * JWT 令牌服务。
 * <p>
 * 功能：签发 HS256 访问令牌与不透明刷新令牌，校验访问令牌，提取用户 ID。
 * 声明：
 * - `sub` / `user_id`：用户 ID；
 * - `email`：用户邮箱；
 * - `iat` / `exp`：签发与过期时间。
 * 访问令牌无状态，不支持吊销；刷新令牌是随机 UUID，有效性完全取决于 {@link RefreshTokenStore}。
 */
@Service
@RequiredArgsConstructor
public class JwtService {

    static final String CLAIM_USER_ID = "user_id";
    static final String CLAIM_EMAIL = "email";

    private final JwtEncoder jwtEncoder;
    private final JwtDecoder jwtDecoder;
    private final AuthProperties properties;
    private final Clock clock;

    /**
     * 为指定用户签发访问令牌与刷新令牌。
     *
     * @param user 用户实体。
     * @return 令牌对。
     */
    public TokenPair issueTokenPair(User user) {
        return new TokenPair(issueAccessToken(user.getId(), user.getEmail()), issueRefreshToken());
    }

    /**
     * 签发访问令牌。
     *
     * @param userId 用户 ID。
     * @param email  用户邮箱。
     * @return JWT 字符串。
     */
    public String issueAccessToken(long userId, String email) {
        Instant issuedAt = Instant.now(clock);
        return encodeAccessToken(userId, email, issuedAt, issuedAt.plus(properties.getJwt().getAccessTokenTtl()));
    }

    /**
     * 生成不透明刷新令牌。
     *
     * @return 随机 UUID 字符串。
     */
    public String issueRefreshToken() {
        return UUID.randomUUID().toString();
    }

    /**
     * 校验访问令牌的签名与有效期。
     * <p>
     * 签名不符、结构错误或已过期统一返回空，不向调用方区分原因。
     *
     * @param token JWT 字符串。
     * @return 解析出的声明；无效时为空。
     */
    public Optional<AccessTokenClaims> validateAccessToken(String token) {
        if (!StringUtils.hasText(token)) {
            return Optional.empty();
        }
        try {
            Jwt jwt = jwtDecoder.decode(token);
            return Optional.of(new AccessTokenClaims(
                    extractUserId(jwt),
                    jwt.getClaimAsString(CLAIM_EMAIL),
                    jwt.getIssuedAt(),
                    jwt.getExpiresAt()));
        } catch (JwtException | IllegalArgumentException ex) {
            return Optional.empty();
        }
    }

    /**
     * 从 JWT 中提取用户 ID。
     *
     * @param jwt 已解析的 JWT。
     * @return 用户 ID（long）。
     * @throws IllegalArgumentException 当声明缺失或类型不合法时抛出。
     */
    public long extractUserId(Jwt jwt) {
        Object claim = jwt.getClaims().get(CLAIM_USER_ID);
        if (claim instanceof Number number) {
            return number.longValue();
        }
        if (claim instanceof String text) {
            return Long.parseLong(text);
        }
        throw new IllegalArgumentException("Invalid user id in token");
    }

    private String encodeAccessToken(long userId, String email, Instant issuedAt, Instant expiresAt) {
        JwtClaimsSet.Builder claims = JwtClaimsSet.builder()
                .issuedAt(issuedAt)
                .expiresAt(expiresAt)
                .subject(String.valueOf(userId))
                .claim(CLAIM_USER_ID, userId)
                .claim(CLAIM_EMAIL, email);
        if (StringUtils.hasText(properties.getJwt().getIssuer())) {
            claims.issuer(properties.getJwt().getIssuer());
        }
        JwsHeader header = JwsHeader.with(MacAlgorithm.HS256).build();
        return jwtEncoder.encode(JwtEncoderParameters.from(header, claims.build())).getTokenValue();
    }
}
