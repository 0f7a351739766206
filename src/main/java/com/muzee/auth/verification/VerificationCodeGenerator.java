package com.muzee.auth.verification;

import com.muzee.auth.config.AuthProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.security.SecureRandom;

/**
 * 数字验证码生成器。
 * <p>
 * 每一位独立取自 {@link SecureRandom#nextInt(int)}，分布均匀且保留前导零。
 */
@Component
@RequiredArgsConstructor
public class VerificationCodeGenerator {

    private static final SecureRandom RANDOM = new SecureRandom();

    private final AuthProperties properties;

    /**
     * 生成配置长度（默认 6 位）的纯数字验证码。
     *
     * @return 数字字符串。
     */
    public String generate() {
        int length = properties.getSignup().getCodeLength();
        StringBuilder builder = new StringBuilder(length);
        for (int i = 0; i < length; i++) {
            builder.append(RANDOM.nextInt(10));
        }
        return builder.toString();
    }
}
