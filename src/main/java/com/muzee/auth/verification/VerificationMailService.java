package com.muzee.auth.verification;

import com.muzee.auth.config.AuthProperties;
import com.muzee.mail.EmailSender;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

/**
 * 验证码邮件服务。
 * <p>
 * 负责拼装验证码邮件的主题与 HTML 正文，并交给 {@link EmailSender} 投递。
 * 投递失败以异常形式抛出，是否忽略由调用方决定。
 */
@Service
@RequiredArgsConstructor
public class VerificationMailService {

    static final String SUBJECT = "【Muzee】验证码";

    private final EmailSender emailSender;
    private final AuthProperties properties;

    /**
     * 发送注册验证码邮件。
     *
     * @param email 收件人（标准化后的邮箱）。
     * @param code  验证码。
     */
    public void sendVerificationCode(String email, String code) {
        long minutes = properties.getSignup().getSessionTtl().toMinutes();
        String html = """
                <div style="font-family: sans-serif; max-width: 600px; margin: 0 auto;">
                    <h2>验证码</h2>
                    <p>请输入以下验证码完成注册：</p>
                    <div style="background-color: #f5f5f5; padding: 20px; text-align: center; font-size: 32px; font-weight: bold; letter-spacing: 8px;">
                        %s
                    </div>
                    <p style="color: #666; font-size: 14px;">
                        验证码 %d 分钟内有效<br>
                        如非本人操作，请忽略本邮件
                    </p>
                </div>
                """.formatted(code, minutes);
        emailSender.send(email, SUBJECT, html);
    }
}
