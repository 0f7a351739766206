package com.muzee.mail;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * 开发/测试用邮件发送器。
 * <p>
 * 不实际发送，仅记录日志，便于本地开发时直接从日志读取验证码。
 */
@Slf4j
@Component
@ConditionalOnProperty(prefix = "muzee.mail", name = "enabled", havingValue = "false", matchIfMissing = true)
public class LoggingEmailSender implements EmailSender {

    @Override
    public void send(String to, String subject, String html) {
        log.info("Send email (dev mode) to={} subject={} html={}", to, subject, html);
    }
}
