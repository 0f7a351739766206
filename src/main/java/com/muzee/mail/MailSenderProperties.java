package com.muzee.mail;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * 邮件发送配置，绑定前缀 {@code muzee.mail.*}。
 * SMTP 连接参数沿用 {@code spring.mail.*}。
 */
@Data
@Component
@ConfigurationProperties(prefix = "muzee.mail")
public class MailSenderProperties {
    /** 是否通过 SMTP 真实发送；关闭时仅输出日志。 */
    private boolean enabled = false;
    /** 发件人地址。 */
    private String from = "no-reply@muzee.app";
}
