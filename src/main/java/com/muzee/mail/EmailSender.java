package com.muzee.mail;

/**
 * 邮件发送器接口。
 * <p>
 * 抽象真实投递行为：开发环境可只记录日志，生产环境通过 SMTP 发送。
 */
public interface EmailSender {

    /**
     * 发送 HTML 邮件。
     *
     * @param to      收件人地址。
     * @param subject 主题。
     * @param html    HTML 正文。
     * @throws EmailDeliveryException 投递失败时抛出。
     */
    void send(String to, String subject, String html);
}
