package com.muzee.mail;

import jakarta.mail.Session;
import jakarta.mail.internet.MimeMessage;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.mail.MailSendException;
import org.springframework.mail.javamail.JavaMailSender;

import java.util.Properties;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class SmtpEmailSenderTest {

    private JavaMailSender mailSender;
    private SmtpEmailSender sender;

    @BeforeEach
    void setUp() {
        mailSender = mock(JavaMailSender.class);
        when(mailSender.createMimeMessage()).thenReturn(new MimeMessage(Session.getInstance(new Properties())));
        MailSenderProperties properties = new MailSenderProperties();
        properties.setFrom("no-reply@muzee.app");
        sender = new SmtpEmailSender(mailSender, properties);
    }

    @Test
    void sendsHtmlMessage() throws Exception {
        sender.send("a@b.com", "【Muzee】验证码", "<p>123456</p>");

        ArgumentCaptor<MimeMessage> captor = ArgumentCaptor.forClass(MimeMessage.class);
        verify(mailSender).send(captor.capture());
        MimeMessage sent = captor.getValue();
        assertThat(sent.getSubject()).isEqualTo("【Muzee】验证码");
        assertThat(sent.getAllRecipients()[0].toString()).isEqualTo("a@b.com");
        assertThat(sent.getFrom()[0].toString()).isEqualTo("no-reply@muzee.app");
    }

    @Test
    void transportFailureIsWrapped() {
        doThrow(new MailSendException("connection refused")).when(mailSender).send(any(MimeMessage.class));

        assertThatThrownBy(() -> sender.send("a@b.com", "subject", "<p>x</p>"))
                .isInstanceOf(EmailDeliveryException.class)
                .hasCauseInstanceOf(MailSendException.class);
    }
}
