package com.shopnest.authservice.serviceImpl;

import com.shopnest.authservice.service.EmailService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.mail.MailException;
import org.springframework.mail.SimpleMailMessage;
import org.springframework.mail.javamail.JavaMailSender;
import org.springframework.stereotype.Service;

/**
 * Sends account emails through {@link JavaMailSender} when {@code app.mail.enabled=true};
 * otherwise only logs them. A mail failure never fails the calling auth operation.
 */
@Slf4j
@Service
public class EmailServiceImpl implements EmailService {

    private final ObjectProvider<JavaMailSender> mailSender;
    private final boolean enabled;
    private final String from;
    private final String frontendUrl;

    public EmailServiceImpl(ObjectProvider<JavaMailSender> mailSender,
                            @Value("${app.mail.enabled:false}") boolean enabled,
                            @Value("${app.mail.from:no-reply@shopnest.local}") String from,
                            @Value("${app.frontend-url:http://localhost:3000}") String frontendUrl) {
        this.mailSender = mailSender;
        this.enabled = enabled;
        this.from = from;
        this.frontendUrl = frontendUrl.endsWith("/") ? frontendUrl.substring(0, frontendUrl.length() - 1) : frontendUrl;
    }

    @Override
    public void sendVerificationEmail(String to, String token) {
        String url = frontendUrl + "/verify-email?token=" + token;
        send(to,
                "Verify Your Email - ShopNest",
                "Thank you for registering! Verify your email address by visiting:\n\n" + url
                        + "\n\nIf you didn't create an account, you can safely ignore this email.");
    }

    @Override
    public void sendPasswordResetEmail(String to, String token) {
        String url = frontendUrl + "/reset-password?token=" + token;
        send(to,
                "Reset Your Password - ShopNest",
                "We received a request to reset your password. Use the link below within one hour:\n\n" + url
                        + "\n\nIf you didn't request this, you can safely ignore this email.");
    }

    private void send(String to, String subject, String text) {
        JavaMailSender sender = enabled ? mailSender.getIfAvailable() : null;
        if (sender == null) {
            log.info("Mail delivery disabled; would send '{}' to {}", subject, to);
            log.debug("Mail body:\n{}", text);
            return;
        }
        SimpleMailMessage message = new SimpleMailMessage();
        message.setFrom(from);
        message.setTo(to);
        message.setSubject(subject);
        message.setText(text);
        try {
            sender.send(message);
            log.info("Sent '{}' to {}", subject, to);
        } catch (MailException e) {
            log.warn("Failed to send '{}' to {}: {}", subject, to, e.getMessage());
        }
    }
}
