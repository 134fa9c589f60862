package uk.gegc.assessment.shared.email.impl;

import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.mail.SimpleMailMessage;
import org.springframework.mail.javamail.JavaMailSender;
import org.springframework.stereotype.Service;
import uk.gegc.assessment.shared.email.EmailService;

import static uk.gegc.assessment.shared.email.EmailMasking.mask;

/**
 * SMTP delivery through Spring's {@link JavaMailSender}.
 * Activated when {@code app.email.provider=smtp}.
 */
@Slf4j
@Service
@ConditionalOnProperty(name = "app.email.provider", havingValue = "smtp")
@RequiredArgsConstructor
public class SmtpEmailService implements EmailService {

    private final JavaMailSender mailSender;

    @Value("${spring.mail.username:}")
    private String fromEmail;

    @PostConstruct
    void verifyEmailConfiguration() {
        if (fromEmail == null || fromEmail.isBlank()) {
            log.warn("Email service disabled: spring.mail.username is not configured");
        } else {
            log.info("Email service enabled with sender: {}", fromEmail);
        }
    }

    @Override
    public void sendPlainTextEmail(String to, String subject, String body) {
        if (fromEmail == null || fromEmail.isBlank()) {
            log.warn("Email service disabled - skipping email to: {}", mask(to));
            return;
        }

        SimpleMailMessage message = new SimpleMailMessage();
        message.setFrom(fromEmail);
        message.setTo(to);
        message.setSubject(subject);
        message.setText(body);

        mailSender.send(message);
        log.info("Email '{}' sent to: {}", subject, mask(to));
    }
}
