package uk.gegc.assessment.shared.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import uk.gegc.assessment.shared.email.EmailService;
import uk.gegc.assessment.shared.email.impl.NoopEmailService;

/**
 * Selects the {@link EmailService} implementation from {@code app.email.provider}.
 * <ul>
 *   <li>{@code smtp} - {@link uk.gegc.assessment.shared.email.impl.SmtpEmailService}, picked up by component scan</li>
 *   <li>{@code noop} (default) - logs only</li>
 * </ul>
 */
@Slf4j
@Configuration
public class EmailProviderConfig {

    @Bean
    @ConditionalOnProperty(name = "app.email.provider", havingValue = "noop", matchIfMissing = true)
    public EmailService noopEmailService() {
        log.info("Activating No-op email service (emails will be logged but not sent)");
        return new NoopEmailService();
    }
}
