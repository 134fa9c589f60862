package uk.gegc.assessment.shared.email.impl;

import lombok.extern.slf4j.Slf4j;
import uk.gegc.assessment.shared.email.EmailService;

import static uk.gegc.assessment.shared.email.EmailMasking.mask;

/**
 * Logs email send attempts without delivering anything.
 * Default provider for local development and tests ({@code app.email.provider=noop}).
 */
@Slf4j
public class NoopEmailService implements EmailService {

    public NoopEmailService() {
        log.info("NoopEmailService initialized - emails will be logged but not sent");
    }

    @Override
    public void sendPlainTextEmail(String to, String subject, String body) {
        log.info("[NOOP] Would send plain text email to: {} with subject: {}", mask(to), subject);
    }
}
