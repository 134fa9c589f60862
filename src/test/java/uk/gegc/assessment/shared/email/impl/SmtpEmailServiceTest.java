package uk.gegc.assessment.shared.email.impl;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.springframework.mail.SimpleMailMessage;
import org.springframework.mail.javamail.JavaMailSender;
import org.springframework.test.util.ReflectionTestUtils;
import uk.gegc.assessment.BaseUnitTest;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

@DisplayName("SmtpEmailService")
class SmtpEmailServiceTest extends BaseUnitTest {

    @Mock
    private JavaMailSender mailSender;

    private SmtpEmailService service;

    @BeforeEach
    void setUp() {
        service = new SmtpEmailService(mailSender);
    }

    @Test
    @DisplayName("skips sending when no sender address is configured")
    void unconfigured_skips() {
        ReflectionTestUtils.setField(service, "fromEmail", "");

        service.sendPlainTextEmail("jdoe@example.com", "Subject", "Body");

        verifyNoInteractions(mailSender);
    }

    @Test
    @DisplayName("sends a plain text message from the configured sender")
    void configured_sends() {
        ReflectionTestUtils.setField(service, "fromEmail", "noreply@example.com");

        service.sendPlainTextEmail("jdoe@example.com", "Your assessment result", "Score: 80%");

        ArgumentCaptor<SimpleMailMessage> captor = ArgumentCaptor.forClass(SimpleMailMessage.class);
        verify(mailSender).send(captor.capture());
        SimpleMailMessage message = captor.getValue();
        assertThat(message.getFrom()).isEqualTo("noreply@example.com");
        assertThat(message.getTo()).containsExactly("jdoe@example.com");
        assertThat(message.getSubject()).isEqualTo("Your assessment result");
        assertThat(message.getText()).isEqualTo("Score: 80%");
    }
}
