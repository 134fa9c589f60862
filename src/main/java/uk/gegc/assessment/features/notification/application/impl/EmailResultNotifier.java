package uk.gegc.assessment.features.notification.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import uk.gegc.assessment.features.assessment.domain.model.Assessment;
import uk.gegc.assessment.features.assessment.domain.repository.AssessmentRepository;
import uk.gegc.assessment.features.notification.application.ResultNotifier;
import uk.gegc.assessment.features.user.domain.model.User;
import uk.gegc.assessment.features.user.domain.repository.UserRepository;
import uk.gegc.assessment.shared.email.EmailMasking;
import uk.gegc.assessment.shared.email.EmailService;

import java.util.Optional;
import java.util.UUID;

@Service
@RequiredArgsConstructor
@Slf4j
public class EmailResultNotifier implements ResultNotifier {

    private final UserRepository userRepository;
    private final AssessmentRepository assessmentRepository;
    private final EmailService emailService;

    @Value("${app.notification.result-subject:Your assessment result}")
    private String resultSubject;

    @Override
    @Transactional(readOnly = true)
    public void notifyResult(UUID userId, UUID assessmentId, int score, boolean passed) {
        try {
            Optional<User> user = userRepository.findById(userId);
            if (user.isEmpty() || !user.get().isActive()) {
                log.debug("No active user {} to notify", userId);
                return;
            }
            String title = assessmentRepository.findById(assessmentId)
                    .map(Assessment::getTitle)
                    .orElse("your assessment");
            String email = user.get().getEmail();
            emailService.sendPlainTextEmail(email, resultSubject, buildBody(user.get().getUsername(), title, score, passed));
            log.info("Result notification sent to {} for assessment {}", EmailMasking.mask(email), assessmentId);
        } catch (Exception e) {
            log.warn("Failed to send result notification to user {} for assessment {}: {}",
                    userId, assessmentId, e.getMessage());
        }
    }

    private String buildBody(String username, String title, int score, boolean passed) {
        return """
                Hello %s,

                You have finished "%s".
                Score: %d%%
                Result: %s

                """.formatted(username, title, score, passed ? "PASSED" : "NOT PASSED");
    }
}
