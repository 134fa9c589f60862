package uk.gegc.assessment.features.session.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import uk.gegc.assessment.features.assessment.domain.model.Assessment;
import uk.gegc.assessment.features.assessment.domain.repository.AssessmentRepository;
import uk.gegc.assessment.features.organization.application.OrgAuthorizationService;
import uk.gegc.assessment.features.organization.domain.model.OrgRole;
import uk.gegc.assessment.features.session.application.ProctoringService;
import uk.gegc.assessment.features.session.application.ViolationReport;
import uk.gegc.assessment.features.session.domain.model.AssessmentSession;
import uk.gegc.assessment.features.session.domain.model.SessionViolation;
import uk.gegc.assessment.features.session.domain.model.ViolationType;
import uk.gegc.assessment.features.session.domain.repository.AssessmentSessionRepository;
import uk.gegc.assessment.features.session.domain.repository.SessionViolationRepository;
import uk.gegc.assessment.features.user.domain.model.User;
import uk.gegc.assessment.features.user.domain.repository.UserRepository;
import uk.gegc.assessment.shared.result.ErrorKind;
import uk.gegc.assessment.shared.result.Result;

import java.time.Clock;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

@Service
@RequiredArgsConstructor
@Slf4j
public class ProctoringServiceImpl implements ProctoringService {

    private final AssessmentSessionRepository sessionRepository;
    private final SessionViolationRepository violationRepository;
    private final AssessmentRepository assessmentRepository;
    private final OrgAuthorizationService orgAuthorizationService;
    private final UserRepository userRepository;
    private final Clock clock;

    @Override
    @Transactional
    public Result<Integer> recordFocusLoss(UUID sessionId, UUID userId) {
        Instant now = clock.instant();
        int updated = sessionRepository.incrementTabSwitchCount(sessionId, userId, now);
        if (updated == 0) {
            Optional<AssessmentSession> session = sessionRepository.findByIdAndUserId(sessionId, userId);
            if (session.isEmpty()) {
                log.warn("Focus loss rejected: session {} not found for user {}", sessionId, userId);
                return Result.failure(ErrorKind.NOT_FOUND, "Session " + sessionId + " not found");
            }
            log.warn("Focus loss rejected: session {} is {}", sessionId, session.get().getStatus());
            return Result.failure(ErrorKind.SESSION_CLOSED, "Session is already " + session.get().getStatus());
        }

        // The increment holds the row lock until commit, so this read sees our own value.
        int count = sessionRepository.findTabSwitchCount(sessionId);

        SessionViolation violation = new SessionViolation();
        violation.setSessionId(sessionId);
        violation.setSequence(count);
        violation.setOccurredAt(now);
        violation.setType(ViolationType.TAB_HIDDEN);
        violationRepository.save(violation);

        log.info("Session {} focus loss #{}", sessionId, count);
        return Result.success(count);
    }

    @Override
    @Transactional(readOnly = true)
    public Result<ViolationReport> getViolations(UUID sessionId, UUID requesterId) {
        Optional<AssessmentSession> maybeSession = sessionRepository.findById(sessionId);
        if (maybeSession.isEmpty()) {
            return Result.failure(ErrorKind.NOT_FOUND, "Session " + sessionId + " not found");
        }
        AssessmentSession session = maybeSession.get();
        Optional<Assessment> assessment = assessmentRepository.findById(session.getAssessmentId());
        if (assessment.isEmpty()) {
            return Result.failure(ErrorKind.NOT_FOUND, "Assessment " + session.getAssessmentId() + " not found");
        }
        if (!orgAuthorizationService.hasMinimumRole(requesterId, assessment.get().getOrganizationId(),
                OrgRole.CONTENT_MANAGER)) {
            return Result.failure(ErrorKind.UNAUTHORIZED, "Viewing violations requires a content manager role");
        }
        return Result.success(new ViolationReport(
                session.getId(),
                session.getUserId(),
                candidateLabel(session.getUserId()),
                assessment.get().getTitle(),
                session.getTabSwitchCount(),
                violationRepository.findBySessionIdOrderBySequenceAsc(sessionId)
        ));
    }

    private String candidateLabel(UUID userId) {
        return userRepository.findById(userId)
                .map(User::getEmail)
                .filter(email -> !email.isBlank())
                .orElseGet(() -> "user-" + userId.toString().substring(0, 8));
    }
}
