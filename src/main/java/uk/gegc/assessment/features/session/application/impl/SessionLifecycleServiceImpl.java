package uk.gegc.assessment.features.session.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import uk.gegc.assessment.features.assessment.application.QuestionSetResolver;
import uk.gegc.assessment.features.assessment.domain.model.Assessment;
import uk.gegc.assessment.features.assessment.domain.repository.AssessmentRepository;
import uk.gegc.assessment.features.session.application.AttemptEligibility;
import uk.gegc.assessment.features.session.application.CompletionResult;
import uk.gegc.assessment.features.session.application.CompletionService;
import uk.gegc.assessment.features.session.application.SessionDeadline;
import uk.gegc.assessment.features.session.application.SessionLifecycleService;
import uk.gegc.assessment.features.session.application.SessionStore;
import uk.gegc.assessment.features.session.application.SessionView;
import uk.gegc.assessment.features.session.domain.model.AssessmentSession;
import uk.gegc.assessment.features.session.domain.model.CompletionReason;
import uk.gegc.assessment.shared.result.ErrorKind;
import uk.gegc.assessment.shared.result.Result;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Not transactional on purpose: creation must commit (or fail on the unique key) on its own so a
 * losing concurrent start can read the winner's row.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SessionLifecycleServiceImpl implements SessionLifecycleService {

    private final AssessmentRepository assessmentRepository;
    private final SessionStore sessionStore;
    private final QuestionSetResolver questionSetResolver;
    private final CompletionService completionService;
    private final AttemptEligibility attemptEligibility;
    private final Clock clock;

    @Override
    public Result<SessionView> startOrResume(UUID userId, UUID assessmentId, String accessCode, String ipAddress) {
        Optional<Assessment> maybeAssessment = assessmentRepository.findById(assessmentId);
        if (maybeAssessment.isEmpty()) {
            return Result.failure(ErrorKind.NOT_FOUND, "Assessment " + assessmentId + " not found");
        }
        Assessment assessment = maybeAssessment.get();
        if (!assessment.isPublished()) {
            log.warn("Start rejected: assessment {} is {}", assessmentId, assessment.getStatus());
            return Result.failure(ErrorKind.NOT_AVAILABLE, "Assessment is not published");
        }

        Optional<AssessmentSession> existing = sessionStore.findInProgress(userId, assessmentId);
        if (existing.isPresent()) {
            return resume(existing.get(), assessment);
        }
        return create(userId, assessment, accessCode, ipAddress, true);
    }

    private Result<SessionView> create(UUID userId, Assessment assessment, String accessCode, String ipAddress,
                                       boolean retryOnLostRace) {
        Instant now = clock.instant();
        Result<Void> eligibility = attemptEligibility.checkCanStart(assessment, userId, now);
        if (!eligibility.isSuccess()) {
            log.warn("Start rejected for user {} on assessment {}: {}", userId, assessment.getId(), eligibility);
            return eligibility.map(ignored -> null);
        }
        if (!AttemptEligibility.accessCodeMatches(assessment, accessCode)) {
            log.warn("Start rejected for user {} on assessment {}: wrong access code", userId, assessment.getId());
            return Result.failure(ErrorKind.INVALID_ACCESS_CODE, "Invalid access code");
        }

        Result<List<UUID>> order = questionSetResolver.drawQuestionOrder(assessment);
        if (!order.isSuccess()) {
            return order.map(ignored -> null);
        }

        AssessmentSession session;
        try {
            session = sessionStore.create(userId, assessment.getId(), order.orElseThrow(), now, ipAddress);
        } catch (DataIntegrityViolationException e) {
            log.info("Concurrent start for user {} on assessment {}; resuming the existing session",
                    userId, assessment.getId());
            Optional<AssessmentSession> winner = sessionStore.findInProgress(userId, assessment.getId());
            if (winner.isPresent()) {
                return resume(winner.get(), assessment);
            }
            // The winner finished before we could read it; its slot is free again.
            if (retryOnLostRace) {
                return create(userId, assessment, accessCode, ipAddress, false);
            }
            log.warn("Start for user {} on assessment {} lost the insert race twice", userId, assessment.getId());
            return Result.failure(ErrorKind.ALREADY_STARTED, "Session was started concurrently");
        }

        log.info("Session {} created for user {} on assessment {} ({} questions, {} min)",
                session.getId(), userId, assessment.getId(), session.getQuestionOrder().size(),
                assessment.getTimeLimitMinutes());
        return Result.success(view(session, assessment, assessment.timeLimitSeconds(), now));
    }

    private Result<SessionView> resume(AssessmentSession session, Assessment assessment) {
        Instant now = clock.instant();
        long remaining = SessionDeadline.remainingSeconds(session, assessment, now);
        if (remaining > 0) {
            log.info("Session {} resumed with {}s remaining", session.getId(), remaining);
            return Result.success(view(session, assessment, remaining, now));
        }

        log.info("Session {} resumed after its deadline; finalizing as expired", session.getId());
        Result<CompletionResult> completion =
                completionService.complete(session.getId(), session.getUserId(), CompletionReason.EXPIRED);
        if (!completion.isSuccess()) {
            return completion.map(ignored -> null);
        }
        AssessmentSession terminal = sessionStore.findOwned(session.getId(), session.getUserId()).orElse(session);
        return Result.success(view(terminal, assessment, 0L, now));
    }

    private SessionView view(AssessmentSession session, Assessment assessment, long remaining, Instant now) {
        return new SessionView(
                session,
                assessment,
                questionSetResolver.resolve(List.copyOf(session.getQuestionOrder())),
                sessionStore.answersOf(session.getId()),
                remaining,
                SessionDeadline.deadlineAt(session, assessment),
                now
        );
    }
}
