package uk.gegc.assessment.features.session.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import uk.gegc.assessment.features.assessment.application.QuestionContent;
import uk.gegc.assessment.features.assessment.application.QuestionSetResolver;
import uk.gegc.assessment.features.assessment.domain.model.Assessment;
import uk.gegc.assessment.features.assessment.domain.repository.AssessmentRepository;
import uk.gegc.assessment.features.session.application.CompletionResult;
import uk.gegc.assessment.features.session.application.CompletionService;
import uk.gegc.assessment.features.session.application.ScoreCard;
import uk.gegc.assessment.features.session.application.ScoringService;
import uk.gegc.assessment.features.session.application.SessionDeadline;
import uk.gegc.assessment.features.session.domain.event.SessionCompletedEvent;
import uk.gegc.assessment.features.session.domain.model.AssessmentSession;
import uk.gegc.assessment.features.session.domain.model.CompletionReason;
import uk.gegc.assessment.features.session.domain.model.SessionAnswer;
import uk.gegc.assessment.features.session.domain.model.SessionStatus;
import uk.gegc.assessment.features.session.domain.repository.AssessmentSessionRepository;
import uk.gegc.assessment.features.session.domain.repository.SessionAnswerRepository;
import uk.gegc.assessment.shared.config.SessionProperties;
import uk.gegc.assessment.shared.result.ErrorKind;
import uk.gegc.assessment.shared.result.Result;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Service
@RequiredArgsConstructor
@Slf4j
public class CompletionServiceImpl implements CompletionService {

    private final AssessmentSessionRepository sessionRepository;
    private final SessionAnswerRepository answerRepository;
    private final AssessmentRepository assessmentRepository;
    private final QuestionSetResolver questionSetResolver;
    private final ScoringService scoringService;
    private final ApplicationEventPublisher eventPublisher;
    private final SessionProperties sessionProperties;
    private final Clock clock;

    @Override
    @Transactional
    public Result<CompletionResult> complete(UUID sessionId, UUID userId, CompletionReason reason) {
        Optional<AssessmentSession> locked = sessionRepository.findByIdForUpdate(sessionId);
        if (locked.isEmpty() || !locked.get().isOwnedBy(userId)) {
            log.warn("Completion rejected: session {} not found for user {}", sessionId, userId);
            return Result.failure(ErrorKind.NOT_FOUND, "Session " + sessionId + " not found");
        }
        AssessmentSession session = locked.get();
        if (session.getStatus().isTerminal()) {
            log.debug("Session {} already {}, returning persisted result", sessionId, session.getStatus());
            return Result.success(CompletionResult.of(session));
        }

        Optional<Assessment> maybeAssessment = assessmentRepository.findById(session.getAssessmentId());
        if (maybeAssessment.isEmpty()) {
            return Result.failure(ErrorKind.NOT_FOUND, "Assessment " + session.getAssessmentId() + " not found");
        }
        Assessment assessment = maybeAssessment.get();

        Instant now = clock.instant();
        SessionStatus status = classify(session, assessment, reason, now);

        List<UUID> order = List.copyOf(session.getQuestionOrder());
        List<QuestionContent> answerKey = questionSetResolver.resolve(order);
        List<SessionAnswer> answers = answerRepository.findBySessionId(sessionId);
        ScoreCard card = scoringService.grade(order, answerKey, answers,
                assessment.getQuestionCount(), assessment.getPassScore());

        int updated = sessionRepository.completeIfInProgress(sessionId, status, card.score(), card.passed(), now);
        if (updated == 0) {
            AssessmentSession winner = sessionRepository.findById(sessionId).orElseThrow();
            log.info("Session {} was finalized concurrently as {} (score {}); returning winner's result",
                    sessionId, winner.getStatus(), winner.getScore());
            return Result.success(CompletionResult.of(winner));
        }

        answers.forEach(answer -> answer.setCorrect(card.correctness().getOrDefault(answer.getQuestionId(), false)));
        answerRepository.saveAll(answers);

        log.info("Session {} finalized as {} (reason {}): score={} passed={} correct={}/{}",
                sessionId, status, reason, card.score(), card.passed(), card.correctCount(), assessment.getQuestionCount());

        eventPublisher.publishEvent(new SessionCompletedEvent(
                this, sessionId, session.getAssessmentId(), session.getUserId(),
                status, card.score(), card.passed(), now));

        return Result.success(new CompletionResult(sessionId, status, card.score(), card.passed(), now));
    }

    /**
     * Server time decides the terminal status. A session past its deadline always times out,
     * whatever the client claims; a client-declared expiry counts only within the grace window.
     */
    SessionStatus classify(AssessmentSession session, Assessment assessment, CompletionReason reason, Instant now) {
        long remaining = SessionDeadline.remainingSeconds(session, assessment, now);
        if (remaining == 0) {
            return SessionStatus.TIMED_OUT;
        }
        if (reason == CompletionReason.EXPIRED && remaining <= sessionProperties.getExpiryGraceSeconds()) {
            return SessionStatus.TIMED_OUT;
        }
        if (reason == CompletionReason.EXPIRED) {
            log.warn("Session {} reported expiry with {}s still remaining; finalizing as completed",
                    session.getId(), remaining);
        }
        return SessionStatus.COMPLETED;
    }
}
