package uk.gegc.assessment.features.session.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import uk.gegc.assessment.features.assessment.application.QuestionContent;
import uk.gegc.assessment.features.assessment.application.QuestionSetResolver;
import uk.gegc.assessment.features.assessment.domain.model.Assessment;
import uk.gegc.assessment.features.assessment.domain.repository.AssessmentRepository;
import uk.gegc.assessment.features.session.application.AnswerReceipt;
import uk.gegc.assessment.features.session.application.AnswerService;
import uk.gegc.assessment.features.session.application.SessionDeadline;
import uk.gegc.assessment.features.session.domain.model.AssessmentSession;
import uk.gegc.assessment.features.session.domain.model.SessionAnswer;
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
public class AnswerServiceImpl implements AnswerService {

    private final AssessmentSessionRepository sessionRepository;
    private final SessionAnswerRepository answerRepository;
    private final AssessmentRepository assessmentRepository;
    private final QuestionSetResolver questionSetResolver;
    private final SessionProperties sessionProperties;
    private final Clock clock;

    @Override
    @Transactional
    public Result<AnswerReceipt> submitAnswer(UUID sessionId, UUID userId, UUID questionId, int selectedIndex,
                                              Long clientReportedRemaining) {
        Optional<AssessmentSession> maybeSession = sessionRepository.findByIdAndUserId(sessionId, userId);
        if (maybeSession.isEmpty()) {
            log.warn("Answer rejected: session {} not found for user {}", sessionId, userId);
            return Result.failure(ErrorKind.NOT_FOUND, "Session " + sessionId + " not found");
        }
        AssessmentSession session = maybeSession.get();
        if (!session.isInProgress()) {
            log.warn("Answer rejected: session {} is {}", sessionId, session.getStatus());
            return Result.failure(ErrorKind.SESSION_CLOSED, "Session is already " + session.getStatus());
        }
        if (!session.getQuestionOrder().contains(questionId)) {
            return Result.failure(ErrorKind.NOT_FOUND, "Question " + questionId + " is not part of this session");
        }
        List<QuestionContent> resolved = questionSetResolver.resolve(List.of(questionId));
        if (resolved.isEmpty()) {
            return Result.failure(ErrorKind.NOT_FOUND, "Question " + questionId + " not found");
        }
        if (!resolved.get(0).isValidIndex(selectedIndex)) {
            return Result.failure(ErrorKind.INVALID_ANSWER,
                    "Selected index " + selectedIndex + " is out of range for question " + questionId);
        }

        Instant now = clock.instant();
        Optional<Assessment> assessment = assessmentRepository.findById(session.getAssessmentId());
        if (assessment.isPresent()) {
            Instant cutoff = SessionDeadline.deadlineAt(session, assessment.get())
                    .plusSeconds(sessionProperties.getExpiryGraceSeconds());
            if (now.isAfter(cutoff)) {
                log.warn("Answer rejected: session {} passed its deadline", sessionId);
                return Result.failure(ErrorKind.SESSION_CLOSED, "Time limit has expired");
            }
            logDrift(session, assessment.get(), now, clientReportedRemaining);
        }

        // Locks the session row; a completion holding the lock first makes this return 0.
        if (sessionRepository.touchIfInProgress(sessionId, userId, now) == 0) {
            log.warn("Answer rejected: session {} closed while the answer was in flight", sessionId);
            return Result.failure(ErrorKind.SESSION_CLOSED, "Session is already closed");
        }

        // Current read: a plain read would reuse the snapshot taken above and miss a concurrent first insert.
        SessionAnswer answer = answerRepository.findForUpdate(sessionId, questionId)
                .orElseGet(() -> {
                    SessionAnswer created = new SessionAnswer();
                    created.setSessionId(sessionId);
                    created.setQuestionId(questionId);
                    return created;
                });
        answer.setSelectedIndex(selectedIndex);
        answer.setSubmittedAt(now);
        answer.setClientRemainingSeconds(clientReportedRemaining);
        answerRepository.save(answer);

        return Result.success(new AnswerReceipt(sessionId, questionId, selectedIndex, now));
    }

    private void logDrift(AssessmentSession session, Assessment assessment, Instant now, Long clientReportedRemaining) {
        if (clientReportedRemaining == null || !log.isDebugEnabled()) {
            return;
        }
        long serverRemaining = SessionDeadline.remainingSeconds(session, assessment, now);
        log.debug("Session {} clock drift: client={}s server={}s delta={}s",
                session.getId(), clientReportedRemaining, serverRemaining, clientReportedRemaining - serverRemaining);
    }
}
