package uk.gegc.assessment.features.session.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import uk.gegc.assessment.features.assessment.application.QuestionContent;
import uk.gegc.assessment.features.assessment.application.QuestionSetResolver;
import uk.gegc.assessment.features.assessment.domain.model.Assessment;
import uk.gegc.assessment.features.assessment.domain.repository.AssessmentRepository;
import uk.gegc.assessment.features.session.application.AttemptEligibility;
import uk.gegc.assessment.features.session.application.SessionDeadline;
import uk.gegc.assessment.features.session.application.SessionQueryService;
import uk.gegc.assessment.features.session.application.SessionSummary;
import uk.gegc.assessment.features.session.application.SessionSummary.QuestionReview;
import uk.gegc.assessment.features.session.domain.model.AssessmentSession;
import uk.gegc.assessment.features.session.domain.model.SessionAnswer;
import uk.gegc.assessment.features.session.domain.repository.AssessmentSessionRepository;
import uk.gegc.assessment.features.session.domain.repository.SessionAnswerRepository;
import uk.gegc.assessment.shared.result.ErrorKind;
import uk.gegc.assessment.shared.result.Result;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;

@Service
@RequiredArgsConstructor
@Slf4j
public class SessionQueryServiceImpl implements SessionQueryService {

    private final AssessmentSessionRepository sessionRepository;
    private final SessionAnswerRepository answerRepository;
    private final AssessmentRepository assessmentRepository;
    private final QuestionSetResolver questionSetResolver;
    private final AttemptEligibility attemptEligibility;
    private final Clock clock;

    @Override
    @Transactional(readOnly = true)
    public Result<SessionSummary> getSessionSummary(UUID sessionId, UUID userId) {
        Optional<AssessmentSession> maybeSession = sessionRepository.findByIdAndUserId(sessionId, userId);
        if (maybeSession.isEmpty()) {
            return Result.failure(ErrorKind.NOT_FOUND, "Session " + sessionId + " not found");
        }
        AssessmentSession session = maybeSession.get();
        Optional<Assessment> maybeAssessment = assessmentRepository.findById(session.getAssessmentId());
        if (maybeAssessment.isEmpty()) {
            return Result.failure(ErrorKind.NOT_FOUND, "Assessment " + session.getAssessmentId() + " not found");
        }
        Assessment assessment = maybeAssessment.get();
        Instant now = clock.instant();
        boolean terminal = session.getStatus().isTerminal();

        List<SessionAnswer> answers = answerRepository.findBySessionId(sessionId);

        Instant cooldownEndsAt = null;
        boolean canRetake = false;
        if (terminal) {
            cooldownEndsAt = attemptEligibility.cooldownEndsAt(assessment, userId, now).orElse(null);
            canRetake = attemptEligibility.checkCanStart(assessment, userId, now).isSuccess();
        }

        boolean reviewAvailable = terminal && assessment.isAllowReview();
        List<QuestionReview> review = reviewAvailable ? buildReview(session, answers) : List.of();

        log.debug("Summary for session {}: status={} answered={}/{}", sessionId, session.getStatus(),
                answers.size(), session.getQuestionOrder().size());

        return Result.success(new SessionSummary(
                session.getId(),
                assessment.getId(),
                assessment.getTitle(),
                session.getStatus(),
                session.getStartedAt(),
                SessionDeadline.deadlineAt(session, assessment),
                session.getCompletedAt(),
                terminal ? 0L : SessionDeadline.remainingSeconds(session, assessment, now),
                session.getQuestionOrder().size(),
                answers.size(),
                session.getScore(),
                session.getPassed(),
                assessment.getPassScore(),
                session.getTabSwitchCount(),
                canRetake,
                cooldownEndsAt,
                reviewAvailable,
                review
        ));
    }

    private List<QuestionReview> buildReview(AssessmentSession session, List<SessionAnswer> answers) {
        Map<UUID, SessionAnswer> byQuestion = answers.stream()
                .collect(Collectors.toMap(SessionAnswer::getQuestionId, Function.identity()));
        List<QuestionContent> questions = questionSetResolver.resolve(List.copyOf(session.getQuestionOrder()));
        return questions.stream()
                .map(q -> {
                    SessionAnswer answer = byQuestion.get(q.questionId());
                    Integer selected = answer != null ? answer.getSelectedIndex() : null;
                    boolean correct = selected != null && selected == q.correctIndex();
                    return new QuestionReview(q.questionId(), q.stem(), q.options(), selected, q.correctIndex(), correct);
                })
                .toList();
    }
}
