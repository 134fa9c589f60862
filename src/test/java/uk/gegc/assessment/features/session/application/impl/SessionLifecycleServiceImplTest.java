package uk.gegc.assessment.features.session.application.impl;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.springframework.dao.DataIntegrityViolationException;
import uk.gegc.assessment.BaseUnitTest;
import uk.gegc.assessment.features.assessment.application.QuestionSetResolver;
import uk.gegc.assessment.features.assessment.domain.model.Assessment;
import uk.gegc.assessment.features.assessment.domain.model.AssessmentStatus;
import uk.gegc.assessment.features.assessment.domain.repository.AssessmentRepository;
import uk.gegc.assessment.features.session.application.AttemptEligibility;
import uk.gegc.assessment.features.session.application.CompletionResult;
import uk.gegc.assessment.features.session.application.CompletionService;
import uk.gegc.assessment.features.session.application.SessionStore;
import uk.gegc.assessment.features.session.application.SessionView;
import uk.gegc.assessment.features.session.domain.model.AssessmentSession;
import uk.gegc.assessment.features.session.domain.model.CompletionReason;
import uk.gegc.assessment.features.session.domain.model.SessionStatus;
import uk.gegc.assessment.shared.result.ErrorKind;
import uk.gegc.assessment.shared.result.Result;
import uk.gegc.assessment.testsupport.TestFixtures;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@DisplayName("SessionLifecycleServiceImpl")
class SessionLifecycleServiceImplTest extends BaseUnitTest {

    private static final String IP = "203.0.113.7";

    @Mock
    private AssessmentRepository assessmentRepository;
    @Mock
    private SessionStore sessionStore;
    @Mock
    private QuestionSetResolver questionSetResolver;
    @Mock
    private CompletionService completionService;

    private SessionLifecycleServiceImpl service;

    private UUID userId;
    private Assessment assessment;
    private List<UUID> order;

    @BeforeEach
    void setUp() {
        service = new SessionLifecycleServiceImpl(
                assessmentRepository,
                sessionStore,
                questionSetResolver,
                completionService,
                new AttemptEligibility(sessionStore),
                FIXED_CLOCK
        );
        userId = UUID.randomUUID();
        assessment = TestFixtures.publishedAssessment(4, 30, 70);
        order = TestFixtures.questionIds(4);
        when(assessmentRepository.findById(assessment.getId())).thenReturn(Optional.of(assessment));
    }

    @Test
    @DisplayName("first start creates a session with the full time limit and the drawn order")
    void firstStart_createsSession() {
        when(sessionStore.findInProgress(userId, assessment.getId())).thenReturn(Optional.empty());
        when(questionSetResolver.drawQuestionOrder(assessment)).thenReturn(Result.success(order));
        AssessmentSession created = TestFixtures.inProgressSession(assessment, userId, NOW, order);
        when(sessionStore.create(userId, assessment.getId(), order, NOW, IP)).thenReturn(created);
        when(questionSetResolver.resolve(order)).thenReturn(TestFixtures.answerKey(order));
        when(sessionStore.answersOf(created.getId())).thenReturn(List.of());

        SessionView view = service.startOrResume(userId, assessment.getId(), null, IP).orElseThrow();

        assertThat(view.session()).isSameAs(created);
        assertThat(view.remainingSeconds()).isEqualTo(1800);
        assertThat(view.deadlineAt()).isEqualTo(NOW.plusSeconds(1800));
        assertThat(view.serverTime()).isEqualTo(NOW);
        assertThat(view.questions()).extracting(q -> q.questionId()).containsExactlyElementsOf(order);
    }

    @Test
    @DisplayName("draft assessment is not available")
    void draft_notAvailable() {
        assessment.setStatus(AssessmentStatus.DRAFT);

        Result<SessionView> result = service.startOrResume(userId, assessment.getId(), null, IP);

        assertThat(failureKind(result)).isEqualTo(ErrorKind.NOT_AVAILABLE);
        verify(sessionStore, never()).create(any(), any(), anyList(), any(), any());
    }

    @Test
    @DisplayName("resume recomputes remaining time from the server clock and keeps the question order")
    void resume_recomputesRemaining() {
        AssessmentSession existing = TestFixtures.inProgressSession(assessment, userId, NOW.minus(Duration.ofMinutes(12)), order);
        when(sessionStore.findInProgress(userId, assessment.getId())).thenReturn(Optional.of(existing));
        when(questionSetResolver.resolve(order)).thenReturn(TestFixtures.answerKey(order));
        when(sessionStore.answersOf(existing.getId()))
                .thenReturn(List.of(TestFixtures.answer(existing.getId(), order.get(0), 2)));

        SessionView view = service.startOrResume(userId, assessment.getId(), "ignored", IP).orElseThrow();

        assertThat(view.session().getStatus()).isEqualTo(SessionStatus.IN_PROGRESS);
        assertThat(view.remainingSeconds()).isEqualTo(18 * 60);
        assertThat(view.answers()).hasSize(1);
        assertThat(view.session().getQuestionOrder()).containsExactlyElementsOf(order);
        verify(questionSetResolver, never()).drawQuestionOrder(any());
    }

    @Test
    @DisplayName("resume after the deadline finalizes the session as expired and returns it terminal")
    void resumeAfterDeadline_timesOut() {
        AssessmentSession existing = TestFixtures.inProgressSession(assessment, userId, NOW.minus(Duration.ofHours(2)), order);
        when(sessionStore.findInProgress(userId, assessment.getId())).thenReturn(Optional.of(existing));
        when(completionService.complete(existing.getId(), userId, CompletionReason.EXPIRED))
                .thenReturn(Result.success(new CompletionResult(existing.getId(), SessionStatus.TIMED_OUT, 25, false, NOW)));

        AssessmentSession terminal = TestFixtures.inProgressSession(assessment, userId, existing.getStartedAt(), order);
        terminal.setId(existing.getId());
        terminal.setStatus(SessionStatus.TIMED_OUT);
        terminal.setActiveSlot(null);
        terminal.setScore(25);
        terminal.setPassed(false);
        terminal.setCompletedAt(NOW);
        when(sessionStore.findOwned(existing.getId(), userId)).thenReturn(Optional.of(terminal));
        when(questionSetResolver.resolve(order)).thenReturn(TestFixtures.answerKey(order));
        when(sessionStore.answersOf(existing.getId())).thenReturn(List.of());

        SessionView view = service.startOrResume(userId, assessment.getId(), null, IP).orElseThrow();

        assertThat(view.session().getStatus()).isEqualTo(SessionStatus.TIMED_OUT);
        assertThat(view.session().getScore()).isEqualTo(25);
        assertThat(view.remainingSeconds()).isZero();
    }

    @Test
    @DisplayName("a concurrent double start resumes the winner's session instead of failing")
    void concurrentStart_resumesWinner() {
        AssessmentSession winner = TestFixtures.inProgressSession(assessment, userId, NOW, order);
        when(sessionStore.findInProgress(userId, assessment.getId()))
                .thenReturn(Optional.empty())
                .thenReturn(Optional.of(winner));
        when(questionSetResolver.drawQuestionOrder(assessment)).thenReturn(Result.success(order));
        when(sessionStore.create(userId, assessment.getId(), order, NOW, IP))
                .thenThrow(new DataIntegrityViolationException("uk_session_active_slot"));
        when(questionSetResolver.resolve(order)).thenReturn(TestFixtures.answerKey(order));
        when(sessionStore.answersOf(winner.getId())).thenReturn(List.of());

        SessionView view = service.startOrResume(userId, assessment.getId(), null, IP).orElseThrow();

        assertThat(view.session()).isSameAs(winner);
    }

    @Test
    @DisplayName("a lost start race whose winner already finished retries creation")
    void lostRaceWithFinishedWinner_retriesCreate() {
        AssessmentSession created = TestFixtures.inProgressSession(assessment, userId, NOW, order);
        when(sessionStore.findInProgress(userId, assessment.getId())).thenReturn(Optional.empty());
        when(questionSetResolver.drawQuestionOrder(assessment)).thenReturn(Result.success(order));
        when(sessionStore.create(userId, assessment.getId(), order, NOW, IP))
                .thenThrow(new DataIntegrityViolationException("uk_session_active_slot"))
                .thenReturn(created);
        when(questionSetResolver.resolve(order)).thenReturn(TestFixtures.answerKey(order));
        when(sessionStore.answersOf(created.getId())).thenReturn(List.of());

        SessionView view = service.startOrResume(userId, assessment.getId(), null, IP).orElseThrow();

        assertThat(view.session()).isSameAs(created);
        assertThat(view.remainingSeconds()).isEqualTo(1800);
        verify(sessionStore, times(2)).create(userId, assessment.getId(), order, NOW, IP);
    }

    @Test
    @DisplayName("a retried start still honours the attempt limit the finished winner used up")
    void lostRaceWithFinishedWinner_rechecksAttemptLimit() {
        assessment.setMaxAttempts(1);
        when(sessionStore.findInProgress(userId, assessment.getId())).thenReturn(Optional.empty());
        when(sessionStore.countTerminal(userId, assessment.getId())).thenReturn(0L, 1L);
        when(questionSetResolver.drawQuestionOrder(assessment)).thenReturn(Result.success(order));
        when(sessionStore.create(userId, assessment.getId(), order, NOW, IP))
                .thenThrow(new DataIntegrityViolationException("uk_session_active_slot"));

        Result<SessionView> result = service.startOrResume(userId, assessment.getId(), null, IP);

        assertThat(failureKind(result)).isEqualTo(ErrorKind.ATTEMPT_LIMIT_REACHED);
        verify(sessionStore, times(1)).create(any(), any(), anyList(), any(), any());
    }

    @Test
    @DisplayName("wrong access code is rejected on creation")
    void wrongAccessCode_rejected() {
        assessment.setAccessCode("SPRING24");
        when(sessionStore.findInProgress(userId, assessment.getId())).thenReturn(Optional.empty());

        Result<SessionView> result = service.startOrResume(userId, assessment.getId(), "WINTER", IP);

        assertThat(failureKind(result)).isEqualTo(ErrorKind.INVALID_ACCESS_CODE);
    }

    @Test
    @DisplayName("attempt limit blocks a new session")
    void attemptLimit_blocks() {
        assessment.setMaxAttempts(2);
        when(sessionStore.findInProgress(userId, assessment.getId())).thenReturn(Optional.empty());
        when(sessionStore.countTerminal(userId, assessment.getId())).thenReturn(2L);

        Result<SessionView> result = service.startOrResume(userId, assessment.getId(), null, IP);

        assertThat(failureKind(result)).isEqualTo(ErrorKind.ATTEMPT_LIMIT_REACHED);
    }

    @Test
    @DisplayName("cooldown after the last attempt blocks a new session")
    void cooldown_blocks() {
        assessment.setCooldownMinutes(60);
        when(sessionStore.findInProgress(userId, assessment.getId())).thenReturn(Optional.empty());
        when(sessionStore.lastCompletedAt(userId, assessment.getId()))
                .thenReturn(Optional.of(NOW.minus(Duration.ofMinutes(20))));

        Result<SessionView> result = service.startOrResume(userId, assessment.getId(), null, IP);

        assertThat(failureKind(result)).isEqualTo(ErrorKind.COOLDOWN_ACTIVE);
    }

    @Test
    @DisplayName("outside the scheduling window a new session is not available")
    void outsideWindow_notAvailable() {
        assessment.setEndDate(NOW.minusSeconds(1));
        when(sessionStore.findInProgress(userId, assessment.getId())).thenReturn(Optional.empty());

        Result<SessionView> result = service.startOrResume(userId, assessment.getId(), null, IP);

        assertThat(failureKind(result)).isEqualTo(ErrorKind.NOT_AVAILABLE);
    }

    @Test
    @DisplayName("a deck too small for the assessment makes it unavailable")
    void smallDeck_notAvailable() {
        when(sessionStore.findInProgress(userId, assessment.getId())).thenReturn(Optional.empty());
        when(questionSetResolver.drawQuestionOrder(assessment))
                .thenReturn(Result.failure(ErrorKind.NOT_AVAILABLE, "Assessment does not have enough questions"));

        Result<SessionView> result = service.startOrResume(userId, assessment.getId(), null, IP);

        assertThat(failureKind(result)).isEqualTo(ErrorKind.NOT_AVAILABLE);
    }
}
