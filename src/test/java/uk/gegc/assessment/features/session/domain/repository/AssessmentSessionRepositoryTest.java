package uk.gegc.assessment.features.session.domain.repository;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.jdbc.AutoConfigureTestDatabase;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.test.autoconfigure.orm.jpa.TestEntityManager;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.test.context.ActiveProfiles;
import uk.gegc.assessment.features.session.domain.model.AssessmentSession;
import uk.gegc.assessment.features.session.domain.model.SessionAnswer;
import uk.gegc.assessment.features.session.domain.model.SessionStatus;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DataJpaTest
@ActiveProfiles("test")
@AutoConfigureTestDatabase(replace = AutoConfigureTestDatabase.Replace.NONE)
@DisplayName("AssessmentSessionRepository")
class AssessmentSessionRepositoryTest {

    private static final Instant STARTED = Instant.parse("2024-01-01T11:30:00Z");
    private static final Instant NOW = Instant.parse("2024-01-01T12:00:00Z");

    @Autowired
    private AssessmentSessionRepository sessionRepository;

    @Autowired
    private SessionAnswerRepository answerRepository;

    @Autowired
    private TestEntityManager entityManager;

    private UUID userId;
    private UUID assessmentId;

    @BeforeEach
    void setUp() {
        userId = UUID.randomUUID();
        assessmentId = UUID.randomUUID();
    }

    @Test
    @DisplayName("a second in-progress session for the same candidate and assessment violates the active slot")
    void duplicateInProgress_rejected() {
        sessionRepository.saveAndFlush(newSession());

        assertThatThrownBy(() -> sessionRepository.saveAndFlush(newSession()))
                .isInstanceOf(DataIntegrityViolationException.class);
    }

    @Test
    @DisplayName("completion swaps exactly once and frees the active slot")
    void completeIfInProgress_swapsOnce() {
        AssessmentSession session = sessionRepository.saveAndFlush(newSession());

        int first = sessionRepository.completeIfInProgress(session.getId(), SessionStatus.COMPLETED, 80, true, NOW);
        int second = sessionRepository.completeIfInProgress(session.getId(), SessionStatus.TIMED_OUT, 10, false, NOW.plusSeconds(5));

        assertThat(first).isEqualTo(1);
        assertThat(second).isZero();
        AssessmentSession stored = sessionRepository.findById(session.getId()).orElseThrow();
        assertThat(stored.getStatus()).isEqualTo(SessionStatus.COMPLETED);
        assertThat(stored.getScore()).isEqualTo(80);
        assertThat(stored.getPassed()).isTrue();
        assertThat(stored.getCompletedAt()).isEqualTo(NOW);
        assertThat(stored.getActiveSlot()).isNull();

        AssessmentSession retake = sessionRepository.saveAndFlush(newSession());
        assertThat(sessionRepository.findInProgress(userId, assessmentId))
                .map(AssessmentSession::getId)
                .contains(retake.getId());
    }

    @Test
    @DisplayName("tab switches increment in place and stop once the session is closed")
    void incrementTabSwitchCount_inPlace() {
        AssessmentSession session = sessionRepository.saveAndFlush(newSession());

        assertThat(sessionRepository.incrementTabSwitchCount(session.getId(), userId, NOW)).isEqualTo(1);
        assertThat(sessionRepository.incrementTabSwitchCount(session.getId(), userId, NOW)).isEqualTo(1);
        assertThat(sessionRepository.incrementTabSwitchCount(session.getId(), UUID.randomUUID(), NOW)).isZero();
        assertThat(sessionRepository.findTabSwitchCount(session.getId())).isEqualTo(2);

        sessionRepository.completeIfInProgress(session.getId(), SessionStatus.COMPLETED, 50, false, NOW);

        assertThat(sessionRepository.incrementTabSwitchCount(session.getId(), userId, NOW)).isZero();
        assertThat(sessionRepository.findTabSwitchCount(session.getId())).isEqualTo(2);
    }

    @Test
    @DisplayName("touch only matches the owner's in-progress session")
    void touchIfInProgress_ownerOnly() {
        AssessmentSession session = sessionRepository.saveAndFlush(newSession());

        assertThat(sessionRepository.touchIfInProgress(session.getId(), UUID.randomUUID(), NOW)).isZero();
        assertThat(sessionRepository.touchIfInProgress(session.getId(), userId, NOW)).isEqualTo(1);
    }

    @Test
    @DisplayName("question order survives a round trip in its original sequence")
    void questionOrder_persisted() {
        AssessmentSession session = newSession();
        List<UUID> order = List.of(UUID.randomUUID(), UUID.randomUUID(), UUID.randomUUID());
        session.setQuestionOrder(new ArrayList<>(order));
        UUID id = sessionRepository.saveAndFlush(session).getId();
        entityManager.clear();

        assertThat(sessionRepository.findById(id).orElseThrow().getQuestionOrder()).containsExactlyElementsOf(order);
    }

    @Test
    @DisplayName("terminal attempts are counted and the latest completion is found")
    void terminalQueries() {
        AssessmentSession older = sessionRepository.saveAndFlush(newSession());
        sessionRepository.completeIfInProgress(older.getId(), SessionStatus.TIMED_OUT, 30, false, NOW.minusSeconds(3600));
        AssessmentSession newer = sessionRepository.saveAndFlush(newSession());
        sessionRepository.completeIfInProgress(newer.getId(), SessionStatus.COMPLETED, 90, true, NOW);
        sessionRepository.saveAndFlush(newSession());

        assertThat(sessionRepository.countByUserIdAndAssessmentIdAndStatusIn(userId, assessmentId,
                List.of(SessionStatus.COMPLETED, SessionStatus.TIMED_OUT))).isEqualTo(2);
        assertThat(sessionRepository
                .findFirstByUserIdAndAssessmentIdAndCompletedAtIsNotNullOrderByCompletedAtDesc(userId, assessmentId))
                .map(AssessmentSession::getId)
                .contains(newer.getId());
    }

    @Test
    @DisplayName("one answer per question and only graded answers are reported as scored")
    void answers_uniqueAndScored() {
        AssessmentSession session = sessionRepository.saveAndFlush(newSession());
        UUID q1 = UUID.randomUUID();
        UUID q2 = UUID.randomUUID();
        answerRepository.saveAndFlush(answer(session.getId(), q1, true));
        answerRepository.saveAndFlush(answer(session.getId(), q2, null));

        assertThat(answerRepository.findScoredBySessionIds(List.of(session.getId())))
                .extracting(SessionAnswer::getQuestionId)
                .containsExactly(q1);
        assertThatThrownBy(() -> answerRepository.saveAndFlush(answer(session.getId(), q1, null)))
                .isInstanceOf(DataIntegrityViolationException.class);
    }

    private AssessmentSession newSession() {
        AssessmentSession session = new AssessmentSession();
        session.setAssessmentId(assessmentId);
        session.setUserId(userId);
        session.setStatus(SessionStatus.IN_PROGRESS);
        session.setActiveSlot(Boolean.TRUE);
        session.setStartedAt(STARTED);
        session.setQuestionOrder(new ArrayList<>(List.of(UUID.randomUUID())));
        return session;
    }

    private static SessionAnswer answer(UUID sessionId, UUID questionId, Boolean correct) {
        SessionAnswer answer = new SessionAnswer();
        answer.setSessionId(sessionId);
        answer.setQuestionId(questionId);
        answer.setSelectedIndex(0);
        answer.setCorrect(correct);
        answer.setSubmittedAt(NOW);
        return answer;
    }
}
