package uk.gegc.assessment.features.session.application;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;
import uk.gegc.assessment.features.session.domain.model.AssessmentSession;
import uk.gegc.assessment.features.session.domain.model.SessionAnswer;
import uk.gegc.assessment.features.session.domain.model.SessionStatus;
import uk.gegc.assessment.features.session.domain.repository.AssessmentSessionRepository;
import uk.gegc.assessment.features.session.domain.repository.SessionAnswerRepository;

import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Short transactions around session rows. Each method commits on its own so that callers can
 * react to a unique-key violation on {@link #create} by reading the row that won.
 */
@Component
@RequiredArgsConstructor
public class SessionStore {

    private static final EnumSet<SessionStatus> TERMINAL = EnumSet.of(SessionStatus.COMPLETED, SessionStatus.TIMED_OUT);

    private final AssessmentSessionRepository sessionRepository;
    private final SessionAnswerRepository answerRepository;

    /**
     * Inserts a new in-progress session. Throws
     * {@link org.springframework.dao.DataIntegrityViolationException} when the user already holds
     * one for the same assessment.
     */
    @Transactional
    public AssessmentSession create(UUID userId, UUID assessmentId, List<UUID> questionOrder,
                                    Instant startedAt, String ipAddress) {
        AssessmentSession session = new AssessmentSession();
        session.setUserId(userId);
        session.setAssessmentId(assessmentId);
        session.setStatus(SessionStatus.IN_PROGRESS);
        session.setActiveSlot(Boolean.TRUE);
        session.setQuestionOrder(new ArrayList<>(questionOrder));
        session.setStartedAt(startedAt);
        session.setLastActivityAt(startedAt);
        session.setIpAddress(ipAddress);
        return sessionRepository.saveAndFlush(session);
    }

    @Transactional(readOnly = true)
    public Optional<AssessmentSession> findInProgress(UUID userId, UUID assessmentId) {
        return sessionRepository.findInProgress(userId, assessmentId);
    }

    @Transactional(readOnly = true)
    public Optional<AssessmentSession> findOwned(UUID sessionId, UUID userId) {
        return sessionRepository.findByIdAndUserId(sessionId, userId);
    }

    @Transactional(readOnly = true)
    public long countTerminal(UUID userId, UUID assessmentId) {
        return sessionRepository.countByUserIdAndAssessmentIdAndStatusIn(userId, assessmentId, TERMINAL);
    }

    @Transactional(readOnly = true)
    public Optional<Instant> lastCompletedAt(UUID userId, UUID assessmentId) {
        return sessionRepository
                .findFirstByUserIdAndAssessmentIdAndCompletedAtIsNotNullOrderByCompletedAtDesc(userId, assessmentId)
                .map(AssessmentSession::getCompletedAt);
    }

    @Transactional(readOnly = true)
    public List<SessionAnswer> answersOf(UUID sessionId) {
        return answerRepository.findBySessionId(sessionId);
    }
}
