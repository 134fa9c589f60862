package uk.gegc.assessment.features.session.domain.repository;

import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import uk.gegc.assessment.features.session.domain.model.AssessmentSession;
import uk.gegc.assessment.features.session.domain.model.SessionStatus;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface AssessmentSessionRepository extends JpaRepository<AssessmentSession, UUID> {

    Optional<AssessmentSession> findByIdAndUserId(UUID id, UUID userId);

    @Query("""
            SELECT s
            FROM AssessmentSession s
            WHERE s.userId = :userId
              AND s.assessmentId = :assessmentId
              AND s.status = uk.gegc.assessment.features.session.domain.model.SessionStatus.IN_PROGRESS
            """)
    Optional<AssessmentSession> findInProgress(@Param("userId") UUID userId,
                                               @Param("assessmentId") UUID assessmentId);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT s FROM AssessmentSession s WHERE s.id = :id")
    Optional<AssessmentSession> findByIdForUpdate(@Param("id") UUID id);

    /**
     * Compare-and-swap transition out of {@code IN_PROGRESS}. Returns 0 when another caller
     * already finalized the session.
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
            UPDATE AssessmentSession s
            SET s.status = :status,
                s.score = :score,
                s.passed = :passed,
                s.completedAt = :completedAt,
                s.activeSlot = NULL
            WHERE s.id = :id
              AND s.status = uk.gegc.assessment.features.session.domain.model.SessionStatus.IN_PROGRESS
            """)
    int completeIfInProgress(@Param("id") UUID id,
                             @Param("status") SessionStatus status,
                             @Param("score") int score,
                             @Param("passed") boolean passed,
                             @Param("completedAt") Instant completedAt);

    /**
     * Stamps activity on an in-progress session owned by {@code userId}. The update also takes the
     * row lock, which serializes the caller against a concurrent completion.
     */
    @Modifying(flushAutomatically = true)
    @Query("""
            UPDATE AssessmentSession s
            SET s.lastActivityAt = :now
            WHERE s.id = :id
              AND s.userId = :userId
              AND s.status = uk.gegc.assessment.features.session.domain.model.SessionStatus.IN_PROGRESS
            """)
    int touchIfInProgress(@Param("id") UUID id, @Param("userId") UUID userId, @Param("now") Instant now);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
            UPDATE AssessmentSession s
            SET s.tabSwitchCount = s.tabSwitchCount + 1,
                s.lastActivityAt = :now
            WHERE s.id = :id
              AND s.userId = :userId
              AND s.status = uk.gegc.assessment.features.session.domain.model.SessionStatus.IN_PROGRESS
            """)
    int incrementTabSwitchCount(@Param("id") UUID id, @Param("userId") UUID userId, @Param("now") Instant now);

    @Query("SELECT s.tabSwitchCount FROM AssessmentSession s WHERE s.id = :id")
    int findTabSwitchCount(@Param("id") UUID id);

    long countByUserIdAndAssessmentIdAndStatusIn(UUID userId, UUID assessmentId, Collection<SessionStatus> statuses);

    Optional<AssessmentSession> findFirstByUserIdAndAssessmentIdAndCompletedAtIsNotNullOrderByCompletedAtDesc(
            UUID userId, UUID assessmentId);

    List<AssessmentSession> findByAssessmentId(UUID assessmentId);

    List<AssessmentSession> findByAssessmentIdIn(Collection<UUID> assessmentIds);
}
