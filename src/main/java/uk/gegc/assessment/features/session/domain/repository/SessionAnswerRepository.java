package uk.gegc.assessment.features.session.domain.repository;

import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import uk.gegc.assessment.features.session.domain.model.SessionAnswer;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface SessionAnswerRepository extends JpaRepository<SessionAnswer, UUID> {

    List<SessionAnswer> findBySessionId(UUID sessionId);

    /**
     * Locking read of the answer for one question. A locking read sees the latest committed row
     * even under REPEATABLE READ, so an upsert that follows never inserts a duplicate.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT a FROM SessionAnswer a WHERE a.sessionId = :sessionId AND a.questionId = :questionId")
    Optional<SessionAnswer> findForUpdate(@Param("sessionId") UUID sessionId, @Param("questionId") UUID questionId);

    long countBySessionId(UUID sessionId);

    @Query("""
            SELECT a
            FROM SessionAnswer a
            WHERE a.sessionId IN :sessionIds
              AND a.correct IS NOT NULL
            """)
    List<SessionAnswer> findScoredBySessionIds(@Param("sessionIds") Collection<UUID> sessionIds);
}
