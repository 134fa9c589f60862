package uk.gegc.assessment.features.session.domain.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;
import uk.gegc.assessment.features.session.domain.model.SessionViolation;

import java.util.List;
import java.util.UUID;

@Repository
public interface SessionViolationRepository extends JpaRepository<SessionViolation, UUID> {

    List<SessionViolation> findBySessionIdOrderBySequenceAsc(UUID sessionId);
}
