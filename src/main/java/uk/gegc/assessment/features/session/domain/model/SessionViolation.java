package uk.gegc.assessment.features.session.domain.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.time.Instant;
import java.util.UUID;

/**
 * Append-only proctoring log entry. {@code sequence} mirrors the session's tab switch counter
 * at the moment the entry was written, so entries order the same way the counter grew.
 */
@Entity
@Getter
@Setter
@Table(name = "session_violations",
        uniqueConstraints = @UniqueConstraint(
                name = "uk_session_violation_seq",
                columnNames = {"session_id", "sequence_no"}))
public class SessionViolation {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", updatable = false, nullable = false)
    private UUID id;

    @Column(name = "session_id", nullable = false, updatable = false)
    private UUID sessionId;

    @Column(name = "sequence_no", nullable = false, updatable = false)
    private int sequence;

    @Column(name = "occurred_at", nullable = false, updatable = false)
    private Instant occurredAt;

    @Enumerated(EnumType.STRING)
    @Column(name = "type", nullable = false, length = 30, updatable = false)
    private ViolationType type;
}
