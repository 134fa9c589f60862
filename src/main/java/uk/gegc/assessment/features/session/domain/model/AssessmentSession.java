package uk.gegc.assessment.features.session.domain.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * One timed attempt of a user at an assessment.
 * <p>
 * {@code activeSlot} is {@code TRUE} while the session is in progress and {@code NULL} once it is
 * terminal. Together with the unique key on (user, assessment, active_slot) it lets the database
 * reject a second in-progress session, since NULLs never collide in a unique index.
 * </p>
 */
@Entity
@Getter
@Setter
@Table(name = "assessment_sessions",
        uniqueConstraints = @UniqueConstraint(
                name = "uk_session_active_slot",
                columnNames = {"user_id", "assessment_id", "active_slot"}))
public class AssessmentSession {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", updatable = false, nullable = false)
    private UUID id;

    @Column(name = "assessment_id", nullable = false, updatable = false)
    private UUID assessmentId;

    @Column(name = "user_id", nullable = false, updatable = false)
    private UUID userId;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private SessionStatus status = SessionStatus.IN_PROGRESS;

    @Column(name = "active_slot")
    private Boolean activeSlot = Boolean.TRUE;

    @Column(name = "started_at", nullable = false, updatable = false)
    private Instant startedAt;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "session_question_order", joinColumns = @JoinColumn(name = "session_id"))
    @OrderColumn(name = "position")
    @Column(name = "question_id", nullable = false)
    private List<UUID> questionOrder = new ArrayList<>();

    @Column(name = "tab_switch_count", nullable = false)
    private int tabSwitchCount;

    @Column(name = "score")
    private Integer score;

    @Column(name = "passed")
    private Boolean passed;

    @Column(name = "completed_at")
    private Instant completedAt;

    @Column(name = "ip_address", length = 45)
    private String ipAddress;

    @Column(name = "last_activity_at")
    private Instant lastActivityAt;

    public boolean isInProgress() {
        return status == SessionStatus.IN_PROGRESS;
    }

    public boolean isOwnedBy(UUID candidateId) {
        return userId != null && userId.equals(candidateId);
    }
}
