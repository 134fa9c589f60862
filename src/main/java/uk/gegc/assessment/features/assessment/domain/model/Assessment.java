package uk.gegc.assessment.features.assessment.domain.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.time.Instant;
import java.util.UUID;

/**
 * Timed exam configuration. Authored by the content-management service; the session engine
 * only reads it.
 */
@Entity
@Getter
@Setter
@Table(name = "assessments")
public class Assessment {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", updatable = false, nullable = false)
    private UUID id;

    @Column(name = "org_id", nullable = false)
    private UUID organizationId;

    @Column(name = "deck_id", nullable = false)
    private UUID deckId;

    @Column(name = "title", nullable = false, length = 255)
    private String title;

    @Column(name = "question_count", nullable = false)
    private int questionCount;

    @Column(name = "time_limit_minutes", nullable = false)
    private int timeLimitMinutes;

    @Column(name = "pass_score", nullable = false)
    private int passScore;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private AssessmentStatus status = AssessmentStatus.DRAFT;

    @Column(name = "start_date")
    private Instant startDate;

    @Column(name = "end_date")
    private Instant endDate;

    @Column(name = "access_code", length = 64)
    private String accessCode;

    @Column(name = "max_attempts")
    private Integer maxAttempts;

    @Column(name = "cooldown_minutes")
    private Integer cooldownMinutes;

    @Column(name = "shuffle_questions", nullable = false)
    private boolean shuffleQuestions;

    @Column(name = "allow_review", nullable = false)
    private boolean allowReview = true;

    public boolean isPublished() {
        return status == AssessmentStatus.PUBLISHED;
    }

    /**
     * Whether {@code now} falls inside the optional scheduling window. Open ends are unbounded.
     */
    public boolean isOpenAt(Instant now) {
        if (startDate != null && now.isBefore(startDate)) {
            return false;
        }
        return endDate == null || !now.isAfter(endDate);
    }

    public long timeLimitSeconds() {
        return timeLimitMinutes * 60L;
    }
}
