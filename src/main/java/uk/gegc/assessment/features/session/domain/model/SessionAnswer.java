package uk.gegc.assessment.features.session.domain.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.time.Instant;
import java.util.UUID;

@Entity
@Getter
@Setter
@Table(name = "session_answers",
        uniqueConstraints = @UniqueConstraint(
                name = "uk_session_answer_question",
                columnNames = {"session_id", "question_id"}))
public class SessionAnswer {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", updatable = false, nullable = false)
    private UUID id;

    @Column(name = "session_id", nullable = false, updatable = false)
    private UUID sessionId;

    @Column(name = "question_id", nullable = false, updatable = false)
    private UUID questionId;

    @Column(name = "selected_index", nullable = false)
    private int selectedIndex;

    // null until the session is scored
    @Column(name = "is_correct")
    private Boolean correct;

    @Column(name = "submitted_at", nullable = false)
    private Instant submittedAt;

    @Column(name = "client_remaining_seconds")
    private Long clientRemainingSeconds;
}
