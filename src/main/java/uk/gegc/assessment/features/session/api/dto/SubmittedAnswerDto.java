package uk.gegc.assessment.features.session.api.dto;

import java.time.Instant;
import java.util.UUID;

public record SubmittedAnswerDto(UUID questionId, int selectedIndex, Instant submittedAt) {
}
