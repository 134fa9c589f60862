package uk.gegc.assessment.features.session.application;

import java.time.Instant;
import java.util.UUID;

public record AnswerReceipt(UUID sessionId, UUID questionId, int selectedIndex, Instant submittedAt) {
}
