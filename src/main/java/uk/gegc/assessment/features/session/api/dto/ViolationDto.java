package uk.gegc.assessment.features.session.api.dto;

import uk.gegc.assessment.features.session.domain.model.ViolationType;

import java.time.Instant;

public record ViolationDto(int sequence, Instant timestamp, ViolationType type) {
}
