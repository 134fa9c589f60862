package uk.gegc.assessment.features.analytics.api.dto;

import uk.gegc.assessment.features.assessment.domain.model.AssessmentStatus;

import java.util.UUID;

public record AssessmentBreakdownDto(
        UUID id,
        String title,
        AssessmentStatus status,
        long sessions,
        long completedCount,
        int avgScore,
        int passRate
) {
}
