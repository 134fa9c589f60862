package uk.gegc.assessment.features.session.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;

import java.util.List;
import java.util.UUID;

@Schema(name = "ViolationReportDto", description = "Focus-loss log of a session, oldest first")
public record ViolationReportDto(
        UUID sessionId,
        UUID userId,
        @Schema(description = "Candidate email, or a short user label when none is on file") String candidateEmail,
        String assessmentTitle,
        int tabSwitchCount,
        List<ViolationDto> violations
) {
}
