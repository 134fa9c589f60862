package uk.gegc.assessment.features.session.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.Size;

@Schema(name = "StartSessionRequest", description = "Optional payload for starting a session")
public record StartSessionRequest(
        @Schema(description = "Access code, required only when the assessment has one", example = "SPRING24")
        @Size(max = 64, message = "Access code must not exceed 64 characters")
        String accessCode
) {
}
