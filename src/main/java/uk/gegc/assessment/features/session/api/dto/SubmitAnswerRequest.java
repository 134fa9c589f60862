package uk.gegc.assessment.features.session.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;

import java.util.UUID;

@Schema(name = "SubmitAnswerRequest", description = "Answer to one question; resubmitting overwrites the previous choice")
public record SubmitAnswerRequest(
        @Schema(description = "Question being answered", requiredMode = Schema.RequiredMode.REQUIRED)
        @NotNull(message = "Question ID is required")
        UUID questionId,

        @Schema(description = "Zero-based index of the chosen option", requiredMode = Schema.RequiredMode.REQUIRED, example = "2")
        @NotNull(message = "Selected index is required")
        @Min(value = 0, message = "Selected index must not be negative")
        Integer selectedIndex,

        @Schema(description = "Client countdown value, used for clock drift diagnostics only", example = "1200")
        @Min(value = 0, message = "Remaining seconds must not be negative")
        Long clientRemainingSeconds
) {
}
