package uk.gegc.assessment.features.session.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import uk.gegc.assessment.features.session.domain.model.CompletionReason;

@Schema(name = "CompleteSessionRequest", description = "Why the client is finishing the session")
public record CompleteSessionRequest(
        @Schema(description = "MANUAL for a finish click, EXPIRED when the countdown reached zero. Defaults to MANUAL.",
                example = "MANUAL")
        CompletionReason reason
) {
    public CompleteSessionRequest {
        if (reason == null) {
            reason = CompletionReason.MANUAL;
        }
    }
}
