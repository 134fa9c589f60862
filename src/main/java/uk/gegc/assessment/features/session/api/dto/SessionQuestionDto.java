package uk.gegc.assessment.features.session.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;

import java.util.List;
import java.util.UUID;

@Schema(name = "SessionQuestionDto", description = "Question shown to the candidate; carries no answer key")
public record SessionQuestionDto(
        UUID questionId,

        @Schema(description = "Zero-based position in the session order", example = "0")
        int position,

        String stem,
        List<String> options
) {
}
