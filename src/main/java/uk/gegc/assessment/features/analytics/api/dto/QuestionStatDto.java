package uk.gegc.assessment.features.analytics.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;

import java.util.UUID;

@Schema(name = "QuestionStatDto", description = "Correct-answer rate of one question across scored attempts")
public record QuestionStatDto(
        UUID questionId,

        @Schema(description = "Question stem, truncated to 80 characters")
        String stem,

        @Schema(description = "Scored answers to this question", example = "12")
        long totalAnswers,

        @Schema(description = "Rounded percentage of correct answers", example = "58")
        int percentCorrect
) {
}
