package uk.gegc.assessment.features.analytics.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;

@Schema(name = "ScoreBucketDto", description = "One of ten fixed-width score ranges")
public record ScoreBucketDto(
        @Schema(description = "Bucket index, 0 to 9", example = "7")
        int index,

        @Schema(description = "Human readable range", example = "71-80")
        String range,

        @Schema(description = "Attempts whose score falls in this bucket", example = "4")
        long count
) {
}
