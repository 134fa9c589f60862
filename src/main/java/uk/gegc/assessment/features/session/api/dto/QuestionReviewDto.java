package uk.gegc.assessment.features.session.api.dto;

import java.util.List;
import java.util.UUID;

public record QuestionReviewDto(
        UUID questionId,
        String stem,
        List<String> options,
        Integer selectedIndex,
        int correctIndex,
        boolean correct
) {
}
