package uk.gegc.assessment.features.assessment.application;

import java.util.List;
import java.util.UUID;

/**
 * Resolved question, including the answer key. Must not be serialized to candidates
 * before the owning session is terminal.
 */
public record QuestionContent(UUID questionId, String stem, List<String> options, int correctIndex) {

    public QuestionContent {
        options = List.copyOf(options);
    }

    public boolean isValidIndex(int index) {
        return index >= 0 && index < options.size();
    }
}
