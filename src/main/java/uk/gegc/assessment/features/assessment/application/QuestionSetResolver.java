package uk.gegc.assessment.features.assessment.application;

import uk.gegc.assessment.features.assessment.domain.model.Assessment;
import uk.gegc.assessment.shared.result.Result;

import java.util.List;
import java.util.UUID;

/**
 * Read-only gateway to the question bank.
 */
public interface QuestionSetResolver {

    /**
     * Picks the fixed question order of a new session: the first {@code questionCount}
     * questions of the assessment's deck by position, shuffled once when the assessment asks for it.
     * Fails with {@code NOT_AVAILABLE} when the deck is too small.
     */
    Result<List<UUID>> drawQuestionOrder(Assessment assessment);

    /**
     * Loads the content of {@code questionOrder}, preserving its order. Ids no longer present in
     * the bank are skipped.
     */
    List<QuestionContent> resolve(List<UUID> questionOrder);
}
