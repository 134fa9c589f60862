package uk.gegc.assessment.features.session.application;

import java.util.Map;
import java.util.UUID;

/**
 * Outcome of grading one session: the percentage score, the pass decision and the correctness of
 * every question in the session's order.
 */
public record ScoreCard(int correctCount, int score, boolean passed, Map<UUID, Boolean> correctness) {

    public ScoreCard {
        correctness = Map.copyOf(correctness);
    }
}
