package uk.gegc.assessment.features.session.application;

import org.springframework.stereotype.Service;
import uk.gegc.assessment.features.assessment.application.QuestionContent;
import uk.gegc.assessment.features.session.domain.model.SessionAnswer;

import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Pure grading arithmetic. An unanswered question, or one whose key is missing, counts as incorrect.
 */
@Service
public class ScoringService {

    public ScoreCard grade(List<UUID> questionOrder,
                           Collection<QuestionContent> answerKey,
                           Collection<SessionAnswer> answers,
                           int questionCount,
                           int passScore) {
        Map<UUID, Integer> keyById = answerKey.stream()
                .collect(Collectors.toMap(QuestionContent::questionId, QuestionContent::correctIndex, (a, b) -> a));
        Map<UUID, SessionAnswer> answerById = answers.stream()
                .collect(Collectors.toMap(SessionAnswer::getQuestionId, Function.identity(), (a, b) -> b));

        Map<UUID, Boolean> correctness = new HashMap<>();
        int correct = 0;
        for (UUID questionId : questionOrder) {
            SessionAnswer answer = answerById.get(questionId);
            Integer key = keyById.get(questionId);
            boolean isCorrect = answer != null && key != null && answer.getSelectedIndex() == key;
            correctness.put(questionId, isCorrect);
            if (isCorrect) {
                correct++;
            }
        }
        int score = percentage(correct, questionCount);
        return new ScoreCard(correct, score, score >= passScore, correctness);
    }

    public static int percentage(int correct, int questionCount) {
        if (questionCount <= 0) {
            return 0;
        }
        return (int) Math.round(100.0 * correct / questionCount);
    }
}
