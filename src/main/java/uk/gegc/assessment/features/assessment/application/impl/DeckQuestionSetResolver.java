package uk.gegc.assessment.features.assessment.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import uk.gegc.assessment.features.assessment.application.QuestionContent;
import uk.gegc.assessment.features.assessment.application.QuestionSetResolver;
import uk.gegc.assessment.features.assessment.domain.model.Assessment;
import uk.gegc.assessment.features.assessment.domain.model.Question;
import uk.gegc.assessment.features.assessment.domain.repository.QuestionRepository;
import uk.gegc.assessment.shared.result.ErrorKind;
import uk.gegc.assessment.shared.result.Result;

import java.security.SecureRandom;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Random;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;

@Service
@RequiredArgsConstructor
@Slf4j
public class DeckQuestionSetResolver implements QuestionSetResolver {

    private final QuestionRepository questionRepository;
    private final Random random = new SecureRandom();

    @Override
    @Transactional(readOnly = true)
    public Result<List<UUID>> drawQuestionOrder(Assessment assessment) {
        List<Question> deck = questionRepository.findByDeckIdOrderByPositionAsc(assessment.getDeckId());
        if (deck.size() < assessment.getQuestionCount() || assessment.getQuestionCount() <= 0) {
            log.warn("Assessment {} needs {} questions but deck {} has {}",
                    assessment.getId(), assessment.getQuestionCount(), assessment.getDeckId(), deck.size());
            return Result.failure(ErrorKind.NOT_AVAILABLE, "Assessment does not have enough questions");
        }
        List<UUID> order = new ArrayList<>(deck.subList(0, assessment.getQuestionCount()).stream()
                .map(Question::getId)
                .toList());
        if (assessment.isShuffleQuestions()) {
            Collections.shuffle(order, random);
        }
        return Result.success(List.copyOf(order));
    }

    @Override
    @Transactional(readOnly = true)
    public List<QuestionContent> resolve(List<UUID> questionOrder) {
        if (questionOrder == null || questionOrder.isEmpty()) {
            return List.of();
        }
        Map<UUID, Question> byId = questionRepository.findByIdIn(questionOrder).stream()
                .collect(Collectors.toMap(Question::getId, Function.identity()));
        return questionOrder.stream()
                .map(byId::get)
                .filter(Objects::nonNull)
                .map(q -> new QuestionContent(q.getId(), q.getStem(), q.getOptions(), q.getCorrectIndex()))
                .toList();
    }
}
