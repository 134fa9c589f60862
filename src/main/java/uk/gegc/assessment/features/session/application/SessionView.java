package uk.gegc.assessment.features.session.application;

import uk.gegc.assessment.features.assessment.application.QuestionContent;
import uk.gegc.assessment.features.assessment.domain.model.Assessment;
import uk.gegc.assessment.features.session.domain.model.AssessmentSession;
import uk.gegc.assessment.features.session.domain.model.SessionAnswer;

import java.time.Instant;
import java.util.List;

/**
 * What a candidate gets back from start or resume. Still carries the answer key inside
 * {@link QuestionContent}; the web mapper strips it.
 */
public record SessionView(
        AssessmentSession session,
        Assessment assessment,
        List<QuestionContent> questions,
        List<SessionAnswer> answers,
        long remainingSeconds,
        Instant deadlineAt,
        Instant serverTime
) {
}
