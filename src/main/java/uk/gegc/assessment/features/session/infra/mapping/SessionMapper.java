package uk.gegc.assessment.features.session.infra.mapping;

import org.springframework.stereotype.Component;
import uk.gegc.assessment.features.assessment.application.QuestionContent;
import uk.gegc.assessment.features.session.api.dto.AnswerReceiptDto;
import uk.gegc.assessment.features.session.api.dto.CompletionResultDto;
import uk.gegc.assessment.features.session.api.dto.QuestionReviewDto;
import uk.gegc.assessment.features.session.api.dto.SessionQuestionDto;
import uk.gegc.assessment.features.session.api.dto.SessionStateDto;
import uk.gegc.assessment.features.session.api.dto.SessionSummaryDto;
import uk.gegc.assessment.features.session.api.dto.SubmittedAnswerDto;
import uk.gegc.assessment.features.session.api.dto.ViolationDto;
import uk.gegc.assessment.features.session.api.dto.ViolationReportDto;
import uk.gegc.assessment.features.session.application.AnswerReceipt;
import uk.gegc.assessment.features.session.application.CompletionResult;
import uk.gegc.assessment.features.session.application.SessionSummary;
import uk.gegc.assessment.features.session.application.SessionView;
import uk.gegc.assessment.features.session.application.ViolationReport;
import uk.gegc.assessment.features.session.domain.model.AssessmentSession;
import uk.gegc.assessment.features.session.domain.model.SessionAnswer;

import java.util.Comparator;
import java.util.List;
import java.util.stream.IntStream;

@Component
public class SessionMapper {

    public SessionStateDto toStateDto(SessionView view) {
        AssessmentSession session = view.session();
        List<QuestionContent> questions = view.questions();
        // correctIndex is dropped here
        List<SessionQuestionDto> questionDtos = IntStream.range(0, questions.size())
                .mapToObj(i -> new SessionQuestionDto(
                        questions.get(i).questionId(), i, questions.get(i).stem(), questions.get(i).options()))
                .toList();
        List<SubmittedAnswerDto> answers = view.answers().stream()
                .sorted(Comparator.comparing(SessionAnswer::getSubmittedAt))
                .map(a -> new SubmittedAnswerDto(a.getQuestionId(), a.getSelectedIndex(), a.getSubmittedAt()))
                .toList();

        return new SessionStateDto(
                session.getId(),
                session.getAssessmentId(),
                view.assessment().getTitle(),
                session.getStatus(),
                session.getStartedAt(),
                view.deadlineAt(),
                view.serverTime(),
                view.remainingSeconds(),
                view.assessment().getTimeLimitMinutes(),
                session.getTabSwitchCount(),
                questionDtos,
                answers,
                session.getScore(),
                session.getPassed(),
                session.getCompletedAt()
        );
    }

    public AnswerReceiptDto toReceiptDto(AnswerReceipt receipt) {
        return new AnswerReceiptDto(receipt.sessionId(), receipt.questionId(), receipt.selectedIndex(), receipt.submittedAt());
    }

    public CompletionResultDto toResultDto(CompletionResult result) {
        return new CompletionResultDto(result.sessionId(), result.status(), result.score(), result.passed(), result.completedAt());
    }

    public SessionSummaryDto toSummaryDto(SessionSummary summary) {
        List<QuestionReviewDto> review = summary.review().stream()
                .map(r -> new QuestionReviewDto(r.questionId(), r.stem(), r.options(), r.selectedIndex(),
                        r.correctIndex(), r.correct()))
                .toList();
        return new SessionSummaryDto(
                summary.sessionId(),
                summary.assessmentId(),
                summary.assessmentTitle(),
                summary.status(),
                summary.startedAt(),
                summary.deadlineAt(),
                summary.completedAt(),
                summary.remainingSeconds(),
                summary.totalQuestions(),
                summary.answeredQuestions(),
                summary.score(),
                summary.passed(),
                summary.passScore(),
                summary.tabSwitchCount(),
                summary.canRetake(),
                summary.cooldownEndsAt(),
                summary.reviewAvailable(),
                review
        );
    }

    public ViolationReportDto toViolationReportDto(ViolationReport report) {
        List<ViolationDto> violations = report.violations().stream()
                .map(v -> new ViolationDto(v.getSequence(), v.getOccurredAt(), v.getType()))
                .toList();
        return new ViolationReportDto(
                report.sessionId(),
                report.userId(),
                report.candidateEmail(),
                report.assessmentTitle(),
                report.tabSwitchCount(),
                violations
        );
    }
}
