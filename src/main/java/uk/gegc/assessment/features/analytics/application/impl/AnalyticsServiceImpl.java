package uk.gegc.assessment.features.analytics.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import uk.gegc.assessment.features.analytics.api.dto.AssessmentAnalyticsDto;
import uk.gegc.assessment.features.analytics.api.dto.AssessmentBreakdownDto;
import uk.gegc.assessment.features.analytics.api.dto.OrganizationAnalyticsDto;
import uk.gegc.assessment.features.analytics.api.dto.PerformerDto;
import uk.gegc.assessment.features.analytics.api.dto.QuestionStatDto;
import uk.gegc.assessment.features.analytics.application.AnalyticsService;
import uk.gegc.assessment.features.analytics.application.ScoreStatistics;
import uk.gegc.assessment.features.assessment.application.QuestionContent;
import uk.gegc.assessment.features.assessment.application.QuestionSetResolver;
import uk.gegc.assessment.features.assessment.domain.model.Assessment;
import uk.gegc.assessment.features.assessment.domain.model.AssessmentStatus;
import uk.gegc.assessment.features.assessment.domain.repository.AssessmentRepository;
import uk.gegc.assessment.features.organization.application.OrgAuthorizationService;
import uk.gegc.assessment.features.organization.domain.model.OrgRole;
import uk.gegc.assessment.features.session.domain.model.AssessmentSession;
import uk.gegc.assessment.features.session.domain.model.SessionAnswer;
import uk.gegc.assessment.features.session.domain.model.SessionStatus;
import uk.gegc.assessment.features.session.domain.repository.AssessmentSessionRepository;
import uk.gegc.assessment.features.session.domain.repository.SessionAnswerRepository;
import uk.gegc.assessment.features.user.domain.model.User;
import uk.gegc.assessment.features.user.domain.repository.UserRepository;
import uk.gegc.assessment.shared.config.SessionProperties;
import uk.gegc.assessment.shared.result.ErrorKind;
import uk.gegc.assessment.shared.result.Result;

import java.time.Clock;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;

@Service
@RequiredArgsConstructor
@Slf4j
public class AnalyticsServiceImpl implements AnalyticsService {

    private static final int STEM_PREVIEW_LENGTH = 80;

    private final AssessmentRepository assessmentRepository;
    private final AssessmentSessionRepository sessionRepository;
    private final SessionAnswerRepository answerRepository;
    private final UserRepository userRepository;
    private final QuestionSetResolver questionSetResolver;
    private final OrgAuthorizationService orgAuthorizationService;
    private final SessionProperties sessionProperties;
    private final Clock clock;

    @Override
    @Transactional(readOnly = true)
    public Result<AssessmentAnalyticsDto> summarizeAssessment(UUID assessmentId, UUID requesterId) {
        Optional<Assessment> maybeAssessment = assessmentRepository.findById(assessmentId);
        if (maybeAssessment.isEmpty()) {
            return Result.failure(ErrorKind.NOT_FOUND, "Assessment " + assessmentId + " not found");
        }
        Assessment assessment = maybeAssessment.get();
        if (!orgAuthorizationService.hasMinimumRole(requesterId, assessment.getOrganizationId(), OrgRole.CONTENT_MANAGER)) {
            return Result.failure(ErrorKind.UNAUTHORIZED, "Analytics require a content manager role");
        }

        List<AssessmentSession> sessions = sessionRepository.findByAssessmentId(assessmentId);
        List<AssessmentSession> attempts = finishedNewestFirst(sessions);
        List<Integer> scores = scoresOf(attempts);
        long passed = attempts.stream().filter(s -> Boolean.TRUE.equals(s.getPassed())).count();
        double avgTabSwitches = attempts.stream().mapToInt(AssessmentSession::getTabSwitchCount).average().orElse(0);
        int limit = sessionProperties.getAnalyticsPerformerLimit();
        Map<UUID, String> names = displayNames(attempts);

        log.debug("Summarizing assessment {}: {} sessions, {} attempts", assessmentId, sessions.size(), attempts.size());

        return Result.success(new AssessmentAnalyticsDto(
                assessment.getId(),
                assessment.getTitle(),
                assessment.getQuestionCount(),
                assessment.getTimeLimitMinutes(),
                assessment.getPassScore(),
                sessions.size(),
                countStatus(sessions, SessionStatus.IN_PROGRESS),
                countStatus(sessions, SessionStatus.COMPLETED),
                countStatus(sessions, SessionStatus.TIMED_OUT),
                attempts.size(),
                ScoreStatistics.roundedMean(scores),
                ScoreStatistics.median(scores),
                ScoreStatistics.percentage(passed, attempts.size()),
                Math.round(avgTabSwitches * 10) / 10.0,
                ScoreStatistics.distribution(scores),
                toPerformers(ScoreStatistics.top(attempts, ScoreStatistics::scoreOrZero, limit), names),
                toPerformers(ScoreStatistics.bottom(attempts, ScoreStatistics::scoreOrZero, limit), names),
                questionStats(attempts)
        ));
    }

    @Override
    @Transactional(readOnly = true)
    public Result<OrganizationAnalyticsDto> summarizeOrganization(UUID organizationId, UUID requesterId) {
        if (!orgAuthorizationService.hasMinimumRole(requesterId, organizationId, OrgRole.CONTENT_MANAGER)) {
            return Result.failure(ErrorKind.UNAUTHORIZED, "Analytics require a content manager role");
        }

        List<Assessment> assessments = assessmentRepository.findByOrganizationId(organizationId);
        List<AssessmentSession> sessions = assessments.isEmpty()
                ? List.of()
                : sessionRepository.findByAssessmentIdIn(assessments.stream().map(Assessment::getId).toList());
        List<AssessmentSession> attempts = finishedNewestFirst(sessions);
        List<Integer> scores = scoresOf(attempts);
        long passed = attempts.stream().filter(s -> Boolean.TRUE.equals(s.getPassed())).count();
        Set<UUID> candidates = sessions.stream().map(AssessmentSession::getUserId).collect(Collectors.toCollection(HashSet::new));
        int limit = sessionProperties.getAnalyticsPerformerLimit();
        Map<UUID, String> names = displayNames(attempts);

        Map<UUID, List<AssessmentSession>> byAssessment = sessions.stream()
                .collect(Collectors.groupingBy(AssessmentSession::getAssessmentId));
        List<AssessmentBreakdownDto> breakdown = assessments.stream()
                .map(a -> breakdown(a, byAssessment.getOrDefault(a.getId(), List.of())))
                .sorted(Comparator.comparingLong(AssessmentBreakdownDto::sessions).reversed())
                .toList();

        List<ScoreStatistics.Completion> completions = attempts.stream()
                .map(s -> new ScoreStatistics.Completion(s.getCompletedAt(), s.getScore()))
                .toList();

        log.debug("Summarizing organization {}: {} assessments, {} sessions", organizationId, assessments.size(), sessions.size());

        return Result.success(new OrganizationAnalyticsDto(
                organizationId,
                assessments.size(),
                assessments.stream().filter(a -> a.getStatus() == AssessmentStatus.PUBLISHED).count(),
                sessions.size(),
                countStatus(sessions, SessionStatus.COMPLETED),
                countStatus(sessions, SessionStatus.TIMED_OUT),
                candidates.size(),
                ScoreStatistics.roundedMean(scores),
                ScoreStatistics.median(scores),
                ScoreStatistics.percentage(passed, attempts.size()),
                ScoreStatistics.distribution(scores),
                toPerformers(ScoreStatistics.top(attempts, ScoreStatistics::scoreOrZero, limit), names),
                toPerformers(ScoreStatistics.bottom(attempts, ScoreStatistics::scoreOrZero, limit), names),
                ScoreStatistics.weeklyTrend(completions, clock.instant(), clock.getZone(),
                        sessionProperties.getAnalyticsTrendWeeks()),
                breakdown
        ));
    }

    private AssessmentBreakdownDto breakdown(Assessment assessment, List<AssessmentSession> sessions) {
        List<AssessmentSession> attempts = finishedNewestFirst(sessions);
        long passed = attempts.stream().filter(s -> Boolean.TRUE.equals(s.getPassed())).count();
        return new AssessmentBreakdownDto(
                assessment.getId(),
                assessment.getTitle(),
                assessment.getStatus(),
                sessions.size(),
                attempts.size(),
                ScoreStatistics.roundedMean(scoresOf(attempts)),
                ScoreStatistics.percentage(passed, attempts.size())
        );
    }

    private List<QuestionStatDto> questionStats(List<AssessmentSession> attempts) {
        if (attempts.isEmpty()) {
            return List.of();
        }
        List<SessionAnswer> scored = answerRepository.findScoredBySessionIds(
                attempts.stream().map(AssessmentSession::getId).toList());
        Map<UUID, long[]> tally = new LinkedHashMap<>();
        for (SessionAnswer answer : scored) {
            long[] counts = tally.computeIfAbsent(answer.getQuestionId(), id -> new long[2]);
            counts[0]++;
            if (Boolean.TRUE.equals(answer.getCorrect())) {
                counts[1]++;
            }
        }
        Map<UUID, QuestionContent> content = questionSetResolver.resolve(List.copyOf(tally.keySet())).stream()
                .collect(Collectors.toMap(QuestionContent::questionId, Function.identity()));
        return tally.entrySet().stream()
                .map(e -> new QuestionStatDto(
                        e.getKey(),
                        preview(content.get(e.getKey())),
                        e.getValue()[0],
                        ScoreStatistics.percentage(e.getValue()[1], e.getValue()[0])))
                .toList();
    }

    private static String preview(QuestionContent question) {
        if (question == null) {
            return "";
        }
        String stem = question.stem();
        return stem.length() > STEM_PREVIEW_LENGTH ? stem.substring(0, STEM_PREVIEW_LENGTH - 3) + "..." : stem;
    }

    private Map<UUID, String> displayNames(List<AssessmentSession> attempts) {
        Set<UUID> ids = attempts.stream().map(AssessmentSession::getUserId).collect(Collectors.toSet());
        if (ids.isEmpty()) {
            return Map.of();
        }
        return userRepository.findAllById(ids).stream()
                .collect(Collectors.toMap(User::getId, User::getUsername));
    }

    private static List<PerformerDto> toPerformers(List<AssessmentSession> sessions, Map<UUID, String> names) {
        return sessions.stream()
                .map(s -> new PerformerDto(
                        s.getId(),
                        s.getUserId(),
                        names.get(s.getUserId()),
                        ScoreStatistics.scoreOrZero(s),
                        Boolean.TRUE.equals(s.getPassed()),
                        s.getCompletedAt()))
                .toList();
    }

    private static List<AssessmentSession> finishedNewestFirst(List<AssessmentSession> sessions) {
        return sessions.stream()
                .filter(s -> s.getStatus().isTerminal())
                .sorted(Comparator.comparing(AssessmentSession::getCompletedAt,
                        Comparator.nullsLast(Comparator.reverseOrder())))
                .toList();
    }

    private static List<Integer> scoresOf(List<AssessmentSession> attempts) {
        return attempts.stream()
                .map(AssessmentSession::getScore)
                .filter(Objects::nonNull)
                .toList();
    }

    private static long countStatus(List<AssessmentSession> sessions, SessionStatus status) {
        return sessions.stream().filter(s -> s.getStatus() == status).count();
    }
}
