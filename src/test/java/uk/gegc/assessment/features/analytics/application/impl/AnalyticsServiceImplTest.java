package uk.gegc.assessment.features.analytics.application.impl;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import uk.gegc.assessment.BaseUnitTest;
import uk.gegc.assessment.features.analytics.api.dto.AssessmentAnalyticsDto;
import uk.gegc.assessment.features.analytics.api.dto.OrganizationAnalyticsDto;
import uk.gegc.assessment.features.analytics.api.dto.PerformerDto;
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
import uk.gegc.assessment.testsupport.TestFixtures;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@DisplayName("AnalyticsServiceImpl")
class AnalyticsServiceImplTest extends BaseUnitTest {

    @Mock
    private AssessmentRepository assessmentRepository;
    @Mock
    private AssessmentSessionRepository sessionRepository;
    @Mock
    private SessionAnswerRepository answerRepository;
    @Mock
    private UserRepository userRepository;
    @Mock
    private QuestionSetResolver questionSetResolver;
    @Mock
    private OrgAuthorizationService orgAuthorizationService;

    private AnalyticsServiceImpl service;

    private UUID managerId;
    private Assessment assessment;

    @BeforeEach
    void setUp() {
        service = new AnalyticsServiceImpl(
                assessmentRepository,
                sessionRepository,
                answerRepository,
                userRepository,
                questionSetResolver,
                orgAuthorizationService,
                new SessionProperties(),
                FIXED_CLOCK
        );
        managerId = UUID.randomUUID();
        assessment = TestFixtures.publishedAssessment(2, 30, 70);
    }

    @Test
    @DisplayName("assessment analytics without a manager role fail with UNAUTHORIZED and read nothing else")
    void assessment_unauthorized() {
        when(assessmentRepository.findById(assessment.getId())).thenReturn(Optional.of(assessment));
        when(orgAuthorizationService.hasMinimumRole(managerId, assessment.getOrganizationId(), OrgRole.CONTENT_MANAGER))
                .thenReturn(false);

        Result<AssessmentAnalyticsDto> result = service.summarizeAssessment(assessment.getId(), managerId);

        assertThat(result.isSuccess()).isFalse();
        assertThat(failureKind(result)).isEqualTo(ErrorKind.UNAUTHORIZED);
        verifyNoInteractions(sessionRepository, answerRepository, userRepository);
    }

    @Test
    @DisplayName("unknown assessment fails with NOT_FOUND")
    void assessment_notFound() {
        UUID missing = UUID.randomUUID();
        when(assessmentRepository.findById(missing)).thenReturn(Optional.empty());

        Result<AssessmentAnalyticsDto> result = service.summarizeAssessment(missing, managerId);

        assertThat(result.isSuccess()).isFalse();
        assertThat(failureKind(result)).isEqualTo(ErrorKind.NOT_FOUND);
    }

    @Test
    @DisplayName("assessment without sessions reports zeros and ten empty buckets")
    void assessment_empty() {
        allowManager(assessment.getOrganizationId());
        when(assessmentRepository.findById(assessment.getId())).thenReturn(Optional.of(assessment));
        when(sessionRepository.findByAssessmentId(assessment.getId())).thenReturn(List.of());

        AssessmentAnalyticsDto dto = service.summarizeAssessment(assessment.getId(), managerId).orElseThrow();

        assertThat(dto.totalSessions()).isZero();
        assertThat(dto.totalAttempts()).isZero();
        assertThat(dto.avgScore()).isZero();
        assertThat(dto.medianScore()).isZero();
        assertThat(dto.passRate()).isZero();
        assertThat(dto.scoreDistribution()).hasSize(10).allSatisfy(b -> assertThat(b.count()).isZero());
        assertThat(dto.topPerformers()).isEmpty();
        assertThat(dto.questionStats()).isEmpty();
    }

    @Test
    @DisplayName("assessment rollup counts statuses, uses the stored pass flag and names performers")
    void assessment_rollup() {
        allowManager(assessment.getOrganizationId());
        UUID alice = UUID.randomUUID();
        UUID bob = UUID.randomUUID();
        UUID carol = UUID.randomUUID();
        List<UUID> order = TestFixtures.questionIds(2);

        AssessmentSession a = finished(alice, SessionStatus.COMPLETED, 100, true, NOW.minusSeconds(300), 0);
        AssessmentSession b = finished(bob, SessionStatus.TIMED_OUT, 50, false, NOW.minusSeconds(200), 3);
        AssessmentSession live = TestFixtures.inProgressSession(assessment, carol, NOW.minusSeconds(60), order);

        when(assessmentRepository.findById(assessment.getId())).thenReturn(Optional.of(assessment));
        when(sessionRepository.findByAssessmentId(assessment.getId())).thenReturn(List.of(a, b, live));
        when(userRepository.findAllById(any())).thenReturn(List.of(user(alice, "alice"), user(bob, "bob")));

        SessionAnswer a1 = scored(a.getId(), order.get(0), true);
        SessionAnswer a2 = scored(a.getId(), order.get(1), true);
        SessionAnswer b1 = scored(b.getId(), order.get(0), false);
        when(answerRepository.findScoredBySessionIds(anyList())).thenReturn(List.of(a1, a2, b1));
        String longStem = "x".repeat(120);
        when(questionSetResolver.resolve(anyList())).thenReturn(List.of(
                new QuestionContent(order.get(0), longStem, List.of("A", "B"), 0),
                new QuestionContent(order.get(1), "Short stem", List.of("A", "B"), 1)));

        AssessmentAnalyticsDto dto = service.summarizeAssessment(assessment.getId(), managerId).orElseThrow();

        assertThat(dto.totalSessions()).isEqualTo(3);
        assertThat(dto.inProgressCount()).isEqualTo(1);
        assertThat(dto.completedCount()).isEqualTo(1);
        assertThat(dto.timedOutCount()).isEqualTo(1);
        assertThat(dto.totalAttempts()).isEqualTo(2);
        assertThat(dto.avgScore()).isEqualTo(75);
        assertThat(dto.medianScore()).isEqualTo(75.0);
        assertThat(dto.passRate()).isEqualTo(50);
        assertThat(dto.avgTabSwitches()).isEqualTo(1.5);
        assertThat(dto.topPerformers()).extracting(PerformerDto::name).containsExactly("alice", "bob");
        assertThat(dto.bottomPerformers()).extracting(PerformerDto::name).containsExactly("bob", "alice");
        assertThat(dto.questionStats()).hasSize(2);
        assertThat(dto.questionStats().get(0).totalAnswers()).isEqualTo(2);
        assertThat(dto.questionStats().get(0).percentCorrect()).isEqualTo(50);
        assertThat(dto.questionStats().get(0).stem()).hasSize(80).endsWith("...");
        assertThat(dto.questionStats().get(1).percentCorrect()).isEqualTo(100);
        assertThat(dto.questionStats().get(1).stem()).isEqualTo("Short stem");
    }

    @Test
    @DisplayName("organization analytics without a manager role fail with UNAUTHORIZED")
    void organization_unauthorized() {
        UUID orgId = UUID.randomUUID();
        when(orgAuthorizationService.hasMinimumRole(managerId, orgId, OrgRole.CONTENT_MANAGER)).thenReturn(false);

        Result<OrganizationAnalyticsDto> result = service.summarizeOrganization(orgId, managerId);

        assertThat(result.isSuccess()).isFalse();
        assertThat(failureKind(result)).isEqualTo(ErrorKind.UNAUTHORIZED);
        verifyNoInteractions(assessmentRepository, sessionRepository);
    }

    @Test
    @DisplayName("empty organization still reports a full twelve week trend")
    void organization_empty() {
        UUID orgId = UUID.randomUUID();
        allowManager(orgId);
        when(assessmentRepository.findByOrganizationId(orgId)).thenReturn(List.of());

        OrganizationAnalyticsDto dto = service.summarizeOrganization(orgId, managerId).orElseThrow();

        assertThat(dto.totalAssessments()).isZero();
        assertThat(dto.totalSessions()).isZero();
        assertThat(dto.uniqueCandidates()).isZero();
        assertThat(dto.weeklyTrend()).hasSize(12);
        assertThat(dto.assessmentStats()).isEmpty();
        verifyNoInteractions(sessionRepository);
    }

    @Test
    @DisplayName("organization rollup breaks down per assessment, busiest first")
    void organization_rollup() {
        UUID orgId = assessment.getOrganizationId();
        allowManager(orgId);
        Assessment draft = TestFixtures.publishedAssessment(2, 30, 70);
        draft.setOrganizationId(orgId);
        draft.setStatus(AssessmentStatus.DRAFT);
        UUID alice = UUID.randomUUID();

        AssessmentSession first = finished(alice, SessionStatus.COMPLETED, 80, true, NOW.minusSeconds(3600), 1);
        AssessmentSession second = finished(alice, SessionStatus.TIMED_OUT, 40, false, NOW.minusSeconds(60), 0);

        when(assessmentRepository.findByOrganizationId(orgId)).thenReturn(List.of(draft, assessment));
        when(sessionRepository.findByAssessmentIdIn(anyList())).thenReturn(List.of(first, second));
        when(userRepository.findAllById(any())).thenReturn(List.of(user(alice, "alice")));

        OrganizationAnalyticsDto dto = service.summarizeOrganization(orgId, managerId).orElseThrow();

        assertThat(dto.totalAssessments()).isEqualTo(2);
        assertThat(dto.publishedAssessments()).isEqualTo(1);
        assertThat(dto.totalSessions()).isEqualTo(2);
        assertThat(dto.completedSessions()).isEqualTo(1);
        assertThat(dto.timedOutSessions()).isEqualTo(1);
        assertThat(dto.uniqueCandidates()).isEqualTo(1);
        assertThat(dto.avgScore()).isEqualTo(60);
        assertThat(dto.passRate()).isEqualTo(50);
        assertThat(dto.weeklyTrend()).hasSize(12);
        assertThat(dto.weeklyTrend().get(11).completions()).isEqualTo(2);
        assertThat(dto.assessmentStats()).hasSize(2);
        assertThat(dto.assessmentStats().get(0).id()).isEqualTo(assessment.getId());
        assertThat(dto.assessmentStats().get(0).sessions()).isEqualTo(2);
        assertThat(dto.assessmentStats().get(1).sessions()).isZero();
    }

    private void allowManager(UUID orgId) {
        when(orgAuthorizationService.hasMinimumRole(managerId, orgId, OrgRole.CONTENT_MANAGER)).thenReturn(true);
    }

    private AssessmentSession finished(UUID userId, SessionStatus status, int score, boolean passed,
                                       Instant completedAt, int tabSwitches) {
        AssessmentSession session = TestFixtures.inProgressSession(assessment, userId, completedAt.minusSeconds(600),
                TestFixtures.questionIds(2));
        session.setStatus(status);
        session.setActiveSlot(null);
        session.setScore(score);
        session.setPassed(passed);
        session.setCompletedAt(completedAt);
        session.setTabSwitchCount(tabSwitches);
        return session;
    }

    private static SessionAnswer scored(UUID sessionId, UUID questionId, boolean correct) {
        SessionAnswer answer = TestFixtures.answer(sessionId, questionId, correct ? 1 : 0);
        answer.setCorrect(correct);
        return answer;
    }

    private static User user(UUID id, String username) {
        User user = new User();
        user.setId(id);
        user.setUsername(username);
        return user;
    }
}
