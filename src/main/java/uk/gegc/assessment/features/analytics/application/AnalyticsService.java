package uk.gegc.assessment.features.analytics.application;

import uk.gegc.assessment.features.analytics.api.dto.AssessmentAnalyticsDto;
import uk.gegc.assessment.features.analytics.api.dto.OrganizationAnalyticsDto;
import uk.gegc.assessment.shared.result.Result;

import java.util.UUID;

/**
 * Read-only rollups over finished sessions. Both reads require at least the creator role in the
 * owning organization.
 */
public interface AnalyticsService {

    Result<AssessmentAnalyticsDto> summarizeAssessment(UUID assessmentId, UUID requesterId);

    Result<OrganizationAnalyticsDto> summarizeOrganization(UUID organizationId, UUID requesterId);
}
