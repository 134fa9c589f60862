package uk.gegc.assessment.features.analytics.api;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.Authentication;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import uk.gegc.assessment.features.analytics.api.dto.AssessmentAnalyticsDto;
import uk.gegc.assessment.features.analytics.api.dto.OrganizationAnalyticsDto;
import uk.gegc.assessment.features.analytics.application.AnalyticsService;
import uk.gegc.assessment.shared.security.AuthenticatedUser;

import java.util.UUID;

@Tag(name = "Analytics", description = "Read-only rollups of finished sessions for content managers")
@RestController
@RequestMapping("/api/v1/analytics")
@RequiredArgsConstructor
public class AnalyticsController {

    private final AnalyticsService analyticsService;

    @Operation(summary = "Assessment analytics", description = "Score statistics, distribution, performers and per-question rates.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Analytics returned",
                    content = @Content(schema = @Schema(implementation = AssessmentAnalyticsDto.class))),
            @ApiResponse(responseCode = "403", description = "Insufficient organization role",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "404", description = "Assessment not found",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    @GetMapping("/assessments/{assessmentId}")
    public ResponseEntity<AssessmentAnalyticsDto> assessmentAnalytics(
            @Parameter(description = "Assessment UUID", required = true)
            @PathVariable UUID assessmentId,
            Authentication authentication
    ) {
        return ResponseEntity.ok(analyticsService
                .summarizeAssessment(assessmentId, AuthenticatedUser.idOf(authentication))
                .orElseThrow());
    }

    @Operation(summary = "Organization analytics", description = "Totals, weekly trend and per-assessment breakdown.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Analytics returned",
                    content = @Content(schema = @Schema(implementation = OrganizationAnalyticsDto.class))),
            @ApiResponse(responseCode = "403", description = "Insufficient organization role",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    @GetMapping("/organizations/{orgId}")
    public ResponseEntity<OrganizationAnalyticsDto> organizationAnalytics(
            @Parameter(description = "Organization UUID", required = true)
            @PathVariable UUID orgId,
            Authentication authentication
    ) {
        return ResponseEntity.ok(analyticsService
                .summarizeOrganization(orgId, AuthenticatedUser.idOf(authentication))
                .orElseThrow());
    }
}
