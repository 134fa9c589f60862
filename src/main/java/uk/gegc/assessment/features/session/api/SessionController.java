package uk.gegc.assessment.features.session.api;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.ExampleObject;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.Authentication;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;
import uk.gegc.assessment.features.session.api.dto.*;
import uk.gegc.assessment.features.session.application.AnswerService;
import uk.gegc.assessment.features.session.application.CompletionService;
import uk.gegc.assessment.features.session.application.ProctoringService;
import uk.gegc.assessment.features.session.application.SessionLifecycleService;
import uk.gegc.assessment.features.session.application.SessionQueryService;
import uk.gegc.assessment.features.session.application.SessionView;
import uk.gegc.assessment.features.session.domain.model.CompletionReason;
import uk.gegc.assessment.features.session.infra.mapping.SessionMapper;
import uk.gegc.assessment.shared.security.AuthenticatedUser;
import uk.gegc.assessment.shared.util.ClientIpResolver;

import java.util.UUID;

@Tag(name = "Sessions", description = "Timed assessment sessions: start, answer, proctoring and completion")
@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
@Validated
public class SessionController {

    private final SessionLifecycleService lifecycleService;
    private final AnswerService answerService;
    private final CompletionService completionService;
    private final ProctoringService proctoringService;
    private final SessionQueryService queryService;
    private final SessionMapper sessionMapper;
    private final ClientIpResolver clientIpResolver;

    @Operation(
            summary = "Start or resume a session",
            description = """
                    Creates a session for the assessment, or returns the caller's in-progress one.
                    Remaining time is always recomputed from the server clock. A session resumed after its
                    deadline comes back finalized as TIMED_OUT.
                    """
    )
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Session started or resumed",
                    content = @Content(schema = @Schema(implementation = SessionStateDto.class))),
            @ApiResponse(responseCode = "403", description = "Wrong access code",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "404", description = "Assessment not found",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "409", description = "Assessment not available, attempt limit reached or cooldown active",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    @PostMapping("/assessments/{assessmentId}/sessions")
    public ResponseEntity<SessionStateDto> startOrResume(
            @Parameter(description = "Assessment UUID", required = true)
            @PathVariable UUID assessmentId,

            @io.swagger.v3.oas.annotations.parameters.RequestBody(
                    description = "Optional access code",
                    required = false,
                    content = @Content(schema = @Schema(implementation = StartSessionRequest.class))
            )
            @RequestBody(required = false) @Valid StartSessionRequest request,

            Authentication authentication,
            HttpServletRequest httpRequest
    ) {
        UUID userId = AuthenticatedUser.idOf(authentication);
        String accessCode = request != null ? request.accessCode() : null;
        SessionView view = lifecycleService
                .startOrResume(userId, assessmentId, accessCode, clientIpResolver.resolve(httpRequest))
                .orElseThrow();
        return ResponseEntity.ok(sessionMapper.toStateDto(view));
    }

    @Operation(summary = "Submit an answer", description = "Upserts the answer to one question of an in-progress session.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Answer stored",
                    content = @Content(schema = @Schema(implementation = AnswerReceiptDto.class))),
            @ApiResponse(responseCode = "400", description = "Validation error or option index out of range",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "404", description = "Session or question not found",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "409", description = "Session already closed",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    @PutMapping("/sessions/{sessionId}/answers")
    public ResponseEntity<AnswerReceiptDto> submitAnswer(
            @Parameter(description = "Session UUID", required = true)
            @PathVariable UUID sessionId,

            @RequestBody @Valid SubmitAnswerRequest request,

            Authentication authentication
    ) {
        UUID userId = AuthenticatedUser.idOf(authentication);
        var receipt = answerService.submitAnswer(
                sessionId, userId, request.questionId(), request.selectedIndex(), request.clientRemainingSeconds()
        ).orElseThrow();
        return ResponseEntity.ok(sessionMapper.toReceiptDto(receipt));
    }

    @Operation(summary = "Report a focus loss", description = "Records that the exam tab was hidden. Advisory only.")
    @ApiResponses({
            @ApiResponse(responseCode = "204", description = "Recorded"),
            @ApiResponse(responseCode = "404", description = "Session not found",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "409", description = "Session already closed",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    @PostMapping("/sessions/{sessionId}/focus-loss")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void recordFocusLoss(
            @Parameter(description = "Session UUID", required = true)
            @PathVariable UUID sessionId,

            Authentication authentication
    ) {
        proctoringService.recordFocusLoss(sessionId, AuthenticatedUser.idOf(authentication)).orElseThrow();
    }

    @Operation(
            summary = "Complete a session",
            description = """
                    Finalizes and scores the session. Safe to call more than once or concurrently: every call
                    returns the same persisted result. The final status is decided by server time.
                    """
    )
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Session finalized",
                    content = @Content(schema = @Schema(implementation = CompletionResultDto.class),
                            examples = @ExampleObject(name = "success", value = """
                                    {
                                      "sessionId":"3fa85f64-5717-4562-b3fc-2c963f66afa6",
                                      "status":"COMPLETED",
                                      "score":75,
                                      "passed":true,
                                      "completedAt":"2024-01-01T12:00:00Z"
                                    }
                                    """))),
            @ApiResponse(responseCode = "404", description = "Session not found",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    @PostMapping("/sessions/{sessionId}/complete")
    public ResponseEntity<CompletionResultDto> complete(
            @Parameter(description = "Session UUID", required = true)
            @PathVariable UUID sessionId,

            @RequestBody(required = false) @Valid CompleteSessionRequest request,

            Authentication authentication
    ) {
        CompletionReason reason = request != null ? request.reason() : CompletionReason.MANUAL;
        var result = completionService.complete(sessionId, AuthenticatedUser.idOf(authentication), reason)
                .orElseThrow();
        return ResponseEntity.ok(sessionMapper.toResultDto(result));
    }

    @Operation(summary = "Get session summary", description = "Status, timing, score and, when allowed, a per-question review.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Summary returned",
                    content = @Content(schema = @Schema(implementation = SessionSummaryDto.class))),
            @ApiResponse(responseCode = "404", description = "Session not found",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    @GetMapping("/sessions/{sessionId}/summary")
    public ResponseEntity<SessionSummaryDto> getSummary(
            @Parameter(description = "Session UUID", required = true)
            @PathVariable UUID sessionId,

            Authentication authentication
    ) {
        var summary = queryService.getSessionSummary(sessionId, AuthenticatedUser.idOf(authentication)).orElseThrow();
        return ResponseEntity.ok(sessionMapper.toSummaryDto(summary));
    }

    @Operation(summary = "Get session violations", description = "Focus-loss log. Requires the creator role or higher in the owning organization.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Violations returned",
                    content = @Content(schema = @Schema(implementation = ViolationReportDto.class))),
            @ApiResponse(responseCode = "403", description = "Insufficient organization role",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "404", description = "Session not found",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    @GetMapping("/sessions/{sessionId}/violations")
    public ResponseEntity<ViolationReportDto> getViolations(
            @Parameter(description = "Session UUID", required = true)
            @PathVariable UUID sessionId,

            Authentication authentication
    ) {
        var report = proctoringService.getViolations(sessionId, AuthenticatedUser.idOf(authentication)).orElseThrow();
        return ResponseEntity.ok(sessionMapper.toViolationReportDto(report));
    }
}
