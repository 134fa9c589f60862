package uk.gegc.assessment.features.session.application;

import uk.gegc.assessment.shared.result.Result;

import java.util.UUID;

public interface AnswerService {

    /**
     * Upserts the caller's answer to one question. Correctness is not evaluated here.
     *
     * @param clientReportedRemaining client countdown value, kept for drift diagnostics only
     */
    Result<AnswerReceipt> submitAnswer(UUID sessionId, UUID userId, UUID questionId, int selectedIndex,
                                       Long clientReportedRemaining);
}
