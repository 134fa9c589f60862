package uk.gegc.assessment.features.notification.application;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;
import uk.gegc.assessment.features.session.domain.event.SessionCompletedEvent;

/**
 * Sends the result notification once the completing transaction has committed, off the request thread.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class SessionCompletedEventListener {

    private final ResultNotifier resultNotifier;

    @Async("generalTaskExecutor")
    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
    public void handleSessionCompleted(SessionCompletedEvent event) {
        try {
            resultNotifier.notifyResult(event.getUserId(), event.getAssessmentId(), event.getScore(), event.isPassed());
        } catch (Exception e) {
            // completion is already committed
            log.warn("Result notification for session {} failed: {}", event.getSessionId(), e.getMessage());
        }
    }
}
