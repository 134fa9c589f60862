package uk.gegc.assessment.features.session.application;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import uk.gegc.assessment.features.assessment.domain.model.Assessment;
import uk.gegc.assessment.shared.result.ErrorKind;
import uk.gegc.assessment.shared.result.Result;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

/**
 * Rules that gate the creation of a new session: publication, scheduling window, attempt limit
 * and cooldown. Resuming an existing session is not subject to them.
 */
@Component
@RequiredArgsConstructor
public class AttemptEligibility {

    private final SessionStore sessionStore;

    public Result<Void> checkCanStart(Assessment assessment, UUID userId, Instant now) {
        if (!assessment.isPublished()) {
            return Result.failure(ErrorKind.NOT_AVAILABLE, "Assessment is not published");
        }
        if (!assessment.isOpenAt(now)) {
            return Result.failure(ErrorKind.NOT_AVAILABLE, "Assessment is outside its scheduling window");
        }
        Integer maxAttempts = assessment.getMaxAttempts();
        if (maxAttempts != null && sessionStore.countTerminal(userId, assessment.getId()) >= maxAttempts) {
            return Result.failure(ErrorKind.ATTEMPT_LIMIT_REACHED,
                    "Maximum number of attempts (" + maxAttempts + ") reached");
        }
        Optional<Instant> cooldownEnds = cooldownEndsAt(assessment, userId, now);
        if (cooldownEnds.isPresent()) {
            return Result.failure(ErrorKind.COOLDOWN_ACTIVE, "Next attempt available at " + cooldownEnds.get());
        }
        return Result.success(null);
    }

    /**
     * End of the cooldown after the user's latest finished attempt, if it is still in the future.
     */
    public Optional<Instant> cooldownEndsAt(Assessment assessment, UUID userId, Instant now) {
        Integer cooldownMinutes = assessment.getCooldownMinutes();
        if (cooldownMinutes == null || cooldownMinutes <= 0) {
            return Optional.empty();
        }
        return sessionStore.lastCompletedAt(userId, assessment.getId())
                .map(last -> last.plusSeconds(cooldownMinutes * 60L))
                .filter(end -> end.isAfter(now));
    }

    public static boolean accessCodeMatches(Assessment assessment, String provided) {
        String expected = assessment.getAccessCode();
        if (expected == null || expected.isBlank()) {
            return true;
        }
        if (provided == null) {
            return false;
        }
        return MessageDigest.isEqual(
                expected.trim().getBytes(StandardCharsets.UTF_8),
                provided.trim().getBytes(StandardCharsets.UTF_8)
        );
    }
}
