package uk.gegc.assessment.features.session.domain.model;

public enum SessionStatus {
    IN_PROGRESS,
    COMPLETED,
    TIMED_OUT;

    public boolean isTerminal() {
        return this != IN_PROGRESS;
    }
}
