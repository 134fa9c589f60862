package uk.gegc.assessment.features.session.domain.model;

public enum ViolationType {
    TAB_HIDDEN
}
