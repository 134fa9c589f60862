package uk.gegc.assessment.features.assessment.domain.model;

public enum AssessmentStatus {
    DRAFT,
    PUBLISHED,
    ARCHIVED
}
