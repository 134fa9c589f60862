package uk.gegc.assessment.features.organization.domain.model;

/**
 * Organization role hierarchy, lowest first: {@code CANDIDATE < CREATOR < ADMIN < OWNER}.
 */
public enum OrgRole {
    CANDIDATE,
    CREATOR,
    ADMIN,
    OWNER;

    /** Minimum role that counts as a content manager of an organization. */
    public static final OrgRole CONTENT_MANAGER = CREATOR;

    public static boolean hasMinimumRole(OrgRole role, OrgRole required) {
        return role != null && required != null && role.ordinal() >= required.ordinal();
    }
}
