package uk.gegc.assessment.shared.security;

import org.springframework.security.authentication.InsufficientAuthenticationException;
import org.springframework.security.core.Authentication;

import java.util.UUID;

/**
 * Reads the caller's user id from the authentication. Bearer tokens carry the id as their subject,
 * so {@link Authentication#getName()} is the id in string form.
 */
public final class AuthenticatedUser {

    private AuthenticatedUser() {
        throw new AssertionError("Utility class - do not instantiate");
    }

    public static UUID idOf(Authentication authentication) {
        if (authentication == null || authentication.getName() == null) {
            throw new InsufficientAuthenticationException("Authentication is required");
        }
        try {
            return UUID.fromString(authentication.getName());
        } catch (IllegalArgumentException e) {
            throw new InsufficientAuthenticationException("Authenticated principal is not a user id", e);
        }
    }
}
