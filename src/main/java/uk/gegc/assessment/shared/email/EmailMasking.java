package uk.gegc.assessment.shared.email;

public final class EmailMasking {

    private EmailMasking() {
        throw new AssertionError("Utility class - do not instantiate");
    }

    public static String mask(String email) {
        if (email == null || email.isEmpty()) {
            return "***";
        }
        int atIndex = email.indexOf('@');
        if (atIndex <= 1) {
            return "***@" + (atIndex > 0 ? email.substring(atIndex + 1) : "***");
        }
        return email.charAt(0) + "***@" + email.substring(atIndex + 1);
    }
}
