package me.growmies.assistant.domain.model;

/**
 * Answer of the age-verification collaborator.
 */
public record EligibilityResult(boolean eligible, String reason) {

    public static EligibilityResult allowed() {
        return new EligibilityResult(true, null);
    }

    public static EligibilityResult denied(String reason) {
        return new EligibilityResult(false, reason);
    }
}
