package me.growmies.assistant.domain.model;

import java.util.Locale;

/**
 * Lifecycle status of a thread-mode run.
 */
public enum RunStatus {
    QUEUED,
    IN_PROGRESS,
    REQUIRES_ACTION,
    CANCELLING,
    CANCELLED,
    FAILED,
    COMPLETED,
    INCOMPLETE,
    EXPIRED,
    UNKNOWN;

    public static RunStatus fromWire(String value) {
        if (value == null || value.isBlank()) {
            return UNKNOWN;
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return UNKNOWN;
        }
    }

    /**
     * Statuses after which polling stops. {@link #REQUIRES_ACTION} stops polling
     * too since tool calls are never served.
     */
    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED || this == EXPIRED
                || this == INCOMPLETE || this == REQUIRES_ACTION;
    }
}
