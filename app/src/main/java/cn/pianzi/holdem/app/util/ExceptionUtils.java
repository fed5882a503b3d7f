package cn.pianzi.holdem.app.util;

import java.util.Objects;

/**
 * Shared exception helpers.
 */
public final class ExceptionUtils {

    private ExceptionUtils() {
    }

    /** Deepest throwable of the cause chain, the argument itself when it has no cause. */
    public static Throwable rootCause(Throwable throwable) {
        Throwable current = Objects.requireNonNull(throwable, "throwable");
        while (current.getCause() != null && current.getCause() != current) {
            current = current.getCause();
        }
        return current;
    }

    /**
     * Message of the root cause, which for rejected game commands is the snake_case reason
     * followed by its detail. Falls back to the simple class name when the message is blank.
     */
    public static String rootMessage(Throwable throwable) {
        Throwable root = rootCause(throwable);
        String message = root.getMessage();
        return message == null || message.isBlank() ? root.getClass().getSimpleName() : message;
    }
}
