package cn.pianzi.holdem.core.engine;

/**
 * Thrown when a command is rejected. The engine state is left untouched.
 * {@link #reason()} is a stable snake_case code suitable for translation.
 */
public class InvalidActionException extends IllegalStateException {
    private final String reason;

    public InvalidActionException(String reason) {
        super(reason);
        this.reason = reason;
    }

    public InvalidActionException(String reason, String detail) {
        super(reason + ": " + detail);
        this.reason = reason;
    }

    public String reason() {
        return reason;
    }
}
