package cn.pianzi.holdem.core.engine;

/**
 * The engine detected a state that should be impossible (chips created or lost, deck
 * exhausted, bad pot layout). The tournament cannot safely continue.
 */
public class InvariantViolationException extends RuntimeException {
    public InvariantViolationException(String message) {
        super(message);
    }
}
