package cn.pianzi.holdem.core.domain;

import java.util.Objects;

/**
 * What a decision source answers for one decision opportunity. {@code raiseTo} is only
 * meaningful for {@link ActionType#RAISE} and is the street total after the raise.
 */
public record Decision(ActionType type, int raiseTo) {
    public Decision {
        Objects.requireNonNull(type, "type");
        if (type == ActionType.POST_BLIND) {
            throw new IllegalArgumentException("blinds are posted by the engine");
        }
    }

    public static Decision fold() {
        return new Decision(ActionType.FOLD, 0);
    }

    public static Decision check() {
        return new Decision(ActionType.CHECK, 0);
    }

    public static Decision call() {
        return new Decision(ActionType.CALL, 0);
    }

    public static Decision raiseTo(int amount) {
        return new Decision(ActionType.RAISE, amount);
    }
}
