package cn.pianzi.holdem.core.domain;

import java.util.Objects;

/**
 * One entry of a hand's action log. {@code amount} is the number of chips the seat moved
 * into the pot with this action, except for raises where {@code raiseTo} carries the
 * street total the seat raised to. {@code sequence} is the only ordering key for replay.
 */
public record Action(
        long sequence,
        int seat,
        ActionType type,
        int amount,
        int raiseTo,
        GamePhase street,
        boolean allIn
) {
    public Action {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(street, "street");
        if (amount < 0) {
            throw new IllegalArgumentException("amount must be >= 0");
        }
    }
}
