package cn.pianzi.holdem.core.domain;

import java.util.List;

/**
 * A main or side pot. Eligible seats are kept in ascending seat order.
 */
public record Pot(int amount, List<Integer> eligibleSeats) {
    public Pot {
        if (amount < 0) {
            throw new IllegalArgumentException("pot amount must be >= 0");
        }
        eligibleSeats = List.copyOf(eligibleSeats);
    }
}
