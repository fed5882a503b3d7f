package cn.pianzi.holdem.core.domain;

import java.util.Objects;

/**
 * Opaque hand strength from the evaluator. Lower {@code rank} is the better hand.
 */
public record HandScore(int rank, String description) implements Comparable<HandScore> {
    public HandScore {
        Objects.requireNonNull(description, "description");
    }

    @Override
    public int compareTo(HandScore other) {
        return Integer.compare(rank, other.rank);
    }
}
