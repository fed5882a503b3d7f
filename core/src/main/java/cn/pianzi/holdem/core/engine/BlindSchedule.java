package cn.pianzi.holdem.core.engine;

import cn.pianzi.holdem.core.config.BlindLevel;
import cn.pianzi.holdem.core.config.TournamentConfig;

import java.util.List;
import java.util.Objects;

public final class BlindSchedule {
    private final List<BlindLevel> levels;
    private final int handsPerLevel;

    public BlindSchedule(List<BlindLevel> levels, int handsPerLevel) {
        Objects.requireNonNull(levels, "levels");
        if (levels.isEmpty()) {
            throw new IllegalArgumentException("levels must not be empty");
        }
        if (handsPerLevel <= 0) {
            throw new IllegalArgumentException("handsPerLevel must be positive");
        }
        this.levels = List.copyOf(levels);
        this.handsPerLevel = handsPerLevel;
    }

    public static BlindSchedule from(TournamentConfig config) {
        return new BlindSchedule(config.blindSchedule(), config.handsPerLevel());
    }

    /** Level index in effect once {@code handsPlayed} hands have completed; the last level holds. */
    public int levelFor(int handsPlayed) {
        if (handsPlayed < 0) {
            throw new IllegalArgumentException("handsPlayed must be >= 0");
        }
        return Math.min(handsPlayed / handsPerLevel, levels.size() - 1);
    }

    public BlindLevel blindsFor(int handsPlayed) {
        return levels.get(levelFor(handsPlayed));
    }

    public BlindLevel level(int index) {
        return levels.get(index);
    }

    /** -1 once the final level has been reached. */
    public int handsUntilIncrease(int handsPlayed) {
        int level = levelFor(handsPlayed);
        if (level == levels.size() - 1) {
            return -1;
        }
        return (level + 1) * handsPerLevel - handsPlayed;
    }

    /** A short stack posts what it has and is all-in. */
    static int postAmount(int nominal, int stack) {
        return Math.min(nominal, stack);
    }
}
