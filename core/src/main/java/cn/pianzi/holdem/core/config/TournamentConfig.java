package cn.pianzi.holdem.core.config;

import java.util.List;
import java.util.Objects;

public record TournamentConfig(
        int startingStack,
        int minSeats,
        int maxSeats,
        int turnSeconds,
        int handsPerLevel,
        List<BlindLevel> blindSchedule,
        ResumePolicy resumePolicy
) {
    public static final List<BlindLevel> DEFAULT_BLIND_SCHEDULE = List.of(
            new BlindLevel(10, 20),
            new BlindLevel(20, 40),
            new BlindLevel(40, 80),
            new BlindLevel(75, 150),
            new BlindLevel(150, 300),
            new BlindLevel(300, 600),
            new BlindLevel(500, 1000),
            new BlindLevel(1000, 2000)
    );

    public TournamentConfig {
        Objects.requireNonNull(blindSchedule, "blindSchedule");
        Objects.requireNonNull(resumePolicy, "resumePolicy");
        if (startingStack <= 0 || turnSeconds <= 0 || handsPerLevel <= 0) {
            throw new IllegalArgumentException("stack, turn seconds and hands per level must be positive");
        }
        if (minSeats < 2 || maxSeats < minSeats) {
            throw new IllegalArgumentException("seat range must satisfy 2 <= min <= max");
        }
        if (blindSchedule.isEmpty()) {
            throw new IllegalArgumentException("blind schedule must not be empty");
        }
        blindSchedule = List.copyOf(blindSchedule);
    }

    public static TournamentConfig defaults() {
        return new TournamentConfig(
                1000,
                2,
                8,
                30,
                10,
                DEFAULT_BLIND_SCHEDULE,
                ResumePolicy.RESTART_FULL
        );
    }

    public TournamentConfig withTurnSeconds(int seconds) {
        return new TournamentConfig(startingStack, minSeats, maxSeats, seconds, handsPerLevel, blindSchedule, resumePolicy);
    }

    public TournamentConfig withResumePolicy(ResumePolicy policy) {
        return new TournamentConfig(startingStack, minSeats, maxSeats, turnSeconds, handsPerLevel, blindSchedule, policy);
    }
}
