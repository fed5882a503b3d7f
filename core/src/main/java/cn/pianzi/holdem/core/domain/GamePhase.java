package cn.pianzi.holdem.core.domain;

public enum GamePhase {
    BETWEEN_HANDS,
    PRE_FLOP,
    FLOP,
    TURN,
    RIVER,
    SHOWDOWN,
    COMPLETED;

    public boolean isBettingStreet() {
        return this == PRE_FLOP || this == FLOP || this == TURN || this == RIVER;
    }

    /**
     * Street that follows this one, or {@link #SHOWDOWN} after the river.
     */
    public GamePhase nextStreet() {
        return switch (this) {
            case PRE_FLOP -> FLOP;
            case FLOP -> TURN;
            case TURN -> RIVER;
            case RIVER -> SHOWDOWN;
            default -> throw new IllegalStateException("no street after " + this);
        };
    }

    public int communityCardsToDeal() {
        return switch (this) {
            case FLOP -> 3;
            case TURN, RIVER -> 1;
            default -> 0;
        };
    }
}
