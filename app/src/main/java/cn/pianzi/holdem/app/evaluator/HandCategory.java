package cn.pianzi.holdem.app.evaluator;

/**
 * Poker hand classes from weakest to strongest; {@link #ordinal()} is the strength.
 */
public enum HandCategory {
    HIGH_CARD("High Card"),
    ONE_PAIR("Pair"),
    TWO_PAIR("Two Pair"),
    THREE_OF_A_KIND("Three of a Kind"),
    STRAIGHT("Straight"),
    FLUSH("Flush"),
    FULL_HOUSE("Full House"),
    FOUR_OF_A_KIND("Four of a Kind"),
    STRAIGHT_FLUSH("Straight Flush");

    private final String displayName;

    HandCategory(String displayName) {
        this.displayName = displayName;
    }

    public String displayName() {
        return displayName;
    }
}
