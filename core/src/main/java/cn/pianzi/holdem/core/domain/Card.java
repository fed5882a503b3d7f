package cn.pianzi.holdem.core.domain;

import java.util.Objects;

/**
 * A playing card. Rank runs from 2 to 14, where 11..14 are jack, queen, king and ace.
 */
public record Card(int rank, Suit suit) {
    public static final int MIN_RANK = 2;
    public static final int MAX_RANK = 14;

    private static final String RANK_SYMBOLS = "23456789TJQKA";

    public Card {
        Objects.requireNonNull(suit, "suit");
        if (rank < MIN_RANK || rank > MAX_RANK) {
            throw new IllegalArgumentException("rank out of range: " + rank);
        }
    }

    /**
     * Parses the two-character short form, e.g. {@code "Ah"} or {@code "Tc"}.
     */
    public static Card parse(String text) {
        Objects.requireNonNull(text, "text");
        if (text.length() != 2) {
            throw new IllegalArgumentException("invalid card: " + text);
        }
        int rankIndex = RANK_SYMBOLS.indexOf(Character.toUpperCase(text.charAt(0)));
        if (rankIndex < 0) {
            throw new IllegalArgumentException("invalid card rank: " + text);
        }
        char suitSymbol = Character.toLowerCase(text.charAt(1));
        for (Suit suit : Suit.values()) {
            if (suit.symbol() == suitSymbol) {
                return new Card(rankIndex + MIN_RANK, suit);
            }
        }
        throw new IllegalArgumentException("invalid card suit: " + text);
    }

    public char rankSymbol() {
        return RANK_SYMBOLS.charAt(rank - MIN_RANK);
    }

    public String shortName() {
        return "" + rankSymbol() + suit.symbol();
    }

    @Override
    public String toString() {
        return shortName();
    }
}
