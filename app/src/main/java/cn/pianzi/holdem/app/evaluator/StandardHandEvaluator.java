package cn.pianzi.holdem.app.evaluator;

import cn.pianzi.holdem.core.domain.Card;
import cn.pianzi.holdem.core.domain.HandScore;
import cn.pianzi.holdem.core.port.HandEvaluator;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Best five of up to seven cards. The score packs the category and five tie-break ranks
 * into one int (category in the top bits, ranks four bits each) and inverts it, so a
 * lower rank is a better hand and equal hands get equal ranks regardless of suits.
 *
 * <p>With fewer than five cards only pairs, trips and quads count; straights and flushes
 * need five cards.
 */
public final class StandardHandEvaluator implements HandEvaluator {
    private static final int HAND_SIZE = 5;
    private static final int RANK_BITS = 4;
    private static final int CATEGORY_SHIFT = HAND_SIZE * RANK_BITS;
    private static final int WORST = (HandCategory.values().length) << CATEGORY_SHIFT;

    private static final String[] RANK_NAMES = {
            "Two", "Three", "Four", "Five", "Six", "Seven", "Eight",
            "Nine", "Ten", "Jack", "Queen", "King", "Ace"
    };

    @Override
    public HandScore score(List<Card> holeCards, List<Card> communityCards) {
        Objects.requireNonNull(holeCards, "holeCards");
        Objects.requireNonNull(communityCards, "communityCards");
        if (holeCards.size() != 2) {
            throw new IllegalArgumentException("exactly two hole cards required, got " + holeCards.size());
        }
        if (communityCards.size() > 5) {
            throw new IllegalArgumentException("at most five community cards, got " + communityCards.size());
        }
        List<Card> cards = new ArrayList<>(holeCards.size() + communityCards.size());
        cards.addAll(holeCards);
        cards.addAll(communityCards);
        Ranked best = best(cards);
        return new HandScore(WORST - best.strength(), best.description());
    }

    /** Evaluates exactly the given cards (up to five) without choosing a subset. */
    public static Ranked rank(List<Card> cards) {
        if (cards.isEmpty() || cards.size() > HAND_SIZE) {
            throw new IllegalArgumentException("one to five cards required, got " + cards.size());
        }
        int[] counts = new int[Card.MAX_RANK + 1];
        for (Card card : cards) {
            counts[card.rank()]++;
        }
        List<Integer> ordered = orderByGroup(counts);
        boolean flush = cards.size() == HAND_SIZE && cards.stream().map(Card::suit).distinct().count() == 1;
        int straightHigh = cards.size() == HAND_SIZE ? straightHigh(counts) : -1;

        if (straightHigh > 0) {
            HandCategory category = flush ? HandCategory.STRAIGHT_FLUSH : HandCategory.STRAIGHT;
            return ranked(category, List.of(straightHigh), describeStraight(category, straightHigh));
        }
        if (flush) {
            return ranked(HandCategory.FLUSH, ordered, HandCategory.FLUSH.displayName() + ", " + name(ordered.get(0)) + " high");
        }
        int top = counts[ordered.get(0)];
        int second = ordered.size() > 1 ? counts[ordered.get(1)] : 0;
        if (top == 4) {
            return ranked(HandCategory.FOUR_OF_A_KIND, ordered, "Four of a Kind, " + plural(ordered.get(0)));
        }
        if (top == 3 && second >= 2) {
            return ranked(HandCategory.FULL_HOUSE, ordered,
                    "Full House, " + plural(ordered.get(0)) + " full of " + plural(ordered.get(1)));
        }
        if (top == 3) {
            return ranked(HandCategory.THREE_OF_A_KIND, ordered, "Three of a Kind, " + plural(ordered.get(0)));
        }
        if (top == 2 && second == 2) {
            return ranked(HandCategory.TWO_PAIR, ordered,
                    "Two Pair, " + plural(ordered.get(0)) + " and " + plural(ordered.get(1)));
        }
        if (top == 2) {
            return ranked(HandCategory.ONE_PAIR, ordered, "Pair of " + plural(ordered.get(0)));
        }
        return ranked(HandCategory.HIGH_CARD, ordered, "High Card, " + name(ordered.get(0)));
    }

    private static Ranked best(List<Card> cards) {
        if (cards.size() <= HAND_SIZE) {
            return rank(cards);
        }
        Ranked best = null;
        int n = cards.size();
        int[] index = {0, 1, 2, 3, 4};
        while (true) {
            List<Card> hand = new ArrayList<>(HAND_SIZE);
            for (int i : index) {
                hand.add(cards.get(i));
            }
            Ranked candidate = rank(hand);
            if (best == null || candidate.strength() > best.strength()) {
                best = candidate;
            }
            // next combination in lexicographic order
            int i = HAND_SIZE - 1;
            while (i >= 0 && index[i] == n - HAND_SIZE + i) {
                i--;
            }
            if (i < 0) {
                return best;
            }
            index[i]++;
            for (int j = i + 1; j < HAND_SIZE; j++) {
                index[j] = index[j - 1] + 1;
            }
        }
    }

    /** Distinct ranks, larger groups first, then higher rank first. */
    private static List<Integer> orderByGroup(int[] counts) {
        List<Integer> ranks = new ArrayList<>();
        for (int rank = Card.MAX_RANK; rank >= Card.MIN_RANK; rank--) {
            if (counts[rank] > 0) {
                ranks.add(rank);
            }
        }
        ranks.sort(Comparator.<Integer>comparingInt(rank -> counts[rank]).reversed()
                .thenComparing(Comparator.<Integer>reverseOrder()));
        return ranks;
    }

    private static int straightHigh(int[] counts) {
        for (int high = Card.MAX_RANK; high >= 6; high--) {
            boolean run = true;
            for (int rank = high; rank > high - HAND_SIZE; rank--) {
                if (counts[rank] != 1) {
                    run = false;
                    break;
                }
            }
            if (run) {
                return high;
            }
        }
        boolean wheel = counts[Card.MAX_RANK] == 1;
        for (int rank = 2; rank <= 5 && wheel; rank++) {
            wheel = counts[rank] == 1;
        }
        return wheel ? 5 : -1;
    }

    private static Ranked ranked(HandCategory category, List<Integer> tieBreak, String description) {
        int strength = category.ordinal() << CATEGORY_SHIFT;
        int shift = CATEGORY_SHIFT;
        for (int i = 0; i < tieBreak.size() && i < HAND_SIZE; i++) {
            shift -= RANK_BITS;
            strength |= tieBreak.get(i) << shift;
        }
        return new Ranked(category, strength, description);
    }

    private static String describeStraight(HandCategory category, int high) {
        if (category == HandCategory.STRAIGHT_FLUSH && high == Card.MAX_RANK) {
            return "Royal Flush";
        }
        return category.displayName() + ", " + name(high) + " high";
    }

    private static String name(int rank) {
        return RANK_NAMES[rank - Card.MIN_RANK];
    }

    private static String plural(int rank) {
        return rank == 6 ? "Sixes" : name(rank) + "s";
    }

    /**
     * @param strength higher is better; comparable across categories
     */
    public record Ranked(HandCategory category, int strength, String description) {
    }
}
