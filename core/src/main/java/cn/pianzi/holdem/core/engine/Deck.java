package cn.pianzi.holdem.core.engine;

import cn.pianzi.holdem.core.domain.Card;
import cn.pianzi.holdem.core.domain.Suit;
import cn.pianzi.holdem.core.port.RandomSource;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;

/**
 * A 52-card deck dealt from the top. One card is burned before every community deal.
 */
public final class Deck {
    public static final int SIZE = 52;

    private final List<Card> cards;
    private int position;

    private Deck(List<Card> cards) {
        this.cards = cards;
        this.position = 0;
    }

    public static Deck standard() {
        List<Card> cards = new ArrayList<>(SIZE);
        for (Suit suit : Suit.values()) {
            for (int rank = Card.MIN_RANK; rank <= Card.MAX_RANK; rank++) {
                cards.add(new Card(rank, suit));
            }
        }
        return new Deck(cards);
    }

    public static Deck shuffled(RandomSource random) {
        Deck deck = standard();
        deck.shuffle(random);
        return deck;
    }

    /**
     * Rebuilds a deck in a recorded order, e.g. from a hand history.
     */
    public static Deck ofOrder(List<Card> order) {
        Objects.requireNonNull(order, "order");
        if (order.size() != SIZE || new HashSet<>(order).size() != SIZE) {
            throw new IllegalArgumentException("deck order must contain 52 distinct cards");
        }
        return new Deck(new ArrayList<>(order));
    }

    public void shuffle(RandomSource random) {
        Objects.requireNonNull(random, "random");
        if (position != 0) {
            throw new IllegalStateException("cannot shuffle a deck that has been dealt from");
        }
        random.shuffle(cards);
    }

    public List<Card> deal(int count) {
        if (count < 0) {
            throw new IllegalArgumentException("count must be >= 0");
        }
        if (remaining() < count) {
            throw new InvariantViolationException("deck exhausted: need " + count + ", have " + remaining());
        }
        List<Card> dealt = List.copyOf(cards.subList(position, position + count));
        position += count;
        return dealt;
    }

    public Card burn() {
        return deal(1).get(0);
    }

    /**
     * Two passes round the table, one card each pass. Index i of the result belongs to
     * the i-th player in dealing order.
     */
    public List<List<Card>> dealHoleCards(int players) {
        if (remaining() < players * 2) {
            throw new InvariantViolationException("deck exhausted: need " + players * 2 + " hole cards");
        }
        List<List<Card>> hands = new ArrayList<>(players);
        for (int i = 0; i < players; i++) {
            hands.add(new ArrayList<>(2));
        }
        for (int pass = 0; pass < 2; pass++) {
            for (List<Card> hand : hands) {
                hand.add(deal(1).get(0));
            }
        }
        List<List<Card>> result = new ArrayList<>(players);
        for (List<Card> hand : hands) {
            result.add(List.copyOf(hand));
        }
        return result;
    }

    public List<Card> dealCommunity(int count) {
        if (remaining() < count + 1) {
            throw new InvariantViolationException("deck exhausted: need " + (count + 1) + " cards with burn");
        }
        burn();
        return deal(count);
    }

    public int remaining() {
        return cards.size() - position;
    }

    public int dealtCount() {
        return position;
    }

    /** Full order, including cards already dealt. */
    public List<Card> order() {
        return List.copyOf(cards);
    }
}
