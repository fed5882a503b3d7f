package cn.pianzi.holdem.app.evaluator;

import cn.pianzi.holdem.core.domain.Card;
import cn.pianzi.holdem.core.domain.HandScore;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class StandardHandEvaluatorTest {
    private final StandardHandEvaluator evaluator = new StandardHandEvaluator();

    @Test
    void shouldDescribeFullHouseFromSevenCards() {
        HandScore score = evaluator.score(cards("Kh Kd"), cards("Ks 7c 7d 2h 3s"));

        assertEquals("Full House, Kings full of Sevens", score.description());
    }

    @Test
    void shouldOrderCategories() {
        List<Card> board = cards("Th Jh Qh 2c 2d");
        HandScore royal = evaluator.score(cards("Ah Kh"), board);
        HandScore quads = evaluator.score(cards("2h 2s"), board);
        HandScore fullHouse = evaluator.score(cards("Qs Qd"), board);
        HandScore flush = evaluator.score(cards("3h 5h"), board);
        HandScore straight = evaluator.score(cards("Ac Kd"), board);
        HandScore trips = evaluator.score(cards("2s 9c"), board);
        HandScore twoPair = evaluator.score(cards("Js 4c"), board);
        HandScore pair = evaluator.score(cards("5c 4s"), board);

        assertEquals("Royal Flush", royal.description());
        assertEquals("Four of a Kind, Twos", quads.description());
        assertEquals("Flush, Queen high", flush.description());
        assertEquals("Straight, Ace high", straight.description());
        assertEquals("Three of a Kind, Twos", trips.description());
        assertEquals("Two Pair, Jacks and Twos", twoPair.description());
        assertEquals("Pair of Twos", pair.description());

        List<HandScore> ordered = List.of(royal, quads, fullHouse, flush, straight, trips, twoPair, pair);
        for (int i = 1; i < ordered.size(); i++) {
            assertTrue(ordered.get(i - 1).compareTo(ordered.get(i)) < 0,
                    ordered.get(i - 1).description() + " should beat " + ordered.get(i).description());
        }
    }

    @Test
    void shouldTreatWheelAsFiveHighStraight() {
        List<Card> board = cards("2c 3d 4h 5s Kd");
        HandScore wheel = evaluator.score(cards("Ah 9c"), board);
        HandScore sixHigh = evaluator.score(cards("6h 9c"), board);

        assertEquals("Straight, Five high", wheel.description());
        assertEquals("Straight, Six high", sixHigh.description());
        assertTrue(sixHigh.compareTo(wheel) < 0);
    }

    @Test
    void shouldBreakTiesWithKickers() {
        List<Card> board = cards("Ac 8d 6h 4s 2c");
        HandScore kingKicker = evaluator.score(cards("Ad Kc"), board);
        HandScore queenKicker = evaluator.score(cards("Ah Qc"), board);

        assertEquals("Pair of Aces", kingKicker.description());
        assertTrue(kingKicker.compareTo(queenKicker) < 0);
    }

    @Test
    void shouldRankEqualHandsEquallyRegardlessOfSuits() {
        List<Card> board = cards("Ah As Kh Ks 9s");

        HandScore first = evaluator.score(cards("2c 2d"), board);
        HandScore second = evaluator.score(cards("3c 3d"), board);

        assertEquals("Two Pair, Aces and Kings", first.description());
        assertEquals(first.rank(), second.rank());
    }

    @Test
    void shouldPreferFlushOverStraightOnSameBoard() {
        List<Card> board = cards("9h Th Jc Qh 3d");

        HandScore flush = evaluator.score(cards("2h 5h"), board);
        HandScore straight = evaluator.score(cards("Kd 4c"), board);

        assertEquals("Flush, Queen high", flush.description());
        assertEquals("Straight, King high", straight.description());
        assertTrue(flush.compareTo(straight) < 0);
    }

    @Test
    void shouldScorePartialBoards() {
        HandScore pocketPair = evaluator.score(cards("8c 8d"), List.of());
        HandScore aceHigh = evaluator.score(cards("Ac Kd"), cards("2h 7s 9d"));

        assertEquals("Pair of Eights", pocketPair.description());
        assertEquals("High Card, Ace", aceHigh.description());
        assertTrue(pocketPair.compareTo(aceHigh) < 0);
    }

    @Test
    void shouldRejectWrongCardCounts() {
        assertThrows(IllegalArgumentException.class, () -> evaluator.score(cards("Ac"), cards("2h 7s 9d")));
        assertThrows(IllegalArgumentException.class, () -> evaluator.score(cards("Ac Kd"), cards("2h 3h 4h 5h 6h 7h")));
    }

    private static List<Card> cards(String text) {
        List<Card> cards = new ArrayList<>();
        for (String token : text.split(" ")) {
            cards.add(Card.parse(token));
        }
        return cards;
    }
}
