package cn.pianzi.holdem.core.port;

import cn.pianzi.holdem.core.domain.Card;
import cn.pianzi.holdem.core.domain.HandScore;

import java.util.List;

@FunctionalInterface
public interface HandEvaluator {
    /**
     * @param holeCards      exactly two cards
     * @param communityCards zero to five cards
     * @return a totally ordered score, lower is better
     */
    HandScore score(List<Card> holeCards, List<Card> communityCards);
}
