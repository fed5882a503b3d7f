package cn.pianzi.holdem.core.snapshot;

import cn.pianzi.holdem.core.domain.Card;

import java.util.List;

public record SeatScore(int seat, List<Card> holeCards, int rank, String description) {
    public SeatScore {
        holeCards = List.copyOf(holeCards);
    }
}
