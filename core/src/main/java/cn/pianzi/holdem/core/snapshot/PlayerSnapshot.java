package cn.pianzi.holdem.core.snapshot;

import cn.pianzi.holdem.core.domain.Card;

import java.util.List;

public record PlayerSnapshot(
        int seat,
        String name,
        int stack,
        int currentBet,
        int totalContributed,
        List<Card> holeCards,
        boolean folded,
        boolean allIn,
        boolean eliminated,
        boolean dealer
) {
    public PlayerSnapshot {
        holeCards = List.copyOf(holeCards);
    }
}
