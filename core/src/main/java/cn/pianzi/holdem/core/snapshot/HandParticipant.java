package cn.pianzi.holdem.core.snapshot;

import cn.pianzi.holdem.core.domain.Card;

import java.util.List;

public record HandParticipant(
        int seat,
        String name,
        int startingStack,
        int endingStack,
        int totalContributed,
        boolean folded,
        List<Card> holeCards
) {
    public HandParticipant {
        holeCards = List.copyOf(holeCards);
    }
}
