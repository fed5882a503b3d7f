package cn.pianzi.holdem.core.snapshot;

import java.time.Instant;

public record TournamentStats(
        int totalHands,
        int biggestPot,
        int biggestPotHand,
        int folds,
        int raises,
        int allIns,
        int showdowns,
        int handsWonWithoutShowdown,
        String bestHandDescription,
        int bestHandRank,
        int bestHandSeat,
        int bestHandNumber,
        Instant startedAt,
        Instant endedAt
) {
}
