package cn.pianzi.holdem.core.engine;

import cn.pianzi.holdem.core.domain.ActionType;
import cn.pianzi.holdem.core.snapshot.SeatScore;
import cn.pianzi.holdem.core.snapshot.TournamentStats;

import java.time.Instant;
import java.util.List;

final class StatsTracker {
    private int totalHands;
    private int biggestPot;
    private int biggestPotHand;
    private int folds;
    private int raises;
    private int allIns;
    private int showdowns;
    private int handsWonWithoutShowdown;
    private String bestHandDescription;
    private int bestHandRank = Integer.MAX_VALUE;
    private int bestHandSeat = -1;
    private int bestHandNumber;
    private Instant startedAt;
    private Instant endedAt;

    void started(Instant at) {
        startedAt = at;
    }

    void ended(Instant at) {
        endedAt = at;
    }

    void recordAction(ActionType type, boolean allIn) {
        if (type == ActionType.FOLD) {
            folds++;
        } else if (type == ActionType.RAISE) {
            raises++;
        }
        if (allIn) {
            allIns++;
        }
    }

    void recordHand(int handNumber, int potTotal, boolean showdown, List<SeatScore> scores) {
        totalHands++;
        if (potTotal > biggestPot) {
            biggestPot = potTotal;
            biggestPotHand = handNumber;
        }
        if (!showdown) {
            handsWonWithoutShowdown++;
            return;
        }
        showdowns++;
        for (SeatScore score : scores) {
            if (score.rank() < bestHandRank) {
                bestHandRank = score.rank();
                bestHandDescription = score.description();
                bestHandSeat = score.seat();
                bestHandNumber = handNumber;
            }
        }
    }

    TournamentStats snapshot() {
        return new TournamentStats(
                totalHands,
                biggestPot,
                biggestPotHand,
                folds,
                raises,
                allIns,
                showdowns,
                handsWonWithoutShowdown,
                bestHandDescription,
                bestHandSeat < 0 ? 0 : bestHandRank,
                bestHandSeat,
                bestHandNumber,
                startedAt,
                endedAt
        );
    }
}
