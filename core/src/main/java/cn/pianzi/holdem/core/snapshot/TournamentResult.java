package cn.pianzi.holdem.core.snapshot;

import java.util.List;

public record TournamentResult(
        String gameId,
        int winnerSeat,
        String abortReason,
        List<Standing> standings,
        TournamentStats stats
) {
    public TournamentResult {
        standings = List.copyOf(standings);
    }

    public boolean aborted() {
        return abortReason != null;
    }
}
