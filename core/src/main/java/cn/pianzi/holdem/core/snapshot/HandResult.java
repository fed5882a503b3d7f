package cn.pianzi.holdem.core.snapshot;

import java.util.List;

/**
 * Outcome of a finished hand. {@code scores} is empty when the hand ended by fold-out.
 */
public record HandResult(
        int handNumber,
        boolean showdown,
        List<SeatScore> scores,
        List<PotAward> awards
) {
    public HandResult {
        scores = List.copyOf(scores);
        awards = List.copyOf(awards);
    }
}
