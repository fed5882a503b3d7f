package cn.pianzi.holdem.core.snapshot;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * How one pot was paid out. {@code winners} is in payout order, clockwise from the
 * seat left of the dealer; {@code payouts} maps seat to chips received from this pot.
 */
public record PotAward(
        int potIndex,
        int amount,
        List<Integer> eligibleSeats,
        List<Integer> winners,
        Map<Integer, Integer> payouts
) {
    public PotAward {
        eligibleSeats = List.copyOf(eligibleSeats);
        winners = List.copyOf(winners);
        payouts = Collections.unmodifiableMap(new LinkedHashMap<>(payouts));
    }

    public int payoutTo(int seat) {
        return payouts.getOrDefault(seat, 0);
    }
}
