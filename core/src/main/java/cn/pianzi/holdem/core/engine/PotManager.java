package cn.pianzi.holdem.core.engine;

import cn.pianzi.holdem.core.domain.HandScore;
import cn.pianzi.holdem.core.domain.Pot;
import cn.pianzi.holdem.core.snapshot.PotAward;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;
import java.util.function.IntFunction;

/**
 * Splits hand contributions into a main pot and side pots, and pays them out.
 */
final class PotManager {
    private PotManager() {
    }

    /**
     * One pot per distinct contribution level of the non-folded players. Folded chips are
     * counted into every tier they reach, and anything a folded player put in above the
     * highest live level goes to the last pot, so the pot total always equals the sum of
     * contributions.
     */
    static List<Pot> computePots(Collection<PlayerState> participants) {
        TreeSet<Integer> tiers = new TreeSet<>();
        int totalContributed = 0;
        for (PlayerState player : participants) {
            totalContributed += player.totalContributed;
            if (player.dealtIn && !player.folded && player.totalContributed > 0) {
                tiers.add(player.totalContributed);
            }
        }
        if (tiers.isEmpty()) {
            if (totalContributed != 0) {
                throw new InvariantViolationException("contributions without a live contributor: " + totalContributed);
            }
            return List.of();
        }

        List<Integer> amounts = new ArrayList<>();
        List<List<Integer>> eligibility = new ArrayList<>();
        int previous = 0;
        for (int tier : tiers) {
            int amount = 0;
            List<Integer> eligible = new ArrayList<>();
            for (PlayerState player : participants) {
                amount += clamp(player.totalContributed - previous, 0, tier - previous);
                if (player.dealtIn && !player.folded && player.totalContributed >= tier) {
                    eligible.add(player.seat);
                }
            }
            amounts.add(amount);
            eligibility.add(eligible);
            previous = tier;
        }
        int overflow = 0;
        for (PlayerState player : participants) {
            overflow += Math.max(0, player.totalContributed - previous);
        }
        int last = amounts.size() - 1;
        amounts.set(last, amounts.get(last) + overflow);

        List<Pot> pots = new ArrayList<>(amounts.size());
        int potTotal = 0;
        for (int i = 0; i < amounts.size(); i++) {
            eligibility.get(i).sort(Comparator.naturalOrder());
            pots.add(new Pot(amounts.get(i), eligibility.get(i)));
            potTotal += amounts.get(i);
        }
        if (potTotal != totalContributed) {
            throw new InvariantViolationException("pot total " + potTotal + " != contributions " + totalContributed);
        }
        return List.copyOf(pots);
    }

    /**
     * Pays every pot to its best eligible hand (lowest score). A pot with one eligible
     * seat is awarded without evaluating anything. Odd chips of a split go one at a time
     * to the winners clockwise from the seat left of the dealer.
     */
    static List<PotAward> distribute(List<Pot> pots, IntFunction<HandScore> scorer, TurnOrder order, int dealer) {
        List<PotAward> awards = new ArrayList<>(pots.size());
        for (int index = 0; index < pots.size(); index++) {
            Pot pot = pots.get(index);
            List<Integer> winners = winners(pot, scorer);
            winners.sort(Comparator.comparingInt(seat -> order.distanceFromButton(dealer, seat)));
            awards.add(new PotAward(index, pot.amount(), pot.eligibleSeats(), winners, split(pot.amount(), winners)));
        }
        return List.copyOf(awards);
    }

    /** Fold-out: every pot goes to the sole remaining player. */
    static List<PotAward> awardAll(List<Pot> pots, int seat) {
        List<PotAward> awards = new ArrayList<>(pots.size());
        for (int index = 0; index < pots.size(); index++) {
            Pot pot = pots.get(index);
            awards.add(new PotAward(index, pot.amount(), pot.eligibleSeats(), List.of(seat), Map.of(seat, pot.amount())));
        }
        return List.copyOf(awards);
    }

    private static List<Integer> winners(Pot pot, IntFunction<HandScore> scorer) {
        List<Integer> eligible = pot.eligibleSeats();
        if (eligible.isEmpty()) {
            throw new InvariantViolationException("pot without eligible seats: " + pot);
        }
        if (eligible.size() == 1) {
            return new ArrayList<>(eligible);
        }
        List<Integer> best = new ArrayList<>();
        int bestRank = Integer.MAX_VALUE;
        for (int seat : eligible) {
            int rank = scorer.apply(seat).rank();
            if (rank < bestRank) {
                bestRank = rank;
                best.clear();
                best.add(seat);
            } else if (rank == bestRank) {
                best.add(seat);
            }
        }
        return best;
    }

    private static Map<Integer, Integer> split(int amount, List<Integer> winners) {
        int share = amount / winners.size();
        int remainder = amount % winners.size();
        Map<Integer, Integer> payouts = new LinkedHashMap<>();
        for (int i = 0; i < winners.size(); i++) {
            payouts.put(winners.get(i), share + (i < remainder ? 1 : 0));
        }
        return payouts;
    }

    private static int clamp(int value, int min, int max) {
        return Math.max(min, Math.min(max, value));
    }
}
