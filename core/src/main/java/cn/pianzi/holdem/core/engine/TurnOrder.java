package cn.pianzi.holdem.core.engine;

import cn.pianzi.holdem.core.domain.GamePhase;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Predicate;

/**
 * Clockwise seat arithmetic. Seats are indices into the player list; clockwise means
 * increasing index with wrap-around.
 */
final class TurnOrder {
    private final List<PlayerState> players;

    TurnOrder(List<PlayerState> players) {
        this.players = players;
    }

    /** First seat after {@code from} (exclusive, wrapping) that matches, or -1. */
    int nextSeat(int from, Predicate<PlayerState> eligible) {
        int size = players.size();
        for (int step = 1; step <= size; step++) {
            PlayerState candidate = players.get(Math.floorMod(from + step, size));
            if (eligible.test(candidate)) {
                return candidate.seat;
            }
        }
        return -1;
    }

    int nextLiveSeat(int from) {
        return nextSeat(from, PlayerState::live);
    }

    /** First live seat before {@code from} going counter-clockwise, or -1. */
    int previousLiveSeat(int from) {
        int size = players.size();
        for (int step = 1; step <= size; step++) {
            PlayerState candidate = players.get(Math.floorMod(from - step, size));
            if (candidate.live()) {
                return candidate.seat;
            }
        }
        return -1;
    }

    int liveCount() {
        int count = 0;
        for (PlayerState player : players) {
            if (player.live()) {
                count++;
            }
        }
        return count;
    }

    /** Heads-up the dealer posts the small blind. */
    int smallBlindSeat(int dealer) {
        return liveCount() == 2 ? dealer : nextLiveSeat(dealer);
    }

    int bigBlindSeat(int dealer) {
        return nextLiveSeat(smallBlindSeat(dealer));
    }

    /** Seat the search for the first actor starts after on the given street. */
    int streetAnchor(GamePhase street, int dealer, int bigBlindSeat) {
        return street == GamePhase.PRE_FLOP ? bigBlindSeat : dealer;
    }

    /** Live seats in dealing order, starting left of the dealer. */
    List<PlayerState> dealingOrder(int dealer) {
        List<PlayerState> ordered = new ArrayList<>();
        int size = players.size();
        for (int step = 1; step <= size; step++) {
            PlayerState candidate = players.get(Math.floorMod(dealer + step, size));
            if (candidate.live()) {
                ordered.add(candidate);
            }
        }
        return ordered;
    }

    /** Clockwise distance from the seat left of the dealer, used to order split-pot winners. */
    int distanceFromButton(int dealer, int seat) {
        return Math.floorMod(seat - dealer - 1, players.size());
    }
}
