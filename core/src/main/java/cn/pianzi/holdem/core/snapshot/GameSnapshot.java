package cn.pianzi.holdem.core.snapshot;

import cn.pianzi.holdem.core.domain.Action;
import cn.pianzi.holdem.core.domain.Card;
import cn.pianzi.holdem.core.domain.GamePhase;
import cn.pianzi.holdem.core.domain.Pot;
import cn.pianzi.holdem.core.domain.TournamentMode;
import cn.pianzi.holdem.core.domain.TournamentStatus;

import java.util.List;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * Full state of the tournament after a mutation. {@code sequence} is stamped by the
 * coordinator and strictly increases; {@code turnSecondsRemaining} is -1 without a timer.
 */
public record GameSnapshot(
        String gameId,
        long sequence,
        TournamentStatus status,
        TournamentMode mode,
        GamePhase phase,
        int handNumber,
        int handsPlayed,
        int dealerSeat,
        int blindLevel,
        int smallBlind,
        int bigBlind,
        List<PlayerSnapshot> players,
        List<Card> communityCards,
        List<Pot> pots,
        int betToMatch,
        OptionalInt currentActor,
        int turnSecondsRemaining,
        List<Action> actions,
        Optional<HandResult> lastResult,
        List<Integer> eliminationOrder
) {
    public GameSnapshot {
        players = List.copyOf(players);
        communityCards = List.copyOf(communityCards);
        pots = List.copyOf(pots);
        actions = List.copyOf(actions);
        eliminationOrder = List.copyOf(eliminationOrder);
    }

    public GameSnapshot stamped(long nextSequence, int secondsRemaining) {
        return new GameSnapshot(gameId, nextSequence, status, mode, phase, handNumber, handsPlayed,
                dealerSeat, blindLevel, smallBlind, bigBlind, players, communityCards, pots, betToMatch,
                currentActor, secondsRemaining, actions, lastResult, eliminationOrder);
    }

    public int potTotal() {
        int total = 0;
        for (Pot pot : pots) {
            total += pot.amount();
        }
        return total;
    }

    public PlayerSnapshot player(int seat) {
        return players.get(seat);
    }
}
