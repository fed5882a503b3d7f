package cn.pianzi.holdem.core.snapshot;

import cn.pianzi.holdem.core.domain.Action;
import cn.pianzi.holdem.core.domain.ActionType;
import cn.pianzi.holdem.core.domain.Card;
import cn.pianzi.holdem.core.domain.GamePhase;
import cn.pianzi.holdem.core.domain.Pot;

import java.util.List;
import java.util.Set;

/**
 * What one seat is allowed to see when asked for a decision: its own hole cards and public
 * information only. {@code players} never carries another seat's hole cards.
 */
public record SeatView(
        String gameId,
        int seat,
        long promptId,
        int handNumber,
        GamePhase phase,
        int dealerSeat,
        int smallBlind,
        int bigBlind,
        List<Card> holeCards,
        List<Card> communityCards,
        List<PlayerSnapshot> players,
        List<Pot> pots,
        List<Action> actions,
        int betToMatch,
        Set<ActionType> legalActions,
        int callAmount,
        int minRaiseTo,
        int maxRaiseTo
) {
    public SeatView {
        holeCards = List.copyOf(holeCards);
        communityCards = List.copyOf(communityCards);
        players = List.copyOf(players);
        pots = List.copyOf(pots);
        actions = List.copyOf(actions);
        legalActions = Set.copyOf(legalActions);
    }

    public boolean canCheck() {
        return legalActions.contains(ActionType.CHECK);
    }

    public boolean canRaise() {
        return legalActions.contains(ActionType.RAISE);
    }

    public SeatView withPromptId(long id) {
        return new SeatView(gameId, seat, id, handNumber, phase, dealerSeat, smallBlind, bigBlind, holeCards,
                communityCards, players, pots, actions, betToMatch, legalActions, callAmount, minRaiseTo, maxRaiseTo);
    }
}
