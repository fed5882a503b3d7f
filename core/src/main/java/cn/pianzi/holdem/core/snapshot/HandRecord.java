package cn.pianzi.holdem.core.snapshot;

import cn.pianzi.holdem.core.domain.Action;
import cn.pianzi.holdem.core.domain.Card;
import cn.pianzi.holdem.core.domain.Pot;

import java.util.List;

/**
 * Immutable archive of one completed hand, handed to the persistence sink. Together with
 * {@code deck} and the starting stacks, the action log is enough to replay the hand.
 */
public record HandRecord(
        String gameId,
        int handNumber,
        int seatCount,
        int dealerSeat,
        int smallBlindSeat,
        int bigBlindSeat,
        int blindLevel,
        int smallBlind,
        int bigBlind,
        List<HandParticipant> participants,
        List<Card> deck,
        List<Card> communityCards,
        List<Action> actions,
        List<Pot> pots,
        HandResult result,
        List<Integer> eliminatedSeats
) {
    public HandRecord {
        participants = List.copyOf(participants);
        deck = List.copyOf(deck);
        communityCards = List.copyOf(communityCards);
        actions = List.copyOf(actions);
        pots = List.copyOf(pots);
        eliminatedSeats = List.copyOf(eliminatedSeats);
    }
}
