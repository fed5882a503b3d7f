package cn.pianzi.holdem.core.engine;

import cn.pianzi.holdem.core.domain.Card;

import java.util.ArrayList;
import java.util.List;

final class PlayerState {
    final int seat;
    final String name;
    final List<Card> holeCards;
    int stack;
    int stackAtHandStart;
    int currentBet;
    int totalContributed;
    boolean dealtIn;
    boolean folded;
    boolean allIn;
    boolean eliminated;
    boolean actedSinceFullRaise;
    int eliminatedInHand;

    PlayerState(int seat, String name, int stack) {
        this.seat = seat;
        this.name = name;
        this.stack = stack;
        this.holeCards = new ArrayList<>(2);
    }

    boolean live() {
        return !eliminated;
    }

    /** Dealt into the current hand and not folded. */
    boolean inHand() {
        return dealtIn && !folded;
    }

    boolean canAct() {
        return inHand() && !allIn;
    }

    void resetForHand() {
        holeCards.clear();
        stackAtHandStart = stack;
        currentBet = 0;
        totalContributed = 0;
        dealtIn = !eliminated;
        folded = false;
        allIn = false;
        actedSinceFullRaise = false;
    }

    void resetForStreet() {
        currentBet = 0;
        actedSinceFullRaise = false;
    }

    void commit(int chips) {
        if (chips < 0 || chips > stack) {
            throw new InvariantViolationException("seat " + seat + " cannot commit " + chips + " from stack " + stack);
        }
        stack -= chips;
        currentBet += chips;
        totalContributed += chips;
        if (stack == 0) {
            allIn = true;
        }
    }
}
