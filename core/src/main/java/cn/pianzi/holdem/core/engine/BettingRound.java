package cn.pianzi.holdem.core.engine;

import cn.pianzi.holdem.core.domain.ActionType;
import cn.pianzi.holdem.core.domain.Decision;

import java.util.Collection;
import java.util.EnumSet;
import java.util.Set;

/**
 * Betting state of one street: the bet to match and the minimum raise increment.
 * A raise whose increment is at least the current minimum is a full raise and reopens
 * action; a smaller all-in raise does not.
 */
final class BettingRound {
    private final int bigBlind;
    private int betToMatch;
    private int minRaiseIncrement;

    BettingRound(int bigBlind) {
        if (bigBlind <= 0) {
            throw new IllegalArgumentException("bigBlind must be positive");
        }
        this.bigBlind = bigBlind;
        this.minRaiseIncrement = bigBlind;
    }

    void openStreet(int openingBet) {
        this.betToMatch = openingBet;
        this.minRaiseIncrement = bigBlind;
    }

    int betToMatch() {
        return betToMatch;
    }

    int minRaiseIncrement() {
        return minRaiseIncrement;
    }

    int callAmount(PlayerState player) {
        return Math.min(Math.max(0, betToMatch - player.currentBet), player.stack);
    }

    int maxRaiseTo(PlayerState player) {
        return player.currentBet + player.stack;
    }

    /** Smallest legal raise-to total, or the all-in total when the stack cannot reach it. */
    int minRaiseTo(PlayerState player) {
        return Math.min(betToMatch + minRaiseIncrement, maxRaiseTo(player));
    }

    boolean canRaise(PlayerState player) {
        return player.canAct()
                && !player.actedSinceFullRaise
                && player.stack > betToMatch - player.currentBet;
    }

    Set<ActionType> legalActions(PlayerState player) {
        if (!player.canAct()) {
            return Set.of();
        }
        EnumSet<ActionType> legal = EnumSet.of(ActionType.FOLD);
        if (player.currentBet >= betToMatch) {
            legal.add(ActionType.CHECK);
        } else {
            legal.add(ActionType.CALL);
        }
        if (canRaise(player)) {
            legal.add(ActionType.RAISE);
        }
        return legal;
    }

    void validate(PlayerState player, Decision decision) {
        if (!player.canAct()) {
            throw new InvalidActionException("seat_cannot_act", "seat " + player.seat);
        }
        switch (decision.type()) {
            case FOLD -> {
            }
            case CHECK -> {
                if (player.currentBet < betToMatch) {
                    throw new InvalidActionException("check_not_allowed", "owes " + callAmount(player));
                }
            }
            case CALL -> {
                if (player.currentBet >= betToMatch) {
                    throw new InvalidActionException("nothing_to_call");
                }
            }
            case RAISE -> validateRaise(player, decision.raiseTo());
            default -> throw new InvalidActionException("unsupported_action", decision.type().name());
        }
    }

    private void validateRaise(PlayerState player, int raiseTo) {
        if (!canRaise(player)) {
            throw new InvalidActionException("raise_not_allowed");
        }
        int max = maxRaiseTo(player);
        if (raiseTo > max) {
            throw new InvalidActionException("raise_above_stack", raiseTo + " > " + max);
        }
        if (raiseTo <= betToMatch) {
            throw new InvalidActionException("raise_not_above_bet", raiseTo + " <= " + betToMatch);
        }
        if (raiseTo < betToMatch + minRaiseIncrement && raiseTo != max) {
            throw new InvalidActionException("raise_below_minimum",
                    raiseTo + " < " + (betToMatch + minRaiseIncrement));
        }
    }

    /**
     * Applies a decision that already passed {@link #validate}. {@code others} are the
     * remaining players of the hand, whose action flags are reopened by a full raise.
     */
    Applied apply(PlayerState player, Decision decision, Collection<PlayerState> others) {
        int chips = 0;
        boolean fullRaise = false;
        switch (decision.type()) {
            case FOLD -> player.folded = true;
            case CHECK -> {
            }
            case CALL -> {
                chips = callAmount(player);
                player.commit(chips);
            }
            case RAISE -> {
                int raiseTo = decision.raiseTo();
                chips = raiseTo - player.currentBet;
                player.commit(chips);
                int increment = raiseTo - betToMatch;
                betToMatch = raiseTo;
                if (increment >= minRaiseIncrement) {
                    fullRaise = true;
                    minRaiseIncrement = increment;
                    for (PlayerState other : others) {
                        if (other != player) {
                            other.actedSinceFullRaise = false;
                        }
                    }
                }
            }
            default -> throw new InvalidActionException("unsupported_action", decision.type().name());
        }
        player.actedSinceFullRaise = true;
        return new Applied(chips, player.allIn, fullRaise, player.currentBet);
    }

    /** Whether this seat still has to respond before the street can close. */
    boolean owesDecision(PlayerState player) {
        return player.canAct() && (!player.actedSinceFullRaise || player.currentBet < betToMatch);
    }

    boolean isClosed(Collection<PlayerState> players) {
        int actionable = 0;
        boolean everyoneActed = true;
        for (PlayerState player : players) {
            if (!player.canAct()) {
                continue;
            }
            actionable++;
            if (player.currentBet < betToMatch) {
                return false;
            }
            if (!player.actedSinceFullRaise) {
                everyoneActed = false;
            }
        }
        // a lone player who already matches has nobody left to bet against
        return actionable <= 1 || everyoneActed;
    }

    record Applied(int chips, boolean allIn, boolean fullRaise, int streetTotal) {
    }
}
