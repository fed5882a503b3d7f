package cn.pianzi.holdem.core.engine;

import cn.pianzi.holdem.core.config.BlindLevel;
import cn.pianzi.holdem.core.config.TournamentConfig;
import cn.pianzi.holdem.core.domain.Action;
import cn.pianzi.holdem.core.domain.Decision;
import cn.pianzi.holdem.core.domain.Pot;
import cn.pianzi.holdem.core.domain.TournamentMode;
import cn.pianzi.holdem.core.port.HandEvaluator;
import cn.pianzi.holdem.core.port.RandomSource;
import cn.pianzi.holdem.core.snapshot.HandParticipant;
import cn.pianzi.holdem.core.snapshot.HandRecord;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Re-runs a recorded hand through a fresh engine: same starting stacks, button, blinds and
 * deck order, then every voluntary action of the log in sequence order.
 */
public final class HandReplayer {
    private final TournamentConfig config;
    private final HandEvaluator evaluator;

    public HandReplayer(TournamentConfig config, HandEvaluator evaluator) {
        this.config = Objects.requireNonNull(config, "config");
        this.evaluator = Objects.requireNonNull(evaluator, "evaluator");
    }

    public Replay replay(HandRecord record) {
        Objects.requireNonNull(record, "record");
        List<String> names = new ArrayList<>(Collections.nCopies(record.seatCount(), ""));
        for (int seat = 0; seat < record.seatCount(); seat++) {
            names.set(seat, "seat-" + seat);
        }
        for (HandParticipant participant : record.participants()) {
            names.set(participant.seat(), participant.name());
        }

        TournamentConfig replayConfig = new TournamentConfig(
                config.startingStack(),
                Math.min(config.minSeats(), record.seatCount()),
                Math.max(config.maxSeats(), record.seatCount()),
                config.turnSeconds(),
                config.handsPerLevel(),
                config.blindSchedule(),
                config.resumePolicy()
        );
        // the deck comes from the record, nothing is drawn
        RandomSource noDraws = (min, max) -> {
            throw new IllegalStateException("replay must not draw random numbers");
        };
        TournamentEngine engine = new TournamentEngine(record.gameId(), replayConfig, TournamentMode.SPECTATOR,
                names, noDraws, evaluator);
        Map<Integer, HandParticipant> bySeat = new LinkedHashMap<>();
        for (HandParticipant participant : record.participants()) {
            bySeat.put(participant.seat(), participant);
        }
        for (int seat = 0; seat < record.seatCount(); seat++) {
            HandParticipant participant = bySeat.get(seat);
            engine.restoreSeat(seat, participant == null ? 0 : participant.startingStack(), participant == null);
        }
        engine.restoreProgress(record.handNumber() - 1);
        engine.beginHand(Deck.ofOrder(record.deck()), record.dealerSeat(), record.blindLevel(),
                new BlindLevel(record.smallBlind(), record.bigBlind()));

        List<Action> ordered = new ArrayList<>(record.actions());
        ordered.sort((left, right) -> Long.compare(left.sequence(), right.sequence()));
        for (Action action : ordered) {
            Decision decision = switch (action.type()) {
                case POST_BLIND -> null;
                case FOLD -> Decision.fold();
                case CHECK -> Decision.check();
                case CALL -> Decision.call();
                case RAISE -> Decision.raiseTo(action.raiseTo());
            };
            if (decision != null) {
                engine.applyAction(action.seat(), decision);
            }
        }

        HandRecord replayed = engine.lastHandRecord()
                .filter(candidate -> candidate.handNumber() == record.handNumber())
                .orElseThrow(() -> new IllegalStateException("replayed hand did not complete"));
        return new Replay(replayed, replayed.pots(), stacksOf(replayed));
    }

    private static Map<Integer, Integer> stacksOf(HandRecord record) {
        Map<Integer, Integer> stacks = new LinkedHashMap<>();
        for (HandParticipant participant : record.participants()) {
            stacks.put(participant.seat(), participant.endingStack());
        }
        return Collections.unmodifiableMap(stacks);
    }

    public record Replay(HandRecord record, List<Pot> pots, Map<Integer, Integer> endingStacks) {
        public boolean matches(HandRecord original) {
            return pots.equals(original.pots()) && endingStacks.equals(stacksOf(original));
        }
    }
}
