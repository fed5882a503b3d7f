package cn.pianzi.holdem.core.runtime;

import cn.pianzi.holdem.core.config.ResumePolicy;
import cn.pianzi.holdem.core.domain.ActorType;
import cn.pianzi.holdem.core.domain.Decision;
import cn.pianzi.holdem.core.domain.GamePhase;
import cn.pianzi.holdem.core.domain.TournamentStatus;
import cn.pianzi.holdem.core.engine.InvalidActionException;
import cn.pianzi.holdem.core.engine.InvariantViolationException;
import cn.pianzi.holdem.core.engine.TournamentEngine;
import cn.pianzi.holdem.core.event.CoreEvent;
import cn.pianzi.holdem.core.event.CoreEventType;
import cn.pianzi.holdem.core.port.BroadcastSink;
import cn.pianzi.holdem.core.port.CoreEventListener;
import cn.pianzi.holdem.core.port.PersistenceSink;
import cn.pianzi.holdem.core.snapshot.GameSnapshot;
import cn.pianzi.holdem.core.snapshot.HandRecord;
import cn.pianzi.holdem.core.snapshot.SeatView;
import cn.pianzi.holdem.core.snapshot.TournamentResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.concurrent.CompletionStage;
import java.util.function.Supplier;

/**
 * Single writer of one tournament. Every method must be called from one thread at a time
 * (the {@link AsyncGameRuntime} mailbox); decision sources and timers only reach the game
 * through {@link CommandDispatcher}.
 *
 * <p>Each decision opportunity gets a fresh prompt id and one {@link TurnTimer}. A hand
 * that finishes leaves the table between hands until the next tick, so a pause received
 * in between defers the next deal.
 */
public final class GameCoordinator {
    private static final Logger log = LoggerFactory.getLogger(GameCoordinator.class);

    private final TournamentEngine engine;
    private final List<SeatController> seats;
    private final CommandDispatcher dispatcher;
    private final BroadcastSink broadcast;
    private final PersistenceSink persistence;
    private final CoreEventListener listener;
    private final SessionGuard sessionGuard;

    private long snapshotSequence;
    private long promptSequence;
    private TurnTimer timer;
    private int frozenSeconds;
    private boolean nextHandDue;
    private boolean started;

    public GameCoordinator(
            TournamentEngine engine,
            List<SeatController> seats,
            CommandDispatcher dispatcher,
            BroadcastSink broadcast,
            PersistenceSink persistence,
            CoreEventListener listener,
            SessionGuard sessionGuard
    ) {
        this.engine = Objects.requireNonNull(engine, "engine");
        this.seats = List.copyOf(Objects.requireNonNull(seats, "seats"));
        this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher");
        this.broadcast = Objects.requireNonNull(broadcast, "broadcast");
        this.persistence = Objects.requireNonNull(persistence, "persistence");
        this.listener = Objects.requireNonNull(listener, "listener");
        this.sessionGuard = Objects.requireNonNull(sessionGuard, "sessionGuard");
        if (this.seats.size() != engine.seatCount()) {
            throw new IllegalArgumentException("one seat controller per seat required");
        }
        this.frozenSeconds = -1;
    }

    public List<CoreEvent> start() {
        if (started) {
            throw new IllegalStateException("coordinator_already_started");
        }
        sessionGuard.acquire(engine.gameId());
        started = true;
        try {
            return guarded(() -> {
                List<CoreEvent> events = new ArrayList<>(engine.startTournament());
                events.addAll(engine.startHand());
                return afterMutation(events);
            });
        } catch (RuntimeException ex) {
            sessionGuard.release(engine.gameId());
            throw ex;
        }
    }

    public List<CoreEvent> handle(GameCommand command) {
        Objects.requireNonNull(command, "command");
        if (command instanceof GameCommand.PlayerAction action) {
            return handleAction(action);
        }
        if (command instanceof GameCommand.PromptFailed failed) {
            return handlePromptFailure(failed);
        }
        if (command instanceof GameCommand.Pause pause) {
            return pause(pause.reason());
        }
        if (command instanceof GameCommand.Resume) {
            return resume();
        }
        throw new InvalidActionException("unknown_command", command.getClass().getSimpleName());
    }

    /**
     * Advances the turn timer by one second. On expiry the pending seat checks when it can
     * and folds otherwise. A finished hand is followed by the next deal on the next tick.
     */
    public List<CoreEvent> tickSecond() {
        if (!started || engine.status() != TournamentStatus.ACTIVE) {
            return List.of();
        }
        if (nextHandDue) {
            nextHandDue = false;
            return guarded(() -> afterMutation(new ArrayList<>(engine.startHand())));
        }
        if (timer == null) {
            return List.of();
        }
        TurnTimer running = timer;
        boolean expired = running.tick();
        CoreEvent tick = CoreEvent.of(
                CoreEventType.TURN_TIMER_TICK,
                "turn timer tick",
                Map.of("seat", running.seat(), "remaining", running.remainingSeconds(), "promptId", running.promptId())
        );
        if (!expired) {
            listener.onEvents(List.of(tick));
            return List.of(tick);
        }
        return guarded(() -> {
            Decision fallback = engine.timeoutDecision(running.seat());
            log.warn("Seat {} timed out in hand #{}, applying {}", running.seat(), engine.handNumber(), fallback.type());
            seats.get(running.seat()).source().cancelPending(running.seat());
            List<CoreEvent> events = new ArrayList<>();
            events.add(tick);
            events.add(CoreEvent.of(
                    CoreEventType.TURN_TIMED_OUT,
                    "turn timed out",
                    Map.of("seat", running.seat(), "action", fallback.type().name(), "promptId", running.promptId())
            ));
            events.addAll(engine.applyAction(running.seat(), fallback));
            return afterMutation(events);
        });
    }

    public GameSnapshot snapshot() {
        return engine.snapshot().stamped(snapshotSequence, timer == null ? -1 : timer.remainingSeconds());
    }

    public Optional<TurnTimer> timer() {
        return Optional.ofNullable(timer);
    }

    public Optional<TournamentResult> result() {
        return engine.result();
    }

    public boolean finished() {
        return engine.status() == TournamentStatus.COMPLETED;
    }

    public String gameId() {
        return engine.gameId();
    }

    private List<CoreEvent> handleAction(GameCommand.PlayerAction action) {
        int seat = action.seat();
        if (!action.isDirect()) {
            if (timer == null || timer.promptId() != action.promptId() || timer.seat() != seat) {
                log.debug("Discarding stale answer from seat {} for prompt {}", seat, action.promptId());
                return List.of();
            }
            return guarded(() -> applyPromptAnswer(seat, action.decision()));
        }
        if (seat < 0 || seat >= seats.size()) {
            throw new InvalidActionException("unknown_seat", String.valueOf(seat));
        }
        if (seats.get(seat).type() != ActorType.HUMAN) {
            throw new InvalidActionException("seat_not_human", "seat " + seat);
        }
        return guarded(() -> {
            List<CoreEvent> events = new ArrayList<>(engine.applyAction(seat, action.decision()));
            seats.get(seat).source().cancelPending(seat);
            return afterMutation(events);
        });
    }

    private List<CoreEvent> applyPromptAnswer(int seat, Decision decision) {
        List<CoreEvent> events = new ArrayList<>();
        try {
            events.addAll(engine.applyAction(seat, decision));
        } catch (InvalidActionException ex) {
            if (seats.get(seat).type() == ActorType.HUMAN) {
                throw ex;
            }
            Decision fallback = engine.timeoutDecision(seat);
            log.warn("Seat {} answered an illegal {} ({}), applying {}", seat, decision.type(), ex.reason(), fallback.type());
            events.addAll(engine.applyAction(seat, fallback));
        }
        return afterMutation(events);
    }

    private List<CoreEvent> handlePromptFailure(GameCommand.PromptFailed failed) {
        if (timer == null || timer.promptId() != failed.promptId() || timer.seat() != failed.seat()) {
            return List.of();
        }
        if (seats.get(failed.seat()).type() == ActorType.HUMAN) {
            // a human keeps the rest of the turn; the timer still applies
            log.warn("Decision source of human seat {} failed: {}", failed.seat(), failed.reason());
            return List.of();
        }
        return guarded(() -> {
            Decision fallback = engine.timeoutDecision(failed.seat());
            log.warn("Decision source of seat {} failed ({}), applying {}", failed.seat(), failed.reason(), fallback.type());
            return afterMutation(new ArrayList<>(engine.applyAction(failed.seat(), fallback)));
        });
    }

    private List<CoreEvent> pause(String reason) {
        List<CoreEvent> events = new ArrayList<>(engine.pause(reason));
        if (timer != null) {
            frozenSeconds = timer.remainingSeconds();
            seats.get(timer.seat()).source().cancelPending(timer.seat());
            timer = null;
        }
        publish(events);
        return Collections.unmodifiableList(events);
    }

    private List<CoreEvent> resume() {
        List<CoreEvent> events = new ArrayList<>(engine.resume());
        OptionalInt actor = engine.currentActor();
        if (actor.isPresent()) {
            int seconds = engine.config().resumePolicy() == ResumePolicy.PRESERVE_REMAINING && frozenSeconds > 0
                    ? frozenSeconds
                    : engine.config().turnSeconds();
            prompt(actor.getAsInt(), seconds, events);
        }
        frozenSeconds = -1;
        publish(events);
        return Collections.unmodifiableList(events);
    }

    private List<CoreEvent> afterMutation(List<CoreEvent> events) {
        timer = null;
        if (containsEvent(events, CoreEventType.HAND_COMPLETED)) {
            engine.lastHandRecord().ifPresent(this::persist);
        }
        if (finished()) {
            sessionGuard.release(engine.gameId());
        } else if (engine.phase() == GamePhase.BETWEEN_HANDS) {
            nextHandDue = true;
        } else {
            OptionalInt actor = engine.currentActor();
            if (actor.isPresent()) {
                prompt(actor.getAsInt(), engine.config().turnSeconds(), events);
            }
        }
        publish(events);
        return Collections.unmodifiableList(events);
    }

    private void prompt(int seat, int seconds, List<CoreEvent> events) {
        long promptId = ++promptSequence;
        timer = new TurnTimer(seat, promptId, seconds);
        SeatController controller = seats.get(seat);
        SeatView view = engine.seatView(seat).withPromptId(promptId);
        log.debug("Prompting {} seat {} (prompt {}, {}s)", controller.type(), seat, promptId, seconds);
        events.add(CoreEvent.of(
                CoreEventType.DECISION_REQUESTED,
                "decision requested",
                Map.of(
                        "seat", seat,
                        "promptId", promptId,
                        "actorType", controller.type().name(),
                        "seconds", seconds,
                        "legalActions", view.legalActions().stream().map(Enum::name).sorted().toList()
                )
        ));
        CompletionStage<Decision> answer;
        try {
            answer = controller.source().requestDecision(view);
        } catch (RuntimeException ex) {
            log.warn("Decision source of seat {} threw on request", seat, ex);
            dispatcher.dispatch(new GameCommand.PromptFailed(seat, promptId, ExceptionMessages.describe(ex)));
            return;
        }
        if (answer == null) {
            dispatcher.dispatch(new GameCommand.PromptFailed(seat, promptId, "no answer stage"));
            return;
        }
        answer.whenComplete((decision, error) -> {
            if (error != null) {
                dispatcher.dispatch(new GameCommand.PromptFailed(seat, promptId, ExceptionMessages.describe(error)));
            } else if (decision == null) {
                dispatcher.dispatch(new GameCommand.PromptFailed(seat, promptId, "null decision"));
            } else {
                dispatcher.dispatch(new GameCommand.PlayerAction(seat, decision, promptId));
            }
        });
    }

    private void persist(HandRecord record) {
        try {
            persistence.handCompleted(record);
        } catch (RuntimeException ex) {
            // the game goes on without the archived hand
            log.error("Persisting hand #{} of {} failed", record.handNumber(), record.gameId(), ex);
        }
    }

    private void publish(List<CoreEvent> events) {
        if (!events.isEmpty()) {
            listener.onEvents(Collections.unmodifiableList(events));
        }
        snapshotSequence++;
        broadcast.publish(snapshot());
    }

    private List<CoreEvent> guarded(Supplier<List<CoreEvent>> step) {
        try {
            return step.get();
        } catch (InvariantViolationException ex) {
            log.error("Invariant violated in {}, aborting tournament", engine.gameId(), ex);
            timer = null;
            nextHandDue = false;
            List<CoreEvent> events = new ArrayList<>(engine.abort(ex.getMessage()));
            sessionGuard.release(engine.gameId());
            publish(events);
            throw ex;
        }
    }

    private static boolean containsEvent(List<CoreEvent> events, CoreEventType type) {
        for (CoreEvent event : events) {
            if (event.type() == type) {
                return true;
            }
        }
        return false;
    }
}
