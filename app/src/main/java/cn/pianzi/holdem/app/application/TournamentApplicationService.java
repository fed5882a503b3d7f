package cn.pianzi.holdem.app.application;

import cn.pianzi.holdem.app.decision.InteractiveDecisionSource;
import cn.pianzi.holdem.app.presentation.CoreEventTranslator;
import cn.pianzi.holdem.app.presentation.UserFacingEvent;
import cn.pianzi.holdem.core.config.TournamentConfig;
import cn.pianzi.holdem.core.domain.Decision;
import cn.pianzi.holdem.core.domain.TournamentMode;
import cn.pianzi.holdem.core.engine.TournamentEngine;
import cn.pianzi.holdem.core.event.CoreEvent;
import cn.pianzi.holdem.core.port.BroadcastSink;
import cn.pianzi.holdem.core.port.DecisionSource;
import cn.pianzi.holdem.core.port.HandEvaluator;
import cn.pianzi.holdem.core.port.PersistenceSink;
import cn.pianzi.holdem.core.port.RandomSource;
import cn.pianzi.holdem.core.runtime.AsyncGameRuntime;
import cn.pianzi.holdem.core.runtime.GameCommand;
import cn.pianzi.holdem.core.runtime.GameCoordinator;
import cn.pianzi.holdem.core.runtime.SeatController;
import cn.pianzi.holdem.core.runtime.SessionGuard;
import cn.pianzi.holdem.core.snapshot.GameSnapshot;
import cn.pianzi.holdem.core.snapshot.SeatView;
import cn.pianzi.holdem.core.snapshot.TournamentResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.function.Consumer;
import java.util.function.IntFunction;

/**
 * Owns the one running tournament of this process. Starting a second game while one holds
 * the session guard fails with {@code session_busy}; a finished game is replaced by the
 * next start.
 */
public final class TournamentApplicationService implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(TournamentApplicationService.class);

    private final TournamentConfig config;
    private final HandEvaluator evaluator;
    private final RandomSource random;
    private final IntFunction<DecisionSource> automatedSources;
    private final BroadcastSink broadcast;
    private final PersistenceSink persistence;
    private final SessionGuard sessionGuard;
    private final Duration tickInterval;
    private final CoreEventTranslator eventTranslator;
    private final Consumer<List<UserFacingEvent>> sideChannel;
    private final InteractiveDecisionSource humanSource;

    private AsyncGameRuntime runtime;
    private String gameId;
    private TournamentMode mode;

    /**
     * @param automatedSources decision source for each automated seat, by seat number
     * @param sideChannel      receives the translated events the current viewer may see
     */
    public TournamentApplicationService(
            TournamentConfig config,
            HandEvaluator evaluator,
            RandomSource random,
            IntFunction<DecisionSource> automatedSources,
            BroadcastSink broadcast,
            PersistenceSink persistence,
            SessionGuard sessionGuard,
            Duration tickInterval,
            Consumer<List<UserFacingEvent>> sideChannel
    ) {
        this.config = Objects.requireNonNull(config, "config");
        this.evaluator = Objects.requireNonNull(evaluator, "evaluator");
        this.random = Objects.requireNonNull(random, "random");
        this.automatedSources = Objects.requireNonNull(automatedSources, "automatedSources");
        this.broadcast = Objects.requireNonNull(broadcast, "broadcast");
        this.persistence = Objects.requireNonNull(persistence, "persistence");
        this.sessionGuard = Objects.requireNonNull(sessionGuard, "sessionGuard");
        this.tickInterval = Objects.requireNonNull(tickInterval, "tickInterval");
        this.sideChannel = Objects.requireNonNull(sideChannel, "sideChannel");
        this.eventTranslator = new CoreEventTranslator();
        this.humanSource = new InteractiveDecisionSource();
    }

    /**
     * Seats the players and deals the first hand. In {@link TournamentMode#PLAYER} seat
     * {@value TournamentEngine#HUMAN_SEAT} is the human.
     */
    public synchronized CompletionStage<List<UserFacingEvent>> start(String gameId, TournamentMode mode, List<String> seatNames) {
        Objects.requireNonNull(gameId, "gameId");
        Objects.requireNonNull(mode, "mode");
        Objects.requireNonNull(seatNames, "seatNames");
        Optional<String> active = sessionGuard.activeGame();
        if (active.isPresent()) {
            return CompletableFuture.failedStage(new IllegalStateException("session_busy: " + active.get()));
        }
        AsyncGameRuntime next;
        try {
            TournamentEngine engine = new TournamentEngine(gameId, config, mode, seatNames, random, evaluator);
            List<SeatController> seats = seatControllers(mode, seatNames.size());
            next = new AsyncGameRuntime(gameId, dispatcher -> new GameCoordinator(
                    engine, seats, dispatcher, broadcast, persistence, events -> forward(mode, events), sessionGuard
            ), tickInterval);
        } catch (RuntimeException ex) {
            return CompletableFuture.failedStage(ex);
        }
        closeRuntime();
        runtime = next;
        this.gameId = gameId;
        this.mode = mode;
        log.info("Starting {} tournament {} with {} seats", mode, gameId, seatNames.size());
        AsyncGameRuntime started = next;
        return next.start()
                .whenComplete((events, ex) -> {
                    if (ex != null) {
                        // closing waits for the mailbox, which is running this callback
                        CompletableFuture.runAsync(started::close);
                    }
                })
                .thenApply(events -> visible(mode, events))
                .thenApply(events -> injectGameId(events, gameId));
    }

    /** Applies the human seat's decision. Fails when it is not the human's turn or the action is illegal. */
    public CompletionStage<List<UserFacingEvent>> act(Decision decision) {
        Objects.requireNonNull(decision, "decision");
        return execute(GameCommand.PlayerAction.direct(TournamentEngine.HUMAN_SEAT, decision));
    }

    public CompletionStage<List<UserFacingEvent>> pause(String reason) {
        return execute(new GameCommand.Pause(reason == null || reason.isBlank() ? "requested" : reason));
    }

    public CompletionStage<List<UserFacingEvent>> resume() {
        return execute(new GameCommand.Resume());
    }

    public CompletionStage<GameSnapshot> snapshot() {
        AsyncGameRuntime current = currentRuntime();
        if (current == null) {
            return CompletableFuture.failedStage(new IllegalStateException("no_active_game"));
        }
        return current.snapshot();
    }

    public CompletionStage<TournamentResult> completion() {
        AsyncGameRuntime current = currentRuntime();
        if (current == null) {
            return CompletableFuture.failedStage(new IllegalStateException("no_active_game"));
        }
        return current.completion();
    }

    /** The human seat's open decision request, if one is waiting. */
    public Optional<SeatView> pendingPrompt() {
        return humanSource.pendingView();
    }

    public synchronized boolean running() {
        return runtime != null && !isFinished(runtime);
    }

    /** Stops the current game; an unfinished game gives up the session guard. */
    @Override
    public synchronized void close() {
        closeRuntime();
    }

    private void closeRuntime() {
        if (runtime == null) {
            return;
        }
        runtime.close();
        if (sessionGuard.release(gameId)) {
            log.info("Closed unfinished tournament {}", gameId);
        }
        runtime = null;
        gameId = null;
        mode = null;
    }

    private CompletionStage<List<UserFacingEvent>> execute(GameCommand command) {
        AsyncGameRuntime current = currentRuntime();
        if (current == null) {
            return CompletableFuture.failedStage(new IllegalStateException("no_active_game"));
        }
        TournamentMode currentMode = currentMode();
        return current.submit(command)
                .thenApply(events -> visible(currentMode, events));
    }

    private List<SeatController> seatControllers(TournamentMode mode, int seatCount) {
        List<SeatController> seats = new ArrayList<>(seatCount);
        for (int seat = 0; seat < seatCount; seat++) {
            if (mode == TournamentMode.PLAYER && seat == TournamentEngine.HUMAN_SEAT) {
                seats.add(SeatController.human(humanSource));
            } else {
                seats.add(SeatController.automated(
                        Objects.requireNonNull(automatedSources.apply(seat), "decision source for seat " + seat)));
            }
        }
        return seats;
    }

    private void forward(TournamentMode mode, List<CoreEvent> events) {
        List<UserFacingEvent> translated = visible(mode, events);
        if (translated.isEmpty()) {
            return;
        }
        try {
            sideChannel.accept(translated);
        } catch (RuntimeException ex) {
            log.warn("Side channel rejected {} events", translated.size(), ex);
        }
    }

    private List<UserFacingEvent> visible(TournamentMode mode, List<CoreEvent> events) {
        List<UserFacingEvent> translated = eventTranslator.translate(events);
        if (mode == TournamentMode.SPECTATOR) {
            return translated;
        }
        return translated.stream()
                .filter(event -> event.visibleTo(TournamentEngine.HUMAN_SEAT))
                .toList();
    }

    private List<UserFacingEvent> injectGameId(List<UserFacingEvent> events, String gameId) {
        return events.stream()
                .map(e -> e.withGameId(gameId))
                .toList();
    }

    private synchronized AsyncGameRuntime currentRuntime() {
        return runtime;
    }

    private synchronized TournamentMode currentMode() {
        return mode;
    }

    private static boolean isFinished(AsyncGameRuntime runtime) {
        return runtime.completion().toCompletableFuture().isDone();
    }
}
