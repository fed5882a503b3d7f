package cn.pianzi.holdem.core.runtime;

import cn.pianzi.holdem.core.event.CoreEvent;
import cn.pianzi.holdem.core.snapshot.GameSnapshot;
import cn.pianzi.holdem.core.snapshot.TournamentResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Runs a {@link GameCoordinator} on a single-thread mailbox. Commands, decision answers and
 * timer ticks are all queued there, so the coordinator never sees two callers at once.
 */
public final class AsyncGameRuntime implements CommandDispatcher, AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(AsyncGameRuntime.class);

    private final GameCoordinator coordinator;
    private final ExecutorService mailbox;
    private final ScheduledExecutorService ticker;
    private final Duration tickInterval;
    private final CompletableFuture<TournamentResult> completion;
    private volatile ScheduledFuture<?> tickTask;

    /**
     * @param coordinatorFactory builds the coordinator around this runtime's dispatcher
     * @param tickInterval       wall-clock length of one timer second
     */
    public AsyncGameRuntime(String gameId, Function<CommandDispatcher, GameCoordinator> coordinatorFactory, Duration tickInterval) {
        Objects.requireNonNull(gameId, "gameId");
        Objects.requireNonNull(coordinatorFactory, "coordinatorFactory");
        this.tickInterval = Objects.requireNonNull(tickInterval, "tickInterval");
        if (tickInterval.isZero() || tickInterval.isNegative()) {
            throw new IllegalArgumentException("tickInterval must be positive");
        }
        this.mailbox = Executors.newSingleThreadExecutor(namedThreads("holdem-core-" + gameId + "-"));
        this.ticker = Executors.newSingleThreadScheduledExecutor(namedThreads("holdem-tick-" + gameId + "-"));
        this.completion = new CompletableFuture<>();
        this.coordinator = Objects.requireNonNull(coordinatorFactory.apply(this), "coordinator");
    }

    public CompletionStage<List<CoreEvent>> start() {
        CompletionStage<List<CoreEvent>> started = submitTask(coordinator::start);
        long periodNanos = tickInterval.toNanos();
        tickTask = ticker.scheduleAtFixedRate(this::enqueueTick, periodNanos, periodNanos, TimeUnit.NANOSECONDS);
        return started;
    }

    public CompletionStage<List<CoreEvent>> submit(GameCommand command) {
        Objects.requireNonNull(command, "command");
        return submitTask(() -> coordinator.handle(command));
    }

    public CompletionStage<List<CoreEvent>> tickSecond() {
        return submitTask(coordinator::tickSecond);
    }

    public CompletionStage<GameSnapshot> snapshot() {
        return CompletableFuture.supplyAsync(coordinator::snapshot, mailbox);
    }

    /** Completes with the result once the tournament finishes or aborts. */
    public CompletionStage<TournamentResult> completion() {
        return completion;
    }

    @Override
    public void dispatch(GameCommand command) {
        try {
            submit(command).whenComplete((events, error) -> {
                if (error != null) {
                    log.warn("Command {} rejected: {}", command, ExceptionMessages.describe(error));
                }
            });
        } catch (RejectedExecutionException ex) {
            log.debug("Mailbox closed, {} dropped", command);
        }
    }

    @Override
    public void close() {
        if (tickTask != null) {
            tickTask.cancel(false);
        }
        ticker.shutdownNow();
        mailbox.shutdown();
        try {
            if (!mailbox.awaitTermination(3, TimeUnit.SECONDS)) {
                mailbox.shutdownNow();
            }
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            mailbox.shutdownNow();
        }
        if (!completion.isDone()) {
            completion.completeExceptionally(new IllegalStateException("runtime_closed"));
        }
    }

    private void enqueueTick() {
        try {
            tickSecond().whenComplete((events, error) -> {
                if (error != null) {
                    log.error("Tick failed", error);
                }
            });
        } catch (RejectedExecutionException ex) {
            log.debug("Mailbox closed, tick dropped");
        }
    }

    private <T> CompletionStage<T> submitTask(Supplier<T> task) {
        return CompletableFuture.supplyAsync(() -> {
            try {
                return task.get();
            } finally {
                checkCompletion();
            }
        }, mailbox);
    }

    private void checkCompletion() {
        if (coordinator.finished() && !completion.isDone()) {
            coordinator.result().ifPresent(completion::complete);
            if (tickTask != null) {
                tickTask.cancel(false);
            }
        }
    }

    private static ThreadFactory namedThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + counter.getAndIncrement());
            thread.setDaemon(true);
            return thread;
        };
    }
}
