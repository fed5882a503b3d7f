package cn.pianzi.holdem.app.decision;

import cn.pianzi.holdem.core.domain.Decision;
import cn.pianzi.holdem.core.port.DecisionSource;
import cn.pianzi.holdem.core.snapshot.SeatView;

import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Decision source for the human seat. A request parks the seat's view so the console can
 * show it; the player's typed command reaches the coordinator directly, which then cancels
 * the parked request. The turn timer bounds how long it stays parked.
 */
public final class InteractiveDecisionSource implements DecisionSource {
    private final AtomicReference<Pending> pending = new AtomicReference<>();

    @Override
    public CompletionStage<Decision> requestDecision(SeatView view) {
        Objects.requireNonNull(view, "view");
        Pending next = new Pending(view, new CompletableFuture<>());
        Pending previous = pending.getAndSet(next);
        if (previous != null) {
            previous.answer().cancel(false);
        }
        return next.answer();
    }

    /** The view of the request waiting for an answer, if any. */
    public Optional<SeatView> pendingView() {
        Pending current = pending.get();
        return current == null ? Optional.empty() : Optional.of(current.view());
    }

    @Override
    public void cancelPending(int seat) {
        Pending current = pending.get();
        if (current != null && current.view().seat() == seat && pending.compareAndSet(current, null)) {
            current.answer().cancel(false);
        }
    }

    private record Pending(SeatView view, CompletableFuture<Decision> answer) {
    }
}
