package cn.pianzi.holdem.core.port;

import cn.pianzi.holdem.core.domain.Decision;
import cn.pianzi.holdem.core.snapshot.SeatView;

import java.util.concurrent.CompletionStage;

/**
 * Produces the decision for one seat. Humans and automated players implement the same
 * contract; the coordinator never looks at how the answer was produced.
 *
 * <p>The returned stage may complete on any thread, late, exceptionally or never. The
 * coordinator bounds every request with the turn timer.
 */
@FunctionalInterface
public interface DecisionSource {
    CompletionStage<Decision> requestDecision(SeatView view);

    /**
     * Called when a previously requested decision is no longer wanted (timeout, pause,
     * or the seat acted through another channel).
     */
    default void cancelPending(int seat) {
    }
}
