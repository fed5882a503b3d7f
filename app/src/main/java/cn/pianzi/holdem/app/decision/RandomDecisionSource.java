package cn.pianzi.holdem.app.decision;

import cn.pianzi.holdem.core.domain.ActionType;
import cn.pianzi.holdem.core.domain.Decision;
import cn.pianzi.holdem.core.port.DecisionSource;
import cn.pianzi.holdem.core.port.RandomSource;
import cn.pianzi.holdem.core.snapshot.SeatView;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.TimeUnit;

/**
 * Automated player that picks among the legal actions at random. Raises land between the
 * minimum raise and three times it, capped at the seat's all-in total.
 */
public final class RandomDecisionSource implements DecisionSource {
    private static final int CHECK_PERCENT = 70;
    private static final int FOLD_PERCENT = 20;
    private static final int CALL_PERCENT = 60;

    private final RandomSource random;
    private final Duration thinkTime;

    public RandomDecisionSource(RandomSource random) {
        this(random, Duration.ZERO);
    }

    /**
     * @param thinkTime delay before the answer completes; zero answers synchronously
     */
    public RandomDecisionSource(RandomSource random, Duration thinkTime) {
        this.random = Objects.requireNonNull(random, "random");
        this.thinkTime = Objects.requireNonNull(thinkTime, "thinkTime");
        if (thinkTime.isNegative()) {
            throw new IllegalArgumentException("thinkTime must not be negative");
        }
    }

    public static RandomDecisionSource seeded(long seed) {
        return new RandomDecisionSource(RandomSource.seeded(seed));
    }

    @Override
    public CompletionStage<Decision> requestDecision(SeatView view) {
        if (thinkTime.isZero()) {
            return CompletableFuture.completedFuture(decide(view));
        }
        return CompletableFuture.supplyAsync(() -> decide(view),
                CompletableFuture.delayedExecutor(thinkTime.toMillis(), TimeUnit.MILLISECONDS));
    }

    Decision decide(SeatView view) {
        int roll = random.nextIntInclusive(1, 100);
        if (view.canCheck()) {
            if (roll <= CHECK_PERCENT || !view.canRaise()) {
                return Decision.check();
            }
            return raise(view);
        }
        if (roll <= FOLD_PERCENT && view.legalActions().contains(ActionType.FOLD)) {
            return Decision.fold();
        }
        if (roll <= FOLD_PERCENT + CALL_PERCENT || !view.canRaise()) {
            return view.legalActions().contains(ActionType.CALL) ? Decision.call() : Decision.fold();
        }
        return raise(view);
    }

    private Decision raise(SeatView view) {
        int min = view.minRaiseTo();
        int max = Math.max(min, Math.min(view.maxRaiseTo(), min * 3));
        return Decision.raiseTo(random.nextIntInclusive(min, max));
    }
}
