package cn.pianzi.holdem.app.decision;

import cn.pianzi.holdem.core.domain.Decision;
import cn.pianzi.holdem.core.engine.TournamentEngine;
import cn.pianzi.holdem.core.snapshot.SeatView;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class InteractiveDecisionSourceTest {

    @Test
    void shouldParkViewUntilCancelled() {
        InteractiveDecisionSource source = new InteractiveDecisionSource();
        SeatView view = currentView();

        CompletableFuture<Decision> answer = source.requestDecision(view).toCompletableFuture();

        assertEquals(view, source.pendingView().orElseThrow());
        assertFalse(answer.isDone());

        source.cancelPending(view.seat() + 1);
        assertTrue(source.pendingView().isPresent());

        source.cancelPending(view.seat());
        assertTrue(answer.isCancelled());
        assertTrue(source.pendingView().isEmpty());
    }

    @Test
    void shouldCancelOlderRequestWhenPromptedAgain() {
        InteractiveDecisionSource source = new InteractiveDecisionSource();
        SeatView view = currentView();

        CompletableFuture<Decision> first = source.requestDecision(view.withPromptId(1)).toCompletableFuture();
        CompletableFuture<Decision> second = source.requestDecision(view.withPromptId(2)).toCompletableFuture();

        assertTrue(first.isCancelled());
        assertFalse(second.isDone());
        assertEquals(2, source.pendingView().orElseThrow().promptId());
    }

    private static SeatView currentView() {
        TournamentEngine engine = new TournamentEngine("interactive", List.of("Ann", "Bob", "Cid"));
        engine.startTournament();
        engine.startHand();
        return engine.seatView(engine.currentActor().getAsInt());
    }
}
