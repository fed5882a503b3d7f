package cn.pianzi.holdem.app.application;

import cn.pianzi.holdem.app.decision.RandomDecisionSource;
import cn.pianzi.holdem.app.evaluator.StandardHandEvaluator;
import cn.pianzi.holdem.app.presentation.UserFacingEvent;
import cn.pianzi.holdem.app.util.ExceptionUtils;
import cn.pianzi.holdem.core.config.TournamentConfig;
import cn.pianzi.holdem.core.domain.Decision;
import cn.pianzi.holdem.core.domain.TournamentMode;
import cn.pianzi.holdem.core.port.BroadcastSink;
import cn.pianzi.holdem.core.port.DecisionSource;
import cn.pianzi.holdem.core.port.PersistenceSink;
import cn.pianzi.holdem.core.port.RandomSource;
import cn.pianzi.holdem.core.runtime.SessionGuard;
import cn.pianzi.holdem.core.snapshot.HandRecord;
import cn.pianzi.holdem.core.snapshot.TournamentResult;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;
import java.util.function.IntFunction;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TournamentApplicationServiceTest {
    private static final DecisionSource CALLING = view ->
            CompletableFuture.completedFuture(view.canCheck() ? Decision.check() : Decision.call());

    @Test
    void shouldPlaySpectatorTournamentToCompletion() throws Exception {
        List<HandRecord> archived = new CopyOnWriteArrayList<>();
        List<UserFacingEvent> sideChannel = new CopyOnWriteArrayList<>();
        SessionGuard guard = SessionGuard.isolated();

        try (TournamentApplicationService service = service(
                guard, seat -> RandomDecisionSource.seeded(100L + seat), archived::add, Duration.ofMillis(2), sideChannel::addAll)) {
            List<UserFacingEvent> opening = service.start("spectate", TournamentMode.SPECTATOR, names(4))
                    .toCompletableFuture().get(5, TimeUnit.SECONDS);
            TournamentResult result = service.completion().toCompletableFuture().get(60, TimeUnit.SECONDS);

            assertEquals("event.tournament_started", opening.get(0).message());
            assertEquals("spectate", opening.get(0).data().get("gameId"));
            assertFalse(result.aborted());
            assertEquals(4, result.standings().size());
            assertEquals(4000, result.standings().get(0).stack());
            assertEquals(result.standings().get(0).seat(), result.winnerSeat());
            assertEquals(result.stats().totalHands(), archived.size());
            assertTrue(sideChannel.stream().anyMatch(e -> e.message().equals("event.tournament_completed")));
            assertTrue(sideChannel.stream().anyMatch(e -> e.message().equals("event.hole_cards")));
            assertFalse(guard.isHeld());
            assertFalse(service.running());
        }
    }

    @Test
    void shouldRejectSecondStartWhileGameIsRunning() throws Exception {
        SessionGuard guard = SessionGuard.isolated();
        try (TournamentApplicationService service = service(guard, seat -> CALLING, PersistenceSink.noop(), Duration.ofHours(1), events -> {
        })) {
            service.start("first", TournamentMode.PLAYER, names(3)).toCompletableFuture().get(5, TimeUnit.SECONDS);

            Throwable failure = failureOf(service.start("second", TournamentMode.SPECTATOR, names(3)));

            assertEquals("session_busy: first", ExceptionUtils.rootMessage(failure));
            assertTrue(service.running());
            assertEquals("first", guard.activeGame().orElseThrow());
        }
        assertFalse(guard.isHeld());
    }

    @Test
    void shouldHideOtherSeatsHoleCardsFromThePlayer() throws Exception {
        List<UserFacingEvent> sideChannel = new CopyOnWriteArrayList<>();
        try (TournamentApplicationService service = service(
                SessionGuard.isolated(), seat -> CALLING, PersistenceSink.noop(), Duration.ofHours(1), sideChannel::addAll)) {
            List<UserFacingEvent> opening = service.start("private", TournamentMode.PLAYER, names(3))
                    .toCompletableFuture().get(5, TimeUnit.SECONDS);

            List<UserFacingEvent> holeCards = opening.stream()
                    .filter(e -> e.message().equals("event.hole_cards"))
                    .toList();
            assertEquals(1, holeCards.size());
            assertEquals(0, holeCards.get(0).targetSeat());
            assertTrue(sideChannel.stream().allMatch(e -> e.visibleTo(0)));
        }
    }

    @Test
    void shouldReportInvalidSeatCountAndStayAvailable() throws Exception {
        SessionGuard guard = SessionGuard.isolated();
        try (TournamentApplicationService service = service(guard, seat -> CALLING, PersistenceSink.noop(), Duration.ofHours(1), events -> {
        })) {
            Throwable failure = failureOf(service.start("lonely", TournamentMode.SPECTATOR, names(1)));

            assertTrue(failure instanceof IllegalArgumentException, String.valueOf(failure));
            assertFalse(guard.isHeld());

            service.start("table", TournamentMode.PLAYER, names(2)).toCompletableFuture().get(5, TimeUnit.SECONDS);
            assertEquals("table", guard.activeGame().orElseThrow());
        }
    }

    @Test
    void shouldFailCommandsWithoutActiveGame() throws Exception {
        try (TournamentApplicationService service = service(
                SessionGuard.isolated(), seat -> CALLING, PersistenceSink.noop(), Duration.ofHours(1), events -> {
                })) {
            assertEquals("no_active_game", ExceptionUtils.rootMessage(failureOf(service.act(Decision.fold()))));
            assertEquals("no_active_game", ExceptionUtils.rootMessage(failureOf(service.snapshot())));
            assertFalse(service.running());
        }
    }

    static TournamentApplicationService service(
            SessionGuard guard,
            IntFunction<DecisionSource> bots,
            PersistenceSink persistence,
            Duration tick,
            Consumer<List<UserFacingEvent>> sideChannel
    ) {
        return new TournamentApplicationService(
                TournamentConfig.defaults(),
                new StandardHandEvaluator(),
                RandomSource.seeded(5L),
                bots,
                BroadcastSink.noop(),
                persistence,
                guard,
                tick,
                sideChannel
        );
    }

    static List<String> names(int seats) {
        List<String> names = new ArrayList<>(seats);
        for (int seat = 0; seat < seats; seat++) {
            names.add("Seat " + seat);
        }
        return names;
    }

    private static Throwable failureOf(CompletionStage<?> stage) throws Exception {
        Throwable failure = stage.handle((value, ex) -> ex).toCompletableFuture().get(5, TimeUnit.SECONDS);
        assertTrue(failure != null, "stage should have failed");
        return failure instanceof CompletionException && failure.getCause() != null ? failure.getCause() : failure;
    }
}
