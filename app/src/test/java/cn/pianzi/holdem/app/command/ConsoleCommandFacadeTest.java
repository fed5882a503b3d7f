package cn.pianzi.holdem.app.command;

import cn.pianzi.holdem.app.application.TournamentApplicationService;
import cn.pianzi.holdem.app.evaluator.StandardHandEvaluator;
import cn.pianzi.holdem.core.config.TournamentConfig;
import cn.pianzi.holdem.core.domain.Decision;
import cn.pianzi.holdem.core.domain.TournamentMode;
import cn.pianzi.holdem.core.port.BroadcastSink;
import cn.pianzi.holdem.core.port.DecisionSource;
import cn.pianzi.holdem.core.port.PersistenceSink;
import cn.pianzi.holdem.core.port.RandomSource;
import cn.pianzi.holdem.core.runtime.SessionGuard;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ConsoleCommandFacadeTest {
    private static final DecisionSource CALLING = view ->
            CompletableFuture.completedFuture(view.canCheck() ? Decision.check() : Decision.call());

    private TournamentApplicationService service;
    private ConsoleCommandFacade facade;

    @BeforeEach
    void setUp() throws Exception {
        service = new TournamentApplicationService(
                TournamentConfig.defaults(),
                new StandardHandEvaluator(),
                RandomSource.seeded(3L),
                seat -> CALLING,
                BroadcastSink.noop(),
                PersistenceSink.noop(),
                SessionGuard.isolated(),
                Duration.ofHours(1),
                events -> {
                }
        );
        facade = new ConsoleCommandFacade(service);
        service.start("console", TournamentMode.PLAYER, List.of("You", "Bot 1", "Bot 2"))
                .toCompletableFuture().get(5, TimeUnit.SECONDS);
        awaitHumanTurn();
    }

    @AfterEach
    void tearDown() {
        service.close();
    }

    @Test
    void shouldReportMalformedCommands() throws Exception {
        assertEquals("command.empty", run(" ").message());
        assertEquals("command.unknown: dance", run("dance").message());
        assertEquals("command.raise_amount_required", run("raise").message());
        assertEquals("command.invalid_amount: lots", run("raise lots").message());
    }

    @Test
    void shouldShowStatusWithTheHumansOptions() throws Exception {
        CommandOutcome outcome = run("status");

        assertTrue(outcome.success());
        Map<String, Object> data = outcome.events().get(0).data();
        assertEquals(1, data.get("handNumber"));
        assertEquals("PRE_FLOP", data.get("phase"));
        assertEquals(0, data.get("actor"));
        assertTrue(((List<?>) data.get("legalActions")).contains("FOLD"));
        assertEquals(2, ((List<?>) data.get("hand")).size());
    }

    @Test
    void shouldRejectIllegalRaiseWithoutChangingTheTurn() throws Exception {
        CommandOutcome outcome = run("raise 1");

        assertFalse(outcome.success());
        assertTrue(outcome.message().startsWith("raise_"), outcome.message());
        assertTrue(service.pendingPrompt().isPresent());
    }

    @Test
    void shouldFoldOnceAndRejectActingOutOfTurn() throws Exception {
        CommandOutcome folded = run("FOLD");

        assertTrue(folded.success(), folded.message());
        assertEquals("command.result.folded", folded.message());
        assertTrue(folded.hasEvent("event.action.fold"));

        CommandOutcome again = run("fold");
        assertFalse(again.success());
    }

    @Test
    void shouldPauseAndResume() throws Exception {
        CommandOutcome paused = run("pause tea break");

        assertTrue(paused.success(), paused.message());
        assertTrue(paused.hasEvent("event.game_paused"));
        assertEquals("tea break", paused.events().get(0).data().get("reason"));
        assertTrue(service.pendingPrompt().isEmpty());

        CommandOutcome blocked = run("check");
        assertFalse(blocked.success());

        CommandOutcome resumed = run("resume");
        assertTrue(resumed.success(), resumed.message());
        assertTrue(resumed.hasEvent("event.game_resumed"));
        awaitHumanTurn();
    }

    private CommandOutcome run(String line) throws Exception {
        return facade.execute(line).toCompletableFuture().get(5, TimeUnit.SECONDS);
    }

    private void awaitHumanTurn() throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        while (service.pendingPrompt().isEmpty()) {
            if (System.nanoTime() > deadline) {
                throw new AssertionError("human seat was never prompted");
            }
            Thread.sleep(5);
        }
    }
}
