package cn.pianzi.holdem.app.bootstrap;

import cn.pianzi.holdem.app.application.TournamentApplicationService;
import cn.pianzi.holdem.app.command.CommandOutcome;
import cn.pianzi.holdem.app.command.ConsoleCommandFacade;
import cn.pianzi.holdem.app.config.TournamentConfigLoader;
import cn.pianzi.holdem.app.decision.RandomDecisionSource;
import cn.pianzi.holdem.app.evaluator.StandardHandEvaluator;
import cn.pianzi.holdem.app.history.JsonHandHistoryStore;
import cn.pianzi.holdem.app.presentation.LoggingBroadcastSink;
import cn.pianzi.holdem.app.presentation.UserFacingEvent;
import cn.pianzi.holdem.app.util.ExceptionUtils;
import cn.pianzi.holdem.core.config.TournamentConfig;
import cn.pianzi.holdem.core.domain.TournamentMode;
import cn.pianzi.holdem.core.port.RandomSource;
import cn.pianzi.holdem.core.runtime.SessionGuard;
import cn.pianzi.holdem.core.snapshot.Standing;
import cn.pianzi.holdem.core.snapshot.TournamentResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

/**
 * Headless launcher.
 *
 * <pre>
 *   HoldemApplication [--play] [--seats N] [--config holdem.json] [--history dir]
 * </pre>
 *
 * Without {@code --play} every seat is automated and the timer runs fast; with it seat 0
 * reads commands from standard input.
 */
public final class HoldemApplication {
    private static final Logger log = LoggerFactory.getLogger(HoldemApplication.class);

    private static final int DEFAULT_SEATS = 4;
    private static final Duration SPECTATOR_TICK = Duration.ofMillis(50);
    private static final Duration PLAYER_TICK = Duration.ofSeconds(1);
    private static final Duration BOT_THINK_TIME = Duration.ofMillis(400);

    private HoldemApplication() {
    }

    public static void main(String[] args) throws Exception {
        boolean play = false;
        int seats = DEFAULT_SEATS;
        Path configFile = null;
        Path historyDir = Path.of("hand-history");
        for (int i = 0; i < args.length; i++) {
            switch (args[i]) {
                case "--play" -> play = true;
                case "--seats" -> seats = Integer.parseInt(requireValue(args, ++i));
                case "--config" -> configFile = Path.of(requireValue(args, ++i));
                case "--history" -> historyDir = Path.of(requireValue(args, ++i));
                default -> throw new IllegalArgumentException("unknown argument: " + args[i]);
            }
        }

        TournamentConfig config = configFile == null
                ? TournamentConfigLoader.loadClasspath()
                : TournamentConfigLoader.load(configFile);
        TournamentMode mode = play ? TournamentMode.PLAYER : TournamentMode.SPECTATOR;
        Duration think = play ? BOT_THINK_TIME : Duration.ZERO;
        RandomSource random = RandomSource.threadLocal();
        LoggingBroadcastSink broadcast = new LoggingBroadcastSink();

        try (TournamentApplicationService service = new TournamentApplicationService(
                config,
                new StandardHandEvaluator(),
                random,
                seat -> new RandomDecisionSource(random, think),
                broadcast,
                new JsonHandHistoryStore(historyDir),
                SessionGuard.processWide(),
                play ? PLAYER_TICK : SPECTATOR_TICK,
                HoldemApplication::printEvents
        )) {
            String gameId = "sng-" + UUID.randomUUID().toString().substring(0, 8);
            service.start(gameId, mode, seatNames(mode, seats)).toCompletableFuture().get(10, TimeUnit.SECONDS);
            CompletableFuture<TournamentResult> completion = service.completion().toCompletableFuture();
            if (play) {
                readCommands(new ConsoleCommandFacade(service), completion);
            }
            logResult(completion.get());
            broadcast.latest().ifPresent(last -> log.info("Published {} snapshots", last.sequence()));
        }
    }

    private static void readCommands(ConsoleCommandFacade facade, CompletableFuture<TournamentResult> completion) throws IOException {
        BufferedReader in = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));
        String line;
        while (!completion.isDone() && (line = in.readLine()) != null) {
            try {
                CommandOutcome outcome = facade.execute(line).toCompletableFuture().get(5, TimeUnit.SECONDS);
                if (outcome.success()) {
                    log.info("{}", outcome.message());
                    printEvents(outcome.events());
                } else {
                    log.warn("{}", outcome.message());
                }
            } catch (Exception ex) {
                log.warn("Command '{}' failed: {}", line, ExceptionUtils.rootMessage(ex));
            }
        }
    }

    private static void printEvents(List<UserFacingEvent> events) {
        for (UserFacingEvent event : events) {
            switch (event.severity()) {
                case ERROR, WARNING -> log.warn("{} {}", event.message(), event.data());
                default -> log.info("{} {}", event.message(), event.data());
            }
        }
    }

    private static void logResult(TournamentResult result) {
        if (result.aborted()) {
            log.error("Tournament {} aborted: {}", result.gameId(), result.abortReason());
        } else {
            log.info("Tournament {} won by seat {} after {} hands",
                    result.gameId(), result.winnerSeat(), result.stats().totalHands());
        }
        for (Standing standing : result.standings()) {
            log.info("  {}. {} (seat {}) {}", standing.place(), standing.name(), standing.seat(), standing.stack());
        }
        log.info("Biggest pot {} in hand #{}, best hand {}",
                result.stats().biggestPot(), result.stats().biggestPotHand(), result.stats().bestHandDescription());
    }

    private static List<String> seatNames(TournamentMode mode, int seats) {
        List<String> names = new ArrayList<>(seats);
        for (int seat = 0; seat < seats; seat++) {
            names.add(mode == TournamentMode.PLAYER && seat == 0 ? "You" : "Bot " + seat);
        }
        return names;
    }

    private static String requireValue(String[] args, int index) {
        if (index >= args.length) {
            throw new IllegalArgumentException("missing value for " + args[index - 1]);
        }
        return args[index];
    }
}
