package cn.pianzi.holdem.app.history;

import cn.pianzi.holdem.app.evaluator.StandardHandEvaluator;
import cn.pianzi.holdem.core.config.TournamentConfig;
import cn.pianzi.holdem.core.domain.ActionType;
import cn.pianzi.holdem.core.domain.Decision;
import cn.pianzi.holdem.core.domain.TournamentMode;
import cn.pianzi.holdem.core.engine.HandReplayer;
import cn.pianzi.holdem.core.engine.TournamentEngine;
import cn.pianzi.holdem.core.port.RandomSource;
import cn.pianzi.holdem.core.snapshot.HandRecord;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class JsonHandHistoryStoreTest {
    private static final StandardHandEvaluator EVALUATOR = new StandardHandEvaluator();

    @Test
    void shouldAppendOneLinePerHandAndReadThemBack(@TempDir Path dir) throws Exception {
        TournamentEngine engine = engine("archive", 11L);
        JsonHandHistoryStore store = new JsonHandHistoryStore(dir);

        HandRecord first = playCheckDownHand(engine);
        store.handCompleted(first);
        HandRecord second = playCheckDownHand(engine);
        store.handCompleted(second);

        assertEquals(2, Files.readAllLines(store.fileFor("archive")).size());
        List<HandRecord> loaded = store.load("archive");
        assertEquals(List.of(first, second), loaded);
    }

    @Test
    void shouldReplayLoadedHandToTheSameOutcome(@TempDir Path dir) throws Exception {
        TournamentEngine engine = engine("replayed", 29L);
        JsonHandHistoryStore store = new JsonHandHistoryStore(dir);
        HandRecord original = playCheckDownHand(engine);
        store.handCompleted(original);

        HandRecord loaded = store.load("replayed").get(0);
        HandReplayer.Replay replay = new HandReplayer(engine.config(), EVALUATOR).replay(loaded);

        assertTrue(replay.matches(original));
    }

    @Test
    void shouldReturnNothingForUnknownGame(@TempDir Path dir) throws Exception {
        JsonHandHistoryStore store = new JsonHandHistoryStore(dir.resolve("nested"));

        assertTrue(store.load("never-played").isEmpty());
    }

    @Test
    void shouldKeepFileNamesInsideTheHistoryFolder(@TempDir Path dir) {
        JsonHandHistoryStore store = new JsonHandHistoryStore(dir);

        Path file = store.fileFor("../evil/game");

        assertEquals(dir, file.getParent());
        assertEquals(".._evil_game.jsonl", file.getFileName().toString());
    }

    private static TournamentEngine engine(String gameId, long seed) {
        TournamentEngine engine = new TournamentEngine(gameId, TournamentConfig.defaults(), TournamentMode.SPECTATOR,
                List.of("Ann", "Bob", "Cid"), RandomSource.seeded(seed), EVALUATOR);
        engine.startTournament();
        return engine;
    }

    /** Everyone calls or checks to the river. */
    private static HandRecord playCheckDownHand(TournamentEngine engine) {
        engine.startHand();
        int handNumber = engine.handNumber();
        while (engine.currentActor().isPresent()) {
            int seat = engine.currentActor().getAsInt();
            Decision decision = engine.legalActions(seat).contains(ActionType.CHECK) ? Decision.check() : Decision.call();
            engine.applyAction(seat, decision);
        }
        HandRecord record = engine.lastHandRecord().orElseThrow();
        assertEquals(handNumber, record.handNumber());
        return record;
    }
}
