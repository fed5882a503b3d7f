package cn.pianzi.holdem.core.engine;

import cn.pianzi.holdem.core.config.BlindLevel;
import cn.pianzi.holdem.core.config.TournamentConfig;
import cn.pianzi.holdem.core.domain.Decision;
import cn.pianzi.holdem.core.domain.GamePhase;
import cn.pianzi.holdem.core.domain.HandScore;
import cn.pianzi.holdem.core.domain.TournamentMode;
import cn.pianzi.holdem.core.domain.TournamentStatus;
import cn.pianzi.holdem.core.event.CoreEvent;
import cn.pianzi.holdem.core.event.CoreEventType;
import cn.pianzi.holdem.core.port.HandEvaluator;
import cn.pianzi.holdem.core.port.RandomSource;
import cn.pianzi.holdem.core.snapshot.HandRecord;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class HandReplayerTest {
    private static final HandEvaluator BOARD_AWARE = (hole, board) -> {
        int score = 0;
        for (int i = 0; i < board.size(); i++) {
            score += board.get(i).rank() * (i + 1);
        }
        int kicker = Math.max(hole.get(0).rank(), hole.get(1).rank());
        return new HandScore(100 - kicker - (hole.get(0).rank() + hole.get(1).rank() + score) % 7, "scripted");
    };

    @Test
    void shouldReproduceSidePotHandFromRecord() {
        TournamentEngine engine = TournamentEngineTest.engine(BOARD_AWARE, 100, 300, 1000);
        engine.beginHand(Deck.standard(), 0, 0, new BlindLevel(10, 20));
        engine.applyAction(0, Decision.raiseTo(100));
        engine.applyAction(1, Decision.raiseTo(300));
        engine.applyAction(2, Decision.call());
        HandRecord record = engine.lastHandRecord().orElseThrow();

        HandReplayer.Replay replay = new HandReplayer(TournamentConfig.defaults(), BOARD_AWARE).replay(record);

        assertEquals(record.pots(), replay.pots());
        assertEquals(Map.of(0, engine.stack(0), 1, engine.stack(1), 2, engine.stack(2)), replay.endingStacks());
        assertEquals(record.communityCards(), replay.record().communityCards());
        assertEquals(record.actions(), replay.record().actions());
    }

    @Test
    void shouldReproduceEveryHandOfARandomTournament() {
        TournamentConfig config = TournamentConfig.defaults();
        TournamentEngine engine = new TournamentEngine("replay", config, TournamentMode.SPECTATOR,
                List.of("a", "b", "c", "d"), RandomSource.seeded(99L), BOARD_AWARE);
        HandReplayer replayer = new HandReplayer(config, BOARD_AWARE);
        Random decisions = new Random(5L);
        engine.startTournament();

        int replayed = 0;
        int steps = 0;
        while (engine.status() != TournamentStatus.COMPLETED) {
            assertTrue(++steps < 200_000, "tournament did not finish");
            List<CoreEvent> events;
            if (engine.phase() == GamePhase.BETWEEN_HANDS) {
                events = engine.startHand();
            } else {
                int seat = engine.currentActor().getAsInt();
                events = engine.applyAction(seat, TournamentEngineTest.randomDecision(engine.seatView(seat), decisions));
            }
            if (events.stream().anyMatch(event -> event.type() == CoreEventType.HAND_COMPLETED)) {
                HandRecord record = engine.lastHandRecord().orElseThrow();
                assertTrue(replayer.replay(record).matches(record), "hand " + record.handNumber());
                replayed++;
            }
        }

        assertEquals(engine.handsPlayed(), replayed);
    }
}
