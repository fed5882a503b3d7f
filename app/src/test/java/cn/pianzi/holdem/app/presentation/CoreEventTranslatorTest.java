package cn.pianzi.holdem.app.presentation;

import cn.pianzi.holdem.core.engine.TournamentEngine;
import cn.pianzi.holdem.core.event.CoreEvent;
import cn.pianzi.holdem.core.event.CoreEventType;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CoreEventTranslatorTest {
    private final CoreEventTranslator translator = new CoreEventTranslator();

    @Test
    void shouldSendHoleCardsOnlyToTheirOwner() {
        List<UserFacingEvent> events = translator.translate(List.of(CoreEvent.of(
                CoreEventType.HOLE_CARDS_DEALT,
                "hole cards dealt",
                Map.of("seat", 2, "cards", List.of("Ah", "Kd"))
        )));

        UserFacingEvent event = events.get(0);
        assertEquals("event.hole_cards", event.message());
        assertEquals(2, event.targetSeat());
        assertEquals("Ah Kd", event.data().get("hand"));
        assertTrue(event.visibleTo(2));
        assertFalse(event.visibleTo(0));
    }

    @Test
    void shouldPromptHumansPersonallyAndAnnounceAutomatedSeats() {
        List<UserFacingEvent> events = translator.translate(List.of(
                CoreEvent.of(CoreEventType.DECISION_REQUESTED, "decision requested",
                        Map.of("seat", 0, "actorType", "HUMAN", "promptId", 7L)),
                CoreEvent.of(CoreEventType.DECISION_REQUESTED, "decision requested",
                        Map.of("seat", 3, "actorType", "AUTOMATED", "promptId", 8L))
        ));

        assertEquals("event.your_turn", events.get(0).message());
        assertEquals(0, events.get(0).targetSeat());
        assertEquals(EventSeverity.WARNING, events.get(0).severity());
        assertEquals("event.thinking", events.get(1).message());
        assertNull(events.get(1).targetSeat());
    }

    @Test
    void shouldOnlySurfaceTimerTicksNearExpiry() {
        List<UserFacingEvent> events = translator.translate(List.of(
                tick(10),
                tick(CoreEventTranslator.TIMER_WARNING_SECONDS),
                tick(1)
        ));

        assertEquals(2, events.size());
        assertEquals("event.timer_running_out", events.get(0).message());
        assertEquals(CoreEventTranslator.TIMER_WARNING_SECONDS, events.get(0).data().get("remaining"));
    }

    @Test
    void shouldKeyActionsAndPotsByKind() {
        List<UserFacingEvent> events = translator.translate(List.of(
                CoreEvent.of(CoreEventType.ACTION_APPLIED, "action applied",
                        Map.of("seat", 1, "action", "RAISE", "amount", 60)),
                CoreEvent.of(CoreEventType.POT_AWARDED, "pot awarded",
                        Map.of("potIndex", 0, "amount", 90, "showdown", false)),
                CoreEvent.of(CoreEventType.POT_AWARDED, "pot awarded",
                        Map.of("potIndex", 0, "amount", 400, "showdown", true))
        ));

        assertEquals("event.action.raise", events.get(0).message());
        assertEquals("event.pot_won_uncontested", events.get(1).message());
        assertEquals("event.pot_won_at_showdown", events.get(2).message());
        assertEquals(EventSeverity.SUCCESS, events.get(2).severity());
    }

    @Test
    void shouldTranslateEngineEventsOfAFreshHand() {
        TournamentEngine engine = new TournamentEngine("translate", List.of("Ann", "Bob", "Cid"));
        List<CoreEvent> raw = new ArrayList<>(engine.startTournament());
        raw.addAll(engine.startHand());

        List<UserFacingEvent> events = translator.translate(raw);

        assertEquals(raw.size(), events.size());
        assertEquals("event.tournament_started", events.get(0).message());
        assertEquals("event.hand_started", events.get(1).message());
        assertEquals("10/20", events.get(1).data().get("blinds"));
        long personal = events.stream().filter(UserFacingEvent::isPersonal).count();
        assertEquals(3, personal);
    }

    @Test
    void shouldInjectGameIdWithoutTouchingOtherData() {
        UserFacingEvent event = UserFacingEvent.broadcast(EventSeverity.INFO, "event.hand_started", "HAND_STARTED",
                Map.of("handNumber", 4));

        UserFacingEvent enriched = event.withGameId("g-1");

        assertEquals("g-1", enriched.data().get("gameId"));
        assertEquals(4, enriched.data().get("handNumber"));
        assertFalse(event.data().containsKey("gameId"));
    }

    private static CoreEvent tick(int remaining) {
        return CoreEvent.of(CoreEventType.TURN_TIMER_TICK, "turn timer tick",
                Map.of("seat", 1, "remaining", remaining, "promptId", 3L));
    }
}
