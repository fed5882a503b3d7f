package cn.pianzi.holdem.app.presentation;

import cn.pianzi.holdem.core.event.CoreEvent;
import cn.pianzi.holdem.core.event.CoreEventType;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Turns engine facts into side-channel cues. Hole cards and decision prompts for humans
 * are personal; everything else is broadcast. Timer ticks only surface for the last
 * {@value #TIMER_WARNING_SECONDS} seconds.
 */
public final class CoreEventTranslator {
    static final int TIMER_WARNING_SECONDS = 5;

    public List<UserFacingEvent> translate(List<CoreEvent> events) {
        if (events.isEmpty()) {
            return List.of();
        }
        List<UserFacingEvent> result = new ArrayList<>(events.size());
        for (CoreEvent event : events) {
            UserFacingEvent translated = translateOne(event);
            if (translated != null) {
                result.add(translated);
            }
        }
        return result;
    }

    private UserFacingEvent translateOne(CoreEvent event) {
        CoreEventType type = event.type();
        String typeName = type.name();
        Map<String, Object> data = event.data();
        return switch (type) {
            case TOURNAMENT_STARTED -> UserFacingEvent.broadcast(
                    EventSeverity.SUCCESS,
                    "event.tournament_started",
                    typeName,
                    data
            );
            case HAND_STARTED -> UserFacingEvent.broadcast(
                    EventSeverity.INFO,
                    "event.hand_started",
                    typeName,
                    withEntries(data, Map.of(
                            "blinds", data.getOrDefault("smallBlind", "?") + "/" + data.getOrDefault("bigBlind", "?")
                    ))
            );
            case BLIND_POSTED -> UserFacingEvent.broadcast(
                    EventSeverity.INFO,
                    "event.blind_posted",
                    typeName,
                    data
            );
            case HOLE_CARDS_DEALT -> UserFacingEvent.personal(
                    EventSeverity.INFO,
                    "event.hole_cards",
                    event.intValue("seat", -1),
                    typeName,
                    withEntries(data, Map.of("hand", joinCards(data.get("cards"))))
            );
            case PHASE_CHANGED -> UserFacingEvent.broadcast(
                    EventSeverity.INFO,
                    "event.phase_changed",
                    typeName,
                    withEntries(data, Map.of("street", streetName(data.get("phase"))))
            );
            case COMMUNITY_DEALT -> UserFacingEvent.broadcast(
                    EventSeverity.INFO,
                    "event.community_dealt",
                    typeName,
                    withEntries(data, Map.of(
                            "street", streetName(data.get("phase")),
                            "boardText", joinCards(data.get("board"))
                    ))
            );
            case TURN_CHANGED -> UserFacingEvent.broadcast(
                    EventSeverity.INFO,
                    "event.turn_changed",
                    typeName,
                    data
            );
            case DECISION_REQUESTED -> "HUMAN".equals(data.get("actorType"))
                    ? UserFacingEvent.personal(
                            EventSeverity.WARNING,
                            "event.your_turn",
                            event.intValue("seat", -1),
                            typeName,
                            data)
                    : UserFacingEvent.broadcast(
                            EventSeverity.INFO,
                            "event.thinking",
                            typeName,
                            data);
            case ACTION_APPLIED -> UserFacingEvent.broadcast(
                    EventSeverity.INFO,
                    actionMessageKey(data.get("action")),
                    typeName,
                    data
            );
            case ALL_IN -> UserFacingEvent.broadcast(
                    EventSeverity.WARNING,
                    "event.all_in",
                    typeName,
                    data
            );
            case SHOWDOWN -> UserFacingEvent.broadcast(
                    EventSeverity.INFO,
                    "event.showdown",
                    typeName,
                    withEntries(data, Map.of("boardText", joinCards(data.get("board"))))
            );
            case POT_AWARDED -> UserFacingEvent.broadcast(
                    EventSeverity.SUCCESS,
                    Boolean.TRUE.equals(data.get("showdown")) ? "event.pot_won_at_showdown" : "event.pot_won_uncontested",
                    typeName,
                    data
            );
            case HAND_COMPLETED -> UserFacingEvent.broadcast(
                    EventSeverity.INFO,
                    "event.hand_completed",
                    typeName,
                    data
            );
            case PLAYER_ELIMINATED -> UserFacingEvent.broadcast(
                    EventSeverity.ERROR,
                    "event.player_eliminated",
                    typeName,
                    data
            );
            case BLINDS_INCREASED -> UserFacingEvent.broadcast(
                    EventSeverity.WARNING,
                    "event.blinds_increased",
                    typeName,
                    data
            );
            case TOURNAMENT_COMPLETED -> UserFacingEvent.broadcast(
                    EventSeverity.SUCCESS,
                    "event.tournament_completed",
                    typeName,
                    data
            );
            case TOURNAMENT_ABORTED -> UserFacingEvent.broadcast(
                    EventSeverity.ERROR,
                    "event.tournament_aborted",
                    typeName,
                    data
            );
            case GAME_PAUSED -> UserFacingEvent.broadcast(
                    EventSeverity.WARNING,
                    "event.game_paused",
                    typeName,
                    data
            );
            case GAME_RESUMED -> UserFacingEvent.broadcast(
                    EventSeverity.INFO,
                    "event.game_resumed",
                    typeName,
                    data
            );
            case TURN_TIMER_TICK -> timerWarning(event);
            case TURN_TIMED_OUT -> UserFacingEvent.broadcast(
                    EventSeverity.WARNING,
                    "event.turn_timed_out",
                    typeName,
                    data
            );
        };
    }

    private UserFacingEvent timerWarning(CoreEvent event) {
        int remaining = event.intValue("remaining", Integer.MAX_VALUE);
        if (remaining <= 0 || remaining > TIMER_WARNING_SECONDS) {
            return null;
        }
        return UserFacingEvent.broadcast(
                EventSeverity.WARNING,
                "event.timer_running_out",
                event.type().name(),
                event.data()
        );
    }

    private Map<String, Object> withEntries(Map<String, Object> base, Map<String, Object> extra) {
        LinkedHashMap<String, Object> merged = new LinkedHashMap<>(base);
        for (Map.Entry<String, Object> entry : extra.entrySet()) {
            if (entry.getKey() != null && entry.getValue() != null) {
                merged.put(entry.getKey(), entry.getValue());
            }
        }
        return merged;
    }

    private String actionMessageKey(Object action) {
        if (action == null) {
            return "event.action";
        }
        return "event.action." + String.valueOf(action).toLowerCase(Locale.ROOT);
    }

    private String streetName(Object phase) {
        if (phase == null) {
            return "?";
        }
        return switch (String.valueOf(phase)) {
            case "PRE_FLOP" -> "preflop";
            case "FLOP" -> "flop";
            case "TURN" -> "turn";
            case "RIVER" -> "river";
            case "SHOWDOWN" -> "showdown";
            default -> String.valueOf(phase).toLowerCase(Locale.ROOT);
        };
    }

    private String joinCards(Object cards) {
        if (cards instanceof List<?> list) {
            List<String> names = new ArrayList<>(list.size());
            for (Object card : list) {
                names.add(String.valueOf(card));
            }
            return String.join(" ", names);
        }
        return "";
    }
}
