package cn.pianzi.holdem.app.presentation;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A cue for the side channel (chat, toasts, sounds). {@code targetSeat} is {@code null}
 * for events every viewer may see and names the only seat allowed to see it otherwise.
 */
public record UserFacingEvent(
        EventSeverity severity,
        String message,
        Integer targetSeat,
        String sourceType,
        Map<String, Object> data
) {
    public UserFacingEvent {
        Objects.requireNonNull(severity, "severity");
        Objects.requireNonNull(message, "message");
        data = safeCopy(data);
    }

    private static Map<String, Object> safeCopy(Map<String, Object> input) {
        if (input == null || input.isEmpty()) {
            return Map.of();
        }
        // Map.copyOf() rejects null values, so filter them out
        LinkedHashMap<String, Object> clean = new LinkedHashMap<>();
        for (Map.Entry<String, Object> entry : input.entrySet()) {
            if (entry.getKey() != null && entry.getValue() != null) {
                clean.put(entry.getKey(), entry.getValue());
            }
        }
        return Map.copyOf(clean);
    }

    public UserFacingEvent withGameId(String gameId) {
        LinkedHashMap<String, Object> enriched = new LinkedHashMap<>(data);
        enriched.put("gameId", gameId);
        return new UserFacingEvent(severity, message, targetSeat, sourceType, enriched);
    }

    public boolean isPersonal() {
        return targetSeat != null;
    }

    /** Whether the player at {@code seat} may see this event. */
    public boolean visibleTo(int seat) {
        return targetSeat == null || targetSeat == seat;
    }

    public static UserFacingEvent broadcast(EventSeverity severity, String message, String sourceType, Map<String, Object> data) {
        return new UserFacingEvent(severity, message, null, sourceType, data);
    }

    public static UserFacingEvent personal(EventSeverity severity, String message, int targetSeat, String sourceType, Map<String, Object> data) {
        return new UserFacingEvent(severity, message, targetSeat, sourceType, data);
    }
}
