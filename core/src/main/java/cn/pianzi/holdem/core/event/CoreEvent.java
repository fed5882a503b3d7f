package cn.pianzi.holdem.core.event;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

public record CoreEvent(CoreEventType type, String message, Map<String, Object> data) {
    public CoreEvent {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(message, "message");
        data = safeCopy(data);
    }

    private static Map<String, Object> safeCopy(Map<String, Object> input) {
        if (input == null || input.isEmpty()) {
            return Map.of();
        }
        // null values are dropped, Map.copyOf would reject them
        LinkedHashMap<String, Object> copy = new LinkedHashMap<>();
        for (Map.Entry<String, Object> entry : input.entrySet()) {
            if (entry.getKey() != null && entry.getValue() != null) {
                copy.put(entry.getKey(), entry.getValue());
            }
        }
        return Collections.unmodifiableMap(copy);
    }

    public static CoreEvent of(CoreEventType type, String message) {
        return new CoreEvent(type, message, Map.of());
    }

    public static CoreEvent of(CoreEventType type, String message, Map<String, Object> data) {
        return new CoreEvent(type, message, data);
    }

    public int intValue(String key, int fallback) {
        Object value = data.get(key);
        return value instanceof Number number ? number.intValue() : fallback;
    }
}
