package cn.pianzi.holdem.app.command;

import cn.pianzi.holdem.app.presentation.UserFacingEvent;

import java.util.List;

/**
 * Result of one console command. {@code message} is a message key on success and the
 * rejection reason on failure.
 */
public record CommandOutcome(
        boolean success,
        String message,
        List<UserFacingEvent> events
) {
    public CommandOutcome {
        events = List.copyOf(events);
    }

    public static CommandOutcome success(String message, List<UserFacingEvent> events) {
        return new CommandOutcome(true, message, events);
    }

    public static CommandOutcome failure(String reason) {
        return new CommandOutcome(false, reason, List.of());
    }

    public boolean hasEvent(String messageKey) {
        for (UserFacingEvent event : events) {
            if (event.message().equals(messageKey)) {
                return true;
            }
        }
        return false;
    }
}
