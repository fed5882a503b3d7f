package cn.pianzi.holdem.core.port;

import cn.pianzi.holdem.core.event.CoreEvent;

import java.util.List;

/**
 * Subscriber side of the event bus. The engine publishes facts (all-in, showdown,
 * elimination, ...) without knowing who listens.
 */
@FunctionalInterface
public interface CoreEventListener {
    void onEvents(List<CoreEvent> events);
}
