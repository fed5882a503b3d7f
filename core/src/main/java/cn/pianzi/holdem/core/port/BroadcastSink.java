package cn.pianzi.holdem.core.port;

import cn.pianzi.holdem.core.snapshot.GameSnapshot;

@FunctionalInterface
public interface BroadcastSink {
    void publish(GameSnapshot snapshot);

    static BroadcastSink noop() {
        return snapshot -> {
        };
    }
}
