package cn.pianzi.holdem.core.port;

import cn.pianzi.holdem.core.snapshot.HandRecord;

@FunctionalInterface
public interface PersistenceSink {
    void handCompleted(HandRecord record);

    static PersistenceSink noop() {
        return record -> {
        };
    }
}
