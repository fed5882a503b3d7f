package cn.pianzi.holdem.app.presentation;

import cn.pianzi.holdem.core.port.BroadcastSink;
import cn.pianzi.holdem.core.snapshot.GameSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Broadcast sink for headless runs: keeps the latest snapshot for status queries and
 * logs each one at debug. Snapshots that arrive out of order are dropped.
 */
public final class LoggingBroadcastSink implements BroadcastSink {
    private static final Logger log = LoggerFactory.getLogger(LoggingBroadcastSink.class);

    private final AtomicReference<GameSnapshot> latest = new AtomicReference<>();

    @Override
    public void publish(GameSnapshot snapshot) {
        GameSnapshot previous = latest.getAndAccumulate(snapshot,
                (current, next) -> current == null || next.sequence() > current.sequence() ? next : current);
        if (previous != null && snapshot.sequence() <= previous.sequence()) {
            log.warn("Dropping out-of-order snapshot {} (latest {})", snapshot.sequence(), previous.sequence());
            return;
        }
        if (log.isDebugEnabled()) {
            log.debug("Snapshot #{} {}: hand {} {} pot {} board {} actor {}",
                    snapshot.sequence(), snapshot.gameId(), snapshot.handNumber(), snapshot.phase(),
                    snapshot.potTotal(), snapshot.communityCards(),
                    snapshot.currentActor().isPresent() ? snapshot.currentActor().getAsInt() : "-");
        }
    }

    public Optional<GameSnapshot> latest() {
        return Optional.ofNullable(latest.get());
    }
}
