package cn.pianzi.holdem.core.runtime;

import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Allows one active tournament at a time. Acquired when a game starts and released when
 * it completes or aborts.
 */
public final class SessionGuard {
    private static final SessionGuard PROCESS_WIDE = new SessionGuard();

    private final AtomicReference<String> activeGame = new AtomicReference<>();

    public static SessionGuard processWide() {
        return PROCESS_WIDE;
    }

    /** A guard independent of the process-wide one, for embedding several engines in tests. */
    public static SessionGuard isolated() {
        return new SessionGuard();
    }

    public void acquire(String gameId) {
        Objects.requireNonNull(gameId, "gameId");
        if (!activeGame.compareAndSet(null, gameId)) {
            throw new IllegalStateException("session_busy: " + activeGame.get());
        }
    }

    public boolean release(String gameId) {
        return activeGame.compareAndSet(gameId, null);
    }

    public Optional<String> activeGame() {
        return Optional.ofNullable(activeGame.get());
    }

    public boolean isHeld() {
        return activeGame.get() != null;
    }
}
