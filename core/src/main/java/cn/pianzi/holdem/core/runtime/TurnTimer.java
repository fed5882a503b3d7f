package cn.pianzi.holdem.core.runtime;

/**
 * Countdown for one decision opportunity, advanced by coordinator ticks.
 */
public final class TurnTimer {
    private final int seat;
    private final long promptId;
    private int remainingSeconds;

    public TurnTimer(int seat, long promptId, int seconds) {
        if (seconds <= 0) {
            throw new IllegalArgumentException("seconds must be positive");
        }
        this.seat = seat;
        this.promptId = promptId;
        this.remainingSeconds = seconds;
    }

    public int seat() {
        return seat;
    }

    public long promptId() {
        return promptId;
    }

    public int remainingSeconds() {
        return remainingSeconds;
    }

    /** @return true once the timer has run out */
    public boolean tick() {
        if (remainingSeconds > 0) {
            remainingSeconds--;
        }
        return remainingSeconds == 0;
    }
}
