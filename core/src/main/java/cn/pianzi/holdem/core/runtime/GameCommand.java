package cn.pianzi.holdem.core.runtime;

import cn.pianzi.holdem.core.domain.Decision;

import java.util.Objects;

/**
 * Inputs accepted by the coordinator. Anything that is not one of the nested types is
 * rejected.
 */
public interface GameCommand {

    /**
     * An action for a seat. {@code promptId} names the decision opportunity the answer
     * belongs to; {@link #DIRECT} marks a command typed by a human at any time during
     * their turn.
     */
    record PlayerAction(int seat, Decision decision, long promptId) implements GameCommand {
        public static final long DIRECT = 0L;

        public PlayerAction {
            Objects.requireNonNull(decision, "decision");
        }

        public static PlayerAction direct(int seat, Decision decision) {
            return new PlayerAction(seat, decision, DIRECT);
        }

        public boolean isDirect() {
            return promptId == DIRECT;
        }
    }

    /** A decision source failed to produce an answer for the given prompt. */
    record PromptFailed(int seat, long promptId, String reason) implements GameCommand {
    }

    record Pause(String reason) implements GameCommand {
        public Pause {
            Objects.requireNonNull(reason, "reason");
        }
    }

    record Resume() implements GameCommand {
    }
}
