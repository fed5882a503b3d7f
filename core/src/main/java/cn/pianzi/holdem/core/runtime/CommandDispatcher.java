package cn.pianzi.holdem.core.runtime;

/**
 * Hands a command back to the coordinator's single processing point. Decision callbacks
 * and transport callbacks go through here instead of touching the game directly.
 */
@FunctionalInterface
public interface CommandDispatcher {
    void dispatch(GameCommand command);
}
