package cn.pianzi.holdem.core.event;

public enum CoreEventType {
    TOURNAMENT_STARTED,
    HAND_STARTED,
    BLIND_POSTED,
    HOLE_CARDS_DEALT,
    PHASE_CHANGED,
    COMMUNITY_DEALT,
    TURN_CHANGED,
    DECISION_REQUESTED,
    ACTION_APPLIED,
    ALL_IN,
    SHOWDOWN,
    POT_AWARDED,
    HAND_COMPLETED,
    PLAYER_ELIMINATED,
    BLINDS_INCREASED,
    TOURNAMENT_COMPLETED,
    TOURNAMENT_ABORTED,
    GAME_PAUSED,
    GAME_RESUMED,
    TURN_TIMER_TICK,
    TURN_TIMED_OUT
}
