package cn.pianzi.holdem.core.domain;

public enum ActionType {
    FOLD,
    CHECK,
    CALL,
    RAISE,
    POST_BLIND;

    public boolean isVoluntary() {
        return this != POST_BLIND;
    }
}
