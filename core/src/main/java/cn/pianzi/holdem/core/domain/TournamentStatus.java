package cn.pianzi.holdem.core.domain;

public enum TournamentStatus {
    WAITING,
    ACTIVE,
    PAUSED,
    COMPLETED
}
