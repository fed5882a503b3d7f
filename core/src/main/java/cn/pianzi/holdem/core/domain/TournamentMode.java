package cn.pianzi.holdem.core.domain;

public enum TournamentMode {
    /** Seat 0 is a human, every other seat is automated. */
    PLAYER,
    /** Every seat is automated. */
    SPECTATOR
}
