package cn.pianzi.holdem.core.config;

public record BlindLevel(int smallBlind, int bigBlind) {
    public BlindLevel {
        if (smallBlind <= 0 || bigBlind <= 0) {
            throw new IllegalArgumentException("blinds must be positive");
        }
        if (smallBlind > bigBlind) {
            throw new IllegalArgumentException("small blind must not exceed big blind");
        }
    }
}
