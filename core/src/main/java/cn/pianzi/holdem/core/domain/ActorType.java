package cn.pianzi.holdem.core.domain;

public enum ActorType {
    HUMAN,
    AUTOMATED
}
