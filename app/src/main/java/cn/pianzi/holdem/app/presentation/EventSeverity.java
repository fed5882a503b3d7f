package cn.pianzi.holdem.app.presentation;

public enum EventSeverity {
    INFO,
    SUCCESS,
    WARNING,
    ERROR
}
