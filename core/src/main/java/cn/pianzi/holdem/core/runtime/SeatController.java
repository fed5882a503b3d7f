package cn.pianzi.holdem.core.runtime;

import cn.pianzi.holdem.core.domain.ActorType;
import cn.pianzi.holdem.core.port.DecisionSource;

import java.util.Objects;

public record SeatController(ActorType type, DecisionSource source) {
    public SeatController {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(source, "source");
    }

    public static SeatController human(DecisionSource source) {
        return new SeatController(ActorType.HUMAN, source);
    }

    public static SeatController automated(DecisionSource source) {
        return new SeatController(ActorType.AUTOMATED, source);
    }
}
