package com.cryptobot.ta.model;

import java.util.Objects;

/**
 * One entry of the technical indicator list. The concrete subclass fixes the
 * entry's shape, so readers switch on {@link #kind()} instead of probing for fields.
 */
public abstract class IndicatorResult {
    private final IndicatorType type;
    private final Signal signal;

    IndicatorResult(IndicatorType type, Signal signal, IndicatorKind expectedKind) {
        this.type = Objects.requireNonNull(type, "type");
        this.signal = Objects.requireNonNull(signal, "signal");
        if (type.kind() != expectedKind) {
            throw new IllegalArgumentException(type + " is a " + type.kind() + " indicator, not " + expectedKind);
        }
    }

    public final IndicatorType type() {
        return type;
    }

    public final String name() {
        return type.displayName();
    }

    public final Signal signal() {
        return signal;
    }

    public abstract IndicatorKind kind();
}
