package com.cryptobot.ta.model;

public enum MovingAverageType {
    SIMPLE("Simple"),
    EXPONENTIAL("Exponential");

    private final String label;

    MovingAverageType(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public static MovingAverageType fromLabel(String raw) {
        for (MovingAverageType type : values()) {
            if (type.label.equalsIgnoreCase(raw == null ? "" : raw.trim())) {
                return type;
            }
        }
        throw new IllegalArgumentException("unknown moving average type: " + raw);
    }
}
