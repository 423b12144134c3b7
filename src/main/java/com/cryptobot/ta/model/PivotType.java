package com.cryptobot.ta.model;

public enum PivotType {
    CLASSIC("Classic"),
    FIBONACCI("Fibonacci"),
    CAMARILLA("Camarilla"),
    WOODIE("Woodie");

    private final String label;

    PivotType(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public static PivotType fromLabel(String raw) {
        for (PivotType type : values()) {
            if (type.label.equalsIgnoreCase(raw == null ? "" : raw.trim())) {
                return type;
            }
        }
        throw new IllegalArgumentException("unknown pivot type: " + raw);
    }
}
