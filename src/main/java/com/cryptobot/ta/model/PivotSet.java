package com.cryptobot.ta.model;

import java.util.Objects;

/**
 * Support and resistance levels of one pivot method. Resistances grow away from the
 * pivot (r1 &lt;= r2 &lt;= r3), supports fall away from it (s1 &gt;= s2 &gt;= s3).
 */
public final class PivotSet {
    public final PivotType type;
    public final double pivot;
    public final double r1;
    public final double r2;
    public final double r3;
    public final double s1;
    public final double s2;
    public final double s3;

    public PivotSet(PivotType type, double pivot, double r1, double r2, double r3, double s1, double s2, double s3) {
        this.type = Objects.requireNonNull(type, "type");
        double tolerance = 1e-9 * Math.max(1.0, Math.abs(pivot));
        if (r1 - r2 > tolerance || r2 - r3 > tolerance) {
            throw new IllegalArgumentException("resistance levels out of order: " + r1 + ", " + r2 + ", " + r3);
        }
        if (s2 - s1 > tolerance || s3 - s2 > tolerance) {
            throw new IllegalArgumentException("support levels out of order: " + s1 + ", " + s2 + ", " + s3);
        }
        this.pivot = pivot;
        this.r1 = r1;
        this.r2 = r2;
        this.r3 = r3;
        this.s1 = s1;
        this.s2 = s2;
        this.s3 = s3;
    }
}
