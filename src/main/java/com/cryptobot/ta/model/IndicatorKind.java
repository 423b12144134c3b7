package com.cryptobot.ta.model;

/**
 * Shape of an indicator entry. Each kind owns a fixed set of output fields:
 * SCALAR has value, BAND has upper/middle/lower, MACD has value/histogram,
 * TREND has value/trend.
 */
public enum IndicatorKind {
    SCALAR,
    BAND,
    MACD,
    TREND
}
