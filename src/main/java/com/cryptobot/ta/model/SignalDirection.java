package com.cryptobot.ta.model;

public enum SignalDirection {
    BULLISH,
    BEARISH,
    NEUTRAL
}
