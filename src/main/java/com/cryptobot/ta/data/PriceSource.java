package com.cryptobot.ta.data;

import com.cryptobot.ta.model.PriceQuote;

public interface PriceSource {
    PriceQuote getPrice(String symbol);
}
