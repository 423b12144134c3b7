package com.cryptobot.ta.signal;

import com.cryptobot.ta.model.BandIndicator;
import com.cryptobot.ta.model.IndicatorResult;
import com.cryptobot.ta.model.IndicatorType;
import com.cryptobot.ta.model.MacdIndicator;
import com.cryptobot.ta.model.MovingAverageResult;
import com.cryptobot.ta.model.MovingAverageType;
import com.cryptobot.ta.model.ScalarIndicator;
import com.cryptobot.ta.model.Signal;
import com.cryptobot.ta.model.TrendIndicator;
import org.json.JSONObject;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.DoubleFunction;

/**
 * Turns remote indicator payloads (keyed as requested, e.g. {@code rsi}, {@code ema50})
 * into typed indicator entries. A payload missing its value field is skipped and noted.
 * Price-relative rules read Neutral when the price is unknown ({@code NaN}).
 */
public final class SignalClassifier {

    public Classification classify(Map<String, JSONObject> payloads, double price) {
        List<IndicatorResult> indicators = new ArrayList<>();
        List<MovingAverageResult> movingAverages = new ArrayList<>();
        List<String> issues = new ArrayList<>();

        JSONObject rsi = payloads.get("rsi");
        if (rsi != null) {
            double value = number(rsi, "value");
            if (require("rsi", value, "value", issues)) {
                indicators.add(new ScalarIndicator(IndicatorType.RSI, value, SignalRules.rsiAdvice(value)));
            }
        }

        JSONObject macd = payloads.get("macd");
        if (macd != null) {
            double line = number(macd, "valueMACD");
            double signalLine = number(macd, "valueMACDSignal");
            double hist = number(macd, "valueMACDHist");
            if (require("macd", line, "valueMACD", issues) && require("macd", signalLine, "valueMACDSignal", issues)) {
                if (Double.isNaN(hist)) {
                    hist = line - signalLine;
                }
                indicators.add(new MacdIndicator(IndicatorType.MACD, line, hist, SignalRules.macd(line, signalLine)));
            }
        }

        JSONObject bbands = payloads.get("bbands");
        if (bbands != null) {
            double upper = number(bbands, "valueUpperBand");
            double middle = number(bbands, "valueMiddleBand");
            double lower = number(bbands, "valueLowerBand");
            if (require("bbands", upper, "valueUpperBand", issues)
                    && require("bbands", middle, "valueMiddleBand", issues)
                    && require("bbands", lower, "valueLowerBand", issues)) {
                indicators.add(new BandIndicator(IndicatorType.BOLLINGER_BANDS, upper, middle, lower,
                        SignalRules.bollinger(price, upper, lower)));
            }
        }

        scalar(payloads, "obv", IndicatorType.OBV, issues, indicators, SignalRules::obvSign);

        JSONObject stoch = payloads.get("stochrsi");
        if (stoch != null) {
            double k = number(stoch, "valueFastK");
            if (Double.isNaN(k)) {
                k = number(stoch, "valueK");
            }
            if (require("stochrsi", k, "valueFastK", issues)) {
                indicators.add(new ScalarIndicator(IndicatorType.STOCH_RSI, k, SignalRules.stochAdvice(k)));
            }
        }

        scalar(payloads, "atr", IndicatorType.ATR, issues, indicators, value -> SignalRules.atr(value, price));
        scalar(payloads, "vwap", IndicatorType.VWAP, issues, indicators, value -> SignalRules.vwap(price, value));

        JSONObject supertrend = payloads.get("supertrend");
        if (supertrend != null) {
            double value = number(supertrend, "value");
            if (require("supertrend", value, "value", issues)) {
                boolean up = isUptrend(supertrend);
                indicators.add(new TrendIndicator(IndicatorType.SUPERTREND, value,
                        up ? "Uptrend" : "Downtrend", up ? Signal.BUY : Signal.SELL));
            }
        }

        scalar(payloads, "cmf", IndicatorType.CMF, issues, indicators, SignalRules::cmf);

        for (int period : MovingAverageResult.PERIODS) {
            String key = "ema" + period;
            JSONObject ema = payloads.get(key);
            if (ema == null) {
                continue;
            }
            double value = number(ema, "value");
            if (require(key, value, "value", issues)) {
                movingAverages.add(new MovingAverageResult(period, MovingAverageType.EXPONENTIAL, value,
                        SignalRules.movingAverage(price, value)));
            }
        }

        return new Classification(indicators, movingAverages, issues);
    }

    private static void scalar(
            Map<String, JSONObject> payloads,
            String key,
            IndicatorType type,
            List<String> issues,
            List<IndicatorResult> out,
            DoubleFunction<Signal> rule
    ) {
        JSONObject payload = payloads.get(key);
        if (payload == null) {
            return;
        }
        double value = number(payload, "value");
        if (require(key, value, "value", issues)) {
            out.add(new ScalarIndicator(type, value, rule.apply(value)));
        }
    }

    private static boolean isUptrend(JSONObject payload) {
        String advice = payload.optString("valueAdvice", "").trim().toLowerCase(Locale.ROOT);
        if (!advice.isEmpty()) {
            return "long".equals(advice) || "buy".equals(advice);
        }
        Object trend = payload.opt("trend");
        if (trend instanceof Number number) {
            return number.intValue() == 1;
        }
        String text = trend == null ? "" : String.valueOf(trend).trim().toLowerCase(Locale.ROOT);
        return "1".equals(text) || "long".equals(text) || "up".equals(text) || "uptrend".equals(text);
    }

    private static double number(JSONObject payload, String field) {
        double value = payload.optDouble(field, Double.NaN);
        return Double.isInfinite(value) ? Double.NaN : value;
    }

    private static boolean require(String key, double value, String field, List<String> issues) {
        if (Double.isNaN(value)) {
            issues.add(key + ": missing field " + field);
            return false;
        }
        return true;
    }

    public static final class Classification {
        public final List<IndicatorResult> indicators;
        public final List<MovingAverageResult> movingAverages;
        public final List<String> issues;

        Classification(List<IndicatorResult> indicators, List<MovingAverageResult> movingAverages, List<String> issues) {
            this.indicators = List.copyOf(indicators);
            this.movingAverages = List.copyOf(movingAverages);
            this.issues = List.copyOf(issues);
        }
    }
}
