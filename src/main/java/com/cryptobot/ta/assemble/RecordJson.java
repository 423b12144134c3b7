package com.cryptobot.ta.assemble;

import com.cryptobot.ta.model.BandIndicator;
import com.cryptobot.ta.model.IndicatorKind;
import com.cryptobot.ta.model.IndicatorResult;
import com.cryptobot.ta.model.IndicatorType;
import com.cryptobot.ta.model.MacdIndicator;
import com.cryptobot.ta.model.MovingAverageResult;
import com.cryptobot.ta.model.MovingAverageType;
import com.cryptobot.ta.model.PivotSet;
import com.cryptobot.ta.model.PivotType;
import com.cryptobot.ta.model.ScalarIndicator;
import com.cryptobot.ta.model.Signal;
import com.cryptobot.ta.model.SummaryLabel;
import com.cryptobot.ta.model.SummaryTriplet;
import com.cryptobot.ta.model.TechnicalAnalysisRecord;
import com.cryptobot.ta.model.TrendIndicator;
import org.json.JSONArray;
import org.json.JSONObject;

import java.time.Instant;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * JSON rendering of {@link TechnicalAnalysisRecord}. Non-finite numbers are written as
 * {@code null} and read back as {@code NaN}.
 */
public final class RecordJson {
    private static final DateTimeFormatter ISO = DateTimeFormatter.ISO_INSTANT;

    private RecordJson() {
    }

    public static JSONObject toJson(TechnicalAnalysisRecord record) {
        JSONObject root = new JSONObject();
        root.put("symbol", record.symbol);
        root.put("price", number(record.price));
        root.put("priceChange", number(record.priceChange));
        root.put("priceChangePercent", number(record.priceChangePercent));
        root.put("summary", summaryJson(record.summary));
        root.put("technicalIndicators", indicatorsJson(record.technicalIndicators));
        root.put("movingAverages", movingAveragesJson(record.movingAverages));
        root.put("pivotPoints", pivotsJson(record.pivotPoints));
        root.put("sourceUrl", record.sourceUrl);
        root.put("scrapedAt", ISO.format(record.scrapedAt));
        root.put("metadata", new JSONObject(record.metadata));
        return root;
    }

    public static JSONObject summaryJson(SummaryTriplet summary) {
        JSONObject out = new JSONObject();
        out.put("overall", summary.overall().label());
        out.put("technicalIndicators", summary.technicalIndicators().label());
        out.put("movingAverages", summary.movingAverages().label());
        return out;
    }

    public static JSONArray indicatorsJson(List<IndicatorResult> indicators) {
        JSONArray out = new JSONArray();
        for (IndicatorResult result : indicators) {
            JSONObject item = new JSONObject();
            item.put("name", result.name());
            switch (result.kind()) {
                case SCALAR:
                    item.put("value", number(((ScalarIndicator) result).value()));
                    break;
                case BAND:
                    BandIndicator band = (BandIndicator) result;
                    item.put("upper", number(band.upper()));
                    item.put("middle", number(band.middle()));
                    item.put("lower", number(band.lower()));
                    break;
                case MACD:
                    MacdIndicator macd = (MacdIndicator) result;
                    item.put("value", number(macd.value()));
                    item.put("histogram", number(macd.histogram()));
                    break;
                case TREND:
                    TrendIndicator trend = (TrendIndicator) result;
                    item.put("value", trend.notApplicable() ? TrendIndicator.NOT_APPLICABLE : number(trend.value()));
                    item.put("trend", trend.trend());
                    break;
                default:
                    throw new IllegalStateException("unknown indicator kind: " + result.kind());
            }
            item.put("signal", result.signal().label());
            out.put(item);
        }
        return out;
    }

    public static JSONArray movingAveragesJson(List<MovingAverageResult> movingAverages) {
        JSONArray out = new JSONArray();
        for (MovingAverageResult ma : movingAverages) {
            JSONObject item = new JSONObject();
            item.put("name", ma.name());
            item.put("period", ma.period);
            item.put("type", ma.type.label());
            item.put("value", number(ma.value));
            item.put("signal", ma.signal.label());
            out.put(item);
        }
        return out;
    }

    public static JSONArray pivotsJson(List<PivotSet> pivots) {
        JSONArray out = new JSONArray();
        for (PivotSet pivot : pivots) {
            JSONObject item = new JSONObject();
            item.put("type", pivot.type.label());
            item.put("pivot", number(pivot.pivot));
            item.put("r1", number(pivot.r1));
            item.put("r2", number(pivot.r2));
            item.put("r3", number(pivot.r3));
            item.put("s1", number(pivot.s1));
            item.put("s2", number(pivot.s2));
            item.put("s3", number(pivot.s3));
            out.put(item);
        }
        return out;
    }

    public static TechnicalAnalysisRecord fromJson(JSONObject root) {
        JSONObject summary = root.optJSONObject("summary");
        SummaryTriplet triplet = summary == null
                ? SummaryTriplet.neutral()
                : summaryFromJson(summary);
        JSONObject metadata = root.optJSONObject("metadata");
        return new TechnicalAnalysisRecord(
                root.getString("symbol"),
                root.optDouble("price", Double.NaN),
                root.optDouble("priceChange", Double.NaN),
                root.optDouble("priceChangePercent", Double.NaN),
                triplet,
                indicatorsFromJson(root.optJSONArray("technicalIndicators")),
                movingAveragesFromJson(root.optJSONArray("movingAverages")),
                pivotsFromJson(root.optJSONArray("pivotPoints")),
                root.optString("sourceUrl", ""),
                Instant.parse(root.getString("scrapedAt")),
                metadata == null ? Map.of() : metadata.toMap()
        );
    }

    public static SummaryTriplet summaryFromJson(JSONObject summary) {
        return new SummaryTriplet(
                SummaryLabel.fromLabel(summary.optString("overall", "")),
                SummaryLabel.fromLabel(summary.optString("technicalIndicators", "")),
                SummaryLabel.fromLabel(summary.optString("movingAverages", ""))
        );
    }

    public static List<IndicatorResult> indicatorsFromJson(JSONArray array) {
        List<IndicatorResult> out = new ArrayList<>();
        if (array == null) {
            return out;
        }
        for (int i = 0; i < array.length(); i++) {
            JSONObject item = array.getJSONObject(i);
            IndicatorType type = IndicatorType.fromDisplayName(item.getString("name"));
            Signal signal = Signal.fromLabel(item.getString("signal"));
            IndicatorKind kind = type.kind();
            switch (kind) {
                case SCALAR:
                    out.add(new ScalarIndicator(type, item.optDouble("value", Double.NaN), signal));
                    break;
                case BAND:
                    out.add(new BandIndicator(type,
                            item.optDouble("upper", Double.NaN),
                            item.optDouble("middle", Double.NaN),
                            item.optDouble("lower", Double.NaN),
                            signal));
                    break;
                case MACD:
                    out.add(new MacdIndicator(type,
                            item.optDouble("value", Double.NaN),
                            item.optDouble("histogram", Double.NaN),
                            signal));
                    break;
                case TREND:
                    if (signal == Signal.NOT_APPLICABLE) {
                        out.add(TrendIndicator.notApplicable(type));
                    } else {
                        out.add(new TrendIndicator(type, item.optDouble("value", Double.NaN),
                                item.optString("trend", ""), signal));
                    }
                    break;
                default:
                    throw new IllegalStateException("unknown indicator kind: " + kind);
            }
        }
        return out;
    }

    public static List<MovingAverageResult> movingAveragesFromJson(JSONArray array) {
        List<MovingAverageResult> out = new ArrayList<>();
        if (array == null) {
            return out;
        }
        for (int i = 0; i < array.length(); i++) {
            JSONObject item = array.getJSONObject(i);
            int period = item.has("period")
                    ? item.getInt("period")
                    : Integer.parseInt(item.getString("name").substring(2));
            out.add(new MovingAverageResult(
                    period,
                    MovingAverageType.fromLabel(item.optString("type", "Exponential")),
                    item.optDouble("value", Double.NaN),
                    Signal.fromLabel(item.getString("signal"))
            ));
        }
        return out;
    }

    public static List<PivotSet> pivotsFromJson(JSONArray array) {
        List<PivotSet> out = new ArrayList<>();
        if (array == null) {
            return out;
        }
        for (int i = 0; i < array.length(); i++) {
            JSONObject item = array.getJSONObject(i);
            out.add(new PivotSet(
                    PivotType.fromLabel(item.optString("type", "Classic")),
                    item.getDouble("pivot"),
                    item.getDouble("r1"),
                    item.getDouble("r2"),
                    item.getDouble("r3"),
                    item.getDouble("s1"),
                    item.getDouble("s2"),
                    item.getDouble("s3")
            ));
        }
        return out;
    }

    private static Object number(double value) {
        return Double.isFinite(value) ? value : JSONObject.NULL;
    }
}
