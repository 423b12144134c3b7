package com.cryptobot.ta.db;

import com.cryptobot.ta.assemble.RecordJson;
import com.cryptobot.ta.error.PersistException;
import com.cryptobot.ta.model.SummaryLabel;
import com.cryptobot.ta.model.SummaryTriplet;
import com.cryptobot.ta.model.TechnicalAnalysisRecord;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONArray;
import org.json.JSONObject;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.sql.Types;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * PostgreSQL store for analysis records; list fields and metadata live in JSONB columns.
 */
public final class TechnicalAnalysisDao implements TechnicalAnalysisStore {
    private static final Logger SQL_LOG = LogManager.getLogger("SQL");

    private static final String INSERT_SQL = "INSERT INTO technical_analysis(" +
            "symbol, price, price_change, price_change_percent, " +
            "overall_summary, technical_indicators_summary, moving_averages_summary, " +
            "technical_indicators, moving_averages, pivot_points, metadata, source_url, scraped_at) " +
            "VALUES(?, ?, ?, ?, ?, ?, ?, CAST(? AS JSONB), CAST(? AS JSONB), CAST(? AS JSONB), CAST(? AS JSONB), ?, ?)";

    private static final String SELECT_COLUMNS = "SELECT symbol, price, price_change, price_change_percent, " +
            "overall_summary, technical_indicators_summary, moving_averages_summary, " +
            "technical_indicators::text, moving_averages::text, pivot_points::text, metadata::text, " +
            "source_url, scraped_at FROM technical_analysis";

    private final Database database;

    public TechnicalAnalysisDao(Database database) {
        this.database = database;
    }

    @Override
    public boolean insert(TechnicalAnalysisRecord record) {
        SQL_LOG.debug("insert technical_analysis symbol={}", record.symbol);
        try (Connection conn = database.connect();
             PreparedStatement ps = conn.prepareStatement(INSERT_SQL)) {
            ps.setString(1, record.symbol);
            setNumber(ps, 2, record.price);
            setNumber(ps, 3, record.priceChange);
            setNumber(ps, 4, record.priceChangePercent);
            ps.setString(5, record.summary.overall().label());
            ps.setString(6, record.summary.technicalIndicators().label());
            ps.setString(7, record.summary.movingAverages().label());
            ps.setString(8, RecordJson.indicatorsJson(record.technicalIndicators).toString());
            ps.setString(9, RecordJson.movingAveragesJson(record.movingAverages).toString());
            ps.setString(10, RecordJson.pivotsJson(record.pivotPoints).toString());
            ps.setString(11, new JSONObject(record.metadata).toString());
            ps.setString(12, record.sourceUrl);
            ps.setTimestamp(13, Timestamp.from(record.scrapedAt));
            return ps.executeUpdate() > 0;
        } catch (SQLException e) {
            throw new PersistException("insert failed for " + record.symbol + ": " + e.getMessage(), e);
        }
    }

    @Override
    public List<TechnicalAnalysisRecord> latest(String symbol, int limit) {
        boolean filtered = symbol != null && !symbol.isBlank();
        String sql = SELECT_COLUMNS
                + (filtered ? " WHERE symbol = ?" : "")
                + " ORDER BY created_at DESC, id DESC LIMIT ?";
        SQL_LOG.debug("latest technical_analysis symbol={} limit={}", symbol, limit);
        List<TechnicalAnalysisRecord> out = new ArrayList<>();
        try (Connection conn = database.connect();
             PreparedStatement ps = conn.prepareStatement(sql)) {
            int index = 1;
            if (filtered) {
                ps.setString(index++, symbol.trim().toUpperCase(Locale.ROOT));
            }
            ps.setInt(index, Math.max(1, limit));
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(mapRow(rs));
                }
            }
        } catch (SQLException e) {
            throw new PersistException("query failed: " + e.getMessage(), e);
        }
        return out;
    }

    private TechnicalAnalysisRecord mapRow(ResultSet rs) throws SQLException {
        String metadata = rs.getString(11);
        return new TechnicalAnalysisRecord(
                rs.getString(1),
                getNumber(rs, 2),
                getNumber(rs, 3),
                getNumber(rs, 4),
                new SummaryTriplet(
                        SummaryLabel.fromLabel(rs.getString(5)),
                        SummaryLabel.fromLabel(rs.getString(6)),
                        SummaryLabel.fromLabel(rs.getString(7))
                ),
                RecordJson.indicatorsFromJson(jsonArray(rs.getString(8))),
                RecordJson.movingAveragesFromJson(jsonArray(rs.getString(9))),
                RecordJson.pivotsFromJson(jsonArray(rs.getString(10))),
                rs.getString(12),
                rs.getTimestamp(13).toInstant(),
                metadata == null || metadata.isBlank() ? null : new JSONObject(metadata).toMap()
        );
    }

    private static JSONArray jsonArray(String raw) {
        return raw == null || raw.isBlank() ? new JSONArray() : new JSONArray(raw);
    }

    private static void setNumber(PreparedStatement ps, int index, double value) throws SQLException {
        if (Double.isFinite(value)) {
            ps.setDouble(index, value);
        } else {
            ps.setNull(index, Types.NUMERIC);
        }
    }

    private static double getNumber(ResultSet rs, int index) throws SQLException {
        double value = rs.getDouble(index);
        return rs.wasNull() ? Double.NaN : value;
    }
}
