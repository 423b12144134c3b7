package com.cryptobot.ta.db;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;

/**
 * Idempotent schema setup for the technical_analysis store.
 */
public final class MigrationRunner {
    private static final Logger log = LogManager.getLogger(MigrationRunner.class);
    private static final int TARGET_VERSION = 1;

    public void run(Database database) throws SQLException {
        try (Connection conn = database.connect(); Statement st = conn.createStatement()) {
            st.execute("CREATE TABLE IF NOT EXISTS metadata (" +
                    "meta_key TEXT PRIMARY KEY," +
                    "meta_value TEXT NOT NULL," +
                    "updated_at TIMESTAMPTZ NOT NULL DEFAULT now()" +
                    ")");

            int currentVersion = readSchemaVersion(conn);
            String lastSql = "";
            try {
                for (String sql : buildStatements()) {
                    lastSql = sql;
                    st.execute(sql);
                }
                writeSchemaVersion(conn, TARGET_VERSION);
            } catch (SQLException e) {
                String detail = "migration_failed: schema_version=" + currentVersion
                        + ", target_version=" + TARGET_VERSION
                        + ", failed_sql=" + summarizeSql(lastSql)
                        + ", cause=" + safe(e.getMessage());
                log.error(detail);
                throw new SQLException(detail, e.getSQLState(), e.getErrorCode(), e);
            }
            if (currentVersion != TARGET_VERSION) {
                log.info("Schema migrated from version {} to {}", currentVersion, TARGET_VERSION);
            }
        }
    }

    static List<String> buildStatements() {
        List<String> sqls = new ArrayList<>();
        sqls.add("CREATE TABLE IF NOT EXISTS technical_analysis (" +
                "id BIGSERIAL PRIMARY KEY," +
                "symbol TEXT NOT NULL," +
                "price NUMERIC NULL," +
                "price_change NUMERIC NULL," +
                "price_change_percent NUMERIC NULL," +
                "overall_summary TEXT NOT NULL," +
                "technical_indicators_summary TEXT NOT NULL," +
                "moving_averages_summary TEXT NOT NULL," +
                "technical_indicators JSONB NOT NULL DEFAULT '[]'::jsonb," +
                "moving_averages JSONB NOT NULL DEFAULT '[]'::jsonb," +
                "pivot_points JSONB NOT NULL DEFAULT '[]'::jsonb," +
                "metadata JSONB NOT NULL DEFAULT '{}'::jsonb," +
                "source_url TEXT NULL," +
                "scraped_at TIMESTAMPTZ NOT NULL," +
                "created_at TIMESTAMPTZ NOT NULL DEFAULT now()" +
                ")");
        sqls.add("CREATE INDEX IF NOT EXISTS idx_technical_analysis_symbol_created " +
                "ON technical_analysis(symbol, created_at DESC)");
        return sqls;
    }

    private int readSchemaVersion(Connection conn) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement("SELECT meta_value FROM metadata WHERE meta_key='schema_version'");
             ResultSet rs = ps.executeQuery()) {
            if (rs.next()) {
                String value = rs.getString(1);
                if (value != null && value.trim().matches("\\d+")) {
                    return Integer.parseInt(value.trim());
                }
            }
        }
        return 0;
    }

    private void writeSchemaVersion(Connection conn, int version) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(
                "INSERT INTO metadata(meta_key, meta_value, updated_at) VALUES('schema_version', ?, now()) " +
                        "ON CONFLICT(meta_key) DO UPDATE SET meta_value=excluded.meta_value, updated_at=excluded.updated_at"
        )) {
            ps.setString(1, Integer.toString(version));
            ps.executeUpdate();
        }
    }

    private static String summarizeSql(String sql) {
        if (sql == null || sql.trim().isEmpty()) {
            return "-";
        }
        String oneLine = sql.replaceAll("\\s+", " ").trim();
        if (oneLine.length() <= 180) {
            return oneLine;
        }
        return oneLine.substring(0, 177) + "...";
    }

    private static String safe(String value) {
        return value == null ? "" : value;
    }
}
