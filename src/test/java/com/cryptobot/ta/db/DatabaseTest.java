package com.cryptobot.ta.db;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DatabaseTest {

    @Test
    void rejectsNonPostgresUrlAndBadSchema() {
        assertThrows(IllegalArgumentException.class,
                () -> new Database("jdbc:sqlite:cryptobot.db", "u", "p", "public"));
        assertThrows(IllegalArgumentException.class,
                () -> new Database("jdbc:postgresql://localhost/cryptobot", "u", "p", "ta; drop"));
    }

    @Test
    void maskedUrlHidesPassword() {
        Database database = new Database(
                "jdbc:postgresql://localhost:5432/cryptobot?user=bot&password=hunter2", "bot", "hunter2", " ");

        assertEquals("jdbc:postgresql://localhost:5432/cryptobot?user=bot&password=***", database.maskedJdbcUrl());
        assertEquals("public", database.schema());
    }

    @Test
    void migrationCreatesRecordTableWithJsonColumns() {
        List<String> statements = MigrationRunner.buildStatements();

        assertTrue(statements.get(0).startsWith("CREATE TABLE IF NOT EXISTS technical_analysis"));
        assertTrue(statements.get(0).contains("technical_indicators JSONB"));
        assertTrue(statements.get(0).contains("scraped_at TIMESTAMPTZ NOT NULL"));
        assertTrue(statements.get(1).contains("(symbol, created_at DESC)"));
    }
}
