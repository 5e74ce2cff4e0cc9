package com.tracker.adapter.out.persistence;

import com.tracker.infrastructure.persistence.ConnectionManager;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.sql.Connection;
import java.util.OptionalLong;

/**
 * Named integer counters in the {@code app_settings} key/value table.
 * Every method runs on the caller's connection, so the caller decides the transaction.
 */
@Repository
public class JdbcCounterStore {

    public static final String CREATE_TABLE = """
        CREATE TABLE IF NOT EXISTS app_settings (
            setting_key VARCHAR(100) PRIMARY KEY,
            setting_value BIGINT NOT NULL
        )
        """;

    public void ensureSchema(Connection connection) {
        ConnectionManager.jdbcTemplate(connection).execute(CREATE_TABLE);
    }

    /**
     * Reads the counter and locks its row until the surrounding transaction ends.
     */
    public OptionalLong readForUpdate(Connection connection, String name) {
        return read(connection, "SELECT setting_value FROM app_settings WHERE setting_key = ? FOR UPDATE", name);
    }

    public OptionalLong read(Connection connection, String name) {
        return read(connection, "SELECT setting_value FROM app_settings WHERE setting_key = ?", name);
    }

    /**
     * Updates the counter, inserting its row on first use. A concurrent first insert of the
     * same counter fails on the primary key instead of silently overwriting.
     */
    public void write(Connection connection, String name, long value) {
        JdbcTemplate jdbc = ConnectionManager.jdbcTemplate(connection);
        int updated = jdbc.update("UPDATE app_settings SET setting_value = ? WHERE setting_key = ?", value, name);
        if (updated == 0) {
            jdbc.update("INSERT INTO app_settings (setting_key, setting_value) VALUES (?, ?)", name, value);
        }
    }

    private OptionalLong read(Connection connection, String sql, String name) {
        return ConnectionManager.jdbcTemplate(connection)
            .query(sql, (rs, rowNum) -> rs.getLong("setting_value"), name)
            .stream()
            .mapToLong(Long::longValue)
            .findFirst();
    }
}
