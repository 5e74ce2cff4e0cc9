package com.tracker.adapter.out.persistence;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tracker.application.port.out.WebhookRepository;
import com.tracker.domain.model.WebhookSubscription;
import com.tracker.infrastructure.persistence.ConnectionManager;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.SQLException;
import java.sql.Timestamp;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public class JdbcWebhookRepository implements WebhookRepository {

    private static final ObjectMapper EVENTS_JSON = new ObjectMapper();
    private static final TypeReference<List<String>> EVENT_LIST = new TypeReference<>() {};

    private static final String COLUMNS = "id, url, events, active, secret, created_at";

    public static final String CREATE_TABLE = """
        CREATE TABLE IF NOT EXISTS webhooks (
            id VARCHAR(36) PRIMARY KEY,
            url VARCHAR(2048) NOT NULL,
            events VARCHAR(4000) NOT NULL,
            active BOOLEAN NOT NULL,
            secret VARCHAR(255),
            created_at TIMESTAMP NOT NULL
        )
        """;

    private static final RowMapper<WebhookSubscription> ROW_MAPPER = (rs, rowNum) -> new WebhookSubscription(
        UUID.fromString(rs.getString("id")),
        rs.getString("url"),
        readEvents(rs.getString("events")),
        rs.getBoolean("active"),
        rs.getString("secret"),
        rs.getTimestamp("created_at").toInstant()
    );

    private final ConnectionManager connectionManager;

    private volatile boolean schemaReady;

    public JdbcWebhookRepository(ConnectionManager connectionManager) {
        this.connectionManager = connectionManager;
    }

    @Override
    public void save(WebhookSubscription subscription) {
        String events = writeEvents(subscription);
        connectionManager.execute(connection -> {
            JdbcTemplate jdbc = ConnectionManager.jdbcTemplate(connection);
            ensureSchema(jdbc);
            return jdbc.update(
                "INSERT INTO webhooks (" + COLUMNS + ") VALUES (?, ?, ?, ?, ?, ?)",
                subscription.id().toString(),
                subscription.url(),
                events,
                subscription.active(),
                subscription.secret(),
                Timestamp.from(subscription.createdAt())
            );
        });
    }

    @Override
    public List<WebhookSubscription> findAll() {
        return connectionManager.execute(connection -> {
            JdbcTemplate jdbc = ConnectionManager.jdbcTemplate(connection);
            ensureSchema(jdbc);
            return jdbc.query("SELECT " + COLUMNS + " FROM webhooks ORDER BY created_at, id", ROW_MAPPER);
        });
    }

    @Override
    public Optional<WebhookSubscription> findById(UUID id) {
        return connectionManager.execute(connection -> {
            JdbcTemplate jdbc = ConnectionManager.jdbcTemplate(connection);
            ensureSchema(jdbc);
            return jdbc.query("SELECT " + COLUMNS + " FROM webhooks WHERE id = ?", ROW_MAPPER, id.toString())
                .stream()
                .findFirst();
        });
    }

    @Override
    public boolean updateActive(UUID id, boolean active) {
        return connectionManager.execute(connection -> {
            JdbcTemplate jdbc = ConnectionManager.jdbcTemplate(connection);
            ensureSchema(jdbc);
            return jdbc.update("UPDATE webhooks SET active = ? WHERE id = ?", active, id.toString()) > 0;
        });
    }

    @Override
    public boolean deleteById(UUID id) {
        return connectionManager.execute(connection -> {
            JdbcTemplate jdbc = ConnectionManager.jdbcTemplate(connection);
            ensureSchema(jdbc);
            return jdbc.update("DELETE FROM webhooks WHERE id = ?", id.toString()) > 0;
        });
    }

    private void ensureSchema(JdbcTemplate jdbc) {
        if (schemaReady) {
            return;
        }
        jdbc.execute(CREATE_TABLE);
        schemaReady = true;
    }

    private static String writeEvents(WebhookSubscription subscription) {
        try {
            return EVENTS_JSON.writeValueAsString(new ArrayList<>(subscription.events()));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize webhook events", e);
        }
    }

    private static LinkedHashSet<String> readEvents(String json) throws SQLException {
        try {
            return new LinkedHashSet<>(EVENTS_JSON.readValue(json, EVENT_LIST));
        } catch (JsonProcessingException e) {
            throw new SQLException("Corrupted webhook events column: " + json, e);
        }
    }
}
