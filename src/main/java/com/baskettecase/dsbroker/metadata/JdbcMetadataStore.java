package com.baskettecase.dsbroker.metadata;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Metadata store backed by a single {@code metadata_records} table.
 * Attributes are stored as a JSON document; the store never interprets them.
 */
@Slf4j
public class JdbcMetadataStore implements MetadataStore {

    private static final TypeReference<LinkedHashMap<String, Object>> ATTRIBUTES_TYPE =
        new TypeReference<>() {};

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;
    private final RowMapper<MetadataRecord> rowMapper;

    public JdbcMetadataStore(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
        this.jdbcTemplate = jdbcTemplate;
        this.objectMapper = objectMapper;
        this.rowMapper = (rs, rowNum) -> {
            MetadataRecord record = new MetadataRecord();
            record.setType(rs.getString("type"));
            record.setId(rs.getString("id"));
            record.setNamespace(rs.getString("namespace"));
            record.setAttributes(readAttributes(rs.getString("attributes")));
            record.setVersion(rs.getLong("version"));

            Timestamp createdAt = rs.getTimestamp("created_at");
            if (createdAt != null) {
                record.setCreatedAt(createdAt.toInstant());
            }

            Timestamp updatedAt = rs.getTimestamp("updated_at");
            if (updatedAt != null) {
                record.setUpdatedAt(updatedAt.toInstant());
            }
            return record;
        };
    }

    @Override
    public MetadataRecord get(String type, String id) {
        String sql = """
            SELECT * FROM metadata_records
            WHERE type = ? AND id = ?
            """;

        List<MetadataRecord> results = jdbcTemplate.query(sql, rowMapper, type, id);
        if (results.isEmpty()) {
            throw new NotFoundException(type, id);
        }
        return results.get(0);
    }

    @Override
    public List<MetadataRecord> find(String type) {
        String sql = "SELECT * FROM metadata_records WHERE type = ? ORDER BY created_at";
        return jdbcTemplate.query(sql, rowMapper, type);
    }

    @Override
    public MetadataRecord create(MetadataRecord record) {
        Instant now = Instant.now();
        MetadataRecord stored = record.toBuilder()
            .id(record.getId() != null ? record.getId() : UUID.randomUUID().toString())
            .version(1)
            .createdAt(now)
            .updatedAt(now)
            .build();

        String sql = """
            INSERT INTO metadata_records (
                type, id, namespace, attributes, version, created_at, updated_at
            ) VALUES (?, ?, ?, ?, ?, ?, ?)
            """;

        jdbcTemplate.update(sql,
            stored.getType(),
            stored.getId(),
            stored.getNamespace(),
            writeAttributes(stored.getAttributes()),
            stored.getVersion(),
            Timestamp.from(now),
            Timestamp.from(now)
        );

        log.debug("Created {}/{}", stored.getType(), stored.getId());
        return stored;
    }

    @Override
    public MetadataRecord update(MetadataRecord record) {
        String sql = """
            UPDATE metadata_records
            SET namespace = ?, attributes = ?, version = version + 1, updated_at = ?
            WHERE type = ? AND id = ?
            """;

        int updated = jdbcTemplate.update(sql,
            record.getNamespace(),
            writeAttributes(record.getAttributes()),
            Timestamp.from(Instant.now()),
            record.getType(),
            record.getId()
        );
        if (updated == 0) {
            throw new NotFoundException(record.getType(), record.getId());
        }

        log.debug("Updated {}/{}", record.getType(), record.getId());
        return get(record.getType(), record.getId());
    }

    @Override
    public void delete(String type, String id) {
        String sql = "DELETE FROM metadata_records WHERE type = ? AND id = ?";
        int deleted = jdbcTemplate.update(sql, type, id);
        if (deleted == 0) {
            throw new NotFoundException(type, id);
        }
        log.debug("Deleted {}/{}", type, id);
    }

    /**
     * Create the metadata_records table if it doesn't exist
     */
    public void initializeTable() {
        String createTableSql = """
            CREATE TABLE IF NOT EXISTS metadata_records (
                type VARCHAR(64) NOT NULL,
                id VARCHAR(128) NOT NULL,
                namespace VARCHAR(128) NOT NULL,
                attributes TEXT NOT NULL,
                version BIGINT NOT NULL,
                created_at TIMESTAMP NOT NULL,
                updated_at TIMESTAMP NOT NULL,
                PRIMARY KEY (type, id)
            )
            """;
        try {
            jdbcTemplate.execute(createTableSql);
            log.info("Metadata records table initialized");
        } catch (Exception e) {
            log.error("Failed to initialize metadata_records table", e);
            throw e;
        }
    }

    private String writeAttributes(Map<String, Object> attributes) {
        try {
            return objectMapper.writeValueAsString(attributes == null ? Map.of() : attributes);
        } catch (JsonProcessingException e) {
            // Attribute values are not echoed; credential payloads pass through here
            throw new IllegalStateException("Failed to serialize record attributes", e);
        }
    }

    private Map<String, Object> readAttributes(String json) {
        if (json == null || json.isBlank()) {
            return new LinkedHashMap<>();
        }
        try {
            return objectMapper.readValue(json, ATTRIBUTES_TYPE);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to parse record attributes", e);
        }
    }
}
