package com.abroadhelper.resources.persistence;

import com.abroadhelper.resources.model.ResourceCategory;
import com.abroadhelper.resources.model.ResourceRecord;
import com.abroadhelper.resources.model.UpsertResult;
import com.abroadhelper.resources.util.Timestamps;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.time.Clock;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

@Repository
public class ResourceJdbcRepository implements ResourceRepository {
    private static final Logger log = LoggerFactory.getLogger(ResourceJdbcRepository.class);
    private static final TypeReference<List<String>> STRING_LIST = new TypeReference<>() {};
    private static final TypeReference<Map<String, Object>> JSON_MAP = new TypeReference<>() {};
    private static final String COLUMNS = """
        id, title, description, url, category, country, institution, deadline,
        eligibility, amount, tags, last_updated, metadata
        """;

    private final NamedParameterJdbcTemplate jdbc;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final RowMapper<ResourceRecord> rowMapper = this::mapRow;

    public ResourceJdbcRepository(NamedParameterJdbcTemplate jdbc, ObjectMapper objectMapper, Clock clock) {
        this.jdbc = jdbc;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    @Override
    public List<ResourceRecord> listAll(Optional<ResourceCategory> category) {
        MapSqlParameterSource params = new MapSqlParameterSource();
        String where = "";
        if (category.isPresent()) {
            where = "WHERE category = :category";
            params.addValue("category", category.get().value());
        }
        return jdbc.query(
            "SELECT " + COLUMNS + " FROM resources " + where + " ORDER BY id",
            params,
            rowMapper
        );
    }

    @Override
    public Optional<ResourceRecord> findById(String id) {
        if (id == null || id.isBlank()) {
            return Optional.empty();
        }
        List<ResourceRecord> rows = jdbc.query(
            "SELECT " + COLUMNS + " FROM resources WHERE id = :id",
            new MapSqlParameterSource("id", id),
            rowMapper
        );
        return rows.stream().findFirst();
    }

    @Override
    public Optional<ResourceRecord> findByTitle(String title) {
        if (title == null || title.isBlank()) {
            return Optional.empty();
        }
        List<ResourceRecord> rows = jdbc.query(
            "SELECT " + COLUMNS + " FROM resources WHERE title = :title ORDER BY id",
            new MapSqlParameterSource("title", title),
            rowMapper
        );
        return rows.stream().findFirst();
    }

    @Override
    public UpsertResult upsert(ResourceRecord record) {
        if (record.title() == null) {
            throw new IllegalArgumentException("Resource title is required");
        }
        // A caller-supplied id is authoritative; title matching only applies to records without one.
        Optional<ResourceRecord> existing = blankToNull(record.id()) != null
            ? findById(record.id())
            : findByTitle(record.title());

        if (existing.isPresent()) {
            String id = existing.get().id();
            MapSqlParameterSource params = parameters(record, id, null);
            jdbc.update(
                """
                    UPDATE resources
                    SET title = :title,
                        description = :description,
                        url = :url,
                        category = :category,
                        country = :country,
                        institution = :institution,
                        deadline = :deadline,
                        eligibility = :eligibility,
                        amount = :amount,
                        tags = :tags,
                        last_updated = COALESCE(:lastUpdated, last_updated),
                        metadata = :metadata
                    WHERE id = :id
                    """,
                params
            );
            log.info("Updated resource: {}", record.title());
            return new UpsertResult(id, false);
        }

        String id = record.id() == null || record.id().isBlank() ? UUID.randomUUID().toString() : record.id();
        MapSqlParameterSource params = parameters(record, id, OffsetDateTime.now(clock));
        jdbc.update(
            """
                INSERT INTO resources (
                    id, title, description, url, category, country, institution, deadline,
                    eligibility, amount, tags, last_updated, created_at, metadata
                ) VALUES (
                    :id, :title, :description, :url, :category, :country, :institution, :deadline,
                    :eligibility, :amount, :tags, :lastUpdated, :createdAt, :metadata
                )
                """,
            params
        );
        log.info("Inserted new resource: {}", record.title());
        return new UpsertResult(id, true);
    }

    @Override
    public boolean delete(String id) {
        int rows = jdbc.update("DELETE FROM resources WHERE id = :id", new MapSqlParameterSource("id", id));
        if (rows > 0) {
            log.info("Deleted resource: {}", id);
        }
        return rows > 0;
    }

    private MapSqlParameterSource parameters(ResourceRecord record, String id, OffsetDateTime insertedAt) {
        OffsetDateTime lastUpdated = toTimestamp(record.lastUpdated());
        if (lastUpdated == null) {
            lastUpdated = insertedAt;
        }
        return new MapSqlParameterSource()
            .addValue("id", id)
            .addValue("title", record.title())
            .addValue("description", record.description())
            .addValue("url", blankToNull(record.url()))
            .addValue("category", ResourceCategory.fromValue(record.category()).map(ResourceCategory::value).orElse(record.category()))
            .addValue("country", record.country())
            .addValue("institution", blankToNull(record.institution()))
            .addValue("deadline", toDate(record.deadline()), Types.DATE)
            .addValue("eligibility", record.eligibility())
            .addValue("amount", record.amount())
            .addValue("tags", toJson(record.tags()))
            .addValue("lastUpdated", lastUpdated, Types.TIMESTAMP_WITH_TIMEZONE)
            .addValue("createdAt", insertedAt, Types.TIMESTAMP_WITH_TIMEZONE)
            .addValue("metadata", toJson(record.metadata()));
    }

    private ResourceRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
        LocalDate deadline = rs.getObject("deadline", LocalDate.class);
        OffsetDateTime lastUpdated = rs.getObject("last_updated", OffsetDateTime.class);
        return new ResourceRecord(
            rs.getString("id"),
            rs.getString("title"),
            rs.getString("description"),
            rs.getString("url"),
            rs.getString("category"),
            rs.getString("country"),
            rs.getString("institution"),
            deadline == null ? null : deadline.toString(),
            rs.getString("eligibility"),
            rs.getString("amount"),
            fromJson(rs.getString("tags"), STRING_LIST, List.of()),
            lastUpdated == null ? null : lastUpdated.format(DateTimeFormatter.ISO_OFFSET_DATE_TIME),
            fromJson(rs.getString("metadata"), JSON_MAP, Map.of())
        );
    }

    private LocalDate toDate(String deadline) {
        if (deadline == null || deadline.isBlank()) {
            return null;
        }
        try {
            return LocalDate.parse(deadline.trim(), DateTimeFormatter.ISO_LOCAL_DATE);
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("Invalid deadline format: " + deadline, e);
        }
    }

    private OffsetDateTime toTimestamp(String lastUpdated) {
        if (lastUpdated == null || lastUpdated.isBlank()) {
            return null;
        }
        return Timestamps.parseOffset(lastUpdated, clock.getZone())
            .orElseThrow(() -> new IllegalArgumentException("Could not parse last_updated: " + lastUpdated));
    }

    private String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Value is not serializable as JSON", e);
        }
    }

    private <T> T fromJson(String json, TypeReference<T> type, T fallback) {
        if (json == null || json.isBlank()) {
            return fallback;
        }
        try {
            T value = objectMapper.readValue(json, type);
            return value == null ? fallback : value;
        } catch (JsonProcessingException e) {
            log.warn("Ignoring unreadable JSON column value: {}", e.getOriginalMessage());
            return fallback;
        }
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }
}
