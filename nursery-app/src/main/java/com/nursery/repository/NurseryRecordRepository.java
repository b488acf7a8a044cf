package com.nursery.repository;

import com.nursery.model.NurseryRecord;
import com.nursery.model.RecordField;
import com.nursery.model.RecordKind;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Owner-scoped storage shared by every {@link RecordKind}. Table and column names come
 * from the kind's schema, never from request input.
 */
@Repository
public class NurseryRecordRepository {

    private final JdbcTemplate jdbc;

    public NurseryRecordRepository(JdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    public NurseryRecord insert(RecordKind kind, String ownerId, Map<String, Object> fields, Instant createdAt) {
        String id = UUID.randomUUID().toString();

        List<String> columns = new ArrayList<>(List.of("id", "user_id", "created_at"));
        List<Object> args = new ArrayList<>(List.of(id, ownerId, createdAt.atOffset(ZoneOffset.UTC)));
        for (RecordField field : kind.fields()) {
            columns.add(field.name());
            args.add(fields.get(field.name()));
        }

        String sql = "INSERT INTO " + kind.table()
            + " (" + String.join(", ", columns) + ") VALUES ("
            + String.join(", ", Collections.nCopies(columns.size(), "?")) + ")";
        jdbc.update(sql, args.toArray());

        Map<String, Object> stored = new LinkedHashMap<>();
        kind.fields().forEach(field -> stored.put(field.name(), fields.get(field.name())));
        return new NurseryRecord(id, ownerId, createdAt, stored);
    }

    /**
     * Newest first; ties on created_at fall back to insertion order.
     */
    public List<NurseryRecord> findByOwner(RecordKind kind, String ownerId, int limit) {
        return jdbc.query(
            "SELECT * FROM " + kind.table() + " WHERE user_id = ? ORDER BY created_at DESC, seq DESC LIMIT ?",
            mapperFor(kind), ownerId, limit
        );
    }

    /**
     * Oldest first, the order records were submitted in.
     */
    public List<NurseryRecord> findByOwnerInCreationOrder(RecordKind kind, String ownerId, int limit) {
        return jdbc.query(
            "SELECT * FROM " + kind.table() + " WHERE user_id = ? ORDER BY created_at, seq LIMIT ?",
            mapperFor(kind), ownerId, limit
        );
    }

    public boolean deleteByIdAndOwner(RecordKind kind, String id, String ownerId) {
        int deleted = jdbc.update(
            "DELETE FROM " + kind.table() + " WHERE id = ? AND user_id = ?",
            id, ownerId
        );
        return deleted > 0;
    }

    public long sumQuantity(RecordKind kind, String ownerId) {
        if (!kind.hasField("quantity")) {
            throw new IllegalArgumentException(kind + " has no quantity field");
        }
        Long total = jdbc.queryForObject(
            "SELECT COALESCE(SUM(quantity), 0) FROM " + kind.table() + " WHERE user_id = ?",
            Long.class, ownerId
        );
        return total != null ? total : 0L;
    }

    private static RowMapper<NurseryRecord> mapperFor(RecordKind kind) {
        return (rs, rowNum) -> new NurseryRecord(
            rs.getString("id"),
            rs.getString("user_id"),
            rs.getObject("created_at", OffsetDateTime.class).toInstant(),
            readFields(kind, rs)
        );
    }

    private static Map<String, Object> readFields(RecordKind kind, ResultSet rs) throws SQLException {
        Map<String, Object> values = new LinkedHashMap<>();
        for (RecordField field : kind.fields()) {
            Object value = switch (field.type()) {
                case STRING -> rs.getString(field.name());
                case INTEGER -> rs.getObject(field.name()) != null ? rs.getInt(field.name()) : null;
                case DECIMAL -> rs.getObject(field.name()) != null ? rs.getDouble(field.name()) : null;
            };
            values.put(field.name(), value);
        }
        return values;
    }
}
