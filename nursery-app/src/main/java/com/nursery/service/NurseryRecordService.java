package com.nursery.service;

import com.nursery.config.NurseryProperties;
import com.nursery.model.NurseryRecord;
import com.nursery.model.RecordField;
import com.nursery.model.RecordKind;
import com.nursery.repository.NurseryRecordRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Create, list and delete for every record kind, always scoped to the calling owner.
 * <p>
 * Payloads are only checked for shape: each field of the kind must be present and
 * convertible to its type. Values are otherwise accepted as sent, negative quantities
 * included. Client supplied {@code user_id}, {@code created_at} and unknown keys are ignored.
 */
@Service
public class NurseryRecordService {

    private static final Logger log = LoggerFactory.getLogger(NurseryRecordService.class);

    private final NurseryRecordRepository recordRepository;
    private final NurseryProperties properties;
    private final Clock clock;

    public NurseryRecordService(NurseryRecordRepository recordRepository, NurseryProperties properties, Clock clock) {
        this.recordRepository = recordRepository;
        this.properties = properties;
        this.clock = clock;
    }

    public NurseryRecord create(RecordKind kind, String ownerId, Map<String, Object> payload) {
        if (payload == null) {
            throw new InvalidPayloadException("Request body is required");
        }
        Map<String, Object> fields = new LinkedHashMap<>();
        for (RecordField field : kind.fields()) {
            fields.put(field.name(), coerce(field, payload.get(field.name())));
        }
        return recordRepository.insert(kind, ownerId, fields, clock.instant());
    }

    public List<NurseryRecord> list(RecordKind kind, String ownerId) {
        List<NurseryRecord> records = recordRepository.findByOwner(kind, ownerId, listLimit());
        log.debug("Listed {} {} records for {}", records.size(), kind.path(), ownerId);
        return records;
    }

    public List<NurseryRecord> listForExport(RecordKind kind, String ownerId) {
        return recordRepository.findByOwnerInCreationOrder(kind, ownerId, listLimit());
    }

    public void deleteById(RecordKind kind, String ownerId, String id) {
        if (!recordRepository.deleteByIdAndOwner(kind, id, ownerId)) {
            throw new RecordNotFoundException();
        }
        log.info("Deleted {} record {} for {}", kind.path(), id, ownerId);
    }

    private int listLimit() {
        return properties.getRecords().getListLimit();
    }

    private static Object coerce(RecordField field, Object value) {
        if (value == null) {
            throw new InvalidPayloadException("Field '" + field.name() + "' is required");
        }
        try {
            return switch (field.type()) {
                case STRING -> {
                    if (!(value instanceof String text)) {
                        throw invalidType(field, "a string");
                    }
                    yield text;
                }
                case INTEGER -> toBigDecimal(field, value, "an integer").intValueExact();
                case DECIMAL -> toBigDecimal(field, value, "a number").doubleValue();
            };
        } catch (ArithmeticException e) {
            throw new InvalidPayloadException("Field '" + field.name() + "' must be an integer", e);
        }
    }

    private static BigDecimal toBigDecimal(RecordField field, Object value, String expected) {
        if (value instanceof Boolean) {
            throw invalidType(field, expected);
        }
        if (value instanceof Number || value instanceof String) {
            try {
                return new BigDecimal(value.toString().trim());
            } catch (NumberFormatException e) {
                throw new InvalidPayloadException("Field '" + field.name() + "' must be " + expected, e);
            }
        }
        throw invalidType(field, expected);
    }

    private static InvalidPayloadException invalidType(RecordField field, String expected) {
        return new InvalidPayloadException("Field '" + field.name() + "' must be " + expected);
    }
}
