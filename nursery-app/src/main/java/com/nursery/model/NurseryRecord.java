package com.nursery.model;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Map;

/**
 * A stored inventory event. Kind-specific values live in {@code fields}, keyed by
 * {@link RecordField#name()}, and are flattened into the JSON object.
 */
public record NurseryRecord(
    @JsonProperty("_id") String id,
    @JsonProperty("user_id") String userId,
    @JsonProperty("created_at") Instant createdAt,
    @JsonIgnore Map<String, Object> fields
) {

    @JsonAnyGetter
    public Map<String, Object> fieldValues() {
        return fields;
    }

    public Object get(String name) {
        return fields.get(name);
    }
}
