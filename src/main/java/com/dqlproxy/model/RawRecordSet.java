package com.dqlproxy.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.Value;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Records of a succeeded Grail job ({@code result.records}).
 *
 * Records have no common schema: each one carries its own set of fields, and a field
 * holding JSON null counts as absent.
 */
@Value
public class RawRecordSet {

    List<ObjectNode> records;

    public RawRecordSet(List<ObjectNode> records) {
        this.records = Collections.unmodifiableList(new ArrayList<>(records));
    }

    /**
     * Extract records from a poll body. Missing result or non-object entries are ignored.
     */
    public static RawRecordSet fromPollBody(JsonNode body) {
        List<ObjectNode> records = new ArrayList<>();
        JsonNode array = body == null ? null : body.path("result").path("records");
        if (array != null && array.isArray()) {
            for (JsonNode record : array) {
                if (record.isObject()) {
                    records.add((ObjectNode) record);
                }
            }
        }
        return new RawRecordSet(records);
    }

    public int size() {
        return records.size();
    }

    /**
     * Field value, or null when the record lacks it or holds JSON null.
     */
    public static JsonNode field(ObjectNode record, String name) {
        JsonNode value = record.get(name);
        return value == null || value.isNull() ? null : value;
    }
}
