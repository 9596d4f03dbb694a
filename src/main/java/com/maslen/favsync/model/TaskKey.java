package com.maslen.favsync.model;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import lombok.EqualsAndHashCode;

import java.util.Collections;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Natural key of a task and its canonical form: compact JSON with the fields
 * sorted by name, so equal keys always produce the same {@code task_key}.
 */
@EqualsAndHashCode
public final class TaskKey {

    public static final String BVID = "bvid";
    public static final String FAVID = "favid";

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true);

    private final SortedMap<String, String> fields;

    private TaskKey(Map<String, String> fields) {
        this.fields = Collections.unmodifiableSortedMap(new TreeMap<>(fields));
    }

    public static TaskKey of(Map<String, String> fields) {
        if (fields == null || fields.isEmpty()) {
            throw new IllegalArgumentException("Task key must have at least one field");
        }
        fields.forEach((name, value) -> {
            if (name == null || value == null) {
                throw new IllegalArgumentException("Task key fields must not be null: " + fields);
            }
        });
        return new TaskKey(fields);
    }

    public static TaskKey biliVideo(String bvid, String favid) {
        return of(Map.of(BVID, bvid, FAVID, favid));
    }

    public static TaskKey parse(String serialized) {
        try {
            return of(MAPPER.readValue(serialized, new TypeReference<Map<String, String>>() {
            }));
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Malformed task key: " + serialized, e);
        }
    }

    public String get(String field) {
        return fields.get(field);
    }

    public Map<String, String> getFields() {
        return fields;
    }

    public String serialize() {
        try {
            return MAPPER.writeValueAsString(fields);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize task key " + fields, e);
        }
    }

    @Override
    public String toString() {
        return serialize();
    }
}
