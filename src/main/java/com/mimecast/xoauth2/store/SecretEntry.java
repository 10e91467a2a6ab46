package com.mimecast.xoauth2.store;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Secret store entry exposing named fields.
 */
public class SecretEntry {

    /**
     * Entry name within the store.
     */
    private final String name;

    /**
     * Entry fields.
     */
    private final Map<String, String> fields;

    /**
     * Constructs a new SecretEntry instance.
     *
     * @param name   Entry name.
     * @param fields Map of field name to value.
     */
    public SecretEntry(String name, Map<String, String> fields) {
        this.name = name;
        this.fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
    }

    /**
     * Gets entry name.
     *
     * @return String.
     */
    public String getName() {
        return name;
    }

    /**
     * Gets a field value.
     *
     * @param field Field name.
     * @return Optional of String, empty if absent or blank.
     */
    public Optional<String> getField(String field) {
        String value = fields.get(field);
        return value == null || value.isEmpty() ? Optional.empty() : Optional.of(value);
    }

    /**
     * Gets all fields.
     *
     * @return Map of String, String.
     */
    public Map<String, String> getFields() {
        return fields;
    }

    @Override
    public String toString() {
        return "SecretEntry{name=" + name + ", fields=" + fields.keySet() + "}";
    }
}
