package com.mimecast.xoauth2.config;

import com.google.gson.Gson;
import com.google.gson.JsonParseException;
import com.google.gson.reflect.TypeToken;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.lang.reflect.Type;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Configuration foundation.
 *
 * <p>Holds a JSON5 document as a map and provides type safe accessors over it.
 * <br>Keys may address nested maps with dot notation (e.g. <code>source.type</code>).
 * <p>Gson reads the file leniently so comments, unquoted keys and single quotes are accepted.
 */
@SuppressWarnings("unchecked")
public class ConfigFoundation {
    protected static final Logger log = LogManager.getLogger(ConfigFoundation.class);

    private static final Type MAP_TYPE = new TypeToken<Map<String, Object>>() {}.getType();

    /**
     * Configuration map.
     */
    protected final Map<String, Object> map;

    /**
     * Constructs a new ConfigFoundation instance with an empty map.
     */
    public ConfigFoundation() {
        this.map = new HashMap<>();
    }

    /**
     * Constructs a new ConfigFoundation instance with given map.
     *
     * @param map Configuration map.
     */
    public ConfigFoundation(Map<String, Object> map) {
        this.map = map != null ? map : new HashMap<>();
    }

    /**
     * Constructs a new ConfigFoundation instance with configuration path.
     *
     * @param path Path to configuration file.
     * @throws IOException Unable to read or parse file.
     */
    public ConfigFoundation(String path) throws IOException {
        this(readFile(Paths.get(path)));
    }

    /**
     * Reads and parses a JSON5 file into a map.
     *
     * @param path File path.
     * @return Map of String, Object.
     * @throws IOException Unable to read or parse file.
     */
    private static Map<String, Object> readFile(Path path) throws IOException {
        String content = Files.readString(path, StandardCharsets.UTF_8);
        try {
            Map<String, Object> parsed = new Gson().fromJson(content, MAP_TYPE);
            log.debug("Loaded configuration file: {}", path);
            return parsed != null ? parsed : new HashMap<>();
        } catch (JsonParseException e) {
            throw new IOException("Malformed configuration file " + path + ": " + e.getMessage(), e);
        }
    }

    /**
     * Gets configuration map.
     *
     * @return Map of String, Object.
     */
    public Map<String, Object> getMap() {
        return map;
    }

    /**
     * Checks if property exists.
     *
     * @param name Property name.
     * @return Boolean.
     */
    public boolean hasProperty(String name) {
        return getProperty(name) != null;
    }

    /**
     * Gets property value.
     * <p>Dot notation walks nested maps.
     *
     * @param name Property name.
     * @return Object or null.
     */
    protected Object getProperty(String name) {
        if (map.containsKey(name)) {
            return map.get(name);
        }

        Object current = map;
        for (String part : name.split("\\.")) {
            if (!(current instanceof Map)) {
                return null;
            }
            current = ((Map<String, Object>) current).get(part);
        }
        return current;
    }

    /**
     * Gets String property.
     *
     * @param name Property name.
     * @return String or null.
     */
    public String getStringProperty(String name) {
        return getStringProperty(name, null);
    }

    /**
     * Gets String property with default.
     *
     * @param name         Property name.
     * @param defaultValue Default value.
     * @return String.
     */
    public String getStringProperty(String name, String defaultValue) {
        Object value = getProperty(name);
        if (value == null) {
            return defaultValue;
        }

        // Gson reads all JSON numbers as doubles.
        if (value instanceof Double && (Double) value == Math.rint((Double) value)) {
            return String.valueOf(((Double) value).longValue());
        }

        return String.valueOf(value);
    }

    /**
     * Gets Boolean property.
     *
     * @param name Property name.
     * @return Boolean.
     */
    public boolean getBooleanProperty(String name) {
        return getBooleanProperty(name, false);
    }

    /**
     * Gets Boolean property with default.
     *
     * @param name         Property name.
     * @param defaultValue Default value.
     * @return Boolean.
     */
    public boolean getBooleanProperty(String name, boolean defaultValue) {
        Object value = getProperty(name);
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        if (value instanceof String) {
            return Boolean.parseBoolean((String) value);
        }
        return defaultValue;
    }

    /**
     * Gets Long property.
     *
     * @param name Property name.
     * @return Long or null.
     */
    public Long getLongProperty(String name) {
        return getLongProperty(name, null);
    }

    /**
     * Gets Long property with default.
     *
     * @param name         Property name.
     * @param defaultValue Default value.
     * @return Long.
     */
    public Long getLongProperty(String name, Long defaultValue) {
        Object value = getProperty(name);
        if (value instanceof Number) {
            return ((Number) value).longValue();
        }
        if (value instanceof String) {
            try {
                return Long.parseLong((String) value);
            } catch (NumberFormatException e) {
                log.warn("Property {} is not a number: {}", name, value);
            }
        }
        return defaultValue;
    }

    /**
     * Gets List property.
     *
     * @param name Property name.
     * @return List, empty if absent.
     */
    public List<Object> getListProperty(String name) {
        Object value = getProperty(name);
        return value instanceof List ? (List<Object>) value : new ArrayList<>();
    }

    /**
     * Gets Map property.
     *
     * @param name Property name.
     * @return Map, empty if absent.
     */
    public Map<String, Object> getMapProperty(String name) {
        Object value = getProperty(name);
        return value instanceof Map ? (Map<String, Object>) value : new HashMap<>();
    }
}
