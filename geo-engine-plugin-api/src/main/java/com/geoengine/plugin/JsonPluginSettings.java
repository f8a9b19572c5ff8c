package com.geoengine.plugin;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Settings held as a JSON object of simple values. Unknown keys read from JSON are kept;
 * keys missing from JSON fall back to the defaults. Subclasses add checks in {@link #collectErrors(List)}.
 */
public class JsonPluginSettings implements PluginSettings {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final TypeReference<LinkedHashMap<String, Object>> MAP_TYPE = new TypeReference<>() { };

    private final Map<String, Object> defaults;
    private final Map<String, Object> values = new LinkedHashMap<>();

    public JsonPluginSettings() {
        this(Map.of());
    }

    public JsonPluginSettings(Map<String, Object> defaults) {
        this.defaults = Collections.unmodifiableMap(new LinkedHashMap<>(Objects.requireNonNull(defaults, "defaults")));
        this.values.putAll(this.defaults);
    }

    public Object get(String key) {
        return values.get(key);
    }

    public String getString(String key, String defaultValue) {
        Object v = values.get(key);
        return v != null ? v.toString() : defaultValue;
    }

    public int getInt(String key, int defaultValue) {
        Object v = values.get(key);
        if (v instanceof Number n) {
            return n.intValue();
        }
        if (v instanceof String s) {
            try {
                return Integer.parseInt(s.trim());
            } catch (NumberFormatException e) {
                return defaultValue;
            }
        }
        return defaultValue;
    }

    public double getDouble(String key, double defaultValue) {
        Object v = values.get(key);
        if (v instanceof Number n) {
            return n.doubleValue();
        }
        if (v instanceof String s) {
            try {
                return Double.parseDouble(s.trim());
            } catch (NumberFormatException e) {
                return defaultValue;
            }
        }
        return defaultValue;
    }

    public boolean getBoolean(String key, boolean defaultValue) {
        Object v = values.get(key);
        if (v instanceof Boolean b) {
            return b;
        }
        if (v instanceof String s) {
            return "true".equalsIgnoreCase(s.trim());
        }
        return defaultValue;
    }

    public JsonPluginSettings set(String key, Object value) {
        Objects.requireNonNull(key, "key");
        if (value == null) {
            values.remove(key);
        } else {
            values.put(key, value);
        }
        return this;
    }

    /** Current values (unmodifiable view). */
    public Map<String, Object> asMap() {
        return Collections.unmodifiableMap(values);
    }

    @Override
    public String toSerializedForm() {
        try {
            return MAPPER.writeValueAsString(values);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(e);
        }
    }

    @Override
    public void fromSerializedForm(String text) {
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("Settings text must be non-blank");
        }
        Map<String, Object> parsed;
        try {
            parsed = MAPPER.readValue(text, MAP_TYPE);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Invalid settings JSON: " + e.getOriginalMessage(), e);
        }
        values.clear();
        values.putAll(defaults);
        if (parsed != null) {
            values.putAll(parsed);
        }
    }

    @Override
    public void resetToDefaults() {
        values.clear();
        values.putAll(defaults);
    }

    @Override
    public final ValidationResult validate() {
        List<String> errors = new ArrayList<>();
        collectErrors(errors);
        return ValidationResult.of(errors);
    }

    /** Adds a message to {@code errors} for each invalid value. */
    protected void collectErrors(List<String> errors) {
    }
}
