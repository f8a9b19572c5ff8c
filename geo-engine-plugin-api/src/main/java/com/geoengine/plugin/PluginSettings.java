package com.geoengine.plugin;

/**
 * Plugin-owned settings. The host persists the serialized form between sessions and only
 * applies settings that validate.
 */
public interface PluginSettings {

    String toSerializedForm();

    /**
     * Replaces the current values with those in {@code text}.
     *
     * @throws IllegalArgumentException when the text cannot be parsed
     */
    void fromSerializedForm(String text);

    void resetToDefaults();

    ValidationResult validate();
}
