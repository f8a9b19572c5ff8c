package com.geoengine.plugin;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class JsonPluginSettingsTest {

    @Test
    void fromSerializedForm_fillsMissingKeysWithDefaults() {
        JsonPluginSettings settings = new JsonPluginSettings(Map.of("units", "m", "precision", 2));

        settings.fromSerializedForm("""
                {"precision": 4, "extra": true}
                """);

        assertEquals("m", settings.getString("units", null));
        assertEquals(4, settings.getInt("precision", 0));
        assertTrue(settings.getBoolean("extra", false));
    }

    @Test
    void serializedForm_restoresValues() {
        JsonPluginSettings source = new JsonPluginSettings().set("ratio", 0.25).set("name", "x");
        JsonPluginSettings target = new JsonPluginSettings();

        target.fromSerializedForm(source.toSerializedForm());

        assertEquals(0.25, target.getDouble("ratio", 0), 1e-12);
        assertEquals("x", target.getString("name", null));
    }

    @Test
    void fromSerializedForm_rejectsMalformedJson() {
        JsonPluginSettings settings = new JsonPluginSettings();

        assertThrows(IllegalArgumentException.class, () -> settings.fromSerializedForm("{not json"));
        assertThrows(IllegalArgumentException.class, () -> settings.fromSerializedForm(""));
    }

    @Test
    void resetToDefaults_dropsChanges() {
        JsonPluginSettings settings = new JsonPluginSettings(Map.of("units", "m"));
        settings.set("units", "km").set("other", 1);

        settings.resetToDefaults();

        assertEquals(Map.of("units", "m"), settings.asMap());
    }

    @Test
    void validate_collectsSubclassErrors() {
        JsonPluginSettings settings = new JsonPluginSettings(Map.of("precision", -1)) {
            @Override
            protected void collectErrors(List<String> errors) {
                if (getInt("precision", 0) < 0) {
                    errors.add("precision must be >= 0");
                }
            }
        };

        ValidationResult result = settings.validate();

        assertFalse(result.isValid());
        assertEquals("precision must be >= 0", result.getMessage().orElseThrow());
        settings.set("precision", 3);
        assertTrue(settings.validate().isValid());
    }
}
