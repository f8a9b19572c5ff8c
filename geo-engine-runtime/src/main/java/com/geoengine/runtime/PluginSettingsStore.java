package com.geoengine.runtime;

import com.geoengine.plugin.Plugin;
import com.geoengine.plugin.PluginSettings;
import com.geoengine.plugin.ValidationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Objects;
import java.util.Optional;

/**
 * Persists plugin settings as {@code <dir>/<pluginId>.json}. Invalid settings are never written,
 * and a stored file that fails to parse or validate is ignored (defaults stay in place).
 */
public final class PluginSettingsStore {

    private static final Logger log = LoggerFactory.getLogger(PluginSettingsStore.class);
    private static final String EXTENSION = ".json";

    private final Path directory;

    public PluginSettingsStore(Path directory) {
        this.directory = Objects.requireNonNull(directory, "directory");
    }

    public Path getDirectory() {
        return directory;
    }

    Path fileFor(String pluginId) {
        return directory.resolve(pluginId + EXTENSION);
    }

    /**
     * Reads stored settings into the plugin's settings and stages them.
     *
     * @return true when stored settings were found, parsed, validated and applied
     */
    public boolean load(Plugin plugin) {
        Optional<PluginSettings> current = plugin.getSettings();
        if (current.isEmpty()) {
            return false;
        }
        Path file = fileFor(plugin.getId());
        if (!Files.isRegularFile(file)) {
            log.debug("No stored settings for plugin {} at {}", plugin.getId(), file);
            return false;
        }
        PluginSettings settings = current.get();
        try {
            settings.fromSerializedForm(Files.readString(file, StandardCharsets.UTF_8));
        } catch (IOException | IllegalArgumentException e) {
            log.warn("Ignoring unreadable settings for plugin {} at {}: {}", plugin.getId(), file, e.getMessage());
            settings.resetToDefaults();
            return false;
        }
        ValidationResult result = settings.validate();
        if (!result.isValid()) {
            log.warn("Ignoring invalid stored settings for plugin {}: {}", plugin.getId(), result.getErrors());
            settings.resetToDefaults();
            return false;
        }
        plugin.applySettings(settings);
        log.info("Loaded settings for plugin {} from {}", plugin.getId(), file);
        return true;
    }

    /**
     * Writes the plugin's current settings.
     *
     * @return false when the plugin has no settings, they do not validate, or writing failed
     */
    public boolean save(Plugin plugin) {
        Optional<PluginSettings> current = plugin.getSettings();
        if (current.isEmpty()) {
            return false;
        }
        ValidationResult result = current.get().validate();
        if (!result.isValid()) {
            log.warn("Not saving invalid settings for plugin {}: {}", plugin.getId(), result.getErrors());
            return false;
        }
        Path file = fileFor(plugin.getId());
        try {
            Files.createDirectories(directory);
            Path tmp = directory.resolve(plugin.getId() + EXTENSION + ".tmp");
            Files.writeString(tmp, current.get().toSerializedForm(), StandardCharsets.UTF_8);
            Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING);
            log.debug("Saved settings for plugin {} to {}", plugin.getId(), file);
            return true;
        } catch (IOException e) {
            log.error("Failed to save settings for plugin {} to {}: {}", plugin.getId(), file, e.getMessage(), e);
            return false;
        }
    }
}
