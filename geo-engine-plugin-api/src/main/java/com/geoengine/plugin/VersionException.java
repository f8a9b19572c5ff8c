package com.geoengine.plugin;

/**
 * The plugin requires a newer engine than the host. Raised at registration, before any
 * lifecycle method runs.
 */
public class VersionException extends PluginException {

    private final SemanticVersion required;
    private final SemanticVersion host;

    public VersionException(String pluginId, SemanticVersion required, SemanticVersion host) {
        super(pluginId, "Plugin " + pluginId + " requires engine " + required + " but host is " + host);
        this.required = required;
        this.host = host;
    }

    public SemanticVersion getRequired() {
        return required;
    }

    public SemanticVersion getHost() {
        return host;
    }
}
