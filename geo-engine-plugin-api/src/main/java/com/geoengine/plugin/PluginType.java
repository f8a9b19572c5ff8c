package com.geoengine.plugin;

/** Plugin categories. A plugin may belong to several; descriptors hold them as an EnumSet. */
public enum PluginType {
    TOOL,
    DATA_PROVIDER,
    ANALYSIS,
    RENDERER,
    CONVERTER,
    UI_EXTENSION,
    SERVICE
}
