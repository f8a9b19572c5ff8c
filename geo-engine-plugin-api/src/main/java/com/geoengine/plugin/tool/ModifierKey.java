package com.geoengine.plugin.tool;

public enum ModifierKey {
    ALT,
    CONTROL,
    SHIFT,
    META
}
