package com.geoengine.plugin.tool;

public enum MouseButton {
    NONE,
    LEFT,
    MIDDLE,
    RIGHT,
    X_BUTTON_1,
    X_BUTTON_2
}
