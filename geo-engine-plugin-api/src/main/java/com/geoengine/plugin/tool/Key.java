package com.geoengine.plugin.tool;

/** Keys tools may react to; anything else arrives as {@link #OTHER} with the raw code in the event. */
public enum Key {
    NONE,
    ESCAPE,
    ENTER,
    SPACE,
    DELETE,
    BACKSPACE,
    LEFT,
    RIGHT,
    UP,
    DOWN,
    OTHER
}
