package com.geoengine.plugin.tool;

import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

/** Key press delivered to the active tools. */
public final class MapKeyEvent {

    private final Key key;
    private final int keyCode;
    private final Set<ModifierKey> modifiers;

    public MapKeyEvent(Key key, int keyCode, Set<ModifierKey> modifiers) {
        this.key = Objects.requireNonNull(key, "key");
        this.keyCode = keyCode;
        this.modifiers = modifiers == null || modifiers.isEmpty() ? Set.of() : Set.copyOf(EnumSet.copyOf(modifiers));
    }

    public static MapKeyEvent of(Key key) {
        return new MapKeyEvent(key, 0, Set.of());
    }

    public Key getKey() {
        return key;
    }

    /** Host key code; meaningful for {@link Key#OTHER}. */
    public int getKeyCode() {
        return keyCode;
    }

    public Set<ModifierKey> getModifiers() {
        return modifiers;
    }

    public boolean hasModifier(ModifierKey modifier) {
        return modifiers.contains(modifier);
    }

    @Override
    public String toString() {
        return "MapKeyEvent[" + key + (modifiers.isEmpty() ? "" : " " + modifiers) + "]";
    }
}
