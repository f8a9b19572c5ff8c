package com.geoengine.plugin.tool;

import java.util.EnumSet;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Mouse input on the map canvas: screen position, button, click count, held modifiers and,
 * when the host could resolve it, the world coordinate under the cursor.
 */
public final class MapMouseEvent {

    private final double x;
    private final double y;
    private final MouseButton button;
    private final int clickCount;
    private final Set<ModifierKey> modifiers;
    private final double[] worldCoordinate;

    private MapMouseEvent(double x, double y, MouseButton button, int clickCount,
                          Set<ModifierKey> modifiers, double[] worldCoordinate) {
        this.x = x;
        this.y = y;
        this.button = Objects.requireNonNull(button, "button");
        this.clickCount = clickCount;
        this.modifiers = modifiers.isEmpty() ? Set.of() : Set.copyOf(EnumSet.copyOf(modifiers));
        this.worldCoordinate = worldCoordinate;
    }

    /** Event at screen position (x, y) without a world coordinate. */
    public static MapMouseEvent atScreen(double x, double y, MouseButton button) {
        return new MapMouseEvent(x, y, button, 1, Set.of(), null);
    }

    /** Event with screen and world positions. */
    public static MapMouseEvent at(double x, double y, MouseButton button, double worldX, double worldY) {
        return new MapMouseEvent(x, y, button, 1, Set.of(), new double[]{worldX, worldY});
    }

    public MapMouseEvent withClickCount(int clickCount) {
        if (clickCount < 0) {
            throw new IllegalArgumentException("clickCount must be >= 0");
        }
        return new MapMouseEvent(x, y, button, clickCount, modifiers, worldCoordinate);
    }

    public MapMouseEvent withModifiers(Set<ModifierKey> modifiers) {
        return new MapMouseEvent(x, y, button, clickCount, Objects.requireNonNull(modifiers, "modifiers"), worldCoordinate);
    }

    public double getX() {
        return x;
    }

    public double getY() {
        return y;
    }

    public MouseButton getButton() {
        return button;
    }

    public int getClickCount() {
        return clickCount;
    }

    public Set<ModifierKey> getModifiers() {
        return modifiers;
    }

    public boolean hasModifier(ModifierKey key) {
        return modifiers.contains(key);
    }

    /** {x, y} in map units, when known. */
    public Optional<double[]> getWorldCoordinate() {
        return worldCoordinate != null ? Optional.of(worldCoordinate.clone()) : Optional.empty();
    }

    @Override
    public String toString() {
        return "MapMouseEvent[" + button + " at " + x + "," + y + (clickCount > 1 ? " x" + clickCount : "") + "]";
    }
}
