package com.geoengine.plugin.tool;

/**
 * Interactive map tool. While active, the host offers it mouse and key input; a handler returns
 * true to claim the event so that no other tool sees it. Handlers run on the caller's thread.
 */
public interface ToolExtension {

    String getToolName();

    /** Icon resource name, or null. */
    default String getToolIcon() {
        return null;
    }

    default String getToolCategory() {
        return "General";
    }

    void activate();

    void deactivate();

    boolean isActive();

    boolean onMouseDown(MapMouseEvent event);

    default boolean onMouseMove(MapMouseEvent event) {
        return false;
    }

    default boolean onMouseUp(MapMouseEvent event) {
        return false;
    }

    default boolean onKeyDown(MapKeyEvent event) {
        return false;
    }
}
