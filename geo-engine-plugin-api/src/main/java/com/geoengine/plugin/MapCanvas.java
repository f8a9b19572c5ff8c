package com.geoengine.plugin;

import com.geoengine.geometry.Envelope;

/**
 * Host map view as seen by plugins. Rendering itself is outside the engine.
 */
public interface MapCanvas {

    /** World extent currently visible; null when nothing is shown. */
    Envelope getViewExtent();

    /** Asks the host to redraw. */
    void refresh();
}
