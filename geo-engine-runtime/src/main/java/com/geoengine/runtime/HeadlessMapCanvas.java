package com.geoengine.runtime;

import com.geoengine.geometry.Envelope;
import com.geoengine.plugin.MapCanvas;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Map canvas for hosts without a view: keeps a settable extent and counts refresh requests.
 */
public final class HeadlessMapCanvas implements MapCanvas {

    private static final Logger log = LoggerFactory.getLogger(HeadlessMapCanvas.class);

    private final AtomicLong refreshCount = new AtomicLong();
    private volatile Envelope viewExtent;

    public HeadlessMapCanvas() {
    }

    public HeadlessMapCanvas(Envelope viewExtent) {
        this.viewExtent = viewExtent;
    }

    @Override
    public Envelope getViewExtent() {
        return viewExtent;
    }

    public void setViewExtent(Envelope viewExtent) {
        this.viewExtent = viewExtent;
    }

    @Override
    public void refresh() {
        long n = refreshCount.incrementAndGet();
        log.trace("Refresh requested ({} so far)", n);
    }

    public long getRefreshCount() {
        return refreshCount.get();
    }
}
