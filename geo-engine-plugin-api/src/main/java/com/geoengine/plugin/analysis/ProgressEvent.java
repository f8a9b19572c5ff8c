package com.geoengine.plugin.analysis;

/**
 * Progress of a running analysis, 0 to 100 inclusive.
 */
public final class ProgressEvent {

    private final int progress;
    private final String message;
    private final boolean cancelable;

    public ProgressEvent(int progress, String message, boolean cancelable) {
        if (progress < 0 || progress > 100) {
            throw new IllegalArgumentException("progress must be within [0, 100]: " + progress);
        }
        this.progress = progress;
        this.message = message;
        this.cancelable = cancelable;
    }

    public int getProgress() {
        return progress;
    }

    /** Optional status text; may be null. */
    public String getMessage() {
        return message;
    }

    public boolean isCancelable() {
        return cancelable;
    }

    @Override
    public String toString() {
        return "ProgressEvent[" + progress + "%" + (message != null ? " " + message : "") + "]";
    }
}
