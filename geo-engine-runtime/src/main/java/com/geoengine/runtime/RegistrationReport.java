package com.geoengine.runtime;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Outcome of registering a batch of plugins: which ids were accepted and why the rest were not.
 * Accepted plugins may still have failed dependency resolution; see {@link #getDependencyFailures()}.
 */
public final class RegistrationReport {

    private final List<String> accepted;
    private final Map<String, RuntimeException> rejected;
    private final DependencyResolution resolution;

    RegistrationReport(List<String> accepted, Map<String, RuntimeException> rejected, DependencyResolution resolution) {
        this.accepted = List.copyOf(accepted);
        this.rejected = Collections.unmodifiableMap(new LinkedHashMap<>(rejected));
        this.resolution = resolution;
    }

    public List<String> getAccepted() {
        return accepted;
    }

    /** Plugins not registered (version mismatch, duplicate id), keyed by id. */
    public Map<String, RuntimeException> getRejected() {
        return rejected;
    }

    /** Registered plugins moved to ERROR because their dependencies cannot be satisfied. */
    public Map<String, ? extends RuntimeException> getDependencyFailures() {
        return resolution.getFailures();
    }

    @Override
    public String toString() {
        return "RegistrationReport[accepted=" + accepted + ", rejected=" + rejected.keySet()
                + ", dependencyFailures=" + resolution.getFailures().keySet() + "]";
    }
}
