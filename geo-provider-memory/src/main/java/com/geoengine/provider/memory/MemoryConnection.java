package com.geoengine.provider.memory;

import java.util.Optional;

/** Parsed {@code memory://<layer>} connection string. */
final class MemoryConnection {

    static final String SCHEME = "memory://";

    private MemoryConnection() {
    }

    /** Layer name of {@code connection}, or empty when it is not a memory connection. */
    static Optional<String> layerName(String connection) {
        if (connection == null || !connection.regionMatches(true, 0, SCHEME, 0, SCHEME.length())) {
            return Optional.empty();
        }
        String name = connection.substring(SCHEME.length()).trim();
        return name.isEmpty() || name.contains("/") ? Optional.empty() : Optional.of(name);
    }
}
