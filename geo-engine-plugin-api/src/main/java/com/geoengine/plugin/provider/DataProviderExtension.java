package com.geoengine.plugin.provider;

import com.geoengine.data.FeatureStore;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;

/**
 * Opens feature stores from connection strings or file paths. {@link #testConnection(String)} and
 * {@link #getMetadata(String)} only read; they never create or modify the source.
 */
public interface DataProviderExtension {

    /** File extensions handled, lower case with leading dot (e.g. {@code .shp}); empty for non-file sources. */
    List<String> getSupportedExtensions();

    Set<DataProviderCapability> getCapabilities();

    default boolean supports(DataProviderCapability capability) {
        return getCapabilities().contains(capability);
    }

    /** Store for {@code connection}, or empty when the source does not exist or cannot be opened. */
    Optional<FeatureStore> open(String connection, Map<String, String> options);

    CompletableFuture<Boolean> testConnection(String connection);

    CompletableFuture<Optional<DataSourceMetadata>> getMetadata(String connection);
}
