package com.geoengine.provider.memory;

import com.geoengine.data.AttributeValue;
import com.geoengine.data.Feature;
import com.geoengine.data.FeatureStore;
import com.geoengine.data.layer.Layer;
import com.geoengine.data.layer.LayerCollection;
import com.geoengine.plugin.AbstractPlugin;
import com.geoengine.plugin.PluginContext;
import com.geoengine.plugin.PluginDescriptor;
import com.geoengine.plugin.PluginType;
import com.geoengine.plugin.provider.DataProviderCapability;
import com.geoengine.plugin.provider.DataProviderExtension;
import com.geoengine.plugin.provider.DataSourceMetadata;
import com.geoengine.plugin.provider.DataSourceType;
import com.geoengine.plugin.provider.FieldMetadata;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;

/**
 * Data provider over the engine's own layers. A connection {@code memory://roads} names the
 * layer {@code roads}; {@link #open} returns that layer's live store and, with option
 * {@code create=true}, adds an empty layer when none exists.
 */
public final class InMemoryDataProviderPlugin extends AbstractPlugin implements DataProviderExtension {

    private static final Logger log = LoggerFactory.getLogger(InMemoryDataProviderPlugin.class);

    public static final String PLUGIN_ID = "geo.provider.memory";
    public static final String OPTION_CREATE = "create";

    private static final Set<DataProviderCapability> CAPABILITIES = Collections.unmodifiableSet(EnumSet.of(
            DataProviderCapability.READ,
            DataProviderCapability.WRITE,
            DataProviderCapability.CREATE,
            DataProviderCapability.DELETE,
            DataProviderCapability.BULK_INSERT));

    public InMemoryDataProviderPlugin() {
        super(PluginDescriptor.builder(PLUGIN_ID)
                .name("In-Memory Provider")
                .description("Opens engine layers as feature stores")
                .version("1.0.0")
                .author("geo-engine")
                .type(PluginType.DATA_PROVIDER)
                .build());
    }

    @Override
    public List<String> getSupportedExtensions() {
        return List.of();
    }

    @Override
    public Set<DataProviderCapability> getCapabilities() {
        return CAPABILITIES;
    }

    @Override
    public Optional<FeatureStore> open(String connection, Map<String, String> options) {
        Optional<String> name = MemoryConnection.layerName(connection);
        Optional<LayerCollection> layers = layers();
        if (name.isEmpty() || layers.isEmpty()) {
            log.debug("Cannot open {}: not a memory connection or provider not initialized", connection);
            return Optional.empty();
        }
        Optional<Layer> existing = layers.get().get(name.get());
        if (existing.isPresent()) {
            return Optional.of(existing.get().getFeatures());
        }
        boolean create = options != null && Boolean.parseBoolean(options.get(OPTION_CREATE));
        if (!create) {
            return Optional.empty();
        }
        Layer layer = new Layer(name.get());
        try {
            layers.get().add(layer);
        } catch (IllegalArgumentException e) {
            // created concurrently by someone else
            return layers.get().get(name.get()).map(Layer::getFeatures);
        }
        log.info("Created memory layer {}", name.get());
        return Optional.of(layer.getFeatures());
    }

    @Override
    public CompletableFuture<Boolean> testConnection(String connection) {
        return CompletableFuture.completedFuture(findLayer(connection).isPresent());
    }

    @Override
    public CompletableFuture<Optional<DataSourceMetadata>> getMetadata(String connection) {
        return CompletableFuture.completedFuture(findLayer(connection).map(layer -> describe(connection, layer)));
    }

    /** Removes the layer named by {@code connection}; false when there was none. */
    public boolean delete(String connection) {
        Optional<String> name = MemoryConnection.layerName(connection);
        Optional<LayerCollection> layers = layers();
        if (name.isEmpty() || layers.isEmpty()) {
            return false;
        }
        boolean removed = layers.get().remove(name.get()).isPresent();
        if (removed) {
            log.info("Deleted memory layer {}", name.get());
        }
        return removed;
    }

    private Optional<Layer> findLayer(String connection) {
        Optional<LayerCollection> layers = layers();
        if (layers.isEmpty()) {
            return Optional.empty();
        }
        return MemoryConnection.layerName(connection).flatMap(layers.get()::get);
    }

    private Optional<LayerCollection> layers() {
        PluginContext context = getContext();
        return context != null ? Optional.ofNullable(context.getLayers()) : Optional.empty();
    }

    private static DataSourceMetadata describe(String connection, Layer layer) {
        FeatureStore store = layer.getFeatures();
        DataSourceMetadata.Builder b = DataSourceMetadata.builder(layer.getName(), DataSourceType.MEMORY)
                .description("In-memory layer " + layer.getName())
                .extent(store.getExtent())
                .featureCount(store.size())
                .property("connection", connection)
                .property("visible", Boolean.toString(layer.isVisible()));
        Map<String, AttributeValue.Kind> fields = new LinkedHashMap<>();
        for (Feature f : store) {
            f.getAttributes().entries().forEach((name, value) -> {
                AttributeValue.Kind known = fields.get(name);
                if (known == null || known == AttributeValue.Kind.NULL) {
                    fields.put(name, value.getKind());
                }
            });
        }
        fields.forEach((name, kind) -> b.field(FieldMetadata.of(name, kind)));
        return b.build();
    }
}
