package com.geoengine.provider.memory;

import com.geoengine.config.EngineConfig;
import com.geoengine.data.AttributeTable;
import com.geoengine.data.AttributeValue;
import com.geoengine.data.Feature;
import com.geoengine.data.FeatureStore;
import com.geoengine.data.layer.Layer;
import com.geoengine.geometry.Envelope;
import com.geoengine.geometry.jts.JtsGeometry;
import com.geoengine.plugin.provider.DataProviderCapability;
import com.geoengine.plugin.provider.DataProviderExtension;
import com.geoengine.plugin.provider.DataSourceMetadata;
import com.geoengine.plugin.provider.DataSourceType;
import com.geoengine.plugin.provider.FieldMetadata;
import com.geoengine.runtime.PluginManager;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

class InMemoryDataProviderPluginTest {

    private PluginManager manager;
    private InMemoryDataProviderPlugin provider;
    private Layer roads;

    @BeforeEach
    void setUp() {
        manager = PluginManager.builder(EngineConfig.builder().build()).build();
        roads = new Layer("roads");
        roads.getFeatures().add(new Feature(JtsGeometry.lineString(0, 0, 10, 0), AttributeTable.of("name", "A1", "lanes", 2)));
        roads.getFeatures().add(new Feature(JtsGeometry.lineString(0, 5, 0, 20), AttributeTable.of("name", null, "oneway", true)));
        manager.getLayers().add(roads);
        provider = new InMemoryDataProviderPlugin();
        manager.register(provider);
        manager.startAll().join();
    }

    @AfterEach
    void tearDown() {
        manager.shutdown();
    }

    @Test
    void open_returnsLiveStoreOfNamedLayer() {
        FeatureStore store = provider.open("memory://roads", Map.of()).orElseThrow();

        assertSame(roads.getFeatures(), store);
        assertEquals(2, store.size());
    }

    @Test
    void open_missingLayerIsEmptyUnlessCreateRequested() {
        assertTrue(provider.open("memory://rivers", Map.of()).isEmpty());
        assertTrue(manager.getLayers().get("rivers").isEmpty());

        FeatureStore created = provider.open("memory://rivers", Map.of(InMemoryDataProviderPlugin.OPTION_CREATE, "true")).orElseThrow();

        assertTrue(created.isEmpty());
        assertSame(created, manager.getLayers().get("rivers").orElseThrow().getFeatures());
    }

    @Test
    void open_rejectsOtherSchemes() {
        assertTrue(provider.open("file:///tmp/roads.shp", Map.of()).isEmpty());
        assertTrue(provider.open("memory://", Map.of()).isEmpty());
        assertTrue(provider.open(null, null).isEmpty());
    }

    @Test
    void testConnection_isReadOnly() {
        assertTrue(provider.testConnection("memory://roads").join());
        assertFalse(provider.testConnection("memory://rivers").join());
        assertEquals(1, manager.getLayers().size());
    }

    @Test
    void getMetadata_describesLayer() {
        DataSourceMetadata metadata = provider.getMetadata("memory://roads").join().orElseThrow();

        assertEquals("roads", metadata.getName());
        assertEquals(DataSourceType.MEMORY, metadata.getType());
        assertEquals(2, metadata.getFeatureCount());
        assertEquals(new Envelope(0, 0, 10, 20), metadata.getExtent());
        Map<String, AttributeValue.Kind> fields = metadata.getFields().stream()
                .collect(Collectors.toMap(FieldMetadata::name, FieldMetadata::dataType));
        assertEquals(Map.of("name", AttributeValue.Kind.STRING, "lanes", AttributeValue.Kind.INTEGER,
                "oneway", AttributeValue.Kind.BOOLEAN), fields);
        assertEquals(Optional.empty(), provider.getMetadata("memory://rivers").join());
    }

    @Test
    void delete_removesLayer() {
        assertTrue(provider.delete("memory://roads"));
        assertFalse(provider.delete("memory://roads"));
        assertTrue(manager.getLayers().get("roads").isEmpty());
    }

    @Test
    void manager_findsProviderByCapability() {
        List<DataProviderExtension> writers = manager.findDataProviders(DataProviderCapability.WRITE, DataProviderCapability.BULK_INSERT);

        assertEquals(List.of(provider), writers);
        assertTrue(manager.findDataProviders(DataProviderCapability.TRANSACTION).isEmpty());
        assertSame(provider, manager.requireCapability(InMemoryDataProviderPlugin.PLUGIN_ID, DataProviderCapability.DELETE));
    }
}
