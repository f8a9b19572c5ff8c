package com.geoengine.runtime;

import com.geoengine.config.EngineConfig;
import com.geoengine.data.FeatureStore;
import com.geoengine.plugin.AbstractPlugin;
import com.geoengine.plugin.DependencyException;
import com.geoengine.plugin.InvalidStateException;
import com.geoengine.plugin.JsonPluginSettings;
import com.geoengine.plugin.Plugin;
import com.geoengine.plugin.PluginDescriptor;
import com.geoengine.plugin.PluginExecutionException;
import com.geoengine.plugin.PluginState;
import com.geoengine.plugin.PluginType;
import com.geoengine.plugin.VersionException;
import com.geoengine.plugin.event.PluginLifecycleEvent;
import com.geoengine.plugin.provider.DataProviderCapability;
import com.geoengine.plugin.provider.DataProviderExtension;
import com.geoengine.plugin.provider.DataSourceMetadata;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PluginManagerTest {

    private final List<String> journal = TestPlugin.newJournal();
    private PluginManager manager;

    @AfterEach
    void tearDown() {
        if (manager != null) {
            manager.shutdown();
        }
    }

    private PluginManager newManager(EngineConfig config) {
        manager = PluginManager.builder(config).build();
        return manager;
    }

    private PluginManager newManager() {
        return newManager(EngineConfig.builder().build());
    }

    private List<String> journalOf(String prefix) {
        synchronized (journal) {
            return journal.stream()
                    .filter(e -> e.startsWith(prefix))
                    .map(e -> e.substring(prefix.length()))
                    .collect(Collectors.toList());
        }
    }

    @Test
    void startAll_startsDependenciesFirstAndStopAllReverses() {
        PluginManager pm = newManager();
        pm.registerAll(List.of(
                TestPlugin.of("c", journal, "b"),
                TestPlugin.of("b", journal, "a"),
                TestPlugin.of("a", journal)));

        StartupReport report = pm.startAll().join();

        assertTrue(report.isComplete());
        assertEquals(List.of("a", "b", "c"), report.getStarted());
        assertEquals(List.of("a", "b", "c"), journalOf("start:"));

        pm.stopAll().join();

        assertEquals(List.of("c", "b", "a"), journalOf("stop:"));
        assertTrue(pm.getStartedOrder().isEmpty());
        pm.getPlugins().forEach(p -> assertEquals(PluginState.STOPPED, p.getState()));
    }

    @Test
    void startAll_cycleFailsOnlyItsMembers() {
        PluginManager pm = newManager();
        TestPlugin a = TestPlugin.of("A", journal, "B");
        TestPlugin b = TestPlugin.of("B", journal, "C");
        TestPlugin c = TestPlugin.of("C", journal, "A");
        TestPlugin d = TestPlugin.of("D", journal);

        RegistrationReport registration = pm.registerAll(List.of(a, b, c, d));
        StartupReport report = pm.startAll().join();

        assertEquals(Set.of("A", "B", "C"), registration.getDependencyFailures().keySet());
        assertEquals(List.of("D"), report.getStarted());
        for (TestPlugin p : List.of(a, b, c)) {
            assertEquals(PluginState.ERROR, p.getState());
            assertInstanceOf(DependencyException.class, p.getLastError());
            assertTrue(p.getLastError().getMessage().contains("cycle"), p.getLastError().getMessage());
        }
        assertEquals(List.of("D"), journalOf("init:"));
    }

    @Test
    void register_newerEngineRequiredIsRejectedBeforeAnyLifecycleCall() {
        PluginManager pm = newManager(EngineConfig.builder().engineVersion("1.5").build());
        List<PluginLifecycleEvent> events = new CopyOnWriteArrayList<>();
        pm.getEventBus().subscribe(PluginLifecycleEvent.class, events::add);
        TestPlugin plugin = new TestPlugin(PluginDescriptor.builder("future").type(PluginType.SERVICE)
                .minEngineVersion("2.0").build(), journal);

        VersionException e = assertThrows(VersionException.class, () -> pm.register(plugin));

        assertEquals("future", e.getPluginId());
        assertEquals(PluginState.NOT_INITIALIZED, plugin.getState());
        assertTrue(pm.getPlugin("future").isEmpty());
        assertTrue(journal.isEmpty());
        assertEquals(1, events.size());
        assertEquals(PluginLifecycleEvent.Kind.ERROR, events.get(0).getKind());
        assertSame(e, events.get(0).getError());
    }

    @Test
    void registerAll_reportsRejectedPluginsAndKeepsTheRest() {
        PluginManager pm = newManager(EngineConfig.builder().engineVersion("1.5.0").build());
        TestPlugin ok = TestPlugin.of("ok", journal);
        TestPlugin tooNew = new TestPlugin(PluginDescriptor.builder("new").type(PluginType.SERVICE)
                .minEngineVersion("2.0.0").build(), journal);
        TestPlugin duplicate = TestPlugin.of("ok", journal);

        RegistrationReport report = pm.registerAll(List.of(ok, tooNew, duplicate));

        assertEquals(List.of("ok"), report.getAccepted());
        assertInstanceOf(VersionException.class, report.getRejected().get("new"));
        assertSame(ok, pm.getPlugin("ok").orElseThrow());
    }

    @Test
    void register_duplicateIdRejected() {
        PluginManager pm = newManager();
        pm.register(TestPlugin.of("x", journal));

        assertThrows(IllegalArgumentException.class, () -> pm.register(TestPlugin.of("x", journal)));
        assertThrows(IllegalArgumentException.class, () -> pm.register(null));
    }

    @Test
    void startAll_failedStartFailsDependentsButNotOthers() {
        PluginManager pm = newManager();
        TestPlugin base = TestPlugin.of("base", journal);
        base.startFailure = new IllegalStateException("no database");
        TestPlugin dependent = TestPlugin.of("dependent", journal, "base");
        TestPlugin other = TestPlugin.of("other", journal);
        pm.registerAll(List.of(base, dependent, other));

        StartupReport report = pm.startAll().join();

        assertEquals(List.of("other"), report.getStarted());
        assertEquals(PluginState.ERROR, base.getState());
        assertInstanceOf(IllegalStateException.class, base.getLastError());
        assertEquals(PluginState.ERROR, dependent.getState());
        assertInstanceOf(DependencyException.class, dependent.getLastError());
        assertEquals(Map.of("base", PluginState.ERROR, "dependent", PluginState.ERROR), report.getNotStarted());
        assertFalse(journalOf("init:").contains("dependent"));
    }

    @Test
    void startAll_parallelRespectsDependencies() {
        PluginManager pm = newManager(EngineConfig.builder().parallelStartup(true).build());
        pm.registerAll(List.of(
                TestPlugin.of("app", journal, "db", "cache"),
                TestPlugin.of("db", journal),
                TestPlugin.of("cache", journal, "db"),
                TestPlugin.of("standalone", journal)));

        StartupReport report = pm.startAll().join();

        assertTrue(report.isComplete());
        List<String> starts = journalOf("start:");
        assertEquals(4, starts.size());
        assertTrue(starts.indexOf("db") < starts.indexOf("cache"));
        assertTrue(starts.indexOf("cache") < starts.indexOf("app"));
        assertEquals(Set.copyOf(starts), Set.copyOf(pm.getStartedOrder()));

        pm.stopAll().join();

        List<String> stops = journalOf("stop:");
        assertTrue(stops.indexOf("app") < stops.indexOf("cache"));
        assertTrue(stops.indexOf("cache") < stops.indexOf("db"));
    }

    @Test
    void startAll_publishesLifecycleEvents() {
        PluginManager pm = newManager();
        List<PluginLifecycleEvent> events = new CopyOnWriteArrayList<>();
        pm.getEventBus().subscribe(PluginLifecycleEvent.class, events::add);

        pm.register(TestPlugin.of("p", journal));
        pm.startAll().join();

        assertEquals(PluginLifecycleEvent.Kind.LOADED, events.get(0).getKind());
        List<PluginState> reached = events.stream()
                .filter(e -> e.getKind() == PluginLifecycleEvent.Kind.STATE_CHANGED)
                .map(PluginLifecycleEvent::getNewState)
                .collect(Collectors.toList());
        assertEquals(List.of(PluginState.INITIALIZING, PluginState.INITIALIZED, PluginState.STARTED), reached);
    }

    @Test
    void startAll_failurePublishesErrorEvent() {
        PluginManager pm = newManager();
        List<PluginLifecycleEvent> errors = new CopyOnWriteArrayList<>();
        pm.getEventBus().subscribe(PluginLifecycleEvent.class, e -> {
            if (e.getKind() == PluginLifecycleEvent.Kind.ERROR) {
                errors.add(e);
            }
        });
        TestPlugin broken = TestPlugin.of("broken", journal);
        broken.startFailure = new IllegalStateException("boom");
        pm.register(broken);

        pm.startAll().join();

        assertEquals(1, errors.size());
        assertEquals("broken", errors.get(0).getPluginId());
        assertEquals(PluginLifecycleEvent.Severity.ERROR, errors.get(0).getSeverity());
    }

    @Test
    void register_configuredDisabledPluginIsDisabledAndBlocksDependents() {
        PluginManager pm = newManager(EngineConfig.builder().disabledPlugins(List.of("off")).build());
        TestPlugin off = TestPlugin.of("off", journal);
        TestPlugin needsOff = TestPlugin.of("needs-off", journal, "off");

        pm.registerAll(List.of(off, needsOff));
        StartupReport report = pm.startAll().join();

        assertEquals(PluginState.DISABLED, off.getState());
        assertFalse(pm.isEnabled("off"));
        assertEquals(PluginState.ERROR, needsOff.getState());
        assertTrue(report.getStarted().isEmpty());
    }

    @Test
    void disablePlugin_stopsRunningPluginFirst() {
        PluginManager pm = newManager();
        TestPlugin p = TestPlugin.of("p", journal);
        pm.register(p);
        pm.startAll().join();

        pm.disablePlugin("p").join();

        assertEquals(PluginState.DISABLED, p.getState());
        assertEquals(List.of("p"), journalOf("stop:"));
        assertTrue(pm.getStartedOrder().isEmpty());
        CompletionException again = assertThrows(CompletionException.class, () -> pm.disablePlugin("p").join());
        assertInstanceOf(InvalidStateException.class, again.getCause());
    }

    @Test
    void disablePlugin_stopsRunningDependentsBeforeTheDependency() {
        PluginManager pm = newManager();
        TestPlugin a = TestPlugin.of("a", journal);
        TestPlugin b = TestPlugin.of("b", journal, "a");
        pm.registerAll(List.of(a, b));
        pm.startAll().join();

        pm.disablePlugin("a").join();

        assertEquals(List.of("b", "a"), journalOf("stop:"));
        assertEquals(PluginState.STOPPED, b.getState());
        assertTrue(pm.getStartedOrder().isEmpty());

        pm.startAll().join();
        assertEquals(PluginState.ERROR, b.getState());
        assertInstanceOf(DependencyException.class, b.getLastError());

        pm.shutdown();
        manager = null;
        assertEquals(List.of("init:a", "start:a", "init:b", "start:b", "stop:b", "stop:a"), List.copyOf(journal));
    }

    @Test
    void startAll_stopsRunningPluginWhoseDependencyFailed() {
        PluginManager pm = newManager();
        TestPlugin a = TestPlugin.of("a", journal);
        TestPlugin b = TestPlugin.of("b", journal, "a");
        pm.registerAll(List.of(a, b));
        pm.startAll().join();

        a.markFailed(new IllegalStateException("lost connection"));
        pm.startAll().join();

        assertEquals(List.of("b"), journalOf("stop:"));
        assertEquals(PluginState.ERROR, b.getState());
        assertInstanceOf(DependencyException.class, b.getLastError());
        assertTrue(pm.getStartedOrder().isEmpty());
    }

    @Test
    void enablePlugin_reinitializesAndStartsOnceDependenciesRun() {
        PluginManager pm = newManager(EngineConfig.builder().disabledPlugins(List.of("base", "top")).build());
        TestPlugin base = TestPlugin.of("base", journal);
        TestPlugin top = TestPlugin.of("top", journal, "base");
        pm.registerAll(List.of(base, top));
        pm.startAll().join();
        assertEquals(PluginState.DISABLED, base.getState());

        pm.enablePlugin("top").join();
        assertEquals(PluginState.INITIALIZED, top.getState());
        assertTrue(pm.isEnabled("top"));

        pm.enablePlugin("base").join();
        assertEquals(PluginState.STARTED, base.getState());

        pm.startAll().join();
        assertEquals(List.of("base", "top"), pm.getStartedOrder());
        assertEquals(List.of("top", "base"), journalOf("init:"));

        pm.enablePlugin("top").join();
        assertEquals(PluginState.STARTED, top.getState());
    }

    @Test
    void startPlugin_requiresStartedDependencies() {
        PluginManager pm = newManager();
        TestPlugin base = TestPlugin.of("base", journal);
        TestPlugin top = TestPlugin.of("top", journal, "base");
        pm.registerAll(List.of(base, top));
        pm.initializePlugin("top").join();

        CompletionException e = assertThrows(CompletionException.class, () -> pm.startPlugin("top").join());

        assertInstanceOf(DependencyException.class, e.getCause());
        assertEquals(PluginState.INITIALIZED, top.getState());

        pm.initializePlugin("base").join();
        pm.startPlugin("base").join();
        pm.startPlugin("top").join();
        assertEquals(List.of("base", "top"), pm.getStartedOrder());
    }

    @Test
    void stopAll_timeoutMarksPluginFailedAndContinues() {
        PluginManager pm = newManager(EngineConfig.builder().stopTimeoutSeconds(1).build());
        TestPlugin first = TestPlugin.of("first", journal);
        TestPlugin hanging = TestPlugin.of("hanging", journal);
        hanging.stopWork = new CompletableFuture<>();
        pm.registerAll(List.of(first, hanging));
        pm.startAll().join();

        pm.stopAll().join();

        assertEquals(List.of("hanging", "first"), journalOf("stop:"));
        assertEquals(PluginState.ERROR, hanging.getState());
        assertEquals(PluginState.STOPPED, first.getState());
        hanging.stopWork.complete(null);
    }

    @Test
    void stopAll_timedOutStopKeepsLaneUntilItFinishes() {
        PluginManager pm = newManager(EngineConfig.builder().stopTimeoutSeconds(1).build());
        TestPlugin hanging = TestPlugin.of("hanging", journal);
        hanging.stopWork = new CompletableFuture<>();
        pm.register(hanging);
        pm.startAll().join();
        pm.stopAll().join();

        CompletableFuture<Void> unloading = pm.unload("hanging");

        assertFalse(unloading.isDone());
        assertTrue(pm.getPlugin("hanging").isPresent());
        hanging.stopWork.complete(null);
        unloading.join();
        assertTrue(pm.getPlugin("hanging").isEmpty());
    }

    @Test
    void unload_stopsClosesAndRemoves() {
        PluginManager pm = newManager();
        List<PluginLifecycleEvent> events = new CopyOnWriteArrayList<>();
        pm.getEventBus().subscribe(PluginLifecycleEvent.class, events::add);
        TestPlugin p = TestPlugin.of("p", journal);
        pm.register(p);
        pm.startAll().join();

        pm.unload("p").join();

        assertTrue(p.closed);
        assertEquals(PluginState.STOPPED, p.getState());
        assertTrue(pm.getPlugin("p").isEmpty());
        assertEquals(PluginLifecycleEvent.Kind.UNLOADED, events.get(events.size() - 1).getKind());
        assertThrows(IllegalArgumentException.class, () -> pm.unload("p"));
    }

    @Test
    void context_givesPluginAccessToHostServices() {
        PluginManager pm = newManager();
        TestPlugin p = TestPlugin.of("p", journal);
        pm.register(p);
        pm.startAll().join();

        assertSame(pm, p.seenContext.getPluginManager());
        assertSame(pm.getLayers(), p.seenContext.getLayers());
        assertSame(pm.getEventBus(), p.seenContext.getEventBus());
        assertEquals("geoengine.plugin.p", p.seenContext.getLogger().getName());
    }

    @Test
    void settings_persistAcrossManagers(@TempDir Path dir) {
        EngineConfig config = EngineConfig.builder().pluginSettingsDir(dir.toString()).build();
        PluginManager first = PluginManager.builder(config).build();
        TestPlugin p1 = TestPlugin.of("p", journal);
        first.register(p1);
        JsonPluginSettings s = (JsonPluginSettings) p1.getSettings().orElseThrow();
        s.set("color", "blue");
        assertTrue(first.saveSettings("p"));
        first.shutdown();

        TestPlugin p2 = TestPlugin.of("p", journal);
        PluginManager pm = newManager(config);
        pm.register(p2);
        pm.startAll().join();

        assertEquals("blue", p2.activeColor());
    }

    @Test
    void getPlugins_filtersByTypeAndExtensionsOnlyFromStartedPlugins() {
        PluginManager pm = newManager();
        ProviderPlugin provider = new ProviderPlugin("mem", EnumSet.of(DataProviderCapability.READ, DataProviderCapability.WRITE));
        ProviderPlugin readOnly = new ProviderPlugin("ro", EnumSet.of(DataProviderCapability.READ));
        pm.registerAll(List.of(provider, readOnly, TestPlugin.of("svc", journal)));

        assertEquals(List.of(provider, readOnly), pm.getPlugins(Set.of(PluginType.DATA_PROVIDER)));
        assertTrue(pm.getExtensions(DataProviderExtension.class).isEmpty());

        pm.startAll().join();

        assertEquals(2, pm.getExtensions(DataProviderExtension.class).size());
        assertEquals(List.of(provider), pm.findDataProviders(DataProviderCapability.WRITE));
        assertSame(provider, pm.requireCapability("mem", DataProviderCapability.WRITE));
        assertThrows(PluginExecutionException.class, () -> pm.requireCapability("ro", DataProviderCapability.WRITE));
        assertThrows(PluginExecutionException.class, () -> pm.requireCapability("svc", DataProviderCapability.READ));
    }

    private static final class ProviderPlugin extends AbstractPlugin implements DataProviderExtension {
        private final Set<DataProviderCapability> capabilities;

        ProviderPlugin(String id, Set<DataProviderCapability> capabilities) {
            super(PluginDescriptor.builder(id).type(PluginType.DATA_PROVIDER).build());
            this.capabilities = capabilities;
        }

        @Override
        public List<String> getSupportedExtensions() {
            return List.of();
        }

        @Override
        public Set<DataProviderCapability> getCapabilities() {
            return capabilities;
        }

        @Override
        public Optional<FeatureStore> open(String connection, Map<String, String> options) {
            return Optional.of(new FeatureStore());
        }

        @Override
        public CompletableFuture<Boolean> testConnection(String connection) {
            return CompletableFuture.completedFuture(true);
        }

        @Override
        public CompletableFuture<Optional<DataSourceMetadata>> getMetadata(String connection) {
            return CompletableFuture.completedFuture(Optional.empty());
        }
    }

    @Test
    void getPlugin_unknownIsEmpty() {
        PluginManager pm = newManager();

        Optional<Plugin> missing = pm.getPlugin("nope");

        assertTrue(missing.isEmpty());
        assertThrows(IllegalArgumentException.class, () -> pm.startPlugin("nope"));
    }
}
