package com.geoengine.runtime;

import com.geoengine.config.EngineConfig;
import com.geoengine.data.layer.DefaultLayerCollection;
import com.geoengine.data.layer.LayerCollection;
import com.geoengine.plugin.DependencyException;
import com.geoengine.plugin.MapCanvas;
import com.geoengine.plugin.Plugin;
import com.geoengine.plugin.PluginContext;
import com.geoengine.plugin.PluginExecutionException;
import com.geoengine.plugin.PluginLookup;
import com.geoengine.plugin.PluginState;
import com.geoengine.plugin.PluginType;
import com.geoengine.plugin.SemanticVersion;
import com.geoengine.plugin.VersionException;
import com.geoengine.plugin.event.EventBus;
import com.geoengine.plugin.event.PluginLifecycleEvent;
import com.geoengine.plugin.provider.DataProviderCapability;
import com.geoengine.plugin.provider.DataProviderExtension;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * Owns every plugin of the engine: registration with engine-version checks, dependency
 * ordering, startup and shutdown, enable/disable, unloading, settings persistence and lookup.
 * <p>
 * <b>Ordering:</b> lifecycle calls for one plugin run one after another on that plugin's lane;
 * calls for different plugins may run concurrently. {@link #startAll()} starts plugins in
 * dependency order (or independent subgraphs in parallel when configured) and
 * {@link #stopAll()} stops them in exact reverse of the order in which they reached STARTED.
 * <p>
 * <b>Failure isolation:</b> a plugin whose dependencies cannot be satisfied, or that fails to
 * initialize or start, ends in ERROR together with its dependents; unrelated plugins are not
 * affected. Every state change is published on the event bus as a {@link PluginLifecycleEvent}.
 */
public final class PluginManager implements PluginLookup {

    private static final Logger log = LoggerFactory.getLogger(PluginManager.class);

    private final EngineConfig config;
    private final SemanticVersion hostVersion;
    private final EventBus eventBus;
    private final LayerCollection layers;
    private final MapCanvas mapCanvas;
    private final PluginSettingsStore settingsStore;
    private final Executor executor;
    private final ExecutorService ownedExecutor;

    private final Object registryLock = new Object();
    private final Map<String, ManagedPlugin> plugins = new LinkedHashMap<>();
    private final List<String> startedOrder = new ArrayList<>();

    private static final class ManagedPlugin {
        final Plugin plugin;
        final PluginContext context;
        CompletableFuture<Void> lane = CompletableFuture.completedFuture(null);

        ManagedPlugin(Plugin plugin, PluginContext context) {
            this.plugin = plugin;
            this.context = context;
        }
    }

    private PluginManager(Builder b) {
        this.config = b.config;
        this.hostVersion = SemanticVersion.parse(b.config.getEngineVersion());
        this.eventBus = b.eventBus != null ? b.eventBus : new DefaultEventBus();
        this.layers = b.layers != null ? b.layers : new DefaultLayerCollection();
        this.mapCanvas = b.mapCanvas != null ? b.mapCanvas : new HeadlessMapCanvas();
        if (b.settingsStore != null) {
            this.settingsStore = b.settingsStore;
        } else {
            this.settingsStore = b.config.getPluginSettingsDir() != null
                    ? new PluginSettingsStore(b.config.getPluginSettingsDir()) : null;
        }
        if (b.executor != null) {
            this.executor = b.executor;
            this.ownedExecutor = null;
        } else {
            this.ownedExecutor = newDefaultExecutor();
            this.executor = ownedExecutor;
        }
    }

    public static Builder builder(EngineConfig config) {
        return new Builder(config);
    }

    public SemanticVersion getHostVersion() {
        return hostVersion;
    }

    public EventBus getEventBus() {
        return eventBus;
    }

    public LayerCollection getLayers() {
        return layers;
    }

    public MapCanvas getMapCanvas() {
        return mapCanvas;
    }

    // ---- registration ----

    /**
     * Takes ownership of {@code plugin}. No lifecycle method is called here; stored settings are
     * loaded and staged, and plugins listed in the configuration as disabled are disabled.
     *
     * @throws IllegalArgumentException when plugin is null or its id is already registered
     * @throws VersionException when the plugin needs a newer engine; it is not registered
     */
    public void register(Plugin plugin) {
        if (plugin == null) {
            throw new IllegalArgumentException("plugin must not be null");
        }
        String id = plugin.getId();
        SemanticVersion required = plugin.getDescriptor().getMinEngineVersion();
        if (!hostVersion.isAtLeast(required)) {
            VersionException e = new VersionException(id, required, hostVersion);
            log.error("Rejecting plugin {}: {}", id, e.getMessage());
            eventBus.publish(PluginLifecycleEvent.error(id, e, PluginLifecycleEvent.Severity.ERROR));
            throw e;
        }
        ManagedPlugin managed = new ManagedPlugin(plugin,
                new DefaultPluginContext(id, mapCanvas, layers, this, eventBus, config.getPluginDataDir(), executor));
        synchronized (registryLock) {
            if (plugins.containsKey(id)) {
                throw new IllegalArgumentException("Duplicate plugin id: " + id);
            }
            plugins.put(id, managed);
        }
        plugin.addStateListener(this::onStateChanged);
        loadSettings(id);
        log.info("Registered plugin {} {} {}", id, plugin.getDescriptor().getVersion(), plugin.getDescriptor().getTypes());
        eventBus.publish(PluginLifecycleEvent.loaded(id));
        if (config.getDisabledPlugins().contains(id) && plugin.getState() != PluginState.DISABLED) {
            log.info("Plugin {} is disabled by configuration", id);
            plugin.disable();
        }
    }

    /**
     * Registers a batch. Individual rejections are reported rather than thrown; afterwards
     * dependencies are resolved and plugins that cannot be satisfied are moved to ERROR.
     */
    public RegistrationReport registerAll(Collection<? extends Plugin> batch) {
        Objects.requireNonNull(batch, "batch");
        List<String> accepted = new ArrayList<>();
        Map<String, RuntimeException> rejected = new LinkedHashMap<>();
        for (Plugin plugin : batch) {
            if (plugin == null) {
                log.warn("Skipping null plugin in batch");
                continue;
            }
            try {
                register(plugin);
                accepted.add(plugin.getId());
            } catch (VersionException | IllegalArgumentException e) {
                log.error("Plugin {} not registered (skipping): {}", plugin.getId(), e.getMessage());
                rejected.put(plugin.getId(), e);
            }
        }
        DependencyResolution resolution = resolveDependencies();
        markDependencyFailures(resolution).join();
        return new RegistrationReport(accepted, rejected, resolution);
    }

    /** Dependency order over the registered plugins; does not change any state. */
    public DependencyResolution resolveDependencies() {
        Map<String, Plugin> snapshot = new LinkedHashMap<>();
        synchronized (registryLock) {
            plugins.forEach((id, m) -> snapshot.put(id, m.plugin));
        }
        return DependencyResolver.resolve(snapshot);
    }

    // ---- bulk lifecycle ----

    /**
     * Initializes (where needed) and starts every resolvable plugin in dependency order. The
     * returned future never fails; inspect the report or plugin states for failures.
     */
    public CompletableFuture<StartupReport> startAll() {
        DependencyResolution resolution = resolveDependencies();
        return markDependencyFailures(resolution).thenCompose(v -> startInOrder(resolution.getOrder()));
    }

    private CompletableFuture<StartupReport> startInOrder(List<String> order) {
        log.info("Starting {} plugin(s) in order {}{}", order.size(), order, config.isParallelStartup() ? " (parallel)" : "");
        CompletableFuture<Void> all;
        if (config.isParallelStartup()) {
            Map<String, CompletableFuture<Void>> done = new HashMap<>();
            for (String id : order) {
                CompletableFuture<?>[] deps = dependenciesOf(id).stream()
                        .map(done::get)
                        .filter(Objects::nonNull)
                        .toArray(CompletableFuture[]::new);
                done.put(id, CompletableFuture.allOf(deps).thenCompose(v -> bringUp(id)));
            }
            all = CompletableFuture.allOf(done.values().toArray(new CompletableFuture[0]));
        } else {
            all = CompletableFuture.completedFuture(null);
            for (String id : order) {
                all = all.thenCompose(v -> bringUp(id));
            }
        }
        return all.thenApply(v -> buildStartupReport());
    }

    /**
     * Stops every STARTED plugin, one at a time, in reverse start order. A plugin that fails or
     * exceeds the configured stop timeout is logged and skipped. The future never fails.
     */
    public CompletableFuture<Void> stopAll() {
        List<String> toStop = getStartedOrder();
        Collections.reverse(toStop);
        log.info("Stopping {} plugin(s) in order {}", toStop.size(), toStop);
        CompletableFuture<Void> chain = CompletableFuture.completedFuture(null);
        for (String id : toStop) {
            chain = chain.thenCompose(v -> stopQuietly(id));
        }
        return chain;
    }

    /**
     * Stops all plugins, saves their settings, closes and removes them, and releases the
     * manager's own threads. Blocks until done.
     */
    public void shutdown() {
        stopAll().join();
        List<ManagedPlugin> all;
        synchronized (registryLock) {
            all = new ArrayList<>(plugins.values());
        }
        Collections.reverse(all);
        for (ManagedPlugin m : all) {
            release(m);
        }
        if (ownedExecutor != null) {
            ownedExecutor.shutdown();
            try {
                if (!ownedExecutor.awaitTermination(config.getStopTimeoutSeconds(), TimeUnit.SECONDS)) {
                    log.warn("Plugin threads still busy after {}s; interrupting", config.getStopTimeoutSeconds());
                    ownedExecutor.shutdownNow();
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                ownedExecutor.shutdownNow();
            }
        }
        log.info("Plugin manager shut down");
    }

    // ---- single-plugin lifecycle ----

    public CompletableFuture<Void> initializePlugin(String pluginId) {
        ManagedPlugin m = require(pluginId);
        return enqueue(m, () -> m.plugin.initialize(m.context));
    }

    /**
     * Starts one plugin. Fails with {@link DependencyException} when a dependency is not STARTED;
     * the plugin's state is left unchanged in that case.
     */
    public CompletableFuture<Void> startPlugin(String pluginId) {
        ManagedPlugin m = require(pluginId);
        return enqueue(m, () -> {
            Optional<String> blocker = firstUnstartedDependency(m.plugin);
            if (blocker.isPresent()) {
                throw new DependencyException(pluginId, "Plugin " + pluginId + " cannot start: dependency "
                        + blocker.get() + " is not started", List.of(pluginId, blocker.get()));
            }
            return m.plugin.start();
        });
    }

    public CompletableFuture<Void> stopPlugin(String pluginId) {
        ManagedPlugin m = require(pluginId);
        return enqueue(m, m.plugin::stop);
    }

    /**
     * Stops the running plugins that depend on this one (in reverse start order), stops the plugin
     * itself if it is running, then disables it.
     */
    public CompletableFuture<Void> disablePlugin(String pluginId) {
        ManagedPlugin m = require(pluginId);
        return stopDependents(pluginId).thenCompose(x -> enqueue(m, () -> {
            if (m.plugin.getState() != PluginState.STARTED) {
                m.plugin.disable();
                return CompletableFuture.completedFuture(null);
            }
            return m.plugin.stop().handle((v, e) -> {
                if (e != null) {
                    log.warn("Plugin {} failed to stop before disable: {}", pluginId, unwrap(e).getMessage());
                }
                m.plugin.disable();
                return null;
            });
        }));
    }

    /**
     * Re-enables a DISABLED plugin: it returns to NOT_INITIALIZED, is initialized again and is
     * started when all its dependencies are STARTED. A plugin that is not disabled is left alone.
     */
    public CompletableFuture<Void> enablePlugin(String pluginId) {
        ManagedPlugin m = require(pluginId);
        return enqueue(m, () -> {
            if (m.plugin.getState() != PluginState.DISABLED) {
                return CompletableFuture.completedFuture(null);
            }
            m.plugin.enable();
            log.info("Plugin {} enabled", pluginId);
            return m.plugin.initialize(m.context).thenCompose(v -> {
                Optional<String> blocker = firstUnstartedDependency(m.plugin);
                if (blocker.isPresent()) {
                    log.info("Plugin {} enabled but not started: dependency {} is not started", pluginId, blocker.get());
                    return CompletableFuture.completedFuture(null);
                }
                return m.plugin.start();
            });
        });
    }

    public boolean isEnabled(String pluginId) {
        return require(pluginId).plugin.getState() != PluginState.DISABLED;
    }

    /** Stops running dependents, then stops (if running), saves settings, closes and removes one plugin. */
    public CompletableFuture<Void> unload(String pluginId) {
        ManagedPlugin m = require(pluginId);
        return stopDependents(pluginId).thenCompose(x -> enqueue(m, () -> {
            CompletableFuture<Void> stop = m.plugin.getState() == PluginState.STARTED
                    ? m.plugin.stop() : CompletableFuture.completedFuture(null);
            return stop.handle((v, e) -> {
                if (e != null) {
                    log.warn("Plugin {} failed to stop before unload: {}", pluginId, unwrap(e).getMessage());
                }
                release(m);
                return null;
            });
        }));
    }

    /** Stops everything, then unloads every plugin in reverse registration order. */
    public CompletableFuture<Void> unloadAll() {
        return stopAll().thenCompose(v -> {
            List<String> ids;
            synchronized (registryLock) {
                ids = new ArrayList<>(plugins.keySet());
            }
            Collections.reverse(ids);
            CompletableFuture<Void> chain = CompletableFuture.completedFuture(null);
            for (String id : ids) {
                chain = chain.thenCompose(x -> unload(id).exceptionally(e -> {
                    log.error("Plugin {} failed to unload: {}", id, unwrap(e).getMessage(), unwrap(e));
                    return null;
                }));
            }
            return chain;
        });
    }

    // ---- settings ----

    /** Loads stored settings into the plugin; false when there is no store or nothing valid stored. */
    public boolean loadSettings(String pluginId) {
        ManagedPlugin m = require(pluginId);
        if (settingsStore == null) {
            return false;
        }
        try {
            return settingsStore.load(m.plugin);
        } catch (RuntimeException e) {
            log.error("Failed to load settings for plugin {}: {}", pluginId, e.getMessage(), e);
            return false;
        }
    }

    public boolean saveSettings(String pluginId) {
        ManagedPlugin m = require(pluginId);
        return saveSettings(m.plugin);
    }

    // ---- lookup ----

    @Override
    public Optional<Plugin> getPlugin(String pluginId) {
        synchronized (registryLock) {
            ManagedPlugin m = plugins.get(pluginId);
            return m != null ? Optional.of(m.plugin) : Optional.empty();
        }
    }

    @Override
    public List<Plugin> getPlugins() {
        synchronized (registryLock) {
            return plugins.values().stream().map(m -> m.plugin).collect(Collectors.toList());
        }
    }

    @Override
    public List<Plugin> getPlugins(Set<PluginType> types) {
        Objects.requireNonNull(types, "types");
        return getPlugins().stream()
                .filter(p -> p.getDescriptor().getTypes().containsAll(types))
                .collect(Collectors.toList());
    }

    @Override
    public <T> List<T> getExtensions(Class<T> extensionType) {
        Objects.requireNonNull(extensionType, "extensionType");
        List<T> out = new ArrayList<>();
        for (Plugin p : getPlugins()) {
            if (p.getState() == PluginState.STARTED) {
                p.getExtension(extensionType).ifPresent(out::add);
            }
        }
        return out;
    }

    /** Started data providers supporting every capability in {@code required}. */
    public List<DataProviderExtension> findDataProviders(DataProviderCapability... required) {
        List<DataProviderCapability> wanted = Arrays.asList(required);
        return getExtensions(DataProviderExtension.class).stream()
                .filter(p -> p.getCapabilities().containsAll(wanted))
                .collect(Collectors.toList());
    }

    /**
     * Data provider of {@code pluginId}, checked for {@code capability}.
     *
     * @throws PluginExecutionException when the plugin is not a data provider or lacks the capability
     */
    public DataProviderExtension requireCapability(String pluginId, DataProviderCapability capability) {
        Plugin plugin = require(pluginId).plugin;
        DataProviderExtension provider = plugin.getExtension(DataProviderExtension.class)
                .orElseThrow(() -> new PluginExecutionException(pluginId, "Plugin " + pluginId + " is not a data provider"));
        if (!provider.supports(capability)) {
            throw new PluginExecutionException(pluginId, "Plugin " + pluginId + " does not support " + capability);
        }
        return provider;
    }

    /** Ids of STARTED plugins in the order they reached STARTED. */
    public List<String> getStartedOrder() {
        synchronized (startedOrder) {
            return new ArrayList<>(startedOrder);
        }
    }

    // ---- internals ----

    private ManagedPlugin require(String pluginId) {
        synchronized (registryLock) {
            ManagedPlugin m = plugins.get(pluginId);
            if (m == null) {
                throw new IllegalArgumentException("Unknown plugin: " + pluginId);
            }
            return m;
        }
    }

    /** Runs {@code op} after every earlier call queued for the same plugin. */
    private CompletableFuture<Void> enqueue(ManagedPlugin m, Supplier<CompletableFuture<Void>> op) {
        synchronized (m) {
            CompletableFuture<Void> next = m.lane.thenComposeAsync(v -> op.get(), executor);
            m.lane = next.handle((v, e) -> null);
            return next;
        }
    }

    private CompletableFuture<Void> bringUp(String pluginId) {
        ManagedPlugin m;
        synchronized (registryLock) {
            m = plugins.get(pluginId);
        }
        if (m == null) {
            return CompletableFuture.completedFuture(null);
        }
        Plugin plugin = m.plugin;
        return enqueue(m, () -> {
            Optional<String> blocker = firstUnstartedDependency(plugin);
            if (blocker.isPresent()) {
                DependencyException failure = new DependencyException(pluginId, "Plugin " + pluginId
                        + " cannot start: dependency " + blocker.get() + " did not start",
                        List.of(pluginId, blocker.get()));
                if (plugin.getState() == PluginState.STARTED) {
                    return plugin.stop().handle((v, e) -> {
                        if (e != null) {
                            log.warn("Plugin {} failed to stop: {}", pluginId, unwrap(e).getMessage());
                        }
                        failIfActive(plugin, failure);
                        return null;
                    });
                }
                failIfActive(plugin, failure);
                return CompletableFuture.completedFuture(null);
            }
            CompletableFuture<Void> init = plugin.getState() == PluginState.NOT_INITIALIZED
                    ? plugin.initialize(m.context) : CompletableFuture.completedFuture(null);
            return init.thenCompose(v -> plugin.getState().canStart()
                    ? plugin.start() : CompletableFuture.completedFuture(null));
        }).handle((v, e) -> {
            if (e != null) {
                log.warn("Plugin {} did not start: {}", pluginId, unwrap(e).getMessage());
            }
            return null;
        });
    }

    private CompletableFuture<Void> stopQuietly(String pluginId) {
        ManagedPlugin m;
        synchronized (registryLock) {
            m = plugins.get(pluginId);
        }
        if (m == null) {
            return CompletableFuture.completedFuture(null);
        }
        CompletableFuture<Void> stopping = enqueue(m, () -> m.plugin.getState() == PluginState.STARTED
                ? m.plugin.stop() : CompletableFuture.completedFuture(null));
        // the lane stays held until the stop really finishes; only the caller stops waiting
        return stopping.copy()
                .orTimeout(config.getStopTimeoutSeconds(), TimeUnit.SECONDS)
                .handle((v, e) -> {
                    if (e == null) {
                        return null;
                    }
                    Throwable cause = unwrap(e);
                    if (cause instanceof TimeoutException) {
                        log.error("Plugin {} did not stop within {}s", pluginId, config.getStopTimeoutSeconds());
                        if (m.plugin.getState() != PluginState.DISABLED) {
                            m.plugin.markFailed(new PluginExecutionException(pluginId, "Stop timed out"));
                        }
                    } else {
                        log.error("Plugin {} failed to stop: {}", pluginId, cause.getMessage(), cause);
                    }
                    return null;
                });
    }

    private void release(ManagedPlugin m) {
        String id = m.plugin.getId();
        saveSettings(m.plugin);
        try {
            m.plugin.close();
        } catch (RuntimeException e) {
            log.error("Plugin {} failed to close: {}", id, e.getMessage(), e);
        }
        boolean removed;
        synchronized (registryLock) {
            removed = plugins.remove(id, m);
        }
        synchronized (startedOrder) {
            startedOrder.remove(id);
        }
        if (removed) {
            log.info("Unloaded plugin {}", id);
            eventBus.publish(PluginLifecycleEvent.unloaded(id));
        }
    }

    private boolean saveSettings(Plugin plugin) {
        if (settingsStore == null) {
            return false;
        }
        try {
            return settingsStore.save(plugin);
        } catch (RuntimeException e) {
            log.error("Failed to save settings for plugin {}: {}", plugin.getId(), e.getMessage(), e);
            return false;
        }
    }

    /** Stops failed plugins that are still running (dependents first), then moves them to ERROR. */
    private CompletableFuture<Void> markDependencyFailures(DependencyResolution resolution) {
        Map<String, DependencyException> failures = resolution.getFailures();
        List<String> running = getStartedOrder();
        Collections.reverse(running);
        running.retainAll(failures.keySet());
        CompletableFuture<Void> chain = CompletableFuture.completedFuture(null);
        for (String id : running) {
            log.warn("Stopping plugin {}: its dependencies can no longer be satisfied", id);
            chain = chain.thenCompose(v -> stopQuietly(id));
        }
        return chain.thenRun(() -> failures.forEach((id, failure) -> {
            Optional<Plugin> plugin = getPlugin(id);
            if (plugin.isPresent() && !plugin.get().getState().isTerminal()) {
                log.error("Plugin {} failed dependency resolution: {}", id, failure.getMessage());
                failIfActive(plugin.get(), failure);
            }
        }));
    }

    /** Stops the STARTED plugins that transitively depend on {@code pluginId}, last started first. */
    private CompletableFuture<Void> stopDependents(String pluginId) {
        Set<String> dependents = dependentsOf(pluginId);
        List<String> running = getStartedOrder();
        Collections.reverse(running);
        running.retainAll(dependents);
        if (!running.isEmpty()) {
            log.info("Stopping dependents of {}: {}", pluginId, running);
        }
        CompletableFuture<Void> chain = CompletableFuture.completedFuture(null);
        for (String id : running) {
            chain = chain.thenCompose(v -> stopQuietly(id));
        }
        return chain;
    }

    private Set<String> dependentsOf(String pluginId) {
        List<Plugin> all = getPlugins();
        Set<String> found = new HashSet<>();
        Deque<String> pending = new ArrayDeque<>();
        pending.push(pluginId);
        while (!pending.isEmpty()) {
            String target = pending.pop();
            for (Plugin p : all) {
                if (p.getDescriptor().getDependencies().contains(target) && found.add(p.getId())) {
                    pending.push(p.getId());
                }
            }
        }
        return found;
    }

    private static void failIfActive(Plugin plugin, Throwable failure) {
        if (!plugin.getState().isTerminal()) {
            plugin.markFailed(failure);
        }
    }

    private List<String> dependenciesOf(String pluginId) {
        return getPlugin(pluginId).map(p -> p.getDescriptor().getDependencies()).orElse(List.of());
    }

    private Optional<String> firstUnstartedDependency(Plugin plugin) {
        for (String dep : plugin.getDescriptor().getDependencies()) {
            Optional<Plugin> target = getPlugin(dep);
            if (target.isEmpty() || target.get().getState() != PluginState.STARTED) {
                return Optional.of(dep);
            }
        }
        return Optional.empty();
    }

    private StartupReport buildStartupReport() {
        Map<String, PluginState> notStarted = new LinkedHashMap<>();
        for (Plugin p : getPlugins()) {
            if (p.getState() != PluginState.STARTED) {
                notStarted.put(p.getId(), p.getState());
            }
        }
        StartupReport report = new StartupReport(getStartedOrder(), notStarted);
        log.info("Plugin startup finished: {}", report);
        return report;
    }

    private void onStateChanged(Plugin plugin, PluginState oldState, PluginState newState) {
        String id = plugin.getId();
        boolean managed = getPlugin(id).filter(p -> p == plugin).isPresent();
        if (managed) {
            synchronized (startedOrder) {
                if (newState == PluginState.STARTED) {
                    startedOrder.remove(id);
                    startedOrder.add(id);
                } else if (oldState == PluginState.STARTED) {
                    startedOrder.remove(id);
                }
            }
        }
        eventBus.publish(PluginLifecycleEvent.stateChanged(id, oldState, newState));
        if (newState == PluginState.ERROR) {
            Throwable error = plugin.getLastError();
            log.error("Plugin {} entered ERROR from {}: {}", id, oldState, error != null ? error.getMessage() : "unknown");
            eventBus.publish(PluginLifecycleEvent.error(id, error, PluginLifecycleEvent.Severity.ERROR));
        }
    }

    static Throwable unwrap(Throwable t) {
        while ((t instanceof CompletionException || t instanceof ExecutionException) && t.getCause() != null) {
            t = t.getCause();
        }
        return t;
    }

    private static ExecutorService newDefaultExecutor() {
        AtomicInteger counter = new AtomicInteger();
        return Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "geo-plugin-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    public static final class Builder {
        private final EngineConfig config;
        private EventBus eventBus;
        private LayerCollection layers;
        private MapCanvas mapCanvas;
        private PluginSettingsStore settingsStore;
        private Executor executor;

        private Builder(EngineConfig config) {
            this.config = Objects.requireNonNull(config, "config");
        }

        public Builder eventBus(EventBus eventBus) {
            this.eventBus = eventBus;
            return this;
        }

        public Builder layers(LayerCollection layers) {
            this.layers = layers;
            return this;
        }

        public Builder mapCanvas(MapCanvas mapCanvas) {
            this.mapCanvas = mapCanvas;
            return this;
        }

        /** Overrides the store derived from {@link EngineConfig#getPluginSettingsDir()}. */
        public Builder settingsStore(PluginSettingsStore settingsStore) {
            this.settingsStore = settingsStore;
            return this;
        }

        /** Executor for lifecycle work; when unset the manager owns a daemon pool. */
        public Builder executor(Executor executor) {
            this.executor = executor;
            return this;
        }

        public PluginManager build() {
            return new PluginManager(this);
        }
    }
}
