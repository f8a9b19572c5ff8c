package com.geoengine.runtime;

import com.geoengine.plugin.Plugin;
import com.geoengine.plugin.PluginProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.MalformedURLException;
import java.net.URL;
import java.net.URLClassLoader;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.ServiceConfigurationError;
import java.util.ServiceLoader;

/**
 * Creates plugins from {@link PluginProvider}s: explicitly registered internal providers, the
 * classpath, or community JARs in a single configured directory.
 * <p>
 * <b>Operational:</b> a community JAR or provider that fails to load (classloader error, provider
 * constructor failure, plugin factory failure) is <b>logged and skipped</b>; loading continues.
 */
public final class PluginLoader {

    private static final Logger log = LoggerFactory.getLogger(PluginLoader.class);

    // held for the lifetime of the plugins they loaded
    private final List<URLClassLoader> communityLoaders = new ArrayList<>();

    /**
     * Instantiates plugins from enabled providers. A provider whose {@code createPlugin} throws,
     * or whose plugin id does not match its declared id, is logged and skipped.
     */
    public List<Plugin> createPlugins(Iterable<? extends PluginProvider> providers) {
        List<Plugin> plugins = new ArrayList<>();
        for (PluginProvider provider : providers) {
            createPlugin(provider, provider.getClass().getName()).ifPresent(plugins::add);
        }
        return plugins;
    }

    /** Plugins from providers visible on the current classpath. */
    public List<Plugin> loadFromClasspath() {
        return loadWith(ServiceLoader.load(PluginProvider.class), "classpath");
    }

    /**
     * Loads plugins from {@code *.jar} files in {@code pluginsDir}. Only that directory is scanned.
     * Each JAR gets its own classloader whose parent is a {@link RestrictedPluginClassLoader}.
     */
    public List<Plugin> loadFromDirectory(Path pluginsDir) {
        List<Plugin> plugins = new ArrayList<>();
        if (pluginsDir == null) {
            return plugins;
        }
        if (!Files.exists(pluginsDir)) {
            log.debug("Community plugins directory does not exist: {}", pluginsDir);
            return plugins;
        }
        if (!Files.isDirectory(pluginsDir)) {
            log.warn("Community plugins path is not a directory: {}", pluginsDir);
            return plugins;
        }
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(pluginsDir, "*.jar")) {
            for (Path jar : stream) {
                plugins.addAll(loadJar(jar));
            }
        } catch (IOException e) {
            log.warn("Failed to list community plugins directory {}: {}", pluginsDir, e.getMessage());
        }
        return plugins;
    }

    private List<Plugin> loadJar(Path jar) {
        URLClassLoader loader;
        try {
            loader = new URLClassLoader(new URL[]{jar.toUri().toURL()}, new RestrictedPluginClassLoader());
        } catch (MalformedURLException e) {
            log.error("Failed to load community plugin JAR {} (skipping): {}", jar, e.getMessage(), e);
            return List.of();
        }
        List<Plugin> plugins;
        try {
            plugins = loadWith(ServiceLoader.load(PluginProvider.class, loader), jar.getFileName().toString());
        } catch (RuntimeException e) {
            log.error("Failed to load community plugin JAR {} (skipping): {}", jar, e.getMessage(), e);
            plugins = List.of();
        }
        if (plugins.isEmpty()) {
            close(loader, jar);
            return plugins;
        }
        communityLoaders.add(loader);
        log.info("Loaded {} plugin(s) from community JAR: {}", plugins.size(), jar.getFileName());
        return plugins;
    }

    private static void close(URLClassLoader loader, Path jar) {
        try {
            loader.close();
        } catch (IOException e) {
            log.warn("Failed to close classloader of {}: {}", jar, e.getMessage());
        }
    }

    /** Classloaders kept open for JARs that contributed plugins. */
    int openLoaderCount() {
        return communityLoaders.size();
    }

    private List<Plugin> loadWith(ServiceLoader<PluginProvider> serviceLoader, String source) {
        List<Plugin> plugins = new ArrayList<>();
        List<ServiceLoader.Provider<PluginProvider>> handles;
        try {
            handles = serviceLoader.stream().toList();
        } catch (ServiceConfigurationError e) {
            log.error("Plugin providers from {} could not be listed (skipping): {}", source, e.getMessage(), e);
            return plugins;
        }
        for (ServiceLoader.Provider<PluginProvider> handle : handles) {
            PluginProvider provider;
            try {
                provider = handle.get();
            } catch (RuntimeException | ServiceConfigurationError e) {
                log.error("Plugin provider {} from {} failed to instantiate (skipping): {}",
                        handle.type().getName(), source, e.getMessage(), e);
                continue;
            }
            createPlugin(provider, source).ifPresent(plugins::add);
        }
        return plugins;
    }

    private Optional<Plugin> createPlugin(PluginProvider provider, String source) {
        String declaredId;
        try {
            declaredId = provider.getPluginId();
            if (!provider.isEnabled()) {
                log.info("Plugin provider {} from {} is disabled (skipping)", declaredId, source);
                return Optional.empty();
            }
            Plugin plugin = provider.createPlugin();
            if (plugin == null) {
                log.error("Plugin provider {} from {} returned no plugin (skipping)", declaredId, source);
                return Optional.empty();
            }
            if (!plugin.getId().equals(declaredId)) {
                log.error("Plugin provider {} from {} created plugin with id {} (skipping)", declaredId, source, plugin.getId());
                return Optional.empty();
            }
            return Optional.of(plugin);
        } catch (RuntimeException e) {
            log.error("Plugin provider {} from {} failed to create its plugin (skipping): {}",
                    provider.getClass().getName(), source, e.getMessage(), e);
            return Optional.empty();
        }
    }
}
