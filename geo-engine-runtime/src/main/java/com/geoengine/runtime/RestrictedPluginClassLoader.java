package com.geoengine.runtime;

import com.geoengine.plugin.PluginProvider;

/**
 * Parent classloader for community plugin JARs. Exposes only the plugin API, the data model and
 * the libraries they use; every other class (runtime, bootstrap, configuration) resolves to
 * {@link ClassNotFoundException}, including through reflection.
 * <p>
 * <b>Allowed:</b> {@code java.*}, {@code javax.*}, {@code com.geoengine.plugin.*},
 * {@code com.geoengine.data.*}, {@code com.geoengine.geometry.*}, {@code org.slf4j.*},
 * {@code com.fasterxml.jackson.*}, {@code org.locationtech.jts.*}
 */
public final class RestrictedPluginClassLoader extends ClassLoader {

    private static final String[] ALLOWED_PREFIXES = {
            "java.",
            "javax.",
            "com.geoengine.plugin.",
            "com.geoengine.data.",
            "com.geoengine.geometry.",
            "org.slf4j.",
            "com.fasterxml.jackson.",
            "org.locationtech.jts."
    };

    private final ClassLoader apiLoader;

    /** Delegates allowed packages to the loader that loaded {@link PluginProvider}. */
    public RestrictedPluginClassLoader() {
        this(PluginProvider.class.getClassLoader());
    }

    RestrictedPluginClassLoader(ClassLoader apiLoader) {
        super(null);
        this.apiLoader = apiLoader;
    }

    @Override
    protected Class<?> loadClass(String name, boolean resolve) throws ClassNotFoundException {
        synchronized (getClassLoadingLock(name)) {
            Class<?> c = findLoadedClass(name);
            if (c != null) {
                if (resolve) resolveClass(c);
                return c;
            }
            if (isAllowed(name)) {
                c = apiLoader.loadClass(name);
                if (resolve) resolveClass(c);
                return c;
            }
            throw new ClassNotFoundException("Access denied: " + name
                    + " (community plugins may only use the plugin API, data model, slf4j, Jackson and JTS)");
        }
    }

    static boolean isAllowed(String name) {
        for (String prefix : ALLOWED_PREFIXES) {
            if (name.startsWith(prefix)) {
                return true;
            }
        }
        return false;
    }
}
