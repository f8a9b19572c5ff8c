/**
 * Host contract for geo-engine plugins.
 * <ul>
 *   <li>{@link com.geoengine.plugin.Plugin} / {@link com.geoengine.plugin.AbstractPlugin} – lifecycle state machine</li>
 *   <li>{@link com.geoengine.plugin.PluginDescriptor} – id, version, types, minimum engine version, dependencies</li>
 *   <li>{@link com.geoengine.plugin.PluginContext} – layers, map canvas, event bus, logger, data directory</li>
 *   <li>{@link com.geoengine.plugin.PluginSettings} – serializable, validated settings</li>
 *   <li>{@link com.geoengine.plugin.PluginProvider} – SPI used to discover plugins in JARs</li>
 * </ul>
 * Capability interfaces live in {@code .tool}, {@code .analysis} and {@code .provider}; events in {@code .event}.
 */
package com.geoengine.plugin;
