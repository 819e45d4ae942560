/**
 * Spring configuration: thread pools, provider wiring and externalized properties.
 *
 * <ul>
 *   <li>{@link com.phillippitts.aibakeoff.config.ThreadPoolConfig} - benchmark and scenario
 *       executors, realtime deadline scheduler</li>
 *   <li>{@link com.phillippitts.aibakeoff.config.ProviderConfig} - HTTP and WebSocket
 *       transports plus the four provider beans</li>
 * </ul>
 *
 * <p>Sub-package {@code config.properties} holds the {@code @ConfigurationProperties} classes.
 */
package com.phillippitts.aibakeoff.config;
