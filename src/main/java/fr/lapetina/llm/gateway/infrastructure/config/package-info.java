/**
 * Configuration loading and hot-reload support.
 *
 * <h2>Key Classes</h2>
 * <ul>
 *   <li>{@link fr.lapetina.llm.gateway.infrastructure.config.GatewayConfig} - Configuration model</li>
 *   <li>{@link fr.lapetina.llm.gateway.infrastructure.config.ConfigLoader} - YAML loading and file watching</li>
 *   <li>{@link fr.lapetina.llm.gateway.infrastructure.config.ConfigChangeListener} - Callback for configuration changes</li>
 * </ul>
 *
 * <h2>Configuration Sections</h2>
 * <ul>
 *   <li>{@code circuitBreaker} - Failure threshold, recovery timeout, half-open trials</li>
 *   <li>{@code rateLimit} - Default per-caller limits</li>
 *   <li>{@code cache} - Store selection, TTL, similarity matching, Redis connection</li>
 *   <li>{@code queue} - Admission queue capacity and workers</li>
 *   <li>{@code routing} - Default strategy and fallback count</li>
 *   <li>{@code timeouts} - Attempt and connection timeouts</li>
 *   <li>{@code healthCheck} - Provider probing</li>
 *   <li>{@code usage} - Usage ring buffer</li>
 *   <li>{@code metrics} - Prometheus metrics</li>
 * </ul>
 *
 * <p>Only the default routing strategy and the cache switch apply on reload; the other
 * sections are read once at startup.
 */
package fr.lapetina.llm.gateway.infrastructure.config;
