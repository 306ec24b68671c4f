/**
 * Configuration loading.
 *
 * <h2>Configuration Sections</h2>
 * <ul>
 *   <li>{@code bucket}, {@code credentials} - Target bucket and its credentials</li>
 *   <li>{@code bootstrap} - Seed nodes and bootstrap mode (cccp, http, both)</li>
 *   <li>{@code timeouts} - Connect and default operation timeouts</li>
 *   <li>{@code retry} - Default retry strategy and backoff</li>
 *   <li>{@code circuitBreaker} - Breaker policy and thresholds</li>
 *   <li>{@code topology} - Polling period and refresh debounce</li>
 *   <li>{@code pool} - Binary connections per node, in-flight cap, row buffer</li>
 *   <li>{@code disruptor} - Ring buffer and wait strategy settings</li>
 *   <li>{@code strategy} - Node selection strategy</li>
 *   <li>{@code metrics} - Prometheus metrics configuration</li>
 * </ul>
 *
 * @see fr.lapetina.clusterclient.infrastructure.config.ClientConfig
 * @see fr.lapetina.clusterclient.infrastructure.config.ConfigLoader
 */
package fr.lapetina.clusterclient.infrastructure.config;
