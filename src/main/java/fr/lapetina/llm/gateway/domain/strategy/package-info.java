/**
 * Ranking strategies applied by the router after filtering.
 *
 * <table border="1">
 *   <tr><th>Strategy</th><th>Ranks by</th></tr>
 *   <tr><td>{@code cost-optimized}</td><td>Estimated cost, provisioned throughput counted as free</td></tr>
 *   <tr><td>{@code latency-optimized}</td><td>Declared p50 latency</td></tr>
 *   <tr><td>{@code quality-optimized}</td><td>Score on the preferred quality dimension, descending</td></tr>
 *   <tr><td>{@code provider-pinned}</td><td>Preferred providers first, then cost</td></tr>
 *   <tr><td>{@code capability-first}</td><td>Default; ranked like cost</td></tr>
 * </table>
 *
 * <p>Every strategy breaks ties on backend id, so ranking is deterministic.
 *
 * @see fr.lapetina.llm.gateway.domain.strategy.StrategyFactory
 */
package fr.lapetina.llm.gateway.domain.strategy;
