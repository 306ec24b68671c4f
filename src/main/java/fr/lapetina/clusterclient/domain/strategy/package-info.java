/**
 * Node selection strategies for spreading attempts across the nodes of a service.
 *
 * <h2>Available Strategies</h2>
 * <table border="1">
 *   <tr><th>Strategy</th><th>Description</th></tr>
 *   <tr><td>{@code round-robin}</td><td>Cycles through admitted nodes in order</td></tr>
 *   <tr><td>{@code random}</td><td>Random admitted node</td></tr>
 * </table>
 *
 * <p>Implement {@link fr.lapetina.clusterclient.domain.strategy.NodeSelectionStrategy} and register
 * with {@link fr.lapetina.clusterclient.domain.strategy.StrategyFactory} for custom selection.
 */
package fr.lapetina.clusterclient.domain.strategy;
