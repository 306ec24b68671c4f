/**
 * LMAX Disruptor-based pipeline for dispatching operation attempts.
 *
 * <p>Each event on the ring is one attempt of one operation. Retries are published back onto
 * the same ring, so an operation may cross it many times before it settles.
 *
 * <h2>Pipeline Stages</h2>
 * <pre>
 * Routing → Dispatch → Metrics → Completion
 * </pre>
 *
 * <h2>Key Classes</h2>
 * <ul>
 *   <li>{@link fr.lapetina.clusterclient.disruptor.OperationPipeline} - Submission and ring lifecycle</li>
 *   <li>{@link fr.lapetina.clusterclient.disruptor.RetryCoordinator} - Acts on retry decisions</li>
 *   <li>{@link fr.lapetina.clusterclient.disruptor.exception.BackpressureException} - Thrown when ring buffer is full</li>
 * </ul>
 *
 * @see com.lmax.disruptor.dsl.Disruptor
 */
package fr.lapetina.clusterclient.disruptor;
