/**
 * Cluster Client Core - asynchronous operation dispatch for a clustered document database.
 *
 * <p>This library accepts key/value and query operations, routes each attempt to a node of the
 * current cluster topology, and settles every operation exactly once: with a result, a terminal
 * error, a timeout or a cancellation. Attempts run through an LMAX Disruptor ring.
 *
 * <h2>Key Components</h2>
 * <ul>
 *   <li>{@link fr.lapetina.clusterclient.ClusterClientFactory} - Main entry point for creating
 *       a fully-configured client from YAML configuration</li>
 *   <li>{@link fr.lapetina.clusterclient.disruptor.OperationPipeline} - Submission and attempt pipeline</li>
 * </ul>
 *
 * <h2>Quick Start</h2>
 * <pre>{@code
 * try (ClusterClientFactory factory = ClusterClientFactory.create("client-config.yaml").start()) {
 *     OperationPipeline pipeline = factory.getPipeline();
 *
 *     OperationRequest request = OperationRequest.kv(KvCommand.of(BinaryOpcodes.GET, "user::42"), Duration.ofMillis(2500));
 *     OperationHandle handle = pipeline.submit(request);
 *
 *     OperationResult result = handle.result().get();
 *     System.out.println(result.bodyAsString());
 * }
 * }</pre>
 *
 * <h2>Features</h2>
 * <ul>
 *   <li>Deadlines and cancellation with exactly-once settlement</li>
 *   <li>Retry orchestration bounded by the deadline</li>
 *   <li>Per node and service circuit breakers</li>
 *   <li>Topology polling over the binary protocol with HTTP fallback</li>
 *   <li>Streaming row decoding for query services</li>
 *   <li>Micrometer metrics with Prometheus export</li>
 * </ul>
 *
 * @see fr.lapetina.clusterclient.ClusterClientFactory
 * @see fr.lapetina.clusterclient.disruptor.OperationPipeline
 */
package fr.lapetina.clusterclient;
