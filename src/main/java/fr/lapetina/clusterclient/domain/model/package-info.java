/**
 * Domain model: requests, results, payloads and the cluster topology.
 *
 * <p>All classes in this package are immutable. A {@code TopologySnapshot} is never
 * modified; a newer revision replaces it wholesale.
 *
 * @see fr.lapetina.clusterclient.domain.model.OperationRequest
 * @see fr.lapetina.clusterclient.domain.model.TopologySnapshot
 */
package fr.lapetina.clusterclient.domain.model;
