package fr.lapetina.clusterclient.infrastructure.topology;

import fr.lapetina.clusterclient.domain.model.TopologySnapshot;

import java.util.concurrent.CompletableFuture;

/**
 * Source of cluster configurations.
 */
public interface TopologyProvider {

    String getName();

    /**
     * Fetches the configuration from the nodes of {@code current}, or from the
     * seed nodes while no topology is known.
     *
     * @param current latest published snapshot, null before the first one
     * @return the fetched snapshot; fails with {@link UnsupportedConfigProtocolException}
     *         when the cluster does not serve configurations through this provider
     */
    CompletableFuture<TopologySnapshot> fetch(TopologySnapshot current);
}
