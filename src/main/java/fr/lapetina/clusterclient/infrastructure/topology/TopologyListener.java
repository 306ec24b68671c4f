package fr.lapetina.clusterclient.infrastructure.topology;

import fr.lapetina.clusterclient.domain.model.TopologySnapshot;

/**
 * Listener for published topology revisions.
 */
@FunctionalInterface
public interface TopologyListener {

    /**
     * Called after a newer snapshot was published.
     *
     * @param previous the replaced snapshot, null for the first one
     * @param current  the published snapshot
     */
    void onTopologyChanged(TopologySnapshot previous, TopologySnapshot current);
}
