package fr.lapetina.clusterclient.domain.model;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Immutable view of the cluster at one configuration revision.
 * Published wholesale; never mutated after construction.
 *
 * @param source host the configuration was fetched from
 */
public record TopologySnapshot(
        long revision,
        List<ClusterNode> nodes,
        Instant fetchedAt,
        String source
) {
    public TopologySnapshot {
        nodes = nodes != null ? List.copyOf(nodes) : List.of();
        if (fetchedAt == null) {
            fetchedAt = Instant.now();
        }
    }

    /**
     * Nodes advertising the given service, in configuration order.
     */
    public List<ClusterNode> nodesFor(ServiceType service) {
        return nodes.stream()
                .filter(n -> n.hasService(service))
                .toList();
    }

    public boolean hasService(ServiceType service) {
        return nodes.stream().anyMatch(n -> n.hasService(service));
    }

    public Optional<ClusterNode> findNode(String nodeId) {
        if (nodeId == null) {
            return Optional.empty();
        }
        return nodes.stream()
                .filter(n -> n.getId().equals(nodeId))
                .findFirst();
    }

    public Set<String> nodeIds() {
        return nodes.stream()
                .map(ClusterNode::getId)
                .collect(Collectors.toUnmodifiableSet());
    }

    public boolean isNewerThan(TopologySnapshot other) {
        return other == null || revision > other.revision;
    }
}
