package fr.lapetina.clusterclient.infrastructure.topology;

import fr.lapetina.clusterclient.domain.exception.OperationException;
import fr.lapetina.clusterclient.domain.model.ErrorType;
import fr.lapetina.clusterclient.domain.model.ServiceType;
import fr.lapetina.clusterclient.domain.model.TopologySnapshot;
import fr.lapetina.clusterclient.infrastructure.transport.binary.BinaryConnectionPool;
import fr.lapetina.clusterclient.infrastructure.transport.binary.BinaryFrame;
import fr.lapetina.clusterclient.infrastructure.transport.binary.BinaryOpcodes;
import fr.lapetina.clusterclient.infrastructure.transport.binary.BinaryStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * Fetches the cluster configuration with the GET_CLUSTER_CONFIG binary command,
 * over the same pooled connections the key/value operations use.
 *
 * Nodes are tried in order until one answers. A node answering UNKNOWN_COMMAND
 * or NOT_SUPPORTED ends the fetch with {@link UnsupportedConfigProtocolException}.
 */
public final class BinaryConfigProvider implements TopologyProvider {

    private static final Logger log = LoggerFactory.getLogger(BinaryConfigProvider.class);

    private final BinaryConnectionPool pool;
    private final List<SeedNode> seeds;
    private final ClusterConfigParser parser;

    public BinaryConfigProvider(BinaryConnectionPool pool, List<SeedNode> seeds, ClusterConfigParser parser) {
        this.pool = pool;
        this.seeds = List.copyOf(seeds);
        this.parser = parser;
    }

    @Override
    public String getName() {
        return "cccp";
    }

    @Override
    public CompletableFuture<TopologySnapshot> fetch(TopologySnapshot current) {
        List<SeedNode> targets = targets(current);
        if (targets.isEmpty()) {
            return CompletableFuture.failedFuture(new OperationException(ErrorType.TOPOLOGY_UNAVAILABLE,
                    "No key/value node to fetch the cluster configuration from"));
        }
        return fetchFrom(targets, 0, null);
    }

    private List<SeedNode> targets(TopologySnapshot current) {
        if (current == null || !current.hasService(ServiceType.KEY_VALUE)) {
            return seeds;
        }
        return current.nodesFor(ServiceType.KEY_VALUE).stream()
                .map(node -> new SeedNode(node.getHostname(), node.getPort(ServiceType.KEY_VALUE)))
                .toList();
    }

    private CompletableFuture<TopologySnapshot> fetchFrom(List<SeedNode> targets, int index, Throwable lastError) {
        if (index >= targets.size()) {
            return CompletableFuture.failedFuture(new OperationException(ErrorType.TOPOLOGY_UNAVAILABLE,
                    "No node served a cluster configuration: tried=" + targets.size()
                            + (lastError != null ? ", lastError=" + lastError.getMessage() : ""), lastError));
        }
        SeedNode target = targets.get(index);
        return fetchOne(target)
                .handle((snapshot, error) -> {
                    if (error == null) {
                        return CompletableFuture.completedFuture(snapshot);
                    }
                    Throwable cause = unwrap(error);
                    if (cause instanceof UnsupportedConfigProtocolException) {
                        return CompletableFuture.<TopologySnapshot>failedFuture(cause);
                    }
                    log.debug("Config fetch failed, trying next node: endpoint={}, error={}", target, cause.getMessage());
                    return fetchFrom(targets, index + 1, cause);
                })
                .thenCompose(next -> next);
    }

    private CompletableFuture<TopologySnapshot> fetchOne(SeedNode target) {
        String endpoint = target.toString();
        return pool.acquire(target.hostname(), target.port())
                .thenCompose(connection -> connection.send(
                        BinaryFrame.request(BinaryOpcodes.GET_CLUSTER_CONFIG, new byte[0], null)))
                .thenApply(response -> {
                    if (BinaryStatus.isUnsupported(response.status())) {
                        throw new UnsupportedConfigProtocolException(endpoint, response.status());
                    }
                    if (!BinaryStatus.isSuccess(response.status())) {
                        throw BinaryStatus.toException(response.status(), endpoint, "GET_CLUSTER_CONFIG");
                    }
                    return parser.parse(response.value(), target.hostname());
                });
    }

    private static Throwable unwrap(Throwable error) {
        return error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
    }
}
