package fr.lapetina.clusterclient.infrastructure.topology;

import fr.lapetina.clusterclient.domain.exception.OperationException;
import fr.lapetina.clusterclient.domain.model.ErrorType;
import fr.lapetina.clusterclient.domain.model.ServiceType;
import fr.lapetina.clusterclient.domain.model.TopologySnapshot;
import fr.lapetina.clusterclient.infrastructure.auth.Authenticator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * Fetches the bucket configuration from the management REST endpoint,
 * {@code GET /pools/default/b/<bucket>}.
 */
public final class HttpConfigProvider implements TopologyProvider {

    private static final Logger log = LoggerFactory.getLogger(HttpConfigProvider.class);

    private final HttpClient httpClient;
    private final Authenticator authenticator;
    private final String bucket;
    private final List<SeedNode> seeds;
    private final Duration requestTimeout;
    private final ClusterConfigParser parser;

    public HttpConfigProvider(
            Authenticator authenticator,
            String bucket,
            List<SeedNode> seeds,
            Duration connectTimeout,
            Duration requestTimeout,
            ClusterConfigParser parser
    ) {
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(connectTimeout)
                .version(HttpClient.Version.HTTP_1_1)
                .build();
        this.authenticator = authenticator;
        this.bucket = bucket;
        this.seeds = List.copyOf(seeds);
        this.requestTimeout = requestTimeout;
        this.parser = parser;
    }

    @Override
    public String getName() {
        return "http";
    }

    @Override
    public CompletableFuture<TopologySnapshot> fetch(TopologySnapshot current) {
        List<SeedNode> targets = targets(current);
        if (targets.isEmpty()) {
            return CompletableFuture.failedFuture(new OperationException(ErrorType.TOPOLOGY_UNAVAILABLE,
                    "No management node to fetch the cluster configuration from"));
        }
        return fetchFrom(targets, 0, null);
    }

    private List<SeedNode> targets(TopologySnapshot current) {
        if (current == null || !current.hasService(ServiceType.MANAGEMENT)) {
            return seeds;
        }
        return current.nodesFor(ServiceType.MANAGEMENT).stream()
                .map(node -> new SeedNode(node.getHostname(), node.getPort(ServiceType.MANAGEMENT)))
                .toList();
    }

    private CompletableFuture<TopologySnapshot> fetchFrom(List<SeedNode> targets, int index, Throwable lastError) {
        if (index >= targets.size()) {
            return CompletableFuture.failedFuture(new OperationException(ErrorType.TOPOLOGY_UNAVAILABLE,
                    "No management node served a cluster configuration: tried=" + targets.size()
                            + (lastError != null ? ", lastError=" + lastError.getMessage() : ""), lastError));
        }
        SeedNode target = targets.get(index);
        return fetchOne(target)
                .handle((snapshot, error) -> {
                    if (error == null) {
                        return CompletableFuture.completedFuture(snapshot);
                    }
                    Throwable cause = error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
                    log.debug("Config fetch failed, trying next node: endpoint={}, error={}", target, cause.getMessage());
                    return fetchFrom(targets, index + 1, cause);
                })
                .thenCompose(next -> next);
    }

    private CompletableFuture<TopologySnapshot> fetchOne(SeedNode target) {
        String endpoint = target.toString();
        URI uri = URI.create("http://" + endpoint + "/pools/default/b/" + URLEncoder.encode(bucket, StandardCharsets.UTF_8));
        HttpRequest request = HttpRequest.newBuilder()
                .uri(uri)
                .timeout(requestTimeout)
                .header("Authorization", authenticator.credentials(ServiceType.MANAGEMENT, endpoint).basicAuthHeader())
                .GET()
                .build();

        return httpClient.sendAsync(request, HttpResponse.BodyHandlers.ofByteArray())
                .thenApply(response -> {
                    if (response.statusCode() != 200) {
                        throw new OperationException(ErrorType.TOPOLOGY_UNAVAILABLE, null, response.statusCode(),
                                "HTTP " + response.statusCode() + " fetching configuration from " + uri, null);
                    }
                    return parser.parse(response.body(), target.hostname());
                });
    }
}
