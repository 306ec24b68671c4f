package fr.lapetina.clusterclient.infrastructure.topology;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import fr.lapetina.clusterclient.domain.exception.OperationException;
import fr.lapetina.clusterclient.domain.model.ClusterNode;
import fr.lapetina.clusterclient.domain.model.ErrorType;
import fr.lapetina.clusterclient.domain.model.ServiceType;
import fr.lapetina.clusterclient.domain.model.TopologySnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Parses the cluster configuration document served by the nodes.
 *
 * <pre>{@code
 * {"rev": 42,
 *  "nodesExt": [{"hostname": "10.0.0.1", "services": {"kv": 11210, "mgmt": 8091, "n1ql": 8093}}]}
 * }</pre>
 *
 * A missing hostname, or the {@code $HOST} placeholder, means the host the
 * document was fetched from. Unknown service keys are ignored.
 */
public final class ClusterConfigParser {

    private static final Logger log = LoggerFactory.getLogger(ClusterConfigParser.class);

    static final String HOST_PLACEHOLDER = "$HOST";

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final Clock clock;

    public ClusterConfigParser(Clock clock) {
        this.clock = clock;
    }

    public ClusterConfigParser() {
        this(Clock.systemUTC());
    }

    /**
     * @throws OperationException PROTOCOL_FAILURE if the document is not a valid configuration
     */
    public TopologySnapshot parse(byte[] json, String sourceHost) {
        JsonNode root;
        try {
            root = objectMapper.readTree(json);
        } catch (IOException e) {
            throw new OperationException(ErrorType.PROTOCOL_FAILURE,
                    "Unparseable cluster configuration from " + sourceHost + ": " + e.getMessage(), e);
        }
        if (root == null || !root.isObject()) {
            throw new OperationException(ErrorType.PROTOCOL_FAILURE,
                    "Cluster configuration from " + sourceHost + " is not a JSON object");
        }

        JsonNode rev = root.get("rev");
        if (rev == null || !rev.canConvertToLong()) {
            throw new OperationException(ErrorType.PROTOCOL_FAILURE,
                    "Cluster configuration from " + sourceHost + " has no revision");
        }

        JsonNode nodesExt = root.get("nodesExt");
        if (nodesExt == null || !nodesExt.isArray()) {
            throw new OperationException(ErrorType.PROTOCOL_FAILURE,
                    "Cluster configuration from " + sourceHost + " has no nodesExt array");
        }

        List<ClusterNode> nodes = new ArrayList<>();
        for (JsonNode entry : nodesExt) {
            parseNode(entry, sourceHost).ifPresent(nodes::add);
        }

        TopologySnapshot snapshot = new TopologySnapshot(rev.asLong(), nodes, clock.instant(), sourceHost);
        log.debug("Parsed cluster configuration: rev={}, nodes={}, source={}", snapshot.revision(), nodes.size(), sourceHost);
        return snapshot;
    }

    private Optional<ClusterNode> parseNode(JsonNode entry, String sourceHost) {
        String hostname = entry.hasNonNull("hostname") ? entry.get("hostname").asText() : null;
        if (hostname == null || hostname.isBlank() || HOST_PLACEHOLDER.equals(hostname)) {
            hostname = sourceHost;
        }

        ClusterNode.Builder builder = ClusterNode.builder().hostname(hostname);
        JsonNode services = entry.get("services");
        int known = 0;
        if (services != null && services.isObject()) {
            Iterator<Map.Entry<String, JsonNode>> fields = services.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                Optional<ServiceType> service = ServiceType.fromConfigKey(field.getKey());
                if (service.isPresent() && field.getValue().canConvertToInt()) {
                    builder.service(service.get(), field.getValue().asInt());
                    known++;
                }
            }
        }

        if (known == 0) {
            log.debug("Skipping node without known services: hostname={}", hostname);
            return Optional.empty();
        }
        return Optional.of(builder.build());
    }
}
