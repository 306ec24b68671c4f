package fr.lapetina.clusterclient.infrastructure.topology;

import fr.lapetina.clusterclient.domain.exception.OperationException;
import fr.lapetina.clusterclient.domain.model.ClusterNode;
import fr.lapetina.clusterclient.domain.model.ErrorType;
import fr.lapetina.clusterclient.domain.model.ServiceType;
import fr.lapetina.clusterclient.domain.model.TopologySnapshot;
import fr.lapetina.clusterclient.support.MutableClock;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ClusterConfigParserTest {

    private final MutableClock clock = new MutableClock();
    private final ClusterConfigParser parser = new ClusterConfigParser(clock);

    private TopologySnapshot parse(String json) {
        return parser.parse(json.getBytes(StandardCharsets.UTF_8), "10.0.0.9");
    }

    @Test
    @DisplayName("should parse nodes and their service ports")
    void shouldParseNodes() {
        TopologySnapshot snapshot = parse("{\"rev\": 42,"
                + "\"nodesExt\": ["
                + "{\"hostname\": \"10.0.0.1\", \"services\": {\"kv\": 11210, \"mgmt\": 8091, \"n1ql\": 8093}},"
                + "{\"hostname\": \"10.0.0.2\", \"services\": {\"kv\": 11210, \"mgmt\": 8091, \"fts\": 8094}}"
                + "]}");

        assertThat(snapshot.revision()).isEqualTo(42);
        assertThat(snapshot.source()).isEqualTo("10.0.0.9");
        assertThat(snapshot.fetchedAt()).isEqualTo(clock.instant());
        assertThat(snapshot.nodeIds()).containsExactlyInAnyOrder("10.0.0.1:8091", "10.0.0.2:8091");
        assertThat(snapshot.nodesFor(ServiceType.QUERY))
                .extracting(ClusterNode::getHostname)
                .containsExactly("10.0.0.1");
        assertThat(snapshot.findNode("10.0.0.2:8091"))
                .map(node -> node.getPort(ServiceType.SEARCH))
                .contains(8094);
    }

    @Test
    @DisplayName("should substitute the source host for a missing or placeholder hostname")
    void shouldSubstituteSourceHost() {
        TopologySnapshot snapshot = parse("{\"rev\": 1, \"nodesExt\": ["
                + "{\"hostname\": \"$HOST\", \"services\": {\"kv\": 11210}},"
                + "{\"services\": {\"n1ql\": 8093}}"
                + "]}");

        assertThat(snapshot.nodes())
                .extracting(ClusterNode::getHostname)
                .containsExactly("10.0.0.9", "10.0.0.9");
    }

    @Test
    @DisplayName("should ignore unknown services and nodes without known ones")
    void shouldIgnoreUnknownServices() {
        TopologySnapshot snapshot = parse("{\"rev\": 3, \"nodesExt\": ["
                + "{\"hostname\": \"a\", \"services\": {\"kv\": 11210, \"eventingAdminPort\": 8096}},"
                + "{\"hostname\": \"b\", \"services\": {\"backupAPI\": 8097}}"
                + "]}");

        assertThat(snapshot.nodes()).hasSize(1);
        assertThat(snapshot.nodes().get(0).getPorts()).containsOnlyKeys(ServiceType.KEY_VALUE);
    }

    @Test
    @DisplayName("should reject a document without revision")
    void shouldRejectMissingRevision() {
        assertThatThrownBy(() -> parse("{\"nodesExt\": []}"))
                .isInstanceOf(OperationException.class)
                .satisfies(e -> assertThat(((OperationException) e).getErrorType())
                        .isEqualTo(ErrorType.PROTOCOL_FAILURE));
    }

    @Test
    @DisplayName("should reject invalid JSON")
    void shouldRejectInvalidJson() {
        assertThatThrownBy(() -> parse("{\"rev\": 1, \"nodesExt\": ["))
                .isInstanceOf(OperationException.class)
                .hasMessageContaining("10.0.0.9");
    }

    @Test
    @DisplayName("should parse seed addresses with and without port")
    void shouldParseSeeds() {
        assertThat(SeedNode.parse("db1.local", 11210)).isEqualTo(new SeedNode("db1.local", 11210));
        assertThat(SeedNode.parse(" db2.local:11207 ", 11210)).isEqualTo(new SeedNode("db2.local", 11207));
        assertThatThrownBy(() -> SeedNode.parse("db3.local:http", 11210))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
