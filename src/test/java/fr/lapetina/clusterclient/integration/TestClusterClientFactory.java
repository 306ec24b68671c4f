package fr.lapetina.clusterclient.integration;

import fr.lapetina.clusterclient.ClusterClientFactory;
import fr.lapetina.clusterclient.domain.model.ServiceType;
import fr.lapetina.clusterclient.infrastructure.config.ClientConfig;
import fr.lapetina.clusterclient.infrastructure.config.ConfigLoader;
import fr.lapetina.clusterclient.infrastructure.tracing.NoopTracer;

import java.util.List;

/**
 * Test extension of ClusterClientFactory wired to a stub transport and a stub topology.
 */
public final class TestClusterClientFactory extends ClusterClientFactory {

    private final StubTransport transport;
    private final StubTopologyProvider topology;

    private TestClusterClientFactory(ClientConfig config, StubTransport transport, StubTopologyProvider topology) {
        super(config, transport, topology, NoopTracer.INSTANCE);
        this.transport = transport;
        this.topology = topology;
    }

    /**
     * Creates a started factory whose topology has two key/value nodes and one query node.
     */
    public static TestClusterClientFactory create() {
        StubTopologyProvider topology = new StubTopologyProvider();
        topology.serve(1, List.of("node-1", "node-2"), ServiceType.KEY_VALUE, ServiceType.QUERY);
        return create(topology);
    }

    /**
     * Creates a started factory; the topology is whatever the provider serves.
     */
    public static TestClusterClientFactory create(StubTopologyProvider topology) {
        ClientConfig config = new ConfigLoader("test-config.yaml").load();
        TestClusterClientFactory factory = new TestClusterClientFactory(config, new StubTransport(), topology);
        factory.start();
        return factory;
    }

    public StubTransport getTransport() {
        return transport;
    }

    public StubTopologyProvider getTopology() {
        return topology;
    }
}
