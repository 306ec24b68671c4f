package fr.lapetina.clusterclient.domain.model;

import java.net.InetSocketAddress;
import java.net.URI;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * A cluster node as advertised by one topology revision.
 * Immutable: a changed node shows up as a new instance in the next snapshot.
 */
public final class ClusterNode {
    private final String id;
    private final String hostname;
    private final Map<ServiceType, Integer> ports;

    private ClusterNode(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "Node ID is required");
        this.hostname = Objects.requireNonNull(builder.hostname, "Hostname is required");
        this.ports = Collections.unmodifiableMap(new EnumMap<>(builder.ports));
    }

    public String getId() {
        return id;
    }

    public String getHostname() {
        return hostname;
    }

    public Map<ServiceType, Integer> getPorts() {
        return ports;
    }

    public boolean hasService(ServiceType service) {
        return ports.containsKey(service);
    }

    /**
     * Returns the port of a service this node advertises.
     *
     * @throws IllegalArgumentException if the node does not run the service
     */
    public int getPort(ServiceType service) {
        Integer port = ports.get(service);
        if (port == null) {
            throw new IllegalArgumentException("Node " + id + " does not advertise service " + service);
        }
        return port;
    }

    public InetSocketAddress socketAddress(ServiceType service) {
        return InetSocketAddress.createUnresolved(hostname, getPort(service));
    }

    /**
     * host:port of a service endpoint, used as connection pool key.
     */
    public String endpoint(ServiceType service) {
        return hostname + ":" + getPort(service);
    }

    public URI httpUri(ServiceType service, String path) {
        String suffix = path.startsWith("/") ? path : "/" + path;
        return URI.create("http://" + hostname + ":" + getPort(service) + suffix);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ClusterNode that = (ClusterNode) o;
        return id.equals(that.id) && hostname.equals(that.hostname) && ports.equals(that.ports);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, hostname, ports);
    }

    @Override
    public String toString() {
        return "ClusterNode{" +
                "id='" + id + '\'' +
                ", hostname='" + hostname + '\'' +
                ", ports=" + ports +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String id;
        private String hostname;
        private final Map<ServiceType, Integer> ports = new EnumMap<>(ServiceType.class);

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder hostname(String hostname) {
            this.hostname = hostname;
            return this;
        }

        public Builder service(ServiceType service, int port) {
            this.ports.put(service, port);
            return this;
        }

        public Builder services(Map<ServiceType, Integer> ports) {
            this.ports.putAll(ports);
            return this;
        }

        public ClusterNode build() {
            if (id == null && hostname != null) {
                Integer mgmt = ports.get(ServiceType.MANAGEMENT);
                id = mgmt != null ? hostname + ":" + mgmt : hostname;
            }
            return new ClusterNode(this);
        }
    }
}
