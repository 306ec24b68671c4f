package fr.lapetina.clusterclient.domain.model;

import java.util.Optional;

/**
 * Service kinds a cluster node may advertise.
 *
 * The config key is the name used in the {@code services} map of a cluster
 * configuration document. Query-style services also name the JSON field of
 * their response body that carries the row array.
 */
public enum ServiceType {
    /** Binary key/value protocol on the data port */
    KEY_VALUE("kv", null),

    /** N1QL query service */
    QUERY("n1ql", "results"),

    /** Analytics service */
    ANALYTICS("cbas", "results"),

    /** Full-text search service */
    SEARCH("fts", "hits"),

    /** Map/reduce views */
    VIEWS("capi", "rows"),

    /** Cluster management REST API */
    MANAGEMENT("mgmt", null);

    private final String configKey;
    private final String rowsField;

    ServiceType(String configKey, String rowsField) {
        this.configKey = configKey;
        this.rowsField = rowsField;
    }

    public String getConfigKey() {
        return configKey;
    }

    public String getRowsField() {
        return rowsField;
    }

    /**
     * Whether successful responses of this service are decoded row by row.
     */
    public boolean isStreaming() {
        return rowsField != null;
    }

    public boolean usesBinaryProtocol() {
        return this == KEY_VALUE;
    }

    public static Optional<ServiceType> fromConfigKey(String key) {
        for (ServiceType type : values()) {
            if (type.configKey.equals(key)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
