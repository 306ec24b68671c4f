package fr.lapetina.clusterclient.infrastructure.topology;

import java.util.List;
import java.util.Objects;

/**
 * Bootstrap address from the configuration, {@code host} or {@code host:port}.
 */
public record SeedNode(String hostname, int port) {

    public SeedNode {
        Objects.requireNonNull(hostname, "Hostname is required");
        if (port <= 0 || port > 65535) {
            throw new IllegalArgumentException("Invalid port " + port + " for seed " + hostname);
        }
    }

    public static SeedNode parse(String address, int defaultPort) {
        String trimmed = address.trim();
        int colon = trimmed.lastIndexOf(':');
        if (colon < 0) {
            return new SeedNode(trimmed, defaultPort);
        }
        try {
            return new SeedNode(trimmed.substring(0, colon), Integer.parseInt(trimmed.substring(colon + 1)));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid seed address: " + address, e);
        }
    }

    public static List<SeedNode> parseAll(List<String> addresses, int defaultPort) {
        return addresses.stream()
                .map(address -> parse(address, defaultPort))
                .toList();
    }

    @Override
    public String toString() {
        return hostname + ":" + port;
    }
}
