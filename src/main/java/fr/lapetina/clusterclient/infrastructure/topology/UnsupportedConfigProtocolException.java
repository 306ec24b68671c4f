package fr.lapetina.clusterclient.infrastructure.topology;

/**
 * The node does not serve cluster configurations through the binary protocol.
 */
public class UnsupportedConfigProtocolException extends RuntimeException {

    private final int status;

    public UnsupportedConfigProtocolException(String endpoint, int status) {
        super(String.format("Node %s does not serve cluster configurations (status 0x%02x)", endpoint, status));
        this.status = status;
    }

    public int getStatus() {
        return status;
    }
}
