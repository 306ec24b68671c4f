package fr.lapetina.clusterclient.infrastructure.transport;

import fr.lapetina.clusterclient.domain.model.ClusterNode;
import fr.lapetina.clusterclient.domain.model.OperationRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * Routes key/value operations to the binary transport and everything else to HTTP.
 */
public final class ServiceTransports implements Transport {

    private static final Logger log = LoggerFactory.getLogger(ServiceTransports.class);

    private final Transport binary;
    private final Transport http;

    public ServiceTransports(Transport binary, Transport http) {
        this.binary = binary;
        this.http = http;
    }

    @Override
    public InFlightExchange send(ClusterNode node, OperationRequest request, Duration remaining) {
        Transport target = request.service().usesBinaryProtocol() ? binary : http;
        return target.send(node, request, remaining);
    }

    @Override
    public void close() {
        try {
            binary.close();
        } catch (Exception e) {
            log.warn("Error closing binary transport", e);
        }
        try {
            http.close();
        } catch (Exception e) {
            log.warn("Error closing HTTP transport", e);
        }
    }
}
