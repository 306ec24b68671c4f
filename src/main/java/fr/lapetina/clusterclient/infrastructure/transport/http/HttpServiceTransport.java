package fr.lapetina.clusterclient.infrastructure.transport.http;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import fr.lapetina.clusterclient.domain.exception.OperationException;
import fr.lapetina.clusterclient.domain.model.ClusterNode;
import fr.lapetina.clusterclient.domain.model.ErrorType;
import fr.lapetina.clusterclient.domain.model.HttpCommand;
import fr.lapetina.clusterclient.domain.model.OperationRequest;
import fr.lapetina.clusterclient.domain.model.ServiceType;
import fr.lapetina.clusterclient.domain.retry.RetryReason;
import fr.lapetina.clusterclient.infrastructure.auth.Authenticator;
import fr.lapetina.clusterclient.infrastructure.stream.RowReader;
import fr.lapetina.clusterclient.infrastructure.stream.StreamingRowDecoder;
import fr.lapetina.clusterclient.infrastructure.transport.InFlightExchange;
import fr.lapetina.clusterclient.infrastructure.transport.Transport;
import fr.lapetina.clusterclient.infrastructure.transport.TransportResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.ConnectException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpConnectTimeoutException;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Flow;
import java.util.concurrent.atomic.AtomicReference;

/**
 * HTTP transport for the query, analytics, search, views and management services.
 *
 * Uses java.net.http.HttpClient for non-blocking I/O. Credentials are fetched
 * from the authenticator for every request. Successful responses of streaming
 * services are decoded row by row while the body arrives.
 */
public class HttpServiceTransport implements Transport {

    private static final Logger log = LoggerFactory.getLogger(HttpServiceTransport.class);

    private static final Duration MIN_REQUEST_TIMEOUT = Duration.ofMillis(1);

    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final Authenticator authenticator;
    private final int rowBufferSize;

    public HttpServiceTransport(Duration connectTimeout, Authenticator authenticator, int rowBufferSize) {
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(connectTimeout)
                .version(HttpClient.Version.HTTP_1_1)
                .build();
        this.objectMapper = new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        this.authenticator = authenticator;
        this.rowBufferSize = rowBufferSize;
    }

    @Override
    public InFlightExchange send(ClusterNode node, OperationRequest request, Duration remaining) {
        HttpExchange exchange = new HttpExchange();
        if (!(request.payload() instanceof HttpCommand command)) {
            exchange.response.completeExceptionally(new OperationException(ErrorType.CONFIGURATION_ERROR,
                    "HTTP transport requires an HttpCommand payload, got: " + request.payload().describe()));
            return exchange;
        }

        ServiceType service = request.service();
        String endpoint = node.endpoint(service);
        HttpRequest httpRequest;
        try {
            httpRequest = buildHttpRequest(node, request, command, remaining);
        } catch (RuntimeException e) {
            log.error("Failed to build request: nodeId={}, requestId={}", node.getId(), request.requestId(), e);
            exchange.response.completeExceptionally(new OperationException(ErrorType.CONFIGURATION_ERROR,
                    "Failed to build request: " + e.getMessage(), e));
            return exchange;
        }

        log.debug("Sending request: nodeId={}, requestId={}, uri={}", node.getId(), request.requestId(), httpRequest.uri());

        CompletableFuture<HttpResponse<Flow.Publisher<List<ByteBuffer>>>> sent =
                httpClient.sendAsync(httpRequest, HttpResponse.BodyHandlers.ofPublisher());
        exchange.bind(sent);

        sent.whenComplete((response, error) -> {
            if (error != null) {
                exchange.response.completeExceptionally(classifyException(endpoint, unwrap(error)));
                return;
            }
            handleResponse(exchange, service, endpoint, request, response);
        });
        return exchange;
    }

    private HttpRequest buildHttpRequest(ClusterNode node, OperationRequest request, HttpCommand command, Duration remaining) {
        URI uri = node.httpUri(request.service(), command.path());
        HttpRequest.BodyPublisher body = command.hasBody()
                ? HttpRequest.BodyPublishers.ofByteArray(command.body())
                : HttpRequest.BodyPublishers.noBody();

        HttpRequest.Builder builder = HttpRequest.newBuilder()
                .uri(uri)
                .timeout(remaining.compareTo(MIN_REQUEST_TIMEOUT) < 0 ? MIN_REQUEST_TIMEOUT : remaining)
                .header("Authorization", authenticator.credentials(request.service(), node.endpoint(request.service())).basicAuthHeader())
                .header("X-Request-ID", request.requestId())
                .header("X-Correlation-ID", request.correlationId())
                .method(command.method(), body);
        if (command.contentType() != null) {
            builder.header("Content-Type", command.contentType());
        }
        command.headers().forEach(builder::header);
        return builder.build();
    }

    private void handleResponse(
            HttpExchange exchange,
            ServiceType service,
            String endpoint,
            OperationRequest request,
            HttpResponse<Flow.Publisher<List<ByteBuffer>>> response
    ) {
        int status = response.statusCode();

        if (isSuccess(status) && service.isStreaming()) {
            RowReader rows = new RowReader(rowBufferSize);
            exchange.bindRows(rows);
            StreamingRowDecoder decoder = new StreamingRowDecoder(service.getRowsField(), rows);
            response.body().subscribe(new RowStreamSubscriber(decoder, rows, endpoint));
            if (!exchange.response.complete(TransportResponse.streaming(status, rows))) {
                rows.close();
            }
            return;
        }

        ByteArrayCollector collector = new ByteArrayCollector();
        exchange.bindBody(collector.body());
        response.body().subscribe(collector);
        collector.body().whenComplete((bytes, error) -> {
            if (error != null) {
                exchange.response.completeExceptionally(classifyException(endpoint, unwrap(error)));
            } else if (isSuccess(status)) {
                exchange.response.complete(TransportResponse.of(status, bytes));
            } else {
                exchange.response.completeExceptionally(statusException(status, endpoint, request, bytes));
            }
        });
    }

    private OperationException statusException(int status, String endpoint, OperationRequest request, byte[] body) {
        String message = "HTTP " + status + " from " + endpoint + ": " + extractErrorMessage(body);
        log.debug("Request failed with HTTP error: endpoint={}, requestId={}, status={}", endpoint, request.requestId(), status);
        return switch (status) {
            case 503 -> new OperationException(ErrorType.SERVICE_UNAVAILABLE, RetryReason.SERVICE_NOT_AVAILABLE, status, message, null);
            case 429 -> new OperationException(RetryReason.NODE_OVERLOADED.errorType(), RetryReason.NODE_OVERLOADED, status, message, null);
            default -> new OperationException(ErrorType.SERVICE_ERROR, null, status, message, null);
        };
    }

    private String extractErrorMessage(byte[] body) {
        if (body == null || body.length == 0) {
            return "empty body";
        }
        try {
            JsonNode node = objectMapper.readTree(body);
            if (node.hasNonNull("errors")) {
                return node.get("errors").toString();
            }
            if (node.hasNonNull("error")) {
                return node.get("error").isTextual() ? node.get("error").asText() : node.get("error").toString();
            }
        } catch (IOException e) {
            log.trace("Error body is not JSON", e);
        }
        String text = new String(body, StandardCharsets.UTF_8);
        return text.length() > 256 ? text.substring(0, 256) + "..." : text;
    }

    private Throwable classifyException(String endpoint, Throwable cause) {
        if (cause instanceof OperationException || cause instanceof CancellationException) {
            return cause;
        }
        String message = cause.getClass().getSimpleName() + " from " + endpoint + ": " + cause.getMessage();
        if (cause instanceof HttpConnectTimeoutException || cause instanceof ConnectException) {
            return OperationException.retryable(RetryReason.SOCKET_NOT_AVAILABLE, message, cause);
        }
        if (cause instanceof HttpTimeoutException) {
            return new OperationException(ErrorType.TIMEOUT, message, cause);
        }
        if (cause instanceof IOException) {
            return OperationException.retryable(RetryReason.SOCKET_CLOSED_WHILE_IN_FLIGHT, message, cause);
        }
        log.error("Request failed unexpectedly: endpoint={}", endpoint, cause);
        return new OperationException(ErrorType.TRANSPORT_FAILURE, message, cause);
    }

    private static boolean isSuccess(int status) {
        return status >= 200 && status < 300;
    }

    private static Throwable unwrap(Throwable error) {
        return error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
    }

    @Override
    public void close() {
        // HttpClient doesn't need explicit closing in Java 17
    }

    /**
     * Abort cancels the pending HTTP exchange, the body collection and the row stream.
     */
    static final class HttpExchange implements InFlightExchange {
        final CompletableFuture<TransportResponse> response = new CompletableFuture<>();
        private final AtomicReference<CompletableFuture<?>> sent = new AtomicReference<>();
        private final AtomicReference<CompletableFuture<?>> body = new AtomicReference<>();
        private final AtomicReference<RowReader> rows = new AtomicReference<>();
        private volatile boolean aborted = false;

        void bind(CompletableFuture<?> future) {
            sent.set(future);
            if (aborted) {
                future.cancel(true);
            }
        }

        void bindBody(CompletableFuture<?> future) {
            body.set(future);
            if (aborted) {
                future.cancel(true);
            }
        }

        void bindRows(RowReader reader) {
            rows.set(reader);
            if (aborted) {
                reader.close();
            }
        }

        @Override
        public CompletableFuture<TransportResponse> response() {
            return response;
        }

        @Override
        public void abort() {
            aborted = true;
            response.completeExceptionally(new CancellationException("Exchange aborted"));
            CompletableFuture<?> pending = sent.get();
            if (pending != null) {
                pending.cancel(true);
            }
            CompletableFuture<?> collecting = body.get();
            if (collecting != null) {
                collecting.cancel(true);
            }
            RowReader reader = rows.get();
            if (reader != null) {
                reader.close();
            }
        }
    }
}
