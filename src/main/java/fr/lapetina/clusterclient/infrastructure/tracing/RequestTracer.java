package fr.lapetina.clusterclient.infrastructure.tracing;

/**
 * Receives one span per operation and one child span per dispatch attempt.
 * Implementations must be thread-safe and must not block.
 */
@FunctionalInterface
public interface RequestTracer {

    /**
     * @param name   span name, {@code operation} or {@code attempt}
     * @param parent enclosing span, null for an operation span
     */
    RequestSpan requestSpan(String name, RequestSpan parent);
}
