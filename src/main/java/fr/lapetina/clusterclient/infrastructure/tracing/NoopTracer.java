package fr.lapetina.clusterclient.infrastructure.tracing;

/**
 * Tracer that records nothing.
 */
public final class NoopTracer implements RequestTracer {

    public static final NoopTracer INSTANCE = new NoopTracer();

    private static final RequestSpan NOOP_SPAN = new RequestSpan() {
        @Override
        public void setAttribute(String key, String value) {
        }

        @Override
        public void end() {
        }
    };

    private NoopTracer() {
    }

    @Override
    public RequestSpan requestSpan(String name, RequestSpan parent) {
        return NOOP_SPAN;
    }
}
