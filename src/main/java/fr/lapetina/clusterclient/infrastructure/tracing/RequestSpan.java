package fr.lapetina.clusterclient.infrastructure.tracing;

/**
 * One traced unit of work: an operation, or one attempt of it.
 */
public interface RequestSpan {

    void setAttribute(String key, String value);

    /**
     * Ends the span. Calls after the first are ignored.
     */
    void end();
}
