package fr.lapetina.clusterclient.domain.event;

import com.lmax.disruptor.EventFactory;

/**
 * Factory for creating OperationEvent instances in the Disruptor ring buffer.
 *
 * The Disruptor pre-allocates events at startup to avoid GC during operation.
 * Events are then reused by clearing and re-initializing them.
 */
public final class OperationEventFactory implements EventFactory<OperationEvent> {

    @Override
    public OperationEvent newInstance() {
        return new OperationEvent();
    }
}
