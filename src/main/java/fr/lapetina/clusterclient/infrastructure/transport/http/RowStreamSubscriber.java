package fr.lapetina.clusterclient.infrastructure.transport.http;

import fr.lapetina.clusterclient.domain.exception.OperationException;
import fr.lapetina.clusterclient.domain.retry.RetryReason;
import fr.lapetina.clusterclient.infrastructure.stream.RowReader;
import fr.lapetina.clusterclient.infrastructure.stream.StreamingRowDecoder;

import java.nio.ByteBuffer;
import java.util.List;
import java.util.concurrent.Flow;

/**
 * Feeds an HTTP response body into a row decoder, one chunk at a time.
 *
 * Demand is driven by the reader: the next chunk is requested only while the
 * row buffer is below capacity.
 */
final class RowStreamSubscriber implements Flow.Subscriber<List<ByteBuffer>> {

    private final StreamingRowDecoder decoder;
    private final RowReader reader;
    private final String endpoint;

    private Flow.Subscription subscription;

    RowStreamSubscriber(StreamingRowDecoder decoder, RowReader reader, String endpoint) {
        this.decoder = decoder;
        this.reader = reader;
        this.endpoint = endpoint;
    }

    @Override
    public void onSubscribe(Flow.Subscription subscription) {
        this.subscription = subscription;
        reader.bindUpstream(new RowReader.Upstream() {
            @Override
            public void request(long n) {
                subscription.request(n);
            }

            @Override
            public void cancel() {
                subscription.cancel();
            }
        });
        reader.requestMore();
    }

    @Override
    public void onNext(List<ByteBuffer> chunks) {
        for (ByteBuffer chunk : chunks) {
            byte[] bytes = new byte[chunk.remaining()];
            chunk.get(bytes);
            decoder.feed(bytes);
        }
        if (decoder.isTerminal()) {
            // Anything after the closing brace is irrelevant
            subscription.cancel();
            return;
        }
        reader.requestMore();
    }

    @Override
    public void onError(Throwable throwable) {
        decoder.abort(OperationException.retryable(RetryReason.SOCKET_CLOSED_WHILE_IN_FLIGHT,
                "Response body from " + endpoint + " interrupted after " + decoder.getRowCount() + " rows: "
                        + throwable.getMessage(), throwable));
    }

    @Override
    public void onComplete() {
        decoder.endOfInput();
    }
}
