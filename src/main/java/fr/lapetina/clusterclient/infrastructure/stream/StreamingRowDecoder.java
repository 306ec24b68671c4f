package fr.lapetina.clusterclient.infrastructure.stream;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonParseException;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.core.async.ByteArrayFeeder;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import fr.lapetina.clusterclient.domain.exception.OperationException;
import fr.lapetina.clusterclient.domain.model.ErrorType;
import fr.lapetina.clusterclient.domain.retry.RetryReason;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;

/**
 * Incremental decoder for row-oriented JSON response bodies.
 *
 * The body is a JSON object; one of its fields holds the row array. Chunks are
 * pushed into Jackson's non-blocking parser as they arrive and each array
 * element is handed to the sink as soon as its closing token has been parsed,
 * so the first row is visible long before the body is complete.
 *
 * All other root fields are collected into a metadata object. A non-empty
 * {@code errors} array in it turns the end of the stream into a service error.
 *
 * Not thread-safe: a decoder is fed by a single subscriber.
 */
public final class StreamingRowDecoder {

    private static final Logger log = LoggerFactory.getLogger(StreamingRowDecoder.class);

    private static final JsonFactory JSON_FACTORY = new JsonFactory();
    private static final ObjectMapper MAPPER = new ObjectMapper(JSON_FACTORY);

    private enum Phase {
        START,
        ROOT,
        ROWS_START,
        ROWS,
        ROW,
        META_VALUE,
        DONE,
        FAILED
    }

    private final String rowsField;
    private final RowSink sink;
    private final JsonParser parser;
    private final ByteArrayFeeder feeder;

    private final ByteArrayOutputStream rowBuffer = new ByteArrayOutputStream(256);
    private final ByteArrayOutputStream metadataBuffer = new ByteArrayOutputStream(256);
    private final JsonGenerator metadataGenerator;
    private JsonGenerator rowGenerator;

    private Phase phase = Phase.START;
    private int depth;
    private long rowCount;

    public StreamingRowDecoder(String rowsField, RowSink sink) {
        this.rowsField = rowsField;
        this.sink = sink;
        try {
            this.parser = JSON_FACTORY.createNonBlockingByteArrayParser();
            this.metadataGenerator = JSON_FACTORY.createGenerator(metadataBuffer);
            this.metadataGenerator.writeStartObject();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to create non-blocking parser", e);
        }
        this.feeder = (ByteArrayFeeder) parser.getNonBlockingInputFeeder();
    }

    public void feed(byte[] chunk) {
        feed(chunk, 0, chunk.length);
    }

    /**
     * Pushes the next chunk of the body. Complete rows are emitted before this returns.
     */
    public void feed(byte[] chunk, int offset, int length) {
        if (isTerminal()) {
            return;
        }
        try {
            feeder.feedInput(chunk, offset, offset + length);
            drain();
        } catch (IOException e) {
            fail(malformed(e));
        }
    }

    /**
     * Signals that the body ended. A body that ended before its root object closed is truncated.
     */
    public void endOfInput() {
        if (isTerminal()) {
            return;
        }
        feeder.endOfInput();
        try {
            drain();
        } catch (IOException e) {
            fail(malformed(e));
            return;
        }
        if (!isTerminal()) {
            fail(OperationException.retryable(
                    RetryReason.MALFORMED_RESPONSE,
                    "Response body truncated after " + rowCount + " rows"));
        }
    }

    /**
     * Signals a transport failure while the body was being read.
     */
    public void abort(OperationException error) {
        if (!isTerminal()) {
            fail(error);
        }
    }

    public boolean isTerminal() {
        return phase == Phase.DONE || phase == Phase.FAILED;
    }

    public long getRowCount() {
        return rowCount;
    }

    private void drain() throws IOException {
        while (!isTerminal()) {
            JsonToken token = parser.nextToken();
            if (token == null || token == JsonToken.NOT_AVAILABLE) {
                return;
            }
            handle(token);
        }
    }

    private void handle(JsonToken token) throws IOException {
        switch (phase) {
            case START -> {
                if (token != JsonToken.START_OBJECT) {
                    throw new JsonParseException(parser, "Expected a JSON object, got " + token);
                }
                phase = Phase.ROOT;
            }
            case ROOT -> {
                if (token == JsonToken.END_OBJECT) {
                    complete();
                    return;
                }
                String name = parser.currentName();
                if (rowsField.equals(name)) {
                    phase = Phase.ROWS_START;
                } else {
                    metadataGenerator.writeFieldName(name);
                    depth = 0;
                    phase = Phase.META_VALUE;
                }
            }
            case ROWS_START -> {
                if (token == JsonToken.START_ARRAY) {
                    phase = Phase.ROWS;
                } else if (token == JsonToken.VALUE_NULL) {
                    phase = Phase.ROOT;
                } else {
                    throw new JsonParseException(parser, "Field '" + rowsField + "' is not an array");
                }
            }
            case ROWS -> {
                if (token == JsonToken.END_ARRAY) {
                    phase = Phase.ROOT;
                    return;
                }
                rowGenerator = JSON_FACTORY.createGenerator(rowBuffer);
                rowGenerator.copyCurrentEvent(parser);
                if (token.isStructStart()) {
                    depth = 1;
                    phase = Phase.ROW;
                } else {
                    emitRow();
                }
            }
            case ROW -> {
                rowGenerator.copyCurrentEvent(parser);
                depth += depthDelta(token);
                if (depth == 0) {
                    emitRow();
                    phase = Phase.ROWS;
                }
            }
            case META_VALUE -> {
                metadataGenerator.copyCurrentEvent(parser);
                depth += depthDelta(token);
                if (depth == 0) {
                    phase = Phase.ROOT;
                }
            }
            default -> throw new IllegalStateException("Unexpected token in phase " + phase + ": " + token);
        }
    }

    private void emitRow() throws IOException {
        rowGenerator.close();
        rowGenerator = null;
        byte[] row = rowBuffer.toByteArray();
        rowBuffer.reset();
        rowCount++;
        sink.onRow(row);
    }

    private void complete() throws IOException {
        metadataGenerator.writeEndObject();
        metadataGenerator.close();
        byte[] metadata = metadataBuffer.toByteArray();
        phase = Phase.DONE;

        log.debug("Row stream complete: rowsField={}, rows={}", rowsField, rowCount);

        OperationException serviceError = serviceError(metadata);
        if (serviceError != null) {
            sink.onError(serviceError);
        } else {
            sink.onComplete(metadata);
        }
    }

    private OperationException serviceError(byte[] metadata) throws IOException {
        JsonNode errors = MAPPER.readTree(metadata).path("errors");
        if (!errors.isArray() || errors.isEmpty()) {
            return null;
        }
        JsonNode first = errors.get(0);
        String message = first.path("msg").asText(first.toString());
        int code = first.path("code").asInt(0);
        return new OperationException(
                ErrorType.SERVICE_ERROR,
                null,
                OperationException.NO_STATUS,
                "Service reported " + errors.size() + " error(s), first: code=" + code + ", msg=" + message,
                null);
    }

    private void fail(OperationException error) {
        phase = Phase.FAILED;
        log.debug("Row stream failed: rowsField={}, rowsDelivered={}, error={}",
                rowsField, rowCount, error.getMessage());
        sink.onError(error);
    }

    private OperationException malformed(IOException e) {
        return OperationException.retryable(
                RetryReason.MALFORMED_RESPONSE,
                "Malformed response body after " + rowCount + " rows: " + e.getMessage(),
                e);
    }

    private static int depthDelta(JsonToken token) {
        if (token.isStructStart()) {
            return 1;
        }
        if (token.isStructEnd()) {
            return -1;
        }
        return 0;
    }
}
