package fr.lapetina.clusterclient.infrastructure.transport.binary;

import fr.lapetina.clusterclient.domain.exception.OperationException;
import fr.lapetina.clusterclient.domain.model.ErrorType;
import fr.lapetina.clusterclient.domain.retry.RetryReason;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BinaryFrameCodecTest {

    private static BinaryFrame response(int opaque, int status, String value) {
        return new BinaryFrame(BinaryOpcodes.RESPONSE_MAGIC, BinaryOpcodes.GET, status, opaque, 7L,
                new byte[]{0, 0, 0, 1}, null, value.getBytes(StandardCharsets.UTF_8));
    }

    @Test
    @DisplayName("should write the 24-byte header in network order")
    void shouldEncodeHeader() {
        BinaryFrame frame = BinaryFrame.request(BinaryOpcodes.GET, "key", null).withOpaque(0x01020304);

        ByteBuffer encoded = BinaryFrameCodec.encode(frame);

        assertThat(encoded.remaining()).isEqualTo(BinaryFrameCodec.HEADER_LENGTH + 3);
        assertThat(encoded.get(0)).isEqualTo(BinaryOpcodes.REQUEST_MAGIC);
        assertThat(encoded.get(1)).isEqualTo((byte) BinaryOpcodes.GET);
        assertThat(encoded.getShort(2)).isEqualTo((short) 3);
        assertThat(encoded.getInt(8)).isEqualTo(3);
        assertThat(encoded.getInt(12)).isEqualTo(0x01020304);
    }

    @Test
    @DisplayName("should decode a complete response and advance past it")
    void shouldDecodeResponse() {
        ByteBuffer buffer = BinaryFrameCodec.encode(response(9, BinaryStatus.SUCCESS, "{\"a\":1}"));

        Optional<BinaryFrame> decoded = BinaryFrameCodec.decode(buffer);

        assertThat(decoded).isPresent();
        BinaryFrame frame = decoded.get();
        assertThat(frame.isResponse()).isTrue();
        assertThat(frame.opaque()).isEqualTo(9);
        assertThat(frame.cas()).isEqualTo(7L);
        assertThat(frame.extras()).containsExactly(0, 0, 0, 1);
        assertThat(frame.valueAsString()).isEqualTo("{\"a\":1}");
        assertThat(buffer.hasRemaining()).isFalse();
    }

    @Test
    @DisplayName("should wait for the rest of a partial packet without consuming it")
    void shouldLeavePartialPacket() {
        ByteBuffer full = BinaryFrameCodec.encode(response(1, BinaryStatus.SUCCESS, "value"));
        ByteBuffer partial = ByteBuffer.allocate(full.remaining() - 2);
        byte[] bytes = new byte[full.remaining() - 2];
        full.get(bytes);
        partial.put(bytes).flip();

        assertThat(BinaryFrameCodec.decode(partial)).isEmpty();
        assertThat(partial.position()).isZero();
    }

    @Test
    @DisplayName("should decode consecutive packets from one buffer")
    void shouldDecodeSeveralPackets() {
        ByteBuffer first = BinaryFrameCodec.encode(response(1, BinaryStatus.SUCCESS, "one"));
        ByteBuffer second = BinaryFrameCodec.encode(response(2, BinaryStatus.KEY_NOT_FOUND, ""));
        ByteBuffer both = ByteBuffer.allocate(first.remaining() + second.remaining());
        both.put(first).put(second).flip();

        assertThat(BinaryFrameCodec.decode(both)).map(BinaryFrame::opaque).contains(1);
        assertThat(BinaryFrameCodec.decode(both)).map(BinaryFrame::status).contains(BinaryStatus.KEY_NOT_FOUND);
        assertThat(BinaryFrameCodec.decode(both)).isEmpty();
    }

    @Test
    @DisplayName("should reject a bad magic byte as a malformed response")
    void shouldRejectBadMagic() {
        ByteBuffer buffer = ByteBuffer.allocate(BinaryFrameCodec.HEADER_LENGTH);
        buffer.put(0, (byte) 0x42);

        assertThatThrownBy(() -> BinaryFrameCodec.decode(buffer))
                .isInstanceOf(OperationException.class)
                .satisfies(e -> assertThat(((OperationException) e).getRetryReason())
                        .isEqualTo(RetryReason.MALFORMED_RESPONSE));
    }

    @Test
    @DisplayName("should reject a key longer than the body")
    void shouldRejectImpossibleLengths() {
        ByteBuffer buffer = ByteBuffer.allocate(BinaryFrameCodec.HEADER_LENGTH);
        buffer.put(0, BinaryOpcodes.RESPONSE_MAGIC);
        buffer.putShort(2, (short) 10);
        buffer.putInt(8, 4);

        assertThatThrownBy(() -> BinaryFrameCodec.decode(buffer))
                .isInstanceOf(OperationException.class)
                .hasMessageContaining("Invalid body length");
    }

    @Nested
    @DisplayName("status mapping")
    class StatusMapping {

        @Test
        @DisplayName("should map not-my-vbucket to a stale topology")
        void shouldMapNotMyVbucket() {
            OperationException e = BinaryStatus.toException(BinaryStatus.NOT_MY_VBUCKET, "10.0.0.1:11210", "");

            assertThat(e.getRetryReason()).isEqualTo(RetryReason.TOPOLOGY_STALE);
            assertThat(e.isServerResponse()).isTrue();
        }

        @Test
        @DisplayName("should map temporary failures to an overloaded node")
        void shouldMapTemporaryFailure() {
            assertThat(BinaryStatus.toException(BinaryStatus.TEMPORARY_FAILURE, "n", "").getRetryReason())
                    .isEqualTo(RetryReason.NODE_OVERLOADED);
            assertThat(BinaryStatus.toException(BinaryStatus.LOCKED, "n", "").getRetryReason())
                    .isEqualTo(RetryReason.CONFLICT_IN_PROGRESS);
        }

        @Test
        @DisplayName("should make every other status a terminal service error")
        void shouldMapOtherStatuses() {
            OperationException e = BinaryStatus.toException(BinaryStatus.KEY_NOT_FOUND, "n", "Not found");

            assertThat(e.getErrorType()).isEqualTo(ErrorType.SERVICE_ERROR);
            assertThat(e.isRetryable()).isFalse();
            assertThat(e.getStatus()).isEqualTo(BinaryStatus.KEY_NOT_FOUND);
        }
    }
}
