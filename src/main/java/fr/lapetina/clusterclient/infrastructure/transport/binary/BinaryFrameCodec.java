package fr.lapetina.clusterclient.infrastructure.transport.binary;

import fr.lapetina.clusterclient.domain.exception.OperationException;
import fr.lapetina.clusterclient.domain.retry.RetryReason;

import java.nio.ByteBuffer;
import java.util.Optional;

/**
 * Encodes and decodes binary protocol packets.
 *
 * Header layout (24 bytes, big endian):
 * magic(1) opcode(1) keyLength(2) extrasLength(1) datatype(1) vbucket/status(2)
 * totalBodyLength(4) opaque(4) cas(8)
 */
public final class BinaryFrameCodec {

    public static final int HEADER_LENGTH = 24;
    static final int MAX_BODY_LENGTH = 20 * 1024 * 1024;

    private BinaryFrameCodec() {
        // Utility class
    }

    public static ByteBuffer encode(BinaryFrame frame) {
        int bodyLength = frame.extras().length + frame.key().length + frame.value().length;
        ByteBuffer buffer = ByteBuffer.allocate(HEADER_LENGTH + bodyLength);
        buffer.put(frame.magic());
        buffer.put((byte) frame.opcode());
        buffer.putShort((short) frame.key().length);
        buffer.put((byte) frame.extras().length);
        buffer.put((byte) 0);
        buffer.putShort((short) frame.vbucketOrStatus());
        buffer.putInt(bodyLength);
        buffer.putInt(frame.opaque());
        buffer.putLong(frame.cas());
        buffer.put(frame.extras());
        buffer.put(frame.key());
        buffer.put(frame.value());
        buffer.flip();
        return buffer;
    }

    /**
     * Decodes one packet if the buffer (in read mode) holds a complete one.
     * On success the buffer position moves past the packet; otherwise it is left untouched.
     *
     * @throws OperationException MALFORMED_RESPONSE on a bad magic byte or an impossible length
     */
    public static Optional<BinaryFrame> decode(ByteBuffer buffer) {
        if (buffer.remaining() < HEADER_LENGTH) {
            return Optional.empty();
        }
        int start = buffer.position();
        byte magic = buffer.get(start);
        if (magic != BinaryOpcodes.RESPONSE_MAGIC && magic != BinaryOpcodes.REQUEST_MAGIC) {
            throw OperationException.retryable(RetryReason.MALFORMED_RESPONSE,
                    String.format("Unexpected magic byte 0x%02x", magic));
        }

        int keyLength = Short.toUnsignedInt(buffer.getShort(start + 2));
        int extrasLength = Byte.toUnsignedInt(buffer.get(start + 4));
        int bodyLength = buffer.getInt(start + 8);
        if (bodyLength < 0 || bodyLength > MAX_BODY_LENGTH || keyLength + extrasLength > bodyLength) {
            throw OperationException.retryable(RetryReason.MALFORMED_RESPONSE,
                    "Invalid body length " + bodyLength + " (key=" + keyLength + ", extras=" + extrasLength + ")");
        }
        if (buffer.remaining() < HEADER_LENGTH + bodyLength) {
            return Optional.empty();
        }

        int opcode = Byte.toUnsignedInt(buffer.get(start + 1));
        int vbucketOrStatus = Short.toUnsignedInt(buffer.getShort(start + 6));
        int opaque = buffer.getInt(start + 12);
        long cas = buffer.getLong(start + 16);

        buffer.position(start + HEADER_LENGTH);
        byte[] extras = new byte[extrasLength];
        buffer.get(extras);
        byte[] key = new byte[keyLength];
        buffer.get(key);
        byte[] value = new byte[bodyLength - keyLength - extrasLength];
        buffer.get(value);

        return Optional.of(new BinaryFrame(magic, opcode, vbucketOrStatus, opaque, cas, extras, key, value));
    }
}
