package fr.lapetina.clusterclient.infrastructure.transport.binary;

import fr.lapetina.clusterclient.domain.model.KvCommand;

import java.nio.charset.StandardCharsets;

/**
 * One binary protocol packet.
 *
 * @param vbucketOrStatus vbucket id on requests, status on responses
 * @param opaque          correlation id echoed by the server
 */
public record BinaryFrame(
        byte magic,
        int opcode,
        int vbucketOrStatus,
        int opaque,
        long cas,
        byte[] extras,
        byte[] key,
        byte[] value
) {
    private static final byte[] EMPTY = new byte[0];

    public BinaryFrame {
        extras = extras != null ? extras : EMPTY;
        key = key != null ? key : EMPTY;
        value = value != null ? value : EMPTY;
    }

    public static BinaryFrame request(int opcode, byte[] key, byte[] value) {
        return new BinaryFrame(BinaryOpcodes.REQUEST_MAGIC, opcode, 0, 0, 0, null, key, value);
    }

    public static BinaryFrame request(int opcode, String key, byte[] value) {
        return request(opcode, key.getBytes(StandardCharsets.UTF_8), value);
    }

    public static BinaryFrame fromCommand(KvCommand command) {
        return new BinaryFrame(BinaryOpcodes.REQUEST_MAGIC, command.opcode(), command.vbucket(), 0,
                command.cas(), command.extras(), command.key(), command.value());
    }

    public BinaryFrame withOpaque(int newOpaque) {
        return new BinaryFrame(magic, opcode, vbucketOrStatus, newOpaque, cas, extras, key, value);
    }

    public boolean isResponse() {
        return magic == BinaryOpcodes.RESPONSE_MAGIC;
    }

    public int status() {
        return vbucketOrStatus;
    }

    public String valueAsString() {
        return new String(value, StandardCharsets.UTF_8);
    }

    @Override
    public String toString() {
        return String.format("BinaryFrame{magic=0x%02x, opcode=0x%02x, status/vb=%d, opaque=%d, key=%d bytes, value=%d bytes}",
                magic, opcode, vbucketOrStatus, opaque, key.length, value.length);
    }
}
