package fr.lapetina.clusterclient.domain.model;

import java.nio.charset.StandardCharsets;

/**
 * A binary protocol command: opcode plus raw key, extras and value.
 * The caller owns the payload encoding; the core only frames it.
 */
public record KvCommand(
        int opcode,
        byte[] key,
        byte[] extras,
        byte[] value,
        int vbucket,
        long cas
) implements ServicePayload {

    private static final byte[] EMPTY = new byte[0];

    public KvCommand {
        key = key != null ? key : EMPTY;
        extras = extras != null ? extras : EMPTY;
        value = value != null ? value : EMPTY;
    }

    public static KvCommand of(int opcode, String key) {
        return new KvCommand(opcode, key.getBytes(StandardCharsets.UTF_8), null, null, 0, 0);
    }

    public static KvCommand of(int opcode, String key, int vbucket, byte[] extras, byte[] value) {
        return new KvCommand(opcode, key.getBytes(StandardCharsets.UTF_8), extras, value, vbucket, 0);
    }

    public String keyAsString() {
        return new String(key, StandardCharsets.UTF_8);
    }

    @Override
    public String describe() {
        return String.format("kv{opcode=0x%02x, key=%s, vbucket=%d}", opcode, keyAsString(), vbucket);
    }
}
