package fr.lapetina.clusterclient.infrastructure.transport.binary;

/**
 * Opcodes of the memcached binary protocol used by the client itself.
 * Data opcodes are supplied by callers through {@code KvCommand}.
 */
public final class BinaryOpcodes {

    public static final byte REQUEST_MAGIC = (byte) 0x80;
    public static final byte RESPONSE_MAGIC = (byte) 0x81;

    public static final int GET = 0x00;
    public static final int SET = 0x01;
    public static final int DELETE = 0x04;
    public static final int NOOP = 0x0a;
    public static final int SASL_AUTH = 0x21;
    public static final int SELECT_BUCKET = 0x89;
    public static final int GET_CLUSTER_CONFIG = 0xb5;

    private BinaryOpcodes() {
        // Constants
    }
}
