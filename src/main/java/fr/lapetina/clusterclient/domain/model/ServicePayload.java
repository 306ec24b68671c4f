package fr.lapetina.clusterclient.domain.model;

/**
 * Already-encoded payload of an operation.
 * {@link KvCommand} travels over the binary protocol, {@link HttpCommand} over HTTP.
 */
public interface ServicePayload {

    /**
     * Short description used in logs. Must not include document bodies.
     */
    String describe();
}
