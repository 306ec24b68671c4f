package fr.lapetina.clusterclient.disruptor;

import fr.lapetina.clusterclient.domain.exception.OperationException;
import fr.lapetina.clusterclient.domain.model.ErrorType;
import fr.lapetina.clusterclient.domain.model.HttpCommand;
import fr.lapetina.clusterclient.domain.model.KvCommand;
import fr.lapetina.clusterclient.domain.model.OperationRequest;
import fr.lapetina.clusterclient.domain.model.ServiceType;

/**
 * Structural checks run synchronously at submission.
 *
 * Validates:
 * - Service, payload and deadline are present
 * - Key/value operations carry a binary command with a key
 * - Other services carry an HTTP command with a path
 */
public final class RequestValidator {

    private static final int MAX_KEY_LENGTH = 250;

    private RequestValidator() {
        // Utility class
    }

    /**
     * @throws OperationException CONFIGURATION_ERROR describing the first violation
     */
    public static void validate(OperationRequest request) {
        if (request == null) {
            throw invalid("Request is null");
        }
        if (request.service() == null) {
            throw invalid("Service is required");
        }
        if (request.payload() == null) {
            throw invalid("Payload is required");
        }
        if (request.deadline() == null) {
            throw invalid("Deadline is required");
        }

        if (request.service() == ServiceType.KEY_VALUE) {
            if (!(request.payload() instanceof KvCommand command)) {
                throw invalid("KEY_VALUE requires a KvCommand payload, got: " + request.payload().getClass().getSimpleName());
            }
            if (command.opcode() < 0 || command.opcode() > 0xff) {
                throw invalid("Opcode out of range: " + command.opcode());
            }
            if (command.key().length > MAX_KEY_LENGTH) {
                throw invalid("Key exceeds maximum length of " + MAX_KEY_LENGTH + " bytes");
            }
            return;
        }

        if (!(request.payload() instanceof HttpCommand command)) {
            throw invalid(request.service() + " requires an HttpCommand payload, got: " + request.payload().getClass().getSimpleName());
        }
        if (command.path() == null || command.path().isBlank()) {
            throw invalid("HTTP path is required");
        }
    }

    private static OperationException invalid(String message) {
        return new OperationException(ErrorType.CONFIGURATION_ERROR, "Invalid request: " + message);
    }
}
