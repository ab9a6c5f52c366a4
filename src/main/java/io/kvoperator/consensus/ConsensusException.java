package io.kvoperator.consensus;

import io.kvoperator.exceptions.TransientCollaboratorException;

/**
 * Exception thrown when the consensus API cannot be reached or rejects a call.
 */
public class ConsensusException extends TransientCollaboratorException {

    public ConsensusException(String message) {
        super(message);
    }

    public ConsensusException(String message, Throwable cause) {
        super(message, cause);
    }
}
