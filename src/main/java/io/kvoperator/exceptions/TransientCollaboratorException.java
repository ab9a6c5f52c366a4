package io.kvoperator.exceptions;

/**
 * Failure of an external collaborator that is expected to heal on retry.
 * Reconciliation keeps the recorded state and retries the key with backoff.
 */
public class TransientCollaboratorException extends Exception {

    public TransientCollaboratorException(String message) {
        super(message);
    }

    public TransientCollaboratorException(String message, Throwable cause) {
        super(message, cause);
    }
}
