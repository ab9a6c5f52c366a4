package io.kvoperator.runtime;

import io.kvoperator.exceptions.TransientCollaboratorException;

/**
 * Exception thrown when the workload runtime cannot be reached or rejects a request.
 */
public class WorkloadRuntimeException extends TransientCollaboratorException {

    public WorkloadRuntimeException(String message) {
        super(message);
    }

    public WorkloadRuntimeException(String message, Throwable cause) {
        super(message, cause);
    }
}
