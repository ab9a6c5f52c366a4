package io.kvoperator.quorum;

/**
 * Thrown when leadership has to move but no healthy, active, non-leader peer exists.
 */
public class NoTransferTargetException extends Exception {

    public NoTransferTargetException(String message) {
        super(message);
    }
}
