package io.kvoperator.store;

import lombok.Getter;

/**
 * Raised when a compare-and-set write is rejected because the key changed since it was read.
 * Callers re-read and retry from fresh state.
 */
@Getter
public class StaleRevisionException extends Exception {

    private final String key;
    private final long expectedModRevision;

    public StaleRevisionException(String key, long expectedModRevision) {
        super("Stale write to " + key + ": expected mod revision " + expectedModRevision);
        this.key = key;
        this.expectedModRevision = expectedModRevision;
    }
}
