package io.kvoperator.models;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * A value read from the metadata store together with the etcd mod revision it was read at.
 * The revision is the expected value for the next compare-and-set write.
 */
@Data
@AllArgsConstructor
public class Versioned<T> {
    private final T value;
    private final long modRevision;
}
