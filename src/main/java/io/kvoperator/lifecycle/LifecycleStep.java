package io.kvoperator.lifecycle;

import io.kvoperator.exceptions.TransientCollaboratorException;

/**
 * One named transition of the instance lifecycle.
 * <p>
 * Steps never write the metadata store; they return the record to persist and the engine
 * writes it with compare-and-set. External calls made by a step must be idempotent since a
 * pass may be abandoned after the call and before the write.
 */
public interface LifecycleStep {

    String name();

    boolean appliesTo(LifecycleContext context);

    StepResult apply(LifecycleContext context) throws TransientCollaboratorException;

    /**
     * Disruptive steps reduce availability or membership and are suppressed while the group is halted.
     */
    default boolean isDisruptive() {
        return false;
    }
}
