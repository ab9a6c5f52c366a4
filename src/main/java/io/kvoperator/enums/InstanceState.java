package io.kvoperator.enums;

/**
 * Lifecycle state of a single instance.
 *
 * <ul>
 *   <li><strong>PENDING</strong> - record exists, workload not requested yet</li>
 *   <li><strong>JOINING</strong> - workload requested, waiting for readiness and consensus registration</li>
 *   <li><strong>ACTIVE</strong> - serving and registered</li>
 *   <li><strong>UPGRADING</strong> - draining or restarting with a new revision</li>
 *   <li><strong>OFFLINING</strong> - draining before removal</li>
 *   <li><strong>REMOVABLE</strong> - safe to remove from consensus and delete</li>
 *   <li><strong>REMOVED</strong> - terminal, record about to be deleted</li>
 * </ul>
 */
public enum InstanceState {
    PENDING,
    JOINING,
    ACTIVE,
    UPGRADING,
    OFFLINING,
    REMOVABLE,
    REMOVED;

    /**
     * States in which the instance's leadership or data is being moved away.
     */
    public boolean isDraining() {
        return this == UPGRADING || this == OFFLINING;
    }
}
