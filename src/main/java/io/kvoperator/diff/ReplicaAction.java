package io.kvoperator.diff;

import io.kvoperator.enums.ReplicaActionType;
import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;

/**
 * One change to the replica set of a group.
 */
@Getter
@AllArgsConstructor
@EqualsAndHashCode
public class ReplicaAction {

    private final ReplicaActionType type;
    private final int index;

    public static ReplicaAction create(int index) {
        return new ReplicaAction(ReplicaActionType.CREATE, index);
    }

    public static ReplicaAction remove(int index) {
        return new ReplicaAction(ReplicaActionType.REMOVE, index);
    }

    public static ReplicaAction cancelRemoval(int index) {
        return new ReplicaAction(ReplicaActionType.CANCEL_REMOVAL, index);
    }

    @Override
    public String toString() {
        return type + "(" + index + ")";
    }
}
