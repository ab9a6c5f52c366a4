package io.kvoperator.enums;

public enum ReplicaActionType {
    CREATE,
    REMOVE,
    CANCEL_REMOVAL
}
