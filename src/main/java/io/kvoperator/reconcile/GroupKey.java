package io.kvoperator.reconcile;

import lombok.EqualsAndHashCode;
import lombok.Getter;

/**
 * Identifies one unit of reconciliation work.
 */
@Getter
@EqualsAndHashCode
public class GroupKey {

    private final String clusterId;
    private final String group;

    public GroupKey(String clusterId, String group) {
        this.clusterId = clusterId;
        this.group = group;
    }

    @Override
    public String toString() {
        return clusterId + "/" + group;
    }
}
