package io.kvoperator.diff;

import io.kvoperator.enums.InstanceState;
import io.kvoperator.models.InstanceRecord;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Computes the replica actions that move an observed instance set toward a desired count.
 * <p>
 * Output order: removals and cancellations first, highest index first, then creations in
 * ascending index order. The plan is idempotent: applying it and diffing again yields nothing.
 */
public class DiffEngine {

    public List<ReplicaAction> plan(int desiredReplicas, Collection<InstanceRecord> observed) {
        if (desiredReplicas < 0) {
            throw new IllegalArgumentException("Desired replicas must not be negative: " + desiredReplicas);
        }

        Map<Integer, InstanceRecord> byIndex = observed.stream()
                .collect(Collectors.toMap(InstanceRecord::getIndex, Function.identity()));
        List<Integer> descending = byIndex.keySet().stream()
                .sorted(Comparator.reverseOrder())
                .collect(Collectors.toList());

        List<ReplicaAction> actions = new ArrayList<>();

        for (int index : descending) {
            InstanceRecord record = byIndex.get(index);
            if (index >= desiredReplicas) {
                if (!record.isMarkedForRemoval()) {
                    actions.add(ReplicaAction.remove(index));
                }
            } else if (record.isMarkedForRemoval() && isCancelable(record)) {
                actions.add(ReplicaAction.cancelRemoval(index));
            }
        }

        // indices are not reused while a higher peer is still on its way out
        int highestPendingRemoval = descending.stream()
                .filter(i -> i >= desiredReplicas || byIndex.get(i).isMarkedForRemoval() && !isCancelable(byIndex.get(i)))
                .findFirst()
                .orElse(-1);

        for (int index = 0; index < desiredReplicas; index++) {
            if (!byIndex.containsKey(index) && index > highestPendingRemoval) {
                actions.add(ReplicaAction.create(index));
            }
        }
        return actions;
    }

    /**
     * A removal can be called off until the instance is cleared for deletion.
     */
    static boolean isCancelable(InstanceRecord record) {
        return record.getState() != InstanceState.REMOVABLE && record.getState() != InstanceState.REMOVED;
    }
}
