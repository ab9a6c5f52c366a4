package io.kvoperator.upgrade;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.util.List;
import java.util.Optional;

/**
 * Outcome of one sequencing decision for a group.
 */
@Getter
@Builder
@ToString
public class UpgradePlan {

    private final String updateRevision;
    private final String updateConfigHash;
    private final String updateBaseRevision;

    // index allowed to change revision in this pass, if any
    private final Integer selectedIndex;

    // instances not yet running the update revision, highest index first
    private final List<Integer> laggingIndices;

    private final int updatedCount;

    // an instance is draining, restarting or reloading
    private final boolean inFlight;

    private final boolean stalled;

    public Optional<Integer> selected() {
        return Optional.ofNullable(selectedIndex);
    }

    public boolean isSelected(int index) {
        return selectedIndex != null && selectedIndex == index;
    }

    /**
     * No instance lags and nothing is in flight, so the current revision may advance.
     */
    public boolean isComplete() {
        return laggingIndices.isEmpty() && !inFlight;
    }
}
