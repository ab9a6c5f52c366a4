package io.kvoperator.upgrade;

import io.kvoperator.enums.InstanceState;
import io.kvoperator.models.InstanceRecord;
import io.kvoperator.models.InstanceTemplate;
import lombok.extern.slf4j.Slf4j;

import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Chooses which instance may move to the update revision, one at a time.
 * <p>
 * Highest index goes first. Nothing new is picked while any instance is offlining, upgrading,
 * or waiting for a pushed configuration to show up.
 */
@Slf4j
public class RollingUpgradeSequencer {

    private final RevisionHasher revisionHasher;

    public RollingUpgradeSequencer(RevisionHasher revisionHasher) {
        this.revisionHasher = revisionHasher;
    }

    public UpgradePlan plan(List<InstanceRecord> records, InstanceTemplate template, int stallThresholdPasses) {
        String updateRevision = revisionHasher.revision(template);
        String updateConfigHash = revisionHasher.configHash(template);
        String updateBaseRevision = revisionHasher.baseRevision(template);

        List<InstanceRecord> lagging = records.stream()
                .filter(r -> !r.isMarkedForRemoval())
                .filter(r -> r.getState() == InstanceState.ACTIVE || r.getState() == InstanceState.UPGRADING)
                .filter(r -> !isUpdated(r, template, updateRevision, updateConfigHash))
                .sorted(Comparator.comparingInt(InstanceRecord::getIndex).reversed())
                .collect(Collectors.toList());

        int updatedCount = (int) records.stream()
                .filter(r -> !r.isMarkedForRemoval())
                .filter(r -> isUpdated(r, template, updateRevision, updateConfigHash))
                .count();

        // instances marked for removal still count, an UPGRADING one keeps its slot until it settles
        boolean draining = records.stream().anyMatch(r -> r.getState().isDraining());

        // an upgrade or config push already under way keeps the slot
        Optional<InstanceRecord> current = lagging.stream()
                .filter(r -> r.getState() == InstanceState.UPGRADING
                        || Objects.equals(r.getRevision(), updateRevision))
                .findFirst();

        InstanceRecord selected = null;
        if (current.isPresent()) {
            selected = current.get();
        } else if (!draining) {
            selected = lagging.stream()
                    .filter(r -> r.getState() == InstanceState.ACTIVE)
                    .findFirst()
                    .orElse(null);
        }

        boolean stalled = selected != null && selected.getGuardWaitCount() >= stallThresholdPasses;
        if (stalled) {
            log.warn("Upgrade of {} stalled after {} waiting passes: {}",
                    selected.getName(), selected.getGuardWaitCount(), selected.getLastReason());
        }

        return UpgradePlan.builder()
                .updateRevision(updateRevision)
                .updateConfigHash(updateConfigHash)
                .updateBaseRevision(updateBaseRevision)
                .selectedIndex(selected != null ? selected.getIndex() : null)
                .laggingIndices(lagging.stream().map(InstanceRecord::getIndex).collect(Collectors.toList()))
                .updatedCount(updatedCount)
                .inFlight(draining || current.isPresent())
                .stalled(stalled)
                .build();
    }

    /**
     * Started with the update revision and observed running the template's version and configuration.
     */
    public static boolean isUpdated(InstanceRecord record, InstanceTemplate template,
                                    String updateRevision, String updateConfigHash) {
        return Objects.equals(record.getRevision(), updateRevision)
                && Objects.equals(record.getVersion(), template.getVersion())
                && Objects.equals(record.getConfigHash(), updateConfigHash);
    }
}
