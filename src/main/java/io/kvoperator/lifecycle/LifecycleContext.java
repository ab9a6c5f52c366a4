package io.kvoperator.lifecycle;

import io.kvoperator.enums.InstanceRole;
import io.kvoperator.models.ConsensusMember;
import io.kvoperator.models.DesiredSpec;
import io.kvoperator.models.InstanceObservation;
import io.kvoperator.models.InstanceRecord;
import io.kvoperator.models.InstanceTemplate;
import io.kvoperator.models.OrchestrationPolicy;
import io.kvoperator.quorum.MembershipView;
import io.kvoperator.quorum.QuorumCoordinator;
import io.kvoperator.runtime.WorkloadRuntime;
import lombok.Builder;
import lombok.Getter;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable snapshot one lifecycle step is evaluated against.
 */
@Getter
@Builder(toBuilder = true)
public class LifecycleContext {

    private final String clusterId;
    private final DesiredSpec spec;
    private final InstanceRecord record;
    private final List<InstanceRecord> peers;
    private final InstanceObservation observation;
    private final MembershipView view;
    private final OrchestrationPolicy policy;

    private final String updateRevision;
    private final String updateConfigHash;
    private final String updateBaseRevision;
    private final boolean selectedForUpgrade;

    // an invariant violation was observed on the group, disruptive steps must not run
    private final boolean halted;

    private final Instant now;

    private final WorkloadRuntime runtime;
    private final QuorumCoordinator quorum;

    public String getGroup() {
        return spec.getName();
    }

    public InstanceRole getRole() {
        return spec.getRole();
    }

    public InstanceTemplate getTemplate() {
        return spec.getTemplate();
    }

    public boolean isCoordinator() {
        return spec.getRole() == InstanceRole.COORDINATOR;
    }

    public Optional<ConsensusMember> member() {
        return view.find(record);
    }

    public boolean isRegistered() {
        return member().isPresent();
    }

    public boolean isLeader() {
        return member().map(ConsensusMember::isLeader).orElse(false);
    }

    /**
     * Time since the current drain or restart started, zero when none is recorded.
     */
    public Duration elapsedInTransition() {
        if (record.getTransitionStartedAt() == null) {
            return Duration.ZERO;
        }
        return Duration.between(record.getTransitionStartedAt(), now);
    }

    /**
     * The pending template change only touches configuration and may be reloaded in place.
     */
    public boolean isConfigOnlyChange() {
        return record.getBaseRevision() != null
                && record.getBaseRevision().equals(updateBaseRevision)
                && Objects.equals(record.getVersion(), getTemplate().getVersion());
    }

    /**
     * The instance already runs the update revision with the expected version and configuration.
     */
    public boolean isUpToDate() {
        return Objects.equals(record.getRevision(), updateRevision)
                && Objects.equals(record.getVersion(), getTemplate().getVersion())
                && Objects.equals(record.getConfigHash(), updateConfigHash);
    }

    public boolean isCrashLooping() {
        return observation.getRestartCount() >= policy.getCrashLoopRestartThreshold();
    }
}
