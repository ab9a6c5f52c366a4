package io.kvoperator.lifecycle;

import io.kvoperator.enums.StepOutcome;
import io.kvoperator.models.InstanceRecord;
import io.kvoperator.quorum.MembershipView;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

/**
 * What one lifecycle pass did to one instance.
 */
@Getter
@AllArgsConstructor
@ToString(exclude = "view")
public class LifecyclePassResult {

    // latest record, REMOVED once the record has been deleted
    private final InstanceRecord record;

    // mod revision of the stored record, 0 once deleted
    private final long modRevision;

    // outcome of the last step applied, null when no step applied
    private final StepOutcome lastOutcome;

    private final int transitions;

    // true when the pass stopped at the transition limit with work left
    private final boolean truncated;

    // membership as last read during the pass
    private final MembershipView view;

    public boolean needsRecheck() {
        return truncated || lastOutcome == StepOutcome.WAIT || lastOutcome == StepOutcome.FAIL;
    }

    public boolean isRemoved() {
        return modRevision == 0;
    }
}
