package io.kvoperator.lifecycle;

import io.kvoperator.enums.StepOutcome;
import io.kvoperator.models.InstanceRecord;
import lombok.Getter;
import lombok.ToString;

/**
 * Result of applying one lifecycle step: the outcome and the record to persist.
 */
@Getter
@ToString
public class StepResult {

    private final StepOutcome outcome;
    private final InstanceRecord record;
    private final String reason;
    private final String message;

    private StepResult(StepOutcome outcome, InstanceRecord record, String reason, String message) {
        this.outcome = outcome;
        this.record = record;
        this.reason = reason;
        this.message = message;
    }

    public static StepResult advance(InstanceRecord record, String reason, String message) {
        return new StepResult(StepOutcome.ADVANCE, record, reason, message);
    }

    public static StepResult waitFor(InstanceRecord record, String reason, String message) {
        return new StepResult(StepOutcome.WAIT, record, reason, message);
    }

    public static StepResult fail(InstanceRecord record, String reason, String message) {
        return new StepResult(StepOutcome.FAIL, record, reason, message);
    }
}
