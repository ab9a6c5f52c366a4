package io.kvoperator.enums;

/**
 * Outcome of one lifecycle step.
 */
public enum StepOutcome {
    ADVANCE,
    WAIT,
    FAIL
}
