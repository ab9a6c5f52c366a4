package io.kvoperator.reconcile;

import lombok.Getter;
import lombok.ToString;

import java.time.Duration;
import java.util.Optional;

@Getter
@ToString
public class ReconcileResult {

    private static final ReconcileResult DONE = new ReconcileResult(null);

    // null when the group converged and only the periodic sweep needs to look at it again
    private final Duration requeueAfter;

    private ReconcileResult(Duration requeueAfter) {
        this.requeueAfter = requeueAfter;
    }

    public static ReconcileResult done() {
        return DONE;
    }

    public static ReconcileResult requeueAfter(Duration delay) {
        return new ReconcileResult(delay);
    }

    public Optional<Duration> requeue() {
        return Optional.ofNullable(requeueAfter);
    }
}
