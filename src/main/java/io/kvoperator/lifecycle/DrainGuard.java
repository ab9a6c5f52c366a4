package io.kvoperator.lifecycle;

import lombok.extern.slf4j.Slf4j;

import java.time.Duration;

/**
 * Decides whether an instance has shed its leadership, or waited long enough trying.
 */
@Slf4j
public final class DrainGuard {

    public enum Decision {
        DRAINED,
        TIMED_OUT,
        WAITING
    }

    private DrainGuard() {
    }

    /**
     * Coordinators are drained when they no longer lead; stores when they hold no region leaders.
     */
    public static Decision evaluate(LifecycleContext context) {
        boolean drained = context.isCoordinator()
                ? !context.isLeader()
                : context.getQuorum().leaderCount(context.getRecord(), context.getView()) == 0;
        if (drained) {
            return Decision.DRAINED;
        }

        Duration timeout = context.isCoordinator()
                ? context.getPolicy().leaderTransferTimeout()
                : context.getPolicy().evictionTimeout();
        if (context.getRecord().getTransitionStartedAt() != null
                && context.elapsedInTransition().compareTo(timeout) >= 0) {
            log.warn("[Cluster: {}] Drain of {} timed out after {}, proceeding",
                    context.getClusterId(), context.getRecord().getName(), context.elapsedInTransition());
            return Decision.TIMED_OUT;
        }
        return Decision.WAITING;
    }
}
