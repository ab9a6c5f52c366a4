package io.kvoperator.models;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

import java.time.Duration;

/**
 * Timeouts and thresholds that govern how aggressively a group is driven.
 * On a group spec every field is an optional override of the configured default.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class OrchestrationPolicy {

    @JsonProperty("leader_transfer_timeout_seconds")
    private Long leaderTransferTimeoutSeconds;

    @JsonProperty("eviction_timeout_seconds")
    private Long evictionTimeoutSeconds;

    @JsonProperty("stall_threshold_passes")
    private Integer stallThresholdPasses;

    @JsonProperty("crash_loop_restart_threshold")
    private Integer crashLoopRestartThreshold;

    @JsonProperty("max_transitions_per_pass")
    private Integer maxTransitionsPerPass;

    /**
     * Returns a policy where every field set on {@code override} replaces the value of this one.
     */
    public OrchestrationPolicy overriddenBy(OrchestrationPolicy override) {
        OrchestrationPolicy merged = new OrchestrationPolicy();
        merged.leaderTransferTimeoutSeconds = pick(override == null ? null : override.leaderTransferTimeoutSeconds, leaderTransferTimeoutSeconds);
        merged.evictionTimeoutSeconds = pick(override == null ? null : override.evictionTimeoutSeconds, evictionTimeoutSeconds);
        merged.stallThresholdPasses = pick(override == null ? null : override.stallThresholdPasses, stallThresholdPasses);
        merged.crashLoopRestartThreshold = pick(override == null ? null : override.crashLoopRestartThreshold, crashLoopRestartThreshold);
        merged.maxTransitionsPerPass = pick(override == null ? null : override.maxTransitionsPerPass, maxTransitionsPerPass);
        return merged;
    }

    public Duration leaderTransferTimeout() {
        return Duration.ofSeconds(leaderTransferTimeoutSeconds);
    }

    public Duration evictionTimeout() {
        return Duration.ofSeconds(evictionTimeoutSeconds);
    }

    private static <T> T pick(T preferred, T fallback) {
        return preferred != null ? preferred : fallback;
    }
}
