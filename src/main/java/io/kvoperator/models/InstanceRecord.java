package io.kvoperator.models;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.kvoperator.enums.InstanceRole;
import io.kvoperator.enums.InstanceState;
import io.kvoperator.enums.StepOutcome;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Persisted orchestration record of one logical instance, keyed by its stable index.
 * Observation fields are refreshed at the start of every pass; the rest is orchestration state.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class InstanceRecord {

    @JsonProperty("index")
    private int index;

    @JsonProperty("name")
    private String name;

    @JsonProperty("role")
    private InstanceRole role;

    @JsonProperty("state")
    private InstanceState state;

    // revision the workload was last started with
    @JsonProperty("revision")
    private String revision;

    // revision of the template without its configuration, to tell config-only changes apart
    @JsonProperty("base_revision")
    private String baseRevision;

    @JsonProperty("version")
    private String version;

    @JsonProperty("config_hash")
    private String configHash;

    @JsonProperty("member_id")
    private String memberId;

    @JsonProperty("address")
    private String address;

    @JsonProperty("leader")
    private boolean leader;

    @JsonProperty("leader_count")
    private int leaderCount;

    @JsonProperty("data_migrating")
    private boolean dataMigrating;

    @JsonProperty("evicting")
    private boolean evicting;

    @JsonProperty("marked_for_removal")
    private boolean markedForRemoval;

    @JsonProperty("target_revision")
    private String targetRevision;

    @JsonProperty("restart_issued")
    private boolean restartIssued;

    @JsonProperty("transition_started_at")
    private Instant transitionStartedAt;

    @JsonProperty("guard_wait_count")
    private int guardWaitCount;

    @JsonProperty("observed_ready")
    private boolean observedReady;

    @JsonProperty("registered")
    private boolean registered;

    @JsonProperty("restart_count")
    private int restartCount;

    @JsonProperty("last_outcome")
    private StepOutcome lastOutcome;

    @JsonProperty("last_reason")
    private String lastReason;

    @JsonProperty("last_message")
    private String lastMessage;

    @JsonProperty("created_at")
    private Instant createdAt;

    @JsonProperty("last_updated")
    private Instant lastUpdated;

    /**
     * Instance name as registered with the coordinator, e.g. {@code basic-pd-2}.
     */
    public static String nameFor(String group, InstanceRole role, int index) {
        return group + "-" + role.getShortName() + "-" + index;
    }

    public static InstanceRecord pending(String group, InstanceRole role, int index, Instant now) {
        return InstanceRecord.builder()
                .index(index)
                .name(nameFor(group, role, index))
                .role(role)
                .state(InstanceState.PENDING)
                .createdAt(now)
                .lastUpdated(now)
                .build();
    }
}
