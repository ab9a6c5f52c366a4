package io.kvoperator.models;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.kvoperator.enums.InstanceRole;
import lombok.Data;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Observed status of a replica group. Derived from instance records, never edited by hand.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class GroupStatus {

    @JsonProperty("name")
    private String name;

    @JsonProperty("role")
    private InstanceRole role;

    @JsonProperty("observed_generation")
    private long observedGeneration;

    @JsonProperty("replicas")
    private int replicas;

    @JsonProperty("ready_replicas")
    private int readyReplicas;

    @JsonProperty("current_replicas")
    private int currentReplicas;

    @JsonProperty("updated_replicas")
    private int updatedReplicas;

    @JsonProperty("current_revision")
    private String currentRevision;

    @JsonProperty("update_revision")
    private String updateRevision;

    @JsonProperty("version")
    private String version;

    @JsonProperty("leader")
    private String leader;

    @JsonProperty("conditions")
    private List<Condition> conditions = new ArrayList<>();

    @JsonProperty("last_updated")
    private Instant lastUpdated;

    public Optional<Condition> findCondition(String type) {
        if (conditions == null) {
            return Optional.empty();
        }
        return conditions.stream().filter(c -> type.equals(c.getType())).findFirst();
    }
}
