package io.kvoperator.models;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Cluster-level roll-up of all group statuses.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class ClusterStatus {

    @JsonProperty("observed_generation")
    private long observedGeneration;

    @JsonProperty("coordinator_endpoint")
    private String coordinatorEndpoint;

    @JsonProperty("components")
    private List<ComponentStatus> components = new ArrayList<>();

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
