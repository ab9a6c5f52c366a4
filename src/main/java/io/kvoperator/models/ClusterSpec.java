package io.kvoperator.models;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Cluster-wide desired settings shared by all groups.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class ClusterSpec {

    // when set, reconciliation only refreshes status
    @JsonProperty("paused")
    private boolean paused;

    // PD HTTP endpoint used for consensus calls, e.g. http://basic-pd:2379
    @JsonProperty("coordinator_endpoint")
    private String coordinatorEndpoint;

    @JsonProperty("generation")
    private long generation;
}
