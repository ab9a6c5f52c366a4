package io.kvoperator.models;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.kvoperator.enums.InstanceRole;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Desired state of one replica group, edited by operators through the REST API.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class DesiredSpec {

    @JsonProperty("name")
    private String name;

    @JsonProperty("role")
    private InstanceRole role;

    @JsonProperty("replicas")
    private int replicas;

    @JsonProperty("template")
    private InstanceTemplate template;

    @JsonProperty("policy")
    private OrchestrationPolicy policy;

    @JsonProperty("generation")
    private long generation;
}
