package io.kvoperator.models;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Resource shape requested for each instance of a group.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class ResourceRequirements {

    @JsonProperty("cpu")
    private String cpu;

    @JsonProperty("memory")
    private String memory;

    @JsonProperty("storage")
    private String storage;
}
