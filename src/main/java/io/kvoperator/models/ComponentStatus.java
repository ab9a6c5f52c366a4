package io.kvoperator.models;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class ComponentStatus {

    @JsonProperty("kind")
    private String kind;

    @JsonProperty("replicas")
    private int replicas;

    @JsonProperty("ready_replicas")
    private int readyReplicas;
}
