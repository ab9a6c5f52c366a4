package io.kvoperator.models;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.kvoperator.enums.ConfigUpdateStrategy;
import lombok.Data;

import java.time.Instant;

/**
 * Goal state published for the node agent that runs one instance.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class InstanceGoalState {

    @JsonProperty("group")
    private String group;

    @JsonProperty("index")
    private int index;

    @JsonProperty("revision")
    private String revision;

    @JsonProperty("config_hash")
    private String configHash;

    @JsonProperty("template")
    private InstanceTemplate template;

    // HOT_RELOAD lets the agent apply a config-only change without a restart
    @JsonProperty("config_update_strategy")
    private ConfigUpdateStrategy configUpdateStrategy;

    @JsonProperty("last_updated")
    private Instant lastUpdated;
}
