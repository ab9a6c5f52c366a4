package io.kvoperator.models;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

import java.time.Instant;

/**
 * State reported by the node agent running one instance.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class InstanceActualState {

    @JsonProperty("running")
    private boolean running;

    @JsonProperty("ready")
    private boolean ready;

    @JsonProperty("version")
    private String version;

    @JsonProperty("config_hash")
    private String configHash;

    @JsonProperty("revision")
    private String revision;

    @JsonProperty("address")
    private String address;

    @JsonProperty("restart_count")
    private int restartCount;

    @JsonProperty("last_updated")
    private Instant lastUpdated;
}
