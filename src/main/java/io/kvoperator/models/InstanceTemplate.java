package io.kvoperator.models;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.kvoperator.enums.ConfigUpdateStrategy;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * Template every instance of a group is started from.
 * The update strategy only decides how a change is rolled out, it is not part of the revision.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class InstanceTemplate {

    @JsonProperty("version")
    private String version;

    @JsonProperty("image")
    private String image;

    @JsonProperty("config")
    private Map<String, Object> config;

    @JsonProperty("resources")
    private ResourceRequirements resources;

    @JsonProperty("config_update_strategy")
    private ConfigUpdateStrategy configUpdateStrategy;

    public ConfigUpdateStrategy effectiveConfigUpdateStrategy() {
        return configUpdateStrategy != null ? configUpdateStrategy : ConfigUpdateStrategy.RESTART;
    }
}
