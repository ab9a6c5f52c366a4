package io.kvoperator.models;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * What the workload runtime currently reports about one instance.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class InstanceObservation {
    private boolean exists;
    private boolean running;
    private boolean ready;
    private String version;
    private String configHash;
    private String revision;
    private String address;
    private int restartCount;

    public static InstanceObservation absent() {
        return new InstanceObservation();
    }
}
