package io.kvoperator.models;

import io.kvoperator.enums.StoreState;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A coordinator member or a store as reported by the consensus API.
 * For coordinators {@code id} is the Raft member id, for stores the store id.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class ConsensusMember {
    private String id;
    private String name;
    private String address;
    private boolean healthy;
    private boolean leader;
    private int leaderCount;
    private StoreState storeState;
}
