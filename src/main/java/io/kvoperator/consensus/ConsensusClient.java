package io.kvoperator.consensus;

import io.kvoperator.models.ConsensusMember;

import java.util.List;

/**
 * Narrow interface to the coordinator's membership and scheduling API.
 * Mutating calls are idempotent: repeating them, or applying them to a member that is already
 * in the requested state, succeeds.
 */
public interface ConsensusClient {

    /**
     * Coordinator members with health and leadership.
     */
    List<ConsensusMember> listMembers() throws ConsensusException;

    /**
     * Stores with state and region leader count.
     */
    List<ConsensusMember> listStores() throws ConsensusException;

    void transferLeader(String targetMemberName) throws ConsensusException;

    void beginEvictLeader(String storeId) throws ConsensusException;

    void endEvictLeader(String storeId) throws ConsensusException;

    void removeMember(String memberName) throws ConsensusException;

    /**
     * Starts offlining a store. Data migrates away until the store reaches the removed state.
     */
    void removeStore(String storeId) throws ConsensusException;

    /**
     * Returns a store that is being offlined to serving.
     */
    void cancelStoreRemoval(String storeId) throws ConsensusException;
}
