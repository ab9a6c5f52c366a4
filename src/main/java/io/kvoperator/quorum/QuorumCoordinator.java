package io.kvoperator.quorum;

import io.kvoperator.consensus.ConsensusClient;
import io.kvoperator.consensus.ConsensusException;
import io.kvoperator.enums.InstanceRole;
import io.kvoperator.enums.InstanceState;
import io.kvoperator.models.ConsensusMember;
import io.kvoperator.models.InstanceRecord;
import lombok.extern.slf4j.Slf4j;

import java.util.Collection;
import java.util.Comparator;
import java.util.Optional;

/**
 * Answers membership and leadership questions for one group and issues the consensus
 * operations that move leadership or data away from an instance.
 * <p>
 * Nothing is cached: every decision is made against a {@link MembershipView} read in the
 * current pass.
 */
@Slf4j
public class QuorumCoordinator {

    private final ConsensusClient consensusClient;

    public QuorumCoordinator(ConsensusClient consensusClient) {
        this.consensusClient = consensusClient;
    }

    /**
     * Reads the current membership of a group.
     */
    public MembershipView inspect(InstanceRole role) throws ConsensusException {
        MembershipView view = role == InstanceRole.COORDINATOR
                ? new MembershipView(role, consensusClient.listMembers())
                : new MembershipView(role, consensusClient.listStores());
        if (view.hasAnomalies()) {
            log.warn("Membership anomalies for {} group: {}", role, view.getAnomalies());
        }
        return view;
    }

    /**
     * Whether removing {@code target} still leaves a live majority of the observed membership:
     * {@code live - 1 >= floor(N/2) + 1}. The observed member count and live count are used, never
     * the desired replica count. Stores do not vote, so removing one never costs quorum.
     */
    public boolean safeToRemove(InstanceRecord target, MembershipView view) {
        if (view.getRole() != InstanceRole.COORDINATOR) {
            return true;
        }

        if (view.find(target).isEmpty()) {
            // not part of the configuration, removing it changes nothing
            return true;
        }

        int n = view.size();
        int live = view.liveCount();
        boolean safe = live - 1 >= n / 2 + 1;

        log.debug("Quorum check for {}: members={}, live={}, safe={}", target.getName(), n, live, safe);
        return safe;
    }

    /**
     * Moves coordinator leadership away from {@code from} to the lowest-index healthy,
     * non-leader, active peer.
     *
     * @return the peer leadership was handed to
     */
    public InstanceRecord transferLeadership(InstanceRecord from, Collection<InstanceRecord> peers, MembershipView view)
            throws ConsensusException, NoTransferTargetException {
        Optional<InstanceRecord> target = transferTarget(from, peers, view);
        if (target.isEmpty()) {
            throw new NoTransferTargetException("No healthy active peer to take leadership from " + from.getName());
        }

        String targetName = view.find(target.get()).map(ConsensusMember::getName).orElse(target.get().getName());
        log.info("Transferring leadership from {} to {}", from.getName(), targetName);
        consensusClient.transferLeader(targetName);
        return target.get();
    }

    /**
     * The peer {@link #transferLeadership} would pick, without asking for the transfer.
     */
    public Optional<InstanceRecord> transferTarget(InstanceRecord from, Collection<InstanceRecord> peers, MembershipView view) {
        return peers.stream()
                .filter(p -> p.getIndex() != from.getIndex())
                .filter(p -> p.getState() == InstanceState.ACTIVE && !p.isMarkedForRemoval())
                .filter(p -> view.find(p).map(m -> m.isHealthy() && !m.isLeader()).orElse(false))
                .min(Comparator.comparingInt(InstanceRecord::getIndex));
    }

    /**
     * Region leaders on a store, or 1/0 for a coordinator holding leadership.
     */
    public int leaderCount(InstanceRecord instance, MembershipView view) {
        return view.find(instance)
                .map(m -> view.getRole() == InstanceRole.COORDINATOR ? (m.isLeader() ? 1 : 0) : m.getLeaderCount())
                .orElse(0);
    }

    public void beginEvict(InstanceRecord instance) throws ConsensusException {
        log.info("Begin evicting leaders from {} (store {})", instance.getName(), instance.getMemberId());
        consensusClient.beginEvictLeader(instance.getMemberId());
    }

    public void endEvict(InstanceRecord instance) throws ConsensusException {
        log.info("End evicting leaders from {} (store {})", instance.getName(), instance.getMemberId());
        consensusClient.endEvictLeader(instance.getMemberId());
    }

    /**
     * Starts offlining a store; its data migrates away until the store is tombstoned.
     */
    public void offlineStore(InstanceRecord instance) throws ConsensusException {
        log.info("Offlining store {} of {}", instance.getMemberId(), instance.getName());
        consensusClient.removeStore(instance.getMemberId());
    }

    public void cancelOffline(InstanceRecord instance) throws ConsensusException {
        log.info("Canceling offline of store {} of {}", instance.getMemberId(), instance.getName());
        consensusClient.cancelStoreRemoval(instance.getMemberId());
    }

    /**
     * Removes a coordinator from the Raft configuration. Absent members are ignored.
     */
    public void removeMember(InstanceRecord instance, MembershipView view) throws ConsensusException {
        Optional<ConsensusMember> member = view.find(instance);
        if (member.isEmpty()) {
            log.debug("{} is not a coordinator member, nothing to remove", instance.getName());
            return;
        }
        log.info("Removing coordinator member {}", member.get().getName());
        consensusClient.removeMember(member.get().getName());
    }
}
