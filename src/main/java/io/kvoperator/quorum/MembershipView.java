package io.kvoperator.quorum;

import io.kvoperator.enums.InstanceRole;
import io.kvoperator.models.ConsensusMember;
import io.kvoperator.models.InstanceRecord;
import lombok.Getter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Membership of one group as read from the consensus API at the start of a pass.
 * Never reused across passes.
 */
@Getter
public class MembershipView {

    private final InstanceRole role;
    private final List<ConsensusMember> members;
    private final List<String> anomalies;

    public MembershipView(InstanceRole role, List<ConsensusMember> members) {
        this.role = role;
        this.members = members == null ? List.of() : List.copyOf(members);
        this.anomalies = Collections.unmodifiableList(detectAnomalies());
    }

    public static MembershipView empty(InstanceRole role) {
        return new MembershipView(role, List.of());
    }

    /**
     * Finds the member backing {@code record}: by consensus id, then by instance name, then by address.
     */
    public Optional<ConsensusMember> find(InstanceRecord record) {
        if (record.getMemberId() != null) {
            Optional<ConsensusMember> byId = members.stream()
                    .filter(m -> record.getMemberId().equals(m.getId()))
                    .findFirst();
            if (byId.isPresent()) {
                return byId;
            }
        }
        Optional<ConsensusMember> byName = members.stream()
                .filter(m -> Objects.equals(record.getName(), m.getName()))
                .findFirst();
        if (byName.isPresent() || record.getAddress() == null) {
            return byName;
        }
        return members.stream()
                .filter(m -> record.getAddress().equals(m.getAddress()))
                .findFirst();
    }

    public int size() {
        return members.size();
    }

    public int liveCount() {
        return (int) members.stream().filter(ConsensusMember::isHealthy).count();
    }

    public List<ConsensusMember> leaders() {
        return members.stream().filter(ConsensusMember::isLeader).collect(Collectors.toList());
    }

    public boolean hasMultipleLeaders() {
        return role == InstanceRole.COORDINATOR && leaders().size() > 1;
    }

    /**
     * Whether the current configuration has a live majority.
     */
    public boolean hasQuorum() {
        return liveCount() >= size() / 2 + 1;
    }

    public boolean hasAnomalies() {
        return !anomalies.isEmpty();
    }

    private List<String> detectAnomalies() {
        List<String> found = new ArrayList<>();
        if (hasMultipleLeaders()) {
            found.add("multiple leaders reported: " + leaders().stream()
                    .map(ConsensusMember::getName)
                    .collect(Collectors.joining(", ")));
        }
        return found;
    }
}
