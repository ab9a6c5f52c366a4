package io.kvoperator.quorum;

import io.kvoperator.enums.InstanceRole;
import io.kvoperator.models.ConsensusMember;
import io.kvoperator.models.InstanceRecord;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

class MembershipViewTest {

    @Test
    void testFindPrefersMemberId() {
        MembershipView view = new MembershipView(InstanceRole.COORDINATOR, List.of(
                member("m-1", "basic-pd-0", true, false),
                member("m-2", "basic-pd-1", true, false)));
        InstanceRecord record = InstanceRecord.builder().name("basic-pd-0").memberId("m-2").build();

        assertThat(view.find(record)).map(ConsensusMember::getId).contains("m-2");
    }

    @Test
    void testFindFallsBackToNameThenAddress() {
        ConsensusMember store = ConsensusMember.builder()
                .id("4").name("basic-tikv-0:20160").address("basic-tikv-0:20160").healthy(true).build();
        MembershipView view = new MembershipView(InstanceRole.STORE, List.of(store));

        InstanceRecord byAddress = InstanceRecord.builder().name("basic-tikv-0").address("basic-tikv-0:20160").build();
        InstanceRecord unknown = InstanceRecord.builder().name("basic-tikv-1").build();

        assertThat(view.find(byAddress)).contains(store);
        assertThat(view.find(unknown)).isEmpty();
    }

    @Test
    void testQuorumArithmetic() {
        MembershipView healthy = new MembershipView(InstanceRole.COORDINATOR, List.of(
                member("1", "a", true, true), member("2", "b", true, false), member("3", "c", false, false)));
        MembershipView degraded = new MembershipView(InstanceRole.COORDINATOR, List.of(
                member("1", "a", true, true), member("2", "b", false, false), member("3", "c", false, false)));

        assertThat(healthy.size()).isEqualTo(3);
        assertThat(healthy.liveCount()).isEqualTo(2);
        assertThat(healthy.hasQuorum()).isTrue();
        assertThat(degraded.hasQuorum()).isFalse();
    }

    @Test
    void testMultipleLeadersIsAnAnomaly() {
        MembershipView view = new MembershipView(InstanceRole.COORDINATOR, List.of(
                member("1", "basic-pd-0", true, true), member("2", "basic-pd-1", true, true)));

        assertThat(view.hasMultipleLeaders()).isTrue();
        assertThat(view.hasAnomalies()).isTrue();
        assertThat(view.getAnomalies()).hasSize(1);
        assertThat(view.getAnomalies().get(0)).contains("basic-pd-0", "basic-pd-1");
    }

    @Test
    void testStoresNeverReportMultipleLeaders() {
        MembershipView view = new MembershipView(InstanceRole.STORE, List.of(
                ConsensusMember.builder().id("1").leader(true).build(),
                ConsensusMember.builder().id("2").leader(true).build()));

        assertThat(view.hasAnomalies()).isFalse();
    }

    @Test
    void testEmptyView() {
        MembershipView view = MembershipView.empty(InstanceRole.COORDINATOR);

        assertThat(view.size()).isZero();
        assertThat(view.leaders()).isEmpty();
        assertThat(view.hasAnomalies()).isFalse();
    }

    private static ConsensusMember member(String id, String name, boolean healthy, boolean leader) {
        return ConsensusMember.builder().id(id).name(name).healthy(healthy).leader(leader).build();
    }
}
