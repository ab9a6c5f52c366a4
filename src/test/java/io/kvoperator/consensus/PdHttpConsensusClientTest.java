package io.kvoperator.consensus;

import io.kvoperator.enums.StoreState;
import io.kvoperator.models.ConsensusMember;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.List;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class PdHttpConsensusClientTest {

    private static final String ENDPOINT = "http://basic-pd:2379";

    @Mock
    private HttpClient httpClient;

    @Mock
    private HttpResponse<String> response;

    private PdHttpConsensusClient client;

    @BeforeEach
    void setUp() {
        client = new PdHttpConsensusClient(ENDPOINT + "/", httpClient);
    }

    @Test
    void testEndpointTrailingSlashStripped() {
        assertThat(client.getEndpoint()).isEqualTo(ENDPOINT);
    }

    @Test
    void testParseMembersMarksLeaderAndHealth() throws Exception {
        // Given
        String members = """
            {
              "members": [
                {"name": "basic-pd-0", "member_id": 111, "client_urls": ["http://basic-pd-0:2379"]},
                {"name": "basic-pd-1", "member_id": 222, "client_urls": ["http://basic-pd-1:2379"]},
                {"name": "basic-pd-2", "member_id": 333, "client_urls": []}
              ],
              "leader": {"name": "basic-pd-1", "member_id": 222}
            }
            """;
        String health = """
            [
              {"name": "basic-pd-0", "member_id": 111, "health": true},
              {"name": "basic-pd-1", "member_id": 222, "health": true}
            ]
            """;

        // When
        List<ConsensusMember> parsed = client.parseMembers(members, health);

        // Then
        assertThat(parsed).hasSize(3);
        assertThat(parsed.get(0).getId()).isEqualTo("111");
        assertThat(parsed.get(0).getAddress()).isEqualTo("http://basic-pd-0:2379");
        assertThat(parsed.get(0).isLeader()).isFalse();
        assertThat(parsed.get(1).isLeader()).isTrue();
        assertThat(parsed.get(1).isHealthy()).isTrue();
        assertThat(parsed.get(2).isHealthy()).isFalse();
        assertThat(parsed.get(2).getAddress()).isNull();
    }

    @Test
    void testParseStoresMapsNodeStateAndLeaderCount() throws Exception {
        // Given
        String stores = """
            {
              "count": 3,
              "stores": [
                {"store": {"id": 1, "address": "basic-tikv-0:20160", "state_name": "Up", "node_state": "Serving"},
                 "status": {"leader_count": 42}},
                {"store": {"id": 4, "address": "basic-tikv-1:20160", "state_name": "Offline"},
                 "status": {"leader_count": 0}},
                {"store": {"id": 5, "address": "basic-tikv-2:20160", "state_name": "Tombstone"},
                 "status": {}}
              ]
            }
            """;

        // When
        List<ConsensusMember> parsed = client.parseStores(stores);

        // Then
        assertThat(parsed).extracting(ConsensusMember::getId).containsExactly("1", "4", "5");
        assertThat(parsed).extracting(ConsensusMember::getStoreState)
                .containsExactly(StoreState.SERVING, StoreState.REMOVING, StoreState.REMOVED);
        assertThat(parsed.get(0).getLeaderCount()).isEqualTo(42);
        assertThat(parsed.get(0).isHealthy()).isTrue();
        assertThat(parsed.get(1).isHealthy()).isFalse();
        assertThat(parsed.get(1).getName()).isEqualTo("basic-tikv-1:20160");
    }

    @Test
    void testParseRejectsMalformedJson() {
        assertThatThrownBy(() -> client.parseStores("{not json"))
                .isInstanceOf(ConsensusException.class)
                .hasMessageContaining(ENDPOINT);
    }

    @Test
    void testRemoveStoreTreatsNotFoundAsDone() throws Exception {
        // Given
        when(response.statusCode()).thenReturn(404);
        when(httpClient.<String>send(any(), any())).thenReturn(response);
        ArgumentCaptor<HttpRequest> request = ArgumentCaptor.forClass(HttpRequest.class);

        // When
        client.removeStore("4");

        // Then
        verify(httpClient).send(request.capture(), any());
        assertThat(request.getValue().method()).isEqualTo("DELETE");
        assertThat(request.getValue().uri().toString()).isEqualTo(ENDPOINT + "/pd/api/v1/store/4");
    }

    @Test
    void testTransferLeaderFailsOnErrorStatus() throws Exception {
        // Given
        when(response.statusCode()).thenReturn(500);
        when(response.body()).thenReturn("no leader");
        when(httpClient.<String>send(any(), any())).thenReturn(response);

        // When / Then
        assertThatThrownBy(() -> client.transferLeader("basic-pd-0"))
                .isInstanceOf(ConsensusException.class)
                .hasMessageContaining("/pd/api/v1/leader/transfer/basic-pd-0")
                .hasMessageContaining("500");
    }

    @Test
    void testBeginEvictLeaderPostsScheduler() throws Exception {
        // Given
        when(response.statusCode()).thenReturn(200);
        when(httpClient.<String>send(any(), any())).thenReturn(response);
        ArgumentCaptor<HttpRequest> request = ArgumentCaptor.forClass(HttpRequest.class);

        // When
        client.beginEvictLeader("4");

        // Then
        verify(httpClient).send(request.capture(), any());
        assertThat(request.getValue().method()).isEqualTo("POST");
        assertThat(request.getValue().uri().getPath()).isEqualTo("/pd/api/v1/schedulers");
        assertThat(request.getValue().bodyPublisher()).isPresent();
    }

    @Test
    void testIoFailureWrapped() throws Exception {
        // Given
        when(httpClient.<String>send(any(), any())).thenThrow(new IOException("connection refused"));

        // When / Then
        assertThatThrownBy(() -> client.listStores())
                .isInstanceOf(ConsensusException.class)
                .hasMessageContaining("connection refused")
                .hasCauseInstanceOf(IOException.class);
    }
}
