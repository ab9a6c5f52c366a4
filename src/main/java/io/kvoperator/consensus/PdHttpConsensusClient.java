package io.kvoperator.consensus;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.kvoperator.enums.StoreState;
import io.kvoperator.models.ConsensusMember;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * ConsensusClient speaking the PD HTTP API.
 */
@Slf4j
public class PdHttpConsensusClient implements ConsensusClient {

    static final String API_PREFIX = "/pd/api/v1";
    static final String EVICT_LEADER_SCHEDULER = "evict-leader-scheduler";

    private static final Duration REQUEST_TIMEOUT = Duration.ofSeconds(10);

    private final String endpoint;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;

    public PdHttpConsensusClient(String endpoint) {
        this(endpoint, HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(5))
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build());
    }

    PdHttpConsensusClient(String endpoint, HttpClient httpClient) {
        this.endpoint = stripTrailingSlash(endpoint);
        this.httpClient = httpClient;
        this.objectMapper = new ObjectMapper();
    }

    public String getEndpoint() {
        return endpoint;
    }

    // =================================================================
    // QUERIES
    // =================================================================

    @Override
    public List<ConsensusMember> listMembers() throws ConsensusException {
        String members = send("GET", "/members", null, false);
        String health = send("GET", "/health", null, false);
        return parseMembers(members, health);
    }

    @Override
    public List<ConsensusMember> listStores() throws ConsensusException {
        // include offline and tombstone stores so removals can be observed to completion
        return parseStores(send("GET", "/stores?state=0&state=1&state=2", null, false));
    }

    // =================================================================
    // MUTATIONS
    // =================================================================

    @Override
    public void transferLeader(String targetMemberName) throws ConsensusException {
        log.info("Transferring coordinator leadership to {} via {}", targetMemberName, endpoint);
        send("POST", "/leader/transfer/" + targetMemberName, null, false);
    }

    @Override
    public void beginEvictLeader(String storeId) throws ConsensusException {
        log.info("Adding evict-leader scheduler for store {}", storeId);
        Map<String, Object> body = new HashMap<>();
        body.put("name", EVICT_LEADER_SCHEDULER);
        body.put("store_id", Long.parseLong(storeId));
        send("POST", "/schedulers", writeJson(body), false);
    }

    @Override
    public void endEvictLeader(String storeId) throws ConsensusException {
        log.info("Removing evict-leader scheduler for store {}", storeId);
        send("DELETE", "/schedulers/" + EVICT_LEADER_SCHEDULER + "-" + storeId, null, true);
    }

    @Override
    public void removeMember(String memberName) throws ConsensusException {
        log.info("Removing coordinator member {}", memberName);
        send("DELETE", "/members/name/" + memberName, null, true);
    }

    @Override
    public void removeStore(String storeId) throws ConsensusException {
        log.info("Offlining store {}", storeId);
        send("DELETE", "/store/" + storeId, null, true);
    }

    @Override
    public void cancelStoreRemoval(String storeId) throws ConsensusException {
        log.info("Canceling offline of store {}", storeId);
        send("POST", "/store/" + storeId + "/state?state=Up", null, false);
    }

    // =================================================================
    // RESPONSE PARSING
    // =================================================================

    List<ConsensusMember> parseMembers(String membersJson, String healthJson) throws ConsensusException {
        try {
            JsonNode root = objectMapper.readTree(membersJson);
            String leaderName = root.path("leader").path("name").asText(null);

            Map<String, Boolean> healthByName = new HashMap<>();
            JsonNode health = objectMapper.readTree(healthJson);
            for (JsonNode h : health) {
                healthByName.put(h.path("name").asText(), h.path("health").asBoolean(false));
            }

            List<ConsensusMember> members = new ArrayList<>();
            for (JsonNode m : root.path("members")) {
                String name = m.path("name").asText();
                JsonNode clientUrls = m.path("client_urls");
                members.add(ConsensusMember.builder()
                        .id(m.path("member_id").asText())
                        .name(name)
                        .address(clientUrls.size() > 0 ? clientUrls.get(0).asText() : null)
                        .healthy(healthByName.getOrDefault(name, false))
                        .leader(name.equals(leaderName))
                        .build());
            }
            return members;
        } catch (IOException e) {
            throw new ConsensusException("Failed to parse member list from " + endpoint, e);
        }
    }

    List<ConsensusMember> parseStores(String storesJson) throws ConsensusException {
        try {
            JsonNode root = objectMapper.readTree(storesJson);
            List<ConsensusMember> stores = new ArrayList<>();
            for (JsonNode entry : root.path("stores")) {
                JsonNode store = entry.path("store");
                String stateName = store.path("state_name").asText("");
                StoreState state = StoreState.fromString(store.path("node_state").asText(null));
                if (state == null) {
                    state = StoreState.fromString(stateName);
                }
                stores.add(ConsensusMember.builder()
                        .id(store.path("id").asText())
                        .name(store.path("address").asText())
                        .address(store.path("address").asText())
                        .healthy("Up".equalsIgnoreCase(stateName))
                        .leaderCount(entry.path("status").path("leader_count").asInt(0))
                        .storeState(state)
                        .build());
            }
            return stores;
        } catch (IOException e) {
            throw new ConsensusException("Failed to parse store list from " + endpoint, e);
        }
    }

    // =================================================================
    // HTTP
    // =================================================================

    private String send(String method, String path, String body, boolean notFoundIsSuccess) throws ConsensusException {
        String url = endpoint + API_PREFIX + path;
        HttpRequest.Builder builder = HttpRequest.newBuilder()
                .uri(URI.create(url))
                .timeout(REQUEST_TIMEOUT)
                .header("Content-Type", "application/json");
        if (body != null) {
            builder.method(method, HttpRequest.BodyPublishers.ofString(body));
        } else {
            builder.method(method, HttpRequest.BodyPublishers.noBody());
        }

        HttpResponse<String> response;
        try {
            response = httpClient.send(builder.build(), HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new ConsensusException("Failed to call " + method + " " + url + ": " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ConsensusException("Interrupted calling " + method + " " + url, e);
        }

        int status = response.statusCode();
        if (status == 404 && notFoundIsSuccess) {
            log.debug("{} {} returned 404, treating as already done", method, url);
            return "";
        }
        if (status < 200 || status >= 300) {
            throw new ConsensusException(method + " " + url + " returned " + status + ": " + response.body());
        }
        return response.body();
    }

    private String writeJson(Object body) throws ConsensusException {
        try {
            return objectMapper.writeValueAsString(body);
        } catch (IOException e) {
            throw new ConsensusException("Failed to encode request body", e);
        }
    }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
