package io.kvoperator.consensus;

import lombok.extern.slf4j.Slf4j;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

/**
 * Hands out one consensus client per coordinator endpoint.
 */
@Slf4j
public class ConsensusClientFactory {

    private final Function<String, ConsensusClient> clientCreator;
    private final Map<String, ConsensusClient> clients = new ConcurrentHashMap<>();

    public ConsensusClientFactory() {
        this(PdHttpConsensusClient::new);
    }

    public ConsensusClientFactory(Function<String, ConsensusClient> clientCreator) {
        this.clientCreator = clientCreator;
    }

    public ConsensusClient forEndpoint(String endpoint) {
        if (endpoint == null || endpoint.isBlank()) {
            throw new IllegalArgumentException("Coordinator endpoint must not be empty");
        }
        return clients.computeIfAbsent(endpoint, e -> {
            log.info("Creating consensus client for coordinator endpoint {}", e);
            return clientCreator.apply(e);
        });
    }
}
