package com.fintech.supply.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fintech.supply.dto.LayerOneSupply;
import com.fintech.supply.exception.SourceApiException;
import com.fintech.supply.service.LayerOneSupplyClient;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.Map;
import java.util.Optional;

/**
 * Reads layer one global supply state from the network subgraph.
 */
@Service
@Slf4j
public class SubgraphLayerOneSupplyClient implements LayerOneSupplyClient {

    private static final String SOURCE_NAME = "L1 subgraph";

    static final String GLOBAL_STATES_QUERY =
            "query allGlobalStates($blockFilter: Block_height, $orderDirection: OrderDirection) {"
                    + " globalStates(block: $blockFilter, orderDirection: $orderDirection) {"
                    + " totalSupply lockedSupply lockedSupplyGenesis liquidSupply circulatingSupply"
                    + " } }";

    private final GraphQLClient graphQLClient;
    private final ObjectMapper objectMapper;
    private final String subgraphUrl;

    public SubgraphLayerOneSupplyClient(GraphQLClient graphQLClient,
                                        ObjectMapper objectMapper,
                                        @Value("${supply.l1.subgraph-url}") String subgraphUrl) {
        this.graphQLClient = graphQLClient;
        this.objectMapper = objectMapper;
        this.subgraphUrl = subgraphUrl;
    }

    @Override
    public LayerOneSupply fetchLatest() throws SourceApiException {
        log.debug("Fetching latest L1 global state");
        JsonNode states = queryGlobalStates(Map.of("orderDirection", "desc"));
        if (states.size() == 0) {
            throw new SourceApiException("Failed to fetch latest global state", SOURCE_NAME);
        }
        return toSupply(states.get(0));
    }

    @Override
    public Optional<LayerOneSupply> fetchAtBlock(long blockNumber) throws SourceApiException {
        log.debug("Fetching L1 global state at block {}", blockNumber);
        JsonNode states = queryGlobalStates(Map.of("blockFilter", Map.of("number", blockNumber)));
        if (states.size() > 1) {
            throw new SourceApiException(
                    "Expected at most one global state at block " + blockNumber + ", got " + states.size(),
                    SOURCE_NAME);
        }
        if (states.size() == 0) {
            log.info("No L1 global state at block {}", blockNumber);
            return Optional.empty();
        }
        return Optional.of(toSupply(states.get(0)));
    }

    @Override
    public String getSourceName() {
        return SOURCE_NAME;
    }

    private JsonNode queryGlobalStates(Map<String, Object> variables) {
        JsonNode data = graphQLClient.execute(subgraphUrl, GLOBAL_STATES_QUERY, variables, SOURCE_NAME);
        JsonNode states = data.path("globalStates");
        if (!states.isArray()) {
            throw new SourceApiException("Failed to fetch global state: no globalStates in response", SOURCE_NAME);
        }
        return states;
    }

    private LayerOneSupply toSupply(JsonNode state) {
        try {
            return objectMapper.treeToValue(state, LayerOneSupply.class);
        } catch (Exception e) {
            throw new SourceApiException("Unreadable global state: " + e.getMessage(), SOURCE_NAME, e);
        }
    }
}
