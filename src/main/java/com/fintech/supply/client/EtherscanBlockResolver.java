package com.fintech.supply.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.fintech.supply.exception.SourceApiException;
import com.fintech.supply.service.BlockResolver;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.util.Optional;

/**
 * Resolves layer one block numbers through the Etherscan API.
 * <p>
 * Timestamp lookups degrade to {@link Optional#empty()} on any failure so the
 * caller can fall back to the latest block. The latest block lookup has no
 * fallback and throws instead.
 */
@Service
@Slf4j
public class EtherscanBlockResolver implements BlockResolver {

    private static final String SOURCE_NAME = "Etherscan";
    private static final String RATE_LIMIT_MESSAGE = "Max rate limit reached";

    private final RestTemplate restTemplate;
    private final String baseUrl;

    public EtherscanBlockResolver(RestTemplate restTemplate,
                                  @Value("${etherscan.base-url:https://api.etherscan.io/api}") String baseUrl) {
        this.restTemplate = restTemplate;
        this.baseUrl = baseUrl;
    }

    @Override
    public Optional<Long> resolveBlockForTimestamp(long timestampSeconds, String apiKey) {
        URI uri = UriComponentsBuilder.fromHttpUrl(baseUrl)
                .queryParam("module", "block")
                .queryParam("action", "getblocknobytime")
                .queryParam("timestamp", timestampSeconds)
                .queryParam("closest", "before")
                .queryParam("apikey", apiKey)
                .build()
                .toUri();

        JsonNode response;
        try {
            response = restTemplate.getForObject(uri, JsonNode.class);
        } catch (RestClientException e) {
            log.error("Etherscan API error for block by timestamp {}: {}", timestampSeconds, e.getMessage());
            return Optional.empty();
        }

        if (response == null || !"1".equals(response.path("status").asText())) {
            log.error("Etherscan API error for block by timestamp {}: {}", timestampSeconds,
                    response != null ? response.path("message").asText() : "empty response");
            return Optional.empty();
        }

        // The block number comes back either as a bare string or wrapped in an object
        JsonNode result = response.path("result");
        String blockNumber = result.isObject() ? result.path("blockNumber").asText() : result.asText();
        try {
            long block = Long.parseLong(blockNumber.trim());
            if (block == 0) {
                log.info("No block found before timestamp {}", timestampSeconds);
                return Optional.empty();
            }
            return Optional.of(block);
        } catch (NumberFormatException e) {
            log.error("Unparseable block number '{}' for timestamp {}", blockNumber, timestampSeconds);
            return Optional.empty();
        }
    }

    @Override
    public long resolveLatestBlock(String apiKey) throws SourceApiException {
        URI uri = UriComponentsBuilder.fromHttpUrl(baseUrl)
                .queryParam("module", "proxy")
                .queryParam("action", "eth_blockNumber")
                .queryParam("apikey", apiKey)
                .build()
                .toUri();

        JsonNode response;
        try {
            response = restTemplate.getForObject(uri, JsonNode.class);
        } catch (RestClientException e) {
            throw new SourceApiException(
                    "Etherscan API error for latest block: " + e.getMessage(), SOURCE_NAME, e);
        }
        if (response == null) {
            throw new SourceApiException("Failed to parse latest block from Etherscan response", SOURCE_NAME);
        }

        String result = response.path("result").asText("");
        if (result.startsWith("0x")) {
            try {
                return Long.parseLong(result.substring(2), 16);
            } catch (NumberFormatException e) {
                throw new SourceApiException(
                        "Failed to parse latest block from Etherscan response", SOURCE_NAME, e);
            }
        }
        if ("NOTOK".equals(response.path("message").asText()) && result.contains(RATE_LIMIT_MESSAGE)) {
            throw new SourceApiException("Etherscan API rate limit reached for latest block", SOURCE_NAME);
        }
        log.error("Unexpected Etherscan response for latest block: {}", response);
        throw new SourceApiException("Failed to parse latest block from Etherscan response", SOURCE_NAME);
    }
}
