package com.fintech.supply.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.fintech.supply.exception.SourceApiException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Minimal GraphQL-over-HTTP client for subgraph queries.
 * <p>
 * Every failure surfaces as a {@link SourceApiException} so the retry executor
 * can treat transport errors, HTTP errors and GraphQL errors alike.
 */
@Component
@Slf4j
public class GraphQLClient {

    static final String GATEWAY_URL_PREFIX = "https://gateway.thegraph.com/";

    private final RestTemplate restTemplate;
    private final String gatewayApiKey;

    public GraphQLClient(RestTemplate restTemplate,
                         @Value("${supply.graph.gateway-api-key:}") String gatewayApiKey) {
        this.restTemplate = restTemplate;
        this.gatewayApiKey = gatewayApiKey;
    }

    /**
     * Posts {@code query} with {@code variables} to {@code url}.
     *
     * @return the {@code data} member of the response, never null
     * @throws SourceApiException on a non-200 status, GraphQL errors or a missing {@code data} member
     */
    public JsonNode execute(String url, String query, Map<String, Object> variables, String sourceName) {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.setAccept(List.of(MediaType.ALL));
        if (url.startsWith(GATEWAY_URL_PREFIX) && !gatewayApiKey.isBlank()) {
            headers.setBearerAuth(gatewayApiKey);
        }

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("query", query);
        body.put("variables", variables);

        ResponseEntity<JsonNode> response;
        try {
            response = restTemplate.postForEntity(url, new HttpEntity<>(body, headers), JsonNode.class);
        } catch (HttpStatusCodeException e) {
            throw new SourceApiException(
                    "Invalid GraphQL status code: " + e.getStatusCode().value(), sourceName, e);
        } catch (RestClientException e) {
            throw new SourceApiException("GraphQL request failed: " + e.getMessage(), sourceName, e);
        }

        if (response.getStatusCode().value() != 200) {
            throw new SourceApiException(
                    "Invalid GraphQL status code: " + response.getStatusCode().value(), sourceName);
        }

        JsonNode responseBody = response.getBody();
        if (responseBody == null) {
            throw new SourceApiException("GraphQL Error: unexpected empty response", sourceName);
        }

        JsonNode errors = responseBody.path("errors");
        if (errors.isArray() && errors.size() > 0) {
            List<String> messages = new ArrayList<>();
            errors.forEach(error -> messages.add(error.path("message").asText()));
            log.debug("{} returned GraphQL errors: {}", sourceName, errors);
            throw new SourceApiException("GraphQL Errors: " + String.join(",", messages), sourceName);
        }

        JsonNode data = responseBody.get("data");
        if (data == null || data.isNull()) {
            throw new SourceApiException("GraphQL Error: unexpected empty response", sourceName);
        }
        return data;
    }
}
