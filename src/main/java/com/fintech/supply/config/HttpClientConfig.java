package com.fintech.supply.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpRequest;
import org.springframework.http.client.ClientHttpRequestExecution;
import org.springframework.http.client.ClientHttpRequestInterceptor;
import org.springframework.http.client.ClientHttpResponse;
import org.springframework.web.client.RestTemplate;

import java.io.IOException;
import java.time.Duration;

/**
 * HTTP client used by the subgraph and block explorer adapters.
 */
@Configuration
@Slf4j
public class HttpClientConfig {

    @Value("${http.client.connection-timeout:10000}")
    private int connectionTimeout;

    @Value("${http.client.read-timeout:30000}")
    private int readTimeout;

    @Bean
    public RestTemplate restTemplate(RestTemplateBuilder builder) {
        return builder
                .setConnectTimeout(Duration.ofMillis(connectionTimeout))
                .setReadTimeout(Duration.ofMillis(readTimeout))
                .additionalInterceptors(new LoggingInterceptor())
                .build();
    }

    /**
     * Logs method, host, path, status and latency. The query string is left
     * out because it can carry API keys.
     */
    static class LoggingInterceptor implements ClientHttpRequestInterceptor {

        @Override
        public ClientHttpResponse intercept(HttpRequest request, byte[] body,
                                            ClientHttpRequestExecution execution) throws IOException {
            long start = System.currentTimeMillis();
            String target = request.getURI().getHost() + request.getURI().getPath();
            log.debug("HTTP {} {}", request.getMethod(), target);
            try {
                ClientHttpResponse response = execution.execute(request, body);
                log.debug("HTTP {} {} -> {} in {}ms", request.getMethod(), target,
                        response.getStatusCode().value(), System.currentTimeMillis() - start);
                return response;
            } catch (IOException e) {
                log.warn("HTTP {} {} failed after {}ms: {}", request.getMethod(), target,
                        System.currentTimeMillis() - start, e.getMessage());
                throw e;
            }
        }
    }
}
