package com.optevents.client;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.optevents.model.QueryDocument;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;

/**
 * {@link QueryClient} backed by the query service's HTTP API.
 *
 * <p>Queries are posted as {@code {"query": "..."}} to the execute endpoint; continuation links
 * are fetched with GET. Relative links resolve against the configured base URL.
 */
@Component
public class HttpQueryClient implements QueryClient {
    private static final Logger log = LoggerFactory.getLogger(HttpQueryClient.class);

    private static final String DEFAULT_BASE_URL = "http://localhost:8080";
    private static final String DEFAULT_PATH = "/monitoring/v1/query/execute";
    private static final int DEFAULT_TIMEOUT_MS = 30000;

    private final ObjectMapper objectMapper;
    private final QueryResponseParser parser;
    private final Environment environment;
    private final HttpClient httpClient;

    public HttpQueryClient(ObjectMapper objectMapper, Environment environment) {
        this.objectMapper = objectMapper;
        this.parser = new QueryResponseParser(objectMapper);
        this.environment = environment;
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(10))
                .build();
    }

    /**
     * Logs the target endpoint. The token is never logged.
     */
    @PostConstruct
    public void logClientConfig() {
        ClientConfig config = ClientConfig.fromEnvironment(environment);
        log.info("Query client configured (base_url={}, path={}, timeout_ms={}, token_configured={})",
                config.baseUrl(), config.path(), config.timeoutMs(), config.hasToken());
    }

    @Override
    public QueryResponse executeQuery(QueryDocument query) {
        ClientConfig config = ClientConfig.fromEnvironment(environment);
        String json;
        try {
            json = objectMapper.writeValueAsString(Map.of("query", query.getText()));
        } catch (IOException e) {
            throw new RemoteQueryException("failed to encode " + query.getLabel() + " query", e);
        }

        URI uri;
        try {
            uri = URI.create(config.baseUrl() + config.path());
        } catch (IllegalArgumentException e) {
            throw new RemoteQueryException("invalid query service endpoint " + config.baseUrl() + config.path()
                    + ": " + e.getMessage(), e);
        }
        HttpRequest request = newRequest(config, uri)
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(json, StandardCharsets.UTF_8))
                .build();
        log.debug("Executing {} query:\n{}", query.getLabel(), query.getText());
        return send(request, query.getLabel() + " query");
    }

    @Override
    public QueryResponse continueQuery(DataSet dataSet, String linkName) {
        if (dataSet == null || !dataSet.hasLink(linkName)) {
            throw new RemoteQueryException("dataset has no '" + linkName + "' link to continue");
        }
        ClientConfig config = ClientConfig.fromEnvironment(environment);
        URI uri;
        try {
            uri = URI.create(config.baseUrl()).resolve(dataSet.getLink(linkName));
        } catch (IllegalArgumentException e) {
            throw new RemoteQueryException("dataset " + dataSet.getName() + " has an invalid '" + linkName
                    + "' link " + dataSet.getLink(linkName) + ": " + e.getMessage(), e);
        }
        HttpRequest request = newRequest(config, uri).GET().build();
        log.debug("Continuing dataset {} via link {}", dataSet.getName(), linkName);
        return send(request, "'" + linkName + "' continuation of dataset " + dataSet.getName());
    }

    private HttpRequest.Builder newRequest(ClientConfig config, URI uri) {
        HttpRequest.Builder builder = HttpRequest.newBuilder()
                .uri(uri)
                .timeout(Duration.ofMillis(config.timeoutMs()))
                .header("Accept", "application/json");
        if (config.hasToken()) {
            builder.header("Authorization", "Bearer " + config.token());
        }
        return builder;
    }

    private QueryResponse send(HttpRequest request, String what) {
        HttpResponse<String> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new RemoteQueryException(what + " failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RemoteQueryException(what + " interrupted", e);
        }

        if (response.statusCode() >= 400) {
            log.warn("Query service request failed (status_code={}, uri={})", response.statusCode(), request.uri());
            throw new RemoteQueryException(what + " failed: HTTP " + response.statusCode() + " - " + response.body());
        }
        return parser.parse(response.body());
    }

    private record ClientConfig(String baseUrl, String path, String token, int timeoutMs) {

        static ClientConfig fromEnvironment(Environment environment) {
            String baseUrl = firstNonBlank(environment, "optevents.query.base-url", "OPTEVENTS_QUERY_BASE_URL");
            if (baseUrl == null) {
                baseUrl = DEFAULT_BASE_URL;
            }
            while (baseUrl.endsWith("/")) {
                baseUrl = baseUrl.substring(0, baseUrl.length() - 1);
            }

            String path = firstNonBlank(environment, "optevents.query.path", null);
            if (path == null) {
                path = DEFAULT_PATH;
            }
            if (!path.startsWith("/")) {
                path = "/" + path;
            }

            String token = firstNonBlank(environment, "optevents.query.token", "OPTEVENTS_QUERY_TOKEN");

            int timeoutMs = DEFAULT_TIMEOUT_MS;
            String timeout = firstNonBlank(environment, "optevents.query.timeout-ms", null);
            if (timeout != null) {
                try {
                    timeoutMs = Integer.parseInt(timeout);
                } catch (NumberFormatException e) {
                    log.warn("Ignoring invalid optevents.query.timeout-ms={}", timeout);
                }
            }
            return new ClientConfig(baseUrl, path, token, timeoutMs);
        }

        boolean hasToken() {
            return token != null && !token.isBlank();
        }

        private static String firstNonBlank(Environment environment, String propKey, String envKey) {
            if (environment == null) {
                return null;
            }
            String v = environment.getProperty(propKey);
            if ((v == null || v.isBlank()) && envKey != null) {
                v = environment.getProperty(envKey);
            }
            if (v == null || v.isBlank()) {
                return null;
            }
            return v.trim();
        }
    }
}
