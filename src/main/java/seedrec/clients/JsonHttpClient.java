package seedrec.clients;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;
import java.util.StringJoiner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Gemeinsame Basis für JSON-APIs über HTTP
 *
 * Jeder Request trägt ein eigenes Timeout; Fehler werden als ClientException gemeldet, nie wiederholt
 */
abstract class JsonHttpClient {
    private static final Logger log = LoggerFactory.getLogger(JsonHttpClient.class);

    protected final HttpClient http;
    protected final ObjectMapper mapper;
    protected final Duration timeout;

    protected JsonHttpClient(HttpClient http, ObjectMapper mapper, Duration timeout) {
        this.http = http;
        this.mapper = mapper;
        this.timeout = timeout;
    }

    protected JsonNode get(String url) throws ClientException {
        var request = HttpRequest.newBuilder(URI.create(url))
                .timeout(timeout)
                .header("Accept", "application/json")
                .GET()
                .build();
        return send(request);
    }

    protected JsonNode send(HttpRequest request) throws ClientException {
        try {
            HttpResponse<String> response = http.send(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
            if (response.statusCode() != 200) {
                throw new ClientException("HTTP " + response.statusCode() + " from " + request.uri().getHost(),
                        response.statusCode(), null);
            }
            return mapper.readTree(response.body());
        } catch (IOException e) {
            log.debug("Request to {} failed: {}", request.uri().getHost(), e.getMessage());
            throw new ClientException("request to " + request.uri().getHost() + " failed", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ClientException("request to " + request.uri().getHost() + " interrupted", e);
        }
    }

    // Baut "base?key=value&..." mit URL-Encoding der Werte
    protected static String url(String base, Map<String, String> params) {
        var joiner = new StringJoiner("&", base + "?", "");
        joiner.setEmptyValue(base);
        params.forEach((key, value) -> {
            if (value != null) joiner.add(key + "=" + URLEncoder.encode(value, StandardCharsets.UTF_8));
        });
        return joiner.toString();
    }

    protected static String text(JsonNode node, String field) {
        JsonNode value = node.path(field);
        return value.isMissingNode() || value.isNull() ? null : value.asText();
    }
}
