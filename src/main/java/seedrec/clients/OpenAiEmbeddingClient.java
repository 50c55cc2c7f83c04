package seedrec.clients;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.time.Duration;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * EmbeddingClient gegen die OpenAI Embeddings API
 *
 * Ohne API-Key wird kein Request abgesetzt und ein leerer Vektor geliefert (lexikalischer Fallback)
 */
public class OpenAiEmbeddingClient extends JsonHttpClient implements EmbeddingClient {
    private static final Logger log = LoggerFactory.getLogger(OpenAiEmbeddingClient.class);
    private static final double[] EMPTY = new double[0];

    private final String endpoint;
    private final String apiKey;
    private final String model;

    public OpenAiEmbeddingClient(String endpoint, String apiKey, String model, Duration timeout) {
        this(HttpClient.newBuilder().connectTimeout(timeout).build(), new ObjectMapper(), endpoint, apiKey, model, timeout);
    }

    OpenAiEmbeddingClient(HttpClient http, ObjectMapper mapper, String endpoint, String apiKey, String model, Duration timeout) {
        super(http, mapper, timeout);
        this.endpoint = endpoint;
        this.apiKey = apiKey;
        this.model = model;
    }

    public boolean isConfigured() {
        return apiKey != null && !apiKey.isBlank();
    }

    @Override
    public double[] embed(String text) throws ClientException {
        if (!isConfigured() || text == null || text.isBlank()) return EMPTY;
        try {
            var body = mapper.writeValueAsString(Map.of("input", text, "model", model));
            var request = HttpRequest.newBuilder(URI.create(endpoint))
                    .timeout(timeout)
                    .header("Authorization", "Bearer " + apiKey)
                    .header("Content-Type", "application/json")
                    .POST(HttpRequest.BodyPublishers.ofString(body))
                    .build();
            return parseEmbedding(send(request));
        } catch (JsonProcessingException e) {
            throw new ClientException("could not encode embedding request", e);
        }
    }

    static double[] parseEmbedding(JsonNode root) {
        JsonNode vector = root.path("data").path(0).path("embedding");
        if (!vector.isArray() || vector.isEmpty()) {
            log.warn("Embedding response without vector");
            return EMPTY;
        }
        double[] result = new double[vector.size()];
        for (int i = 0; i < result.length; i++) {
            result[i] = vector.get(i).asDouble();
        }
        return result;
    }
}
