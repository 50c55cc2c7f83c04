package seedrec.controllers;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import seedrec.clients.ClientException;
import seedrec.models.FeedbackRecord;
import seedrec.models.FeedbackWeights;
import seedrec.models.MediaType;
import seedrec.services.FeedbackService;
import java.io.IOException;
import java.sql.SQLException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Controller für Bewertungen
 *
 * POST /api/feedback              {"id":..,"mediaType":"movie","rating":1-5}
 * GET  /api/feedback/preferences  normalisierte Genre- und Personengewichte (0-1)
 */
public class FeedbackController {
    private static final Logger log = LoggerFactory.getLogger(FeedbackController.class);

    private final FeedbackService service;
    private final ObjectMapper mapper = new ObjectMapper();

    public FeedbackController(HttpServer server, FeedbackService service) {
        this.service = service;
        server.createContext("/api/feedback", this::handleFeedback);
    }

    private void handleFeedback(HttpExchange exchange) throws IOException {
        try {
            String path = exchange.getRequestURI().getPath();
            String method = exchange.getRequestMethod();

            if (path.equals("/api/feedback/preferences")) {
                if ("GET".equals(method)) {
                    handlePreferences(exchange);
                } else {
                    exchange.sendResponseHeaders(405, -1);
                }
            } else if (path.equals("/api/feedback") || path.equals("/api/feedback/")) {
                if ("POST".equals(method)) {
                    handleRate(exchange);
                } else {
                    exchange.sendResponseHeaders(405, -1);
                }
            } else {
                exchange.sendResponseHeaders(404, -1);
            }
        } catch (SQLException e) {
            log.error("Feedback store error", e);
            sendError(exchange, 500, "feedback store unavailable");
        } catch (Exception e) {
            log.error("Feedback request failed", e);
            sendError(exchange, 500, e.getMessage());
        }
    }

    private void handleRate(HttpExchange exchange) throws IOException, SQLException {
        int id;
        int stars;
        MediaType mediaType;
        try (var in = exchange.getRequestBody()) {
            var node = mapper.readTree(in);
            if (node == null || !node.has("id") || !node.has("mediaType") || !node.has("rating")) {
                sendError(exchange, 400, "id, mediaType and rating required");
                return;
            }
            id = node.get("id").asInt();
            stars = node.get("rating").asInt();
            mediaType = MediaType.fromString(node.get("mediaType").asText());
        } catch (JsonProcessingException e) {
            sendError(exchange, 400, "invalid json");
            return;
        } catch (IllegalArgumentException e) {
            sendError(exchange, 400, e.getMessage());
            return;
        }

        Optional<FeedbackRecord> saved;
        try {
            saved = service.rate(id, mediaType, stars);
        } catch (IllegalArgumentException e) {
            sendError(exchange, 400, e.getMessage());
            return;
        } catch (ClientException e) {
            log.warn("Details for {} {} unavailable: {}", mediaType.wireName(), id, e.getMessage());
            sendError(exchange, 502, "content directory unavailable");
            return;
        }
        if (saved.isEmpty()) {
            sendError(exchange, 404, "unknown " + mediaType.wireName() + " " + id);
            return;
        }
        var record = saved.get();
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("id", record.itemId());
        body.put("mediaType", record.mediaType());
        body.put("rating", record.stars());
        body.put("ratedAt", record.ratedAt().toString());
        sendJson(exchange, 201, body);
    }

    private void handlePreferences(HttpExchange exchange) throws IOException, SQLException {
        FeedbackWeights weights = service.preferences();
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("genres", weights.normalizedGenreWeights());
        body.put("people", weights.normalizedPersonWeights());
        sendJson(exchange, 200, body);
    }

    private void sendJson(HttpExchange exchange, int statusCode, Object data) throws IOException {
        var response = mapper.writeValueAsBytes(data);
        exchange.getResponseHeaders().add("Content-Type", "application/json");
        exchange.sendResponseHeaders(statusCode, response.length);
        try (var os = exchange.getResponseBody()) {
            os.write(response);
        }
    }

    private void sendError(HttpExchange exchange, int statusCode, String message) throws IOException {
        sendJson(exchange, statusCode, Map.of("error", message == null ? "error" : message));
    }
}
