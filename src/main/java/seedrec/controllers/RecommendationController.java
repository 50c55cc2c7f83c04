package seedrec.controllers;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import seedrec.clients.ClientException;
import seedrec.models.Item;
import seedrec.models.MediaType;
import seedrec.services.RecommendationService;
import seedrec.services.SeedValidationException;
import java.io.IOException;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Controller für Titelsuche und Empfehlungen
 *
 * GET  /api/search?query=...                  bis zu 8 Treffer aus dem Verzeichnis
 * GET  /api/recommendations/{movie|tv}/{id}   Empfehlungen zu einem Verzeichnis-Titel
 * POST /api/recommendations                   Empfehlungen zu einem Seed im Body
 */
public class RecommendationController {
    private static final Logger log = LoggerFactory.getLogger(RecommendationController.class);

    private final RecommendationService service;
    private final ObjectMapper mapper = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    public RecommendationController(HttpServer server, RecommendationService service) {
        this.service = service;
        server.createContext("/api/search", this::handleSearch);
        server.createContext("/api/recommendations", this::handleRecommendations);
    }

    private void handleSearch(HttpExchange exchange) throws IOException {
        try {
            if (!"GET".equals(exchange.getRequestMethod())) {
                exchange.sendResponseHeaders(405, -1);
                return;
            }
            String query = parseQueryParam(exchange.getRequestURI().getRawQuery(), "query");
            if (query == null || query.isBlank()) {
                sendError(exchange, 400, "query parameter required");
                return;
            }
            sendJson(exchange, 200, service.search(query));
        } catch (ClientException e) {
            log.warn("Search failed: {}", e.getMessage());
            sendError(exchange, 502, "content directory unavailable");
        } catch (Exception e) {
            log.error("Search failed", e);
            sendError(exchange, 500, e.getMessage());
        }
    }

    private void handleRecommendations(HttpExchange exchange) throws IOException {
        try {
            String method = exchange.getRequestMethod();
            String[] parts = exchange.getRequestURI().getPath().split("/");

            // Path-Parsing: /api/recommendations/{type}/{id} -> parts[3] ist der Typ, parts[4] die ID
            if ("GET".equals(method) && parts.length == 5) {
                handleRankById(exchange, parts[3], parts[4]);
            } else if ("POST".equals(method) && parts.length == 3) {
                handleRankSeed(exchange);
            } else if (parts.length == 3 || parts.length == 5) {
                exchange.sendResponseHeaders(405, -1);
            } else {
                exchange.sendResponseHeaders(404, -1);
            }
        } catch (SeedValidationException e) {
            sendError(exchange, 400, e.getMessage());
        } catch (Exception e) {
            log.error("Recommendation request failed", e);
            sendError(exchange, 500, e.getMessage());
        }
    }

    private void handleRankById(HttpExchange exchange, String type, String rawId) throws IOException {
        MediaType mediaType;
        int id;
        try {
            mediaType = MediaType.fromString(type);
            id = Integer.parseInt(rawId);
        } catch (IllegalArgumentException e) {
            sendError(exchange, 400, "expected /api/recommendations/{movie|tv}/{id}");
            return;
        }

        Optional<Item> seed;
        try {
            seed = service.details(id, mediaType);
        } catch (ClientException e) {
            log.warn("Seed lookup for {} {} failed: {}", type, id, e.getMessage());
            sendError(exchange, 502, "content directory unavailable");
            return;
        }
        if (seed.isEmpty()) {
            sendError(exchange, 404, "unknown " + mediaType.wireName() + " " + id);
            return;
        }
        sendJson(exchange, 200, service.rank(seed.get()));
    }

    private void handleRankSeed(HttpExchange exchange) throws IOException {
        Item seed;
        try (var in = exchange.getRequestBody()) {
            seed = mapper.readValue(in, Item.class);
        } catch (JsonProcessingException e) {
            sendError(exchange, 400, "invalid seed");
            return;
        }
        sendJson(exchange, 200, service.rank(seed));
    }

    static String parseQueryParam(String rawQuery, String name) {
        if (rawQuery == null || rawQuery.isBlank()) return null;
        for (String pair : rawQuery.split("&")) {
            String[] keyValue = pair.split("=", 2);
            if (keyValue.length == 2 && name.equals(keyValue[0].trim())) {
                return URLDecoder.decode(keyValue[1], StandardCharsets.UTF_8);
            }
        }
        return null;
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
