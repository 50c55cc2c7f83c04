package seedrec;

import com.sun.net.httpserver.HttpServer;
import seedrec.clients.CachingEmbeddingClient;
import seedrec.clients.ContentDirectoryClient;
import seedrec.clients.EmbeddingCache;
import seedrec.clients.EmbeddingClient;
import seedrec.clients.GoogleSearchClient;
import seedrec.clients.MetadataEnrichmentClient;
import seedrec.clients.OmdbClient;
import seedrec.clients.OpenAiEmbeddingClient;
import seedrec.clients.TmdbClient;
import seedrec.clients.WebSearchClient;
import seedrec.controllers.FeedbackController;
import seedrec.controllers.RecommendationController;
import seedrec.repos.Db;
import seedrec.repos.FeedbackRepository;
import seedrec.repos.JdbcFeedbackRepository;
import seedrec.services.CandidateDiscoveryService;
import seedrec.services.CandidateFilter;
import seedrec.services.DiscoveryConfig;
import seedrec.services.FeedbackService;
import seedrec.services.RecommendationService;
import seedrec.services.ScoringService;
import seedrec.services.SimilarityService;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Hauptklasse der Anwendung
 *
 * Setzt den HTTP-Server auf und verdrahtet Clients, Repository, Services und Controller
 */
public class App {
    private static final Logger log = LoggerFactory.getLogger(App.class);

    public static void main(String[] args) throws Exception {
        AppConfig config = AppConfig.load();
        int port = config.getInt("server.port", 8080);
        Duration timeout = config.getDuration("http.timeout-ms", Duration.ofSeconds(8));

        HttpServer server = HttpServer.create(new InetSocketAddress(port), 0);

        // Health-Check Endpoint
        server.createContext("/health", exchange -> {
            byte[] response = "{\"status\":\"ok\"}".getBytes(StandardCharsets.UTF_8);
            exchange.getResponseHeaders().add("Content-Type", "application/json");
            exchange.sendResponseHeaders(200, response.length);
            try (OutputStream os = exchange.getResponseBody()) {
                os.write(response);
            }
        });

        // Externe Dienste
        if (!config.isSet("tmdb.api-key")) log.warn("tmdb.api-key not set, directory calls will fail");
        ContentDirectoryClient directory = new TmdbClient(
                config.get("tmdb.base-url", "https://api.themoviedb.org/3"), config.get("tmdb.api-key", ""), timeout);
        EmbeddingClient embeddings = null;
        if (config.isSet("openai.api-key")) {
            embeddings = new CachingEmbeddingClient(
                    new OpenAiEmbeddingClient(config.get("openai.embeddings-url", "https://api.openai.com/v1/embeddings"),
                            config.get("openai.api-key", null), config.get("openai.model", "text-embedding-3-small"), timeout),
                    new EmbeddingCache(config.getInt("embedding.cache-size", 2000)));
        } else {
            log.info("No embedding key configured, content similarity is lexical");
        }
        WebSearchClient webSearch = null;
        if (config.isSet("google.api-key") && config.isSet("google.cse-id")) {
            webSearch = new GoogleSearchClient(config.get("google.search-url", "https://www.googleapis.com/customsearch/v1"),
                    config.get("google.api-key", null), config.get("google.cse-id", null), timeout);
        }
        MetadataEnrichmentClient enrichment = null;
        if (config.isSet("omdb.api-key")) {
            enrichment = new OmdbClient(config.get("omdb.base-url", "http://www.omdbapi.com/"),
                    config.get("omdb.api-key", null), timeout);
        }

        // Repositories initialisieren
        Db db = Db.fromConfig(config);
        try {
            db.initSchema();
        } catch (SQLException e) {
            log.warn("Could not create feedback table, ratings unavailable until the database is reachable: {}",
                    e.getMessage());
        }
        FeedbackRepository feedbackRepo = new JdbcFeedbackRepository(db);

        // Thread-Pools: Strategien und Teilabfragen getrennt, damit verschachtelte Joins nicht blockieren
        ExecutorService strategyPool = Executors.newFixedThreadPool(config.getInt("threads.strategies", 6));
        ExecutorService fetchPool = Executors.newFixedThreadPool(config.getInt("threads.fetch", 12));
        ExecutorService scoringPool = Executors.newFixedThreadPool(config.getInt("threads.scoring", 8));

        // Services initialisieren
        Clock clock = Clock.systemDefaultZone();
        DiscoveryConfig discoveryConfig = DiscoveryConfig.fromConfig(config);
        var feedbackService = new FeedbackService(feedbackRepo, directory, clock);
        var discovery = new CandidateDiscoveryService(directory, webSearch, enrichment, discoveryConfig,
                strategyPool, fetchPool, new CandidateFilter(clock));
        var scoring = new ScoringService(directory, new SimilarityService(embeddings), scoringPool);
        var recommendations = new RecommendationService(directory, discovery, scoring, feedbackService,
                discoveryConfig.presentationLimit());

        // Controller initialisieren
        new RecommendationController(server, recommendations);
        new FeedbackController(server, feedbackService);

        server.setExecutor(Executors.newFixedThreadPool(4));
        server.start();
        log.info("Server running on http://localhost:{} (web search {}, enrichment {})",
                port, webSearch != null ? "on" : "off", enrichment != null ? "on" : "off");
    }
}
