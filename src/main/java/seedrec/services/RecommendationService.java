package seedrec.services;

import seedrec.clients.ClientException;
import seedrec.clients.ContentDirectoryClient;
import seedrec.models.FeedbackWeights;
import seedrec.models.Genre;
import seedrec.models.Item;
import seedrec.models.MediaType;
import seedrec.models.ScoredRecommendation;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Einstiegspunkt für Empfehlungen: Seed prüfen, Kandidaten sammeln, bewerten und sortieren
 *
 * Ausfälle externer Dienste führen nie zu einem Fehler, nur ein ungültiger Seed wird gemeldet
 */
public class RecommendationService {
    private static final Logger log = LoggerFactory.getLogger(RecommendationService.class);

    static final int SEARCH_LIMIT = 8;

    private final ContentDirectoryClient directory;
    private final CandidateDiscoveryService discovery;
    private final ScoringService scoring;
    private final FeedbackService feedback;
    private final int presentationLimit;

    public RecommendationService(ContentDirectoryClient directory,
                                 CandidateDiscoveryService discovery,
                                 ScoringService scoring,
                                 FeedbackService feedback,
                                 int presentationLimit) {
        this.directory = directory;
        this.discovery = discovery;
        this.scoring = scoring;
        this.feedback = feedback;
        this.presentationLimit = presentationLimit;
    }

    /**
     * Liefert die besten Empfehlungen zum Seed, absteigend nach Gesamtscore
     *
     * @throws SeedValidationException wenn ID oder Medientyp fehlen
     */
    public List<ScoredRecommendation> rank(Item seed) {
        validate(seed);
        Item hydrated = hydrate(seed);

        List<Genre> vocabulary = genreVocabulary();
        FeedbackWeights weights = feedback.loadWeights();

        List<Item> candidates = discovery.discover(hydrated, vocabulary);
        if (candidates.isEmpty()) {
            log.info("No candidates found for '{}'", hydrated.title());
            return List.of();
        }

        List<ScoredRecommendation> ranked = sortByScore(scoring.score(hydrated, candidates, vocabulary, weights));
        log.info("Ranked {} candidates for '{}', returning top {}",
                ranked.size(), hydrated.title(), Math.min(ranked.size(), presentationLimit));
        return ranked.size() > presentationLimit ? List.copyOf(ranked.subList(0, presentationLimit)) : ranked;
    }

    static void validate(Item seed) {
        if (seed == null) throw new SeedValidationException("seed item required");
        if (seed.id() <= 0) throw new SeedValidationException("seed id must be positive: " + seed.id());
        if (seed.mediaType() == null) throw new SeedValidationException("seed media type required");
    }

    // Stabil: gleiche Scores behalten die Discovery-Reihenfolge
    public static List<ScoredRecommendation> sortByScore(List<ScoredRecommendation> scored) {
        var sorted = new ArrayList<>(scored);
        sorted.sort(Comparator.comparingInt(ScoredRecommendation::totalScore).reversed());
        return sorted;
    }

    public List<Item> search(String query) throws ClientException {
        if (query == null || query.isBlank()) return List.of();
        return directory.searchMulti(query).stream().limit(SEARCH_LIMIT).toList();
    }

    // Leer, wenn das Verzeichnis den Titel nicht kennt
    public Optional<Item> details(int id, MediaType mediaType) throws ClientException {
        validate(Item.builder().id(id).mediaType(mediaType).build());
        return directory.getDetails(id, mediaType);
    }

    // Ergänzt Tagline und Genres aus dem Verzeichnis; bei Fehlern wird der Seed unverändert genutzt
    private Item hydrate(Item seed) {
        try {
            return directory.getDetails(seed.id(), seed.mediaType())
                    .map(details -> details.toBuilder()
                            .title(details.title().isEmpty() ? seed.title() : details.title())
                            .overview(details.overview().isEmpty() ? seed.overview() : details.overview())
                            .genreIds(details.genreIds().isEmpty() ? seed.genreIds() : details.genreIds())
                            .build())
                    .orElse(seed);
        } catch (ClientException | RuntimeException e) {
            log.warn("Details for seed {} unavailable: {}", seed.id(), e.getMessage());
            return seed;
        }
    }

    // Vokabular beider Medientypen, nach ID zusammengeführt
    private List<Genre> genreVocabulary() {
        Map<Integer, Genre> pooled = new LinkedHashMap<>();
        for (MediaType type : MediaType.values()) {
            try {
                directory.getGenreVocabulary(type).forEach(g -> pooled.putIfAbsent(g.id(), g));
            } catch (ClientException | RuntimeException e) {
                log.warn("Genre list for {} unavailable: {}", type.wireName(), e.getMessage());
            }
        }
        return new ArrayList<>(pooled.values());
    }
}
