package seedrec.services;

import seedrec.clients.ClientException;
import seedrec.clients.ContentDirectoryClient;
import seedrec.models.Credit;
import seedrec.models.Credits;
import seedrec.models.FeedbackRecord;
import seedrec.models.FeedbackWeights;
import seedrec.models.Item;
import seedrec.models.MediaType;
import seedrec.repos.FeedbackRepository;
import java.sql.SQLException;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Service für Bewertungen und die daraus abgeleiteten Präferenzgewichte
 */
public class FeedbackService {
    private static final Logger log = LoggerFactory.getLogger(FeedbackService.class);

    static final double POSITIVE_THRESHOLD = 3.5;

    private final FeedbackRepository repository;
    private final ContentDirectoryClient directory;
    private final Clock clock;

    public FeedbackService(FeedbackRepository repository, ContentDirectoryClient directory, Clock clock) {
        this.repository = repository;
        this.directory = directory;
        this.clock = clock;
    }

    /**
     * Summiert die Sterne positiver Bewertungen (ab 3.5) je Genre und je Person
     */
    public static FeedbackWeights aggregate(List<FeedbackRecord> records) {
        Map<Integer, Double> genres = new LinkedHashMap<>();
        Map<String, Double> people = new LinkedHashMap<>();
        for (FeedbackRecord r : records) {
            if (r.stars() < POSITIVE_THRESHOLD) continue;
            r.genreIds().forEach(g -> genres.merge(g, (double) r.stars(), Double::sum));
            r.castNames().forEach(p -> people.merge(p, (double) r.stars(), Double::sum));
            r.crewNames().forEach(p -> people.merge(p, (double) r.stars(), Double::sum));
        }
        return new FeedbackWeights(genres, people);
    }

    // Nicht lesbarer Store bedeutet: keine Personalisierung
    public FeedbackWeights loadWeights() {
        try {
            return aggregate(repository.readAll());
        } catch (SQLException | RuntimeException e) {
            log.warn("Feedback store unavailable, scoring without personalization: {}", e.getMessage());
            return FeedbackWeights.empty();
        }
    }

    public FeedbackWeights preferences() throws SQLException {
        return aggregate(repository.readAll());
    }

    // Leer, wenn das Verzeichnis den Titel nicht kennt
    public Optional<FeedbackRecord> rate(int id, MediaType mediaType, int stars) throws SQLException, ClientException {
        validateStars(stars);
        Optional<Item> item = directory.getDetails(id, mediaType);
        if (item.isEmpty()) return Optional.empty();
        return Optional.of(rate(item.get(), stars));
    }

    // Speichert bzw. ersetzt die Bewertung inkl. Genres, Top-10-Besetzung und Regie/Drehbuch
    public FeedbackRecord rate(Item item, int stars) throws SQLException {
        validateStars(stars);
        if (item == null || item.mediaType() == null) throw new IllegalArgumentException("item with media type required");

        Credits credits;
        try {
            credits = directory.getCredits(item.id(), item.mediaType());
        } catch (ClientException e) {
            log.warn("Credits for {} {} unavailable, storing rating without people: {}",
                    item.mediaType().wireName(), item.id(), e.getMessage());
            credits = Credits.empty();
        }

        var record = new FeedbackRecord(
                item.id(),
                item.mediaType(),
                stars,
                clock.instant(),
                item.genreIds(),
                credits.topCast(10).stream().map(Credit::name).toList(),
                credits.crew().stream()
                        .filter(c -> c.role() == Credit.Role.DIRECTOR || c.role() == Credit.Role.WRITER)
                        .map(Credit::name)
                        .distinct()
                        .toList());
        repository.appendOrReplace(record);
        log.info("Stored {}-star rating for {} {}", stars, item.mediaType().wireName(), item.id());
        return record;
    }

    private static void validateStars(int stars) {
        if (stars < 1 || stars > 5) throw new IllegalArgumentException("rating must be between 1 and 5");
    }
}
