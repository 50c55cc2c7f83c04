package seedrec.models;

import java.time.Instant;
import java.util.List;

/**
 * Model für eine Bewertung (1-5 Sterne) eines Titels
 *
 * Genres, Besetzung und Crew werden zum Bewertungszeitpunkt mitgespeichert,
 * damit die Gewichtung nicht davon abhängt, ob der Titel später noch abrufbar ist
 */
public record FeedbackRecord(int itemId,
                             MediaType mediaType,
                             int stars,
                             Instant ratedAt,
                             List<Integer> genreIds,
                             List<String> castNames,
                             List<String> crewNames) {

    public FeedbackRecord {
        genreIds = genreIds == null ? List.of() : List.copyOf(genreIds);
        castNames = castNames == null ? List.of() : List.copyOf(castNames);
        crewNames = crewNames == null ? List.of() : List.copyOf(crewNames);
    }
}
