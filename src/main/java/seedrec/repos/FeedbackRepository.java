package seedrec.repos;

import seedrec.models.FeedbackRecord;
import java.sql.SQLException;
import java.util.List;

/**
 * Interface für den Feedback-Store (Repository Pattern)
 *
 * 1 Bewertung pro Titel und Medientyp, appendOrReplace ist idempotent; Einträge werden nie gelöscht
 */
public interface FeedbackRepository {

    List<FeedbackRecord> readAll() throws SQLException;

    // Erstellt oder ersetzt die Bewertung für (itemId, mediaType)
    void appendOrReplace(FeedbackRecord record) throws SQLException;
}
