package seedrec.repos;

import seedrec.models.FeedbackRecord;
import seedrec.models.MediaType;
import java.sql.Array;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * JDBC-Implementierung des FeedbackRepository Interfaces
 *
 * Genres, Besetzung und Crew liegen als PostgreSQL-Arrays in der feedback-Tabelle (siehe schema.sql)
 */
public class JdbcFeedbackRepository implements FeedbackRepository {
    private final Db db;

    public JdbcFeedbackRepository(Db db) {
        this.db = db;
    }

    @Override
    public List<FeedbackRecord> readAll() throws SQLException {
        String sql = """
            SELECT item_id, media_type, stars, rated_at, genre_ids, cast_names, crew_names
            FROM feedback
            ORDER BY rated_at
            """;
        var records = new ArrayList<FeedbackRecord>();
        try (var c = db.get();
             var ps = c.prepareStatement(sql);
             var rs = ps.executeQuery()) {
            while (rs.next()) {
                records.add(mapFeedbackRecord(rs));
            }
        }
        return records;
    }

    // ON CONFLICT ersetzt eine bestehende Bewertung für denselben Titel (idempotent)
    @Override
    public void appendOrReplace(FeedbackRecord record) throws SQLException {
        String sql = """
            INSERT INTO feedback(item_id, media_type, stars, rated_at, genre_ids, cast_names, crew_names)
            VALUES (?, ?, ?, ?, ?, ?, ?)
            ON CONFLICT (item_id, media_type)
            DO UPDATE SET stars = EXCLUDED.stars, rated_at = EXCLUDED.rated_at,
                          genre_ids = EXCLUDED.genre_ids, cast_names = EXCLUDED.cast_names,
                          crew_names = EXCLUDED.crew_names
            """;
        try (var c = db.get();
             var ps = c.prepareStatement(sql)) {
            ps.setInt(1, record.itemId());
            ps.setString(2, record.mediaType().wireName());
            ps.setInt(3, record.stars());
            ps.setTimestamp(4, Timestamp.from(record.ratedAt()));
            ps.setArray(5, c.createArrayOf("integer", record.genreIds().toArray()));
            ps.setArray(6, c.createArrayOf("text", record.castNames().toArray()));
            ps.setArray(7, c.createArrayOf("text", record.crewNames().toArray()));
            ps.executeUpdate();
        }
    }

    // Helper-Methode: Mappt ResultSet-Zeile zu FeedbackRecord
    private FeedbackRecord mapFeedbackRecord(ResultSet rs) throws SQLException {
        return new FeedbackRecord(
                rs.getInt("item_id"),
                MediaType.fromString(rs.getString("media_type")),
                rs.getInt("stars"),
                rs.getTimestamp("rated_at").toInstant(),
                toIntegers(rs.getArray("genre_ids")),
                toStrings(rs.getArray("cast_names")),
                toStrings(rs.getArray("crew_names"))
        );
    }

    private static List<Integer> toIntegers(Array array) throws SQLException {
        if (array == null) return List.of();
        var values = new ArrayList<Integer>();
        for (Object value : (Object[]) array.getArray()) {
            values.add(((Number) value).intValue());
        }
        return values;
    }

    private static List<String> toStrings(Array array) throws SQLException {
        if (array == null) return List.of();
        return Arrays.stream((Object[]) array.getArray()).map(String::valueOf).toList();
    }
}
