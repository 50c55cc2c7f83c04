package seedrec.models;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/**
 * Medientyp eines Titels
 *
 * Der Wire-Wert entspricht dem Pfadsegment des Content-Verzeichnisses ("movie" bzw. "tv")
 */
public enum MediaType {
    MOVIE("movie"),
    SERIES("tv");

    private final String wireName;

    MediaType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    // Akzeptiert "movie", "tv" und "series" (case-insensitive)
    @JsonCreator
    public static MediaType fromString(String value) {
        if (value == null) throw new IllegalArgumentException("media type required");
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "movie" -> MOVIE;
            case "tv", "series" -> SERIES;
            default -> throw new IllegalArgumentException("unknown media type: " + value);
        };
    }
}
