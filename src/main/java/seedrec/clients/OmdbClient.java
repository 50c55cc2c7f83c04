package seedrec.clients;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import seedrec.models.ExternalMetadata;
import java.net.http.HttpClient;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Optional;

/**
 * MetadataEnrichmentClient gegen die OMDb API (Suche per Titel)
 */
public class OmdbClient extends JsonHttpClient implements MetadataEnrichmentClient {
    private final String endpoint;
    private final String apiKey;

    public OmdbClient(String endpoint, String apiKey, Duration timeout) {
        this(HttpClient.newBuilder().connectTimeout(timeout).build(), new ObjectMapper(), endpoint, apiKey, timeout);
    }

    OmdbClient(HttpClient http, ObjectMapper mapper, String endpoint, String apiKey, Duration timeout) {
        super(http, mapper, timeout);
        this.endpoint = endpoint;
        this.apiKey = apiKey;
    }

    @Override
    public Optional<ExternalMetadata> lookup(String title, Integer year) throws ClientException {
        if (title == null || title.isBlank()) return Optional.empty();
        var params = new LinkedHashMap<String, String>();
        params.put("apikey", apiKey);
        params.put("t", year == null ? title : title + " " + year);
        return parseMetadata(get(url(endpoint, params)));
    }

    // OMDb meldet "nicht gefunden" mit HTTP 200 und Response = "False"
    static Optional<ExternalMetadata> parseMetadata(JsonNode root) {
        if (!"True".equals(text(root, "Response"))) return Optional.empty();
        String poster = text(root, "Poster");
        return Optional.of(new ExternalMetadata(
                text(root, "Title"),
                text(root, "Year"),
                text(root, "Genre"),
                parseDouble(text(root, "imdbRating")),
                parseVotes(text(root, "imdbVotes")),
                text(root, "Plot"),
                "N/A".equals(poster) ? null : poster,
                text(root, "Type")));
    }

    static double parseDouble(String value) {
        try {
            return value == null ? 0.0 : Double.parseDouble(value);
        } catch (NumberFormatException e) {
            return 0.0;  // "N/A"
        }
    }

    static int parseVotes(String value) {
        try {
            return value == null ? 0 : Integer.parseInt(value.replace(",", ""));
        } catch (NumberFormatException e) {
            return 0;
        }
    }
}
