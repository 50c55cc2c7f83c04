package seedrec.clients;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import seedrec.models.Credit;
import seedrec.models.Credits;
import seedrec.models.DiscoverQuery;
import seedrec.models.Genre;
import seedrec.models.Item;
import seedrec.models.Keyword;
import seedrec.models.MediaType;
import java.net.http.HttpClient;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * ContentDirectoryClient gegen die TMDB API v3
 *
 * Parst die JSON-Antworten mit Jackson (JsonNode) direkt in Items; nur Seite 1 wird abgefragt
 */
public class TmdbClient extends JsonHttpClient implements ContentDirectoryClient {
    private final String baseUrl;
    private final String apiKey;

    public TmdbClient(String baseUrl, String apiKey, Duration timeout) {
        this(HttpClient.newBuilder().connectTimeout(timeout).build(), new ObjectMapper(), baseUrl, apiKey, timeout);
    }

    TmdbClient(HttpClient http, ObjectMapper mapper, String baseUrl, String apiKey, Duration timeout) {
        super(http, mapper, timeout);
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.apiKey = apiKey;
    }

    @Override
    public List<Item> searchMulti(String query) throws ClientException {
        if (query == null || query.isBlank()) return List.of();
        var root = call("/search/multi", Map.of("query", query, "page", "1"));
        // Personen-Treffer werden verworfen (nur Filme und Serien)
        return parseItems(root.path("results"), null);
    }

    @Override
    public List<Item> searchTitles(MediaType mediaType, String query) throws ClientException {
        var root = call("/search/" + mediaType.wireName(), Map.of("query", query, "page", "1"));
        return parseItems(root.path("results"), mediaType);
    }

    @Override
    public List<Item> getSimilar(int id, MediaType mediaType) throws ClientException {
        var root = call("/" + mediaType.wireName() + "/" + id + "/similar", Map.of("page", "1"));
        return parseItems(root.path("results"), mediaType);
    }

    @Override
    public Optional<Item> getDetails(int id, MediaType mediaType) throws ClientException {
        try {
            return Optional.ofNullable(parseItem(call("/" + mediaType.wireName() + "/" + id, Map.of()), mediaType));
        } catch (ClientException e) {
            if (e.getStatusCode() == 404) return Optional.empty();
            throw e;
        }
    }

    @Override
    public Credits getCredits(int id, MediaType mediaType) throws ClientException {
        return parseCredits(call("/" + mediaType.wireName() + "/" + id + "/credits", Map.of()));
    }

    @Override
    public List<Keyword> getKeywords(int id, MediaType mediaType) throws ClientException {
        var root = call("/" + mediaType.wireName() + "/" + id + "/keywords", Map.of());
        // Filme liefern "keywords", Serien "results"
        var array = root.has("keywords") ? root.path("keywords") : root.path("results");
        var keywords = new ArrayList<Keyword>();
        for (JsonNode node : array) {
            keywords.add(new Keyword(node.path("id").asInt(), node.path("name").asText()));
        }
        return keywords;
    }

    @Override
    public List<Item> discover(MediaType mediaType, DiscoverQuery query) throws ClientException {
        var params = new LinkedHashMap<String, String>();
        if (!query.genreIds().isEmpty()) {
            params.put("with_genres", query.genreIds().stream().map(String::valueOf).collect(Collectors.joining(",")));
        }
        if (!query.keywordIds().isEmpty()) {
            params.put("with_keywords", query.keywordIds().stream().map(String::valueOf).collect(Collectors.joining("|")));
        }
        params.put("sort_by", query.sortBy());
        params.put("vote_count.gte", String.valueOf(query.minVoteCount()));
        params.put("page", "1");
        return parseItems(call("/discover/" + mediaType.wireName(), params).path("results"), mediaType);
    }

    @Override
    public List<Genre> getGenreVocabulary(MediaType mediaType) throws ClientException {
        var genres = new ArrayList<Genre>();
        for (JsonNode node : call("/genre/" + mediaType.wireName() + "/list", Map.of()).path("genres")) {
            genres.add(new Genre(node.path("id").asInt(), node.path("name").asText()));
        }
        return genres;
    }

    @Override
    public List<Integer> searchPerson(String name) throws ClientException {
        var ids = new ArrayList<Integer>();
        for (JsonNode node : call("/search/person", Map.of("query", name, "page", "1")).path("results")) {
            ids.add(node.path("id").asInt());
        }
        return ids;
    }

    @Override
    public List<Item> getPersonCombinedWorks(int personId) throws ClientException {
        return parseItems(call("/person/" + personId + "/combined_credits", Map.of()).path("cast"), null);
    }

    private JsonNode call(String path, Map<String, String> params) throws ClientException {
        var all = new LinkedHashMap<String, String>();
        all.put("api_key", apiKey);
        all.putAll(params);
        return get(url(baseUrl + path, all));
    }

    // defaultType == null: Medientyp kommt aus dem Feld "media_type", sonst wird der Eintrag übersprungen
    static List<Item> parseItems(JsonNode results, MediaType defaultType) {
        var items = new ArrayList<Item>();
        for (JsonNode node : results) {
            Item item = parseItem(node, defaultType);
            if (item != null) items.add(item);
        }
        return items;
    }

    static Item parseItem(JsonNode node, MediaType defaultType) {
        MediaType type = defaultType;
        String wireType = text(node, "media_type");
        if (wireType != null) {
            if (!"movie".equals(wireType) && !"tv".equals(wireType)) return null;
            type = MediaType.fromString(wireType);
        }
        if (type == null || !node.hasNonNull("id")) return null;

        var genreIds = new ArrayList<Integer>();
        node.path("genre_ids").forEach(g -> genreIds.add(g.asInt()));
        // Detail-Antworten liefern "genres" als Objekte statt "genre_ids"
        node.path("genres").forEach(g -> genreIds.add(g.path("id").asInt()));

        String title = text(node, "title");
        String date = text(node, "release_date");
        return Item.builder()
                .id(node.path("id").asInt())
                .mediaType(type)
                .title(title != null ? title : text(node, "name"))
                .overview(text(node, "overview"))
                .tagline(text(node, "tagline"))
                .releaseDate(date != null ? date : text(node, "first_air_date"))
                .posterPath(text(node, "poster_path"))
                .rating(node.path("vote_average").asDouble(0.0))
                .voteCount(node.path("vote_count").asInt(0))
                .genreIds(genreIds)
                .build();
    }

    static Credits parseCredits(JsonNode root) {
        var cast = new ArrayList<Credit>();
        for (JsonNode node : root.path("cast")) {
            cast.add(Credit.cast(node.path("name").asText(), node.path("order").asInt(cast.size())));
        }
        var crew = new ArrayList<Credit>();
        for (JsonNode node : root.path("crew")) {
            crew.add(Credit.crew(node.path("name").asText(), text(node, "job")));
        }
        return new Credits(cast, crew);
    }
}
