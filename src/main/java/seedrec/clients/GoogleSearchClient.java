package seedrec.clients;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import seedrec.models.WebSearchResult;
import java.net.http.HttpClient;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;

/**
 * WebSearchClient gegen die Google Custom Search JSON API
 */
public class GoogleSearchClient extends JsonHttpClient implements WebSearchClient {
    private final String endpoint;
    private final String apiKey;
    private final String searchEngineId;

    public GoogleSearchClient(String endpoint, String apiKey, String searchEngineId, Duration timeout) {
        this(HttpClient.newBuilder().connectTimeout(timeout).build(), new ObjectMapper(), endpoint, apiKey, searchEngineId, timeout);
    }

    GoogleSearchClient(HttpClient http, ObjectMapper mapper, String endpoint, String apiKey, String searchEngineId, Duration timeout) {
        super(http, mapper, timeout);
        this.endpoint = endpoint;
        this.apiKey = apiKey;
        this.searchEngineId = searchEngineId;
    }

    @Override
    public List<WebSearchResult> search(String query) throws ClientException {
        var params = new LinkedHashMap<String, String>();
        params.put("key", apiKey);
        params.put("cx", searchEngineId);
        params.put("q", query);
        params.put("num", "10");
        return parseResults(get(url(endpoint, params)));
    }

    static List<WebSearchResult> parseResults(JsonNode root) {
        var results = new ArrayList<WebSearchResult>();
        for (JsonNode node : root.path("items")) {
            results.add(new WebSearchResult(text(node, "title"), text(node, "snippet"), text(node, "link")));
        }
        return results;
    }
}
