package seedrec.clients;

import seedrec.models.WebSearchResult;
import java.util.List;

/**
 * Interface für die (optionale) Websuche
 */
public interface WebSearchClient {

    List<WebSearchResult> search(String query) throws ClientException;
}
