package seedrec.clients;

import seedrec.models.Credits;
import seedrec.models.DiscoverQuery;
import seedrec.models.Genre;
import seedrec.models.Item;
import seedrec.models.Keyword;
import seedrec.models.MediaType;
import java.util.List;
import java.util.Optional;

/**
 * Interface für das Content-Verzeichnis (Filme und Serien)
 *
 * Jeder Aufruf kann fehlschlagen; Aufrufer behandeln eine ClientException als leeres Ergebnis
 */
public interface ContentDirectoryClient {

    // Suche über Filme und Serien gleichzeitig
    List<Item> searchMulti(String query) throws ClientException;

    // Titelsuche innerhalb eines Medientyps
    List<Item> searchTitles(MediaType mediaType, String query) throws ClientException;

    List<Item> getSimilar(int id, MediaType mediaType) throws ClientException;

    // Vollständiger Titel inkl. Tagline und Genres; leer wenn unbekannt
    Optional<Item> getDetails(int id, MediaType mediaType) throws ClientException;

    Credits getCredits(int id, MediaType mediaType) throws ClientException;

    List<Keyword> getKeywords(int id, MediaType mediaType) throws ClientException;

    List<Item> discover(MediaType mediaType, DiscoverQuery query) throws ClientException;

    List<Genre> getGenreVocabulary(MediaType mediaType) throws ClientException;

    List<Integer> searchPerson(String name) throws ClientException;

    // Alle Werke einer Person (Filme und Serien)
    List<Item> getPersonCombinedWorks(int personId) throws ClientException;
}
