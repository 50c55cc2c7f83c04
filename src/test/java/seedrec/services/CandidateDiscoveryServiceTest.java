package seedrec.services;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import seedrec.clients.ClientException;
import seedrec.clients.ContentDirectoryClient;
import seedrec.clients.MetadataEnrichmentClient;
import seedrec.clients.WebSearchClient;
import seedrec.models.Credit;
import seedrec.models.Credits;
import seedrec.models.DiscoverQuery;
import seedrec.models.ExternalMetadata;
import seedrec.models.Genre;
import seedrec.models.Item;
import seedrec.models.Keyword;
import seedrec.models.MediaType;
import seedrec.models.WebSearchResult;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.IntStream;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.*;

/**
 * Unit-Tests für CandidateDiscoveryService
 *
 * Beide Executors laufen synchron im Test-Thread (Runnable::run), damit die Reihenfolge der Aufrufe feststeht
 */
@ExtendWith(MockitoExtension.class)
class CandidateDiscoveryServiceTest {

    private static final List<Genre> VOCABULARY = List.of(
            new Genre(878, "Science Fiction"), new Genre(18, "Drama"), new Genre(16, "Animation"));

    @Mock private ContentDirectoryClient mockDirectory;
    @Mock private WebSearchClient mockWebSearch;
    @Mock private MetadataEnrichmentClient mockEnrichment;

    private CandidateFilter filter;
    private Item seed;

    @BeforeEach
    void setUp() {
        filter = new CandidateFilter(Clock.fixed(Instant.parse("2024-06-01T00:00:00Z"), ZoneOffset.UTC));
        seed = Item.builder().id(78).mediaType(MediaType.MOVIE).title("Blade Runner")
                .overview("A blade runner hunts rogue androids in a dystopian future")
                .rating(8.0).voteCount(20000).releaseDate("1982-06-25").genreIds(List.of(878, 18)).build();
    }

    private CandidateDiscoveryService service(WebSearchClient webSearch, MetadataEnrichmentClient enrichment,
                                              DiscoveryConfig config) {
        return new CandidateDiscoveryService(mockDirectory, webSearch, enrichment, config,
                Runnable::run, Runnable::run, filter);
    }

    // Helper-Methode: Kandidat, der alle Filter der Similar- und Genre-Strategie besteht
    private Item candidate(int id) {
        return Item.builder().id(id).mediaType(MediaType.MOVIE).title("Candidate " + id)
                .rating(7.5).voteCount(1000).releaseDate("2015-01-01").genreIds(List.of(878)).build();
    }

    private List<Integer> ids(List<Item> items) {
        return items.stream().map(Item::id).toList();
    }

    @Test
    @DisplayName("Totalausfall aller Strategien liefert Fallback-Kandidaten")
    void testDiscover_ShouldReturnFallbackItemsWhenAllStrategiesFail() throws Exception {
        // ARRANGE
        List<Item> unfiltered = IntStream.rangeClosed(1, 12)
                .mapToObj(i -> Item.builder().id(100 + i).mediaType(MediaType.MOVIE).title("Old " + i).build())
                .toList();
        when(mockDirectory.getSimilar(78, MediaType.MOVIE))
                .thenThrow(new ClientException("down"))
                .thenReturn(unfiltered);
        when(mockDirectory.discover(any(), any())).thenThrow(new ClientException("down"));
        when(mockDirectory.searchTitles(any(), anyString())).thenThrow(new ClientException("down"));
        when(mockDirectory.getKeywords(78, MediaType.MOVIE)).thenThrow(new ClientException("down"));
        when(mockDirectory.getCredits(78, MediaType.MOVIE)).thenThrow(new ClientException("down"));
        when(mockWebSearch.search(anyString())).thenThrow(new ClientException("down"));

        // ACT
        List<Item> result = service(mockWebSearch, null, DiscoveryConfig.defaults()).discover(seed, VOCABULARY);

        // ASSERT
        assertTrue(result.size() >= Math.min(10, unfiltered.size()));
        assertTrue(result.stream().allMatch(Item::fallback), "Alle Kandidaten sollten als Fallback markiert sein");
    }

    @Test
    @DisplayName("Totalausfall inklusive Fallback liefert eine leere Liste")
    void testDiscover_ShouldReturnEmptyListWhenEverythingFails() throws Exception {
        // ARRANGE
        when(mockDirectory.getSimilar(78, MediaType.MOVIE)).thenThrow(new ClientException("down"));
        when(mockDirectory.discover(any(), any())).thenThrow(new ClientException("down"));
        when(mockDirectory.searchTitles(any(), anyString())).thenThrow(new ClientException("down"));
        when(mockDirectory.getKeywords(78, MediaType.MOVIE)).thenThrow(new ClientException("down"));
        when(mockDirectory.getCredits(78, MediaType.MOVIE)).thenThrow(new RuntimeException("broken"));

        // ACT
        List<Item> result = service(null, null, DiscoveryConfig.defaults()).discover(seed, VOCABULARY);

        // ASSERT
        assertTrue(result.isEmpty());
    }

    @Test
    @DisplayName("Zusammenführung folgt der Strategie-Reihenfolge und entfernt Duplikate und den Seed")
    void testDiscover_ShouldMergeInPriorityOrderWithoutDuplicates() throws Exception {
        // ARRANGE
        when(mockDirectory.getSimilar(78, MediaType.MOVIE)).thenReturn(List.of(seed, candidate(1), candidate(2)));
        when(mockDirectory.discover(eq(MediaType.MOVIE), any())).thenReturn(List.of(candidate(2), candidate(3)));
        when(mockDirectory.getCredits(78, MediaType.MOVIE)).thenReturn(Credits.empty());

        // ACT
        List<Item> result = service(null, null, DiscoveryConfig.defaults()).discover(seed, VOCABULARY);

        // ASSERT
        assertEquals(List.of(1, 2, 3), ids(result));
        assertTrue(result.stream().noneMatch(Item::fallback));
        // Genre-Abfrage für beide Seed-Genres
        verify(mockDirectory, times(2)).discover(eq(MediaType.MOVIE), any());
    }

    @Test
    @DisplayName("Ergebnis wird auf maxResults gekappt, Fallback füllt nur mit neuen Titeln auf")
    void testDiscover_ShouldTruncateToMaxResults() throws Exception {
        // ARRANGE
        List<Item> similar = new ArrayList<>();
        for (int i = 1; i <= 5; i++) similar.add(candidate(i));
        when(mockDirectory.getSimilar(78, MediaType.MOVIE)).thenReturn(similar);
        when(mockDirectory.getCredits(78, MediaType.MOVIE)).thenReturn(Credits.empty());
        var config = new DiscoveryConfig(3, 20, 15, 10, 12, 5, 8, 10, 20, 12);

        // ACT
        List<Item> result = service(null, null, config).discover(seed, VOCABULARY);

        // ASSERT
        assertEquals(List.of(1, 2, 3), ids(result));
    }

    @Test
    @DisplayName("Websuche löst Titel über Verzeichnis, Anreicherung und Snippet auf")
    void testDiscover_ShouldResolveWebResults() throws Exception {
        // ARRANGE
        when(mockDirectory.getCredits(78, MediaType.MOVIE)).thenReturn(Credits.empty());
        when(mockWebSearch.search(anyString())).thenReturn(List.of(
                new WebSearchResult("Ghost in the Shell - IMDb", "Anime classic about cyborgs", "https://imdb.com/a"),
                new WebSearchResult("Unknown Indie Film - Rotten Tomatoes", "Small film", "https://rottentomatoes.com/b"),
                new WebSearchResult("Nothing Known - Movie", "No data", "https://imdb.com/c")));
        Item ghost = Item.builder().id(9323).mediaType(MediaType.SERIES).title("Ghost in the Shell")
                .rating(7.9).voteCount(2000).releaseDate("1995-11-18").genreIds(List.of(16)).build();
        when(mockDirectory.searchMulti(anyString())).thenAnswer(inv ->
                "Ghost in the Shell".equals(inv.getArgument(0)) ? List.of(ghost) : List.of());
        var indie = new ExternalMetadata("Unknown Indie Film", "2019", "Sci-Fi", 7.0, 1234, "A plot", null, "movie");
        when(mockEnrichment.lookup(anyString(), isNull())).thenAnswer(inv ->
                "Unknown Indie Film".equals(inv.getArgument(0)) ? Optional.of(indie) : Optional.empty());

        // ACT
        List<Item> result = service(mockWebSearch, mockEnrichment, DiscoveryConfig.defaults()).discover(seed, VOCABULARY);

        // ASSERT
        assertEquals(2, result.size(), "Snippet-Kandidat ohne Rating sollte herausgefiltert werden");
        Item adopted = result.get(0);
        assertEquals(9323, adopted.id());
        assertEquals(MediaType.MOVIE, adopted.mediaType(), "Medientyp sollte auf den des Seeds gesetzt werden");
        assertTrue(adopted.externalSourced());
        assertEquals("Anime classic about cyborgs", adopted.sourceSnippet());

        Item enriched = result.get(1);
        assertTrue(enriched.id() < 0, "Externe Titel sollten eine negative ID bekommen");
        assertEquals(List.of(878), enriched.genreIds());
        assertEquals(1234, enriched.voteCount());
        assertTrue(enriched.externalSourced());
    }

    @Test
    @DisplayName("Cast/Crew-Strategie fragt höchstens drei Personen ab")
    void testCastCrew_ShouldLimitPeople() throws Exception {
        // ARRANGE
        var credits = new Credits(
                List.of(Credit.cast("A", 0), Credit.cast("B", 1),
                        Credit.cast("C", 2), Credit.cast("D", 3)),
                List.of(Credit.crew("Ridley Scott", "Director")));
        when(mockDirectory.getCredits(78, MediaType.MOVIE)).thenReturn(credits);
        when(mockDirectory.searchPerson(anyString())).thenReturn(List.of(1));
        Item otherGenre = candidate(5).toBuilder().genreIds(List.of(35)).build();
        Item series = candidate(6).toBuilder().mediaType(MediaType.SERIES).build();
        when(mockDirectory.getPersonCombinedWorks(1)).thenReturn(List.of(otherGenre, series));

        // ACT
        List<Item> result = service(null, null, DiscoveryConfig.defaults()).castCrew(seed);

        // ASSERT
        verify(mockDirectory, times(3)).searchPerson(anyString());
        verify(mockDirectory, never()).searchPerson("D");
        assertEquals(List.of(5, 5, 5), ids(result), "Nur Filme, ohne Genre-Pflicht, Dedup erst beim Zusammenführen");
    }

    // Helper-Methode: Kandidat mit frei wählbaren Filter-Eigenschaften
    private Item candidate(int id, double rating, int votes, String releaseDate, List<Integer> genreIds) {
        return Item.builder().id(id).mediaType(MediaType.MOVIE).title("Candidate " + id)
                .rating(rating).voteCount(votes).releaseDate(releaseDate).genreIds(genreIds).build();
    }

    @Test
    @DisplayName("Titelsuche fragt nur die drei häufigsten Wörter im Medientyp des Seeds ab")
    void testLexicalSearch_ShouldQueryTopThreeTokensAndApplyVoteFloor() throws Exception {
        // ARRANGE
        when(mockDirectory.searchTitles(eq(MediaType.MOVIE), anyString())).thenAnswer(invocation ->
                "blade".equals(invocation.getArgument(1))
                        ? List.of(candidate(5, 7.0, 160, "2010-01-01", List.of(878)),
                                  candidate(6, 7.0, 149, "2010-01-01", List.of(878)))
                        : List.of());

        // ACT
        List<Item> result = service(null, null, DiscoveryConfig.defaults()).lexicalSearch(seed);

        // ASSERT
        assertEquals(List.of(5), ids(result), "Kandidat mit weniger als 150 Stimmen sollte herausfallen");
        verify(mockDirectory).searchTitles(MediaType.MOVIE, "blade");
        verify(mockDirectory).searchTitles(MediaType.MOVIE, "runner");
        verify(mockDirectory).searchTitles(MediaType.MOVIE, "hunts");
        verify(mockDirectory, times(3)).searchTitles(any(), anyString());
    }

    @Test
    @DisplayName("Kuratierte Keywords: die ersten fünf IDs gehen mit mindestens 200 Stimmen an Discover")
    void testCuratedKeywords_ShouldDiscoverByFirstFiveKeywords() throws Exception {
        // ARRANGE
        List<Keyword> keywords = IntStream.rangeClosed(1, 6).mapToObj(i -> new Keyword(i, "keyword " + i)).toList();
        when(mockDirectory.getKeywords(78, MediaType.MOVIE)).thenReturn(keywords);
        when(mockDirectory.discover(MediaType.MOVIE, DiscoverQuery.byKeywords(List.of(1, 2, 3, 4, 5), 200)))
                .thenReturn(List.of(
                        candidate(9, 7.0, 250, "2010-01-01", List.of(878)),
                        candidate(10, 7.0, 199, "2010-01-01", List.of(878)),
                        candidate(11, 6.4, 250, "2010-01-01", List.of(878)),
                        candidate(12, 7.0, 250, "1980-01-01", List.of(878)),
                        candidate(13, 7.0, 250, "2010-01-01", List.of(16))));

        // ACT
        List<Item> result = service(null, null, DiscoveryConfig.defaults()).curatedKeywords(seed);

        // ASSERT
        assertEquals(List.of(9), ids(result), "Nur Kandidat 9 besteht Bewertung, Stimmen, Alter und Genre-Überlappung");
    }

    @Test
    @DisplayName("Seitennamen und Typ-Zusätze werden aus Suchtiteln entfernt")
    void testCleanTitle_ShouldStripSuffixes() {
        assertEquals("Heat", CandidateDiscoveryService.cleanTitle("Heat - IMDb"));
        assertEquals("Heat", CandidateDiscoveryService.cleanTitle("Heat - Rotten Tomatoes"));
        assertEquals("Dark", CandidateDiscoveryService.cleanTitle("Dark - TV Show"));
        assertEquals("Heat", CandidateDiscoveryService.cleanTitle("Heat"));
        assertEquals("", CandidateDiscoveryService.cleanTitle(null));
    }

    @Test
    @DisplayName("Exakter Titel wird Teilstring-Treffern vorgezogen")
    void testBestTitleMatch_ShouldPreferExactMatch() {
        // ARRANGE
        Item resurrection = Item.builder().id(1).mediaType(MediaType.MOVIE).title("Alien Resurrection").build();
        Item alien = Item.builder().id(2).mediaType(MediaType.MOVIE).title("Alien").build();

        // ACT + ASSERT
        assertEquals(2, CandidateDiscoveryService.bestTitleMatch(List.of(resurrection, alien), "alien").orElseThrow().id());
        assertEquals(1, CandidateDiscoveryService.bestTitleMatch(List.of(resurrection), "Alien").orElseThrow().id());
        assertTrue(CandidateDiscoveryService.bestTitleMatch(List.of(resurrection), "Aliens").isEmpty());
    }

    @Test
    @DisplayName("Synthetische IDs sind negativ und für gleiche Titel identisch")
    void testSyntheticId_ShouldBeNegativeAndDeterministic() {
        assertTrue(CandidateDiscoveryService.syntheticId("Heat") < 0);
        assertEquals(CandidateDiscoveryService.syntheticId("Heat"), CandidateDiscoveryService.syntheticId(" heat "));
        assertNotEquals(CandidateDiscoveryService.syntheticId("Heat"), CandidateDiscoveryService.syntheticId("Ronin"));
    }
}
