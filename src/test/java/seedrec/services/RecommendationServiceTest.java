package seedrec.services;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import seedrec.clients.ContentDirectoryClient;
import seedrec.clients.WebSearchClient;
import seedrec.models.Credits;
import seedrec.models.FeedbackWeights;
import seedrec.models.Genre;
import seedrec.models.Item;
import seedrec.models.ItemKey;
import seedrec.models.MediaType;
import seedrec.models.ScoreBreakdown;
import seedrec.models.ScoredRecommendation;
import seedrec.models.WebSearchResult;
import seedrec.repos.FeedbackRepository;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.stream.IntStream;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

/**
 * Tests für RecommendationService mit echter Discovery und echtem Scoring
 *
 * Nur die externen Dienste und der Feedback-Store sind gemockt
 */
@ExtendWith(MockitoExtension.class)
class RecommendationServiceTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-06-01T00:00:00Z"), ZoneOffset.UTC);
    private static final List<Genre> VOCABULARY = List.of(
            new Genre(878, "Science Fiction"), new Genre(18, "Drama"), new Genre(16, "Animation"));

    @Mock private ContentDirectoryClient mockDirectory;
    @Mock private WebSearchClient mockWebSearch;
    @Mock private FeedbackRepository mockRepo;

    private ScoringService scoring;
    private RecommendationService service;
    private Item seed;
    private Item candidateA;
    private Item candidateB;

    @BeforeEach
    void setUp() {
        var discovery = new CandidateDiscoveryService(mockDirectory, mockWebSearch, null, DiscoveryConfig.defaults(),
                Runnable::run, Runnable::run, new CandidateFilter(CLOCK));
        scoring = new ScoringService(mockDirectory, new SimilarityService(null), Runnable::run);
        var feedback = new FeedbackService(mockRepo, mockDirectory, CLOCK);
        service = new RecommendationService(mockDirectory, discovery, scoring, feedback, 12);

        seed = Item.builder().id(78).mediaType(MediaType.MOVIE).title("Blade Runner")
                .overview("A blade runner hunts rogue androids in a dystopian future")
                .rating(8.0).voteCount(20000).releaseDate("1982-06-25").genreIds(List.of(878, 18)).build();
        candidateA = Item.builder().id(335984).mediaType(MediaType.MOVIE).title("Blade Runner 2049")
                .overview("A young blade runner uncovers a dark dystopian secret")
                .rating(8.1).voteCount(15000).releaseDate("2017-10-04").genreIds(List.of(878, 18)).build();
        candidateB = Item.builder().id(9323).mediaType(MediaType.MOVIE).title("Ghost in the Shell")
                .overview("A cyborg policewoman pursues a hacker known as the Puppet Master")
                .rating(7.9).voteCount(2000).releaseDate("1995-11-18").genreIds(List.of(16)).build();
    }

    private void stubScenario() throws Exception {
        when(mockDirectory.getDetails(78, MediaType.MOVIE)).thenReturn(Optional.of(seed));
        when(mockDirectory.getGenreVocabulary(any())).thenReturn(VOCABULARY);
        when(mockDirectory.getSimilar(78, MediaType.MOVIE)).thenReturn(List.of(candidateA));
        when(mockDirectory.getCredits(anyInt(), any())).thenReturn(Credits.empty());
        when(mockWebSearch.search(anyString())).thenReturn(List.of(
                new WebSearchResult("Ghost in the Shell - IMDb", "Cyberpunk classic about identity", "https://imdb.com/x")));
        when(mockDirectory.searchMulti("Ghost in the Shell")).thenReturn(List.of(candidateB));
        when(mockRepo.readAll()).thenReturn(List.of());
    }

    private ScoredRecommendation find(List<ScoredRecommendation> result, int id) {
        return result.stream().filter(r -> r.item().id() == id).findFirst().orElseThrow();
    }

    @Test
    @DisplayName("Szenario: passender Kandidat mit Genre >= 100 und Ton 20, Web-Kandidat ohne Genre mit +5")
    void testRank_ShouldScoreEndToEndScenario() throws Exception {
        // ARRANGE
        stubScenario();

        // ACT
        List<ScoredRecommendation> result = service.rank(seed);

        // ASSERT
        assertEquals(2, result.size());
        ScoreBreakdown a = find(result, 335984).breakdown();
        assertTrue(a.genreScore() >= 100, "Genre-Score sollte mindestens 100 sein");
        assertEquals(20, a.toneScore());

        ScoredRecommendation b = find(result, 9323);
        assertTrue(b.item().externalSourced());
        assertEquals(0, b.breakdown().genreScore());
        assertTrue(b.breakdown().justification().contains("Curated web recommendation"));
        assertTrue(b.breakdown().justification().contains(" | Web source: Cyberpunk classic about identity"));
        int unflagged = scoring.score(seed, List.of(candidateB), VOCABULARY, FeedbackWeights.empty()).get(0).totalScore();
        assertEquals(unflagged + 5, b.totalScore(), "Web-Kandidat sollte den Diversitätsbonus erhalten");
    }

    @Test
    @DisplayName("Ergebnis ist absteigend sortiert und enthält keine Duplikate")
    void testRank_ShouldReturnSortedListWithoutDuplicates() throws Exception {
        // ARRANGE
        stubScenario();

        // ACT
        List<ScoredRecommendation> result = service.rank(seed);

        // ASSERT
        for (int i = 1; i < result.size(); i++) {
            assertTrue(result.get(i - 1).totalScore() >= result.get(i).totalScore());
        }
        var keys = new HashSet<ItemKey>();
        result.forEach(r -> assertTrue(keys.add(r.item().key()), "Doppelter Titel: " + r.item().title()));
    }

    @Test
    @DisplayName("Zwei Läufe mit gleichen Antworten liefern dieselbe Liste")
    void testRank_ShouldBeIdempotent() throws Exception {
        // ARRANGE
        stubScenario();

        // ACT
        List<ScoredRecommendation> first = service.rank(seed);
        List<ScoredRecommendation> second = service.rank(seed);

        // ASSERT
        assertEquals(first, second);
    }

    @Test
    @DisplayName("Ungültiger Seed wird vor jeder Discovery abgelehnt")
    void testRank_ShouldRejectInvalidSeed() {
        // ARRANGE
        Item noId = seed.toBuilder().id(0).build();
        Item noType = seed.toBuilder().mediaType(null).build();

        // ACT + ASSERT
        assertThrows(SeedValidationException.class, () -> service.rank(noId));
        assertThrows(SeedValidationException.class, () -> service.rank(noType));
        assertThrows(SeedValidationException.class, () -> service.rank(null));
        verifyNoInteractions(mockDirectory, mockWebSearch, mockRepo);
    }

    @Test
    @DisplayName("Ohne Kandidaten wird eine leere Liste geliefert, kein Fehler")
    void testRank_ShouldReturnEmptyListWithoutCandidates() throws Exception {
        // ARRANGE
        when(mockDirectory.getCredits(78, MediaType.MOVIE)).thenReturn(Credits.empty());

        // ACT
        List<ScoredRecommendation> result = service.rank(seed);

        // ASSERT
        assertTrue(result.isEmpty());
    }

    @Test
    @DisplayName("Unerwarteter Fehler beim Genre-Vokabular bricht das Ranking nicht ab")
    void testRank_ShouldContinueWhenGenreVocabularyThrowsUnchecked() throws Exception {
        // ARRANGE
        when(mockDirectory.getDetails(78, MediaType.MOVIE)).thenReturn(Optional.of(seed));
        when(mockDirectory.getGenreVocabulary(any())).thenThrow(new IllegalStateException("bad payload"));
        when(mockDirectory.getSimilar(78, MediaType.MOVIE)).thenReturn(List.of(candidateA));
        when(mockDirectory.getCredits(anyInt(), any())).thenReturn(Credits.empty());
        when(mockRepo.readAll()).thenReturn(List.of());

        // ACT
        List<ScoredRecommendation> result = service.rank(seed);

        // ASSERT
        assertEquals(1, result.size());
        assertEquals(335984, result.get(0).item().id());
    }

    @Test
    @DisplayName("Unerwartete Fehler bei Seed-Details und Feedback-Store führen zu leerem Ergebnis statt Exception")
    void testRank_ShouldNotPropagateUncheckedCollaboratorFailures() throws Exception {
        // ARRANGE
        when(mockDirectory.getDetails(78, MediaType.MOVIE)).thenThrow(new IllegalStateException("bad payload"));
        when(mockDirectory.getGenreVocabulary(any())).thenThrow(new IllegalStateException("bad payload"));
        when(mockRepo.readAll()).thenThrow(new IllegalStateException("pool closed"));
        when(mockDirectory.getCredits(78, MediaType.MOVIE)).thenReturn(Credits.empty());

        // ACT
        List<ScoredRecommendation> result = assertDoesNotThrow(() -> service.rank(seed));

        // ASSERT
        assertTrue(result.isEmpty());
    }

    @Test
    @DisplayName("Sortierung ist stabil bei gleichem Score")
    void testSortByScore_ShouldBeStable() {
        // ARRANGE
        var first = new ScoredRecommendation(candidateA, 50, ScoreBreakdown.empty("a"));
        var second = new ScoredRecommendation(candidateB, 50, ScoreBreakdown.empty("b"));
        var best = new ScoredRecommendation(seed, 90, ScoreBreakdown.empty("c"));

        // ACT
        List<ScoredRecommendation> sorted = RecommendationService.sortByScore(List.of(first, second, best));

        // ASSERT
        assertEquals(List.of(best, first, second), sorted);
    }

    @Test
    @DisplayName("Suche liefert höchstens 8 Treffer")
    void testSearch_ShouldLimitResults() throws Exception {
        // ARRANGE
        var many = IntStream.rangeClosed(1, 20)
                .mapToObj(i -> candidateA.toBuilder().id(i).build())
                .toList();
        when(mockDirectory.searchMulti("blade")).thenReturn(many);

        // ACT
        List<Item> result = service.search("blade");

        // ASSERT
        assertEquals(8, result.size());
        assertTrue(service.search(" ").isEmpty());
    }
}
