package seedrec.services;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import seedrec.clients.ClientException;
import seedrec.clients.EmbeddingClient;
import seedrec.models.Item;
import seedrec.models.Keyword;
import seedrec.models.MediaType;
import java.util.List;
import java.util.OptionalDouble;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

/**
 * Unit-Tests für SimilarityService
 *
 * Verwendet Mockito zum Mocken des EmbeddingClient
 */
@ExtendWith(MockitoExtension.class)
class SimilarityServiceTest {

    @Mock
    private EmbeddingClient mockEmbeddings;

    private Item item(String overview, String tagline) {
        return Item.builder().id(1).mediaType(MediaType.MOVIE).title("T").overview(overview).tagline(tagline).build();
    }

    @Test
    @DisplayName("Leerer Vektor führt zum lexikalischen Fallback mit reproduzierbarem Ergebnis")
    void testContentSimilarity_ShouldFallBackToLexicalOnEmptyVector() throws Exception {
        // ARRANGE
        when(mockEmbeddings.embed(anyString())).thenReturn(new double[0]);
        var service = new SimilarityService(mockEmbeddings);
        Item seed = item("androids hunted across neon city", null);
        Item candidate = item("androids escape from neon desert", null);

        // ACT
        double first = service.contentSimilarity(seed, candidate, List.of(), List.of());
        double second = service.contentSimilarity(seed, candidate, List.of(), List.of());

        // ASSERT
        double lexical = TextSimilarity.lexicalItemSimilarity(seed.overview(), candidate.overview(), null, null);
        assertEquals(lexical, first, 1e-9);
        assertEquals(first, second);
    }

    @Test
    @DisplayName("Ohne Embedding-Client wird ohne externen Aufruf lexikalisch verglichen")
    void testSemantic_ShouldBeEmptyWithoutClient() {
        // ARRANGE
        var service = new SimilarityService(null);

        // ACT
        OptionalDouble result = service.semantic("a", "b");

        // ASSERT
        assertTrue(result.isEmpty());
    }

    @Test
    @DisplayName("Fehler des Embedding-Dienstes ergibt keinen semantischen Wert")
    void testSemantic_ShouldBeEmptyOnClientException() throws Exception {
        // ARRANGE
        when(mockEmbeddings.embed(anyString())).thenThrow(new ClientException("timeout"));
        var service = new SimilarityService(mockEmbeddings);

        // ACT
        OptionalDouble result = service.semantic("a", "b");

        // ASSERT
        assertTrue(result.isEmpty());
    }

    @Test
    @DisplayName("Embeddings werden per Kosinus verglichen und das Ergebnis auf 1 begrenzt")
    void testContentSimilarity_ShouldUseEmbeddingsWhenAvailable() throws Exception {
        // ARRANGE
        when(mockEmbeddings.embed(anyString())).thenReturn(new double[]{0.6, 0.8});
        var service = new SimilarityService(mockEmbeddings);
        Item seed = item("something", "tagline one");
        Item candidate = item("entirely different", "tagline two");

        // ACT
        double result = service.contentSimilarity(seed, candidate, List.of(), List.of());

        // ASSERT
        assertEquals(1.0, result, 1e-9);
    }

    @Test
    @DisplayName("Keyword-Überschneidung wird case-insensitive über die Vereinigung berechnet")
    void testKeywordOverlap_ShouldCompareNamesIgnoringCase() {
        // ARRANGE
        var a = List.of(new Keyword(1, "Android"), new Keyword(2, "dystopia"));
        var b = List.of(new Keyword(3, "android"), new Keyword(4, "rain"));

        // ACT
        double overlap = SimilarityService.keywordOverlap(a, b);

        // ASSERT
        assertEquals(1.0 / 3, overlap, 1e-9);
        assertEquals(0.0, SimilarityService.keywordOverlap(a, List.of()));
    }
}
