package seedrec.models;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.OptionalInt;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit-Tests für die Models Item, MediaType, Credits und FeedbackWeights
 */
class ItemTest {

    @Test
    @DisplayName("Erscheinungsjahr wird aus dem Datum gelesen, ungültige Daten ergeben leer")
    void testReleaseYear_ShouldParseLeadingYear() {
        assertEquals(OptionalInt.of(1982), Item.builder().releaseDate("1982-06-25").build().releaseYear());
        assertEquals(OptionalInt.of(2017), Item.builder().releaseDate("2017").build().releaseYear());
        assertTrue(Item.builder().releaseDate("unknown").build().releaseYear().isEmpty());
        assertTrue(Item.builder().build().releaseYear().isEmpty());
    }

    @Test
    @DisplayName("Provenienz-Flags werden gesetzt, ohne die Identität zu ändern")
    void testProvenanceFlags_ShouldKeepKey() {
        // ARRANGE
        Item item = Item.builder().id(78).mediaType(MediaType.MOVIE).title("Blade Runner").build();

        // ACT
        Item web = item.asExternalSourced("snippet");
        Item fallback = item.asFallback();

        // ASSERT
        assertTrue(web.externalSourced());
        assertEquals("snippet", web.sourceSnippet());
        assertTrue(fallback.fallback());
        assertFalse(item.fallback() || item.externalSourced());
        assertEquals(item.key(), web.key());
        assertNotEquals(item.key(), item.withMediaType(MediaType.SERIES).key());
    }

    @Test
    @DisplayName("MediaType akzeptiert movie, tv und series")
    void testMediaTypeFromString_ShouldAcceptAliases() {
        assertEquals(MediaType.MOVIE, MediaType.fromString("Movie"));
        assertEquals(MediaType.SERIES, MediaType.fromString("tv"));
        assertEquals(MediaType.SERIES, MediaType.fromString(" series "));
        assertThrows(IllegalArgumentException.class, () -> MediaType.fromString("person"));
        assertThrows(IllegalArgumentException.class, () -> MediaType.fromString(null));
    }

    @Test
    @DisplayName("MediaType wird unabhängig von der Standard-Locale erkannt")
    void testMediaTypeFromString_ShouldIgnoreDefaultLocale() {
        // ARRANGE
        Locale previous = Locale.getDefault();
        Locale.setDefault(Locale.forLanguageTag("tr-TR"));
        try {
            // ACT + ASSERT
            assertEquals(MediaType.MOVIE, MediaType.fromString("MOVIE"));
            assertEquals(MediaType.SERIES, MediaType.fromString("SERIES"));
        } finally {
            Locale.setDefault(previous);
        }
    }

    @Test
    @DisplayName("Schlüsselpersonen sind Top-Besetzung plus Regie und Drehbuch")
    void testKeyPeople_ShouldIncludeCastDirectorAndWriter() {
        // ARRANGE
        var credits = new Credits(
                List.of(Credit.cast("Rutger Hauer", 1), Credit.cast("Harrison Ford", 0)),
                List.of(Credit.crew("Ridley Scott", "Director"), Credit.crew("Vangelis", "Original Music Composer"),
                        Credit.crew("Hampton Fancher", "Writer")));

        // ACT + ASSERT
        assertEquals(List.of("Harrison Ford", "Rutger Hauer", "Ridley Scott", "Hampton Fancher"),
                List.copyOf(credits.keyPeople()));
    }

    @Test
    @DisplayName("Normalisierte Gewichte beziehen sich auf das Maximum")
    void testFeedbackWeights_ShouldNormalizeByMaximum() {
        // ARRANGE
        var weights = new FeedbackWeights(Map.of(27, 10.0, 53, 4.0), Map.of());

        // ACT
        var normalized = weights.normalizedGenreWeights();

        // ASSERT
        assertEquals(1.0, normalized.get(27));
        assertEquals(0.4, normalized.get(53), 1e-9);
        assertEquals(0.0, weights.genreWeight(18));
        assertTrue(FeedbackWeights.empty().normalizedPersonWeights().isEmpty());
    }
}
