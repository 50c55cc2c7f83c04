package seedrec.services;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Einordnung eines Textes in eine Grundstimmung
 *
 * Der erste Treffer in der Reihenfolge SERIOUS, LIGHT, ACTION, MYSTERY gewinnt (Teilstring-Suche)
 */
public final class ToneClassifier {

    static final Map<Tone, List<String>> TONE_KEYWORDS = new LinkedHashMap<>();

    static {
        TONE_KEYWORDS.put(Tone.SERIOUS, List.of("dark", "gritty", "serious", "dramatic", "intense", "violent",
                "crime", "murder", "corruption", "politics", "social", "realistic", "dystopian", "bleak"));
        TONE_KEYWORDS.put(Tone.LIGHT, List.of("funny", "comedy", "light", "cheerful", "family", "feel-good",
                "romantic", "adventure", "fantasy", "magical"));
        TONE_KEYWORDS.put(Tone.ACTION, List.of("action", "thriller", "suspense", "adventure", "war", "fighting",
                "chase", "explosion"));
        TONE_KEYWORDS.put(Tone.MYSTERY, List.of("mystery", "suspense", "thriller", "investigation", "detective",
                "clue", "puzzle"));
    }

    private ToneClassifier() {}

    public static Tone classify(String text) {
        if (text == null || text.isBlank()) return Tone.NEUTRAL;
        String lower = text.toLowerCase(Locale.ROOT);
        for (var entry : TONE_KEYWORDS.entrySet()) {
            if (entry.getValue().stream().anyMatch(lower::contains)) return entry.getKey();
        }
        return Tone.NEUTRAL;
    }

    /**
     * Punkte für die Stimmungsverträglichkeit (0-20)
     *
     * Gleiche Stimmung 20 (LIGHT nur 10, NEUTRAL 0), SERIOUS/MYSTERY und ACTION/MYSTERY 15
     */
    public static int compatibility(Tone seed, Tone candidate) {
        if (seed == candidate) {
            return switch (seed) {
                case NEUTRAL -> 0;
                case LIGHT -> 10;
                default -> 20;
            };
        }
        if (isPair(seed, candidate, Tone.SERIOUS, Tone.MYSTERY)) return 15;
        // Thriller-Begriffe liegen in der MYSTERY-Liste, daher ACTION/MYSTERY als Action-Thriller-Paar
        if (isPair(seed, candidate, Tone.ACTION, Tone.MYSTERY)) return 15;
        return 0;
    }

    private static boolean isPair(Tone a, Tone b, Tone x, Tone y) {
        return (a == x && b == y) || (a == y && b == x);
    }
}
