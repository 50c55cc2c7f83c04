package seedrec.services;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Extrahiert die häufigsten aussagekräftigen Wörter aus Titel und Beschreibung
 */
public final class KeywordExtractor {

    static final Set<String> STOP_WORDS = Set.of(
            "the", "and", "or", "but", "in", "on", "at", "to", "for", "of", "with", "by",
            "a", "an", "is", "are", "was", "were", "be", "been", "being", "have", "has",
            "had", "do", "does", "did", "will", "would", "could", "should", "may", "might",
            "this", "that", "these", "those", "i", "you", "he", "she", "it", "we", "they",
            "me", "him", "her", "us", "them", "my", "your", "his", "its", "our", "their");

    private KeywordExtractor() {}

    /**
     * Top-Wörter nach Häufigkeit absteigend, bei Gleichstand nach erstem Vorkommen
     *
     * Nur rein alphabetische Wörter mit mehr als 3 Zeichen, ohne Stoppwörter
     */
    public static List<String> topTokens(String text, int limit) {
        if (text == null || text.isBlank()) return List.of();
        Map<String, Integer> counts = new LinkedHashMap<>();
        Arrays.stream(text.toLowerCase(Locale.ROOT).replaceAll("[^\\w\\s]", " ").split("\\s+"))
                .filter(w -> w.length() > 3)
                .filter(w -> !STOP_WORDS.contains(w))
                .filter(w -> w.matches("[a-z]+"))
                .forEach(w -> counts.merge(w, 1, Integer::sum));

        // Stabile Sortierung erhält die Einfügereihenfolge bei gleicher Häufigkeit
        return counts.entrySet().stream()
                .sorted(Map.Entry.<String, Integer>comparingByValue().reversed())
                .limit(limit)
                .map(Map.Entry::getKey)
                .toList();
    }
}
