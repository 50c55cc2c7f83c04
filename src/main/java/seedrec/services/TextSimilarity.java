package seedrec.services;

import java.util.Arrays;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Reine Ähnlichkeitsfunktionen ohne I/O (Kosinus, lexikalische Jaccard-Ähnlichkeit)
 */
public final class TextSimilarity {

    private static final Set<String> STOP_WORDS = Set.of(
            "the", "and", "or", "but", "in", "on", "at", "to", "for", "of", "with", "by");

    private TextSimilarity() {}

    /**
     * Kosinus-Ähnlichkeit zweier Vektoren
     *
     * 0 bei leeren Vektoren, unterschiedlicher Länge oder Nullnorm
     */
    public static double cosine(double[] a, double[] b) {
        if (a == null || b == null || a.length == 0 || a.length != b.length) return 0.0;
        double dot = 0, normA = 0, normB = 0;
        for (int i = 0; i < a.length; i++) {
            dot += a[i] * b[i];
            normA += a[i] * a[i];
            normB += b[i] * b[i];
        }
        if (normA == 0 || normB == 0) return 0.0;
        return dot / (Math.sqrt(normA) * Math.sqrt(normB));
    }

    // Kleinbuchstaben, Satzzeichen entfernt, Wörter mit mehr als 2 Zeichen, ohne Stoppwörter
    public static List<String> normalizeWords(String text) {
        if (text == null || text.isBlank()) return List.of();
        return Arrays.stream(text.toLowerCase(Locale.ROOT).replaceAll("[^\\w\\s]", " ").split("\\s+"))
                .filter(w -> w.length() > 2)
                .filter(w -> !STOP_WORDS.contains(w))
                .toList();
    }

    /**
     * Jaccard-Ähnlichkeit auf Wortebene
     *
     * Gemeinsame Wörter werden über die Wortliste von a gezählt (Wiederholungen zählen mehrfach)
     */
    public static double jaccard(String a, String b) {
        return jaccard(normalizeWords(a), normalizeWords(b));
    }

    static double jaccard(List<String> wordsA, List<String> wordsB) {
        Set<String> union = new LinkedHashSet<>(wordsA);
        union.addAll(wordsB);
        if (union.isEmpty()) return 0.0;
        Set<String> inB = Set.copyOf(wordsB);
        long common = wordsA.stream().filter(inB::contains).count();
        return (double) common / union.size();
    }

    /**
     * Lexikalische Titel-Ähnlichkeit als Fallback für Embeddings
     *
     * Jaccard + 0.1 pro gemeinsamem seltenen Wort (höchstens 2 Vorkommen insgesamt)
     * + 0.05 pro gemeinsamem Tagline-Wort (max. 0.2), begrenzt auf 1
     */
    public static double lexicalItemSimilarity(String seedText, String candidateText,
                                               String seedTagline, String candidateTagline) {
        List<String> seedWords = normalizeWords(seedText);
        List<String> candidateWords = normalizeWords(candidateText);
        Set<String> union = new LinkedHashSet<>(seedWords);
        union.addAll(candidateWords);
        if (union.isEmpty()) return 0.0;

        Set<String> inCandidate = Set.copyOf(candidateWords);
        List<String> common = seedWords.stream().filter(inCandidate::contains).toList();
        double jaccard = (double) common.size() / union.size();

        Map<String, Integer> frequency = new HashMap<>();
        seedWords.forEach(w -> frequency.merge(w, 1, Integer::sum));
        candidateWords.forEach(w -> frequency.merge(w, 1, Integer::sum));
        double rareWordBonus = common.stream().filter(w -> frequency.get(w) <= 2).count() * 0.1;

        double taglineBonus = 0.0;
        if (seedTagline != null && !seedTagline.isBlank() && candidateTagline != null && !candidateTagline.isBlank()) {
            Set<String> candidateTaglineWords = Set.copyOf(normalizeWords(candidateTagline));
            long shared = normalizeWords(seedTagline).stream().filter(candidateTaglineWords::contains).count();
            taglineBonus = Math.min(0.2, shared * 0.05);
        }
        return Math.min(1.0, jaccard + rareWordBonus + taglineBonus);
    }
}
