package seedrec.models;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Aufsummierte Präferenzgewichte aus positiven Bewertungen
 *
 * Die Rohgewichte fließen unnormalisiert in den Feedback-Score; die normalisierte Sicht (0-1)
 * ist nur für die Anzeige gedacht
 */
public record FeedbackWeights(Map<Integer, Double> genreWeights, Map<String, Double> personWeights) {

    public FeedbackWeights {
        genreWeights = genreWeights == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(genreWeights));
        personWeights = personWeights == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(personWeights));
    }

    public static FeedbackWeights empty() {
        return new FeedbackWeights(Map.of(), Map.of());
    }

    public double genreWeight(int genreId) {
        return genreWeights.getOrDefault(genreId, 0.0);
    }

    public Map<Integer, Double> normalizedGenreWeights() {
        return normalize(genreWeights);
    }

    public Map<String, Double> normalizedPersonWeights() {
        return normalize(personWeights);
    }

    private static <K> Map<K, Double> normalize(Map<K, Double> weights) {
        double max = weights.values().stream().mapToDouble(Double::doubleValue).max().orElse(0.0);
        Map<K, Double> normalized = new LinkedHashMap<>();
        if (max <= 0) return normalized;
        weights.forEach((key, weight) -> normalized.put(key, weight / max));
        return normalized;
    }
}
