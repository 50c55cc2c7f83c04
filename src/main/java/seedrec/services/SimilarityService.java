package seedrec.services;

import seedrec.clients.ClientException;
import seedrec.clients.EmbeddingClient;
import seedrec.models.Item;
import seedrec.models.Keyword;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.OptionalDouble;
import java.util.Set;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Service für die inhaltliche Ähnlichkeit zweier Titel
 *
 * Nutzt Embeddings, wenn der Dienst Vektoren liefert; sonst deterministischer lexikalischer Fallback
 */
public class SimilarityService {
    private static final Logger log = LoggerFactory.getLogger(SimilarityService.class);

    private final EmbeddingClient embeddings;

    // embeddings darf null sein: dann immer lexikalisch
    public SimilarityService(EmbeddingClient embeddings) {
        this.embeddings = embeddings;
    }

    /**
     * Kosinus-Ähnlichkeit der Embeddings beider Texte
     *
     * Leer, wenn einer der Vektoren leer ist oder der Dienst fehlschlägt
     */
    public OptionalDouble semantic(String a, String b) {
        if (embeddings == null) return OptionalDouble.empty();
        try {
            double[] va = embeddings.embed(a);
            double[] vb = embeddings.embed(b);
            if (va.length == 0 || vb.length == 0) return OptionalDouble.empty();
            return OptionalDouble.of(TextSimilarity.cosine(va, vb));
        } catch (ClientException e) {
            log.warn("Embedding service unavailable, using lexical similarity: {}", e.getMessage());
            return OptionalDouble.empty();
        }
    }

    /**
     * Inhaltliche Ähnlichkeit 0-1
     *
     * Basis (Embedding oder lexikalisch) + Tagline-Bonus (max. 0.1) + Bonus für kuratierte Schlagwörter (max. 0.15)
     */
    public double contentSimilarity(Item seed, Item candidate, List<Keyword> seedKeywords, List<Keyword> candidateKeywords) {
        String seedText = seed.taglineText().map(t -> seed.overview() + " " + t).orElse(seed.overview());
        String candidateText = candidate.overview();

        double base = semantic(seedText, candidateText).orElseGet(() ->
                TextSimilarity.lexicalItemSimilarity(seedText, candidateText, seed.tagline(), candidate.tagline()));

        double taglineBonus = 0.0;
        if (seed.taglineText().isPresent() && candidate.taglineText().isPresent()) {
            double taglineSimilarity = semantic(seed.tagline(), candidate.tagline())
                    .orElseGet(() -> TextSimilarity.jaccard(seed.tagline(), candidate.tagline()));
            taglineBonus = Math.max(0.0, Math.min(0.1, taglineSimilarity * 0.1));
        }

        double keywordBonus = Math.min(0.15, keywordOverlap(seedKeywords, candidateKeywords) * 0.15);
        return Math.max(0.0, Math.min(1.0, base + taglineBonus + keywordBonus));
    }

    // Anteil gemeinsamer Schlagwörter an der Vereinigung (per Name, case-insensitive)
    public static double keywordOverlap(List<Keyword> a, List<Keyword> b) {
        if (a.isEmpty() || b.isEmpty()) return 0.0;
        Set<String> namesA = names(a);
        Set<String> namesB = names(b);
        long common = namesA.stream().filter(namesB::contains).count();
        Set<String> union = new HashSet<>(namesA);
        union.addAll(namesB);
        return union.isEmpty() ? 0.0 : (double) common / union.size();
    }

    static Set<String> names(List<Keyword> keywords) {
        return keywords.stream()
                .map(k -> k.name().toLowerCase(Locale.ROOT))
                .collect(Collectors.toCollection(LinkedHashSet::new));
    }
}
