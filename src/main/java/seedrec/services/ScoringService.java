package seedrec.services;

import seedrec.clients.ClientException;
import seedrec.clients.ContentDirectoryClient;
import seedrec.models.Credit;
import seedrec.models.Credits;
import seedrec.models.FeedbackWeights;
import seedrec.models.Genre;
import seedrec.models.Item;
import seedrec.models.Keyword;
import seedrec.models.ScoreBreakdown;
import seedrec.models.ScoredRecommendation;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.function.DoubleSupplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Bewertet Kandidaten relativ zum Seed mit acht additiven Teil-Scores (Gesamt 0-120)
 *
 * Genre 0-150, Rating 0-20, Inhalt 0-25, Cast/Crew 0-40, Popularität 0-10, Stimmung 0-20,
 * Feedback 0-20, Keywords 0-45. Web-Funde +5, Fallback-Kandidaten -40 nach der Kappung.
 */
public class ScoringService {
    private static final Logger log = LoggerFactory.getLogger(ScoringService.class);

    static final int MAX_TOTAL = 120;
    static final int FALLBACK_PENALTY = 40;
    static final int EXTERNAL_BOOST = 5;

    private final ContentDirectoryClient directory;
    private final SimilarityService similarity;
    private final Executor executor;

    public ScoringService(ContentDirectoryClient directory, SimilarityService similarity, Executor executor) {
        this.directory = directory;
        this.similarity = similarity;
        this.executor = executor;
    }

    /**
     * Bewertet alle Kandidaten; die Reihenfolge entspricht der Eingabe
     *
     * Credits und Keywords des Seeds werden einmal pro Lauf geladen
     */
    public List<ScoredRecommendation> score(Item seed, List<Item> candidates, List<Genre> vocabulary, FeedbackWeights weights) {
        Optional<Credits> seedCredits = fetch("credits", seed, () -> directory.getCredits(seed.id(), seed.mediaType()));
        List<Keyword> seedKeywords = fetch("keywords", seed, () -> directory.getKeywords(seed.id(), seed.mediaType()))
                .orElse(List.of());
        Map<Integer, String> genreNames = new HashMap<>();
        vocabulary.forEach(g -> genreNames.putIfAbsent(g.id(), g.name()));
        var context = new SeedContext(seed, seedCredits, seedKeywords, genreNames, weights);

        List<CompletableFuture<ScoredRecommendation>> futures = candidates.stream()
                .map(c -> CompletableFuture.supplyAsync(() -> scoreSafely(context, c), executor))
                .toList();
        CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();
        return futures.stream().map(CompletableFuture::join).toList();
    }

    private record SeedContext(Item seed,
                               Optional<Credits> credits,
                               List<Keyword> keywords,
                               Map<Integer, String> genreNames,
                               FeedbackWeights weights) {
    }

    private ScoredRecommendation scoreSafely(SeedContext context, Item candidate) {
        try {
            return scoreOne(context, candidate);
        } catch (RuntimeException e) {
            log.warn("Scoring of '{}' failed, using basic score: {}", candidate.title(), e.getMessage());
            return basicScore(candidate);
        }
    }

    static ScoredRecommendation basicScore(Item candidate) {
        int score = (int) Math.round(candidate.rating() / 10 * 50);
        return new ScoredRecommendation(candidate, score, ScoreBreakdown.empty("Basic similarity score"));
    }

    private ScoredRecommendation scoreOne(SeedContext context, Item candidate) {
        Item seed = context.seed();
        Optional<Credits> candidateCredits = fetch("credits", candidate,
                () -> directory.getCredits(candidate.id(), candidate.mediaType()));
        List<Keyword> candidateKeywords = fetch("keywords", candidate,
                () -> directory.getKeywords(candidate.id(), candidate.mediaType())).orElse(List.of());

        List<Integer> commonGenres = commonGenres(seed, candidate);
        double genre = guard("genre", candidate, () -> genreScore(seed, candidate));
        double rating = guard("rating", candidate, () -> ratingScore(candidate));
        double content = guard("content", candidate,
                () -> similarity.contentSimilarity(seed, candidate, context.keywords(), candidateKeywords) * 25);
        double castCrew = guard("cast/crew", candidate, () -> context.credits().isPresent() && candidateCredits.isPresent()
                ? castCrewScore(context.credits().get(), candidateCredits.get())
                : 0.0);
        double popularity = guard("popularity", candidate, () -> popularityScore(candidate));
        double tone = guard("tone", candidate, () -> toneScore(seed, candidate));
        double feedback = guard("feedback", candidate, () -> feedbackScore(candidate, context.weights()));
        List<String> commonKeywords = commonKeywords(context.keywords(), candidateKeywords);
        double keyword = guard("keyword", candidate, () -> keywordScore(context.keywords(), candidateKeywords));

        int total = combine(genre + rating + content + castCrew + popularity + tone + feedback + keyword,
                candidate.externalSourced(), candidate.fallback());

        var justification = new ArrayList<String>();
        if (candidate.fallback()) justification.add("Fallback recommendation (limited genre match)");
        if (candidate.externalSourced() && hasText(candidate.sourceSnippet())) justification.add("Curated web recommendation");
        List<String> sharedNames = commonGenres.stream()
                .map(context.genreNames()::get)
                .filter(Objects::nonNull)
                .limit(3)
                .toList();
        if (!sharedNames.isEmpty()) justification.add("Shares " + String.join(", ", sharedNames) + " themes");
        if (candidate.rating() >= 7) justification.add(String.format(Locale.ROOT, "High rating (%.1f)", candidate.rating()));
        if (candidate.voteCount() > 1000) justification.add("Well-rated by many viewers");
        if (content > 12) justification.add("Similar plot elements and themes");
        if (castCrew > 15) justification.add("Shares key cast/crew members");
        else if (castCrew > 8) justification.add("Some cast/crew overlap");
        if (candidate.voteCount() > 5000) justification.add("Popular and well-known");
        if (tone > 18) justification.add("Similar tone and atmosphere");
        if (feedback > 5) justification.add("Matches your preferences");
        if (keyword > 15) justification.add("Shares thematic keywords: " + String.join(", ", commonKeywords));

        var breakdown = new ScoreBreakdown(
                (int) Math.round(genre),
                (int) Math.round(rating),
                (int) Math.round(content),
                (int) Math.round(castCrew),
                (int) Math.round(popularity),
                (int) Math.round(tone),
                (int) Math.round(feedback),
                (int) Math.round(keyword),
                justification(justification, candidate));
        log.debug("Scored '{}': {} {}", candidate.title(), total, breakdown);
        return new ScoredRecommendation(candidate, total, breakdown);
    }

    /**
     * Summe + Web-Bonus, gekappt auf 0-120 und gerundet; danach Fallback-Abzug (Untergrenze 0)
     */
    static int combine(double subScoreSum, boolean externalSourced, boolean fallback) {
        double raw = subScoreSum + (externalSourced ? EXTERNAL_BOOST : 0);
        int total = (int) Math.round(clamp(raw, 0, MAX_TOTAL));
        return fallback ? Math.max(0, total - FALLBACK_PENALTY) : total;
    }

    static String justification(List<String> parts, Item candidate) {
        String text = String.join(", ", parts);
        if (candidate.externalSourced() && hasText(candidate.sourceSnippet())) {
            String snippet = candidate.sourceSnippet();
            String preview = snippet.length() > 100 ? snippet.substring(0, 100) + "..." : snippet;
            text += " | Web source: " + preview;
        }
        return text.isEmpty() ? "Similar content style" : text;
    }

    static List<Integer> commonGenres(Item seed, Item candidate) {
        return seed.genreIds().stream().distinct().filter(candidate.genreIds()::contains).toList();
    }

    static double genreScore(Item seed, Item candidate) {
        List<Integer> common = commonGenres(seed, candidate);
        if (common.isEmpty()) return 0.0;
        int seedCount = (int) seed.genreIds().stream().distinct().count();

        double base = (double) common.size() / Math.max(seedCount, 1) * 80;
        double avgRarity = common.stream().mapToDouble(GenreTables::rarityWeight).average().orElse(1.0);
        double rarityBonus = Math.min(30, avgRarity * 15);
        double multiGenreBonus = common.size() > 1 ? 15 : 0;
        double diversityBonus = Math.min(15, common.size() * 3);
        double perfectBonus = common.size() == seedCount ? 10 : 0;
        return clamp(base + rarityBonus + multiGenreBonus + diversityBonus + perfectBonus, 0, 150);
    }

    static double ratingScore(Item candidate) {
        double normalized = clamp((candidate.rating() - 1) / 9, 0, 1);
        double reliability = Math.min(5, Math.log10(Math.max(1, candidate.voteCount())) * 1.5);
        return normalized * 15 + reliability;
    }

    // 15 wenn beide Regie, 10 wenn beide Drehbuch, sonst 5 pro gemeinsamer Person
    static double castCrewScore(Credits seed, Credits candidate) {
        Set<String> shared = new HashSet<>(seed.keyPeople());
        shared.retainAll(candidate.keyPeople());
        double score = 0;
        for (String person : shared) {
            if (seed.hasCrewRole(person, Credit.Role.DIRECTOR) && candidate.hasCrewRole(person, Credit.Role.DIRECTOR)) {
                score += 15;
            } else if (seed.hasCrewRole(person, Credit.Role.WRITER) && candidate.hasCrewRole(person, Credit.Role.WRITER)) {
                score += 10;
            } else {
                score += 5;
            }
        }
        return Math.min(40, score);
    }

    static double popularityScore(Item candidate) {
        return Math.min(1, Math.log10(Math.max(1, candidate.voteCount())) / 5) * 10;
    }

    static double toneScore(Item seed, Item candidate) {
        String seedText = seed.taglineText().map(t -> seed.overview() + " " + t).orElse(seed.overview());
        return ToneClassifier.compatibility(ToneClassifier.classify(seedText), ToneClassifier.classify(candidate.overview()));
    }

    // Rohgewichte, nicht normalisiert
    static double feedbackScore(Item candidate, FeedbackWeights weights) {
        double sum = candidate.genreIds().stream().distinct()
                .mapToDouble(g -> Math.min(10, weights.genreWeight(g) * 0.5))
                .sum();
        return clamp(sum, 0, 20);
    }

    static double keywordScore(List<Keyword> seedKeywords, List<Keyword> candidateKeywords) {
        if (seedKeywords.isEmpty() || candidateKeywords.isEmpty()) return 0.0;
        Set<String> seedNames = SimilarityService.names(seedKeywords);
        Set<String> candidateNames = SimilarityService.names(candidateKeywords);
        long common = seedNames.stream().filter(candidateNames::contains).count();
        if (common == 0) return 0.0;
        Set<String> union = new HashSet<>(seedNames);
        union.addAll(candidateNames);

        double base = (double) common / union.size() * 25;
        double multiBonus = Math.min(8, common * 1.5);
        double rareBonus = Math.min(8, common);
        double perfectBonus = common == Math.min(seedKeywords.size(), candidateKeywords.size()) ? 4 : 0;
        return clamp(base + multiBonus + rareBonus + perfectBonus, 0, 45);
    }

    // Gemeinsame Keywords in der Schreibweise des Seeds
    static List<String> commonKeywords(List<Keyword> seedKeywords, List<Keyword> candidateKeywords) {
        Set<String> candidateNames = SimilarityService.names(candidateKeywords);
        return seedKeywords.stream()
                .map(Keyword::name)
                .filter(n -> candidateNames.contains(n.toLowerCase(Locale.ROOT)))
                .distinct()
                .toList();
    }

    private <T> Optional<T> fetch(String what, Item item, CandidateDiscoveryService.Step<T> step) {
        try {
            return Optional.ofNullable(step.call());
        } catch (ClientException | RuntimeException e) {
            log.warn("Could not load {} for '{}': {}", what, item.title(), e.getMessage());
            return Optional.empty();
        }
    }

    private static double guard(String name, Item candidate, DoubleSupplier subScore) {
        try {
            return subScore.getAsDouble();
        } catch (RuntimeException e) {
            log.warn("{} score for '{}' failed: {}", name, candidate.title(), e.getMessage());
            return 0.0;
        }
    }

    private static double clamp(double value, double min, double max) {
        return Math.max(min, Math.min(max, value));
    }

    private static boolean hasText(String s) {
        return s != null && !s.isBlank();
    }
}
