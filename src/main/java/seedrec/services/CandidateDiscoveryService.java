package seedrec.services;

import seedrec.clients.ClientException;
import seedrec.clients.ContentDirectoryClient;
import seedrec.clients.MetadataEnrichmentClient;
import seedrec.clients.WebSearchClient;
import seedrec.models.Credit;
import seedrec.models.DiscoverQuery;
import seedrec.models.ExternalMetadata;
import seedrec.models.Genre;
import seedrec.models.Item;
import seedrec.models.ItemKey;
import seedrec.models.Keyword;
import seedrec.models.MediaType;
import seedrec.models.WebSearchResult;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Sammelt Kandidaten zu einem Seed aus sechs unabhängigen Quellen
 *
 * Jede Strategie läuft als eigenes Future auf dem Strategie-Executor, ihre Teilabfragen auf dem Fetch-Executor.
 * Fehler einer Strategie ergeben eine leere Liste. Zusammengeführt wird erst nach allen Strategien,
 * in fester Reihenfolge (Similar, Genre, Lexikalisch, Keywords, Cast/Crew, Web), danach ggf. der Fallback.
 */
public class CandidateDiscoveryService {
    private static final Logger log = LoggerFactory.getLogger(CandidateDiscoveryService.class);

    static final Set<String> CREW_JOBS = Set.of("Director", "Writer", "Screenplay", "Creator");
    static final List<String> SITE_SUFFIXES = List.of(" - IMDb", " - Rotten Tomatoes");
    static final List<String> TYPE_SUFFIXES = List.of(" - Movie", " - Film", " - TV Show", " - Series");
    private static final Pattern YEAR = Pattern.compile("(\\d{4})");

    private final ContentDirectoryClient directory;
    private final WebSearchClient webSearch;
    private final MetadataEnrichmentClient enrichment;
    private final DiscoveryConfig config;
    private final Executor strategyExecutor;
    private final Executor fetchExecutor;
    private final CandidateFilter filter;

    // webSearch und enrichment dürfen null sein (nicht konfiguriert)
    public CandidateDiscoveryService(ContentDirectoryClient directory,
                                     WebSearchClient webSearch,
                                     MetadataEnrichmentClient enrichment,
                                     DiscoveryConfig config,
                                     Executor strategyExecutor,
                                     Executor fetchExecutor,
                                     CandidateFilter filter) {
        this.directory = directory;
        this.webSearch = webSearch;
        this.enrichment = enrichment;
        this.config = config;
        this.strategyExecutor = strategyExecutor;
        this.fetchExecutor = fetchExecutor;
        this.filter = filter;
    }

    @FunctionalInterface
    interface Step<T> {
        T call() throws ClientException;
    }

    public List<Item> discover(Item seed, List<Genre> vocabulary) {
        List<CompletableFuture<List<Item>>> strategies = List.of(
                strategy("similar", () -> similarContent(seed)),
                strategy("genre", () -> genreDiscovery(seed)),
                strategy("lexical", () -> lexicalSearch(seed)),
                strategy("keywords", () -> curatedKeywords(seed)),
                strategy("cast-crew", () -> castCrew(seed)),
                strategy("web", () -> webDiscovery(seed, vocabulary)));

        CompletableFuture.allOf(strategies.toArray(new CompletableFuture[0])).join();

        Set<ItemKey> seen = new HashSet<>();
        seen.add(seed.key());
        List<Item> merged = new ArrayList<>();
        for (CompletableFuture<List<Item>> strategy : strategies) {
            for (Item item : strategy.join()) {
                Item forced = item.withMediaType(seed.mediaType());
                if (seen.add(forced.key())) merged.add(forced);
            }
        }

        int found = merged.size();
        if (found < config.fallbackThreshold()) {
            merged.addAll(fallback(seed, seen, config.fallbackTarget() - found));
        }
        log.info("Discovery for '{}' produced {} candidates ({} fallback)",
                seed.title(), Math.min(merged.size(), config.maxResults()), merged.size() - found);

        return merged.size() > config.maxResults() ? List.copyOf(merged.subList(0, config.maxResults())) : merged;
    }

    // Fehler werden an der Task-Grenze abgefangen und ergeben "keine Kandidaten"
    private CompletableFuture<List<Item>> strategy(String name, Step<List<Item>> step) {
        return CompletableFuture.supplyAsync(() -> {
            try {
                List<Item> items = step.call();
                log.debug("Strategy {} returned {} candidates", name, items.size());
                return items;
            } catch (ClientException | RuntimeException e) {
                log.warn("Strategy {} failed: {}", name, e.getMessage());
                return List.of();
            }
        }, strategyExecutor);
    }

    // Teilabfragen parallel; Reihenfolge der Ergebnisse = Reihenfolge der Eingaben
    private <T> List<Item> fanOut(List<T> inputs, String label, SubQuery<T> query) {
        List<CompletableFuture<List<Item>>> futures = inputs.stream()
                .map(input -> CompletableFuture.supplyAsync(() -> {
                    try {
                        return query.run(input);
                    } catch (ClientException | RuntimeException e) {
                        log.warn("{} lookup for '{}' failed: {}", label, input, e.getMessage());
                        return List.<Item>of();
                    }
                }, fetchExecutor))
                .toList();
        CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();
        return futures.stream().flatMap(f -> f.join().stream()).toList();
    }

    @FunctionalInterface
    interface SubQuery<T> {
        List<Item> run(T input) throws ClientException;
    }

    List<Item> similarContent(Item seed) throws ClientException {
        var similar = directory.getSimilar(seed.id(), seed.mediaType());
        return finish(similar, seed, FilterCriteria.SIMILAR, config.similarLimit());
    }

    List<Item> genreDiscovery(Item seed) {
        List<Integer> genres = seed.genreIds().stream().limit(2).toList();
        if (genres.isEmpty()) return List.of();
        var found = fanOut(genres, "Genre", genreId ->
                directory.discover(seed.mediaType(), DiscoverQuery.byGenre(genreId, 100)));
        return finish(found, seed, FilterCriteria.GENRE, config.genreLimit());
    }

    List<Item> lexicalSearch(Item seed) {
        List<String> tokens = KeywordExtractor.topTokens(seed.title() + " " + seed.overview(), 5);
        var found = fanOut(tokens.stream().limit(3).toList(), "Title search",
                token -> directory.searchTitles(seed.mediaType(), token));
        return finish(found, seed, FilterCriteria.LEXICAL, config.keywordSearchLimit());
    }

    List<Item> curatedKeywords(Item seed) throws ClientException {
        List<Integer> keywordIds = directory.getKeywords(seed.id(), seed.mediaType()).stream()
                .limit(5)
                .map(Keyword::id)
                .toList();
        if (keywordIds.isEmpty()) return List.of();
        var found = directory.discover(seed.mediaType(), DiscoverQuery.byKeywords(keywordIds, 200));
        return finish(found, seed, FilterCriteria.CURATED_KEYWORD, config.curatedKeywordLimit());
    }

    List<Item> castCrew(Item seed) throws ClientException {
        var credits = directory.getCredits(seed.id(), seed.mediaType());
        Set<String> people = new LinkedHashSet<>();
        credits.topCast(5).forEach(c -> people.add(c.name()));
        credits.crew().stream()
                .filter(c -> CREW_JOBS.contains(c.job()))
                .limit(3)
                .map(Credit::name)
                .forEach(people::add);

        return fanOut(people.stream().limit(3).toList(), "Person", name -> {
            List<Integer> ids = directory.searchPerson(name);
            if (ids.isEmpty()) return List.of();
            var works = directory.getPersonCombinedWorks(ids.get(0)).stream()
                    .filter(w -> w.mediaType() == seed.mediaType())
                    .toList();
            return finish(works, seed, FilterCriteria.CAST_CREW, config.castCrewLimit());
        });
    }

    List<Item> webDiscovery(Item seed, List<Genre> vocabulary) throws ClientException {
        if (webSearch == null) return List.of();
        String kind = seed.mediaType() == MediaType.MOVIE ? "movies" : "shows";
        String query = seed.title() + " similar " + kind + " site:imdb.com OR site:rottentomatoes.com";
        List<WebSearchResult> results = webSearch.search(query).stream()
                .limit(config.webSearchLimit())
                .toList();
        var resolved = fanOut(results, "Web result", result ->
                resolve(result, seed, vocabulary).map(List::of).orElse(List.of()));
        return finish(resolved, seed, FilterCriteria.WEB, Integer.MAX_VALUE);
    }

    /**
     * Löst ein Suchergebnis in ein Item auf: Verzeichnis, dann Anreicherungsdienst, sonst nur aus dem Snippet
     */
    Optional<Item> resolve(WebSearchResult result, Item seed, List<Genre> vocabulary) throws ClientException {
        String title = cleanTitle(result.title());
        if (title.isBlank()) return Optional.empty();
        String snippet = result.snippet();

        try {
            Optional<Item> match = bestTitleMatch(directory.searchMulti(title), title);
            if (match.isPresent()) return Optional.of(match.get().asExternalSourced(snippet));
        } catch (ClientException e) {
            log.warn("Directory search for '{}' failed: {}", title, e.getMessage());
        }

        if (enrichment != null) {
            Optional<ExternalMetadata> metadata = enrichment.lookup(title, null);
            if (metadata.isPresent()) return Optional.of(fromMetadata(metadata.get(), title, snippet, vocabulary));
        }

        return Optional.of(Item.builder()
                .id(syntheticId(title))
                .mediaType(seed.mediaType())
                .title(title)
                .overview(snippet)
                .externalSourced(true)
                .sourceSnippet(snippet)
                .build());
    }

    // Exakter Titel vor Teilstring-Treffer
    static Optional<Item> bestTitleMatch(List<Item> items, String title) {
        String wanted = title.toLowerCase(Locale.ROOT);
        Optional<Item> exact = items.stream()
                .filter(i -> i.title().toLowerCase(Locale.ROOT).equals(wanted))
                .findFirst();
        if (exact.isPresent()) return exact;
        return items.stream()
                .filter(i -> i.title().toLowerCase(Locale.ROOT).contains(wanted))
                .findFirst();
    }

    private static Item fromMetadata(ExternalMetadata metadata, String title, String snippet, List<Genre> vocabulary) {
        String name = metadata.title() != null ? metadata.title() : title;
        String releaseDate = null;
        if (metadata.year() != null) {
            Matcher m = YEAR.matcher(metadata.year());
            if (m.find()) releaseDate = m.group(1) + "-01-01";
        }
        return Item.builder()
                .id(syntheticId(name))
                .mediaType(metadata.isSeries() ? MediaType.SERIES : MediaType.MOVIE)
                .title(name)
                .overview(metadata.plot())
                .releaseDate(releaseDate)
                .posterPath(metadata.poster())
                .rating(metadata.rating())
                .voteCount(metadata.voteCount())
                .genreIds(GenreTables.mapExternalGenres(metadata.genres(), vocabulary))
                .externalSourced(true)
                .sourceSnippet(snippet)
                .build();
    }

    // Entfernt den Seitennamen, sonst den ersten passenden Typ-Zusatz
    static String cleanTitle(String title) {
        if (title == null) return "";
        for (String suffix : SITE_SUFFIXES) {
            if (title.contains(suffix)) return title.replace(suffix, "").trim();
        }
        for (String suffix : TYPE_SUFFIXES) {
            if (title.contains(suffix)) return title.replace(suffix, "").trim();
        }
        return title.trim();
    }

    // Negativ und deterministisch, kollidiert daher nie mit Verzeichnis-IDs
    static int syntheticId(String title) {
        int hash = title.trim().toLowerCase(Locale.ROOT).hashCode();
        return -Math.abs(hash % 1_000_000_000) - 1;
    }

    private List<Item> fallback(Item seed, Set<ItemKey> seen, int missing) {
        if (missing <= 0) return List.of();
        try {
            List<Item> added = new ArrayList<>();
            for (Item item : directory.getSimilar(seed.id(), seed.mediaType())) {
                if (added.size() >= missing) break;
                Item forced = item.withMediaType(seed.mediaType());
                if (seen.add(forced.key())) added.add(forced.asFallback());
            }
            log.info("Fallback added {} candidates for '{}'", added.size(), seed.title());
            return added;
        } catch (ClientException | RuntimeException e) {
            log.warn("Fallback lookup for '{}' failed: {}", seed.title(), e.getMessage());
            return List.of();
        }
    }

    // Dedupliziert innerhalb der Strategie, entfernt den Seed, filtert und kappt
    private List<Item> finish(List<Item> items, Item seed, FilterCriteria criteria, int limit) {
        Map<ItemKey, Item> distinct = new LinkedHashMap<>();
        for (Item item : items) {
            if (item.id() == seed.id() && item.mediaType() == seed.mediaType()) continue;
            distinct.putIfAbsent(item.key(), item);
        }
        return filter.filter(new ArrayList<>(distinct.values()), seed, criteria).stream()
                .limit(limit)
                .collect(Collectors.toList());
    }
}
