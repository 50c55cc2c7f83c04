package seedrec.services;

import seedrec.models.Genre;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Feste Nachschlagetabellen für Genres
 *
 * RARITY_WEIGHTS belohnt Übereinstimmung in seltenen Genres (IDs des Content-Verzeichnisses),
 * EXTERNAL_GENRE_MAP übersetzt Genre-Namen des Anreicherungsdienstes in Verzeichnis-Genre-Namen
 */
public final class GenreTables {

    public static final Map<Integer, Double> RARITY_WEIGHTS = Map.ofEntries(
            Map.entry(10770, 2.0),  // TV Movie
            Map.entry(10752, 1.8),  // War
            Map.entry(99, 1.6),     // Documentary
            Map.entry(10751, 1.5),  // Family
            Map.entry(16, 1.4),     // Animation
            Map.entry(37, 1.3),     // Western
            Map.entry(10402, 1.2),  // Music
            Map.entry(10749, 1.1)   // Romance
    );

    public static final Map<String, List<String>> EXTERNAL_GENRE_MAP = Map.ofEntries(
            Map.entry("Action", List.of("Action", "Adventure", "Thriller")),
            Map.entry("Adventure", List.of("Adventure", "Action", "Fantasy")),
            Map.entry("Animation", List.of("Animation", "Family")),
            Map.entry("Biography", List.of("Drama", "History")),
            Map.entry("Comedy", List.of("Comedy", "Romance")),
            Map.entry("Crime", List.of("Crime", "Drama", "Thriller")),
            Map.entry("Documentary", List.of("Documentary")),
            Map.entry("Drama", List.of("Drama", "Romance")),
            Map.entry("Family", List.of("Family", "Adventure", "Comedy")),
            Map.entry("Fantasy", List.of("Fantasy", "Adventure", "Drama")),
            Map.entry("Film-Noir", List.of("Drama", "Thriller")),
            Map.entry("Game-Show", List.of("Reality")),
            Map.entry("History", List.of("History", "Drama", "War")),
            Map.entry("Horror", List.of("Horror", "Thriller")),
            Map.entry("Music", List.of("Music", "Drama")),
            Map.entry("Musical", List.of("Music", "Romance")),
            Map.entry("Mystery", List.of("Mystery", "Thriller", "Drama")),
            Map.entry("News", List.of("News")),
            Map.entry("Reality-TV", List.of("Reality")),
            Map.entry("Romance", List.of("Romance", "Drama", "Comedy")),
            Map.entry("Sci-Fi", List.of("Science Fiction", "Action", "Adventure")),
            Map.entry("Sport", List.of("Sport")),
            Map.entry("Talk-Show", List.of("Talk-Show")),
            Map.entry("Thriller", List.of("Thriller", "Action", "Drama")),
            Map.entry("War", List.of("War", "Action", "Drama")),
            Map.entry("Western", List.of("Western", "Action", "Drama"))
    );

    private GenreTables() {}

    // Gängige Genres haben Gewicht 1.0
    public static double rarityWeight(int genreId) {
        return RARITY_WEIGHTS.getOrDefault(genreId, 1.0);
    }

    /**
     * Übersetzt eine kommaseparierte Genre-Liste des Anreicherungsdienstes in Verzeichnis-Genre-IDs
     *
     * Unbekannte Namen werden unverändert gesucht; Treffer per Teilstring (case-insensitive), ohne Duplikate
     */
    public static List<Integer> mapExternalGenres(String externalGenres, List<Genre> vocabulary) {
        var mapped = new ArrayList<Integer>();
        if (externalGenres == null || externalGenres.isBlank()) return mapped;

        for (String raw : externalGenres.split(",")) {
            String external = raw.trim();
            if (external.isEmpty()) continue;
            for (String target : EXTERNAL_GENRE_MAP.getOrDefault(external, List.of(external))) {
                String wanted = target.toLowerCase(Locale.ROOT);
                vocabulary.stream()
                        .filter(g -> {
                            String name = g.name().toLowerCase(Locale.ROOT);
                            return name.contains(wanted) || wanted.contains(name);
                        })
                        .findFirst()
                        .ifPresent(g -> {
                            if (!mapped.contains(g.id())) mapped.add(g.id());
                        });
            }
        }
        return mapped;
    }
}
