package seedrec.models;

import java.util.List;

/**
 * Filter für die "Discover"-Abfrage des Content-Verzeichnisses
 *
 * Genre-IDs werden UND-verknüpft, Keyword-IDs ODER-verknüpft
 */
public record DiscoverQuery(List<Integer> genreIds, List<Integer> keywordIds, int minVoteCount, String sortBy) {

    public static final String SORT_BY_RATING = "vote_average.desc";

    public DiscoverQuery {
        genreIds = genreIds == null ? List.of() : List.copyOf(genreIds);
        keywordIds = keywordIds == null ? List.of() : List.copyOf(keywordIds);
    }

    public static DiscoverQuery byGenre(int genreId, int minVoteCount) {
        return new DiscoverQuery(List.of(genreId), List.of(), minVoteCount, SORT_BY_RATING);
    }

    public static DiscoverQuery byKeywords(List<Integer> keywordIds, int minVoteCount) {
        return new DiscoverQuery(List.of(), keywordIds, minVoteCount, SORT_BY_RATING);
    }
}
