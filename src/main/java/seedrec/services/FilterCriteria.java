package seedrec.services;

/**
 * Schwellenwerte für CandidateFilter
 */
public record FilterCriteria(double minRating, int minVoteCount, int maxAgeYears, boolean requireGenreOverlap) {

    // Voreinstellungen der einzelnen Discovery-Strategien
    public static final FilterCriteria SIMILAR = new FilterCriteria(6.0, 100, 50, true);
    public static final FilterCriteria GENRE = new FilterCriteria(6.5, 200, 40, true);
    public static final FilterCriteria LEXICAL = new FilterCriteria(6.0, 150, 45, true);
    public static final FilterCriteria CURATED_KEYWORD = new FilterCriteria(6.5, 200, 40, true);
    public static final FilterCriteria CAST_CREW = new FilterCriteria(6.0, 100, 50, false);
    public static final FilterCriteria WEB = new FilterCriteria(5.5, 50, 60, false);
}
