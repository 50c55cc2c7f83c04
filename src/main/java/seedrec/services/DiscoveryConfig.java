package seedrec.services;

import seedrec.AppConfig;

/**
 * Limits der Candidate Discovery und der Ergebnisliste
 */
public record DiscoveryConfig(int maxResults,
                              int similarLimit,
                              int genreLimit,
                              int keywordSearchLimit,
                              int curatedKeywordLimit,
                              int castCrewLimit,
                              int webSearchLimit,
                              int fallbackThreshold,
                              int fallbackTarget,
                              int presentationLimit) {

    public static DiscoveryConfig defaults() {
        return new DiscoveryConfig(50, 20, 15, 10, 12, 5, 8, 10, 20, 12);
    }

    public static DiscoveryConfig fromConfig(AppConfig config) {
        var d = defaults();
        return new DiscoveryConfig(
                config.getInt("discovery.max-results", d.maxResults()),
                config.getInt("discovery.similar-limit", d.similarLimit()),
                config.getInt("discovery.genre-limit", d.genreLimit()),
                config.getInt("discovery.keyword-search-limit", d.keywordSearchLimit()),
                config.getInt("discovery.curated-keyword-limit", d.curatedKeywordLimit()),
                config.getInt("discovery.cast-crew-limit", d.castCrewLimit()),
                config.getInt("discovery.web-search-limit", d.webSearchLimit()),
                config.getInt("discovery.fallback-threshold", d.fallbackThreshold()),
                config.getInt("discovery.fallback-target", d.fallbackTarget()),
                config.getInt("recommendations.presentation-limit", d.presentationLimit()));
    }
}
