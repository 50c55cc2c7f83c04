package seedrec.models;

/**
 * Bewerteter Kandidat: totalScore liegt immer im Bereich 0-120
 */
public record ScoredRecommendation(Item item, int totalScore, ScoreBreakdown breakdown) {

    public ScoredRecommendation {
        totalScore = Math.max(0, Math.min(120, totalScore));
    }
}
