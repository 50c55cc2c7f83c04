package seedrec.models;

/**
 * Teil-Scores einer Empfehlung plus lesbare Begründung
 */
public record ScoreBreakdown(int genreScore,
                             int ratingScore,
                             int contentScore,
                             int castCrewScore,
                             int popularityScore,
                             int toneScore,
                             int feedbackScore,
                             int keywordScore,
                             String justification) {

    public static ScoreBreakdown empty(String justification) {
        return new ScoreBreakdown(0, 0, 0, 0, 0, 0, 0, 0, justification);
    }
}
