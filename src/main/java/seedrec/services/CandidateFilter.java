package seedrec.services;

import seedrec.models.Item;
import java.time.Clock;
import java.time.LocalDate;
import java.util.List;
import java.util.OptionalInt;

/**
 * Filtert Kandidaten nach Rating, Stimmenanzahl, Alter und (optional) Genre-Überschneidung mit dem Seed
 *
 * Titel ohne parsebares Erscheinungsdatum werden nie wegen ihres Alters verworfen
 */
public class CandidateFilter {
    private final Clock clock;

    public CandidateFilter(Clock clock) {
        this.clock = clock;
    }

    public List<Item> filter(List<Item> candidates, Item seed, FilterCriteria criteria) {
        int currentYear = LocalDate.now(clock).getYear();
        return candidates.stream()
                .filter(c -> accepts(c, seed, criteria, currentYear))
                .toList();
    }

    private boolean accepts(Item candidate, Item seed, FilterCriteria criteria, int currentYear) {
        if (candidate.rating() < criteria.minRating()) return false;
        if (candidate.voteCount() < criteria.minVoteCount()) return false;

        OptionalInt year = candidate.releaseYear();
        if (year.isPresent() && currentYear - year.getAsInt() > criteria.maxAgeYears()) return false;

        return !criteria.requireGenreOverlap() || candidate.sharesGenreWith(seed);
    }
}
