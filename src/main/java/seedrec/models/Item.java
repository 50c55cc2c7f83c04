package seedrec.models;

import com.fasterxml.jackson.annotation.JsonIgnore;
import java.util.List;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Model für einen Titel (Seed oder Kandidat)
 *
 * Provenienz-Flags sind explizite Felder: fallback = nur über die letzte Fallback-Strategie erreichbar,
 * externalSourced = über die Websuche gefunden (sourceSnippet enthält dann den Suchergebnis-Ausschnitt)
 */
public record Item(int id,
                   MediaType mediaType,
                   String title,
                   String overview,
                   String tagline,
                   String releaseDate,
                   String posterPath,
                   double rating,
                   int voteCount,
                   List<Integer> genreIds,
                   boolean fallback,
                   boolean externalSourced,
                   String sourceSnippet) {

    private static final Pattern YEAR = Pattern.compile("^(\\d{4})");

    public Item {
        title = title == null ? "" : title;
        overview = overview == null ? "" : overview;
        genreIds = genreIds == null ? List.of() : List.copyOf(genreIds);
        voteCount = Math.max(0, voteCount);
    }

    @JsonIgnore
    public ItemKey key() {
        return new ItemKey(id, mediaType);
    }

    // Liefert das Erscheinungsjahr, leer bei fehlendem oder nicht parsebarem Datum
    @JsonIgnore
    public OptionalInt releaseYear() {
        if (releaseDate == null) return OptionalInt.empty();
        Matcher m = YEAR.matcher(releaseDate.trim());
        return m.find() ? OptionalInt.of(Integer.parseInt(m.group(1))) : OptionalInt.empty();
    }

    @JsonIgnore
    public Optional<String> taglineText() {
        return tagline == null || tagline.isBlank() ? Optional.empty() : Optional.of(tagline);
    }

    public boolean sharesGenreWith(Item other) {
        return genreIds.stream().anyMatch(other.genreIds()::contains);
    }

    public Item withMediaType(MediaType type) {
        return toBuilder().mediaType(type).build();
    }

    public Item asFallback() {
        return toBuilder().fallback(true).build();
    }

    public Item asExternalSourced(String snippet) {
        return toBuilder().externalSourced(true).sourceSnippet(snippet).build();
    }

    public Builder toBuilder() {
        return new Builder()
                .id(id).mediaType(mediaType).title(title).overview(overview).tagline(tagline)
                .releaseDate(releaseDate).posterPath(posterPath).rating(rating).voteCount(voteCount)
                .genreIds(genreIds).fallback(fallback).externalSourced(externalSourced)
                .sourceSnippet(sourceSnippet);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private int id;
        private MediaType mediaType;
        private String title;
        private String overview;
        private String tagline;
        private String releaseDate;
        private String posterPath;
        private double rating;
        private int voteCount;
        private List<Integer> genreIds = List.of();
        private boolean fallback;
        private boolean externalSourced;
        private String sourceSnippet;

        public Builder id(int id) { this.id = id; return this; }
        public Builder mediaType(MediaType mediaType) { this.mediaType = mediaType; return this; }
        public Builder title(String title) { this.title = title; return this; }
        public Builder overview(String overview) { this.overview = overview; return this; }
        public Builder tagline(String tagline) { this.tagline = tagline; return this; }
        public Builder releaseDate(String releaseDate) { this.releaseDate = releaseDate; return this; }
        public Builder posterPath(String posterPath) { this.posterPath = posterPath; return this; }
        public Builder rating(double rating) { this.rating = rating; return this; }
        public Builder voteCount(int voteCount) { this.voteCount = voteCount; return this; }
        public Builder genreIds(List<Integer> genreIds) { this.genreIds = genreIds; return this; }
        public Builder fallback(boolean fallback) { this.fallback = fallback; return this; }
        public Builder externalSourced(boolean externalSourced) { this.externalSourced = externalSourced; return this; }
        public Builder sourceSnippet(String sourceSnippet) { this.sourceSnippet = sourceSnippet; return this; }

        public Item build() {
            return new Item(id, mediaType, title, overview, tagline, releaseDate, posterPath,
                    rating, voteCount, genreIds, fallback, externalSourced, sourceSnippet);
        }
    }
}
