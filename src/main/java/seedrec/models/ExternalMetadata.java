package seedrec.models;

/**
 * Metadaten aus dem Anreicherungsdienst
 *
 * genres ist die kommaseparierte Genre-Liste im Format des Dienstes (z.B. "Crime, Drama")
 */
public record ExternalMetadata(String title,
                               String year,
                               String genres,
                               double rating,
                               int voteCount,
                               String plot,
                               String poster,
                               String type) {

    public boolean isSeries() {
        return "series".equalsIgnoreCase(type);
    }
}
