package seedrec.models;

/**
 * Eindeutiger Schlüssel eines Titels: IDs sind nur innerhalb eines Medientyps eindeutig
 */
public record ItemKey(int id, MediaType mediaType) {}
