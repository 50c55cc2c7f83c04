package seedrec.models;

/**
 * Kuratiertes Schlagwort aus der Taxonomie des Content-Verzeichnisses
 */
public record Keyword(int id, String name) {}
