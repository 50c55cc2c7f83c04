package seedrec.models;

public record WebSearchResult(String title, String snippet, String link) {}
