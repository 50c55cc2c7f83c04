package seedrec.models;

public record Genre(int id, String name) {}
