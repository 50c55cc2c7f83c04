package seedrec.models;

import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Besetzung und Crew eines Titels
 */
public record Credits(List<Credit> cast, List<Credit> crew) {

    public Credits {
        cast = cast == null ? List.of() : List.copyOf(cast);
        crew = crew == null ? List.of() : List.copyOf(crew);
    }

    public static Credits empty() {
        return new Credits(List.of(), List.of());
    }

    // Besetzung nach Billing-Reihenfolge, begrenzt auf limit
    public List<Credit> topCast(int limit) {
        return cast.stream()
                .sorted(Comparator.comparingInt(Credit::order))
                .limit(limit)
                .toList();
    }

    public boolean hasCrewRole(String name, Credit.Role role) {
        return crew.stream().anyMatch(c -> c.name().equals(name) && c.role() == role);
    }

    // Schlüsselpersonen: Top-10-Besetzung plus Regie und Drehbuch
    public Set<String> keyPeople() {
        Set<String> people = new LinkedHashSet<>();
        topCast(10).forEach(c -> people.add(c.name()));
        crew.stream()
                .filter(c -> c.role() == Credit.Role.DIRECTOR || c.role() == Credit.Role.WRITER)
                .forEach(c -> people.add(c.name()));
        return people;
    }
}
