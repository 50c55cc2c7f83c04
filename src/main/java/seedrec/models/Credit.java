package seedrec.models;

/**
 * Mitwirkende Person eines Titels (Besetzung oder Crew)
 *
 * job enthält die Originalbezeichnung des Verzeichnisses (z.B. "Screenplay"), role die normalisierte Rolle
 */
public record Credit(String name, Role role, String job, int order) {

    public enum Role { CAST, DIRECTOR, WRITER, OTHER }

    // Mappt die Job-Bezeichnung der Crew auf eine Rolle
    public static Role roleForJob(String job) {
        if (job == null) return Role.OTHER;
        return switch (job) {
            case "Director" -> Role.DIRECTOR;
            case "Writer", "Screenplay" -> Role.WRITER;
            default -> Role.OTHER;
        };
    }

    public static Credit cast(String name, int order) {
        return new Credit(name, Role.CAST, "Actor", order);
    }

    public static Credit crew(String name, String job) {
        return new Credit(name, roleForJob(job), job, 0);
    }
}
