package seedrec.repos;

import seedrec.AppConfig;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.sql.Statement;

/**
 * Datenbank-Verbindungsklasse
 *
 * Verwendet JDBC für die PostgreSQL-Verbindung; Zugangsdaten kommen aus der AppConfig
 * Connection sollte mit try-with-resources verwendet werden für automatisches Schließen
 */
public class Db {
    static final String SCHEMA_RESOURCE = "schema.sql";

    private final String url;
    private final String user;
    private final String password;

    public Db(String url, String user, String password) {
        this.url = url;
        this.user = user;
        this.password = password;
    }

    public static Db fromConfig(AppConfig config) {
        return new Db(
                config.get("db.url", "jdbc:postgresql://localhost:5432/seedrec"),
                config.get("db.user", "seedrec"),
                config.get("db.password", "seedrec"));
    }

    /**
     * Erstellt eine neue Datenbank-Verbindung
     *
     * Verwendung: try (Connection conn = db.get()) { ... }
     */
    public Connection get() throws SQLException {
        return DriverManager.getConnection(url, user, password);
    }

    /**
     * Legt die Tabellen aus schema.sql an
     *
     * Die Statements verwenden CREATE TABLE IF NOT EXISTS und können bei jedem Start laufen
     */
    public void initSchema() throws SQLException {
        try (Connection conn = get()) {
            applySchema(conn, SCHEMA_RESOURCE);
        }
    }

    // Führt die durch ";" getrennten Statements einer Classpath-Ressource aus
    static void applySchema(Connection conn, String resource) throws SQLException {
        String script = readResource(resource);
        try (Statement stmt = conn.createStatement()) {
            for (String sql : script.split(";")) {
                if (!sql.isBlank()) stmt.execute(sql.trim());
            }
        }
    }

    private static String readResource(String resource) {
        try (InputStream in = Db.class.getClassLoader().getResourceAsStream(resource)) {
            if (in == null) throw new IllegalStateException("missing resource " + resource);
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("could not read " + resource, e);
        }
    }
}
