package seedrec;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.time.Duration;
import java.util.Locale;
import java.util.Map;
import java.util.Properties;

/**
 * Konfiguration der Anwendung
 *
 * Lädt application.properties aus dem Classpath; jeder Schlüssel kann per Umgebungsvariable
 * überschrieben werden (tmdb.api-key -> TMDB_API_KEY)
 */
public class AppConfig {
    private final Properties properties;
    private final Map<String, String> env;

    AppConfig(Properties properties, Map<String, String> env) {
        this.properties = properties;
        this.env = env;
    }

    public static AppConfig load() {
        return load("application.properties", System.getenv());
    }

    static AppConfig load(String resource, Map<String, String> env) {
        var properties = new Properties();
        try (InputStream in = AppConfig.class.getClassLoader().getResourceAsStream(resource)) {
            if (in != null) properties.load(in);
        } catch (IOException e) {
            throw new UncheckedIOException("could not read " + resource, e);
        }
        return new AppConfig(properties, env);
    }

    static String envName(String key) {
        return key.toUpperCase(Locale.ROOT).replace('.', '_').replace('-', '_');
    }

    public String get(String key, String defaultValue) {
        String fromEnv = env.get(envName(key));
        if (fromEnv != null && !fromEnv.isBlank()) return fromEnv.trim();
        String value = properties.getProperty(key);
        return value == null || value.isBlank() ? defaultValue : value.trim();
    }

    public int getInt(String key, int defaultValue) {
        String value = get(key, null);
        if (value == null) return defaultValue;
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("invalid integer for " + key + ": " + value, e);
        }
    }

    public Duration getDuration(String key, Duration defaultValue) {
        int millis = getInt(key, (int) defaultValue.toMillis());
        return Duration.ofMillis(millis);
    }

    // Leere Werte gelten als "nicht konfiguriert"
    public boolean isSet(String key) {
        return get(key, null) != null;
    }
}
