package seedrec.clients;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Begrenzter LRU-Cache für Embedding-Vektoren
 *
 * Schlüssel ist der normalisierte Text (lowercase, getrimmt); Zugriffe sind synchronisiert.
 * Vektoren werden beim Ablegen und Auslesen kopiert
 */
public class EmbeddingCache {
    private final int maxEntries;
    private final Map<String, double[]> entries;

    public EmbeddingCache(int maxEntries) {
        if (maxEntries < 1) throw new IllegalArgumentException("cache size must be positive");
        this.maxEntries = maxEntries;
        // accessOrder = true: zuletzt gelesene Einträge bleiben erhalten
        this.entries = new LinkedHashMap<>(16, 0.75f, true) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<String, double[]> eldest) {
                return size() > EmbeddingCache.this.maxEntries;
            }
        };
    }

    public static String normalize(String text) {
        return text == null ? "" : text.trim().toLowerCase(Locale.ROOT);
    }

    public synchronized Optional<double[]> get(String text) {
        return Optional.ofNullable(entries.get(normalize(text))).map(double[]::clone);
    }

    public synchronized void put(String text, double[] vector) {
        entries.put(normalize(text), vector.clone());
    }

    public synchronized int size() {
        return entries.size();
    }
}
