package seedrec.clients;

/**
 * Decorator, der Embeddings im EmbeddingCache ablegt
 *
 * Leere Vektoren (Dienst nicht verfügbar) werden nicht gecacht
 */
public class CachingEmbeddingClient implements EmbeddingClient {
    private final EmbeddingClient delegate;
    private final EmbeddingCache cache;

    public CachingEmbeddingClient(EmbeddingClient delegate, EmbeddingCache cache) {
        this.delegate = delegate;
        this.cache = cache;
    }

    @Override
    public double[] embed(String text) throws ClientException {
        var cached = cache.get(text);
        if (cached.isPresent()) return cached.get();

        double[] vector = delegate.embed(text);
        if (vector.length > 0) cache.put(text, vector);
        return vector;
    }
}
