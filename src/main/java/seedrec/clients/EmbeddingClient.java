package seedrec.clients;

/**
 * Interface für den Text-Embedding-Dienst
 *
 * Liefert einen leeren Vektor, wenn der Dienst nicht konfiguriert ist
 */
public interface EmbeddingClient {

    double[] embed(String text) throws ClientException;
}
