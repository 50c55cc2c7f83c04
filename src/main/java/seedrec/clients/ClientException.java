package seedrec.clients;

/**
 * Fehler beim Aufruf eines externen Dienstes (Netzwerk, Timeout, HTTP-Status, ungültige Antwort)
 */
public class ClientException extends Exception {

    private final int statusCode;

    public ClientException(String message) {
        this(message, -1, null);
    }

    public ClientException(String message, Throwable cause) {
        this(message, -1, cause);
    }

    public ClientException(String message, int statusCode, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
    }

    // -1 wenn der Fehler nicht von einer HTTP-Antwort stammt
    public int getStatusCode() {
        return statusCode;
    }
}
