package banksia.core.model.token;

/**
 * Thrown when a token string is structurally invalid or its signature does not
 * match the server secret.
 */
public class MalformedTokenException extends RuntimeException {

    public MalformedTokenException(String message) {
        super(message);
    }

    public MalformedTokenException(String message, Throwable cause) {
        super(message, cause);
    }
}
