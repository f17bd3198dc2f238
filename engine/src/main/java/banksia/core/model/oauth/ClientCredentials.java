package banksia.core.model.oauth;

/**
 * Credentials a client presented at the token, revocation or introspection
 * endpoint, from HTTP Basic or form fields.
 *
 * @param clientId the client identifier
 * @param secret   the presented secret, null for public clients
 */
public record ClientCredentials(String clientId, String secret) {

    public ClientCredentials {
        if (clientId == null || clientId.isEmpty()) {
            throw new IllegalArgumentException("Client ID cannot be null or empty");
        }
    }
}
