package banksia.core.model.client;

/**
 * An end user who can grant access to their resources.
 *
 * @param username unique name, used as the resource owner ID on credentials
 * @param secret   stored secret, checked through {@code SecretVerifier}
 */
public record ResourceOwner(String username, String secret) {

    public ResourceOwner {
        if (username == null || username.isBlank()) {
            throw new IllegalArgumentException("Username cannot be null or blank");
        }
    }
}
