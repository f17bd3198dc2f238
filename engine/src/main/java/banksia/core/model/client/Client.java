package banksia.core.model.client;

import java.util.Optional;

import banksia.core.model.auth.Scope;

/**
 * A registered OAuth2 client.
 *
 * <p>A client without a secret is public; one with a secret is confidential
 * and must authenticate at the token endpoint. Redirect URIs are compared by
 * exact string match.
 *
 * @param id           client identifier
 * @param secret       stored secret (plain or hashed, see {@code SecretVerifier}), or null
 * @param redirectUri  the single registered redirect URI
 * @param allowedScope scope this client may request, or null to use the server default
 */
public record Client(String id, String secret, String redirectUri, Scope allowedScope) {

    public Client {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Client ID cannot be null or blank");
        }
        if (secret != null && secret.isEmpty()) {
            secret = null;
        }
    }

    public static Client confidential(String id, String secret, String redirectUri) {
        return new Client(id, secret, redirectUri, null);
    }

    public static Client publicClient(String id, String redirectUri) {
        return new Client(id, null, redirectUri, null);
    }

    public boolean confidential() {
        return secret != null;
    }

    public Optional<Scope> scopeRestriction() {
        return Optional.ofNullable(allowedScope);
    }
}
