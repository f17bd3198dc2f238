package banksia.core.model.token;

import java.time.Instant;
import java.util.Optional;

import banksia.core.model.auth.Scope;

/**
 * A stored access token, refresh token or authorization code.
 *
 * <p>Credentials are keyed by the signature of the {@link OpaqueToken} they were
 * issued for. The raw token never appears here.
 *
 * @param type            which store this credential lives in
 * @param clientId        the client the credential was issued to
 * @param resourceOwnerId the resource owner, or null for client-only grants
 * @param scope           the granted scope
 * @param expiresAt       when the credential stops being valid
 * @param redirectUri     redirect URI bound at issuance (authorization codes only)
 * @param parentCode      signature of the authorization code that produced this
 *                        credential, or null
 * @param used            whether the authorization code has been redeemed
 */
public record Credential(
        TokenType type,
        String clientId,
        String resourceOwnerId,
        Scope scope,
        Instant expiresAt,
        String redirectUri,
        String parentCode,
        boolean used) {

    public Credential {
        if (type == null) {
            throw new IllegalArgumentException("Type cannot be null");
        }
        if (clientId == null || clientId.isBlank()) {
            throw new IllegalArgumentException("Client ID cannot be null or blank");
        }
        if (expiresAt == null) {
            throw new IllegalArgumentException("Expiry cannot be null");
        }
        if (scope == null) {
            scope = Scope.empty();
        }
        if (resourceOwnerId != null && resourceOwnerId.isBlank()) {
            resourceOwnerId = null;
        }
    }

    public static Credential accessToken(
            String clientId, String resourceOwnerId, Scope scope, Instant expiresAt, String parentCode) {
        return new Credential(TokenType.ACCESS_TOKEN, clientId, resourceOwnerId, scope, expiresAt, null, parentCode,
                false);
    }

    public static Credential refreshToken(
            String clientId, String resourceOwnerId, Scope scope, Instant expiresAt, String parentCode) {
        return new Credential(TokenType.REFRESH_TOKEN, clientId, resourceOwnerId, scope, expiresAt, null, parentCode,
                false);
    }

    public static Credential authorizationCode(
            String clientId, String resourceOwnerId, Scope scope, Instant expiresAt, String redirectUri) {
        return new Credential(TokenType.AUTHORIZATION_CODE, clientId, resourceOwnerId, scope, expiresAt, redirectUri,
                null, false);
    }

    public boolean isExpired(Instant now) {
        return !expiresAt.isAfter(now);
    }

    public boolean derivedFrom(String codeSignature) {
        return parentCode != null && parentCode.equals(codeSignature);
    }

    public Optional<String> resourceOwner() {
        return Optional.ofNullable(resourceOwnerId);
    }

    public Credential markUsed() {
        return new Credential(type, clientId, resourceOwnerId, scope, expiresAt, redirectUri, parentCode, true);
    }
}
