package banksia.core.model.oauth;

import banksia.core.model.auth.Scope;

/**
 * A parsed token endpoint request (RFC 6749 §4.1.3, §4.3.2, §4.4.2, §6).
 *
 * <p>Fields not used by the requested grant are null.
 *
 * @param grantType    raw {@code grant_type} value
 * @param scope        requested scope, empty if none
 * @param client       presented client credentials, null if the request carried none
 * @param username     resource owner name (password grant)
 * @param password     resource owner secret (password grant)
 * @param code         authorization code (authorization code grant)
 * @param redirectUri  redirect URI (authorization code grant)
 * @param refreshToken refresh token (refresh token grant)
 */
public record TokenRequest(
        String grantType,
        Scope scope,
        ClientCredentials client,
        String username,
        String password,
        String code,
        String redirectUri,
        String refreshToken) {

    public TokenRequest {
        if (scope == null) {
            scope = Scope.empty();
        }
    }
}
