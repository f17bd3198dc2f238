package banksia.core.model.oauth;

import banksia.core.model.auth.Scope;

/**
 * A parsed authorization endpoint request (RFC 6749 §4.1.1, §4.2.1).
 *
 * <p>The resource owner's credentials travel in the same submission because the
 * server renders no login form.
 *
 * @param submission   true for a POST that should act on the request, false for
 *                     a GET that only gets a notice
 * @param responseType raw {@code response_type} value
 * @param clientId     client identifier
 * @param redirectUri  redirect URI, must exactly match the registered one
 * @param scope        requested scope
 * @param state        opaque client state to echo back, may be null
 * @param username     resource owner name
 * @param password     resource owner secret
 */
public record AuthorizationRequest(
        boolean submission,
        String responseType,
        String clientId,
        String redirectUri,
        Scope scope,
        String state,
        String username,
        String password) {

    public AuthorizationRequest {
        if (scope == null) {
            scope = Scope.empty();
        }
    }
}
