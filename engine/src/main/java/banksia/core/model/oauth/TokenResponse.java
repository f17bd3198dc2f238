package banksia.core.model.oauth;

import java.util.LinkedHashMap;
import java.util.Map;

import banksia.core.model.auth.Scope;

/**
 * A successful bearer token response (RFC 6749 §5.1).
 *
 * @param accessToken  the access token string
 * @param expiresIn    access token lifetime in seconds
 * @param refreshToken the refresh token string, or null when none was issued
 * @param scope        the granted scope
 * @param state        state to echo (implicit grant), or null
 */
public record TokenResponse(String accessToken, long expiresIn, String refreshToken, Scope scope, String state) {

    public static final String BEARER = "bearer";

    public TokenResponse {
        if (accessToken == null || accessToken.isEmpty()) {
            throw new IllegalArgumentException("Access token cannot be null or empty");
        }
        if (scope == null) {
            scope = Scope.empty();
        }
    }

    public TokenResponse withState(String state) {
        return new TokenResponse(accessToken, expiresIn, refreshToken, scope, state);
    }

    /**
     * The fields presented to the client; optional fields are omitted when empty.
     */
    public Map<String, Object> toMap() {
        final var map = new LinkedHashMap<String, Object>();
        map.put("token_type", BEARER);
        map.put("access_token", accessToken);
        map.put("expires_in", expiresIn);
        if (refreshToken != null) {
            map.put("refresh_token", refreshToken);
        }
        if (!scope.isEmpty()) {
            map.put("scope", scope.toString());
        }
        if (state != null && !state.isEmpty()) {
            map.put("state", state);
        }
        return map;
    }
}
