package banksia.core.service.oauth;

import java.util.LinkedHashMap;
import java.util.Map;

import banksia.core.model.bearer.BearerError;
import banksia.core.model.oauth.EndpointResponse;
import banksia.core.model.oauth.OAuth2Error;
import banksia.core.model.oauth.OAuth2ErrorCode;
import banksia.core.model.oauth.TokenResponse;
import banksia.core.util.RedirectUris;

/**
 * Converts grant outcomes and failures into {@link EndpointResponse}s.
 */
public final class OAuth2Responses {

    public static final String BASIC_CHALLENGE = "Basic realm=\"" + BearerError.DEFAULT_REALM + "\"";

    static final Map<String, String> NO_STORE = Map.of("Cache-Control", "no-store", "Pragma", "no-cache");

    private OAuth2Responses() {}

    /**
     * Deliver an error, by redirect when it carries a redirect URI.
     */
    public static EndpointResponse error(OAuth2Error error) {
        if (error.redirected()) {
            final var params = error.toMap();
            final var location = error.useFragment()
                    ? RedirectUris.withFragment(error.redirectUri(), params)
                    : RedirectUris.withQuery(error.redirectUri(), params);
            return new EndpointResponse.Redirect(location);
        }

        final var headers = new LinkedHashMap<>(NO_STORE);
        if (error.code() == OAuth2ErrorCode.INVALID_CLIENT) {
            headers.put("WWW-Authenticate", BASIC_CHALLENGE);
        }
        return new EndpointResponse.Json(error.status(), headers, new LinkedHashMap<String, Object>(error.toMap()));
    }

    /**
     * Deliver any failure. Anything that is not an {@link OAuth2Error} becomes
     * a {@code server_error} without a description.
     */
    public static EndpointResponse failure(Throwable failure) {
        if (failure instanceof OAuth2Error error) {
            return error(error);
        }
        return error(OAuth2Error.serverError(null));
    }

    /**
     * Token endpoint success document.
     */
    public static EndpointResponse token(TokenResponse response) {
        return json(response.toMap());
    }

    /**
     * Implicit grant success: the token document in the redirect fragment.
     */
    public static EndpointResponse tokenRedirect(TokenResponse response, String redirectUri) {
        final var params = new LinkedHashMap<String, String>();
        response.toMap().forEach((key, value) -> params.put(key, String.valueOf(value)));
        return new EndpointResponse.Redirect(RedirectUris.withFragment(redirectUri, params));
    }

    /**
     * Authorization code grant success: code and state in the redirect query.
     */
    public static EndpointResponse codeRedirect(String code, String state, String redirectUri) {
        final var params = new LinkedHashMap<String, String>();
        params.put("code", code);
        params.put("state", state);
        return new EndpointResponse.Redirect(RedirectUris.withQuery(redirectUri, params));
    }

    /**
     * A 200 JSON document that must not be cached.
     */
    public static EndpointResponse json(Map<String, Object> body) {
        return new EndpointResponse.Json(200, NO_STORE, body);
    }

    /**
     * Challenge response for a failed bearer check. Internal failures become a
     * bare 500 without a challenge.
     */
    public static EndpointResponse bearerChallenge(Throwable failure) {
        final var error = failure instanceof BearerError bearerError ? bearerError : BearerError.serverError();
        if (error.internal()) {
            return new EndpointResponse.Empty(error.status(), Map.of());
        }
        return new EndpointResponse.Empty(error.status(), Map.of("WWW-Authenticate", error.challenge()));
    }
}
