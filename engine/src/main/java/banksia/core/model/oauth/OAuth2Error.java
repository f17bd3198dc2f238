package banksia.core.model.oauth;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A protocol error raised by the authorization server.
 *
 * <p>Instances are immutable. The delivery target is part of the error: when
 * {@link #redirectUri()} is set the error is reported by redirecting to that
 * URI (query or fragment encoded), otherwise it is written directly as a JSON
 * body with {@link OAuth2ErrorCode#status()}.
 */
public class OAuth2Error extends RuntimeException {

    private final OAuth2ErrorCode code;
    private final String description;
    private final String uri;
    private final String state;
    private final String redirectUri;
    private final boolean useFragment;

    public OAuth2Error(OAuth2ErrorCode code, String description) {
        this(code, description, null, null, null, false);
    }

    private OAuth2Error(
            OAuth2ErrorCode code,
            String description,
            String uri,
            String state,
            String redirectUri,
            boolean useFragment) {
        super(description == null || description.isEmpty() ? code.code() : code.code() + ": " + description);
        this.code = code;
        this.description = emptyToNull(description);
        this.uri = emptyToNull(uri);
        this.state = emptyToNull(state);
        this.redirectUri = emptyToNull(redirectUri);
        this.useFragment = useFragment;
    }

    public static OAuth2Error invalidRequest(String description) {
        return new OAuth2Error(OAuth2ErrorCode.INVALID_REQUEST, description);
    }

    public static OAuth2Error invalidClient(String description) {
        return new OAuth2Error(OAuth2ErrorCode.INVALID_CLIENT, description);
    }

    public static OAuth2Error invalidGrant(String description) {
        return new OAuth2Error(OAuth2ErrorCode.INVALID_GRANT, description);
    }

    public static OAuth2Error invalidScope(String description) {
        return new OAuth2Error(OAuth2ErrorCode.INVALID_SCOPE, description);
    }

    public static OAuth2Error unauthorizedClient(String description) {
        return new OAuth2Error(OAuth2ErrorCode.UNAUTHORIZED_CLIENT, description);
    }

    public static OAuth2Error unsupportedGrantType(String description) {
        return new OAuth2Error(OAuth2ErrorCode.UNSUPPORTED_GRANT_TYPE, description);
    }

    public static OAuth2Error unsupportedResponseType(String description) {
        return new OAuth2Error(OAuth2ErrorCode.UNSUPPORTED_RESPONSE_TYPE, description);
    }

    public static OAuth2Error unsupportedTokenType(String description) {
        return new OAuth2Error(OAuth2ErrorCode.UNSUPPORTED_TOKEN_TYPE, description);
    }

    public static OAuth2Error accessDenied(String description) {
        return new OAuth2Error(OAuth2ErrorCode.ACCESS_DENIED, description);
    }

    public static OAuth2Error serverError(String description) {
        return new OAuth2Error(OAuth2ErrorCode.SERVER_ERROR, description);
    }

    public static OAuth2Error temporarilyUnavailable(String description) {
        return new OAuth2Error(OAuth2ErrorCode.TEMPORARILY_UNAVAILABLE, description);
    }

    /**
     * Copy of this error that echoes the given state.
     */
    public OAuth2Error withState(String state) {
        return new OAuth2Error(code, description, uri, state, redirectUri, useFragment);
    }

    public OAuth2Error withUri(String uri) {
        return new OAuth2Error(code, description, uri, state, redirectUri, useFragment);
    }

    /**
     * Copy of this error delivered by redirect.
     *
     * @param redirectUri the validated client redirect URI
     * @param state       state to echo, may be null
     * @param useFragment true to encode into the fragment, false for the query
     */
    public OAuth2Error redirectTo(String redirectUri, String state, boolean useFragment) {
        return new OAuth2Error(code, description, uri, state, redirectUri, useFragment);
    }

    public OAuth2ErrorCode code() {
        return code;
    }

    public int status() {
        return code.status();
    }

    public String description() {
        return description;
    }

    public String uri() {
        return uri;
    }

    public String state() {
        return state;
    }

    public String redirectUri() {
        return redirectUri;
    }

    public boolean useFragment() {
        return useFragment;
    }

    public boolean redirected() {
        return redirectUri != null;
    }

    /**
     * The fields presented to the client, in wire order.
     */
    public Map<String, String> toMap() {
        final var map = new LinkedHashMap<String, String>();
        map.put("error", code.code());
        if (description != null) {
            map.put("error_description", description);
        }
        if (uri != null) {
            map.put("error_uri", uri);
        }
        if (state != null) {
            map.put("state", state);
        }
        return map;
    }

    private static String emptyToNull(String value) {
        return value == null || value.isEmpty() ? null : value;
    }
}
