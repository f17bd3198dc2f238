package banksia.core.model.bearer;

import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * A failed bearer token authentication, reported through a
 * {@code WWW-Authenticate} challenge.
 *
 * <p>A null {@link #code()} is a bare challenge: either "authentication
 * required" (401) or an internal failure (500, sent without any challenge).
 */
public class BearerError extends RuntimeException {

    public static final String DEFAULT_REALM = "OAuth2";

    private static final int UNAUTHORIZED = 401;
    private static final int INTERNAL_SERVER_ERROR = 500;

    private final BearerErrorCode code;
    private final String description;
    private final String uri;
    private final String realm;
    private final String scope;
    private final int status;

    private BearerError(
            BearerErrorCode code, String description, String uri, String realm, String scope, int status) {
        super(code == null ? "bearer authentication failed (" + status + ")" : code.code() + ": " + description);
        this.code = code;
        this.description = emptyToNull(description);
        this.uri = emptyToNull(uri);
        this.realm = emptyToNull(realm);
        this.scope = emptyToNull(scope);
        this.status = status;
    }

    /**
     * The request carried no token at all.
     */
    public static BearerError protectedResource() {
        return new BearerError(null, null, null, null, null, UNAUTHORIZED);
    }

    public static BearerError invalidRequest(String description) {
        return new BearerError(
                BearerErrorCode.INVALID_REQUEST, description, null, null, null,
                BearerErrorCode.INVALID_REQUEST.status());
    }

    public static BearerError invalidToken(String description) {
        return new BearerError(
                BearerErrorCode.INVALID_TOKEN, description, null, null, null,
                BearerErrorCode.INVALID_TOKEN.status());
    }

    /**
     * The token is valid but lacks scope.
     *
     * @param requiredScope the scope the resource needs, echoed in the challenge
     */
    public static BearerError insufficientScope(String requiredScope) {
        return new BearerError(
                BearerErrorCode.INSUFFICIENT_SCOPE, null, null, null, requiredScope,
                BearerErrorCode.INSUFFICIENT_SCOPE.status());
    }

    public static BearerError serverError() {
        return new BearerError(null, null, null, null, null, INTERNAL_SERVER_ERROR);
    }

    public BearerError withRealm(String realm) {
        return new BearerError(code, description, uri, realm, scope, status);
    }

    public BearerError withUri(String uri) {
        return new BearerError(code, description, uri, realm, scope, status);
    }

    public BearerErrorCode code() {
        return code;
    }

    public String description() {
        return description;
    }

    public String scope() {
        return scope;
    }

    public String realm() {
        return realm;
    }

    public int status() {
        return status;
    }

    public boolean internal() {
        return status == INTERNAL_SERVER_ERROR;
    }

    /**
     * Challenge parameters, sorted by key.
     */
    public Map<String, String> toMap() {
        final var map = new TreeMap<String, String>();
        if (code != null) {
            map.put("error", code.code());
        }
        if (description != null) {
            map.put("error_description", description);
        }
        if (uri != null) {
            map.put("error_uri", uri);
        }
        if (realm != null) {
            map.put("realm", realm);
        }
        if (scope != null) {
            map.put("scope", scope);
        }
        return map;
    }

    /**
     * The {@code WWW-Authenticate} header value, falling back to the default
     * realm when no other parameter applies.
     */
    public String challenge() {
        final var params = toMap().entrySet().stream()
                .map(e -> "%s=\"%s\"".formatted(e.getKey(), quoted(e.getValue())))
                .sorted()
                .collect(Collectors.joining(", "));
        return "Bearer " + (params.isEmpty() ? "realm=\"" + DEFAULT_REALM + "\"" : params);
    }

    /**
     * Escape a value for an HTTP quoted-string (RFC 9110 §5.6.4).
     */
    private static String quoted(String value) {
        return value.replace("\\", "\\\\").replace("\"", "\\\"");
    }

    private static String emptyToNull(String value) {
        return value == null || value.isEmpty() ? null : value;
    }
}
