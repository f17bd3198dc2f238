package banksia.adapter.in.auth;

import java.util.List;

import banksia.core.model.bearer.BearerError;

/**
 * Extracts a bearer token from a request (RFC 6750 §2.1 and §2.3).
 */
public final class BearerTokenExtractor {

    public static final String ACCESS_TOKEN_PARAM = "access_token";

    private static final String BEARER_PREFIX = "bearer ";

    private BearerTokenExtractor() {}

    /**
     * Find the token in the {@code Authorization} header or the
     * {@code access_token} query parameter.
     *
     * @param authorization the Authorization header, may be null
     * @param queryTokens   values of the access_token query parameter, may be null
     * @return the token, or null if the request carries none
     * @throws BearerError invalid_request if the token is sent more than once
     */
    public static String extract(String authorization, List<String> queryTokens) {
        final var fromHeader = fromHeader(authorization);
        final var queryCount = queryTokens == null ? 0 : queryTokens.size();

        if (queryCount > 1 || (fromHeader != null && queryCount > 0)) {
            throw BearerError.invalidRequest("Multiple access tokens in request");
        }
        if (fromHeader != null) {
            return fromHeader;
        }
        return queryCount == 1 ? queryTokens.get(0) : null;
    }

    private static String fromHeader(String authorization) {
        if (authorization == null || authorization.length() <= BEARER_PREFIX.length()) {
            return null;
        }
        if (!authorization.regionMatches(true, 0, BEARER_PREFIX, 0, BEARER_PREFIX.length())) {
            return null;
        }
        final var token = authorization.substring(BEARER_PREFIX.length()).trim();
        return token.isEmpty() ? null : token;
    }
}
