package banksia.adapter.in.auth;

import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.Optional;

import banksia.core.model.oauth.ClientCredentials;
import banksia.core.model.oauth.OAuth2Error;

/**
 * Reads client credentials from HTTP Basic authentication or, failing that,
 * from the {@code client_id} and {@code client_secret} form fields
 * (RFC 6749 §2.3.1).
 */
public final class ClientCredentialsParser {

    private static final String BASIC_PREFIX = "basic ";

    private ClientCredentialsParser() {}

    /**
     * @param authorization the Authorization header, may be null
     * @param formClientId  the client_id form field, may be null
     * @param formSecret    the client_secret form field, may be null
     * @return the credentials, or empty if the request carries none
     * @throws OAuth2Error invalid_request if the Basic header is malformed or the
     *                     form carries credentials of its own alongside it
     */
    public static Optional<ClientCredentials> parse(String authorization, String formClientId, String formSecret) {
        if (authorization != null
                && authorization.regionMatches(true, 0, BASIC_PREFIX, 0, BASIC_PREFIX.length())) {
            final var basic = fromBasic(authorization.substring(BASIC_PREFIX.length()).trim());
            // a client_id alone may accompany Basic, but it must name the same client
            if ((formSecret != null && !formSecret.isEmpty())
                    || (formClientId != null && !formClientId.isEmpty() && !formClientId.equals(basic.clientId()))) {
                throw OAuth2Error.invalidRequest("Multiple client authentication methods");
            }
            return Optional.of(basic);
        }
        if (formClientId != null && !formClientId.isEmpty()) {
            return Optional.of(new ClientCredentials(formClientId, formSecret));
        }
        return Optional.empty();
    }

    private static ClientCredentials fromBasic(String encoded) {
        final String decoded;
        try {
            decoded = new String(Base64.getDecoder().decode(encoded), StandardCharsets.UTF_8);
        } catch (IllegalArgumentException e) {
            throw OAuth2Error.invalidRequest("Malformed Basic authorization header");
        }

        final var colon = decoded.indexOf(':');
        if (colon <= 0) {
            throw OAuth2Error.invalidRequest("Malformed Basic authorization header");
        }
        try {
            final var clientId = URLDecoder.decode(decoded.substring(0, colon), StandardCharsets.UTF_8);
            final var secret = URLDecoder.decode(decoded.substring(colon + 1), StandardCharsets.UTF_8);
            return new ClientCredentials(clientId, secret);
        } catch (IllegalArgumentException e) {
            throw OAuth2Error.invalidRequest("Malformed Basic authorization header");
        }
    }
}
