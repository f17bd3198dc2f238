package banksia.core.port.in;

import banksia.core.model.oauth.AuthorizationRequest;
import banksia.core.model.oauth.EndpointResponse;
import banksia.core.model.oauth.TokenLookupRequest;
import banksia.core.model.oauth.TokenRequest;

/**
 * Inbound port for the OAuth2 authorization server endpoints.
 *
 * <p>Every method returns a complete {@link EndpointResponse}; protocol errors
 * are already encoded in it, never thrown.
 */
public interface AuthorizationServer {

    /**
     * Handle an authorization endpoint request (implicit and authorization code grants).
     *
     * <p>Errors before the redirect URI is validated are delivered directly;
     * later errors are delivered by redirect.
     *
     * @param request the parsed request
     * @return a notice (GET), a redirect, or a direct error
     */
    EndpointResponse authorize(AuthorizationRequest request);

    /**
     * Handle a token endpoint request.
     *
     * @param request the parsed request
     * @return a token JSON document or a JSON error
     */
    EndpointResponse token(TokenRequest request);

    /**
     * Revoke an access or refresh token (RFC 7009).
     *
     * @param request the parsed request
     * @return an empty 200, or a JSON error
     */
    EndpointResponse revoke(TokenLookupRequest request);

    /**
     * Introspect an access or refresh token (RFC 7662).
     *
     * @param request the parsed request
     * @return the introspection document, or a JSON error
     */
    EndpointResponse introspect(TokenLookupRequest request);
}
