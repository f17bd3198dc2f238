package banksia.core.port.in;

import banksia.core.model.auth.Scope;
import banksia.core.model.bearer.BearerError;
import banksia.core.model.oauth.EndpointResponse;
import banksia.core.model.token.Credential;

/**
 * Inbound port for protecting resources with bearer tokens.
 */
public interface ResourceProtection {

    /**
     * Validate a bearer token for a resource.
     *
     * @param token    the raw token string, null if the request carried none
     * @param required the scope the resource needs
     * @return the stored access token credential
     * @throws BearerError if the token is missing, malformed, unknown, expired or lacks scope
     */
    Credential authorize(String token, Scope required);

    /**
     * Build the challenge response for a failed {@link #authorize} call.
     *
     * @param failure the failure; anything other than a {@link BearerError}
     *                becomes a bare 500
     * @return the response to send
     */
    EndpointResponse challenge(RuntimeException failure);
}
