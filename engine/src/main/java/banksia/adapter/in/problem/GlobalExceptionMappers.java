package banksia.adapter.in.problem;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.ws.rs.WebApplicationException;
import jakarta.ws.rs.core.Response;

import org.jboss.logging.Logger;
import org.jboss.resteasy.reactive.server.ServerExceptionMapper;

import banksia.adapter.in.rest.EndpointResponses;
import banksia.core.model.oauth.OAuth2Error;
import banksia.core.service.oauth.OAuth2Responses;

/**
 * Global exception mappers for failures that escape the resources.
 *
 * <p>Anything unexpected is reported as an OAuth2 {@code server_error} with no
 * description, so internal details never reach the client.
 */
@ApplicationScoped
public class GlobalExceptionMappers {

    private static final Logger LOG = Logger.getLogger(GlobalExceptionMappers.class);

    @ServerExceptionMapper
    public Response mapOAuth2Error(OAuth2Error e) {
        LOG.debugv("OAuth2 error: {0}", e.getMessage());
        return EndpointResponses.toResponse(OAuth2Responses.error(e));
    }

    @ServerExceptionMapper
    public Response mapWebApplicationException(WebApplicationException e) {
        return e.getResponse();
    }

    @ServerExceptionMapper
    public Response mapRuntimeException(RuntimeException e) {
        LOG.errorv(e, "Unhandled exception: {0}", e.getMessage());
        return EndpointResponses.toResponse(OAuth2Responses.failure(e));
    }
}
