package banksia.system.filter;

import jakarta.inject.Inject;
import jakarta.ws.rs.Priorities;
import jakarta.ws.rs.container.ContainerRequestContext;
import jakarta.ws.rs.container.ResourceInfo;
import jakarta.ws.rs.core.HttpHeaders;
import jakarta.ws.rs.core.Response;

import org.jboss.resteasy.reactive.server.ServerRequestFilter;

import banksia.adapter.in.auth.BearerRequestContext;
import banksia.adapter.in.auth.BearerTokenExtractor;
import banksia.adapter.in.auth.RequiresScope;
import banksia.adapter.in.rest.EndpointResponses;
import banksia.core.model.auth.Scope;
import banksia.core.port.in.ResourceProtection;

/**
 * Request filter that enforces {@link RequiresScope} on resource methods.
 *
 * <p>Requests to unannotated resources pass through untouched. On failure the
 * request is aborted with the bearer challenge.
 */
public class BearerTokenFilter {

    private final ResourceProtection protection;
    private final BearerRequestContext bearerContext;

    @Inject
    public BearerTokenFilter(ResourceProtection protection, BearerRequestContext bearerContext) {
        this.protection = protection;
        this.bearerContext = bearerContext;
    }

    @ServerRequestFilter(priority = Priorities.AUTHENTICATION)
    public Response filter(ContainerRequestContext requestContext, ResourceInfo resourceInfo) {
        final var requirement = requirement(resourceInfo);
        if (requirement == null) {
            return null;
        }

        try {
            final var token = BearerTokenExtractor.extract(
                    requestContext.getHeaderString(HttpHeaders.AUTHORIZATION),
                    requestContext.getUriInfo().getQueryParameters().get(BearerTokenExtractor.ACCESS_TOKEN_PARAM));
            bearerContext.authenticated(protection.authorize(token, Scope.parse(requirement.value())));
            return null;
        } catch (RuntimeException e) {
            return EndpointResponses.toResponse(protection.challenge(e));
        }
    }

    private static RequiresScope requirement(ResourceInfo resourceInfo) {
        if (resourceInfo == null) {
            return null;
        }
        final var method = resourceInfo.getResourceMethod();
        if (method != null && method.isAnnotationPresent(RequiresScope.class)) {
            return method.getAnnotation(RequiresScope.class);
        }
        final var resourceClass = resourceInfo.getResourceClass();
        return resourceClass == null ? null : resourceClass.getAnnotation(RequiresScope.class);
    }
}
