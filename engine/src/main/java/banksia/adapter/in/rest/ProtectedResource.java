package banksia.adapter.in.rest;

import java.util.LinkedHashMap;
import java.util.Map;

import jakarta.inject.Inject;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;

import banksia.adapter.in.auth.BearerRequestContext;
import banksia.adapter.in.auth.RequiresScope;

/**
 * Sample resources protected by bearer tokens.
 */
@Path("/api")
public class ProtectedResource {

    private final BearerRequestContext bearer;

    @Inject
    public ProtectedResource(BearerRequestContext bearer) {
        this.bearer = bearer;
    }

    @GET
    @Path("/protected")
    @RequiresScope("foo")
    @Produces(MediaType.TEXT_PLAIN)
    public String protectedResource() {
        return "OK";
    }

    @GET
    @Path("/whoami")
    @RequiresScope
    @Produces(MediaType.APPLICATION_JSON)
    public Map<String, Object> whoami() {
        final var body = new LinkedHashMap<String, Object>();
        bearer.credential().ifPresent(credential -> {
            body.put("client_id", credential.clientId());
            credential.resourceOwner().ifPresent(owner -> body.put("username", owner));
            body.put("scope", credential.scope().toString());
            body.put("exp", credential.expiresAt().getEpochSecond());
        });
        return body;
    }
}
