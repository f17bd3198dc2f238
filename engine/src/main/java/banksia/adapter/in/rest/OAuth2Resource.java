package banksia.adapter.in.rest;

import jakarta.inject.Inject;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.FormParam;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.HeaderParam;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.core.HttpHeaders;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;

import org.jboss.logging.Logger;

import banksia.adapter.in.auth.ClientCredentialsParser;
import banksia.core.model.auth.Scope;
import banksia.core.model.oauth.AuthorizationRequest;
import banksia.core.model.oauth.OAuth2Error;
import banksia.core.model.oauth.TokenLookupRequest;
import banksia.core.model.oauth.TokenRequest;
import banksia.core.port.in.AuthorizationServer;
import banksia.core.service.oauth.OAuth2Responses;

/**
 * OAuth2 authorization server endpoints.
 *
 * <ul>
 *   <li>{@code GET /oauth2/authorize} - authorization notice</li>
 *   <li>{@code POST /oauth2/authorize} - implicit and authorization code grants</li>
 *   <li>{@code POST /oauth2/token} - token endpoint</li>
 *   <li>{@code POST /oauth2/revoke} - token revocation (RFC 7009)</li>
 *   <li>{@code POST /oauth2/introspect} - token introspection (RFC 7662)</li>
 * </ul>
 */
@Path("/oauth2")
public class OAuth2Resource {

    private static final Logger LOG = Logger.getLogger(OAuth2Resource.class);

    private final AuthorizationServer server;

    @Inject
    public OAuth2Resource(AuthorizationServer server) {
        this.server = server;
    }

    @GET
    @Path("/authorize")
    public Response authorizationNotice(
            @QueryParam("response_type") String responseType,
            @QueryParam("client_id") String clientId,
            @QueryParam("redirect_uri") String redirectUri,
            @QueryParam("scope") String scope,
            @QueryParam("state") String state) {
        final var request = new AuthorizationRequest(
                false, responseType, clientId, redirectUri, Scope.parse(scope), state, null, null);
        return EndpointResponses.toResponse(server.authorize(request));
    }

    @POST
    @Path("/authorize")
    @Consumes(MediaType.APPLICATION_FORM_URLENCODED)
    public Response authorize(
            @FormParam("response_type") String responseType,
            @FormParam("client_id") String clientId,
            @FormParam("redirect_uri") String redirectUri,
            @FormParam("scope") String scope,
            @FormParam("state") String state,
            @FormParam("username") String username,
            @FormParam("password") String password) {
        final var request = new AuthorizationRequest(
                true, responseType, clientId, redirectUri, Scope.parse(scope), state, username, password);
        return EndpointResponses.toResponse(server.authorize(request));
    }

    @POST
    @Path("/token")
    @Consumes(MediaType.APPLICATION_FORM_URLENCODED)
    @Produces(MediaType.APPLICATION_JSON)
    public Response token(
            @HeaderParam(HttpHeaders.AUTHORIZATION) String authorization,
            @FormParam("grant_type") String grantType,
            @FormParam("client_id") String clientId,
            @FormParam("client_secret") String clientSecret,
            @FormParam("scope") String scope,
            @FormParam("username") String username,
            @FormParam("password") String password,
            @FormParam("code") String code,
            @FormParam("redirect_uri") String redirectUri,
            @FormParam("refresh_token") String refreshToken) {
        try {
            final var client = ClientCredentialsParser.parse(authorization, clientId, clientSecret).orElse(null);
            final var request = new TokenRequest(
                    grantType, Scope.parse(scope), client, username, password, code, redirectUri, refreshToken);
            return EndpointResponses.toResponse(server.token(request));
        } catch (OAuth2Error e) {
            return rejected(e);
        }
    }

    @POST
    @Path("/revoke")
    @Consumes(MediaType.APPLICATION_FORM_URLENCODED)
    public Response revoke(
            @HeaderParam(HttpHeaders.AUTHORIZATION) String authorization,
            @FormParam("client_id") String clientId,
            @FormParam("client_secret") String clientSecret,
            @FormParam("token") String token,
            @FormParam("token_type_hint") String tokenTypeHint) {
        try {
            final var client = ClientCredentialsParser.parse(authorization, clientId, clientSecret).orElse(null);
            return EndpointResponses.toResponse(
                    server.revoke(new TokenLookupRequest(client, token, tokenTypeHint)));
        } catch (OAuth2Error e) {
            return rejected(e);
        }
    }

    @POST
    @Path("/introspect")
    @Consumes(MediaType.APPLICATION_FORM_URLENCODED)
    @Produces(MediaType.APPLICATION_JSON)
    public Response introspect(
            @HeaderParam(HttpHeaders.AUTHORIZATION) String authorization,
            @FormParam("client_id") String clientId,
            @FormParam("client_secret") String clientSecret,
            @FormParam("token") String token,
            @FormParam("token_type_hint") String tokenTypeHint) {
        try {
            final var client = ClientCredentialsParser.parse(authorization, clientId, clientSecret).orElse(null);
            return EndpointResponses.toResponse(
                    server.introspect(new TokenLookupRequest(client, token, tokenTypeHint)));
        } catch (OAuth2Error e) {
            return rejected(e);
        }
    }

    private static Response rejected(OAuth2Error error) {
        LOG.debugf("Rejected request before dispatch: %s", error.getMessage());
        return EndpointResponses.toResponse(OAuth2Responses.error(error));
    }
}
