package banksia.core.service.oauth;

import java.time.Clock;
import java.util.Objects;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import org.jboss.logging.Logger;

import banksia.core.model.auth.Scope;
import banksia.core.model.client.Client;
import banksia.core.model.oauth.AuthorizationRequest;
import banksia.core.model.oauth.EndpointResponse;
import banksia.core.model.oauth.GrantType;
import banksia.core.model.oauth.OAuth2Error;
import banksia.core.model.oauth.ResponseType;
import banksia.core.model.oauth.TokenLookupRequest;
import banksia.core.model.oauth.TokenRequest;
import banksia.core.model.oauth.TokenResponse;
import banksia.core.model.token.Credential;
import banksia.core.model.token.MalformedTokenException;
import banksia.core.model.token.OpaqueToken;
import banksia.core.model.token.RedemptionOutcome;
import banksia.core.model.token.TokenType;
import banksia.core.port.in.AuthorizationServer;
import banksia.core.port.out.CredentialStore;
import banksia.core.port.out.OAuth2Metrics;
import banksia.core.service.token.TokenCodec;
import banksia.core.service.token.TokenIssuer;
import banksia.core.util.SecureHash;

/**
 * Runs the OAuth2 grant flows.
 *
 * <p>Supports the implicit and authorization code grants at the authorization
 * endpoint, and the password, client credentials, authorization code and
 * refresh token grants at the token endpoint. Redemptions of codes and refresh
 * tokens run inside {@link CredentialStore#exclusive} so a credential can be
 * redeemed at most once.
 */
@ApplicationScoped
public class GrantEngine implements AuthorizationServer {

    private static final Logger LOG = Logger.getLogger(GrantEngine.class);

    static final String AUTHORIZATION_NOTICE =
            "This authorization server does not render a login form. Submit the resource owner's username and"
                    + " password with a POST to this endpoint.";

    private static final String IMPLICIT = "implicit";

    private final ClientAuthenticator authenticator;
    private final CredentialStore store;
    private final TokenCodec codec;
    private final TokenIssuer issuer;
    private final TokenLookupService lookups;
    private final OAuth2Metrics metrics;
    private final Clock clock;

    @Inject
    public GrantEngine(
            ClientAuthenticator authenticator,
            CredentialStore store,
            TokenCodec codec,
            TokenIssuer issuer,
            TokenLookupService lookups,
            OAuth2Metrics metrics) {
        this(authenticator, store, codec, issuer, lookups, metrics, Clock.systemUTC());
    }

    public GrantEngine(
            ClientAuthenticator authenticator,
            CredentialStore store,
            TokenCodec codec,
            TokenIssuer issuer,
            TokenLookupService lookups,
            OAuth2Metrics metrics,
            Clock clock) {
        this.authenticator = authenticator;
        this.store = store;
        this.codec = codec;
        this.issuer = issuer;
        this.lookups = lookups;
        this.metrics = metrics;
        this.clock = clock;
    }

    @Override
    public EndpointResponse authorize(AuthorizationRequest request) {
        try {
            return handleAuthorization(request);
        } catch (OAuth2Error e) {
            return reject("authorize", e);
        } catch (RuntimeException e) {
            LOG.errorf(e, "Authorization request failed unexpectedly");
            return reject("authorize", OAuth2Error.serverError(null));
        }
    }

    @Override
    public EndpointResponse token(TokenRequest request) {
        try {
            final var grantType = GrantType.fromValue(request.grantType())
                    .orElseThrow(() -> request.grantType() == null || request.grantType().isEmpty()
                            ? OAuth2Error.invalidRequest("Missing grant type")
                            : OAuth2Error.unsupportedGrantType("Unknown grant type"));
            final var client = authenticator.authenticate(request.client());

            final TokenResponse response = switch (grantType) {
                case PASSWORD -> passwordGrant(client, request);
                case CLIENT_CREDENTIALS -> clientCredentialsGrant(client, request);
                case AUTHORIZATION_CODE -> authorizationCodeGrant(client, request);
                case REFRESH_TOKEN -> refreshTokenGrant(client, request);
            };
            metrics.recordIssued(grantType.value());
            return OAuth2Responses.token(response);
        } catch (OAuth2Error e) {
            return reject("token", e);
        } catch (RuntimeException e) {
            LOG.errorf(e, "Token request failed unexpectedly");
            return reject("token", OAuth2Error.serverError(null));
        }
    }

    @Override
    public EndpointResponse revoke(TokenLookupRequest request) {
        try {
            return lookups.revoke(request);
        } catch (OAuth2Error e) {
            return reject("revoke", e);
        } catch (RuntimeException e) {
            LOG.errorf(e, "Revocation request failed unexpectedly");
            return reject("revoke", OAuth2Error.serverError(null));
        }
    }

    @Override
    public EndpointResponse introspect(TokenLookupRequest request) {
        try {
            return lookups.introspect(request);
        } catch (OAuth2Error e) {
            return reject("introspect", e);
        } catch (RuntimeException e) {
            LOG.errorf(e, "Introspection request failed unexpectedly");
            return reject("introspect", OAuth2Error.serverError(null));
        }
    }

    private EndpointResponse handleAuthorization(AuthorizationRequest request) {
        final var responseType = ResponseType.fromValue(request.responseType())
                .orElseThrow(() -> OAuth2Error.unsupportedResponseType("Unknown response type"));
        final var client = authenticator.lookup(request.clientId());
        final var redirectUri = request.redirectUri();
        if (redirectUri == null || !redirectUri.equals(client.redirectUri())) {
            throw OAuth2Error.invalidRequest("Invalid redirect URI");
        }

        if (!request.submission()) {
            return new EndpointResponse.Text(200, AUTHORIZATION_NOTICE);
        }

        // from here on every error goes back to the client by redirect
        final var useFragment = responseType == ResponseType.TOKEN;
        try {
            if (!authenticator.allowedScope(client).includes(request.scope())) {
                throw OAuth2Error.invalidScope(null).redirectTo(redirectUri, request.state(), useFragment);
            }
            final var owner = authenticator
                    .authenticateOwner(request.username(), request.password())
                    .orElseThrow(() -> OAuth2Error.accessDenied(null)
                            .redirectTo(redirectUri, request.state(), useFragment));

            return switch (responseType) {
                case TOKEN -> {
                    final var tokens = issuer.issueTokens(client.id(), owner.username(), request.scope(), false, null)
                            .withState(request.state());
                    metrics.recordIssued(IMPLICIT);
                    yield OAuth2Responses.tokenRedirect(tokens, redirectUri);
                }
                case CODE -> {
                    final var code =
                            issuer.issueAuthorizationCode(client.id(), owner.username(), request.scope(), redirectUri);
                    yield OAuth2Responses.codeRedirect(code, request.state(), redirectUri);
                }
            };
        } catch (OAuth2Error e) {
            throw e;
        } catch (RuntimeException e) {
            LOG.errorf(e, "Authorization for client %s failed unexpectedly", client.id());
            throw OAuth2Error.serverError(null).redirectTo(redirectUri, request.state(), useFragment);
        }
    }

    private TokenResponse passwordGrant(Client client, TokenRequest request) {
        final var owner = authenticator
                .authenticateOwner(request.username(), request.password())
                .orElseThrow(() -> OAuth2Error.accessDenied("Unknown resource owner"));
        requireAllowed(client, request.scope());
        return issuer.issueTokens(client.id(), owner.username(), request.scope(), true, null);
    }

    private TokenResponse clientCredentialsGrant(Client client, TokenRequest request) {
        if (!client.confidential()) {
            throw OAuth2Error.invalidClient("Client credentials grant requires a confidential client");
        }
        requireAllowed(client, request.scope());
        return issuer.issueTokens(client.id(), null, request.scope(), true, null);
    }

    private TokenResponse authorizationCodeGrant(Client client, TokenRequest request) {
        if (request.code() == null || request.code().isEmpty()) {
            throw OAuth2Error.invalidRequest("Missing authorization code");
        }
        final var signature = parse(request.code(), "Malformed authorization code").signatureString();

        return store.exclusive(() -> {
            final var code = store.get(TokenType.AUTHORIZATION_CODE, signature)
                    .orElseThrow(() -> OAuth2Error.invalidGrant("Unknown authorization code"));

            if (code.used()) {
                if (store.markUsed(signature) == RedemptionOutcome.REPLAYED) {
                    metrics.recordCodeReplay();
                }
                LOG.warnf(
                        "Authorization code %s replayed by client %s; derived tokens revoked",
                        SecureHash.fingerprint(signature), client.id());
                throw OAuth2Error.invalidGrant("Unknown authorization code");
            }
            if (code.isExpired(clock.instant())) {
                throw OAuth2Error.invalidGrant("Expired authorization code");
            }
            if (!code.clientId().equals(client.id())) {
                throw OAuth2Error.invalidGrant("Invalid authorization code ownership");
            }
            if (!Objects.equals(code.redirectUri(), request.redirectUri())) {
                throw OAuth2Error.invalidGrant("Changed redirect URI");
            }

            final var scope = codeScope(client, code, request.scope());
            final var response =
                    issuer.issueTokens(client.id(), code.resourceOwnerId(), scope, true, signature);
            store.markUsed(signature);
            return response;
        });
    }

    private TokenResponse refreshTokenGrant(Client client, TokenRequest request) {
        if (request.refreshToken() == null || request.refreshToken().isEmpty()) {
            throw OAuth2Error.invalidRequest("Missing refresh token");
        }
        final var signature = parse(request.refreshToken(), "Malformed refresh token").signatureString();

        return store.exclusive(() -> {
            final var refresh = store.get(TokenType.REFRESH_TOKEN, signature)
                    .orElseThrow(() -> OAuth2Error.invalidGrant("Unknown refresh token"));
            if (refresh.isExpired(clock.instant())) {
                throw OAuth2Error.invalidGrant("Expired refresh token");
            }
            if (!refresh.clientId().equals(client.id())) {
                throw OAuth2Error.invalidGrant("Invalid refresh token ownership");
            }

            final var scope = request.scope().isEmpty() ? refresh.scope() : request.scope();
            if (!refresh.scope().includes(scope)) {
                throw OAuth2Error.invalidScope("Scope exceeds the originally granted scope");
            }

            final var response =
                    issuer.issueTokens(client.id(), refresh.resourceOwnerId(), scope, true, refresh.parentCode());
            store.delete(TokenType.REFRESH_TOKEN, signature);
            return response;
        });
    }

    /**
     * Scope granted when redeeming a code: the code's scope must still be
     * allowed for the client, and a requested scope may only narrow it.
     */
    private Scope codeScope(Client client, Credential code, Scope requested) {
        if (!authenticator.allowedScope(client).includes(code.scope())) {
            throw OAuth2Error.invalidScope("Authorized scope is no longer allowed for this client");
        }
        if (requested.isEmpty()) {
            return code.scope();
        }
        if (!code.scope().includes(requested)) {
            throw OAuth2Error.invalidScope("Scope exceeds the authorized scope");
        }
        return requested;
    }

    private void requireAllowed(Client client, Scope requested) {
        if (!authenticator.allowedScope(client).includes(requested)) {
            throw OAuth2Error.invalidScope("Scope is not allowed for this client");
        }
    }

    private OpaqueToken parse(String token, String description) {
        try {
            return codec.parse(token);
        } catch (MalformedTokenException e) {
            throw OAuth2Error.invalidRequest(description);
        }
    }

    private EndpointResponse reject(String endpoint, OAuth2Error error) {
        LOG.debugf("%s request rejected: %s", endpoint, error.getMessage());
        metrics.recordError(endpoint, error.code());
        return OAuth2Responses.error(error);
    }
}
