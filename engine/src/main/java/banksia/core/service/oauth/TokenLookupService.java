package banksia.core.service.oauth;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import org.jboss.logging.Logger;

import banksia.core.model.client.Client;
import banksia.core.model.oauth.EndpointResponse;
import banksia.core.model.oauth.OAuth2Error;
import banksia.core.model.oauth.TokenLookupRequest;
import banksia.core.model.token.Credential;
import banksia.core.model.token.MalformedTokenException;
import banksia.core.model.token.TokenType;
import banksia.core.port.out.CredentialStore;
import banksia.core.service.token.TokenCodec;
import banksia.core.util.SecureHash;

/**
 * Token revocation (RFC 7009) and introspection (RFC 7662).
 *
 * <p>Both endpoints accept access and refresh tokens. The type hint only
 * decides which store is searched first.
 */
@ApplicationScoped
public class TokenLookupService {

    private static final Logger LOG = Logger.getLogger(TokenLookupService.class);

    private static final Map<String, Object> INACTIVE = Map.of("active", false);

    private final ClientAuthenticator authenticator;
    private final CredentialStore store;
    private final TokenCodec codec;
    private final Clock clock;

    @Inject
    public TokenLookupService(ClientAuthenticator authenticator, CredentialStore store, TokenCodec codec) {
        this(authenticator, store, codec, Clock.systemUTC());
    }

    public TokenLookupService(
            ClientAuthenticator authenticator, CredentialStore store, TokenCodec codec, Clock clock) {
        this.authenticator = authenticator;
        this.store = store;
        this.codec = codec;
        this.clock = clock;
    }

    /**
     * Revoke a token owned by the requesting client. Unknown tokens are
     * accepted silently.
     *
     * @throws OAuth2Error on an unsupported hint, bad credentials, a malformed
     *                     token, or a token issued to another client
     */
    public EndpointResponse revoke(TokenLookupRequest request) {
        final var order = searchOrder(request.tokenTypeHint());
        final var client = authenticator.authenticate(request.client());
        final var signature = signatureOf(request.token());

        final int revoked = store.exclusive(() -> {
            int count = 0;
            for (final var type : order) {
                final var credential = store.get(type, signature);
                if (credential.isPresent()) {
                    requireOwner(client, credential.get());
                    if (store.delete(type, signature)) {
                        count++;
                    }
                }
            }
            return count;
        });

        if (revoked > 0) {
            LOG.infof("Client %s revoked token %s", client.id(), SecureHash.fingerprint(signature));
        }
        return new EndpointResponse.Empty(200, OAuth2Responses.NO_STORE);
    }

    /**
     * Describe a token owned by the requesting client.
     *
     * @throws OAuth2Error on an unsupported hint, bad credentials, a malformed
     *                     token, or a token issued to another client
     */
    public EndpointResponse introspect(TokenLookupRequest request) {
        final var order = searchOrder(request.tokenTypeHint());
        final var client = authenticator.authenticate(request.client());
        final var signature = signatureOf(request.token());

        for (final var type : order) {
            final Optional<Credential> found = store.get(type, signature);
            if (found.isPresent()) {
                final var credential = found.get();
                requireOwner(client, credential);
                if (credential.isExpired(clock.instant())) {
                    return OAuth2Responses.json(INACTIVE);
                }
                return OAuth2Responses.json(describe(credential));
            }
        }
        return OAuth2Responses.json(INACTIVE);
    }

    private static Map<String, Object> describe(Credential credential) {
        final var body = new LinkedHashMap<String, Object>();
        body.put("active", true);
        if (!credential.scope().isEmpty()) {
            body.put("scope", credential.scope().toString());
        }
        body.put("client_id", credential.clientId());
        credential.resourceOwner().ifPresent(owner -> body.put("username", owner));
        body.put("token_type", credential.type() == TokenType.ACCESS_TOKEN ? "bearer" : credential.type().value());
        body.put("exp", credential.expiresAt().getEpochSecond());
        return body;
    }

    private static List<TokenType> searchOrder(String hint) {
        if (hint == null || hint.isEmpty()) {
            return List.of(TokenType.ACCESS_TOKEN, TokenType.REFRESH_TOKEN);
        }
        final var type = TokenType.fromHint(hint)
                .orElseThrow(() -> OAuth2Error.unsupportedTokenType("Unknown token type hint"));
        return type == TokenType.REFRESH_TOKEN
                ? List.of(TokenType.REFRESH_TOKEN, TokenType.ACCESS_TOKEN)
                : List.of(TokenType.ACCESS_TOKEN, TokenType.REFRESH_TOKEN);
    }

    private String signatureOf(String token) {
        if (token == null || token.isEmpty()) {
            throw OAuth2Error.invalidRequest("Missing token");
        }
        try {
            return codec.signatureOf(token);
        } catch (MalformedTokenException e) {
            throw OAuth2Error.invalidRequest("Malformed token");
        }
    }

    private static void requireOwner(Client client, Credential credential) {
        if (!credential.clientId().equals(client.id())) {
            throw OAuth2Error.invalidClient("Token was issued to another client");
        }
    }
}
