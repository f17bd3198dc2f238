package banksia.core.service.token;

import java.time.Clock;
import java.time.Duration;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import org.jboss.logging.Logger;

import banksia.core.config.OAuth2Config;
import banksia.core.model.auth.Scope;
import banksia.core.model.oauth.TokenResponse;
import banksia.core.model.token.Credential;
import banksia.core.model.token.TokenType;
import banksia.core.port.out.CredentialStore;
import banksia.core.util.SecureHash;

/**
 * Mints tokens and codes and records their credentials.
 *
 * <p>All random material is generated before anything is written, so a
 * failure while generating leaves the store untouched.
 */
@ApplicationScoped
public class TokenIssuer {

    private static final Logger LOG = Logger.getLogger(TokenIssuer.class);

    private final TokenCodec codec;
    private final CredentialStore store;
    private final Duration accessTokenLifespan;
    private final Duration refreshTokenLifespan;
    private final Duration authorizationCodeLifespan;
    private final boolean refreshTokensEnabled;
    private final Clock clock;

    @Inject
    public TokenIssuer(TokenCodec codec, CredentialStore store, OAuth2Config config) {
        this(codec, store, config, Clock.systemUTC());
    }

    public TokenIssuer(TokenCodec codec, CredentialStore store, OAuth2Config config, Clock clock) {
        this.codec = codec;
        this.store = store;
        this.accessTokenLifespan = requirePositive(config.accessTokenLifespan(), "access-token-lifespan");
        this.refreshTokenLifespan = requirePositive(config.refreshTokenLifespan(), "refresh-token-lifespan");
        this.authorizationCodeLifespan =
                requirePositive(config.authorizationCodeLifespan(), "authorization-code-lifespan");
        this.refreshTokensEnabled = config.refreshToken().enabled();
        this.clock = clock;
    }

    /**
     * Issue an access token and, where the flow allows one, a refresh token.
     *
     * @param clientId        the client
     * @param resourceOwnerId the resource owner, null for client-only grants
     * @param scope           the granted scope
     * @param withRefresh     whether the flow is entitled to a refresh token
     * @param parentCode      signature of the originating authorization code, or null
     * @return the response document, without state
     */
    public TokenResponse issueTokens(
            String clientId, String resourceOwnerId, Scope scope, boolean withRefresh, String parentCode) {
        final var now = clock.instant();
        final var accessToken = codec.generate();
        final var refreshToken = withRefresh && refreshTokensEnabled ? codec.generate() : null;

        store.put(
                TokenType.ACCESS_TOKEN,
                accessToken.signatureString(),
                Credential.accessToken(clientId, resourceOwnerId, scope, now.plus(accessTokenLifespan), parentCode));
        if (refreshToken != null) {
            store.put(
                    TokenType.REFRESH_TOKEN,
                    refreshToken.signatureString(),
                    Credential.refreshToken(
                            clientId, resourceOwnerId, scope, now.plus(refreshTokenLifespan), parentCode));
        }

        LOG.debugf(
                "Issued access token %s to client %s (refresh: %s)",
                SecureHash.fingerprint(accessToken.signatureString()), clientId, refreshToken != null);

        return new TokenResponse(
                accessToken.encode(),
                accessTokenLifespan.toSeconds(),
                refreshToken == null ? null : refreshToken.encode(),
                scope,
                null);
    }

    /**
     * Issue an authorization code bound to a redirect URI.
     *
     * @return the encoded code
     */
    public String issueAuthorizationCode(
            String clientId, String resourceOwnerId, Scope scope, String redirectUri) {
        final var code = codec.generate();
        store.put(
                TokenType.AUTHORIZATION_CODE,
                code.signatureString(),
                Credential.authorizationCode(
                        clientId, resourceOwnerId, scope, clock.instant().plus(authorizationCodeLifespan),
                        redirectUri));
        LOG.debugf(
                "Issued authorization code %s to client %s",
                SecureHash.fingerprint(code.signatureString()), clientId);
        return code.encode();
    }

    private static Duration requirePositive(Duration lifespan, String key) {
        if (lifespan == null || lifespan.isNegative() || lifespan.isZero()) {
            throw new IllegalStateException("banksia.oauth2." + key + " must be positive, got " + lifespan);
        }
        return lifespan;
    }
}
