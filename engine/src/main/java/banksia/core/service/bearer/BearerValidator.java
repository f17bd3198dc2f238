package banksia.core.service.bearer;

import java.time.Clock;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import org.jboss.logging.Logger;

import banksia.core.model.auth.Scope;
import banksia.core.model.bearer.BearerError;
import banksia.core.model.oauth.EndpointResponse;
import banksia.core.model.token.Credential;
import banksia.core.model.token.MalformedTokenException;
import banksia.core.model.token.TokenType;
import banksia.core.port.in.ResourceProtection;
import banksia.core.port.out.CredentialStore;
import banksia.core.port.out.OAuth2Metrics;
import banksia.core.service.oauth.OAuth2Responses;
import banksia.core.service.token.TokenCodec;
import banksia.core.util.SecureHash;

/**
 * Validates bearer access tokens presented to protected resources.
 */
@ApplicationScoped
public class BearerValidator implements ResourceProtection {

    private static final Logger LOG = Logger.getLogger(BearerValidator.class);

    private final TokenCodec codec;
    private final CredentialStore store;
    private final OAuth2Metrics metrics;
    private final Clock clock;

    @Inject
    public BearerValidator(TokenCodec codec, CredentialStore store, OAuth2Metrics metrics) {
        this(codec, store, metrics, Clock.systemUTC());
    }

    public BearerValidator(TokenCodec codec, CredentialStore store, OAuth2Metrics metrics, Clock clock) {
        this.codec = codec;
        this.store = store;
        this.metrics = metrics;
        this.clock = clock;
    }

    @Override
    public Credential authorize(String token, Scope required) {
        if (token == null || token.isEmpty()) {
            metrics.recordBearerRejected("missing");
            throw BearerError.protectedResource();
        }

        final String signature;
        try {
            signature = codec.signatureOf(token);
        } catch (MalformedTokenException e) {
            throw rejected(BearerError.invalidToken("Malformed token"));
        }

        final var credential = store.get(TokenType.ACCESS_TOKEN, signature)
                .orElseThrow(() -> rejected(BearerError.invalidToken("Unknown token")));
        if (credential.isExpired(clock.instant())) {
            throw rejected(BearerError.invalidToken("Expired token"));
        }

        final var scope = required == null ? Scope.empty() : required;
        if (!credential.scope().includes(scope)) {
            LOG.debugf(
                    "Token %s lacks scope %s (granted: %s)",
                    SecureHash.fingerprint(signature), scope, credential.scope());
            throw rejected(BearerError.insufficientScope(scope.toString()));
        }
        return credential;
    }

    @Override
    public EndpointResponse challenge(RuntimeException failure) {
        if (!(failure instanceof BearerError)) {
            LOG.errorf(failure, "Bearer token validation failed unexpectedly");
        }
        return OAuth2Responses.bearerChallenge(failure);
    }

    private BearerError rejected(BearerError error) {
        metrics.recordBearerRejected(error.code().code());
        return error;
    }
}
