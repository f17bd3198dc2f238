package banksia.adapter.out.storage.memory;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;

import org.eclipse.microprofile.health.HealthCheckResponse;
import org.jboss.logging.Logger;

import banksia.core.config.OAuth2Config;
import banksia.core.model.token.TokenType;
import banksia.core.port.out.CredentialStore;
import banksia.spi.CredentialStorageProvider;

/**
 * In-memory credential storage provider.
 *
 * <p>Always available. Tokens issued by one instance are unknown to every
 * other instance, so multi-instance deployments need a custom provider.
 */
@ApplicationScoped
public class InMemoryCredentialStorageProvider implements CredentialStorageProvider {

    private static final Logger LOG = Logger.getLogger(InMemoryCredentialStorageProvider.class);
    private static final int PRIORITY = 0;

    private final AtomicBoolean warningLogged = new AtomicBoolean(false);
    private volatile InMemoryCredentialStore store;

    @Override
    public String name() {
        return "memory";
    }

    @Override
    public int priority() {
        return PRIORITY;
    }

    @Override
    public boolean isAvailable() {
        return true;
    }

    @Override
    public synchronized CredentialStore createStore(OAuth2Config config) {
        if (warningLogged.compareAndSet(false, true)) {
            LOG.warn("========================================================================");
            LOG.warn("  WARNING: OAuth2 credential storage is in-memory only!");
            LOG.warn("  Tokens are lost on restart and not shared between instances.");
            LOG.warn("========================================================================");
        }

        if (store == null) {
            store = new InMemoryCredentialStore(config.storage().cleanupInterval());
        }
        return store;
    }

    @Override
    public Optional<HealthCheckResponse> healthCheck() {
        final var current = store;
        return Optional.of(HealthCheckResponse.named("credential-storage-memory")
                .up()
                .withData("type", "in-memory")
                .withData("accessTokens", current != null ? current.count(TokenType.ACCESS_TOKEN) : 0)
                .withData("refreshTokens", current != null ? current.count(TokenType.REFRESH_TOKEN) : 0)
                .withData("authorizationCodes", current != null ? current.count(TokenType.AUTHORIZATION_CODE) : 0)
                .build());
    }

    @PreDestroy
    void shutdown() {
        if (store != null) {
            store.shutdown();
        }
    }
}
