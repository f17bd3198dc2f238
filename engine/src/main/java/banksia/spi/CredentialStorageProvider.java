package banksia.spi;

import java.util.Optional;

import org.eclipse.microprofile.health.HealthCheckResponse;

import banksia.core.config.OAuth2Config;
import banksia.core.port.out.CredentialStore;

/**
 * SPI for credential storage implementations.
 *
 * <p>Platform teams can implement this interface to keep tokens and codes in
 * a shared backend. Built-in providers:
 * <ul>
 *   <li>memory (priority: 0) - In-memory storage, single instance only</li>
 * </ul>
 *
 * <p>Provider selection order:
 * <ol>
 *   <li>Configured provider (banksia.oauth2.storage.provider)</li>
 *   <li>Highest priority available provider</li>
 * </ol>
 *
 * <h2>Custom Implementation Example</h2>
 * <pre>{@code
 * @ApplicationScoped
 * public class JdbcCredentialStorageProvider implements CredentialStorageProvider {
 *
 *     @Override
 *     public String name() {
 *         return "jdbc";
 *     }
 *
 *     @Override
 *     public int priority() {
 *         return 100;
 *     }
 *
 *     @Override
 *     public boolean isAvailable() {
 *         return dataSource != null;
 *     }
 *
 *     @Override
 *     public CredentialStore createStore(OAuth2Config config) {
 *         return new JdbcCredentialStore(dataSource);
 *     }
 * }
 * }</pre>
 *
 * @see CredentialStore
 */
public interface CredentialStorageProvider {

    /**
     * Return the provider name used in {@code banksia.oauth2.storage.provider}.
     *
     * @return Provider name (e.g., "memory", "jdbc")
     */
    String name();

    /**
     * Return the provider priority for automatic selection.
     *
     * @return Priority value (higher = more preferred)
     */
    int priority();

    /**
     * Check if this provider is available and ready to use.
     *
     * @return true if the provider can be used
     */
    boolean isAvailable();

    /**
     * Create the credential store.
     *
     * <p>The returned store must honor the {@link CredentialStore} contract,
     * in particular the exclusive section used for single-use redemption.
     *
     * @param config server configuration
     * @return credential store instance
     * @throws StorageProviderException if the backend cannot be initialized
     */
    CredentialStore createStore(OAuth2Config config);

    /**
     * Create a health indicator for this storage backend.
     *
     * @return Health check response, or empty if not supported
     */
    default Optional<HealthCheckResponse> healthCheck() {
        return Optional.empty();
    }
}
