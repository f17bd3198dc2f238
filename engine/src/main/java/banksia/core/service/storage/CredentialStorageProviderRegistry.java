package banksia.core.service.storage;

import java.util.Comparator;
import java.util.List;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Instance;
import jakarta.inject.Inject;

import org.jboss.logging.Logger;

import banksia.core.config.OAuth2Config;
import banksia.core.port.out.CredentialStore;
import banksia.spi.CredentialStorageProvider;
import banksia.spi.StorageProviderException;

/**
 * Registry for credential storage providers.
 *
 * <p>Discovers providers via CDI and selects one based on configuration and
 * availability:
 * <ol>
 *   <li>Configured provider (banksia.oauth2.storage.provider)</li>
 *   <li>Highest priority available provider</li>
 * </ol>
 */
@ApplicationScoped
public class CredentialStorageProviderRegistry {

    private static final Logger LOG = Logger.getLogger(CredentialStorageProviderRegistry.class);

    private final Instance<CredentialStorageProvider> providers;
    private final OAuth2Config config;

    private volatile CredentialStorageProvider selectedProvider;
    private volatile CredentialStore store;

    @Inject
    public CredentialStorageProviderRegistry(Instance<CredentialStorageProvider> providers, OAuth2Config config) {
        this.providers = providers;
        this.config = config;
    }

    /**
     * Get the credential store from the selected provider.
     *
     * @return credential store instance
     */
    public synchronized CredentialStore getStore() {
        if (store == null) {
            store = getSelectedProvider().createStore(config);
        }
        return store;
    }

    /**
     * Get the selected storage provider.
     *
     * @return selected provider
     */
    public synchronized CredentialStorageProvider getSelectedProvider() {
        if (selectedProvider == null) {
            selectedProvider = selectProvider(getAvailableProviders(), config.storage().provider());
        }
        return selectedProvider;
    }

    /**
     * Get all available providers, highest priority first.
     */
    public List<CredentialStorageProvider> getAvailableProviders() {
        return providers.stream()
                .filter(CredentialStorageProvider::isAvailable)
                .sorted(Comparator.comparingInt(CredentialStorageProvider::priority).reversed())
                .toList();
    }

    static CredentialStorageProvider selectProvider(List<CredentialStorageProvider> available, String configured) {
        LOG.debugf(
                "Available credential storage providers: %s",
                available.stream().map(CredentialStorageProvider::name).toList());

        final var match = available.stream().filter(p -> p.name().equals(configured)).findFirst();
        if (match.isPresent()) {
            LOG.infof("Using configured credential storage provider: %s", configured);
            return match.get();
        }

        if (!"memory".equals(configured)) {
            LOG.warnf("Configured credential storage provider '%s' is not available, falling back", configured);
        }
        if (available.isEmpty()) {
            throw new StorageProviderException(configured, "No credential storage providers available");
        }

        final var provider = available.get(0);
        LOG.infof("Using credential storage provider: %s (priority: %d)", provider.name(), provider.priority());
        return provider;
    }
}
