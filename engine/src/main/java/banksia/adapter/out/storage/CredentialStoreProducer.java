package banksia.adapter.out.storage;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;

import banksia.core.port.out.CredentialStore;
import banksia.core.service.storage.CredentialStorageProviderRegistry;

/**
 * CDI producer for the credential store.
 *
 * <p>Delegates to the {@link CredentialStorageProviderRegistry}, which selects
 * a {@link banksia.spi.CredentialStorageProvider} based on configuration and
 * availability.
 */
@ApplicationScoped
public class CredentialStoreProducer {

    private final CredentialStorageProviderRegistry registry;

    @Inject
    public CredentialStoreProducer(CredentialStorageProviderRegistry registry) {
        this.registry = registry;
    }

    @Produces
    @ApplicationScoped
    public CredentialStore credentialStore() {
        return registry.getStore();
    }
}
