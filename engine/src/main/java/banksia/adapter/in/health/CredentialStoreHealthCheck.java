package banksia.adapter.in.health;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import org.eclipse.microprofile.health.HealthCheck;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.eclipse.microprofile.health.Readiness;
import org.jboss.logging.Logger;

import banksia.core.service.storage.CredentialStorageProviderRegistry;

/**
 * Readiness check for credential storage.
 *
 * <p>Delegates to the selected provider's own health check when it has one.
 */
@Readiness
@ApplicationScoped
public class CredentialStoreHealthCheck implements HealthCheck {

    private static final Logger LOG = Logger.getLogger(CredentialStoreHealthCheck.class);

    private final CredentialStorageProviderRegistry registry;

    @Inject
    public CredentialStoreHealthCheck(CredentialStorageProviderRegistry registry) {
        this.registry = registry;
    }

    @Override
    public HealthCheckResponse call() {
        try {
            final var provider = registry.getSelectedProvider();
            return provider.healthCheck().orElseGet(() -> HealthCheckResponse.named("credential-storage")
                    .up()
                    .withData("provider", provider.name())
                    .build());
        } catch (RuntimeException e) {
            LOG.warnf(e, "Credential storage health check failed");
            return HealthCheckResponse.named("credential-storage")
                    .down()
                    .withData("error", String.valueOf(e.getMessage()))
                    .build();
        }
    }
}
