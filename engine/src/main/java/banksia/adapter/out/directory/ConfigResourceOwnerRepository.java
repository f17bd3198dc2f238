package banksia.adapter.out.directory;

import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.quarkus.arc.DefaultBean;

import banksia.core.config.OAuth2Config;
import banksia.core.model.client.ResourceOwner;
import banksia.core.port.out.ResourceOwnerRepository;

/**
 * Resource owner directory backed by {@code banksia.oauth2.owners.*} configuration.
 */
@DefaultBean
@ApplicationScoped
public class ConfigResourceOwnerRepository implements ResourceOwnerRepository {

    private final Map<String, ResourceOwner> owners;

    @Inject
    public ConfigResourceOwnerRepository(OAuth2Config config) {
        this.owners = config.owners().entrySet().stream()
                .collect(Collectors.toUnmodifiableMap(
                        Map.Entry::getKey, e -> new ResourceOwner(e.getKey(), e.getValue().secret())));
    }

    @Override
    public Optional<ResourceOwner> findByUsername(String username) {
        if (username == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(owners.get(username));
    }
}
