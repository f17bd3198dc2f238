package banksia.adapter.out.directory;

import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.quarkus.arc.DefaultBean;
import org.jboss.logging.Logger;

import banksia.core.config.OAuth2Config;
import banksia.core.model.auth.Scope;
import banksia.core.model.client.Client;
import banksia.core.port.out.ClientRepository;

/**
 * Client registry backed by {@code banksia.oauth2.clients.*} configuration.
 *
 * <p>Applications with their own client registry replace this bean by
 * providing another {@link ClientRepository}.
 */
@DefaultBean
@ApplicationScoped
public class ConfigClientRepository implements ClientRepository {

    private static final Logger LOG = Logger.getLogger(ConfigClientRepository.class);

    private final Map<String, Client> clients;

    @Inject
    public ConfigClientRepository(OAuth2Config config) {
        this.clients = config.clients().entrySet().stream()
                .collect(Collectors.toUnmodifiableMap(Map.Entry::getKey, e -> toClient(e.getKey(), e.getValue())));
        LOG.infof("Loaded %d OAuth2 clients from configuration", clients.size());
    }

    @Override
    public Optional<Client> findById(String clientId) {
        if (clientId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(clients.get(clientId));
    }

    private static Client toClient(String id, OAuth2Config.ClientEntry entry) {
        return new Client(
                id,
                entry.secret().orElse(null),
                entry.redirectUri().orElse(null),
                entry.allowedScope().map(Scope::parse).orElse(null));
    }
}
