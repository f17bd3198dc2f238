package banksia.core.service.oauth;

import java.util.Optional;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import org.jboss.logging.Logger;

import banksia.core.config.OAuth2Config;
import banksia.core.model.auth.Scope;
import banksia.core.model.client.Client;
import banksia.core.model.client.ResourceOwner;
import banksia.core.model.oauth.ClientCredentials;
import banksia.core.model.oauth.OAuth2Error;
import banksia.core.port.out.ClientRepository;
import banksia.core.port.out.ResourceOwnerRepository;
import banksia.core.port.out.SecretVerifier;

/**
 * Authenticates clients and resource owners and resolves the scope a client
 * may request.
 */
@ApplicationScoped
public class ClientAuthenticator {

    private static final Logger LOG = Logger.getLogger(ClientAuthenticator.class);

    private final ClientRepository clients;
    private final ResourceOwnerRepository owners;
    private final SecretVerifier secretVerifier;
    private final Scope serverScope;

    @Inject
    public ClientAuthenticator(
            ClientRepository clients,
            ResourceOwnerRepository owners,
            SecretVerifier secretVerifier,
            OAuth2Config config) {
        this(clients, owners, secretVerifier, Scope.parse(config.allowedScope().orElse("")));
    }

    public ClientAuthenticator(
            ClientRepository clients, ResourceOwnerRepository owners, SecretVerifier secretVerifier, Scope serverScope) {
        this.clients = clients;
        this.owners = owners;
        this.secretVerifier = secretVerifier;
        this.serverScope = serverScope == null ? Scope.empty() : serverScope;
    }

    /**
     * Look up a client by ID without authenticating it.
     *
     * @throws OAuth2Error invalid_client if the client is unknown
     */
    public Client lookup(String clientId) {
        if (clientId == null || clientId.isEmpty()) {
            throw OAuth2Error.invalidClient("Missing client ID");
        }
        return clients.findById(clientId).orElseThrow(() -> OAuth2Error.invalidClient("Unknown client"));
    }

    /**
     * Authenticate a client at the token, revocation or introspection endpoint.
     *
     * <p>Confidential clients must present their secret. Public clients are
     * identified by ID alone.
     *
     * @param credentials credentials taken from the request, null if none were sent
     * @return the authenticated client
     * @throws OAuth2Error invalid_request without credentials, invalid_client on failure
     */
    public Client authenticate(ClientCredentials credentials) {
        if (credentials == null) {
            throw OAuth2Error.invalidRequest("Missing client credentials");
        }
        final var client = clients.findById(credentials.clientId())
                .orElseThrow(() -> OAuth2Error.invalidClient("Unknown client"));
        if (client.confidential() && !secretVerifier.verify(client.secret(), credentials.secret())) {
            LOG.debugf("Client authentication failed for %s", client.id());
            throw OAuth2Error.invalidClient("Unknown client");
        }
        return client;
    }

    /**
     * Authenticate a resource owner by username and password.
     *
     * @return the owner, or empty if unknown or the password does not match
     */
    public Optional<ResourceOwner> authenticateOwner(String username, String password) {
        if (username == null || username.isEmpty()) {
            return Optional.empty();
        }
        return owners.findByUsername(username).filter(owner -> secretVerifier.verify(owner.secret(), password));
    }

    /**
     * The scope a client may request: its own restriction if configured,
     * otherwise the server-wide allowed scope.
     */
    public Scope allowedScope(Client client) {
        return client.scopeRestriction().orElse(serverScope);
    }
}
