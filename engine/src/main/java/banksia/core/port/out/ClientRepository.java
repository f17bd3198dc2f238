package banksia.core.port.out;

import java.util.Optional;

import banksia.core.model.client.Client;

/**
 * Outbound port for looking up registered clients.
 *
 * <p>Supplied by the host application. Lookups are synchronous and not retried;
 * an unexpected exception is reported to the caller as {@code server_error}.
 */
public interface ClientRepository {

    /**
     * Find a client by ID.
     *
     * @param clientId the client identifier
     * @return the client, or empty if unknown
     */
    Optional<Client> findById(String clientId);
}
