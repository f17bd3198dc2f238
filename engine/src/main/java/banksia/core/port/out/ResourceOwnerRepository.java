package banksia.core.port.out;

import java.util.Optional;

import banksia.core.model.client.ResourceOwner;

/**
 * Outbound port for looking up resource owners.
 */
public interface ResourceOwnerRepository {

    /**
     * Find a resource owner by username.
     *
     * @param username the username
     * @return the resource owner, or empty if unknown
     */
    Optional<ResourceOwner> findByUsername(String username);
}
