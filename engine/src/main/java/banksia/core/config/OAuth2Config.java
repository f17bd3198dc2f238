package banksia.core.config;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration mapping for the authorization server.
 *
 * <p>Configuration prefix: {@code banksia.oauth2}
 *
 * <p>Example configuration:
 * <pre>{@code
 * banksia.oauth2.secret=change-me-to-32-random-characters
 * banksia.oauth2.allowed-scope=foo bar
 * banksia.oauth2.clients.client1.secret=foo
 * banksia.oauth2.clients.client1.redirect-uri=https://example.com/callback
 * banksia.oauth2.owners.user1.secret=bar
 * }</pre>
 */
@ConfigMapping(prefix = "banksia.oauth2")
public interface OAuth2Config {

    /**
     * HMAC key used to sign every token and code.
     *
     * <p>Must be at least 16 bytes. Changing it invalidates all issued tokens.
     *
     * @return the server secret
     */
    String secret();

    /**
     * Number of random bytes in each token key.
     *
     * @return key length (default: 16)
     */
    @WithDefault("16")
    int keyLength();

    /**
     * Space separated scope any client may request unless it has its own restriction.
     *
     * @return the server-wide allowed scope, empty if none is allowed
     */
    Optional<String> allowedScope();

    /**
     * @return access token lifespan (default: 1 hour)
     */
    @WithDefault("PT1H")
    Duration accessTokenLifespan();

    /**
     * @return refresh token lifespan (default: 7 days)
     */
    @WithDefault("P7D")
    Duration refreshTokenLifespan();

    /**
     * @return authorization code lifespan (default: 10 minutes)
     */
    @WithDefault("PT10M")
    Duration authorizationCodeLifespan();

    /**
     * Refresh token issuance.
     */
    RefreshTokenConfig refreshToken();

    /**
     * Secret verification scheme for client and resource owner secrets.
     *
     * <p>Available schemes: {@code plain} (constant-time comparison) and
     * {@code argon2} (stored secrets are Argon2id PHC strings).
     *
     * @return scheme name (default: plain)
     */
    @WithDefault("plain")
    String secretVerifier();

    /**
     * Storage configuration for credentials.
     */
    StorageConfig storage();

    /**
     * Statically configured clients, keyed by client ID.
     */
    Map<String, ClientEntry> clients();

    /**
     * Statically configured resource owners, keyed by username.
     */
    Map<String, OwnerEntry> owners();

    interface RefreshTokenConfig {

        /**
         * Whether token endpoint flows issue refresh tokens.
         *
         * @return true if refresh tokens are issued (default: true)
         */
        @WithDefault("true")
        boolean enabled();
    }

    interface StorageConfig {

        /**
         * Storage provider name.
         *
         * <p>Available providers: memory, or custom SPI name.
         *
         * @return provider name (default: memory)
         */
        @WithDefault("memory")
        String provider();

        /**
         * Interval of the background sweep that drops expired credentials.
         * Zero disables the sweep.
         *
         * @return sweep interval (default: 1 minute)
         */
        @WithDefault("PT1M")
        Duration cleanupInterval();
    }

    interface ClientEntry {

        /**
         * @return the client secret; absent for public clients
         */
        Optional<String> secret();

        /**
         * @return the registered redirect URI
         */
        Optional<String> redirectUri();

        /**
         * @return space separated scope narrowing the server-wide allowed scope
         */
        Optional<String> allowedScope();
    }

    interface OwnerEntry {

        /**
         * @return the resource owner secret
         */
        String secret();
    }
}
