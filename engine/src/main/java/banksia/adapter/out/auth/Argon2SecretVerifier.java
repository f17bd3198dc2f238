package banksia.adapter.out.auth;

import de.mkammerer.argon2.Argon2;
import de.mkammerer.argon2.Argon2Factory;
import org.jboss.logging.Logger;

import banksia.core.port.out.SecretVerifier;

/**
 * Verifies secrets against Argon2id hashes in PHC format
 * ({@code $argon2id$v=19$m=65536,t=3,p=4$...}).
 */
public class Argon2SecretVerifier implements SecretVerifier {

    private static final Logger LOG = Logger.getLogger(Argon2SecretVerifier.class);

    private static final int SALT_LENGTH = 16;
    private static final int HASH_LENGTH = 32;
    private static final int MEMORY_COST = 65536;
    private static final int ITERATIONS = 3;
    private static final int PARALLELISM = 4;

    private final Argon2 argon2;

    public Argon2SecretVerifier() {
        this.argon2 = Argon2Factory.create(Argon2Factory.Argon2Types.ARGON2id, SALT_LENGTH, HASH_LENGTH);
    }

    @Override
    public boolean verify(String storedSecret, String presented) {
        if (storedSecret == null || presented == null) {
            return false;
        }
        final var chars = presented.toCharArray();
        try {
            return argon2.verify(storedSecret, chars);
        } catch (RuntimeException e) {
            LOG.warnf("Stored secret is not a valid Argon2 hash: %s", e.getMessage());
            return false;
        } finally {
            argon2.wipeArray(chars);
        }
    }

    /**
     * Hash a secret for storage in configuration.
     *
     * @param secret the clear text secret
     * @return the PHC formatted hash
     */
    public String hash(String secret) {
        if (secret == null || secret.isEmpty()) {
            throw new IllegalArgumentException("Secret cannot be null or empty");
        }
        final var chars = secret.toCharArray();
        try {
            return argon2.hash(ITERATIONS, MEMORY_COST, PARALLELISM, chars);
        } finally {
            argon2.wipeArray(chars);
        }
    }
}
