package banksia.adapter.out.auth;

import java.util.Locale;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;

import io.quarkus.arc.DefaultBean;
import org.jboss.logging.Logger;

import banksia.core.config.OAuth2Config;
import banksia.core.port.out.SecretVerifier;

/**
 * Produces the {@link SecretVerifier} named by {@code banksia.oauth2.secret-verifier}.
 */
@ApplicationScoped
public class SecretVerifierProducer {

    private static final Logger LOG = Logger.getLogger(SecretVerifierProducer.class);

    private final OAuth2Config config;

    @Inject
    public SecretVerifierProducer(OAuth2Config config) {
        this.config = config;
    }

    @Produces
    @DefaultBean
    @ApplicationScoped
    public SecretVerifier secretVerifier() {
        final var scheme = config.secretVerifier().trim().toLowerCase(Locale.ROOT);
        LOG.infof("Using %s secret verification", scheme);
        return switch (scheme) {
            case "plain" -> new PlainSecretVerifier();
            case "argon2" -> new Argon2SecretVerifier();
            default -> throw new IllegalStateException(
                    "Unknown banksia.oauth2.secret-verifier '" + scheme + "' (expected plain or argon2)");
        };
    }
}
