package banksia.core.port.out;

/**
 * Outbound port for checking a presented secret against a stored one.
 *
 * <p>Used for both client and resource owner authentication so the hashing
 * scheme can change without touching the grant flows.
 */
public interface SecretVerifier {

    /**
     * Verify a presented secret.
     *
     * @param storedSecret the stored secret or hash, may be null
     * @param presented    the secret from the request, may be null
     * @return true only if both are present and match
     */
    boolean verify(String storedSecret, String presented);
}
