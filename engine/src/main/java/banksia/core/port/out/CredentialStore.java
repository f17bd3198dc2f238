package banksia.core.port.out;

import java.util.Optional;
import java.util.function.Supplier;

import banksia.core.model.token.Credential;
import banksia.core.model.token.RedemptionOutcome;
import banksia.core.model.token.TokenType;

/**
 * Outbound port for credential storage.
 *
 * <p>Holds access tokens, refresh tokens and authorization codes, one keyspace
 * per {@link TokenType}, keyed by token signature. Platform teams can provide
 * durable implementations through {@code CredentialStorageProvider}.
 *
 * <h2>Implementation Requirements</h2>
 * <ul>
 *   <li>Operations MUST be fail-fast: a rejected call leaves no partial write</li>
 *   <li>{@link #get} MAY return expired entries; callers treat them as absent</li>
 *   <li>{@link #exclusive} MUST serialize read-then-write sequences so that two
 *       concurrent redemptions of one code or refresh token cannot both succeed</li>
 * </ul>
 */
public interface CredentialStore {

    /**
     * Store a credential.
     *
     * @param type      the keyspace; must match {@link Credential#type()}
     * @param signature the token signature
     * @param credential the credential, expiring strictly in the future
     * @throws IllegalArgumentException if the type does not match or the credential is already expired
     */
    void put(TokenType type, String signature, Credential credential);

    /**
     * Look up a credential by signature.
     *
     * @param type      the keyspace
     * @param signature the token signature
     * @return the credential if present, possibly expired
     */
    Optional<Credential> get(TokenType type, String signature);

    /**
     * Delete a credential. Deleting a missing entry is a no-op.
     *
     * @param type      the keyspace
     * @param signature the token signature
     * @return true if an entry was removed
     */
    boolean delete(TokenType type, String signature);

    /**
     * Mark an authorization code as used.
     *
     * <p>If the code was already used, every access and refresh token whose
     * parent code is {@code codeSignature} is deleted instead and
     * {@link RedemptionOutcome#REPLAYED} is returned.
     *
     * @param codeSignature the authorization code signature
     * @return the outcome
     */
    RedemptionOutcome markUsed(String codeSignature);

    /**
     * Delete all access and refresh tokens derived from an authorization code.
     *
     * @param codeSignature the authorization code signature
     * @return number of credentials deleted
     */
    int revokeDerived(String codeSignature);

    /**
     * Run an action while holding the store's exclusive section.
     *
     * <p>Store calls made by the action re-enter the same section.
     *
     * @param action the read-then-write sequence
     * @param <T>    result type
     * @return the action's result
     */
    <T> T exclusive(Supplier<T> action);

    /**
     * Number of entries in a keyspace, expired ones included.
     */
    int count(TokenType type);
}
