package banksia.core.model.token;

/**
 * Result of marking an authorization code as used.
 */
public enum RedemptionOutcome {
    /** First redemption; the code is now used. */
    MARKED,
    /** The code was already used; everything derived from it has been revoked. */
    REPLAYED,
    /** No such code. */
    NOT_FOUND
}
