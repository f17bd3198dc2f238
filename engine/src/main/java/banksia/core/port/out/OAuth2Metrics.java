package banksia.core.port.out;

import banksia.core.model.oauth.OAuth2ErrorCode;

/**
 * Port interface for recording authorization server metrics.
 *
 * <p>Keeps the grant flows decoupled from a specific metrics library.
 */
public interface OAuth2Metrics {

    /**
     * Record tokens issued by a flow.
     *
     * @param flow the grant type or {@code implicit}
     */
    void recordIssued(String flow);

    /**
     * Record a protocol error returned to a client.
     *
     * @param endpoint the endpoint name ({@code authorize}, {@code token}, ...)
     * @param code     the error code
     */
    void recordError(String endpoint, OAuth2ErrorCode code);

    /**
     * Record a replayed authorization code.
     */
    void recordCodeReplay();

    /**
     * Record a rejected bearer token.
     *
     * @param reason the bearer error code, or {@code missing}
     */
    void recordBearerRejected(String reason);
}
