package banksia.core.model.oauth;

/**
 * A revocation (RFC 7009) or introspection (RFC 7662) request.
 *
 * @param client        presented client credentials, null if none
 * @param token         the token string to act on
 * @param tokenTypeHint optional {@code token_type_hint}
 */
public record TokenLookupRequest(ClientCredentials client, String token, String tokenTypeHint) {}
