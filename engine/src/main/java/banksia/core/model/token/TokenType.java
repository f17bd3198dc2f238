package banksia.core.model.token;

import java.util.Arrays;
import java.util.Optional;

/**
 * The kinds of credential the server issues, each kept in its own store.
 */
public enum TokenType {
    ACCESS_TOKEN("access_token"),
    REFRESH_TOKEN("refresh_token"),
    AUTHORIZATION_CODE("authorization_code");

    private final String value;

    TokenType(String value) {
        this.value = value;
    }

    /**
     * Wire name used in {@code token_type_hint} and introspection responses.
     */
    public String value() {
        return value;
    }

    /**
     * Resolve a {@code token_type_hint}. Authorization codes are never valid hints.
     *
     * @param hint the hint from the request
     * @return the matching type, or empty if the hint is unknown
     */
    public static Optional<TokenType> fromHint(String hint) {
        return Arrays.stream(values())
                .filter(t -> t != AUTHORIZATION_CODE)
                .filter(t -> t.value.equals(hint))
                .findFirst();
    }
}
