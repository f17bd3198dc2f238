package banksia.core.model.oauth;

import java.util.Arrays;
import java.util.Optional;

/**
 * Grant types accepted at the token endpoint. The implicit grant has no
 * token-endpoint form and is modelled by {@link ResponseType#TOKEN}.
 */
public enum GrantType {
    PASSWORD("password"),
    CLIENT_CREDENTIALS("client_credentials"),
    AUTHORIZATION_CODE("authorization_code"),
    REFRESH_TOKEN("refresh_token");

    private final String value;

    GrantType(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    public static Optional<GrantType> fromValue(String value) {
        return Arrays.stream(values()).filter(t -> t.value.equals(value)).findFirst();
    }
}
