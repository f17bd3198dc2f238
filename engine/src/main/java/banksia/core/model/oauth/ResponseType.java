package banksia.core.model.oauth;

import java.util.Arrays;
import java.util.Optional;

/**
 * Response types accepted at the authorization endpoint.
 */
public enum ResponseType {
    /** Implicit grant: the access token is returned in the redirect fragment. */
    TOKEN("token"),
    /** Authorization code grant: a code is returned in the redirect query. */
    CODE("code");

    private final String value;

    ResponseType(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    public static Optional<ResponseType> fromValue(String value) {
        return Arrays.stream(values()).filter(t -> t.value.equals(value)).findFirst();
    }
}
