package banksia.core.model.oauth;

import java.util.Map;

/**
 * Transport-neutral result of an authorization server or resource check.
 *
 * <p>Adapters translate these into HTTP responses; the core never touches the
 * HTTP stack.
 */
public sealed interface EndpointResponse {

    int FOUND = 302;

    int status();

    /**
     * JSON document with a status and extra headers.
     *
     * @param status  HTTP status
     * @param headers extra response headers (e.g. {@code WWW-Authenticate})
     * @param body    document fields in wire order
     */
    record Json(int status, Map<String, String> headers, Map<String, Object> body) implements EndpointResponse {
        public Json {
            headers = headers == null ? Map.of() : Map.copyOf(headers);
            if (body == null) {
                throw new IllegalArgumentException("Body cannot be null");
            }
        }
    }

    /**
     * A {@code 302 Found} redirect.
     *
     * @param location the fully built target URI
     */
    record Redirect(String location) implements EndpointResponse {
        public Redirect {
            if (location == null || location.isEmpty()) {
                throw new IllegalArgumentException("Location cannot be null or empty");
            }
        }

        @Override
        public int status() {
            return FOUND;
        }
    }

    /**
     * A plain text notice.
     *
     * @param status HTTP status
     * @param body   text body
     */
    record Text(int status, String body) implements EndpointResponse {}

    /**
     * A response without a body.
     *
     * @param status  HTTP status
     * @param headers response headers
     */
    record Empty(int status, Map<String, String> headers) implements EndpointResponse {
        public Empty {
            headers = headers == null ? Map.of() : Map.copyOf(headers);
        }
    }
}
