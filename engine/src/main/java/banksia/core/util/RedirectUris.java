package banksia.core.util;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Builds redirect targets for the authorization endpoint.
 *
 * <p>Parameters are form encoded and emitted in key order. Null or empty
 * values are skipped.
 */
public final class RedirectUris {

    private RedirectUris() {}

    /**
     * Append parameters to the query component, keeping any existing query
     * and fragment of the base URI.
     */
    public static String withQuery(String baseUri, Map<String, String> params) {
        Objects.requireNonNull(baseUri, "baseUri");
        final var encoded = encode(params);
        if (encoded.isEmpty()) {
            return baseUri;
        }

        final var hashIndex = baseUri.indexOf('#');
        final var beforeFragment = hashIndex < 0 ? baseUri : baseUri.substring(0, hashIndex);
        final var fragment = hashIndex < 0 ? "" : baseUri.substring(hashIndex);

        final String separator;
        if (beforeFragment.indexOf('?') < 0) {
            separator = "?";
        } else if (beforeFragment.endsWith("?") || beforeFragment.endsWith("&")) {
            separator = "";
        } else {
            separator = "&";
        }
        return beforeFragment + separator + encoded + fragment;
    }

    /**
     * Replace the fragment component of the base URI with the parameters.
     */
    public static String withFragment(String baseUri, Map<String, String> params) {
        Objects.requireNonNull(baseUri, "baseUri");
        final var hashIndex = baseUri.indexOf('#');
        final var base = hashIndex < 0 ? baseUri : baseUri.substring(0, hashIndex);
        return base + "#" + encode(params);
    }

    /**
     * Form encode parameters in key order.
     */
    public static String encode(Map<String, String> params) {
        if (params == null || params.isEmpty()) {
            return "";
        }
        return new TreeMap<>(params)
                .entrySet().stream()
                        .filter(e -> e.getValue() != null && !e.getValue().isEmpty())
                        .map(e -> URLEncoder.encode(e.getKey(), StandardCharsets.UTF_8) + "="
                                + URLEncoder.encode(e.getValue(), StandardCharsets.UTF_8))
                        .collect(Collectors.joining("&"));
    }
}
