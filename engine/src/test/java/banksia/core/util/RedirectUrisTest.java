package banksia.core.util;

import static org.junit.jupiter.api.Assertions.assertEquals;

import java.util.LinkedHashMap;
import java.util.Map;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("RedirectUris")
class RedirectUrisTest {

    @Nested
    @DisplayName("withQuery()")
    class WithQueryTests {

        @Test
        @DisplayName("should start a query and order parameters by key")
        void shouldStartQuery() {
            final var params = new LinkedHashMap<String, String>();
            params.put("state", "foobar");
            params.put("code", "abc");

            assertEquals(
                    "https://example.com/cb?code=abc&state=foobar",
                    RedirectUris.withQuery("https://example.com/cb", params));
        }

        @Test
        @DisplayName("should extend an existing query and keep the fragment")
        void shouldExtendExistingQuery() {
            assertEquals(
                    "https://example.com/cb?x=1&error=access_denied#frag",
                    RedirectUris.withQuery("https://example.com/cb?x=1#frag", Map.of("error", "access_denied")));
        }

        @Test
        @DisplayName("should skip empty values")
        void shouldSkipEmptyValues() {
            final var params = new LinkedHashMap<String, String>();
            params.put("error", "invalid_scope");
            params.put("state", "");

            assertEquals(
                    "https://example.com/cb?error=invalid_scope",
                    RedirectUris.withQuery("https://example.com/cb", params));
        }
    }

    @Nested
    @DisplayName("withFragment()")
    class WithFragmentTests {

        @Test
        @DisplayName("should replace any fragment and form encode values")
        void shouldReplaceFragment() {
            assertEquals(
                    "https://example.com/cb#scope=foo+bar&state=a%26b",
                    RedirectUris.withFragment(
                            "https://example.com/cb#old", Map.of("scope", "foo bar", "state", "a&b")));
        }
    }
}
