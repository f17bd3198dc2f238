package banksia.core.model.bearer;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("BearerError")
class BearerErrorTest {

    @Nested
    @DisplayName("challenge()")
    class ChallengeTests {

        @Test
        @DisplayName("should fall back to the default realm for a bare challenge")
        void shouldUseDefaultRealm() {
            final var error = BearerError.protectedResource();

            assertEquals(401, error.status());
            assertEquals("Bearer realm=\"OAuth2\"", error.challenge());
        }

        @Test
        @DisplayName("should list parameters sorted by key")
        void shouldSortParameters() {
            final var error = BearerError.invalidToken("Expired token").withRealm("api");

            assertEquals(
                    "Bearer error=\"invalid_token\", error_description=\"Expired token\", realm=\"api\"",
                    error.challenge());
        }

        @Test
        @DisplayName("should echo the required scope for insufficient_scope")
        void shouldEchoScope() {
            final var error = BearerError.insufficientScope("foo");

            assertEquals(403, error.status());
            assertEquals("Bearer error=\"insufficient_scope\", scope=\"foo\"", error.challenge());
        }

        @Test
        @DisplayName("should escape quotes and backslashes inside values")
        void shouldEscapeQuotedValues() {
            final var error = BearerError.insufficientScope("fo\"o b\\ar");

            assertEquals(
                    "Bearer error=\"insufficient_scope\", scope=\"fo\\\"o b\\\\ar\"",
                    error.challenge());
        }
    }

    @Test
    @DisplayName("should flag server errors as internal")
    void shouldFlagInternal() {
        assertTrue(BearerError.serverError().internal());
        assertEquals(400, BearerError.invalidRequest("Multiple access tokens in request").status());
    }
}
