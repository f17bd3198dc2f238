package banksia.adapter.in.auth;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.charset.StandardCharsets;
import java.util.Base64;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import banksia.core.model.oauth.ClientCredentials;
import banksia.core.model.oauth.OAuth2Error;
import banksia.core.model.oauth.OAuth2ErrorCode;

@DisplayName("ClientCredentialsParser")
class ClientCredentialsParserTest {

    private static String basic(String value) {
        return "Basic " + Base64.getEncoder().encodeToString(value.getBytes(StandardCharsets.UTF_8));
    }

    @Test
    @DisplayName("should accept Basic with a matching client_id form field")
    void shouldAcceptBasicWithMatchingClientId() {
        final var credentials = ClientCredentialsParser.parse(basic("client1:foo"), "client1", null);

        assertEquals(new ClientCredentials("client1", "foo"), credentials.orElseThrow());
    }

    @Test
    @DisplayName("should reject Basic combined with form credentials")
    void shouldRejectTwoAuthenticationMethods() {
        final var otherClient = assertThrows(
                OAuth2Error.class, () -> ClientCredentialsParser.parse(basic("client1:foo"), "client2", null));
        final var formSecret = assertThrows(
                OAuth2Error.class, () -> ClientCredentialsParser.parse(basic("client1:foo"), "client1", "foo"));

        assertEquals(OAuth2ErrorCode.INVALID_REQUEST, otherClient.code());
        assertEquals(OAuth2ErrorCode.INVALID_REQUEST, formSecret.code());
    }

    @Test
    @DisplayName("should form-decode Basic credentials")
    void shouldDecodeBasicCredentials() {
        final var credentials = ClientCredentialsParser.parse(basic("my%20client:p%3Ass"), null, null);

        assertEquals(new ClientCredentials("my client", "p:ss"), credentials.orElseThrow());
    }

    @Test
    @DisplayName("should fall back to form fields")
    void shouldFallBackToForm() {
        assertEquals(
                new ClientCredentials("public1", null),
                ClientCredentialsParser.parse(null, "public1", null).orElseThrow());
        assertEquals(
                new ClientCredentials("client1", "foo"),
                ClientCredentialsParser.parse("Bearer abc", "client1", "foo").orElseThrow());
    }

    @Test
    @DisplayName("should return empty when no credentials are present")
    void shouldReturnEmpty() {
        assertTrue(ClientCredentialsParser.parse(null, null, null).isEmpty());
        assertTrue(ClientCredentialsParser.parse(null, "", "foo").isEmpty());
    }

    @Test
    @DisplayName("should reject malformed Basic headers")
    void shouldRejectMalformedBasic() {
        final var notBase64 = assertThrows(OAuth2Error.class, () -> ClientCredentialsParser.parse("Basic !!!", null, null));
        final var noColon =
                assertThrows(OAuth2Error.class, () -> ClientCredentialsParser.parse(basic("client1"), null, null));

        assertEquals(OAuth2ErrorCode.INVALID_REQUEST, notBase64.code());
        assertEquals(OAuth2ErrorCode.INVALID_REQUEST, noColon.code());
    }
}
