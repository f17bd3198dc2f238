package banksia.core.service.oauth;

import static banksia.EngineFixture.CLIENT1_REDIRECT;
import static banksia.EngineFixture.CLIENT2_REDIRECT;
import static banksia.EngineFixture.NARROW_REDIRECT;
import static banksia.EngineFixture.fragment;
import static banksia.EngineFixture.json;
import static banksia.EngineFixture.location;
import static banksia.EngineFixture.query;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import banksia.EngineFixture;
import banksia.core.model.auth.Scope;
import banksia.core.model.bearer.BearerError;
import banksia.core.model.bearer.BearerErrorCode;
import banksia.core.model.oauth.AuthorizationRequest;
import banksia.core.model.oauth.ClientCredentials;
import banksia.core.model.oauth.EndpointResponse;
import banksia.core.model.oauth.OAuth2ErrorCode;
import banksia.core.model.oauth.TokenRequest;
import banksia.core.model.token.TokenType;

@DisplayName("GrantEngine")
class GrantEngineTest {

    private static final ClientCredentials CLIENT1 = new ClientCredentials("client1", "foo");
    private static final ClientCredentials CLIENT2 = new ClientCredentials("client2", "baz");

    private EngineFixture fixture;
    private GrantEngine engine;

    @BeforeEach
    void setUp() {
        fixture = new EngineFixture();
        engine = fixture.engine;
    }

    private static TokenRequest password(ClientCredentials client, String username, String password, String scope) {
        return new TokenRequest("password", Scope.parse(scope), client, username, password, null, null, null);
    }

    private static TokenRequest codeExchange(ClientCredentials client, String code, String redirectUri, String scope) {
        return new TokenRequest(
                "authorization_code", Scope.parse(scope), client, null, null, code, redirectUri, null);
    }

    private static TokenRequest refresh(ClientCredentials client, String refreshToken, String scope) {
        return new TokenRequest("refresh_token", Scope.parse(scope), client, null, null, null, null, refreshToken);
    }

    private static AuthorizationRequest submit(String responseType, String scope, String password) {
        return new AuthorizationRequest(
                true, responseType, "client1", CLIENT1_REDIRECT, Scope.parse(scope), "foobar", "user1", password);
    }

    private String issueCode(String scope) {
        final var response = engine.authorize(submit("code", scope, "bar"));
        return query(location(response)).get("code");
    }

    private static void assertError(EndpointResponse response, OAuth2ErrorCode code) {
        final var json = json(response);
        assertEquals(code.status(), json.status());
        assertEquals(code.code(), json.body().get("error"));
    }

    private static String field(EndpointResponse response, String name) {
        final var value = json(response).body().get(name);
        return value == null ? null : value.toString();
    }

    @Nested
    @DisplayName("password grant")
    class PasswordGrantTests {

        @Test
        @DisplayName("should issue access and refresh tokens")
        void shouldIssueTokens() {
            final var response = engine.token(password(CLIENT1, "user1", "bar", "foo"));

            final var json = json(response);
            assertEquals(200, json.status());
            assertEquals("bearer", json.body().get("token_type"));
            assertEquals(3600L, json.body().get("expires_in"));
            assertEquals("foo", json.body().get("scope"));
            assertNotNull(json.body().get("refresh_token"));
            assertEquals("no-store", json.headers().get("Cache-Control"));

            final var credential = fixture.validator.authorize(field(response, "access_token"), Scope.parse("foo"));
            assertEquals("user1", credential.resourceOwnerId());
            verify(fixture.metrics).recordIssued("password");
        }

        @Test
        @DisplayName("should omit scope when none was requested")
        void shouldOmitEmptyScope() {
            final var response = engine.token(password(CLIENT1, "user1", "bar", null));

            assertFalse(json(response).body().containsKey("scope"));
        }

        @Test
        @DisplayName("should deny an unknown owner or wrong password")
        void shouldDenyBadOwner() {
            assertError(engine.token(password(CLIENT1, "user1", "wrong", "foo")), OAuth2ErrorCode.ACCESS_DENIED);
            assertError(engine.token(password(CLIENT1, "nobody", "bar", "foo")), OAuth2ErrorCode.ACCESS_DENIED);
            assertError(engine.token(password(CLIENT1, null, null, "foo")), OAuth2ErrorCode.ACCESS_DENIED);
        }

        @Test
        @DisplayName("should reject scope outside the allowed scope")
        void shouldRejectScope() {
            assertError(engine.token(password(CLIENT1, "user1", "bar", "foo baz")), OAuth2ErrorCode.INVALID_SCOPE);
            assertEquals(0, fixture.store.count(TokenType.ACCESS_TOKEN));
        }

        @Test
        @DisplayName("should apply a client's own scope restriction")
        void shouldApplyClientRestriction() {
            final var narrow = new ClientCredentials("narrow", "narrow");

            assertEquals(200, engine.token(password(narrow, "user1", "bar", "foo")).status());
            assertError(engine.token(password(narrow, "user1", "bar", "bar")), OAuth2ErrorCode.INVALID_SCOPE);
        }

        @Test
        @DisplayName("should not issue refresh tokens when they are disabled")
        void shouldHonorRefreshCapability() {
            final var disabled = new EngineFixture(false, EngineFixture.defaultClients());

            final var response = disabled.engine.token(password(CLIENT1, "user1", "bar", "foo"));

            assertEquals(200, response.status());
            assertFalse(json(response).body().containsKey("refresh_token"));
            assertEquals(0, disabled.store.count(TokenType.REFRESH_TOKEN));
        }
    }

    @Nested
    @DisplayName("client authentication")
    class ClientAuthenticationTests {

        @Test
        @DisplayName("should require client credentials")
        void shouldRequireCredentials() {
            assertError(engine.token(password(null, "user1", "bar", "foo")), OAuth2ErrorCode.INVALID_REQUEST);
        }

        @Test
        @DisplayName("should reject unknown clients and wrong secrets with a Basic challenge")
        void shouldRejectBadClients() {
            final var unknown = engine.token(password(new ClientCredentials("nobody", "x"), "user1", "bar", null));
            final var wrongSecret =
                    engine.token(password(new ClientCredentials("client1", "nope"), "user1", "bar", null));

            assertError(unknown, OAuth2ErrorCode.INVALID_CLIENT);
            assertError(wrongSecret, OAuth2ErrorCode.INVALID_CLIENT);
            assertEquals("Basic realm=\"OAuth2\"", json(wrongSecret).headers().get("WWW-Authenticate"));
            verify(fixture.metrics, times(2)).recordError("token", OAuth2ErrorCode.INVALID_CLIENT);
        }

        @Test
        @DisplayName("should accept a public client by ID alone")
        void shouldAcceptPublicClient() {
            final var response =
                    engine.token(password(new ClientCredentials("public1", null), "user1", "bar", null));

            assertEquals(200, response.status());
        }

        @Test
        @DisplayName("should reject missing and unknown grant types")
        void shouldRejectGrantTypes() {
            final var missing = new TokenRequest(null, null, CLIENT1, null, null, null, null, null);
            final var unknown = new TokenRequest("urn:example:magic", null, CLIENT1, null, null, null, null, null);

            assertError(engine.token(missing), OAuth2ErrorCode.INVALID_REQUEST);
            assertError(engine.token(unknown), OAuth2ErrorCode.UNSUPPORTED_GRANT_TYPE);
        }

        @Test
        @DisplayName("should report unexpected failures as server_error without details")
        void shouldHideUnexpectedFailures() {
            final var broken = new EngineFixture(true, clientId -> {
                throw new IllegalStateException("directory offline");
            });

            final var response = broken.engine.token(password(CLIENT1, "user1", "bar", null));

            assertError(response, OAuth2ErrorCode.SERVER_ERROR);
            assertEquals(Map.of("error", "server_error"), json(response).body());
        }
    }

    @Nested
    @DisplayName("client credentials grant")
    class ClientCredentialsGrantTests {

        @Test
        @DisplayName("should issue a token without a resource owner")
        void shouldIssueClientToken() {
            final var response = engine.token(
                    new TokenRequest("client_credentials", Scope.parse("bar"), CLIENT1, null, null, null, null, null));

            assertEquals(200, response.status());
            final var credential = fixture.validator.authorize(field(response, "access_token"), Scope.parse("bar"));
            assertTrue(credential.resourceOwner().isEmpty());
        }

        @Test
        @DisplayName("should refuse public clients")
        void shouldRefusePublicClients() {
            final var response = engine.token(new TokenRequest(
                    "client_credentials", null, new ClientCredentials("public1", null), null, null, null, null, null));

            assertError(response, OAuth2ErrorCode.INVALID_CLIENT);
        }
    }

    @Nested
    @DisplayName("authorization endpoint")
    class AuthorizationEndpointTests {

        @Test
        @DisplayName("should answer a GET with a notice")
        void shouldAnswerGetWithNotice() {
            final var request = new AuthorizationRequest(
                    false, "token", "client1", CLIENT1_REDIRECT, Scope.empty(), "foobar", null, null);

            final var response = engine.authorize(request);

            final var text = assertInstanceOf(EndpointResponse.Text.class, response);
            assertEquals(200, text.status());
            assertEquals(GrantEngine.AUTHORIZATION_NOTICE, text.body());
        }

        @Test
        @DisplayName("should deliver an implicit token in the fragment")
        void shouldDeliverImplicitToken() {
            final var response = engine.authorize(submit("token", "foo", "bar"));

            final var location = location(response);
            assertTrue(location.startsWith(CLIENT1_REDIRECT + "#"), location);
            final var params = fragment(location);
            assertEquals("bearer", params.get("token_type"));
            assertEquals("3600", params.get("expires_in"));
            assertEquals("foobar", params.get("state"));
            assertEquals("foo", params.get("scope"));
            assertFalse(params.containsKey("refresh_token"));
            assertNotNull(fixture.validator.authorize(params.get("access_token"), Scope.parse("foo")));
            verify(fixture.metrics).recordIssued("implicit");
        }

        @Test
        @DisplayName("should redirect invalid_scope through the fragment for implicit requests")
        void shouldRedirectImplicitScopeError() {
            final var response = engine.authorize(submit("token", "baz", "bar"));

            assertEquals(CLIENT1_REDIRECT + "#error=invalid_scope&state=foobar", location(response));
        }

        @Test
        @DisplayName("should redirect access_denied through the query for code requests")
        void shouldRedirectCodeOwnerError() {
            final var response = engine.authorize(submit("code", "foo", "wrong"));

            assertEquals(CLIENT1_REDIRECT + "?error=access_denied&state=foobar", location(response));
        }

        @Test
        @DisplayName("should answer directly until the redirect URI is validated")
        void shouldAnswerDirectlyBeforeRedirectValidation() {
            final var unknownType = new AuthorizationRequest(
                    true, "id_token", "client1", CLIENT1_REDIRECT, Scope.empty(), "s", "user1", "bar");
            final var unknownClient = new AuthorizationRequest(
                    true, "token", "nobody", CLIENT1_REDIRECT, Scope.empty(), "s", "user1", "bar");
            final var wrongRedirect = new AuthorizationRequest(
                    true, "token", "client1", CLIENT2_REDIRECT, Scope.empty(), "s", "user1", "bar");

            assertError(engine.authorize(unknownType), OAuth2ErrorCode.UNSUPPORTED_RESPONSE_TYPE);
            assertError(engine.authorize(unknownClient), OAuth2ErrorCode.INVALID_CLIENT);
            assertError(engine.authorize(wrongRedirect), OAuth2ErrorCode.INVALID_REQUEST);
        }

        @Test
        @DisplayName("should deliver a code and state in the query")
        void shouldDeliverCode() {
            final var params = query(location(engine.authorize(submit("code", "foo bar", "bar"))));

            assertNotNull(params.get("code"));
            assertEquals("foobar", params.get("state"));
            assertEquals(1, fixture.store.count(TokenType.AUTHORIZATION_CODE));
        }
    }

    @Nested
    @DisplayName("authorization code grant")
    class AuthorizationCodeGrantTests {

        @Test
        @DisplayName("should exchange a code once")
        void shouldExchangeCode() {
            final var code = issueCode("foo");

            final var response = engine.token(codeExchange(CLIENT1, code, CLIENT1_REDIRECT, null));

            assertEquals(200, response.status());
            assertEquals("foo", field(response, "scope"));
            assertNotNull(field(response, "refresh_token"));
            final var credential = fixture.validator.authorize(field(response, "access_token"), Scope.parse("foo"));
            assertEquals("user1", credential.resourceOwnerId());
        }

        @Test
        @DisplayName("should revoke every token from a replayed code")
        void shouldRevokeOnReplay() {
            final var code = issueCode("foo");
            final var first = engine.token(codeExchange(CLIENT1, code, CLIENT1_REDIRECT, null));
            final var accessToken = field(first, "access_token");
            final var refreshed = engine.token(refresh(CLIENT1, field(first, "refresh_token"), null));

            final var replay = engine.token(codeExchange(CLIENT1, code, CLIENT1_REDIRECT, null));

            assertError(replay, OAuth2ErrorCode.INVALID_GRANT);
            final var error = assertThrows(
                    BearerError.class, () -> fixture.validator.authorize(accessToken, Scope.empty()));
            assertEquals(BearerErrorCode.INVALID_TOKEN, error.code());
            assertThrows(
                    BearerError.class,
                    () -> fixture.validator.authorize(field(refreshed, "access_token"), Scope.empty()));
            assertEquals(0, fixture.store.count(TokenType.REFRESH_TOKEN));
            verify(fixture.metrics).recordCodeReplay();
        }

        @Test
        @DisplayName("should bind the code to its client and redirect URI")
        void shouldBindCode() {
            final var code = issueCode("foo");

            assertError(
                    engine.token(codeExchange(CLIENT2, code, CLIENT1_REDIRECT, null)), OAuth2ErrorCode.INVALID_GRANT);
            assertError(engine.token(codeExchange(CLIENT1, code, CLIENT2_REDIRECT, null)),
                    OAuth2ErrorCode.INVALID_GRANT);
            assertError(engine.token(codeExchange(CLIENT1, code, null, null)), OAuth2ErrorCode.INVALID_GRANT);
            assertEquals(200, engine.token(codeExchange(CLIENT1, code, CLIENT1_REDIRECT, null)).status());
        }

        @Test
        @DisplayName("should reject an expired code")
        void shouldRejectExpiredCode() {
            final var code = issueCode("foo");
            fixture.clock.advance(EngineFixture.CODE_LIFESPAN);

            assertError(
                    engine.token(codeExchange(CLIENT1, code, CLIENT1_REDIRECT, null)), OAuth2ErrorCode.INVALID_GRANT);
        }

        @Test
        @DisplayName("should only narrow the authorized scope")
        void shouldOnlyNarrowScope() {
            final var code = issueCode("foo bar");

            assertError(engine.token(codeExchange(CLIENT1, code, CLIENT1_REDIRECT, "foo baz")),
                    OAuth2ErrorCode.INVALID_SCOPE);
            final var narrowed = engine.token(codeExchange(CLIENT1, code, CLIENT1_REDIRECT, "bar"));
            assertEquals("bar", field(narrowed, "scope"));
        }

        @Test
        @DisplayName("should treat missing and malformed codes as invalid requests")
        void shouldRejectMalformedCodes() {
            assertError(engine.token(codeExchange(CLIENT1, null, CLIENT1_REDIRECT, null)),
                    OAuth2ErrorCode.INVALID_REQUEST);
            assertError(engine.token(codeExchange(CLIENT1, "garbage", CLIENT1_REDIRECT, null)),
                    OAuth2ErrorCode.INVALID_REQUEST);
            final var foreign = fixture.codec.generate().encode();
            assertError(engine.token(codeExchange(CLIENT1, foreign, CLIENT1_REDIRECT, null)),
                    OAuth2ErrorCode.INVALID_GRANT);
        }

        @Test
        @DisplayName("should let exactly one of many concurrent exchanges succeed")
        void shouldRedeemOnceUnderConcurrency() throws Exception {
            final var code = issueCode("foo");
            final var threads = 8;
            final var executor = Executors.newFixedThreadPool(threads);
            final var start = new CountDownLatch(1);
            final var futures = new ArrayList<Future<EndpointResponse>>();

            final List<EndpointResponse> responses = new ArrayList<>();
            try {
                for (int i = 0; i < threads; i++) {
                    futures.add(executor.submit(() -> {
                        start.await();
                        return engine.token(codeExchange(CLIENT1, code, CLIENT1_REDIRECT, null));
                    }));
                }
                start.countDown();
                for (final var future : futures) {
                    responses.add(future.get(10, TimeUnit.SECONDS));
                }
            } finally {
                executor.shutdownNow();
            }

            assertEquals(1, responses.stream().filter(r -> r.status() == 200).count());
        }

        @Test
        @DisplayName("should exchange a code for a client with its own scope restriction")
        void shouldExchangeCodeForRestrictedClient() {
            final var narrowCode = query(location(engine.authorize(new AuthorizationRequest(
                            true, "code", "narrow", NARROW_REDIRECT, Scope.parse("foo"), null, "user1", "bar"))))
                    .get("code");

            final var response = engine.token(
                    codeExchange(new ClientCredentials("narrow", "narrow"), narrowCode, NARROW_REDIRECT, null));

            assertEquals(200, response.status());
        }
    }

    @Nested
    @DisplayName("refresh token grant")
    class RefreshTokenGrantTests {

        private String refreshToken;

        @BeforeEach
        void issue() {
            refreshToken = field(engine.token(password(CLIENT1, "user1", "bar", "foo bar")), "refresh_token");
        }

        @Test
        @DisplayName("should rotate the refresh token and inherit the scope")
        void shouldRotate() {
            final var response = engine.token(refresh(CLIENT1, refreshToken, null));

            assertEquals(200, response.status());
            assertEquals("foo bar", field(response, "scope"));
            assertError(engine.token(refresh(CLIENT1, refreshToken, null)), OAuth2ErrorCode.INVALID_GRANT);
            assertNotNull(fixture.validator.authorize(field(response, "access_token"), Scope.parse("foo bar")));
        }

        @Test
        @DisplayName("should narrow the scope on request")
        void shouldNarrowScope() {
            final var response = engine.token(refresh(CLIENT1, refreshToken, "foo"));

            assertEquals("foo", field(response, "scope"));
        }

        @Test
        @DisplayName("should leave the refresh token usable after a scope error")
        void shouldNotConsumeOnScopeError() {
            assertError(engine.token(refresh(CLIENT1, refreshToken, "foo baz")), OAuth2ErrorCode.INVALID_SCOPE);
            assertEquals(200, engine.token(refresh(CLIENT1, refreshToken, null)).status());
        }

        @Test
        @DisplayName("should reject tokens of other clients and expired tokens")
        void shouldRejectForeignAndExpired() {
            assertError(engine.token(refresh(CLIENT2, refreshToken, null)), OAuth2ErrorCode.INVALID_GRANT);

            fixture.clock.advance(EngineFixture.REFRESH_LIFESPAN.plus(Duration.ofSeconds(1)));
            assertError(engine.token(refresh(CLIENT1, refreshToken, null)), OAuth2ErrorCode.INVALID_GRANT);
        }

        @Test
        @DisplayName("should treat a malformed refresh token as an invalid request")
        void shouldRejectMalformed() {
            assertError(engine.token(refresh(CLIENT1, "not-a-token", null)), OAuth2ErrorCode.INVALID_REQUEST);
            assertError(engine.token(refresh(CLIENT1, null, null)), OAuth2ErrorCode.INVALID_REQUEST);
        }
    }

    @Nested
    @DisplayName("credential lifespans")
    class LifespanTests {

        private Instant issuedAt;

        @BeforeEach
        void advanceClock() {
            fixture.clock.advance(Duration.ofMinutes(7));
            issuedAt = fixture.clock.instant();
        }

        private Instant storedExpiry(TokenType type, String token) {
            return fixture.store.get(type, fixture.codec.signatureOf(token)).orElseThrow().expiresAt();
        }

        @Test
        @DisplayName("should expire access and refresh tokens exactly one lifespan after issuance")
        void shouldStoreTokenExpiry() {
            final var response = engine.token(password(CLIENT1, "user1", "bar", "foo"));

            assertEquals(
                    issuedAt.plus(EngineFixture.ACCESS_LIFESPAN),
                    storedExpiry(TokenType.ACCESS_TOKEN, field(response, "access_token")));
            assertEquals(
                    issuedAt.plus(EngineFixture.REFRESH_LIFESPAN),
                    storedExpiry(TokenType.REFRESH_TOKEN, field(response, "refresh_token")));
            assertEquals(EngineFixture.ACCESS_LIFESPAN.toSeconds(), json(response).body().get("expires_in"));
        }

        @Test
        @DisplayName("should expire authorization codes one code lifespan after issuance")
        void shouldStoreCodeExpiry() {
            final var code = issueCode("foo");

            assertEquals(
                    issuedAt.plus(EngineFixture.CODE_LIFESPAN),
                    storedExpiry(TokenType.AUTHORIZATION_CODE, code));
        }

        @Test
        @DisplayName("should restart the lifespan for tokens minted by a refresh")
        void shouldRestartLifespanOnRefresh() {
            final var first = engine.token(password(CLIENT1, "user1", "bar", "foo"));
            fixture.clock.advance(Duration.ofMinutes(30));

            final var rotated = engine.token(refresh(CLIENT1, field(first, "refresh_token"), null));

            final var refreshedAt = fixture.clock.instant();
            assertEquals(
                    refreshedAt.plus(EngineFixture.ACCESS_LIFESPAN),
                    storedExpiry(TokenType.ACCESS_TOKEN, field(rotated, "access_token")));
            assertEquals(
                    refreshedAt.plus(EngineFixture.REFRESH_LIFESPAN),
                    storedExpiry(TokenType.REFRESH_TOKEN, field(rotated, "refresh_token")));
        }
    }

    @Test
    @DisplayName("should count protocol errors per endpoint")
    void shouldCountErrors() {
        engine.token(password(CLIENT1, "user1", "bar", "baz"));

        verify(fixture.metrics).recordError(eq("token"), eq(OAuth2ErrorCode.INVALID_SCOPE));
    }
}
