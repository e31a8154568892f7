package com.pushhub.notification.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.pushhub.notification.exception.ProviderSendException;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.*;

import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.Signature;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.Base64;

import static org.assertj.core.api.Assertions.*;

class ServiceAccountTokenSourceTest {

    private static final Instant NOW = Instant.parse("2026-10-19T08:00:00Z");

    private final ObjectMapper mapper = new ObjectMapper();
    private final OkHttpClient http   = new OkHttpClient();
    private final MovableClock clock  = new MovableClock(NOW);

    private MockWebServer             server;
    private String                    tokenUri;
    private ServiceAccountTokenSource source;

    @BeforeEach
    void setup() throws Exception {
        server = new MockWebServer();
        server.start();
        tokenUri = server.url("/token").toString();
        source   = new ServiceAccountTokenSource(ServiceAccountKeys.CLIENT_EMAIL, ServiceAccountKeys.pem(),
                tokenUri, http, clock);
    }

    @AfterEach
    void teardown() throws Exception {
        server.shutdown();
    }

    @Test
    void accessToken_exchangesSignedAssertion_forBearerToken() throws Exception {
        server.enqueue(tokenResponse("ya29.first", 3600));

        assertThat(source.accessToken()).isEqualTo("ya29.first");

        final RecordedRequest request = server.takeRequest();
        assertThat(request.getMethod()).isEqualTo("POST");
        assertThat(request.getPath()).isEqualTo("/token");

        final HttpUrl form = HttpUrl.get("http://form/?" + request.getBody().readUtf8());
        assertThat(form.queryParameter("grant_type")).isEqualTo(ServiceAccountTokenSource.GRANT_TYPE);

        final String[] jwt = form.queryParameter("assertion").split("\\.");
        assertThat(jwt).hasSize(3);

        final JsonNode header = decode(jwt[0]);
        assertThat(header.path("alg").asText()).isEqualTo("RS256");

        final JsonNode claims = decode(jwt[1]);
        assertThat(claims.path("iss").asText()).isEqualTo(ServiceAccountKeys.CLIENT_EMAIL);
        assertThat(claims.path("aud").asText()).isEqualTo(tokenUri);
        assertThat(claims.path("scope").asText()).isEqualTo(ServiceAccountTokenSource.SCOPE);
        assertThat(claims.path("iat").asLong()).isEqualTo(NOW.getEpochSecond());
        assertThat(claims.path("exp").asLong()).isEqualTo(NOW.getEpochSecond() + 3600);

        final Signature rsa = Signature.getInstance("SHA256withRSA");
        rsa.initVerify(ServiceAccountKeys.KEYS.getPublic());
        rsa.update((jwt[0] + "." + jwt[1]).getBytes(StandardCharsets.US_ASCII));
        assertThat(rsa.verify(Base64.getUrlDecoder().decode(jwt[2]))).isTrue();
    }

    @Test
    void accessToken_isCached_untilCloseToExpiry() {
        server.enqueue(tokenResponse("ya29.first", 3600));
        server.enqueue(tokenResponse("ya29.second", 3600));

        assertThat(source.accessToken()).isEqualTo("ya29.first");
        clock.advance(Duration.ofMinutes(50));
        assertThat(source.accessToken()).isEqualTo("ya29.first");
        assertThat(server.getRequestCount()).isEqualTo(1);

        clock.advance(Duration.ofMinutes(6));   // inside the 5 minute refresh margin
        assertThat(source.accessToken()).isEqualTo("ya29.second");
        assertThat(server.getRequestCount()).isEqualTo(2);
    }

    @Test
    void invalidate_forcesNewToken() {
        server.enqueue(tokenResponse("ya29.first", 3600));
        server.enqueue(tokenResponse("ya29.second", 3600));

        source.accessToken();
        source.invalidate();

        assertThat(source.accessToken()).isEqualTo("ya29.second");
    }

    @Test
    void accessToken_throws_whenGrantRejected() {
        server.enqueue(new MockResponse().setResponseCode(400)
                .setBody("{\"error\":\"invalid_grant\",\"error_description\":\"Invalid JWT Signature.\"}"));

        assertThatThrownBy(() -> source.accessToken())
                .isInstanceOfSatisfying(ProviderSendException.class, e -> {
                    assertThat(e.getProviderName()).isEqualTo("Firebase");
                    assertThat(e.getHttpStatusCode()).isEqualTo(400);
                })
                .hasMessage("Firebase token request failed: HTTP 400: Invalid JWT Signature.");
    }

    @Test
    void parsePrivateKey_acceptsEscapedNewlines() throws Exception {
        assertThat(ServiceAccountTokenSource.parsePrivateKey(ServiceAccountKeys.escapedPem()))
                .isEqualTo(ServiceAccountKeys.KEYS.getPrivate());
    }

    @Test
    void parsePrivateKey_rejectsGarbage() {
        assertThatThrownBy(() -> ServiceAccountTokenSource.parsePrivateKey("not a key"))
                .isInstanceOf(GeneralSecurityException.class);
        assertThatThrownBy(() -> ServiceAccountTokenSource.parsePrivateKey(""))
                .isInstanceOf(GeneralSecurityException.class);
    }

    // ── Helpers ───────────────────────────────────────────────────────────────

    private static MockResponse tokenResponse(final String token, final int expiresIn) {
        return new MockResponse().setResponseCode(200).setBody(
                "{\"access_token\":\"" + token + "\",\"expires_in\":" + expiresIn + ",\"token_type\":\"Bearer\"}");
    }

    private JsonNode decode(final String part) throws Exception {
        return mapper.readTree(Base64.getUrlDecoder().decode(part));
    }

    private static final class MovableClock extends Clock {
        private Instant now;

        MovableClock(final Instant start) { this.now = start; }

        void advance(final Duration d) { now = now.plus(d); }

        @Override public ZoneId  getZone()                     { return ZoneOffset.UTC; }
        @Override public Clock   withZone(final ZoneId zone)   { return this; }
        @Override public Instant instant()                     { return now; }
    }
}
