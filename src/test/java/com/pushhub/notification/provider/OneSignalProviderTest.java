package com.pushhub.notification.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.pushhub.notification.exception.ProviderSendException;
import com.pushhub.notification.exception.ValidationException;
import com.pushhub.notification.model.DeliveryReceipt;
import com.pushhub.notification.model.Notification;
import com.pushhub.notification.retry.RetryExecutor;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.*;

import java.util.Collections;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

class OneSignalProviderTest {

    private final ObjectMapper mapper = new ObjectMapper();

    private MockWebServer     server;
    private OneSignalProvider provider;

    @BeforeEach
    void setup() throws Exception {
        server = new MockWebServer();
        server.start();
        provider = new OneSignalProvider(2, true, new RetryExecutor(1, 0L, ms -> { }),
                "app-123", "rest-key", server.url("/api/v1").toString());
    }

    @AfterEach
    void teardown() throws Exception {
        provider.close();
        server.shutdown();
    }

    @Test
    void send_targetsPlayerIds_andReturnsRecipients() throws Exception {
        server.enqueue(new MockResponse().setResponseCode(200)
                .setBody("{\"id\":\"os-notif-1\",\"recipients\":2}"));

        final DeliveryReceipt receipt = provider.send(Notification.builder("Hello", "World")
                .playerIds(List.of("p1", "p2"))
                .segments(List.of("Subscribed Users"))
                .image("https://cdn.example.com/pic.png")
                .sendAt("2026-10-20 09:00:00 GMT+0000")
                .build());

        assertThat(receipt.getProviderMessageId()).isEqualTo("os-notif-1");
        assertThat(receipt.getDetails()).containsEntry("recipients", 2);

        final RecordedRequest request = server.takeRequest();
        assertThat(request.getPath()).isEqualTo("/api/v1/notifications");
        assertThat(request.getHeader("Authorization")).isEqualTo("Basic rest-key");

        final JsonNode body = mapper.readTree(request.getBody().readUtf8());
        assertThat(body.path("app_id").asText()).isEqualTo("app-123");
        assertThat(body.path("headings").path("en").asText()).isEqualTo("Hello");
        assertThat(body.path("contents").path("en").asText()).isEqualTo("World");
        assertThat(body.path("include_player_ids")).hasSize(2);
        assertThat(body.has("included_segments")).isFalse();   // player ids win over segments
        assertThat(body.path("big_picture").asText()).isEqualTo("https://cdn.example.com/pic.png");
        assertThat(body.path("send_after").asText()).isEqualTo("2026-10-20 09:00:00 GMT+0000");
    }

    @Test
    void send_defaultsToAllSegment_withoutTargeting() throws Exception {
        server.enqueue(new MockResponse().setResponseCode(200).setBody("{\"id\":\"os-2\",\"recipients\":10}"));

        provider.send(Notification.builder("Hello", "World").build());

        final JsonNode body = mapper.readTree(server.takeRequest().getBody().readUtf8());
        assertThat(body.path("included_segments").get(0).asText()).isEqualTo("All");
        assertThat(body.has("include_player_ids")).isFalse();
    }

    @Test
    void send_throws_whenResponseHasNoId() {
        server.enqueue(new MockResponse().setResponseCode(200)
                .setBody("{\"id\":\"\",\"errors\":[\"All included players are not subscribed\"]}"));

        assertThatThrownBy(() -> provider.send(Notification.builder("Hello", "World").build()))
                .isInstanceOf(ProviderSendException.class)
                .hasMessage("OneSignal send failed: All included players are not subscribed");
    }

    @Test
    void send_throwsWithStatus_onHttpError() {
        server.enqueue(new MockResponse().setResponseCode(400).setBody("{\"errors\":[\"app_id not found\"]}"));

        assertThatThrownBy(() -> provider.send(Notification.builder("Hello", "World").build()))
                .isInstanceOfSatisfying(ProviderSendException.class,
                        e -> assertThat(e.getHttpStatusCode()).isEqualTo(400))
                .hasMessageContaining("app_id not found");
    }

    @Test
    void canHandle_acceptsEveryNotification() {
        assertThat(provider.canHandle(Notification.builder("a", "b").build())).isTrue();
    }

    @Test
    void validate_rejectsTooManyPlayerIds() {
        final var ids = Collections.nCopies(Notification.MAX_PLAYER_IDS + 1, "p");

        assertThatThrownBy(() -> provider.validate(Notification.builder("a", "b").playerIds(ids).build()))
                .isInstanceOf(ValidationException.class);
    }

    @Test
    void isConfigured_returnsFalse_whenRestKeyBlank() {
        final var unconfigured = new OneSignalProvider(2, true, new RetryExecutor(1, 0L, ms -> { }), "app", " ");
        assertThat(unconfigured.isConfigured()).isFalse();
        unconfigured.close();
    }
}
