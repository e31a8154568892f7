package com.pushhub.notification.health;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.pushhub.notification.dispatch.NotificationDispatcher;
import com.pushhub.notification.model.Notification;
import com.pushhub.notification.provider.NotificationProvider;
import com.pushhub.notification.scheduler.NotificationScheduler;
import com.pushhub.notification.scheduler.ScheduleSpec;
import com.pushhub.notification.scheduler.TriggerCalculator;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import org.junit.jupiter.api.*;

import java.time.Clock;
import java.util.List;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.Mockito.*;

class HealthServerTest {

    private final OkHttpClient http   = new OkHttpClient();
    private final ObjectMapper mapper = new ObjectMapper();

    private NotificationDispatcher dispatcher;
    private NotificationScheduler  scheduler;
    private HealthServer           server;

    @BeforeEach
    void setup() throws Exception {
        final NotificationProvider firebase = mock(NotificationProvider.class);
        when(firebase.name()).thenReturn("Firebase");
        when(firebase.priority()).thenReturn(1);
        when(firebase.isEnabled()).thenReturn(true);

        dispatcher = new NotificationDispatcher(List.of(firebase));
        scheduler  = new NotificationScheduler(Executors.newSingleThreadScheduledExecutor(),
                new TriggerCalculator(), Clock.systemUTC());
        server     = new HealthServer(0, dispatcher, scheduler);
        server.start();
    }

    @AfterEach
    void teardown() {
        server.stop();
        scheduler.close();
        dispatcher.close();
    }

    @Test
    void health_reportsDown_untilMarkedReady() throws Exception {
        assertThat(status("/health")).isEqualTo(503);

        server.markReady();

        try (Response response = get("/health")) {
            assertThat(response.code()).isEqualTo(200);
            assertThat(response.body().string()).contains("UP");
        }
    }

    @Test
    void live_isAlwaysUp() throws Exception {
        try (Response response = get("/health/live")) {
            assertThat(response.code()).isEqualTo(200);
        }
    }

    @Test
    void ready_requiresRunningScheduler() throws Exception {
        server.markReady();
        assertThat(status("/health/ready")).isEqualTo(503);

        scheduler.start();
        assertThat(status("/health/ready")).isEqualTo(200);
    }

    @Test
    void providers_listsStatusInPriorityOrder() throws Exception {
        try (Response response = get("/providers")) {
            final JsonNode body = mapper.readTree(response.body().string());

            assertThat(response.code()).isEqualTo(200);
            assertThat(body).hasSize(1);
            assertThat(body.get(0).path("name").asText()).isEqualTo("Firebase");
            assertThat(body.get(0).path("enabled").asBoolean()).isTrue();
            assertThat(body.get(0).path("priority").asInt()).isEqualTo(1);
        }
    }

    @Test
    void jobs_listsScheduledJobs() throws Exception {
        scheduler.start();
        final var result = scheduler.schedule(Notification.builder("Digest", "Your weekly digest").topic("news").build(),
                ScheduleSpec.daily("06:00", "Europe/London"), dispatcher);

        try (Response response = get("/jobs")) {
            final JsonNode body = mapper.readTree(response.body().string());

            assertThat(body).hasSize(1);
            assertThat(body.get(0).path("id").asText()).isEqualTo(result.getJobId());
            assertThat(body.get(0).path("title").asText()).isEqualTo("Digest");
            assertThat(body.get(0).path("schedule").path("timezone").asText()).isEqualTo("Europe/London");
            assertThat(body.get(0).path("nextTrigger").isTextual()).isTrue();
        }
    }

    private int status(final String path) throws Exception {
        try (Response response = get(path)) {
            return response.code();
        }
    }

    private Response get(final String path) throws Exception {
        return http.newCall(new Request.Builder()
                .url("http://localhost:" + server.getPort() + path)
                .build()).execute();
    }
}
