package com.pushhub.notification.health;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.pushhub.notification.dispatch.NotificationDispatcher;
import com.pushhub.notification.scheduler.NotificationScheduler;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Lightweight HTTP health and introspection server.
 *
 * <p>Endpoints:
 * <ul>
 *   <li>{@code GET /health}: 200 while the hub is running, 503 during shutdown.</li>
 *   <li>{@code GET /health/live}: liveness check (always 200 if the JVM is alive).</li>
 *   <li>{@code GET /health/ready}: readiness check (200 when marked ready and the
 *       scheduler is running).</li>
 *   <li>{@code GET /providers}: provider name, enabled flag and priority, in failover order.</li>
 *   <li>{@code GET /jobs}: snapshots of the registered scheduled jobs.</li>
 * </ul>
 * Everything here is read-only; provider toggles and job cancellation stay
 * with the host layer.
 */
public class HealthServer {

    private static final Logger LOG = LoggerFactory.getLogger(HealthServer.class);

    private final HttpServer             server;
    private final NotificationDispatcher dispatcher;
    private final NotificationScheduler  scheduler;
    private final AtomicBoolean          ready = new AtomicBoolean(false);
    private final ObjectMapper           mapper = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    public HealthServer(
            final int port,
            final NotificationDispatcher dispatcher,
            final NotificationScheduler scheduler) throws IOException {
        this.dispatcher = dispatcher;
        this.scheduler  = scheduler;

        server = HttpServer.create(new InetSocketAddress(port), 0);
        server.setExecutor(Executors.newSingleThreadExecutor(r -> {
            final Thread t = new Thread(r, "health-server");
            t.setDaemon(true);
            return t;
        }));

        server.createContext("/health",       this::handleHealth);
        server.createContext("/health/live",  this::handleLive);
        server.createContext("/health/ready", this::handleReady);
        server.createContext("/providers",    this::handleProviders);
        server.createContext("/jobs",         this::handleJobs);
    }

    public void start() {
        server.start();
        LOG.info("Health server started on port {}", getPort());
    }

    public int getPort() {
        return server.getAddress().getPort();
    }

    /** Mark the hub as ready to receive traffic. */
    public void markReady() {
        ready.set(true);
        LOG.info("Hub marked as ready");
    }

    /** Mark the hub as not ready (e.g. during shutdown). */
    public void markNotReady() {
        ready.set(false);
    }

    public void stop() {
        markNotReady();
        server.stop(1);
        LOG.info("Health server stopped");
    }

    private void handleHealth(final HttpExchange exchange) throws IOException {
        respond(exchange, ready.get() ? 200 : 503,
                ready.get() ? "{\"status\":\"UP\"}" : "{\"status\":\"DOWN\"}");
    }

    private void handleLive(final HttpExchange exchange) throws IOException {
        respond(exchange, 200, "{\"status\":\"ALIVE\"}");
    }

    private void handleReady(final HttpExchange exchange) throws IOException {
        final boolean isReady = ready.get() && scheduler.isRunning();
        respond(exchange, isReady ? 200 : 503,
                isReady ? "{\"status\":\"READY\"}" : "{\"status\":\"NOT_READY\"}");
    }

    private void handleProviders(final HttpExchange exchange) throws IOException {
        respond(exchange, 200, mapper.writeValueAsString(dispatcher.listProviders()));
    }

    private void handleJobs(final HttpExchange exchange) throws IOException {
        respond(exchange, 200, mapper.writeValueAsString(scheduler.listActive()));
    }

    private void respond(final HttpExchange exchange,
                         final int statusCode,
                         final String body) throws IOException {
        final byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().set("Content-Type", "application/json");
        exchange.sendResponseHeaders(statusCode, bytes.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(bytes);
        }
    }
}
