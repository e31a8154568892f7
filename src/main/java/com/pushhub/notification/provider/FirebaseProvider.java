package com.pushhub.notification.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.pushhub.notification.exception.ProviderSendException;
import com.pushhub.notification.exception.ValidationException;
import com.pushhub.notification.model.DeliveryReceipt;
import com.pushhub.notification.model.Notification;
import com.pushhub.notification.retry.RetryExecutor;
import okhttp3.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.security.GeneralSecurityException;
import java.time.Clock;
import java.util.Map;

/**
 * Push provider backed by the Firebase Cloud Messaging HTTP v1 API.
 *
 * <p>Targets a single device {@code token}, a {@code topic}, or a list of
 * {@code tokens}. FCM v1 has no multicast endpoint, so a token list is sent
 * one request per token; the send succeeds when at least one token is
 * accepted and the receipt id reads {@code "successCount/failureCount"}.
 *
 * <h2>Required credentials</h2>
 * <ul>
 *   <li>{@code FIREBASE_PROJECT_ID}</li>
 *   <li>{@code FIREBASE_CLIENT_EMAIL}</li>
 *   <li>{@code FIREBASE_PRIVATE_KEY}: the service account's PKCS#8 PEM key</li>
 *   <li>{@code FIREBASE_TOKEN_URI} (optional)</li>
 * </ul>
 * Access tokens are minted and refreshed by {@link ServiceAccountTokenSource}.
 *
 * <p>API reference:
 * <a href="https://firebase.google.com/docs/reference/fcm/rest/v1/projects.messages/send">
 * FCM projects.messages.send</a>
 */
public class FirebaseProvider extends AbstractNotificationProvider {

    private static final Logger LOG = LoggerFactory.getLogger(FirebaseProvider.class);
    public  static final String NAME = "Firebase";
    public  static final String DEFAULT_ENDPOINT = "https://fcm.googleapis.com";

    private final String                    projectId;
    private final String                    endpoint;
    private final ServiceAccountTokenSource credentials;  // null when the credentials are unusable
    private final boolean                   initialized;
    private final OkHttpClient              http;
    private final ObjectMapper              mapper = new ObjectMapper();

    public FirebaseProvider(
            final int priority,
            final boolean enabled,
            final RetryExecutor retry,
            final String projectId,
            final String clientEmail,
            final String privateKey) {
        this(priority, enabled, retry, projectId, clientEmail, privateKey,
                ServiceAccountTokenSource.DEFAULT_TOKEN_URI, DEFAULT_ENDPOINT, Clock.systemUTC());
    }

    public FirebaseProvider(
            final int priority,
            final boolean enabled,
            final RetryExecutor retry,
            final String projectId,
            final String clientEmail,
            final String privateKey,
            final String tokenUri,
            final String endpoint,
            final Clock clock) {
        super(NAME, priority, enabled, retry);
        this.projectId   = projectId;
        this.endpoint    = stripTrailingSlash(endpoint);
        this.http        = buildHttpClient();
        this.credentials = present(clientEmail) && present(privateKey)
                ? tokenSource(clientEmail, privateKey, tokenUri, http, clock)
                : null;
        this.initialized = present(projectId) && credentials != null;

        if (!initialized) {
            LOG.error("Firebase configuration is incomplete: hasProjectId={} hasClientEmail={} hasPrivateKey={}",
                    present(projectId), present(clientEmail), present(privateKey));
        } else {
            LOG.info("Firebase provider initialized: projectId={} clientEmail={}", projectId, clientEmail);
        }
    }

    private static ServiceAccountTokenSource tokenSource(
            final String clientEmail,
            final String privateKey,
            final String tokenUri,
            final OkHttpClient http,
            final Clock clock) {
        try {
            return new ServiceAccountTokenSource(clientEmail, privateKey, tokenUri, http, clock);
        } catch (GeneralSecurityException e) {
            LOG.error("Firebase private key could not be loaded: {}", e.getMessage());
            return null;
        }
    }

    @Override
    public boolean isConfigured() {
        return initialized;
    }

    @Override
    public boolean canHandle(final Notification notification) {
        return notification.hasToken() || notification.hasTokens() || notification.hasTopic();
    }

    @Override
    public void validate(final Notification notification) {
        super.validate(notification);
        if (notification.getTokens().size() > Notification.MAX_TOKENS) {
            throw new ValidationException("Firebase accepts at most " + Notification.MAX_TOKENS
                    + " tokens per notification, got " + notification.getTokens().size());
        }
    }

    @Override
    public DeliveryReceipt send(final Notification notification) {
        if (!initialized) {
            throw new ProviderSendException(name(), "Firebase provider is not initialized");
        }
        if (!canHandle(notification)) {
            throw new ProviderSendException(name(), "Firebase requires token, tokens, or topic");
        }

        if (notification.hasTokens()) {
            return sendMulticast(notification);
        }
        final ObjectNode message = buildMessage(notification);
        if (notification.hasToken()) {
            message.put("token", notification.getToken());
        } else {
            message.put("topic", notification.getTopic());
        }

        final String messageName = post(message);
        LOG.info("Firebase notification sent: messageId={}", messageName);
        return new DeliveryReceipt(name(), messageName, 200);
    }

    private DeliveryReceipt sendMulticast(final Notification notification) {
        int    successCount = 0;
        int    failureCount = 0;
        String firstError   = null;

        for (final String token : notification.getTokens()) {
            final ObjectNode message = buildMessage(notification);
            message.put("token", token);
            try {
                post(message);
                successCount++;
            } catch (ProviderSendException e) {
                failureCount++;
                if (firstError == null) {
                    firstError = e.getMessage();
                }
            }
        }

        if (successCount == 0) {
            throw new ProviderSendException(name(),
                    "Firebase send failed for all " + failureCount + " tokens: " + firstError);
        }

        LOG.info("Firebase multicast sent: successCount={} failureCount={}", successCount, failureCount);
        return new DeliveryReceipt(name(), successCount + "/" + failureCount, 200,
                Map.of("successCount", successCount, "failureCount", failureCount));
    }

    private String post(final ObjectNode message) {
        final ObjectNode root = mapper.createObjectNode();
        root.set("message", message);

        final Request request = new Request.Builder()
                .url(endpoint + "/v1/projects/" + projectId + "/messages:send")
                .addHeader("Authorization", "Bearer " + credentials.accessToken())
                .post(RequestBody.create(serialize(root), JSON))
                .build();

        try (Response response = http.newCall(request).execute()) {
            final int    code     = response.code();
            final String respBody = response.body() != null ? response.body().string() : "";

            if (code == 200) {
                return extractMessageName(respBody);
            }
            if (code == 401) {
                // Revoked or expired early: the next attempt mints a fresh token
                credentials.invalidate();
            }
            LOG.warn("Firebase rejected message: http={} body={}", code, respBody);
            throw new ProviderSendException(name(),
                    "Firebase send failed: HTTP " + code + ": " + extractError(respBody), code);
        } catch (IOException e) {
            LOG.error("Firebase IO error: {}", e.getMessage());
            throw new ProviderSendException(name(), "Firebase send failed: " + e.getMessage(), e);
        }
    }

    private ObjectNode buildMessage(final Notification notification) {
        final ObjectNode message = mapper.createObjectNode();

        final ObjectNode content = message.putObject("notification");
        content.put("title", notification.getTitle());
        content.put("body",  notification.getBody());
        if (notification.hasImage()) {
            content.put("image", notification.getImage());
        }

        // FCM data values must be strings
        final ObjectNode data = message.putObject("data");
        notification.getData().forEach((key, value) -> data.put(key, String.valueOf(value)));

        if (!notification.getAndroid().isEmpty()) message.set("android", mapper.valueToTree(notification.getAndroid()));
        if (!notification.getApns().isEmpty())    message.set("apns",    mapper.valueToTree(notification.getApns()));
        if (!notification.getWebpush().isEmpty()) message.set("webpush", mapper.valueToTree(notification.getWebpush()));

        return message;
    }

    private String serialize(final ObjectNode root) {
        try {
            return mapper.writeValueAsString(root);
        } catch (Exception e) {
            throw new ProviderSendException(name(), "Failed to serialize Firebase payload", e);
        }
    }

    private String extractMessageName(final String body) {
        try {
            return mapper.readTree(body).path("name").asText("unknown");
        } catch (Exception e) { return "unknown"; }
    }

    private String extractError(final String body) {
        try {
            final JsonNode error = mapper.readTree(body).path("error");
            return error.isMissingNode() ? body : error.path("message").asText(body);
        } catch (Exception e) { return body; }
    }

    @Override
    public void close() {
        http.dispatcher().executorService().shutdown();
        http.connectionPool().evictAll();
    }
}
