package com.pushhub.notification.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
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
import java.util.List;
import java.util.Map;

/**
 * Push provider backed by the OneSignal REST API.
 *
 * <p>OneSignal can always take a notification: explicit {@code playerIds}
 * win, then {@code segments}, and with neither the message goes to the
 * {@code All} segment. An optional {@code sendAt} is forwarded as
 * {@code send_after} so OneSignal itself delays delivery.
 *
 * <h2>Required credentials</h2>
 * <ul>
 *   <li>{@code ONESIGNAL_APP_ID}</li>
 *   <li>{@code ONESIGNAL_REST_API_KEY}</li>
 * </ul>
 *
 * <p>API reference:
 * <a href="https://documentation.onesignal.com/reference/create-notification">
 * OneSignal Create notification</a>
 */
public class OneSignalProvider extends AbstractNotificationProvider {

    private static final Logger LOG = LoggerFactory.getLogger(OneSignalProvider.class);
    public  static final String NAME = "OneSignal";
    private static final String DEFAULT_ENDPOINT = "https://onesignal.com/api/v1";
    private static final String DEFAULT_SEGMENT  = "All";

    private final String       appId;
    private final String       restApiKey;
    private final String       endpoint;
    private final OkHttpClient http;
    private final ObjectMapper mapper = new ObjectMapper();

    public OneSignalProvider(
            final int priority,
            final boolean enabled,
            final RetryExecutor retry,
            final String appId,
            final String restApiKey) {
        this(priority, enabled, retry, appId, restApiKey, DEFAULT_ENDPOINT);
    }

    public OneSignalProvider(
            final int priority,
            final boolean enabled,
            final RetryExecutor retry,
            final String appId,
            final String restApiKey,
            final String endpoint) {
        super(NAME, priority, enabled, retry);
        this.appId      = appId;
        this.restApiKey = restApiKey;
        this.endpoint   = stripTrailingSlash(endpoint);
        this.http       = buildHttpClient();
    }

    @Override
    public boolean isConfigured() {
        return present(appId) && present(restApiKey);
    }

    @Override
    public void validate(final Notification notification) {
        super.validate(notification);
        if (notification.getPlayerIds().size() > Notification.MAX_PLAYER_IDS) {
            throw new ValidationException("OneSignal accepts at most " + Notification.MAX_PLAYER_IDS
                    + " player ids per notification, got " + notification.getPlayerIds().size());
        }
    }

    @Override
    public DeliveryReceipt send(final Notification notification) {
        if (!isConfigured()) {
            throw new ProviderSendException(name(), "OneSignal provider is not available");
        }

        final Request request = new Request.Builder()
                .url(endpoint + "/notifications")
                .addHeader("Authorization", "Basic " + restApiKey)
                .addHeader("Content-Type", "application/json")
                .post(RequestBody.create(buildPayload(notification), JSON))
                .build();

        try (Response response = http.newCall(request).execute()) {
            final int    code     = response.code();
            final String respBody = response.body() != null ? response.body().string() : "";
            final JsonNode json   = parse(respBody);
            final String id       = json.path("id").asText("");

            // OneSignal answers 200 with an "errors" array and no id when nobody was targeted
            if (code == 200 && !id.isEmpty()) {
                final int recipients = json.path("recipients").asInt(0);
                LOG.info("OneSignal notification sent: id={} recipients={}", id, recipients);
                return new DeliveryReceipt(name(), id, code, Map.of("recipients", recipients));
            }

            LOG.warn("OneSignal rejected notification: http={} body={}", code, respBody);
            throw new ProviderSendException(name(),
                    "OneSignal send failed: " + firstError(json, "HTTP " + code), code);
        } catch (IOException e) {
            LOG.error("OneSignal IO error: {}", e.getMessage());
            throw new ProviderSendException(name(), "OneSignal send failed: " + e.getMessage(), e);
        }
    }

    private String buildPayload(final Notification notification) {
        final ObjectNode root = mapper.createObjectNode();
        root.put("app_id", appId);
        root.putObject("headings").put("en", notification.getTitle());
        root.putObject("contents").put("en", notification.getBody());
        root.set("data", mapper.valueToTree(notification.getData()));

        if (!notification.getPlayerIds().isEmpty()) {
            addAll(root.putArray("include_player_ids"), notification.getPlayerIds());
        } else if (!notification.getSegments().isEmpty()) {
            addAll(root.putArray("included_segments"), notification.getSegments());
        } else {
            root.putArray("included_segments").add(DEFAULT_SEGMENT);
        }

        if (notification.hasImage()) {
            root.put("big_picture", notification.getImage());
            root.put("large_icon",  notification.getImage());
        }
        if (present(notification.getSendAt())) {
            root.put("send_after", notification.getSendAt());
        }

        try {
            return mapper.writeValueAsString(root);
        } catch (Exception e) {
            throw new ProviderSendException(name(), "Failed to serialize OneSignal payload", e);
        }
    }

    private static void addAll(final ArrayNode array, final List<String> values) {
        values.forEach(array::add);
    }

    private JsonNode parse(final String body) {
        try {
            return body.isEmpty() ? mapper.createObjectNode() : mapper.readTree(body);
        } catch (Exception e) {
            return mapper.createObjectNode();
        }
    }

    private static String firstError(final JsonNode json, final String fallback) {
        final JsonNode errors = json.path("errors");
        if (errors.isArray() && errors.size() > 0) {
            return errors.get(0).asText(fallback);
        }
        return fallback;
    }

    @Override
    public void close() {
        http.dispatcher().executorService().shutdown();
        http.connectionPool().evictAll();
    }
}
