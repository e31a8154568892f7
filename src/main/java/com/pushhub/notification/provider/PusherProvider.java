package com.pushhub.notification.provider;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.pushhub.notification.exception.ProviderSendException;
import com.pushhub.notification.model.DeliveryReceipt;
import com.pushhub.notification.model.Notification;
import com.pushhub.notification.retry.RetryExecutor;
import okhttp3.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.time.Clock;
import java.time.Instant;
import java.util.HexFormat;
import java.util.Map;

/**
 * Realtime provider backed by the Pusher Channels HTTP API.
 *
 * <p>Broadcasts the notification as an event on a channel. Both have defaults
 * ({@code notifications} / {@code new-notification}), so Pusher accepts every
 * notification. Requests are signed with the Channels HMAC-SHA256 scheme, so
 * no Pusher SDK dependency is needed.
 *
 * <h2>Required credentials</h2>
 * <ul>
 *   <li>{@code PUSHER_APP_ID}</li>
 *   <li>{@code PUSHER_KEY}</li>
 *   <li>{@code PUSHER_SECRET}</li>
 *   <li>{@code PUSHER_CLUSTER} (e.g. {@code eu}, {@code mt1})</li>
 * </ul>
 *
 * <p>API reference:
 * <a href="https://pusher.com/docs/channels/library_auth_reference/rest-api/">Channels HTTP API</a>
 */
public class PusherProvider extends AbstractNotificationProvider {

    private static final Logger LOG = LoggerFactory.getLogger(PusherProvider.class);
    public  static final String NAME = "Pusher";

    static final String DEFAULT_CHANNEL = "notifications";
    static final String DEFAULT_EVENT   = "new-notification";

    private final String       appId;
    private final String       key;
    private final String       secret;
    private final String       cluster;
    private final String       endpoint;
    private final Clock        clock;
    private final OkHttpClient http;
    private final ObjectMapper mapper = new ObjectMapper();

    public PusherProvider(
            final int priority,
            final boolean enabled,
            final RetryExecutor retry,
            final String appId,
            final String key,
            final String secret,
            final String cluster) {
        this(priority, enabled, retry, appId, key, secret, cluster,
                "https://api-" + cluster + ".pusher.com", Clock.systemUTC());
    }

    public PusherProvider(
            final int priority,
            final boolean enabled,
            final RetryExecutor retry,
            final String appId,
            final String key,
            final String secret,
            final String cluster,
            final String endpoint,
            final Clock clock) {
        super(NAME, priority, enabled, retry);
        this.appId    = appId;
        this.key      = key;
        this.secret   = secret;
        this.cluster  = cluster;
        this.endpoint = stripTrailingSlash(endpoint);
        this.clock    = clock;
        this.http     = buildHttpClient();
    }

    @Override
    public boolean isConfigured() {
        return present(appId) && present(key) && present(secret) && present(cluster);
    }

    @Override
    public DeliveryReceipt send(final Notification notification) {
        if (!isConfigured()) {
            throw new ProviderSendException(name(), "Pusher provider is not available");
        }

        final String channel = present(notification.getChannel()) ? notification.getChannel() : DEFAULT_CHANNEL;
        final String event   = present(notification.getEvent())   ? notification.getEvent()   : DEFAULT_EVENT;
        final String body    = buildBody(notification, channel, event);
        final String path    = "/apps/" + appId + "/events";

        final HttpUrl url;
        try {
            url = signedUrl(path, body);
        } catch (Exception e) {
            throw new ProviderSendException(name(), "Pusher request signing failed: " + e.getMessage(), e);
        }

        final Request request = new Request.Builder()
                .url(url)
                .post(RequestBody.create(body, JSON))
                .build();

        try (Response response = http.newCall(request).execute()) {
            final int    code     = response.code();
            final String respBody = response.body() != null ? response.body().string() : "";

            if (code == 200) {
                LOG.info("Pusher event triggered: channel={} event={}", channel, event);
                return new DeliveryReceipt(name(), channel + "/" + event, code,
                        Map.of("channel", channel, "event", event));
            }
            LOG.warn("Pusher rejected event: http={} body={}", code, respBody);
            throw new ProviderSendException(name(), "Pusher send failed: HTTP " + code + ": " + respBody, code);
        } catch (IOException e) {
            LOG.error("Pusher IO error: {}", e.getMessage());
            throw new ProviderSendException(name(), "Pusher send failed: " + e.getMessage(), e);
        }
    }

    private String buildBody(final Notification notification, final String channel, final String event) {
        final ObjectNode payload = mapper.createObjectNode();
        payload.put("title", notification.getTitle());
        payload.put("body",  notification.getBody());
        if (notification.hasImage()) {
            payload.put("image", notification.getImage());
        }
        payload.set("data", mapper.valueToTree(notification.getData()));
        payload.put("timestamp", Instant.now(clock).toString());

        try {
            // Channels expects the event data as a JSON-encoded string
            final ObjectNode root = mapper.createObjectNode();
            root.put("name", event);
            root.putArray("channels").add(channel);
            root.put("data", mapper.writeValueAsString(payload));
            return mapper.writeValueAsString(root);
        } catch (Exception e) {
            throw new ProviderSendException(name(), "Failed to serialize Pusher payload", e);
        }
    }

    /**
     * Builds the request URL carrying the Channels authentication parameters.
     * Query keys are already in lexicographic order, as the signature requires.
     */
    HttpUrl signedUrl(final String path, final String body) throws Exception {
        final String query = "auth_key=" + key
                + "&auth_timestamp=" + clock.instant().getEpochSecond()
                + "&auth_version=1.0"
                + "&body_md5=" + md5Hex(body);
        final String signature = hmacHex(secret, "POST\n" + path + "\n" + query);

        return HttpUrl.get(endpoint + path + "?" + query + "&auth_signature=" + signature);
    }

    static String md5Hex(final String data) throws Exception {
        final MessageDigest md = MessageDigest.getInstance("MD5");
        return HexFormat.of().formatHex(md.digest(data.getBytes(StandardCharsets.UTF_8)));
    }

    static String hmacHex(final String secret, final String data) throws Exception {
        final Mac mac = Mac.getInstance("HmacSHA256");
        mac.init(new SecretKeySpec(secret.getBytes(StandardCharsets.UTF_8), "HmacSHA256"));
        return HexFormat.of().formatHex(mac.doFinal(data.getBytes(StandardCharsets.UTF_8)));
    }

    @Override
    public void close() {
        http.dispatcher().executorService().shutdown();
        http.connectionPool().evictAll();
    }
}
