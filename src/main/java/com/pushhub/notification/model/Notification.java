package com.pushhub.notification.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Immutable notification payload handed to the dispatcher or the scheduler.
 *
 * <p>Besides the content ({@code title}, {@code body}, {@code image},
 * {@code data}) a notification carries the targeting fields of every provider;
 * each provider picks the ones it understands:
 * <ul>
 *   <li>Firebase: {@code token}, {@code tokens}, {@code topic} and the
 *       platform blocks {@code android}, {@code apns}, {@code webpush}</li>
 *   <li>OneSignal: {@code playerIds}, {@code segments}, {@code sendAt}</li>
 *   <li>Pusher: {@code channel}, {@code event}</li>
 * </ul>
 *
 * <p>Collections are copied on build; the getters never return null lists or maps.
 */
public final class Notification {

    public static final int MAX_TITLE_LENGTH = 200;
    public static final int MAX_BODY_LENGTH  = 2000;
    public static final int MAX_TOKENS       = 500;
    public static final int MAX_PLAYER_IDS   = 2000;

    private final String              title;
    private final String              body;
    private final String              image;
    private final Map<String, Object> data;

    private final String              token;
    private final List<String>        tokens;
    private final String              topic;
    private final Map<String, Object> android;
    private final Map<String, Object> apns;
    private final Map<String, Object> webpush;

    private final List<String>        playerIds;
    private final List<String>        segments;
    private final String              sendAt;

    private final String              channel;
    private final String              event;

    private Notification(final Builder b) {
        this.title     = b.title;
        this.body      = b.body;
        this.image     = b.image;
        this.data      = copyOf(b.data);
        this.token     = b.token;
        this.tokens    = b.tokens != null ? List.copyOf(b.tokens) : List.of();
        this.topic     = b.topic;
        this.android   = copyOf(b.android);
        this.apns      = copyOf(b.apns);
        this.webpush   = copyOf(b.webpush);
        this.playerIds = b.playerIds != null ? List.copyOf(b.playerIds) : List.of();
        this.segments  = b.segments != null ? List.copyOf(b.segments) : List.of();
        this.sendAt    = b.sendAt;
        this.channel   = b.channel;
        this.event     = b.event;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static Builder builder(final String title, final String body) {
        return new Builder().title(title).body(body);
    }

    public static final class Builder {
        private String              title;
        private String              body;
        private String              image;
        private Map<String, Object> data;
        private String              token;
        private List<String>        tokens;
        private String              topic;
        private Map<String, Object> android;
        private Map<String, Object> apns;
        private Map<String, Object> webpush;
        private List<String>        playerIds;
        private List<String>        segments;
        private String              sendAt;
        private String              channel;
        private String              event;

        private Builder() {}

        public Builder title(final String v)                 { this.title = v; return this; }
        public Builder body(final String v)                  { this.body = v; return this; }
        public Builder image(final String v)                 { this.image = v; return this; }
        public Builder data(final Map<String, Object> v)     { this.data = v; return this; }
        public Builder token(final String v)                 { this.token = v; return this; }
        public Builder tokens(final List<String> v)          { this.tokens = v; return this; }
        public Builder topic(final String v)                 { this.topic = v; return this; }
        public Builder android(final Map<String, Object> v)  { this.android = v; return this; }
        public Builder apns(final Map<String, Object> v)     { this.apns = v; return this; }
        public Builder webpush(final Map<String, Object> v)  { this.webpush = v; return this; }
        public Builder playerIds(final List<String> v)       { this.playerIds = v; return this; }
        public Builder segments(final List<String> v)        { this.segments = v; return this; }
        public Builder sendAt(final String v)                { this.sendAt = v; return this; }
        public Builder channel(final String v)               { this.channel = v; return this; }
        public Builder event(final String v)                 { this.event = v; return this; }

        public Notification build() { return new Notification(this); }
    }

    public String              getTitle()     { return title; }
    public String              getBody()      { return body; }
    public String              getImage()     { return image; }
    public Map<String, Object> getData()      { return data; }
    public String              getToken()     { return token; }
    public List<String>        getTokens()    { return tokens; }
    public String              getTopic()     { return topic; }
    public Map<String, Object> getAndroid()   { return android; }
    public Map<String, Object> getApns()      { return apns; }
    public Map<String, Object> getWebpush()   { return webpush; }
    public List<String>        getPlayerIds() { return playerIds; }
    public List<String>        getSegments()  { return segments; }
    public String              getSendAt()    { return sendAt; }
    public String              getChannel()   { return channel; }
    public String              getEvent()     { return event; }

    public boolean hasTitle()  { return title != null && !title.isBlank(); }
    public boolean hasBody()   { return body != null && !body.isBlank(); }
    public boolean hasToken()  { return token != null && !token.isBlank(); }
    public boolean hasTokens() { return !tokens.isEmpty(); }
    public boolean hasTopic()  { return topic != null && !topic.isBlank(); }
    public boolean hasImage()  { return image != null && !image.isBlank(); }

    /**
     * Body shortened to {@code maxLength} characters, with an ellipsis appended
     * when {@code ellipsis} is set and the body was actually cut.
     */
    public String bodyPreview(final int maxLength, final boolean ellipsis) {
        if (body == null) return "";
        if (body.length() <= maxLength) return body;
        return body.substring(0, maxLength) + (ellipsis ? "..." : "");
    }

    private static Map<String, Object> copyOf(final Map<String, Object> source) {
        // Map.copyOf rejects null values, which free-form data may legitimately hold
        if (source == null || source.isEmpty()) return Map.of();
        return Collections.unmodifiableMap(new LinkedHashMap<>(source));
    }

    @Override
    public String toString() {
        return "Notification{title=" + title
             + (hasToken() ? ", token=" + maskToken(token) : "")
             + (hasTokens() ? ", tokens=" + tokens.size() : "")
             + (hasTopic() ? ", topic=" + topic : "")
             + (!playerIds.isEmpty() ? ", playerIds=" + playerIds.size() : "")
             + (!segments.isEmpty() ? ", segments=" + segments : "")
             + (channel != null ? ", channel=" + channel : "")
             + "}";
    }

    private static String maskToken(final String value) {
        return value.length() <= 8 ? "***" : value.substring(0, 8) + "***";
    }
}
