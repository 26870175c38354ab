package com.rtmbot.core.dispatch;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * One decoded event object from the real-time socket (or a message from a
 * history page).
 * <p>
 * Fields are kept as the generic map Jackson produces. The channel field is
 * writable because a delivery confirmation takes on the channel of the message
 * it confirms.
 */
public class InboundEvent {

    private final Map<String, Object> fields;

    public InboundEvent(Map<String, Object> fields) {
        this.fields = new LinkedHashMap<>(fields);
    }

    public static InboundEvent of(Object... keyValues) {
        if (keyValues.length % 2 != 0) {
            throw new IllegalArgumentException("Expected key/value pairs");
        }
        Map<String, Object> fields = new LinkedHashMap<>();
        for (int i = 0; i < keyValues.length; i += 2) {
            fields.put((String) keyValues[i], keyValues[i + 1]);
        }
        return new InboundEvent(fields);
    }

    public EventKind kind() {
        if (isMessage(false)) {
            return EventKind.MESSAGE;
        }
        if (fields.containsKey("reply_to") && isOk()) {
            return EventKind.DELIVERY_CONFIRMATION;
        }
        if ("group_joined".equals(getType())) {
            return EventKind.GROUP_JOIN;
        }
        if ("team_join".equals(getType())) {
            return EventKind.TEAM_JOIN;
        }
        return EventKind.OTHER;
    }

    /**
     * A plain user message: type {@code message}, non-empty text, and none of
     * {@code subtype}, {@code bot_id} or {@code reply_to}. History pages omit
     * the channel, so {@code noChannel} skips that check.
     */
    public boolean isMessage(boolean noChannel) {
        if (!"message".equals(getType())) {
            return false;
        }
        if (!noChannel && isBlank(getString("channel"))) {
            return false;
        }
        if (fields.containsKey("subtype") || fields.containsKey("bot_id") || fields.containsKey("reply_to")) {
            return false;
        }
        return !isBlank(getText());
    }

    public String getType() {
        return getString("type");
    }

    public String getUser() {
        return getString("user");
    }

    public String getChannel() {
        return getString("channel");
    }

    public void setChannel(String channelId) {
        fields.put("channel", channelId);
    }

    public String getText() {
        return getString("text");
    }

    public String getTimestamp() {
        return getString("ts");
    }

    public String getSubtype() {
        return getString("subtype");
    }

    public boolean isOk() {
        return Boolean.TRUE.equals(fields.get("ok"));
    }

    public Optional<Long> getReplyTo() {
        Object value = fields.get("reply_to");
        if (value instanceof Number n) {
            return Optional.of(n.longValue());
        }
        return Optional.empty();
    }

    /**
     * String value of a field; non-string scalars are converted, objects give
     * {@code null}.
     */
    public String getString(String key) {
        Object value = fields.get(key);
        if (value == null || value instanceof Map) {
            return null;
        }
        return value.toString();
    }

    /**
     * A nested object field such as the {@code channel} of {@code group_joined}
     * or the {@code user} of {@code team_join}.
     */
    @SuppressWarnings("unchecked")
    public Map<String, Object> getObject(String key) {
        Object value = fields.get(key);
        if (value instanceof Map) {
            return (Map<String, Object>) value;
        }
        return Map.of();
    }

    public boolean has(String key) {
        return fields.containsKey(key);
    }

    public Map<String, Object> asMap() {
        return Collections.unmodifiableMap(fields);
    }

    private static boolean isBlank(String s) {
        return s == null || s.isEmpty();
    }

    @Override
    public String toString() {
        return fields.toString();
    }
}
