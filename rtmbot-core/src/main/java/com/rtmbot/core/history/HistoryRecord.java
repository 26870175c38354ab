package com.rtmbot.core.history;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One archived chat message. {@code timestamp} is the message's remote
 * timestamp and is unique across the store.
 */
public record HistoryRecord(
        @JsonProperty("user_id") String userId,
        @JsonProperty("channel_name") String channelName,
        @JsonProperty("text") String text,
        @JsonProperty("timestamp") String timestamp) {
}
