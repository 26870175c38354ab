package com.rtmbot.core.correlation;

/**
 * A sent message awaiting its delivery confirmation.
 */
public record PendingResponse(String channelId, DeliveryCallback callback) {
}
