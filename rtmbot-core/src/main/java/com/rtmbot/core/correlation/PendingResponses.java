package com.rtmbot.core.correlation;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Outbound message id → pending response, for sends that asked to be told
 * about their delivery.
 */
public class PendingResponses {

    private final Map<Long, PendingResponse> entries = new HashMap<>();

    public synchronized void register(long messageId, PendingResponse response) {
        entries.put(messageId, response);
    }

    public synchronized Optional<PendingResponse> get(long messageId) {
        return Optional.ofNullable(entries.get(messageId));
    }

    public synchronized boolean remove(long messageId) {
        return entries.remove(messageId) != null;
    }

    public synchronized int size() {
        return entries.size();
    }

    public synchronized void clear() {
        entries.clear();
    }
}
