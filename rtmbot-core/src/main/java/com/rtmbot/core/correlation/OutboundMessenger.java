package com.rtmbot.core.correlation;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Numbers and writes outbound message frames on the current socket, and
 * records the ones whose delivery someone wants to hear about.
 * <p>
 * Ids start at 0 for every connection. Text longer than the chunk limit is
 * sent as several frames; only the last frame's id is registered.
 */
@Slf4j
public class OutboundMessenger {

    private final ObjectMapper objectMapper;
    private final int chunkLimit;
    private final PendingResponses pendingResponses = new PendingResponses();
    private final AtomicLong nextId = new AtomicLong();
    private volatile FrameSink sink;

    public OutboundMessenger(ObjectMapper objectMapper, int chunkLimit) {
        if (chunkLimit <= 0) {
            throw new IllegalArgumentException("chunkLimit must be positive: " + chunkLimit);
        }
        this.objectMapper = objectMapper;
        this.chunkLimit = chunkLimit;
    }

    /**
     * Point the messenger at a freshly opened socket. Resets the id counter
     * and drops confirmations still owed by the previous connection.
     */
    public void attach(FrameSink sink) {
        this.sink = sink;
        nextId.set(0);
        int dropped = pendingResponses.size();
        pendingResponses.clear();
        if (dropped > 0) {
            log.info("Dropped {} unconfirmed messages from the previous connection", dropped);
        }
    }

    public PendingResponses getPendingResponses() {
        return pendingResponses;
    }

    /** Id the next frame will carry. */
    public long peekNextId() {
        return nextId.get();
    }

    /**
     * Send text to a channel id. Empty text sends nothing.
     */
    public void send(String channelId, String text, DeliveryCallback callback) throws IOException {
        FrameSink current = sink;
        if (current == null) {
            throw new IllegalStateException("No socket attached");
        }
        List<String> chunks = chunk(text, chunkLimit);
        for (int i = 0; i < chunks.size(); i++) {
            long id = nextId.getAndIncrement();
            boolean last = i == chunks.size() - 1;
            if (last && callback != null) {
                pendingResponses.register(id, new PendingResponse(channelId, callback));
            }
            current.sendText(encodeFrame(id, channelId, chunks.get(i)));
        }
        log.debug("Sent {} frame(s) to {}", chunks.size(), channelId);
    }

    String encodeFrame(long id, String channelId, String text) throws JsonProcessingException {
        ObjectNode frame = objectMapper.createObjectNode();
        frame.put("id", id);
        frame.put("type", "message");
        frame.put("channel", channelId);
        frame.put("text", text);
        return objectMapper.writeValueAsString(frame);
    }

    /**
     * Split text into consecutive pieces of at most {@code limit} characters.
     * Empty or null text yields no pieces. A surrogate pair is never split;
     * a piece that would end inside one ends before it instead.
     */
    public static List<String> chunk(String text, int limit) {
        List<String> chunks = new ArrayList<>();
        if (text == null || text.isEmpty()) {
            return chunks;
        }
        int start = 0;
        while (start < text.length()) {
            int end = Math.min(text.length(), start + limit);
            if (end < text.length() && Character.isHighSurrogate(text.charAt(end - 1))) {
                // a limit of one cannot hold a pair; keep it whole
                end = end - 1 > start ? end - 1 : end + 1;
            }
            chunks.add(text.substring(start, end));
            start = end;
        }
        return chunks;
    }
}
