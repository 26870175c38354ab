package com.rtmbot.slack.history;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.rtmbot.common.infra.RetryRunner;
import com.rtmbot.core.dispatch.InboundEvent;
import com.rtmbot.core.identity.IdentityMap;
import com.rtmbot.core.transport.ProtocolViolationException;
import com.rtmbot.slack.api.SlackWebApi;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Walks the message history of every known conversation, newest page first.
 * <p>
 * Each request is preceded by a fixed pause to stay under the API rate limit.
 * Pages overlap in practice, so messages are de-duplicated by timestamp.
 */
@Slf4j
public class HistoryPager {

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {
    };

    private final SlackWebApi api;
    private final ObjectMapper objectMapper;
    private final RetryRunner.Sleeper sleeper;
    private final long pacingMillis;

    public HistoryPager(SlackWebApi api, ObjectMapper objectMapper, RetryRunner.Sleeper sleeper, long pacingMillis) {
        this.api = api;
        this.objectMapper = objectMapper;
        this.sleeper = sleeper;
        this.pacingMillis = pacingMillis;
    }

    /**
     * Fetch all channel messages, and direct messages too if asked.
     *
     * @return conversation id → messages, in conversation order
     * @throws ProtocolViolationException if a page lacks {@code has_more}
     */
    public Map<String, List<InboundEvent>> fetchAll(IdentityMap identity, boolean includeDirectMessages)
            throws IOException, InterruptedException {
        List<String> conversations = new ArrayList<>(identity.channelIds());
        if (includeDirectMessages) {
            conversations.addAll(identity.directMessageIds());
        }
        Map<String, List<InboundEvent>> result = new LinkedHashMap<>();
        int found = 0;
        for (String conversationId : conversations) {
            log.info("Getting history for channel: {}", identity.conversationName(conversationId));
            List<InboundEvent> messages = fetch(conversationId);
            found += messages.size();
            log.info("Found {} messages", found);
            result.put(conversationId, messages);
        }
        return result;
    }

    /**
     * Fetch one conversation's messages, newest first.
     */
    public List<InboundEvent> fetch(String conversationId) throws IOException, InterruptedException {
        List<InboundEvent> messages = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        BigDecimal latest = null;
        boolean hasMore = true;
        while (hasMore) {
            sleeper.sleep(pacingMillis);
            JsonNode page = api.history(conversationId, latest != null ? latest.toPlainString() : null);
            if (!page.has("has_more")) {
                log.error("History page for {} has no has_more: {}", conversationId, page);
                throw new ProtocolViolationException("History reply for " + conversationId + " lacks has_more");
            }
            hasMore = page.get("has_more").asBoolean();
            JsonNode batch = page.path("messages");
            if (hasMore && batch.isEmpty()) {
                log.warn("Empty history page for {} claims more, stopping", conversationId);
                break;
            }
            for (JsonNode node : batch) {
                InboundEvent message = new InboundEvent(objectMapper.convertValue(node, MAP_TYPE));
                String ts = message.getTimestamp();
                if (ts == null) {
                    continue;
                }
                BigDecimal value = parseTimestamp(conversationId, ts);
                latest = latest == null ? value : latest.min(value);
                if (message.isMessage(true) && seen.add(ts)) {
                    messages.add(message);
                }
            }
        }
        return messages;
    }

    private static BigDecimal parseTimestamp(String conversationId, String ts) {
        try {
            return new BigDecimal(ts);
        } catch (NumberFormatException e) {
            log.error("History for {} has malformed ts: {}", conversationId, ts);
            throw new ProtocolViolationException("Malformed ts " + ts + " in history for " + conversationId, e);
        }
    }
}
