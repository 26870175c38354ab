package com.rtmbot.core.identity;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Bidirectional name/id lookups for channels, users and direct-message
 * sessions on one connection.
 * <p>
 * Built from the connection snapshot and extended by join events. Entries
 * are never removed, so any id observed during the connection stays
 * resolvable. Safe for concurrent readers.
 */
public class IdentityMap {

    private final Map<String, String> channelNameToId = new ConcurrentHashMap<>();
    private final Map<String, String> channelIdToName = new ConcurrentHashMap<>();
    private final Map<String, String> userNameToId = new ConcurrentHashMap<>();
    private final Map<String, String> userIdToName = new ConcurrentHashMap<>();
    private final Map<String, String> displayNameToUserId = new ConcurrentHashMap<>();
    private final Map<String, String> userIdToDisplayName = new ConcurrentHashMap<>();
    private final Map<String, String> userIdToDirectMessage = new ConcurrentHashMap<>();
    private final Map<String, String> directMessageToUserId = new ConcurrentHashMap<>();

    /**
     * Direct-message session ids start with {@code D}; channels with {@code C}
     * and private groups with {@code G}.
     */
    public static boolean isDirectMessage(String conversationId) {
        return conversationId != null && conversationId.startsWith("D");
    }

    // =========================================================================
    // Registration
    // =========================================================================

    public void addChannel(String name, String id) {
        channelNameToId.put(name, id);
        channelIdToName.put(id, name);
    }

    public void addUser(String name, String id) {
        userNameToId.put(name, id);
        userIdToName.put(id, name);
    }

    public void addDisplayName(String displayName, String userId) {
        if (displayName == null || displayName.isEmpty()) {
            return;
        }
        displayNameToUserId.put(displayName, userId);
        userIdToDisplayName.put(userId, displayName);
    }

    public void addDirectMessage(String userId, String directMessageId) {
        userIdToDirectMessage.put(userId, directMessageId);
        directMessageToUserId.put(directMessageId, userId);
    }

    // =========================================================================
    // Lookups
    // =========================================================================

    public String channelId(String name) {
        return require(channelNameToId, name, "channel name");
    }

    public Optional<String> findChannelId(String name) {
        return Optional.ofNullable(name).map(channelNameToId::get);
    }

    public String channelName(String id) {
        return require(channelIdToName, id, "channel id");
    }

    public Optional<String> findChannelName(String id) {
        return Optional.ofNullable(id).map(channelIdToName::get);
    }

    public String userId(String name) {
        return require(userNameToId, name, "user name");
    }

    public Optional<String> findUserId(String name) {
        return Optional.ofNullable(name).map(userNameToId::get);
    }

    public String userName(String id) {
        return require(userIdToName, id, "user id");
    }

    public String displayName(String userId) {
        return require(userIdToDisplayName, userId, "user id");
    }

    public Optional<String> userIdForDisplayName(String displayName) {
        return Optional.ofNullable(displayName).map(displayNameToUserId::get);
    }

    public Optional<String> directMessageId(String userId) {
        return Optional.ofNullable(userId).map(userIdToDirectMessage::get);
    }

    public String userForDirectMessage(String directMessageId) {
        return require(directMessageToUserId, directMessageId, "direct message id");
    }

    /**
     * Human-readable name of any conversation: the channel name, or the peer's
     * user name for a direct message.
     */
    public String conversationName(String conversationId) {
        if (isDirectMessage(conversationId)) {
            String userId = directMessageToUserId.get(conversationId);
            return userId != null ? userIdToName.getOrDefault(userId, userId) : conversationId;
        }
        return channelIdToName.getOrDefault(conversationId, conversationId);
    }

    /** Ids of every known channel and private group. */
    public List<String> channelIds() {
        return List.copyOf(channelIdToName.keySet());
    }

    /** Ids of every known direct-message session. */
    public List<String> directMessageIds() {
        return List.copyOf(directMessageToUserId.keySet());
    }

    private static String require(Map<String, String> map, String key, String kind) {
        String value = key != null ? map.get(key) : null;
        if (value == null) {
            throw new UnknownIdentityException(kind, key);
        }
        return value;
    }
}
