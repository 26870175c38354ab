package com.rtmbot.slack.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.rtmbot.common.config.BotConfig;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The Slack Web API methods the bot uses, with the bot's credentials applied.
 */
@Slf4j
public class SlackWebApi {

    public static final String RTM_START = "rtm.start";
    public static final String CHANNEL_HISTORY = "channels.history";
    public static final String GROUP_HISTORY = "groups.history";
    public static final String IM_HISTORY = "im.history";
    public static final String IM_OPEN = "im.open";
    public static final String ADD_REACTION = "reactions.add";
    public static final String DELETE_CHAT = "chat.delete";
    public static final String UPLOAD_FILE = "files.upload";

    private final SlackApiClient client;
    private final BotConfig config;

    public SlackWebApi(SlackApiClient client, BotConfig config) {
        this.client = client;
        this.config = config;
    }

    /**
     * Start a real-time session. The reply carries the socket {@code url} and
     * the workspace snapshot.
     *
     * @throws IOException if the service refuses the session
     */
    public JsonNode rtmStart() throws IOException, InterruptedException {
        JsonNode reply = client.call(RTM_START, config.getToken(), Map.of());
        if (!reply.path("ok").asBoolean(false)) {
            throw new IOException("rtm.start failed: " + reply.path("error").asText("unknown error"));
        }
        return reply;
    }

    /**
     * History method for a conversation id: {@code C} channels, {@code G}
     * private groups, otherwise direct messages.
     */
    public static String historyMethodFor(String conversationId) {
        if (conversationId.startsWith("C")) {
            return CHANNEL_HISTORY;
        }
        if (conversationId.startsWith("G")) {
            return GROUP_HISTORY;
        }
        return IM_HISTORY;
    }

    /**
     * One page of history strictly older than {@code latest} (all of it when
     * {@code latest} is null).
     */
    public JsonNode history(String conversationId, String latest) throws IOException, InterruptedException {
        Map<String, String> params = new LinkedHashMap<>();
        params.put("channel", conversationId);
        params.put("inclusive", "false");
        if (latest != null) {
            params.put("latest", latest);
        }
        return client.call(historyMethodFor(conversationId), config.getToken(), params);
    }

    /**
     * Delete a message. Skipped when the needed credential is not configured.
     *
     * @return false if skipped
     */
    public boolean deleteMessage(String channelId, String timestamp, boolean useAdminKey)
            throws IOException, InterruptedException {
        String token = useAdminKey ? config.getAdminToken() : config.getToken();
        if (token == null || token.isBlank()) {
            log.debug("No {} token, not deleting {} in {}", useAdminKey ? "admin" : "bot", timestamp, channelId);
            return false;
        }
        Map<String, String> params = new LinkedHashMap<>();
        params.put("ts", timestamp);
        params.put("channel", channelId);
        params.put("as_user", "true");
        client.call(DELETE_CHAT, token, params);
        return true;
    }

    public void addReaction(String emoji, String channelId, String timestamp)
            throws IOException, InterruptedException {
        Map<String, String> params = new LinkedHashMap<>();
        params.put("name", emoji);
        params.put("channel", channelId);
        params.put("timestamp", timestamp);
        client.call(ADD_REACTION, config.getToken(), params);
    }

    public void uploadFile(Path file, String channelId) throws IOException, InterruptedException {
        String fileName = file.getFileName().toString();
        int dot = fileName.lastIndexOf('.');
        Map<String, String> fields = new LinkedHashMap<>();
        fields.put("filetype", dot >= 0 ? fileName.substring(dot + 1) : "auto");
        fields.put("channels", channelId);
        fields.put("filename", (config.getName() != null ? config.getName() : "bot") + " upload");
        client.upload(UPLOAD_FILE, config.getToken(), fields, "file", file);
    }

    /**
     * Open the DM session with a user.
     *
     * @return the DM conversation id
     * @throws IOException if the service refuses
     */
    public String openDirectMessage(String userId) throws IOException, InterruptedException {
        JsonNode reply = client.call(IM_OPEN, config.getToken(), Map.of("user", userId));
        String id = reply.path("channel").path("id").asText(null);
        if (!reply.path("ok").asBoolean(false) || id == null) {
            throw new IOException("im.open failed for " + userId + ": " + reply.path("error").asText("unknown error"));
        }
        return id;
    }

    public BotConfig getConfig() {
        return config;
    }
}
