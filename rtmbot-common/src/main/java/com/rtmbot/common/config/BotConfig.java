package com.rtmbot.common.config;

import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * Root configuration for a bot process.
 * Bound from JSON by {@link BotConfigService}.
 */
@Data
public class BotConfig {

    public static final String DEFAULT_API_BASE_URL = "https://slack.com/api/";
    public static final int DEFAULT_CHUNK_LIMIT = 4000;
    public static final long DEFAULT_PACING_MILLIS = 1000;

    /** Bot token used for the RTM handshake and regular Web API calls. */
    private String token;

    /** Elevated token required to delete other users' messages (optional). */
    private String adminToken;

    /** Leading token that marks a channel message as a command. */
    private String alert = "!";

    /** User name of the bot itself; its own messages are never archived. */
    private String name;

    /** Wipe the history store and reload it from the remote archive on first connect. */
    private boolean loadHistory;

    /** Delete bot replies and issued commands from the remote archive on first connect. */
    private boolean clearCommands;

    /** Whether the command sweep also walks direct-message sessions. */
    private boolean clearIncludesDirectMessages = true;

    /** User names granted access to admin-only commands. */
    private List<String> admins = new ArrayList<>();

    private String apiBaseUrl = DEFAULT_API_BASE_URL;

    /** Maximum characters per outbound message frame. */
    private int chunkLimit = DEFAULT_CHUNK_LIMIT;

    /** Fixed delay before each paginated history or bulk delete request. */
    private long pacingMillis = DEFAULT_PACING_MILLIS;

    /** JSON-lines file backing the message history; in-memory when unset. */
    private String historyStorePath;

    private RetryConfig retry = new RetryConfig();

    @Data
    public static class RetryConfig {
        private int attempts = 5;
        private long minDelayMillis = 1000;
        private long maxDelayMillis = 60_000;
    }
}
