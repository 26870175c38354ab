package com.rtmbot.core.history;

import lombok.extern.slf4j.Slf4j;

import java.io.IOException;

/**
 * Decides which channel messages are worth keeping and writes them to the
 * {@link HistoryStore}.
 * <p>
 * The bot's own messages, empty messages and commands (text starting with the
 * alert prefix) are not archived.
 */
@Slf4j
public class MessageArchiver {

    private final HistoryStore store;
    private final String alertPrefix;
    private volatile String botUserId;

    public MessageArchiver(HistoryStore store, String alertPrefix) {
        this.store = store;
        this.alertPrefix = alertPrefix;
    }

    public void setBotUserId(String botUserId) {
        this.botUserId = botUserId;
    }

    public HistoryStore getStore() {
        return store;
    }

    /**
     * @return true if the message was stored
     */
    public boolean archive(String userId, String channelName, String text, String timestamp) throws IOException {
        if (userId == null || userId.equals(botUserId)) {
            return false;
        }
        if (text == null || text.isEmpty() || text.startsWith(alertPrefix) || timestamp == null) {
            return false;
        }
        boolean stored = store.save(new HistoryRecord(userId, channelName, text, timestamp));
        if (!stored) {
            log.debug("History already has message {}", timestamp);
        }
        return stored;
    }
}
