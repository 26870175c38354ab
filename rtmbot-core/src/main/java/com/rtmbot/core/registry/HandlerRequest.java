package com.rtmbot.core.registry;

import com.rtmbot.core.grammar.ParsedArgs;

/**
 * What a handler is invoked with.
 *
 * @param userId      sender's user id
 * @param channelName channel name, or {@code null} for a direct message
 * @param text        raw message text
 * @param args        captured command arguments (empty for unfiltered handlers)
 * @param timestamp   message timestamp, only when the handler asked for it
 */
public record HandlerRequest(String userId, String channelName, String text, ParsedArgs args, String timestamp) {

    public boolean isDirectMessage() {
        return channelName == null;
    }
}
