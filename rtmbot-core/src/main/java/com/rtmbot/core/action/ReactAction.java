package com.rtmbot.core.action;

import com.rtmbot.core.dispatch.InboundEvent;

import java.io.IOException;

/**
 * Add an emoji reaction to the triggering message.
 */
public final class ReactAction implements Action {

    private final String emoji;

    public ReactAction(String emoji) {
        this.emoji = stripColons(emoji);
    }

    static String stripColons(String emoji) {
        if (emoji != null && emoji.length() > 2 && emoji.startsWith(":") && emoji.endsWith(":")) {
            return emoji.substring(1, emoji.length() - 1);
        }
        return emoji;
    }

    public String getEmoji() {
        return emoji;
    }

    @Override
    public Action execute(ActionContext context) throws IOException, InterruptedException {
        InboundEvent event = context.requireEvent("React");
        context.transport().react(emoji, event.getChannel(), event.getTimestamp());
        return null;
    }

    @Override
    public String toString() {
        return "React[" + emoji + "]";
    }
}
