package com.rtmbot.core.action;

import com.rtmbot.core.dispatch.InboundEvent;

import java.io.IOException;

/**
 * Delete a message. Without an explicit target the triggering message is
 * deleted with the admin credential.
 */
public final class DeleteMessageAction implements Action {

    private final String channelId;
    private final String timestamp;
    private final boolean useAdminKey;

    public DeleteMessageAction(String channelId, String timestamp, boolean useAdminKey) {
        this.channelId = channelId;
        this.timestamp = timestamp;
        this.useAdminKey = useAdminKey;
    }

    public static DeleteMessageAction triggeringMessage() {
        return new DeleteMessageAction(null, null, true);
    }

    @Override
    public Action execute(ActionContext context) throws IOException, InterruptedException {
        String channel = channelId;
        String ts = timestamp;
        if (channel == null || ts == null) {
            InboundEvent event = context.requireEvent("DeleteMessage");
            channel = event.getChannel();
            ts = event.getTimestamp();
        }
        context.transport().deleteMessage(channel, ts, useAdminKey);
        return null;
    }

    @Override
    public String toString() {
        return "DeleteMessage[" + (channelId != null ? channelId + "/" + timestamp : "triggering") + "]";
    }
}
