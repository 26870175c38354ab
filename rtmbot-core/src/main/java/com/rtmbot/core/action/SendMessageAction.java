package com.rtmbot.core.action;

import com.rtmbot.core.correlation.DeliveryCallback;
import com.rtmbot.core.dispatch.InboundEvent;
import com.rtmbot.core.identity.IdentityMap;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.util.Optional;

/**
 * Send a text message.
 * <p>
 * The destination is, in order of preference: the named channel (or the
 * triggering channel when it is named by its raw id), the DM
 * session with {@code userId} (opened on demand), or the channel of the
 * triggering event.
 */
@Slf4j
public final class SendMessageAction implements Action {

    private final String channelName;
    private final String userId;
    private final String text;
    private final DeliveryCallback callback;

    public SendMessageAction(String channelName, String userId, String text, DeliveryCallback callback) {
        this.channelName = channelName;
        this.userId = userId;
        this.text = text;
        this.callback = callback;
    }

    public SendMessageAction(String channelName, String userId, String text) {
        this(channelName, userId, text, null);
    }

    /** Same message, calling back once delivered. */
    public SendMessageAction onDelivered(DeliveryCallback callback) {
        return new SendMessageAction(channelName, userId, text, callback);
    }

    @Override
    public Action execute(ActionContext context) throws IOException, InterruptedException {
        String channelId = resolveChannelId(context);
        context.transport().sendMessage(channelId, text, callback);
        return null;
    }

    private String resolveChannelId(ActionContext context) throws IOException, InterruptedException {
        IdentityMap identity = context.identity();
        if (channelName != null) {
            Optional<String> known = identity.findChannelId(channelName);
            if (known.isPresent()) {
                return known.get();
            }
            // channels missing from the snapshot are named by their raw id
            return context.triggeringEvent()
                    .map(InboundEvent::getChannel)
                    .filter(channelName::equals)
                    .orElseGet(() -> identity.channelId(channelName));
        }
        if (userId != null) {
            return directMessageChannel(context, userId);
        }
        return context.triggeringEvent()
                .map(InboundEvent::getChannel)
                .orElseThrow(() -> new IllegalStateException("Message has no destination: " + this));
    }

    static String directMessageChannel(ActionContext context, String userId)
            throws IOException, InterruptedException {
        IdentityMap identity = context.identity();
        var known = identity.directMessageId(userId);
        if (known.isPresent()) {
            return known.get();
        }
        String opened = context.transport().openDirectMessage(userId);
        identity.addDirectMessage(userId, opened);
        log.info("Opened direct message {} with {}", opened, userId);
        return opened;
    }

    public String getChannelName() {
        return channelName;
    }

    public String getUserId() {
        return userId;
    }

    public String getText() {
        return text;
    }

    public DeliveryCallback getCallback() {
        return callback;
    }

    @Override
    public String toString() {
        return "SendMessage[channel=" + channelName + ", user=" + userId + ", length="
                + (text != null ? text.length() : 0) + "]";
    }
}
