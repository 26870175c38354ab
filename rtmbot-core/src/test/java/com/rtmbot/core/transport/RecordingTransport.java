package com.rtmbot.core.transport;

import com.rtmbot.core.correlation.DeliveryCallback;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Transport fake that records every call.
 */
public class RecordingTransport implements ChatTransport {

    public record Sent(String channelId, String text, DeliveryCallback callback) {
    }

    public record Deleted(String channelId, String timestamp, boolean useAdminKey) {
    }

    public record Reaction(String emoji, String channelId, String timestamp) {
    }

    public final List<Sent> sent = new ArrayList<>();
    public final List<Deleted> deleted = new ArrayList<>();
    public final List<Reaction> reactions = new ArrayList<>();
    public final List<String> uploads = new ArrayList<>();
    public final List<String> openedDirectMessages = new ArrayList<>();

    @Override
    public void sendMessage(String channelId, String text, DeliveryCallback callback) {
        sent.add(new Sent(channelId, text, callback));
    }

    @Override
    public void deleteMessage(String channelId, String timestamp, boolean useAdminKey) {
        deleted.add(new Deleted(channelId, timestamp, useAdminKey));
    }

    @Override
    public void react(String emoji, String channelId, String timestamp) {
        reactions.add(new Reaction(emoji, channelId, timestamp));
    }

    @Override
    public void uploadFile(Path file, String channelId) {
        uploads.add(channelId + ":" + file.getFileName());
    }

    @Override
    public String openDirectMessage(String userId) {
        openedDirectMessages.add(userId);
        return "DNEW" + userId;
    }

    public List<String> sentTexts() {
        return sent.stream().map(Sent::text).toList();
    }
}
