package com.rtmbot.slack;

import com.rtmbot.core.correlation.DeliveryCallback;
import com.rtmbot.core.correlation.OutboundMessenger;
import com.rtmbot.core.transport.ChatTransport;
import com.rtmbot.slack.api.SlackWebApi;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Messages over the RTM socket, everything else over the Web API.
 */
@Slf4j
public class SlackTransport implements ChatTransport {

    private final OutboundMessenger messenger;
    private final SlackWebApi api;

    public SlackTransport(OutboundMessenger messenger, SlackWebApi api) {
        this.messenger = messenger;
        this.api = api;
    }

    @Override
    public void sendMessage(String channelId, String text, DeliveryCallback callback) throws IOException {
        log.info("[{}] Sending message: {}", channelId, text);
        messenger.send(channelId, text, callback);
    }

    @Override
    public void deleteMessage(String channelId, String timestamp, boolean useAdminKey)
            throws IOException, InterruptedException {
        api.deleteMessage(channelId, timestamp, useAdminKey);
    }

    @Override
    public void react(String emoji, String channelId, String timestamp) throws IOException, InterruptedException {
        api.addReaction(emoji, channelId, timestamp);
    }

    @Override
    public void uploadFile(Path file, String channelId) throws IOException, InterruptedException {
        log.info("[{}] Uploading {}", channelId, file.getFileName());
        api.uploadFile(file, channelId);
    }

    @Override
    public String openDirectMessage(String userId) throws IOException, InterruptedException {
        return api.openDirectMessage(userId);
    }
}
