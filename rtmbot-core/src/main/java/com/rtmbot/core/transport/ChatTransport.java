package com.rtmbot.core.transport;

import com.rtmbot.core.correlation.DeliveryCallback;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Side-effecting operations actions perform against the chat service.
 * <p>
 * Messages go out over the real-time socket; everything else uses the
 * service's HTTP API.
 */
public interface ChatTransport {

    /**
     * Send text to a conversation, split into chunks if needed. The callback,
     * if any, fires once the last chunk is confirmed.
     */
    void sendMessage(String channelId, String text, DeliveryCallback callback) throws IOException;

    /**
     * Delete a message. With {@code useAdminKey} the admin credential is used
     * and the call is skipped when none is configured.
     */
    void deleteMessage(String channelId, String timestamp, boolean useAdminKey)
            throws IOException, InterruptedException;

    void react(String emoji, String channelId, String timestamp) throws IOException, InterruptedException;

    void uploadFile(Path file, String channelId) throws IOException, InterruptedException;

    /**
     * Open (or fetch) the direct-message session with a user.
     *
     * @return the DM conversation id
     */
    String openDirectMessage(String userId) throws IOException, InterruptedException;
}
