package com.rtmbot.slack.rtm;

import com.rtmbot.core.correlation.FrameSink;

import java.util.Optional;

/**
 * An open real-time socket.
 */
public interface RtmSession extends FrameSink, AutoCloseable {

    /**
     * Block until the next text frame arrives.
     *
     * @return the frame, or empty once the socket has closed
     */
    Optional<String> receive() throws InterruptedException;

    @Override
    void close();
}
