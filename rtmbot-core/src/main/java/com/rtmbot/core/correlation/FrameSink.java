package com.rtmbot.core.correlation;

import java.io.IOException;

/**
 * Writes one text frame to the real-time socket.
 */
@FunctionalInterface
public interface FrameSink {

    void sendText(String frame) throws IOException;
}
