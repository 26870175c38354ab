package com.rtmbot.slack.rtm;

import java.io.IOException;

/**
 * Opens a real-time socket to the URL handed out by {@code rtm.start}.
 */
@FunctionalInterface
public interface RtmSessionFactory {

    RtmSession open(String url) throws IOException, InterruptedException;
}
