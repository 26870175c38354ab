package com.rtmbot.slack.api;

import java.io.IOException;

/**
 * The Web API answered HTTP 429.
 */
public class RateLimitedException extends IOException {

    private final long retryAfterMillis;

    public RateLimitedException(String method, long retryAfterMillis) {
        super("HTTP 429 ratelimited calling " + method + " (retry after " + retryAfterMillis + "ms)");
        this.retryAfterMillis = retryAfterMillis;
    }

    public long getRetryAfterMillis() {
        return retryAfterMillis;
    }

    /**
     * Retry-After hint of a failure, or -1 if it carries none.
     */
    public static long retryAfterOf(Throwable t) {
        for (Throwable cur = t; cur != null; cur = cur.getCause()) {
            if (cur instanceof RateLimitedException r) {
                return r.getRetryAfterMillis();
            }
        }
        return -1;
    }
}
