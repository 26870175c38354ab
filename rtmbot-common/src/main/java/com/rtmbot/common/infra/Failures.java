package com.rtmbot.common.infra;

import java.io.InterruptedIOException;
import java.net.ConnectException;
import java.net.NoRouteToHostException;
import java.net.SocketTimeoutException;
import java.net.UnknownHostException;
import java.net.http.HttpTimeoutException;
import java.util.concurrent.CancellationException;

/**
 * Classifies failures for logging and retry decisions.
 *
 * <h3>Categories:</h3>
 * <ul>
 * <li><strong>FATAL</strong>: OOM, stack overflow, linkage errors</li>
 * <li><strong>CONFIG</strong>: bad or missing credentials and settings</li>
 * <li><strong>TRANSIENT</strong>: network timeout, DNS failure, rate limit</li>
 * <li><strong>ABORT</strong>: interrupted, cancelled</li>
 * </ul>
 */
public final class Failures {

    private Failures() {
    }

    public enum Category {
        FATAL,
        CONFIG,
        TRANSIENT,
        ABORT,
        UNKNOWN
    }

    /**
     * Classify a throwable into a category.
     */
    public static Category classify(Throwable t) {
        if (t == null) {
            return Category.UNKNOWN;
        }

        if (t instanceof VirtualMachineError || t instanceof LinkageError) {
            return Category.FATAL;
        }

        for (Throwable current = t; current != null; current = current.getCause()) {
            if (current instanceof InterruptedException
                    || current instanceof CancellationException
                    || (current instanceof InterruptedIOException
                            && !(current instanceof SocketTimeoutException))) {
                return Category.ABORT;
            }
            if (current instanceof SocketTimeoutException
                    || current instanceof HttpTimeoutException
                    || current instanceof ConnectException
                    || current instanceof UnknownHostException
                    || current instanceof NoRouteToHostException) {
                return Category.TRANSIENT;
            }
        }

        String message = messageChain(t).toLowerCase();
        if (message.contains("invalid_auth")
                || message.contains("not_authed")
                || message.contains("token_revoked")
                || message.contains("invalid config")) {
            return Category.CONFIG;
        }
        if (message.contains("timeout")
                || message.contains("timed out")
                || message.contains("connection reset")
                || message.contains("connection refused")
                || message.contains("ratelimited")
                || message.contains("rate limit")
                || message.contains("429")
                || message.contains("502")
                || message.contains("503")) {
            return Category.TRANSIENT;
        }
        return Category.UNKNOWN;
    }

    public static boolean isTransient(Throwable t) {
        return classify(t) == Category.TRANSIENT;
    }

    /**
     * Build a message string from the full cause chain.
     */
    public static String messageChain(Throwable t) {
        StringBuilder sb = new StringBuilder();
        Throwable current = t;
        int depth = 0;
        while (current != null && depth < 10) {
            if (!sb.isEmpty()) {
                sb.append(" -> ");
            }
            sb.append(current.getClass().getSimpleName());
            if (current.getMessage() != null) {
                sb.append(": ").append(current.getMessage());
            }
            current = current.getCause();
            depth++;
        }
        return sb.toString();
    }
}
