package com.rtmbot.slack.rtm;

import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.WebSocket;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * {@link RtmSession} on the JDK's WebSocket client. Frames are reassembled by
 * the listener and handed to the reading thread through a queue.
 */
@Slf4j
public class JdkRtmSession implements RtmSession, WebSocket.Listener {

    private static final Object CLOSED = new Object();
    private static final Duration CONNECT_TIMEOUT = Duration.ofSeconds(30);
    private static final long SEND_TIMEOUT_SECONDS = 30;

    private final BlockingQueue<Object> inbound = new LinkedBlockingQueue<>();
    private final StringBuilder buffer = new StringBuilder();
    private volatile WebSocket webSocket;
    private volatile boolean closed;

    private JdkRtmSession() {
    }

    /**
     * Factory for sessions sharing one {@link HttpClient}.
     */
    public static RtmSessionFactory factory(HttpClient httpClient) {
        return url -> open(httpClient, url);
    }

    public static JdkRtmSession open(HttpClient httpClient, String url) throws IOException, InterruptedException {
        JdkRtmSession session = new JdkRtmSession();
        try {
            session.webSocket = httpClient.newWebSocketBuilder()
                    .connectTimeout(CONNECT_TIMEOUT)
                    .buildAsync(URI.create(url), session)
                    .get();
        } catch (ExecutionException e) {
            throw new IOException("WebSocket connect failed: " + url, e.getCause());
        }
        log.info("WebSocket connected");
        return session;
    }

    // =========================================================================
    // Listener
    // =========================================================================

    @Override
    public void onOpen(WebSocket webSocket) {
        webSocket.request(1);
    }

    @Override
    public CompletionStage<?> onText(WebSocket webSocket, CharSequence data, boolean last) {
        buffer.append(data);
        if (last) {
            inbound.add(buffer.toString());
            buffer.setLength(0);
        }
        webSocket.request(1);
        return null;
    }

    @Override
    public CompletionStage<?> onClose(WebSocket webSocket, int statusCode, String reason) {
        log.info("WebSocket closed by server: {} {}", statusCode, reason);
        markClosed();
        return null;
    }

    @Override
    public void onError(WebSocket webSocket, Throwable error) {
        log.warn("WebSocket error: {}", error.toString());
        markClosed();
    }

    private void markClosed() {
        closed = true;
        inbound.add(CLOSED);
    }

    // =========================================================================
    // Session
    // =========================================================================

    @Override
    public Optional<String> receive() throws InterruptedException {
        Object next = inbound.take();
        if (next == CLOSED) {
            inbound.add(CLOSED);
            return Optional.empty();
        }
        return Optional.of((String) next);
    }

    @Override
    public void sendText(String frame) throws IOException {
        if (closed) {
            throw new IOException("WebSocket is closed");
        }
        try {
            webSocket.sendText(frame, true).get(SEND_TIMEOUT_SECONDS, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IOException("Interrupted while sending", e);
        } catch (ExecutionException | TimeoutException e) {
            throw new IOException("WebSocket send failed", e);
        }
    }

    @Override
    public void close() {
        WebSocket ws = webSocket;
        if (ws != null && !ws.isOutputClosed()) {
            ws.sendClose(WebSocket.NORMAL_CLOSURE, "bye");
        }
        if (!closed) {
            markClosed();
        }
    }
}
