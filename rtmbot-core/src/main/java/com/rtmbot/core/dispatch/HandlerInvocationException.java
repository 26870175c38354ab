package com.rtmbot.core.dispatch;

/**
 * A registered handler threw while handling a message.
 */
public class HandlerInvocationException extends RuntimeException {

    private final String handlerName;

    public HandlerInvocationException(String handlerName, String userId, String channel, Throwable cause) {
        super("Handler " + handlerName + " failed for user " + userId + " in "
                + (channel != null ? channel : "direct message") + ": " + cause.getMessage(), cause);
        this.handlerName = handlerName;
    }

    public String getHandlerName() {
        return handlerName;
    }
}
