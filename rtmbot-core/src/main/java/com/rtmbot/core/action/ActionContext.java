package com.rtmbot.core.action;

import com.rtmbot.core.dispatch.InboundEvent;
import com.rtmbot.core.history.HistoryStore;
import com.rtmbot.core.identity.IdentityMap;
import com.rtmbot.core.transport.ChatTransport;

import java.util.Optional;

/**
 * What an action can reach while it runs. {@code event} is the event being
 * handled, or {@code null} for actions queued before the first connection.
 */
public record ActionContext(ChatTransport transport, IdentityMap identity, HistoryStore history,
                            InboundEvent event) {

    public Optional<InboundEvent> triggeringEvent() {
        return Optional.ofNullable(event);
    }

    InboundEvent requireEvent(String actionName) {
        if (event == null) {
            throw new IllegalStateException(actionName + " needs a triggering event");
        }
        return event;
    }
}
