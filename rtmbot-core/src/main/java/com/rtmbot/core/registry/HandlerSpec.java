package com.rtmbot.core.registry;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Set;
import java.util.regex.Pattern;

/**
 * A handler together with its routing metadata.
 * <p>
 * With an {@code expression} the handler is a command: it runs when a message
 * matches and is looked up by {@code name}. Without one it is unfiltered and
 * sees every channel message that is not a command.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class HandlerSpec {

    private String name;
    private Handler handler;
    @Builder.Default
    private String doc = "";
    /** Allowed channel names; {@code null} allows every channel. */
    private Set<String> channels;
    private boolean adminOnly;
    private boolean includeTimestamp;
    private Pattern expression;
    private int priority;

    public boolean isUnfiltered() {
        return expression == null;
    }

    /**
     * Whether the handler may run in the given channel. Direct messages
     * ({@code null} channel name) are only governed by the admin flag.
     */
    public boolean allowsChannel(String channelName) {
        return channels == null || channelName == null || channels.contains(channelName);
    }

    public boolean hasDoc() {
        return doc != null && !doc.isEmpty();
    }
}
