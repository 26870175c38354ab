package com.rtmbot.core.grammar;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Conversion between user ids and the {@code <@U...>} mention markup.
 */
public final class Mentions {

    private Mentions() {
    }

    private static final Pattern MENTION_RE = Pattern.compile("<@(U[0-9A-Z]{8})>$");

    /**
     * User id referenced by a mention, or empty if the text is not a mention.
     */
    public static Optional<String> toUserId(String mention) {
        if (mention == null) {
            return Optional.empty();
        }
        Matcher m = MENTION_RE.matcher(mention);
        return m.lookingAt() ? Optional.of(m.group(1)) : Optional.empty();
    }

    public static String fromUserId(String userId) {
        return "<@" + userId + ">";
    }
}
