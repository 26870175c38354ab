package com.rtmbot.slack.rtm;

import com.fasterxml.jackson.databind.JsonNode;
import com.rtmbot.core.identity.IdentityMap;

/**
 * Builds the identity map from an {@code rtm.start} reply.
 */
public final class Snapshots {

    private Snapshots() {
    }

    public static IdentityMap toIdentityMap(JsonNode start) {
        IdentityMap identity = new IdentityMap();
        for (JsonNode channel : start.path("channels")) {
            identity.addChannel(channel.path("name").asText(), channel.path("id").asText());
        }
        for (JsonNode group : start.path("groups")) {
            identity.addChannel(group.path("name").asText(), group.path("id").asText());
        }
        for (JsonNode user : start.path("users")) {
            String id = user.path("id").asText();
            identity.addUser(user.path("name").asText(), id);
            identity.addDisplayName(user.path("profile").path("display_name_normalized").asText(""), id);
        }
        for (JsonNode im : start.path("ims")) {
            if (im.hasNonNull("user") && im.hasNonNull("id")) {
                identity.addDirectMessage(im.path("user").asText(), im.path("id").asText());
            }
        }
        return identity;
    }

    /**
     * The bot's own user id from the {@code self} block, if present.
     */
    public static String selfId(JsonNode start) {
        return start.path("self").path("id").asText(null);
    }
}
