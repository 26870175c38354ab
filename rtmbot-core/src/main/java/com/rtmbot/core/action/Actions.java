package com.rtmbot.core.action;

import com.rtmbot.core.history.HistoryRecord;

import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import java.util.function.Function;

/**
 * Shorthand constructors for the built-in actions.
 */
public final class Actions {

    private Actions() {
    }

    /** Send to the channel the triggering message came from. */
    public static SendMessageAction reply(String text) {
        return new SendMessageAction(null, null, text);
    }

    public static SendMessageAction toChannel(String channelName, String text) {
        return new SendMessageAction(channelName, null, text);
    }

    public static SendMessageAction toUser(String userId, String text) {
        return new SendMessageAction(null, userId, text);
    }

    /**
     * Reply in the channel when there is one, otherwise in the user's DM.
     */
    public static SendMessageAction respond(String channelName, String userId, String text) {
        return new SendMessageAction(channelName, userId, text);
    }

    public static ActionSequence sequence(Action... actions) {
        return new ActionSequence(Arrays.asList(actions));
    }

    public static ActionSequence sequence(List<Action> actions) {
        return new ActionSequence(actions);
    }

    public static ReactAction react(String emoji) {
        return new ReactAction(emoji);
    }

    public static DeleteMessageAction deleteTriggering() {
        return DeleteMessageAction.triggeringMessage();
    }

    public static UploadFileAction upload(Path file, String channelName, String userId, boolean deleteAfter) {
        return new UploadFileAction(file, channelName, userId, deleteAfter);
    }

    public static HistoryQueryAction history(String channelName, String userId,
                                             Function<List<HistoryRecord>, Action> continuation) {
        return new HistoryQueryAction(channelName, userId, continuation);
    }
}
