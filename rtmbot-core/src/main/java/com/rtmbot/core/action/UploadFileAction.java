package com.rtmbot.core.action;

import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Upload a local file to a channel or to a user's DM, optionally deleting the
 * local copy afterwards.
 */
@Slf4j
public final class UploadFileAction implements Action {

    private final Path file;
    private final String channelName;
    private final String userId;
    private final boolean deleteAfter;

    public UploadFileAction(Path file, String channelName, String userId, boolean deleteAfter) {
        this.file = file;
        this.channelName = channelName;
        this.userId = userId;
        this.deleteAfter = deleteAfter;
    }

    @Override
    public Action execute(ActionContext context) throws IOException, InterruptedException {
        String channelId;
        if (channelName != null) {
            channelId = context.identity().channelId(channelName);
        } else if (userId != null) {
            channelId = SendMessageAction.directMessageChannel(context, userId);
        } else {
            channelId = context.requireEvent("UploadFile").getChannel();
        }
        context.transport().uploadFile(file, channelId);
        if (deleteAfter) {
            Files.deleteIfExists(file);
            log.debug("Deleted uploaded file {}", file);
        }
        return null;
    }

    @Override
    public String toString() {
        return "UploadFile[" + file.getFileName() + "]";
    }
}
