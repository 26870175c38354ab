package com.rtmbot.slack.history;

import com.rtmbot.common.infra.RetryRunner;
import com.rtmbot.core.dispatch.InboundEvent;
import com.rtmbot.core.grammar.CommandGrammar;
import com.rtmbot.core.identity.IdentityMap;
import com.rtmbot.slack.api.SlackWebApi;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Deletes the bot's past messages and the commands users sent it.
 * <p>
 * Bot messages are deleted with the bot token. Channel messages that parse
 * as commands are deleted with the admin token, so nothing happens to them
 * when no admin token is configured. Direct messages from users are kept.
 */
@Slf4j
public class CommandSweeper {

    private static final int PROGRESS_INTERVAL = 100;

    private final HistoryPager pager;
    private final SlackWebApi api;
    private final CommandGrammar grammar;
    private final RetryRunner.Sleeper sleeper;
    private final long pacingMillis;

    record Deletion(String channelId, String timestamp, boolean useAdminKey) {
    }

    public CommandSweeper(HistoryPager pager, SlackWebApi api, CommandGrammar grammar,
                          RetryRunner.Sleeper sleeper, long pacingMillis) {
        this.pager = pager;
        this.api = api;
        this.grammar = grammar;
        this.sleeper = sleeper;
        this.pacingMillis = pacingMillis;
    }

    /**
     * @return number of delete calls made
     */
    public int run(IdentityMap identity, String botUserId, boolean includeDirectMessages)
            throws IOException, InterruptedException {
        List<Deletion> deletions = plan(pager.fetchAll(identity, includeDirectMessages), botUserId);
        log.info("Found {} messages to delete", deletions.size());
        int deleted = 0;
        for (Deletion deletion : deletions) {
            sleeper.sleep(pacingMillis);
            api.deleteMessage(deletion.channelId(), deletion.timestamp(), deletion.useAdminKey());
            deleted++;
            if (deleted % PROGRESS_INTERVAL == 0) {
                log.info("Deleted {} messages so far", deleted);
            }
        }
        return deleted;
    }

    List<Deletion> plan(Map<String, List<InboundEvent>> history, String botUserId) {
        List<Deletion> deletions = new ArrayList<>();
        for (Map.Entry<String, List<InboundEvent>> entry : history.entrySet()) {
            String channelId = entry.getKey();
            boolean directMessage = IdentityMap.isDirectMessage(channelId);
            for (InboundEvent message : entry.getValue()) {
                if (botUserId != null && botUserId.equals(message.getUser())) {
                    deletions.add(new Deletion(channelId, message.getTimestamp(), false));
                } else if (!directMessage && grammar.matches(message.getText(), false)) {
                    deletions.add(new Deletion(channelId, message.getTimestamp(), true));
                }
            }
        }
        return deletions;
    }
}
