package com.rtmbot.slack.history;

import com.rtmbot.core.dispatch.InboundEvent;
import com.rtmbot.core.history.HistoryStore;
import com.rtmbot.core.history.MessageArchiver;
import com.rtmbot.core.identity.IdentityMap;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.util.List;
import java.util.Map;

/**
 * Replaces the archive with the service's full channel history.
 */
@Slf4j
public class HistoryBackfill {

    private final HistoryPager pager;
    private final MessageArchiver archiver;
    private final HistoryStore store;

    public HistoryBackfill(HistoryPager pager, MessageArchiver archiver) {
        this.pager = pager;
        this.archiver = archiver;
        this.store = archiver.getStore();
    }

    /**
     * @return number of messages archived
     */
    public int run(IdentityMap identity) throws IOException, InterruptedException {
        store.clear();
        log.info("History cleared");
        Map<String, List<InboundEvent>> history = pager.fetchAll(identity, false);
        int archived = 0;
        for (Map.Entry<String, List<InboundEvent>> entry : history.entrySet()) {
            String channelName = identity.conversationName(entry.getKey());
            for (InboundEvent message : entry.getValue()) {
                if (message.getUser() == null) {
                    log.debug("Skipping message without user: {}", message);
                    continue;
                }
                if (archiver.archive(message.getUser(), channelName, message.getText(), message.getTimestamp())) {
                    archived++;
                }
            }
        }
        log.info("Archived {} messages", archived);
        return archived;
    }
}
