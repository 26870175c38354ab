package com.rtmbot.core.history;

import java.io.IOException;
import java.util.List;

/**
 * Long-term message history.
 */
public interface HistoryStore {

    /**
     * Store a record.
     *
     * @return false if a record with the same timestamp already exists
     */
    boolean save(HistoryRecord record) throws IOException;

    /**
     * Records matching the given filters, oldest first. A {@code null} filter
     * matches everything.
     */
    List<HistoryRecord> query(String channelName, String userId) throws IOException;

    /**
     * Remove every record.
     */
    void clear() throws IOException;

    int size();
}
