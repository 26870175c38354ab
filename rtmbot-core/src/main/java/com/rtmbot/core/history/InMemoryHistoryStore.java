package com.rtmbot.core.history;

import java.math.BigDecimal;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * History kept in memory for the lifetime of the process.
 */
public class InMemoryHistoryStore implements HistoryStore {

    static final Comparator<HistoryRecord> BY_TIMESTAMP = Comparator.comparing(
            r -> new BigDecimal(r.timestamp()));

    private final Map<String, HistoryRecord> records = new LinkedHashMap<>();

    @Override
    public synchronized boolean save(HistoryRecord record) {
        return records.putIfAbsent(record.timestamp(), record) == null;
    }

    @Override
    public synchronized List<HistoryRecord> query(String channelName, String userId) {
        return records.values().stream()
                .filter(r -> channelName == null || channelName.equals(r.channelName()))
                .filter(r -> userId == null || userId.equals(r.userId()))
                .sorted(BY_TIMESTAMP)
                .toList();
    }

    @Override
    public synchronized void clear() {
        records.clear();
    }

    @Override
    public synchronized int size() {
        return records.size();
    }
}
