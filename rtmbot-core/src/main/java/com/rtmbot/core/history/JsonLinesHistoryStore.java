package com.rtmbot.core.history;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.List;

/**
 * History persisted as one JSON object per line.
 * <p>
 * The file is read once when the store is opened; afterwards records are
 * served from memory and appended to the file as they arrive.
 */
@Slf4j
public class JsonLinesHistoryStore implements HistoryStore {

    private final Path file;
    private final ObjectMapper objectMapper;
    private final InMemoryHistoryStore index = new InMemoryHistoryStore();

    private JsonLinesHistoryStore(Path file, ObjectMapper objectMapper) {
        this.file = file;
        this.objectMapper = objectMapper;
    }

    /**
     * Open (or create) a store at the given path.
     */
    public static JsonLinesHistoryStore open(Path file) throws IOException {
        JsonLinesHistoryStore store = new JsonLinesHistoryStore(file, new ObjectMapper());
        store.load();
        return store;
    }

    private void load() throws IOException {
        if (file.getParent() != null) {
            Files.createDirectories(file.getParent());
        }
        if (!Files.exists(file)) {
            Files.createFile(file);
            return;
        }
        int lineNo = 0;
        for (String line : Files.readAllLines(file, StandardCharsets.UTF_8)) {
            lineNo++;
            if (line.isBlank()) {
                continue;
            }
            try {
                index.save(objectMapper.readValue(line, HistoryRecord.class));
            } catch (IOException e) {
                throw new IOException("Corrupt history line " + lineNo + " in " + file, e);
            }
        }
        log.info("Loaded {} history records from {}", index.size(), file);
    }

    @Override
    public synchronized boolean save(HistoryRecord record) throws IOException {
        if (!index.save(record)) {
            return false;
        }
        Files.writeString(file, objectMapper.writeValueAsString(record) + "\n",
                StandardCharsets.UTF_8, StandardOpenOption.APPEND);
        return true;
    }

    @Override
    public List<HistoryRecord> query(String channelName, String userId) {
        return index.query(channelName, userId);
    }

    @Override
    public synchronized void clear() throws IOException {
        index.clear();
        Files.writeString(file, "", StandardCharsets.UTF_8, StandardOpenOption.TRUNCATE_EXISTING);
    }

    @Override
    public int size() {
        return index.size();
    }

    public Path getFile() {
        return file;
    }
}
