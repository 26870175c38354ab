package com.rtmbot.core.correlation;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class OutboundMessengerTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private final List<String> frames = new ArrayList<>();
    private OutboundMessenger messenger;

    @BeforeEach
    void setUp() {
        messenger = new OutboundMessenger(mapper, 4000);
        messenger.attach(frames::add);
    }

    private JsonNode frame(int index) throws Exception {
        return mapper.readTree(frames.get(index));
    }

    @Test
    void send_shortText_oneFrame() throws Exception {
        messenger.send("C1", "hello", null);

        assertEquals(1, frames.size());
        JsonNode frame = frame(0);
        assertEquals(0, frame.get("id").asLong());
        assertEquals("message", frame.get("type").asText());
        assertEquals("C1", frame.get("channel").asText());
        assertEquals("hello", frame.get("text").asText());
        assertEquals(0, messenger.getPendingResponses().size());
    }

    @Test
    void send_9000Chars_threeFramesOnlyLastRegistered() throws Exception {
        String text = "a".repeat(9000);
        DeliveryCallback callback = () -> null;

        messenger.send("C1", text, callback);

        assertEquals(3, frames.size());
        assertEquals(4000, frame(0).get("text").asText().length());
        assertEquals(4000, frame(1).get("text").asText().length());
        assertEquals(1000, frame(2).get("text").asText().length());
        assertEquals(List.of(0L, 1L, 2L), List.of(frame(0).get("id").asLong(), frame(1).get("id").asLong(),
                frame(2).get("id").asLong()));

        PendingResponses pending = messenger.getPendingResponses();
        assertEquals(1, pending.size());
        assertTrue(pending.get(2).isPresent());
        assertSame(callback, pending.get(2).get().callback());
        assertEquals("C1", pending.get(2).get().channelId());
    }

    @Test
    void send_emptyText_nothingSentNothingRegistered() throws Exception {
        messenger.send("C1", "", () -> null);

        assertTrue(frames.isEmpty());
        assertEquals(0, messenger.getPendingResponses().size());
        assertEquals(0, messenger.peekNextId());
    }

    @Test
    void send_idsIncreaseAcrossMessages() throws Exception {
        messenger.send("C1", "one", null);
        messenger.send("C2", "two", null);

        assertEquals(1, frame(1).get("id").asLong());
        assertEquals(2, messenger.peekNextId());
    }

    @Test
    void attach_resetsCounterAndDropsPending() throws Exception {
        messenger.send("C1", "one", () -> null);
        List<String> second = new ArrayList<>();

        messenger.attach(second::add);
        messenger.send("C1", "two", null);

        assertEquals(0, mapper.readTree(second.get(0)).get("id").asLong());
        assertEquals(0, messenger.getPendingResponses().size());
    }

    @Test
    void send_withoutSocket_throws() {
        OutboundMessenger detached = new OutboundMessenger(mapper, 10);

        assertThrows(IllegalStateException.class, () -> detached.send("C1", "x", null));
    }

    @Test
    void chunk_surrogatePairAtLimit_keptWhole() {
        String text = "a".repeat(3999) + "\uD83D\uDE00" + "b";

        List<String> chunks = OutboundMessenger.chunk(text, 4000);

        assertEquals(2, chunks.size());
        assertEquals(3999, chunks.get(0).length());
        assertEquals("\uD83D\uDE00b", chunks.get(1));
        assertEquals(text, String.join("", chunks));
    }

    @Test
    void chunk_limitOne_neverSplitsPair() {
        assertEquals(List.of("a", "\uD83D\uDE00", "b"), OutboundMessenger.chunk("a\uD83D\uDE00b", 1));
    }

    @Test
    void chunk_exactMultiple() {
        assertEquals(List.of("ab", "cd"), OutboundMessenger.chunk("abcd", 2));
        assertEquals(List.of("abc"), OutboundMessenger.chunk("abc", 4000));
        assertTrue(OutboundMessenger.chunk(null, 10).isEmpty());
    }

    @Test
    void pendingResponses_removeOnce() {
        PendingResponses pending = new PendingResponses();
        pending.register(7, new PendingResponse("C1", () -> null));

        assertTrue(pending.remove(7));
        assertFalse(pending.remove(7));
        assertTrue(pending.get(7).isEmpty());
    }
}
