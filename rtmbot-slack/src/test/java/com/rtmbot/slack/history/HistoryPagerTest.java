package com.rtmbot.slack.history;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.rtmbot.common.config.BotConfig;
import com.rtmbot.core.dispatch.InboundEvent;
import com.rtmbot.core.identity.IdentityMap;
import com.rtmbot.core.transport.ProtocolViolationException;
import com.rtmbot.slack.FakeSlackApiClient;
import com.rtmbot.slack.api.SlackWebApi;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class HistoryPagerTest {

    private FakeSlackApiClient client;
    private HistoryPager pager;
    private final List<Long> sleeps = new ArrayList<>();

    @BeforeEach
    void setUp() {
        BotConfig config = new BotConfig();
        config.setToken("xoxb-test");
        client = new FakeSlackApiClient();
        pager = new HistoryPager(new SlackWebApi(client, config), new ObjectMapper(), sleeps::add, 1000);
    }

    private static String msg(String ts, String text) {
        return "{\"type\":\"message\",\"user\":\"U1\",\"text\":\"" + text + "\",\"ts\":\"" + ts + "\"}";
    }

    @Test
    void fetch_overlappingPages_deduplicated() throws Exception {
        client.reply("channels.history", "{\"ok\":true,\"has_more\":true,\"messages\":["
                + msg("3.000000", "m3") + "," + msg("2.000000", "m2") + "]}");
        client.reply("channels.history", "{\"ok\":true,\"has_more\":false,\"messages\":["
                + msg("2.000000", "m2") + "," + msg("1.000000", "m1") + "]}");

        List<InboundEvent> messages = pager.fetch("C1");

        assertEquals(List.of("m3", "m2", "m1"), messages.stream().map(InboundEvent::getText).toList());
        assertEquals(List.of(1000L, 1000L), sleeps);

        List<FakeSlackApiClient.Call> calls = client.callsTo("channels.history");
        assertEquals(Map.of("channel", "C1", "inclusive", "false"), calls.get(0).params());
        assertEquals("2.000000", calls.get(1).params().get("latest"));
        assertEquals("xoxb-test", calls.get(0).token());
    }

    @Test
    void fetch_skipsNonMessages() throws Exception {
        client.reply("groups.history", "{\"ok\":true,\"has_more\":false,\"messages\":["
                + msg("5.0", "keep") + ","
                + "{\"type\":\"message\",\"subtype\":\"channel_join\",\"user\":\"U2\",\"text\":\"joined\",\"ts\":\"4.0\"},"
                + "{\"type\":\"message\",\"bot_id\":\"B1\",\"text\":\"bot\",\"ts\":\"3.0\"}]}");

        List<InboundEvent> messages = pager.fetch("G1");

        assertEquals(List.of("keep"), messages.stream().map(InboundEvent::getText).toList());
    }

    @Test
    void fetch_missingHasMore_protocolViolation() {
        client.reply("im.history", "{\"ok\":false,\"error\":\"ratelimited\"}");

        assertThrows(ProtocolViolationException.class, () -> pager.fetch("D1"));
    }

    @Test
    void fetch_malformedTimestamp_protocolViolation() {
        client.reply("channels.history", "{\"ok\":true,\"has_more\":false,\"messages\":["
                + msg("not-a-ts", "odd") + "]}");

        ProtocolViolationException e = assertThrows(ProtocolViolationException.class, () -> pager.fetch("C1"));
        assertTrue(e.getMessage().contains("not-a-ts"));
        assertInstanceOf(NumberFormatException.class, e.getCause());
    }

    @Test
    void fetchAll_channelsAndOptionalDirectMessages() throws Exception {
        IdentityMap identity = new IdentityMap();
        identity.addChannel("general", "C1");
        identity.addUser("ada", "U1");
        identity.addDirectMessage("U1", "D1");
        client.reply("channels.history:C1", "{\"ok\":true,\"has_more\":false,\"messages\":[" + msg("1.0", "hi") + "]}");
        client.reply("im.history:D1", "{\"ok\":true,\"has_more\":false,\"messages\":[" + msg("2.0", "dm") + "]}");

        Map<String, List<InboundEvent>> channelsOnly = pager.fetchAll(identity, false);
        assertEquals(List.of("C1"), List.copyOf(channelsOnly.keySet()));

        client.reply("channels.history:C1", "{\"ok\":true,\"has_more\":false,\"messages\":[]}");
        Map<String, List<InboundEvent>> withDms = pager.fetchAll(identity, true);
        assertEquals("dm", withDms.get("D1").get(0).getText());
    }
}
