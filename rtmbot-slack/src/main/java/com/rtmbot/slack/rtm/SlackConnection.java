package com.rtmbot.slack.rtm;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.rtmbot.common.config.BotConfig;
import com.rtmbot.common.config.BotConfigService;
import com.rtmbot.common.infra.RetryRunner;
import com.rtmbot.common.infra.TaskScope;
import com.rtmbot.core.action.Action;
import com.rtmbot.core.correlation.OutboundMessenger;
import com.rtmbot.core.dispatch.EventDispatcher;
import com.rtmbot.core.dispatch.InboundEvent;
import com.rtmbot.core.history.MessageArchiver;
import com.rtmbot.core.identity.IdentityMap;
import com.rtmbot.core.transport.ProtocolViolationException;
import com.rtmbot.slack.api.SlackWebApi;
import com.rtmbot.slack.history.CommandSweeper;
import com.rtmbot.slack.history.HistoryBackfill;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * The connection loop: handshake, read events, dispatch, and reconnect
 * whenever the socket closes.
 * <p>
 * Every handshake rebuilds the identity map and admin set and resets the
 * outbound message counter. History backfill and the command sweep run at
 * most once per process; preloaded actions run once, after the first socket
 * opens.
 */
@Slf4j
public class SlackConnection {

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {
    };

    private final BotConfigService configService;
    private final SlackWebApi api;
    private final RtmSessionFactory sessionFactory;
    private final EventDispatcher dispatcher;
    private final OutboundMessenger messenger;
    private final MessageArchiver archiver;
    private final HistoryBackfill backfill;
    private final CommandSweeper sweeper;
    private final RetryRunner retryRunner;
    private final TaskScope scope;
    private final ObjectMapper objectMapper;

    private final List<Action> preloaded = new ArrayList<>();
    private volatile ConnectionState state = ConnectionState.DISCONNECTED;
    private boolean historyLoaded;
    private boolean sweepStarted;
    private int connections;

    public SlackConnection(BotConfigService configService, SlackWebApi api, RtmSessionFactory sessionFactory,
                           EventDispatcher dispatcher, OutboundMessenger messenger, MessageArchiver archiver,
                           HistoryBackfill backfill, CommandSweeper sweeper, RetryRunner retryRunner,
                           TaskScope scope, ObjectMapper objectMapper) {
        this.configService = configService;
        this.api = api;
        this.sessionFactory = sessionFactory;
        this.dispatcher = dispatcher;
        this.messenger = messenger;
        this.archiver = archiver;
        this.backfill = backfill;
        this.sweeper = sweeper;
        this.retryRunner = retryRunner;
        this.scope = scope;
        this.objectMapper = objectMapper;
    }

    /**
     * Queue actions to run once the first connection is up.
     */
    public synchronized void preload(List<Action> actions) {
        preloaded.addAll(actions);
    }

    public ConnectionState getState() {
        return state;
    }

    public int getConnections() {
        return connections;
    }

    /**
     * Run until interrupted or until something fails.
     */
    public void run() throws Exception {
        while (true) {
            if (Thread.interrupted()) {
                throw new InterruptedException("Connection loop interrupted");
            }
            connectAndServe();
            log.info("Websocket closed");
        }
    }

    /**
     * One pass of the loop: connect, serve events until the socket closes.
     */
    void connectAndServe() throws Exception {
        log.info("Connecting to websocket");
        try (RtmSession session = connect()) {
            runPreloaded();
            serve(session);
        } finally {
            state = ConnectionState.CONNECTING;
        }
    }

    RtmSession connect() throws Exception {
        state = ConnectionState.CONNECTING;
        BotConfig config = configService.loadConfig();
        JsonNode start = retryRunner.execute(api::rtmStart, SlackWebApi.RTM_START);

        IdentityMap identity = Snapshots.toIdentityMap(start);
        dispatcher.bind(identity, resolveAdmins(config.getAdmins(), identity));
        String botUserId = Optional.ofNullable(Snapshots.selfId(start))
                .or(() -> identity.findUserId(config.getName()))
                .orElse(null);
        archiver.setBotUserId(botUserId);

        if (config.isLoadHistory() && !historyLoaded) {
            historyLoaded = true;
            backfill.run(identity);
        }
        if (config.isClearCommands() && !sweepStarted) {
            sweepStarted = true;
            boolean includeDms = config.isClearIncludesDirectMessages();
            scope.fork("command-sweeper", () -> sweeper.run(identity, botUserId, includeDms));
        }

        String url = start.path("url").asText(null);
        if (url == null) {
            throw new ProtocolViolationException("rtm.start reply has no url");
        }
        RtmSession session = sessionFactory.open(url);
        messenger.attach(session);
        connections++;
        state = ConnectionState.CONNECTED;
        return session;
    }

    private Set<String> resolveAdmins(List<String> adminNames, IdentityMap identity) {
        Set<String> ids = new LinkedHashSet<>();
        for (String name : adminNames) {
            Optional<String> id = identity.findUserId(name);
            if (id.isPresent()) {
                ids.add(id.get());
            } else {
                log.warn("Admin {} is not a known user", name);
            }
        }
        return ids;
    }

    private void runPreloaded() throws IOException, InterruptedException {
        List<Action> actions;
        synchronized (this) {
            actions = List.copyOf(preloaded);
            preloaded.clear();
        }
        log.info("Running {} preloaded commands", actions.size());
        for (Action action : actions) {
            dispatcher.execute(action, null);
        }
    }

    void serve(RtmSession session) throws IOException, InterruptedException {
        while (true) {
            Optional<String> frame = session.receive();
            if (frame.isEmpty()) {
                return;
            }
            InboundEvent event = decode(frame.get());
            if (!"message_deleted".equals(event.getSubtype())) {
                log.info("Got event {}", event);
            }
            dispatcher.dispatch(event);
        }
    }

    private InboundEvent decode(String frame) {
        try {
            return new InboundEvent(objectMapper.readValue(frame, MAP_TYPE));
        } catch (JsonProcessingException e) {
            log.error("Undecodable frame: {}", frame);
            throw new ProtocolViolationException("Undecodable frame from socket", e);
        }
    }
}
