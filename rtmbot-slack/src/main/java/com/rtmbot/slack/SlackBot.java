package com.rtmbot.slack;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.rtmbot.common.config.BotConfig;
import com.rtmbot.common.config.BotConfigService;
import com.rtmbot.common.infra.RetryRunner;
import com.rtmbot.common.infra.TaskScope;
import com.rtmbot.core.action.Action;
import com.rtmbot.core.action.ActionExecutor;
import com.rtmbot.core.correlation.OutboundMessenger;
import com.rtmbot.core.dispatch.EventDispatcher;
import com.rtmbot.core.grammar.CommandGrammar;
import com.rtmbot.core.history.HistoryStore;
import com.rtmbot.core.history.MessageArchiver;
import com.rtmbot.core.registry.BotPlugin;
import com.rtmbot.core.registry.HandlerRegistry;
import com.rtmbot.core.registry.HandlerSpec;
import com.rtmbot.slack.api.HttpSlackApiClient;
import com.rtmbot.slack.api.RateLimitedException;
import com.rtmbot.slack.api.SlackApiClient;
import com.rtmbot.slack.api.SlackWebApi;
import com.rtmbot.slack.history.CommandSweeper;
import com.rtmbot.slack.history.HistoryBackfill;
import com.rtmbot.slack.history.HistoryPager;
import com.rtmbot.slack.rtm.JdkRtmSession;
import com.rtmbot.slack.rtm.RtmSessionFactory;
import com.rtmbot.slack.rtm.SlackConnection;
import lombok.extern.slf4j.Slf4j;

import java.net.http.HttpClient;
import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.ExecutionException;

/**
 * Entry point for running a Slack bot: register handlers or plugins, queue
 * any startup actions, then {@link #run()}.
 */
@Slf4j
public class SlackBot {

    private final EventDispatcher dispatcher;
    private final SlackConnection connection;
    private final TaskScope scope;

    public SlackBot(BotConfigService configService, HistoryStore historyStore, SlackApiClient apiClient,
                    RtmSessionFactory sessionFactory, RetryRunner.Sleeper sleeper) {
        BotConfig config = configService.loadConfig();
        ObjectMapper objectMapper = new ObjectMapper();

        SlackWebApi api = new SlackWebApi(apiClient, config);
        CommandGrammar grammar = new CommandGrammar(config.getAlert());
        OutboundMessenger messenger = new OutboundMessenger(objectMapper, config.getChunkLimit());
        MessageArchiver archiver = new MessageArchiver(historyStore, config.getAlert());
        this.dispatcher = new EventDispatcher(grammar, new HandlerRegistry(), new ActionExecutor(),
                new SlackTransport(messenger, api), messenger.getPendingResponses(), archiver);

        HistoryPager pager = new HistoryPager(api, objectMapper, sleeper, config.getPacingMillis());
        BotConfig.RetryConfig retry = config.getRetry();
        RetryRunner retryRunner = new RetryRunner(
                new RetryRunner.Config(retry.getAttempts(), retry.getMinDelayMillis(), retry.getMaxDelayMillis()),
                null, RateLimitedException::retryAfterOf, sleeper);

        this.scope = new TaskScope("rtmbot");
        this.connection = new SlackConnection(configService, api, sessionFactory, dispatcher, messenger, archiver,
                new HistoryBackfill(pager, archiver),
                new CommandSweeper(pager, api, grammar, sleeper, config.getPacingMillis()),
                retryRunner, scope, objectMapper);
    }

    /**
     * A bot talking to the real service.
     */
    public static SlackBot create(BotConfigService configService, HistoryStore historyStore) {
        BotConfig config = configService.loadConfig();
        HttpClient httpClient = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(30))
                .build();
        return new SlackBot(configService, historyStore,
                new HttpSlackApiClient(httpClient, config.getApiBaseUrl(), new ObjectMapper()),
                JdkRtmSession.factory(httpClient), Thread::sleep);
    }

    public void register(HandlerSpec spec) {
        dispatcher.register(spec);
    }

    public void install(BotPlugin plugin) {
        plugin.registerHandlers(dispatcher);
        log.info("Installed plugin {}", plugin.getName());
    }

    /**
     * Queue actions to run once the bot first connects.
     */
    public void preload(Action... actions) {
        connection.preload(Arrays.asList(actions));
    }

    public void preload(List<Action> actions) {
        connection.preload(actions);
    }

    /**
     * Connect and serve until a task fails. Any failure in the connection loop
     * or a background task stops every task and is rethrown here.
     */
    public void run() throws ExecutionException, InterruptedException {
        try (scope) {
            scope.fork("rtm-connection", connection::run);
            scope.join();
        }
    }

    public EventDispatcher getDispatcher() {
        return dispatcher;
    }

    public SlackConnection getConnection() {
        return connection;
    }
}
