package com.rtmbot.app.config;

import com.rtmbot.common.config.BotConfig;
import com.rtmbot.common.config.BotConfigService;
import com.rtmbot.core.history.HistoryStore;
import com.rtmbot.core.history.InMemoryHistoryStore;
import com.rtmbot.core.history.JsonLinesHistoryStore;
import com.rtmbot.slack.SlackBot;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Spring configuration for the bot.
 */
@Slf4j
@Configuration
public class BotBeanConfig {

    @Value("${rtmbot.config.path:~/.rtmbot/config.json}")
    private String configPath;

    @Bean
    public BotConfigService botConfigService() {
        String resolvedPath = configPath;
        if (resolvedPath.startsWith("~")) {
            resolvedPath = System.getProperty("user.home") + resolvedPath.substring(1);
        }
        return new BotConfigService(Path.of(resolvedPath));
    }

    @Bean
    public HistoryStore historyStore(BotConfigService configService) throws IOException {
        BotConfig config = configService.loadConfig();
        if (config.getHistoryStorePath() == null || config.getHistoryStorePath().isBlank()) {
            log.info("No history store path configured, keeping history in memory");
            return new InMemoryHistoryStore();
        }
        return JsonLinesHistoryStore.open(Path.of(config.getHistoryStorePath()));
    }

    @Bean
    public SlackBot slackBot(BotConfigService configService, HistoryStore historyStore) {
        return SlackBot.create(configService, historyStore);
    }
}
