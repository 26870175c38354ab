package com.rtmbot.app;

import com.rtmbot.core.registry.BotPlugin;
import com.rtmbot.slack.SlackBot;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Installs every plugin bean and runs the bot until it fails.
 */
@Slf4j
@Component
public class BotRunner implements CommandLineRunner {

    private final SlackBot bot;
    private final List<BotPlugin> plugins;

    public BotRunner(SlackBot bot, List<BotPlugin> plugins) {
        this.bot = bot;
        this.plugins = plugins;
    }

    @Override
    public void run(String... args) throws Exception {
        plugins.forEach(bot::install);
        log.info("Starting bot with {} plugin(s)", plugins.size());
        bot.run();
    }
}
