package com.rtmbot.common.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Loads and caches the bot configuration.
 * <p>
 * The file is JSON; {@code ${VAR}} and {@code ${VAR:-default}} references are
 * substituted from the environment before parsing. Credentials missing from
 * the file fall back to {@code SLACK_TOKEN}, {@code SLACK_ADMIN_TOKEN} and
 * {@code BOT_NAME}.
 */
@Slf4j
public class BotConfigService {

    public static final String ENV_TOKEN = "SLACK_TOKEN";
    public static final String ENV_ADMIN_TOKEN = "SLACK_ADMIN_TOKEN";
    public static final String ENV_BOT_NAME = "BOT_NAME";

    private static final Duration DEFAULT_CACHE_TTL = Duration.ofSeconds(5);
    private static final Pattern ENV_VAR_PATTERN = Pattern.compile("\\$\\{([^}:]+)(?::-(.*?))?}");

    private final ObjectMapper objectMapper;
    private final Cache<String, BotConfig> cache;
    private final Path configPath;
    private final Function<String, String> env;

    public BotConfigService(Path configPath) {
        this(configPath, DEFAULT_CACHE_TTL, System::getenv);
    }

    public BotConfigService(Path configPath, Duration cacheTtl, Function<String, String> env) {
        String pathStr = configPath.toString();
        if (pathStr.startsWith("~")) {
            configPath = Path.of(System.getProperty("user.home") + pathStr.substring(1));
        }
        this.configPath = configPath;
        this.env = env;
        this.objectMapper = new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        this.cache = Caffeine.newBuilder()
                .expireAfterWrite(cacheTtl)
                .maximumSize(1)
                .build();
    }

    /**
     * Load config with caching.
     */
    public BotConfig loadConfig() {
        return cache.get(configPath.toString(), key -> doLoadConfig());
    }

    /**
     * Force reload config, bypassing cache.
     */
    public BotConfig reloadConfig() {
        cache.invalidateAll();
        return loadConfig();
    }

    public Path getConfigPath() {
        return configPath;
    }

    private BotConfig doLoadConfig() {
        BotConfig config;
        if (!Files.exists(configPath)) {
            log.warn("Config file not found: {}, using defaults and environment", configPath);
            config = new BotConfig();
        } else {
            try {
                String raw = substituteEnvVars(Files.readString(configPath));
                config = objectMapper.readValue(raw, BotConfig.class);
                log.info("Config loaded from: {}", configPath);
            } catch (IOException e) {
                throw new UncheckedIOException("Invalid config at " + configPath, e);
            }
        }
        return applyDefaults(config);
    }

    /**
     * Substitute ${VAR} and ${VAR:-default} patterns.
     */
    String substituteEnvVars(String raw) {
        Matcher matcher = ENV_VAR_PATTERN.matcher(raw);
        StringBuilder result = new StringBuilder();

        while (matcher.find()) {
            String value = env.apply(matcher.group(1));
            if (value == null) {
                value = matcher.group(2) != null ? matcher.group(2) : "";
            }
            matcher.appendReplacement(result, Matcher.quoteReplacement(value));
        }
        matcher.appendTail(result);
        return result.toString();
    }

    BotConfig applyDefaults(BotConfig config) {
        if (isBlank(config.getToken())) {
            config.setToken(env.apply(ENV_TOKEN));
        }
        if (isBlank(config.getAdminToken())) {
            config.setAdminToken(env.apply(ENV_ADMIN_TOKEN));
        }
        if (isBlank(config.getName())) {
            config.setName(env.apply(ENV_BOT_NAME));
        }
        if (config.getAlert() == null || config.getAlert().isEmpty()) {
            config.setAlert("!");
        }
        if (config.getApiBaseUrl() == null || config.getApiBaseUrl().isBlank()) {
            config.setApiBaseUrl(BotConfig.DEFAULT_API_BASE_URL);
        } else if (!config.getApiBaseUrl().endsWith("/")) {
            config.setApiBaseUrl(config.getApiBaseUrl() + "/");
        }
        if (config.getChunkLimit() <= 0) {
            config.setChunkLimit(BotConfig.DEFAULT_CHUNK_LIMIT);
        }
        if (config.getPacingMillis() < 0) {
            config.setPacingMillis(BotConfig.DEFAULT_PACING_MILLIS);
        }
        if (config.getRetry() == null) {
            config.setRetry(new BotConfig.RetryConfig());
        }
        return config;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
