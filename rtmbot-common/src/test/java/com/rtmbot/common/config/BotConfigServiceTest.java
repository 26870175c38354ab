package com.rtmbot.common.config;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class BotConfigServiceTest {

    @TempDir
    Path tempDir;
    private Path configPath;
    private final Map<String, String> env = Map.of(
            "SLACK_TOKEN", "xoxb-env",
            "BOT_NAME", "envbot",
            "ADMIN_ONE", "ada");

    @BeforeEach
    void setUp() {
        configPath = tempDir.resolve("config.json");
    }

    private BotConfigService service() {
        return new BotConfigService(configPath, Duration.ofMinutes(5), env::get);
    }

    @Test
    void loadConfig_validJson_returnsConfig() throws IOException {
        Files.writeString(configPath, """
                {
                  "token": "xoxb-file",
                  "adminToken": "xoxp-admin",
                  "alert": "?",
                  "name": "filebot",
                  "loadHistory": true,
                  "admins": ["grace"],
                  "chunkLimit": 100,
                  "retry": { "attempts": 3 }
                }
                """);

        BotConfig config = service().loadConfig();

        assertEquals("xoxb-file", config.getToken());
        assertEquals("xoxp-admin", config.getAdminToken());
        assertEquals("?", config.getAlert());
        assertEquals("filebot", config.getName());
        assertTrue(config.isLoadHistory());
        assertFalse(config.isClearCommands());
        assertEquals(List.of("grace"), config.getAdmins());
        assertEquals(100, config.getChunkLimit());
        assertEquals(3, config.getRetry().getAttempts());
        assertEquals(1000, config.getRetry().getMinDelayMillis());
    }

    @Test
    void loadConfig_missingFile_usesEnvironment() {
        BotConfig config = service().loadConfig();

        assertEquals("xoxb-env", config.getToken());
        assertEquals("envbot", config.getName());
        assertNull(config.getAdminToken());
        assertEquals("!", config.getAlert());
        assertEquals(BotConfig.DEFAULT_API_BASE_URL, config.getApiBaseUrl());
        assertEquals(4000, config.getChunkLimit());
        assertEquals(1000, config.getPacingMillis());
    }

    @Test
    void loadConfig_substitutesVariables() throws IOException {
        Files.writeString(configPath, """
                { "admins": ["${ADMIN_ONE}", "${ADMIN_TWO:-linus}"] }
                """);

        assertEquals(List.of("ada", "linus"), service().loadConfig().getAdmins());
    }

    @Test
    void loadConfig_unknownFieldsIgnored() throws IOException {
        Files.writeString(configPath, """
                { "token": "t", "somethingElse": 42 }
                """);

        assertEquals("t", service().loadConfig().getToken());
    }

    @Test
    void loadConfig_invalidJson_throws() throws IOException {
        Files.writeString(configPath, "{ not json");

        assertThrows(UncheckedIOException.class, () -> service().loadConfig());
    }

    @Test
    void loadConfig_apiBaseUrlGetsTrailingSlash() throws IOException {
        Files.writeString(configPath, """
                { "apiBaseUrl": "http://localhost:9999/api" }
                """);

        assertEquals("http://localhost:9999/api/", service().loadConfig().getApiBaseUrl());
    }

    @Test
    void loadConfig_isCached() throws IOException {
        Files.writeString(configPath, """
                { "name": "first" }
                """);
        BotConfigService service = service();
        BotConfig first = service.loadConfig();

        Files.writeString(configPath, """
                { "name": "second" }
                """);

        assertSame(first, service.loadConfig());
        assertEquals("second", service.reloadConfig().getName());
    }

    @Test
    void substituteEnvVars_plainString_noChange() {
        assertEquals("hello", service().substituteEnvVars("hello"));
    }

    @Test
    void substituteEnvVars_missingWithoutDefault_empty() {
        assertEquals("[]", service().substituteEnvVars("[${__UNLIKELY_VAR_XYZ}]"));
    }
}
