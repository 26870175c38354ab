package com.rtmbot.slack.api;

import com.fasterxml.jackson.databind.JsonNode;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Map;

/**
 * Raw access to the Slack Web API.
 */
public interface SlackApiClient {

    /**
     * Call a method with form parameters.
     *
     * @return the decoded JSON reply, whether or not it is {@code ok}
     * @throws RateLimitedException on HTTP 429
     */
    JsonNode call(String method, String token, Map<String, String> params)
            throws IOException, InterruptedException;

    /**
     * Call a method with a multipart body carrying one file.
     */
    JsonNode upload(String method, String token, Map<String, String> fields, String fileField, Path file)
            throws IOException, InterruptedException;
}
