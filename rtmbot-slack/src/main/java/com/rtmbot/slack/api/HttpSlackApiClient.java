package com.rtmbot.slack.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * {@link SlackApiClient} over {@link HttpClient}.
 */
@Slf4j
public class HttpSlackApiClient implements SlackApiClient {

    private static final Duration REQUEST_TIMEOUT = Duration.ofSeconds(30);
    private static final Duration UPLOAD_TIMEOUT = Duration.ofSeconds(120);

    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final String baseUrl;

    public HttpSlackApiClient(String baseUrl, ObjectMapper objectMapper) {
        this(HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(30)).build(), baseUrl, objectMapper);
    }

    public HttpSlackApiClient(HttpClient httpClient, String baseUrl, ObjectMapper objectMapper) {
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl : baseUrl + "/";
    }

    @Override
    public JsonNode call(String method, String token, Map<String, String> params)
            throws IOException, InterruptedException {
        HttpRequest request = HttpRequest.newBuilder()
                .uri(URI.create(baseUrl + method))
                .timeout(REQUEST_TIMEOUT)
                .header("Content-Type", "application/x-www-form-urlencoded")
                .header("Authorization", "Bearer " + token)
                .POST(HttpRequest.BodyPublishers.ofString(formEncode(params)))
                .build();
        return send(method, request);
    }

    @Override
    public JsonNode upload(String method, String token, Map<String, String> fields, String fileField, Path file)
            throws IOException, InterruptedException {
        String boundary = "----RtmBotBoundary" + System.nanoTime();
        ByteArrayOutputStream body = new ByteArrayOutputStream();
        for (Map.Entry<String, String> field : fields.entrySet()) {
            writeAscii(body, "--" + boundary + "\r\n");
            writeAscii(body, "Content-Disposition: form-data; name=\"" + field.getKey() + "\"\r\n\r\n");
            body.write(field.getValue().getBytes(StandardCharsets.UTF_8));
            writeAscii(body, "\r\n");
        }
        writeAscii(body, "--" + boundary + "\r\n");
        writeAscii(body, "Content-Disposition: form-data; name=\"" + fileField
                + "\"; filename=\"" + file.getFileName() + "\"\r\n");
        writeAscii(body, "Content-Type: application/octet-stream\r\n\r\n");
        body.write(Files.readAllBytes(file));
        writeAscii(body, "\r\n--" + boundary + "--\r\n");

        HttpRequest request = HttpRequest.newBuilder()
                .uri(URI.create(baseUrl + method))
                .timeout(UPLOAD_TIMEOUT)
                .header("Content-Type", "multipart/form-data; boundary=" + boundary)
                .header("Authorization", "Bearer " + token)
                .POST(HttpRequest.BodyPublishers.ofByteArray(body.toByteArray()))
                .build();
        return send(method, request);
    }

    private JsonNode send(String method, HttpRequest request) throws IOException, InterruptedException {
        HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        if (response.statusCode() == 429) {
            long retryAfter = response.headers().firstValueAsLong("Retry-After").orElse(1) * 1000;
            throw new RateLimitedException(method, retryAfter);
        }
        if (response.statusCode() >= 500) {
            throw new IOException("Slack API " + method + " -> HTTP " + response.statusCode());
        }
        JsonNode reply = objectMapper.readTree(response.body());
        if (!reply.path("ok").asBoolean(false)) {
            log.warn("Slack API {} not ok: {}", method, reply.path("error").asText("unknown error"));
        }
        return reply;
    }

    static String formEncode(Map<String, String> params) {
        return params.entrySet().stream()
                .map(e -> URLEncoder.encode(e.getKey(), StandardCharsets.UTF_8) + "="
                        + URLEncoder.encode(e.getValue(), StandardCharsets.UTF_8))
                .collect(Collectors.joining("&"));
    }

    private static void writeAscii(ByteArrayOutputStream out, String s) {
        out.writeBytes(s.getBytes(StandardCharsets.US_ASCII));
    }
}
