package io.continuum.core.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.continuum.core.error.ModelInvocationException;
import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import okio.BufferedSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Chat-completions client for any OpenAI-compatible endpoint. HTTP 429, 5xx and transport errors are retried
 * with doubling backoff; everything else fails at once.
 */
public final class OpenAiCompatModelInvoker implements ModelInvoker {
    private static final Logger LOG = LoggerFactory.getLogger(OpenAiCompatModelInvoker.class);
    private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");
    private static final long INITIAL_BACKOFF_MS = 250;
    private static final long MAX_BACKOFF_MS = 2000;

    private final String name;
    private final String apiKey;
    private final HttpUrl apiBase;
    private final String model;
    private final String systemPrompt;
    private final int maxAttempts;
    private final OkHttpClient client;
    private final ObjectMapper mapper;

    public OpenAiCompatModelInvoker(String name, String apiKey, String apiBase, String model, String systemPrompt) {
        this(name, apiKey, apiBase, model, systemPrompt, 3, Duration.ofSeconds(90));
    }

    public OpenAiCompatModelInvoker(
        String name,
        String apiKey,
        String apiBase,
        String model,
        String systemPrompt,
        int maxAttempts,
        Duration readTimeout
    ) {
        this.name = Objects.requireNonNull(name, "name must not be null");
        this.apiKey = apiKey == null ? "" : apiKey;
        this.apiBase = HttpUrl.get(Objects.requireNonNull(apiBase, "apiBase must not be null"));
        this.model = Objects.requireNonNull(model, "model must not be null");
        this.systemPrompt = systemPrompt == null ? "" : systemPrompt;
        this.maxAttempts = Math.max(1, maxAttempts);
        this.client = new OkHttpClient.Builder()
            .connectTimeout(Duration.ofSeconds(20))
            .readTimeout(readTimeout == null ? Duration.ofSeconds(90) : readTimeout)
            .writeTimeout(Duration.ofSeconds(20))
            .build();
        this.mapper = new ObjectMapper();
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public String invoke(String prompt) {
        if (apiKey.isBlank()) {
            throw new ModelInvocationException("Missing API key for model " + name);
        }

        long delayMs = INITIAL_BACKOFF_MS;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                Request request = buildRequest(prompt);
                try (Response response = client.newCall(request).execute()) {
                    if (!response.isSuccessful()) {
                        String errorBody = response.body() == null ? "" : response.body().string();
                        boolean retryable = response.code() == 429 || response.code() >= 500;
                        if (retryable && attempt < maxAttempts) {
                            LOG.debug("Model {} returned HTTP {} on attempt {}, retrying", name, response.code(), attempt);
                            sleep(delayMs);
                            delayMs = Math.min(delayMs * 2, MAX_BACKOFF_MS);
                            continue;
                        }
                        throw new ModelInvocationException("Model " + name + " returned HTTP " + response.code() + " " + errorBody);
                    }

                    ResponseBody body = response.body();
                    if (body == null) {
                        return "";
                    }
                    String contentType = response.header("Content-Type", "");
                    if (contentType.contains("text/event-stream")) {
                        return parseSse(body.source());
                    }
                    return parseJson(body.string());
                }
            } catch (IOException ioe) {
                if (attempt < maxAttempts) {
                    LOG.debug("Model {} call failed on attempt {}: {}", name, attempt, ioe.getMessage());
                    sleep(delayMs);
                    delayMs = Math.min(delayMs * 2, MAX_BACKOFF_MS);
                    continue;
                }
                throw new ModelInvocationException("Model " + name + " call failed: " + ioe.getMessage(), ioe);
            }
        }
        throw new ModelInvocationException("Model " + name + " call exhausted retries");
    }

    private Request buildRequest(String prompt) throws IOException {
        List<Map<String, Object>> messages = new ArrayList<>();
        if (!systemPrompt.isBlank()) {
            messages.add(message("system", systemPrompt));
        }
        messages.add(message("user", prompt == null ? "" : prompt));

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("model", model);
        payload.put("messages", messages);
        payload.put("stream", false);

        RequestBody body = RequestBody.create(mapper.writeValueAsString(payload), JSON);
        return new Request.Builder()
            .url(completionsUrl())
            .post(body)
            .header("Authorization", "Bearer " + apiKey)
            .header("Content-Type", "application/json")
            .header("Accept", "application/json, text/event-stream")
            .build();
    }

    private static Map<String, Object> message(String role, String content) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("role", role);
        row.put("content", content);
        return row;
    }

    private HttpUrl completionsUrl() {
        return apiBase.newBuilder()
            .addPathSegment("chat")
            .addPathSegment("completions")
            .build();
    }

    private String parseJson(String body) throws IOException {
        JsonNode root = mapper.readTree(body);
        JsonNode error = root.path("error");
        if (!error.isMissingNode() && !error.isNull()) {
            throw new ModelInvocationException("Model " + name + " error: " + error.path("message").asText(error.toString()));
        }
        return root.path("choices").path(0).path("message").path("content").asText("");
    }

    private String parseSse(BufferedSource source) throws IOException {
        StringBuilder content = new StringBuilder();
        while (!source.exhausted()) {
            String line = source.readUtf8Line();
            if (line == null || line.isBlank() || !line.startsWith("data:")) {
                continue;
            }
            String payload = line.substring(5).trim();
            if (payload.isEmpty()) {
                continue;
            }
            if ("[DONE]".equals(payload)) {
                break;
            }
            JsonNode event = mapper.readTree(payload);
            for (JsonNode choice : event.path("choices")) {
                JsonNode delta = choice.path("delta");
                if (delta.has("content") && !delta.path("content").isNull()) {
                    content.append(delta.path("content").asText(""));
                }
            }
        }
        return content.toString();
    }

    private void sleep(long delayMs) {
        try {
            Thread.sleep(delayMs);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new ModelInvocationException("Interrupted while waiting to retry model " + name, ie);
        }
    }
}
