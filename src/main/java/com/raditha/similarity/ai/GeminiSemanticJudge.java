package com.raditha.similarity.ai;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.raditha.similarity.config.AiServiceConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

/**
 * {@link SemanticJudge} that calls the Gemini generateContent API.
 * <p>
 * The API key comes from the configuration or the GEMINI_API_KEY environment
 * variable; construction fails fast when neither is set. The per-call timeout
 * is owned here, not by callers.
 */
public class GeminiSemanticJudge implements SemanticJudge {
    private static final Logger logger = LoggerFactory.getLogger(GeminiSemanticJudge.class);

    private static final double TEMPERATURE = 0.2;
    private static final int MAX_OUTPUT_TOKENS = 1024;

    private final HttpClient httpClient;
    private final ObjectMapper mapper = new ObjectMapper();
    private final String apiKey;
    private final String url;
    private final Duration timeout;

    public GeminiSemanticJudge(AiServiceConfig config) throws IOException {
        this(config, null);
    }

    GeminiSemanticJudge(AiServiceConfig config, HttpClient httpClient) throws IOException {
        this.apiKey = config.resolveApiKey();
        if (apiKey == null) {
            throw new IOException(
                    "AI service API key is required. Set GEMINI_API_KEY environment variable or configure ai_service.api_key in similarity.yml");
        }
        this.timeout = Duration.ofSeconds(config.timeoutSeconds());
        this.url = config.resolveEndpoint().replace("{model}", config.model());
        this.httpClient = httpClient != null
                ? httpClient
                : HttpClient.newBuilder().connectTimeout(timeout).build();
    }

    @Override
    public String judge(String prompt) throws IOException, InterruptedException {
        HttpRequest request = HttpRequest.newBuilder()
                .uri(URI.create(url + "?key=" + apiKey))
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(buildPayload(prompt)))
                .timeout(timeout)
                .build();

        HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());

        if (response.statusCode() != 200) {
            throw new IOException(
                    "API request failed with status: " + response.statusCode() + ", body: " + response.body());
        }

        return extractText(response.body());
    }

    /**
     * Build the generateContent request body for a single user turn.
     */
    String buildPayload(String prompt) throws IOException {
        ObjectNode root = mapper.createObjectNode();
        ArrayNode contents = root.putArray("contents");
        ObjectNode turn = contents.addObject();
        turn.put("role", "user");
        turn.putArray("parts").addObject().put("text", prompt);

        ObjectNode generation = root.putObject("generationConfig");
        generation.put("temperature", TEMPERATURE);
        generation.put("maxOutputTokens", MAX_OUTPUT_TOKENS);

        return mapper.writeValueAsString(root);
    }

    /**
     * Concatenate the text parts of the first candidate.
     * Response format: {"candidates":[{"content":{"parts":[{"text":"..."}]}}]}
     */
    String extractText(String responseBody) throws IOException {
        JsonNode parts = mapper.readTree(responseBody)
                .path("candidates").path(0).path("content").path("parts");
        if (!parts.isArray() || parts.isEmpty()) {
            logger.debug("Gemini response carried no text parts");
            return "";
        }
        StringBuilder text = new StringBuilder();
        for (JsonNode part : parts) {
            text.append(part.path("text").asText(""));
        }
        return text.toString();
    }
}
