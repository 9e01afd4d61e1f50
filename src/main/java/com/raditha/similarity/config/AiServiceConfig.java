package com.raditha.similarity.config;

/**
 * Connection settings for the semantic judge.
 *
 * @param apiKey         API key; falls back to GEMINI_API_KEY when blank
 * @param endpoint       Endpoint template with a {model} placeholder
 * @param model          Model name
 * @param timeoutSeconds Connect and request timeout
 */
public record AiServiceConfig(
        String apiKey,
        String endpoint,
        String model,
        int timeoutSeconds) {

    public static final String DEFAULT_ENDPOINT =
            "https://generativelanguage.googleapis.com/v1beta/models/{model}:generateContent";
    public static final String DEFAULT_MODEL = "gemini-2.0-flash";

    public AiServiceConfig {
        if (timeoutSeconds < 1) {
            throw new IllegalArgumentException("timeoutSeconds must be >= 1");
        }
        if (endpoint == null || endpoint.isBlank()) {
            endpoint = DEFAULT_ENDPOINT;
        }
        if (model == null || model.isBlank()) {
            model = DEFAULT_MODEL;
        }
    }

    public static AiServiceConfig defaults() {
        return new AiServiceConfig(null, DEFAULT_ENDPOINT, DEFAULT_MODEL, 60);
    }

    /**
     * Resolve the API key, preferring the configured value over the
     * environment.
     */
    public String resolveApiKey() {
        if (apiKey != null && !apiKey.isBlank()) {
            return apiKey;
        }
        return blankToNull(System.getenv("GEMINI_API_KEY"));
    }

    /**
     * Resolve the endpoint, letting AI_SERVICE_ENDPOINT override the default.
     */
    public String resolveEndpoint() {
        if (!DEFAULT_ENDPOINT.equals(endpoint)) {
            return endpoint;
        }
        String env = blankToNull(System.getenv("AI_SERVICE_ENDPOINT"));
        return env != null ? env : endpoint;
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }
}
