package com.raditha.similarity.similarity;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Reads the JSON object embedded in a semantic judge reply.
 * Anything that is not a usable JSON object yields
 * {@link SemanticVerdict#none()}.
 */
public class SemanticResponseParser {
    private static final Logger logger = LoggerFactory.getLogger(SemanticResponseParser.class);

    private final ObjectMapper mapper = new ObjectMapper();

    public SemanticVerdict parse(String response) {
        if (response == null) {
            return SemanticVerdict.none();
        }
        int start = response.indexOf('{');
        int end = response.lastIndexOf('}');
        if (start < 0 || end <= start) {
            return SemanticVerdict.none();
        }

        JsonNode node;
        try {
            node = mapper.readTree(response.substring(start, end + 1));
        } catch (JsonProcessingException e) {
            logger.debug("Unparseable semantic judge reply: {}", e.getOriginalMessage());
            return SemanticVerdict.none();
        }
        if (node == null || !node.isObject()) {
            return SemanticVerdict.none();
        }

        List<String> suggestions = new ArrayList<>();
        for (JsonNode suggestion : node.path("suggestions")) {
            if (suggestion.isTextual()) {
                suggestions.add(suggestion.asText());
            }
        }

        return new SemanticVerdict(
                clamp(node.path("similarity").asDouble(0.0)),
                textOrNull(node.get("type")),
                clamp(node.path("confidence").asDouble(0.0)),
                textOrNull(node.get("reasoning")),
                suggestions);
    }

    private static String textOrNull(JsonNode node) {
        return node != null && node.isTextual() ? node.asText() : null;
    }

    private static double clamp(double value) {
        if (Double.isNaN(value)) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(1.0, value));
    }
}
