package dev.careerpath.ai;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts a JSON object or array from model output.
 */
public final class JsonResponseParser {

    private static final Pattern FENCE = Pattern.compile("```(?:json)?\\s*(.*?)```", Pattern.DOTALL);

    private JsonResponseParser() {
    }

    public static JsonNode parse(ObjectMapper objectMapper, String text) {
        if (text == null || text.isBlank()) {
            throw new ExternalServiceException(ExternalServiceException.Kind.MALFORMED_RESPONSE, "Empty response");
        }

        String candidate = text.trim();
        Matcher fence = FENCE.matcher(candidate);
        if (fence.find()) {
            candidate = fence.group(1).trim();
        }

        JsonNode node = tryRead(objectMapper, candidate);
        if (node == null || !node.isContainerNode()) {
            node = tryRead(objectMapper, slice(candidate));
        }
        if (node == null || !node.isContainerNode()) {
            throw new ExternalServiceException(ExternalServiceException.Kind.MALFORMED_RESPONSE,
                    "Response does not contain a JSON object or array");
        }
        return node;
    }

    /**
     * Cut from the first opening brace or bracket to the last matching closer.
     */
    private static String slice(String text) {
        int objectStart = text.indexOf('{');
        int arrayStart = text.indexOf('[');
        int start;
        char closer;
        if (objectStart == -1 && arrayStart == -1) {
            return null;
        } else if (arrayStart == -1 || (objectStart != -1 && objectStart < arrayStart)) {
            start = objectStart;
            closer = '}';
        } else {
            start = arrayStart;
            closer = ']';
        }
        int end = text.lastIndexOf(closer);
        return end > start ? text.substring(start, end + 1) : null;
    }

    private static JsonNode tryRead(ObjectMapper objectMapper, String text) {
        if (text == null) {
            return null;
        }
        try {
            return objectMapper.readTree(text);
        } catch (JsonProcessingException e) {
            return null;
        }
    }
}
