package dev.careerpath.ai;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JsonResponseParserTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Test
    @DisplayName("Should parse plain JSON object")
    void shouldParsePlainObject() {
        JsonNode node = JsonResponseParser.parse(objectMapper, "{\"milestones\": [1, 2]}");

        assertThat(node.get("milestones").size()).isEqualTo(2);
    }

    @Test
    @DisplayName("Should unwrap markdown code fences")
    void shouldUnwrapFences() {
        JsonNode node = JsonResponseParser.parse(objectMapper, "```json\n[{\"a\": 1}]\n```");

        assertThat(node.isArray()).isTrue();
        assertThat(node.get(0).get("a").asInt()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should slice JSON out of surrounding prose")
    void shouldSliceFromProse() {
        JsonNode node = JsonResponseParser.parse(objectMapper,
                "Sure! Here is the result: {\"successRate\": 0.6} Let me know if you need more.");

        assertThat(node.get("successRate").asDouble()).isEqualTo(0.6);
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "   ", "no json here", "42", "{broken", "\"just a string\""})
    @DisplayName("Should reject responses without a JSON container")
    void shouldRejectNonContainers(String text) {
        assertThatThrownBy(() -> JsonResponseParser.parse(objectMapper, text))
                .isInstanceOf(ExternalServiceException.class)
                .satisfies(e -> assertThat(((ExternalServiceException) e).getKind())
                        .isEqualTo(ExternalServiceException.Kind.MALFORMED_RESPONSE));
    }
}
