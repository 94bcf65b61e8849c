package io.github.cyfko.logictree.core.format;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.cyfko.logictree.core.api.Node;
import io.github.cyfko.logictree.core.exception.MalformedInterchangeException;

import java.util.Map;
import java.util.Objects;

/**
 * JSON text form of the interchange map, backed by Jackson.
 *
 * <pre>{@code
 * String json = JsonInterchange.toJson(node);
 * // {"operator":"OR","left":{"name":"a","negated":false},"right":{"name":"b","negated":true},"negated":false}
 * Node copy = JsonInterchange.fromJson(json);
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 * @see InterchangeCodec
 */
public final class JsonInterchange {

    private static final ObjectMapper JSON = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_TRAILING_TOKENS, true);

    private static final TypeReference<Map<String, Object>> NODE_MAP = new TypeReference<>() {};

    private JsonInterchange() {}

    /**
     * @param node the tree to serialize
     * @return compact JSON text of the interchange form
     */
    public static String toJson(Node node) {
        Objects.requireNonNull(node, "node cannot be null");
        try {
            return JSON.writeValueAsString(InterchangeCodec.encode(node));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to write interchange map as JSON", e);
        }
    }

    /**
     * @param json JSON text of an interchange form
     * @return the decoded node
     * @throws MalformedInterchangeException if the text is not JSON, not an object, or not a valid node
     */
    public static Node fromJson(String json) {
        if (json == null || json.isBlank()) {
            throw new MalformedInterchangeException("JSON interchange text cannot be null or empty");
        }

        Map<String, Object> map;
        try {
            map = JSON.readValue(json, NODE_MAP);
        } catch (JsonProcessingException e) {
            throw new MalformedInterchangeException("Invalid JSON interchange text: " + e.getOriginalMessage(), e);
        }
        return InterchangeCodec.decode(map);
    }
}
