package io.github.cyfko.logictree.core.format;

import io.github.cyfko.logictree.core.api.Leaf;
import io.github.cyfko.logictree.core.api.Node;
import io.github.cyfko.logictree.core.api.NodeVisitor;
import io.github.cyfko.logictree.core.api.Operation;
import io.github.cyfko.logictree.core.api.Operator;
import io.github.cyfko.logictree.core.exception.InvalidNameException;
import io.github.cyfko.logictree.core.exception.InvalidOperatorException;
import io.github.cyfko.logictree.core.exception.MalformedInterchangeException;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Converts expression trees to and from their nested-map interchange form.
 *
 * <h2>Format</h2>
 * <pre>{@code
 * leaf:      {"name": "a", "negated": false}
 * operation: {"operator": "OR", "left": {...}, "right": {...}, "negated": false}
 * }</pre>
 * <ul>
 *   <li>The presence of {@code name} or {@code operator} (exactly one of them) tells the variants apart</li>
 *   <li>{@code negated} may be omitted when decoding and then defaults to {@code false}</li>
 *   <li>Operator codes are decoded case-insensitively and always encoded in upper case</li>
 *   <li>Any other key is rejected</li>
 * </ul>
 *
 * <p>Encoding then decoding any node yields a node equal to the original.</p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class InterchangeCodec {

    public static final String NAME = "name";
    public static final String OPERATOR = "operator";
    public static final String LEFT = "left";
    public static final String RIGHT = "right";
    public static final String NEGATED = "negated";

    private static final Set<String> LEAF_KEYS = Set.of(NAME, NEGATED);
    private static final Set<String> OPERATION_KEYS = Set.of(OPERATOR, LEFT, RIGHT, NEGATED);

    private static final NodeVisitor<Map<String, Object>> ENCODER = new NodeVisitor<>() {
        @Override
        public Map<String, Object> visitLeaf(Leaf leaf) {
            Map<String, Object> map = new LinkedHashMap<>();
            map.put(NAME, leaf.name());
            map.put(NEGATED, leaf.negated());
            return map;
        }

        @Override
        public Map<String, Object> visitOperation(Operation operation) {
            Map<String, Object> map = new LinkedHashMap<>();
            map.put(OPERATOR, operation.operator().getCode());
            map.put(LEFT, operation.left().accept(this));
            map.put(RIGHT, operation.right().accept(this));
            map.put(NEGATED, operation.negated());
            return map;
        }
    };

    private InterchangeCodec() {}

    /**
     * @param node the tree to encode
     * @return a fresh, mutable nested map owned by the caller
     */
    public static Map<String, Object> encode(Node node) {
        return node.accept(ENCODER);
    }

    /**
     * Decodes a nested map into a tree.
     *
     * @param map the interchange form
     * @return the decoded node
     * @throws MalformedInterchangeException if the map or one of its children is not a valid node
     */
    public static Node decode(Map<String, ?> map) {
        return decode(map, "$");
    }

    private static Node decode(Map<String, ?> map, String path) {
        if (map == null) {
            throw new MalformedInterchangeException(String.format("Missing node at %s", path));
        }

        boolean hasName = map.containsKey(NAME);
        boolean hasOperator = map.containsKey(OPERATOR);

        if (hasName && hasOperator) {
            throw new MalformedInterchangeException(String.format(
                    "Ambiguous node at %s: both '%s' and '%s' are present", path, NAME, OPERATOR));
        }
        if (!hasName && !hasOperator) {
            throw new MalformedInterchangeException(String.format(
                    "Node at %s has neither '%s' nor '%s'. Keys found: %s", path, NAME, OPERATOR, map.keySet()));
        }

        return hasName ? decodeLeaf(map, path) : decodeOperation(map, path);
    }

    private static Leaf decodeLeaf(Map<String, ?> map, String path) {
        rejectUnknownKeys(map, LEAF_KEYS, path);

        Object name = map.get(NAME);
        if (!(name instanceof String)) {
            throw new MalformedInterchangeException(String.format(
                    "'%s' at %s must be a string, got: %s", NAME, path, name));
        }

        try {
            return new Leaf((String) name, negated(map, path));
        } catch (InvalidNameException e) {
            throw new MalformedInterchangeException(String.format("Invalid leaf at %s: %s", path, e.getMessage()), e);
        }
    }

    private static Operation decodeOperation(Map<String, ?> map, String path) {
        rejectUnknownKeys(map, OPERATION_KEYS, path);

        Object code = map.get(OPERATOR);
        if (!(code instanceof String)) {
            throw new MalformedInterchangeException(String.format(
                    "'%s' at %s must be a string, got: %s", OPERATOR, path, code));
        }

        Operator operator;
        try {
            operator = Operator.fromCode((String) code);
        } catch (InvalidOperatorException e) {
            throw new MalformedInterchangeException(String.format("Invalid operation at %s: %s", path, e.getMessage()), e);
        }

        Node left = decode(child(map, LEFT, path), path + "." + LEFT);
        Node right = decode(child(map, RIGHT, path), path + "." + RIGHT);
        return new Operation(operator, left, right, negated(map, path));
    }

    @SuppressWarnings("unchecked")
    private static Map<String, ?> child(Map<String, ?> map, String key, String path) {
        Object value = map.get(key);
        if (value == null) {
            throw new MalformedInterchangeException(String.format("Operation at %s is missing '%s'", path, key));
        }
        if (!(value instanceof Map)) {
            throw new MalformedInterchangeException(String.format(
                    "'%s' at %s must be a nested node, got: %s", key, path, value));
        }
        return (Map<String, ?>) value;
    }

    private static boolean negated(Map<String, ?> map, String path) {
        Object value = map.get(NEGATED);
        if (value == null) {
            return false;
        }
        if (!(value instanceof Boolean)) {
            throw new MalformedInterchangeException(String.format(
                    "'%s' at %s must be a boolean, got: %s", NEGATED, path, value));
        }
        return (Boolean) value;
    }

    private static void rejectUnknownKeys(Map<String, ?> map, Set<String> allowed, String path) {
        for (String key : map.keySet()) {
            if (!allowed.contains(key)) {
                throw new MalformedInterchangeException(String.format(
                        "Unexpected key '%s' at %s. Allowed keys: %s", key, path, allowed));
            }
        }
    }
}
