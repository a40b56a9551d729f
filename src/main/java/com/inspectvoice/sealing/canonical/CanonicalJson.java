package com.inspectvoice.sealing.canonical;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

/**
 * Deterministic JSON serialisation used for every byte that gets hashed or signed.
 * <p>
 * Rules:
 * <ol>
 *   <li>UTF-8, no BOM, no insignificant whitespace</li>
 *   <li>object keys sorted lexicographically at every nesting level</li>
 *   <li>array order preserved</li>
 *   <li>numbers in Jackson's default formatting</li>
 *   <li>absent optional values written as explicit {@code null}</li>
 * </ol>
 * Manifests must never be turned into bytes any other way: signature verification
 * depends on bit-for-bit reproducibility.
 */
public final class CanonicalJson {

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .disable(SerializationFeature.INDENT_OUTPUT)
            .setSerializationInclusion(JsonInclude.Include.ALWAYS);

    private CanonicalJson() {
    }

    /**
     * Canonicalises any Jackson-serialisable value (POJO, map, list or tree).
     *
     * @param value the value to serialise
     * @return canonical UTF-8 bytes
     */
    public static byte[] canonicalize(Object value) {
        return canonicalString(value).getBytes(StandardCharsets.UTF_8);
    }

    public static String canonicalString(Object value) {
        JsonNode tree = value instanceof JsonNode ? (JsonNode) value : MAPPER.valueToTree(value);
        try {
            return MAPPER.writeValueAsString(sortKeys(tree));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to write canonical JSON", e);
        }
    }

    private static JsonNode sortKeys(JsonNode node) {
        if (node == null) {
            return JsonNodeFactory.instance.nullNode();
        }
        if (node.isObject()) {
            List<String> names = new ArrayList<>();
            Iterator<String> it = node.fieldNames();
            while (it.hasNext()) {
                names.add(it.next());
            }
            // String.compareTo orders by UTF-16 code unit
            names.sort(String::compareTo);

            ObjectNode sorted = JsonNodeFactory.instance.objectNode();
            for (String name : names) {
                sorted.set(name, sortKeys(node.get(name)));
            }
            return sorted;
        }
        if (node.isArray()) {
            ArrayNode copy = JsonNodeFactory.instance.arrayNode(node.size());
            for (JsonNode element : node) {
                copy.add(sortKeys(element));
            }
            return copy;
        }
        return node;
    }
}
