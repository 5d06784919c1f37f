package com.retailsales.infrastructure.cache;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.datatype.jdk8.Jdk8Module;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.Iterator;
import java.util.List;

/**
 * Builds deterministic cache keys from a namespace and a parameter object.
 *
 * The parameter object is serialized to canonical JSON: properties and map
 * entries in key order, every array sorted, empty and absent values omitted.
 * Logically identical filters therefore produce identical keys regardless of
 * insertion order.
 */
@Component
public class CacheKeyGenerator {

    private final ObjectMapper canonicalMapper = JsonMapper.builder()
            .addModule(new Jdk8Module())
            .addModule(new JavaTimeModule())
            .enable(MapperFeature.SORT_PROPERTIES_ALPHABETICALLY)
            .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .serializationInclusion(JsonInclude.Include.NON_EMPTY)
            .build();

    public String generateKey(String namespace, Object params) {
        if (params == null) {
            return namespace + ":{}";
        }
        try {
            JsonNode tree = canonicalMapper.valueToTree(params);
            return namespace + ":" + canonicalMapper.writeValueAsString(canonicalize(tree));
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new IllegalStateException("Cannot build cache key for " + params.getClass().getSimpleName(), e);
        }
    }

    private JsonNode canonicalize(JsonNode node) {
        if (node.isObject()) {
            ObjectNode sorted = canonicalMapper.createObjectNode();
            List<String> names = new ArrayList<>();
            node.fieldNames().forEachRemaining(names::add);
            names.sort(Comparator.naturalOrder());
            for (String name : names) {
                sorted.set(name, canonicalize(node.get(name)));
            }
            return sorted;
        }
        if (node.isArray()) {
            List<JsonNode> elements = new ArrayList<>();
            for (Iterator<JsonNode> it = node.elements(); it.hasNext(); ) {
                elements.add(canonicalize(it.next()));
            }
            elements.sort(Comparator.comparing(JsonNode::toString));
            ArrayNode sorted = canonicalMapper.createArrayNode();
            sorted.addAll(elements);
            return sorted;
        }
        return node;
    }
}
