package com.useless.script.present;

import java.util.Map;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.useless.script.parser.Value;

/** Script values as Jackson trees, and the text form {@code print} shows. */
public final class ValueJson {

    static final ObjectMapper om = new ObjectMapper();
    private static final JsonNodeFactory nodes = JsonNodeFactory.instance;

    private ValueJson() {}

    public static JsonNode toJson(Value v) {
        switch (v.getType()) {
            case NUMBER:
                return nodes.numberNode(v.asNumber());
            case BOOL:
                return nodes.booleanNode(v.asBool());
            case STRING:
                return nodes.textNode(v.asString());
            case NULL:
                return nodes.nullNode();
            case ARRAY: {
                ArrayNode a = nodes.arrayNode();
                for (Value item : v.asArray()) a.add(toJson(item));
                return a;
            }
            case RECORD: {
                ObjectNode o = nodes.objectNode();
                for (Map.Entry<String, Value> e : v.asRecord().entrySet()) o.set(e.getKey(), toJson(e.getValue()));
                return o;
            }
            default:
                // functions and promises have no data form
                return nodes.textNode(v.toString());
        }
    }

    /** Text is shown raw, numbers in Java's double form, containers as compact JSON. */
    public static String display(Value v) {
        switch (v.getType()) {
            case STRING:
                return v.asString();
            case NUMBER:
                return Double.toString(v.asNumber());
            case ARRAY:
            case RECORD:
                return write(toJson(v));
            default:
                return v.toString();
        }
    }

    static String write(JsonNode node) {
        try {
            return om.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot render value as JSON", e);
        }
    }
}
