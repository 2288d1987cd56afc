package com.delphine.script.runtime;

import java.util.Map;

import com.delphine.script.types.FieldInfo;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Conversions between runtime values and Jackson trees. JSON scalars surface in
 * scripts as native values; objects and arrays stay JSON containers.
 */
public final class JsonValues {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    private JsonValues() {}

    public static ObjectMapper mapper() {
        return MAPPER;
    }

    public static Value parse(String text) throws JsonProcessingException {
        return Value.json(MAPPER.readTree(text));
    }

    public static String stringify(Value v) throws JsonProcessingException {
        return MAPPER.writeValueAsString(toJson(v));
    }

    /** Scalars unwrap to Integer/Float/String/Boolean/nil, containers stay JSON. */
    public static Value toValue(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) return Value.nil();
        if (node.isIntegralNumber()) return Value.integer(node.longValue());
        if (node.isNumber()) return Value.floating(node.doubleValue());
        if (node.isTextual()) return Value.string(node.textValue());
        if (node.isBoolean()) return Value.bool(node.booleanValue());
        return Value.json(node);
    }

    public static JsonNode toJson(Value v) {
        if (v == null) return NODES.nullNode();
        switch (v.getType()) {
            case INTEGER:
                return NODES.numberNode(v.asInteger());
            case FLOAT:
                return NODES.numberNode(v.asFloat());
            case STRING:
                return NODES.textNode(v.asString());
            case BOOLEAN:
                return NODES.booleanNode(v.asBool());
            case NIL:
                return NODES.nullNode();
            case ENUM:
                return NODES.textNode(v.asEnum().getName());
            case JSON:
                return v.asJson();
            case VARIANT:
                return toJson(v.unwrapVariant());
            case ARRAY: {
                ArrayNode out = NODES.arrayNode();
                for (Value e : v.asArray().elements()) out.add(toJson(e));
                return out;
            }
            case SET: {
                ArrayNode out = NODES.arrayNode();
                for (Value e : v.asSet().elements()) out.add(toJson(e));
                return out;
            }
            case RECORD: {
                ObjectNode out = NODES.objectNode();
                RecordValue r = v.asRecord();
                for (FieldInfo f : r.getType().getFields().values()) {
                    out.set(f.getName(), toJson(r.getField(f.getName())));
                }
                return out;
            }
            case OBJECT: {
                ObjectNode out = NODES.objectNode();
                ObjectInstance o = v.asObject();
                for (Map.Entry<String, FieldInfo> f : o.getClassInfo().getFields().entrySet()) {
                    out.set(f.getValue().getName(), toJson(o.getField(f.getKey())));
                }
                return out;
            }
            default:
                return NODES.textNode(v.display());
        }
    }

    public static ObjectNode newObject() {
        return NODES.objectNode();
    }

    public static ArrayNode newArray() {
        return NODES.arrayNode();
    }
}
