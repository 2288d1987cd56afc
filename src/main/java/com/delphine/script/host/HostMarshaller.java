package com.delphine.script.host;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.delphine.script.runtime.ArrayValue;
import com.delphine.script.runtime.JsonValues;
import com.delphine.script.runtime.RecordValue;
import com.delphine.script.runtime.Value;
import com.delphine.script.types.ArrayType;
import com.delphine.script.types.PrimitiveType;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * Converts script values to the Java types a host signature declares, and host
 * results back to script values.
 */
public final class HostMarshaller {

    /** Wraps a script function pointer for host code. */
    public interface CallbackFactory {
        HostCallback callbackFor(Value function);
    }

    private static final Set<Class<?>> SUPPORTED = Set.of(
            Object.class, Value.class,
            long.class, Long.class, int.class, Integer.class,
            double.class, Double.class, float.class, Float.class,
            boolean.class, Boolean.class, String.class,
            List.class, Collection.class, Map.class, JsonNode.class, HostCallback.class);

    private final CallbackFactory callbacks;

    public HostMarshaller(CallbackFactory callbacks) {
        this.callbacks = callbacks;
    }

    public static boolean isSupportedParameter(Class<?> type) {
        return SUPPORTED.contains(type);
    }

    // -------------------------
    // Script -> Java
    // -------------------------

    /**
     * @throws IllegalArgumentException when the value cannot be passed as the target type
     */
    public Object toJava(Value value, Class<?> target) {
        Value v = value.unwrapVariant();
        if (target == Object.class) return toJava(v);
        if (target == Value.class) return v;

        if (v.isNil()) {
            if (target.isPrimitive()) throw mismatch(v, target);
            return null;
        }

        if (target == long.class || target == Long.class) {
            if (v.getType() != Value.Type.INTEGER) throw mismatch(v, target);
            return v.asInteger();
        }
        if (target == int.class || target == Integer.class) {
            if (v.getType() != Value.Type.INTEGER) throw mismatch(v, target);
            long l = v.asInteger();
            if (l < Integer.MIN_VALUE || l > Integer.MAX_VALUE) {
                throw new IllegalArgumentException("integer " + l + " does not fit in int");
            }
            return (int) l;
        }
        if (target == double.class || target == Double.class) {
            if (!v.isNumeric()) throw mismatch(v, target);
            return v.asNumber();
        }
        if (target == float.class || target == Float.class) {
            if (!v.isNumeric()) throw mismatch(v, target);
            return (float) v.asNumber();
        }
        if (target == boolean.class || target == Boolean.class) {
            if (v.getType() != Value.Type.BOOLEAN) throw mismatch(v, target);
            return v.asBool();
        }
        if (target == String.class) {
            if (v.getType() == Value.Type.STRING) return v.asString();
            if (v.getType() == Value.Type.ENUM) return v.asEnum().getName();
            throw mismatch(v, target);
        }
        if (target == List.class || target == Collection.class) {
            if (v.getType() == Value.Type.ARRAY) return listOf(v);
            if (v.getType() == Value.Type.JSON && v.asJson().isArray()) {
                return JsonValues.mapper().convertValue(v.asJson(), List.class);
            }
            throw mismatch(v, target);
        }
        if (target == Map.class) {
            if (v.getType() == Value.Type.RECORD) return mapOf(v.asRecord());
            if (v.getType() == Value.Type.JSON && v.asJson().isObject()) {
                return JsonValues.mapper().convertValue(v.asJson(), Map.class);
            }
            throw mismatch(v, target);
        }
        if (target == JsonNode.class) {
            return JsonValues.toJson(v);
        }
        if (target == HostCallback.class) {
            if (v.getType() != Value.Type.FUNCTION_POINTER) throw mismatch(v, target);
            return callbacks.callbackFor(v);
        }
        throw new IllegalArgumentException("unsupported host parameter type " + target.getName());
    }

    /** Natural Java form of a value, used for untyped parameters and callback arguments. */
    public Object toJava(Value value) {
        Value v = value.unwrapVariant();
        switch (v.getType()) {
            case INTEGER: return v.asInteger();
            case FLOAT: return v.asFloat();
            case STRING: return v.asString();
            case BOOLEAN: return v.asBool();
            case NIL: return null;
            case ENUM: return v.asEnum().getName();
            case ARRAY: return listOf(v);
            case SET: {
                List<Object> out = new ArrayList<>();
                for (Value e : v.asSet().elements()) out.add(toJava(e));
                return out;
            }
            case RECORD: return mapOf(v.asRecord());
            case JSON: return v.asJson();
            case FUNCTION_POINTER: return callbacks.callbackFor(v);
            default: return v;
        }
    }

    private List<Object> listOf(Value array) {
        List<Object> out = new ArrayList<>();
        for (Value e : array.asArray().elements()) out.add(e == null ? null : toJava(e));
        return out;
    }

    private Map<String, Object> mapOf(RecordValue record) {
        Map<String, Object> out = new LinkedHashMap<>();
        record.getType().getFields().values().forEach(f -> out.put(f.getName(), toJava(record.getField(f.getName()))));
        return out;
    }

    private static IllegalArgumentException mismatch(Value v, Class<?> target) {
        return new IllegalArgumentException("cannot pass " + v.typeName() + " as " + target.getSimpleName());
    }

    // -------------------------
    // Java -> script
    // -------------------------

    /**
     * @throws IllegalArgumentException for result types with no script counterpart
     */
    public Value toValue(Object o) {
        if (o == null) return Value.nil();
        if (o instanceof Value) return (Value) o;
        if (o instanceof Long || o instanceof Integer || o instanceof Short || o instanceof Byte) {
            return Value.integer(((Number) o).longValue());
        }
        if (o instanceof Double || o instanceof Float) return Value.floating(((Number) o).doubleValue());
        if (o instanceof String) return Value.string((String) o);
        if (o instanceof Character) return Value.string(String.valueOf(o));
        if (o instanceof Boolean) return Value.bool((Boolean) o);
        if (o instanceof Enum) return Value.string(((Enum<?>) o).name());
        if (o instanceof JsonNode) return JsonValues.toValue((JsonNode) o);
        if (o instanceof Collection) {
            List<Value> elements = new ArrayList<>();
            for (Object e : (Collection<?>) o) elements.add(toValue(e));
            return Value.array(new ArrayValue(ArrayType.dynamic(PrimitiveType.UNKNOWN), elements));
        }
        if (o instanceof Map) {
            return Value.json(JsonValues.mapper().valueToTree(o));
        }
        throw new IllegalArgumentException("unsupported host result type " + o.getClass().getName());
    }
}
