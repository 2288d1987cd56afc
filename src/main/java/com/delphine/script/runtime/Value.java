package com.delphine.script.runtime;

import com.delphine.script.types.ClassInfo;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * Tagged runtime value. Exactly one payload per kind; scalars are immutable,
 * arrays, records and objects mutate only through their own payload classes.
 */
public class Value {
    public enum Type {
        INTEGER, FLOAT, STRING, BOOLEAN, NIL, ENUM, ARRAY, SET, RECORD, OBJECT, INTERFACE,
        CLASS, FUNCTION_POINTER, VARIANT, JSON, EXCEPTION, ERROR
    }

    private static final Value NIL = new Value(Type.NIL, null);
    private static final Value TRUE = new Value(Type.BOOLEAN, Boolean.TRUE);
    private static final Value FALSE = new Value(Type.BOOLEAN, Boolean.FALSE);

    public final Type type;
    public final Object value;

    public Value(Type type, Object value) {
        this.type = type;
        this.value = value;
    }

    public static Value integer(long l) { return new Value(Type.INTEGER, l); }
    public static Value floating(double d) { return new Value(Type.FLOAT, d); }
    public static Value string(String s) { return new Value(Type.STRING, s == null ? "" : s); }
    public static Value bool(boolean b) { return b ? TRUE : FALSE; }
    public static Value nil() { return NIL; }
    public static Value enumValue(EnumValue e) { return new Value(Type.ENUM, e); }
    public static Value array(ArrayValue a) { return new Value(Type.ARRAY, a); }
    public static Value set(SetValue s) { return new Value(Type.SET, s); }
    public static Value record(RecordValue r) { return new Value(Type.RECORD, r); }
    public static Value object(ObjectInstance o) { return new Value(Type.OBJECT, o); }
    public static Value intf(InterfaceInstance i) { return new Value(Type.INTERFACE, i); }
    public static Value classRef(ClassInfo c) { return new Value(Type.CLASS, c); }
    public static Value function(FunctionPointer f) { return new Value(Type.FUNCTION_POINTER, f); }
    public static Value json(JsonNode n) { return new Value(Type.JSON, n); }
    public static Value exception(ExceptionValue e) { return new Value(Type.EXCEPTION, e); }
    public static Value error(String message) { return new Value(Type.ERROR, message); }

    /** Boxes a value as Variant; already-boxed values are not boxed twice. */
    public static Value variant(Value inner) {
        if (inner != null && inner.type == Type.VARIANT) return inner;
        return new Value(Type.VARIANT, inner == null ? NIL : inner);
    }

    public Type getType() { return type; }

    public boolean isError() { return type == Type.ERROR; }
    public boolean isNil() { return type == Type.NIL; }

    public boolean isNumeric() {
        return type == Type.INTEGER || type == Type.FLOAT;
    }

    private IllegalStateException mismatch(String expected) {
        return new IllegalStateException("Expected " + expected + ", got " + type);
    }

    public long asInteger() {
        if (type != Type.INTEGER) throw mismatch("integer");
        return (long) value;
    }

    public double asFloat() {
        if (type != Type.FLOAT) throw mismatch("float");
        return (double) value;
    }

    /** Integer or Float widened to double. */
    public double asNumber() {
        if (type == Type.INTEGER) return (long) value;
        if (type == Type.FLOAT) return (double) value;
        throw mismatch("number");
    }

    public String asString() {
        if (type != Type.STRING) throw mismatch("string");
        return (String) value;
    }

    public boolean asBool() {
        if (type != Type.BOOLEAN) throw mismatch("boolean");
        return (boolean) value;
    }

    public EnumValue asEnum() {
        if (type != Type.ENUM) throw mismatch("enum");
        return (EnumValue) value;
    }

    public ArrayValue asArray() {
        if (type != Type.ARRAY) throw mismatch("array");
        return (ArrayValue) value;
    }

    public SetValue asSet() {
        if (type != Type.SET) throw mismatch("set");
        return (SetValue) value;
    }

    public RecordValue asRecord() {
        if (type != Type.RECORD) throw mismatch("record");
        return (RecordValue) value;
    }

    public ObjectInstance asObject() {
        if (type != Type.OBJECT) throw mismatch("object");
        return (ObjectInstance) value;
    }

    public InterfaceInstance asInterface() {
        if (type != Type.INTERFACE) throw mismatch("interface");
        return (InterfaceInstance) value;
    }

    public ClassInfo asClass() {
        if (type != Type.CLASS) throw mismatch("class reference");
        return (ClassInfo) value;
    }

    public FunctionPointer asFunction() {
        if (type != Type.FUNCTION_POINTER) throw mismatch("function pointer");
        return (FunctionPointer) value;
    }

    public JsonNode asJson() {
        if (type != Type.JSON) throw mismatch("JSON");
        return (JsonNode) value;
    }

    public ExceptionValue asException() {
        if (type != Type.EXCEPTION) throw mismatch("exception");
        return (ExceptionValue) value;
    }

    public String errorMessage() {
        if (type != Type.ERROR) throw mismatch("error");
        return (String) value;
    }

    /** The boxed value of a Variant (recursively), otherwise this. */
    public Value unwrapVariant() {
        Value v = this;
        while (v.type == Type.VARIANT) v = (Value) v.value;
        return v;
    }

    /** Object behind an object or interface value, else null. */
    public ObjectInstance objectOrNull() {
        if (type == Type.OBJECT) return (ObjectInstance) value;
        if (type == Type.INTERFACE) return ((InterfaceInstance) value).getTarget();
        return null;
    }

    /**
     * How a value is stored into a new slot: static arrays, sets and records are
     * copied, everything else is shared.
     */
    public Value copyForAssignment() {
        switch (type) {
            case ARRAY: {
                ArrayValue a = asArray();
                return a.getType().isStatic() ? Value.array(a.copy()) : this;
            }
            case SET:
                return Value.set(asSet().copy());
            case RECORD:
                return Value.record(asRecord().copy());
            case VARIANT: {
                Value inner = (Value) value;
                Value copied = inner.copyForAssignment();
                return copied == inner ? this : Value.variant(copied);
            }
            default:
                return this;
        }
    }

    /** Language-level type name used in diagnostics and operator keys. */
    public String typeName() {
        switch (type) {
            case INTEGER: return "Integer";
            case FLOAT: return "Float";
            case STRING: return "String";
            case BOOLEAN: return "Boolean";
            case NIL: return "Nil";
            case ENUM: return asEnum().getType().getName();
            case ARRAY: return asArray().getType().getName();
            case SET: return asSet().getType().getName();
            case RECORD: return asRecord().getType().getName();
            case OBJECT: return asObject().getClassInfo().getName();
            case INTERFACE: return asInterface().getInterface().getName();
            case CLASS: return "class of " + asClass().getName();
            case FUNCTION_POINTER: return "function pointer";
            case VARIANT: return "Variant";
            case JSON: return "JSONVariant";
            case EXCEPTION: return asException().getClassInfo().getName();
            default: return "Error";
        }
    }

    /** Text shown by Print/PrintLn and string conversions. */
    public String display() {
        switch (type) {
            case INTEGER:
                return Long.toString(asInteger());
            case FLOAT:
                return formatFloat(asFloat());
            case STRING:
                return asString();
            case BOOLEAN:
                return asBool() ? "True" : "False";
            case NIL:
                return "nil";
            case ENUM:
                return asEnum().getName();
            case ARRAY: {
                StringBuilder sb = new StringBuilder("[");
                ArrayValue a = asArray();
                for (int i = 0; i < a.length(); i++) {
                    if (i > 0) sb.append(", ");
                    Value e = a.getPhysical(i);
                    sb.append(e == null ? "nil" : e.display());
                }
                return sb.append(']').toString();
            }
            case SET:
                return asSet().toString();
            case RECORD:
                return asRecord().toString();
            case OBJECT:
                return asObject().getClassInfo().getName();
            case INTERFACE:
                return asInterface().getTarget().getClassInfo().getName();
            case CLASS:
                return asClass().getName();
            case FUNCTION_POINTER:
                return asFunction().getName();
            case VARIANT:
                return ((Value) value).display();
            case JSON:
                return asJson().toString();
            case EXCEPTION:
                return asException().getClassInfo().getName() + ": " + asException().getMessage();
            default:
                return "ERROR: " + value;
        }
    }

    public static String formatFloat(double d) {
        if (Double.isNaN(d)) return "NaN";
        if (Double.isInfinite(d)) return d > 0 ? "INF" : "-INF";
        if (d == Math.rint(d) && Math.abs(d) < 1e15) {
            return Long.toString((long) d);
        }
        return Double.toString(d);
    }

    @Override
    public String toString() {
        switch (type) {
            case STRING:
                return '"' + asString() + '"';
            case ERROR:
                return "ERROR(" + value + ")";
            default:
                return display();
        }
    }
}
