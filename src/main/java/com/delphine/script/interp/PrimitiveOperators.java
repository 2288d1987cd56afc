package com.delphine.script.interp;

import java.util.Map;
import java.util.Objects;

import com.delphine.script.ast.Token;
import com.delphine.script.runtime.ArrayValue;
import com.delphine.script.runtime.RecordValue;
import com.delphine.script.runtime.SetValue;
import com.delphine.script.runtime.Value;
import com.delphine.script.types.DataType;

/**
 * Built-in operator semantics over primitive operands. Returns null when the
 * operand kinds have no built-in meaning, so the caller can try user overloads.
 */
final class PrimitiveOperators {

    private PrimitiveOperators() {}

    static Value binary(String op, Value left, Value right, Token at) {
        boolean viaVariant = left.getType() == Value.Type.VARIANT || right.getType() == Value.Type.VARIANT;
        Value l = left.unwrapVariant();
        Value r = right.unwrapVariant();

        switch (op) {
            case "=":
                return Value.bool(valuesEqual(l, r));
            case "<>":
                return Value.bool(!valuesEqual(l, r));
            case "in":
                return membership(l, r);
            default:
                break;
        }

        Value.Type lt = l.getType();
        Value.Type rt = r.getType();

        if (lt == Value.Type.INTEGER && rt == Value.Type.INTEGER) {
            return integers(op, l.asInteger(), r.asInteger(), at);
        }
        if (l.isNumeric() && r.isNumeric()) {
            return floats(op, l.asNumber(), r.asNumber(), at);
        }
        if (lt == Value.Type.STRING && rt == Value.Type.STRING) {
            return strings(op, l.asString(), r.asString());
        }
        if (op.equals("+") && viaVariant && (lt == Value.Type.STRING || rt == Value.Type.STRING)) {
            return Value.string(l.display() + r.display());
        }
        if (lt == Value.Type.BOOLEAN && rt == Value.Type.BOOLEAN) {
            return booleans(op, l.asBool(), r.asBool());
        }
        if (lt == Value.Type.SET && rt == Value.Type.SET && l.asSet().getType().equals(r.asSet().getType())) {
            return sets(op, l.asSet(), r.asSet());
        }
        if (lt == Value.Type.ENUM && rt == Value.Type.ENUM
                && ValueTypes.sameType(l.asEnum().getType(), r.asEnum().getType())) {
            return compare(op, Long.compare(l.asEnum().getOrdinal(), r.asEnum().getOrdinal()));
        }
        return null;
    }

    static Value unary(String op, Value operand) {
        Value v = operand.unwrapVariant();
        switch (op) {
            case "-":
                if (v.getType() == Value.Type.INTEGER) return Value.integer(-v.asInteger());
                if (v.getType() == Value.Type.FLOAT) return Value.floating(-v.asFloat());
                return null;
            case "+":
                return v.isNumeric() ? v : null;
            case "not":
                if (v.getType() == Value.Type.BOOLEAN) return Value.bool(!v.asBool());
                if (v.getType() == Value.Type.INTEGER) return Value.integer(~v.asInteger());
                return null;
            default:
                return null;
        }
    }

    private static Value integers(String op, long a, long b, Token at) {
        switch (op) {
            case "+": return Value.integer(a + b);
            case "-": return Value.integer(a - b);
            case "*": return Value.integer(a * b);
            case "/":
                if (b == 0) return Value.error(Interpreter.errorAt(at, "division by zero"));
                return Value.floating((double) a / (double) b);
            case "div":
                if (b == 0) return Value.error(Interpreter.errorAt(at, "division by zero"));
                return Value.integer(a / b);
            case "mod":
                if (b == 0) return Value.error(Interpreter.errorAt(at, "division by zero"));
                return Value.integer(a % b);
            case "shl": return Value.integer(a << b);
            case "shr": return Value.integer(a >>> b);
            case "and": return Value.integer(a & b);
            case "or": return Value.integer(a | b);
            case "xor": return Value.integer(a ^ b);
            default: return compare(op, Long.compare(a, b));
        }
    }

    private static Value floats(String op, double a, double b, Token at) {
        switch (op) {
            case "+": return Value.floating(a + b);
            case "-": return Value.floating(a - b);
            case "*": return Value.floating(a * b);
            case "/":
                if (b == 0) return Value.error(Interpreter.errorAt(at, "division by zero"));
                return Value.floating(a / b);
            default: return compare(op, Double.compare(a, b));
        }
    }

    private static Value strings(String op, String a, String b) {
        if (op.equals("+")) return Value.string(a + b);
        return compare(op, a.compareTo(b));
    }

    private static Value booleans(String op, boolean a, boolean b) {
        switch (op) {
            case "and": return Value.bool(a && b);
            case "or": return Value.bool(a || b);
            case "xor": return Value.bool(a ^ b);
            default: return compare(op, Boolean.compare(a, b));
        }
    }

    private static Value sets(String op, SetValue a, SetValue b) {
        switch (op) {
            case "+": return Value.set(a.union(b));
            case "-": return Value.set(a.difference(b));
            case "*": return Value.set(a.intersection(b));
            case "<=": return Value.bool(a.isSubsetOf(b));
            case ">=": return Value.bool(b.isSubsetOf(a));
            default: return null;
        }
    }

    private static Value compare(String op, int c) {
        switch (op) {
            case "<": return Value.bool(c < 0);
            case "<=": return Value.bool(c <= 0);
            case ">": return Value.bool(c > 0);
            case ">=": return Value.bool(c >= 0);
            default: return null;
        }
    }

    private static Value membership(Value needle, Value haystack) {
        if (haystack.getType() == Value.Type.SET) {
            SetValue set = haystack.asSet();
            if (!ValueTypes.isOrdinal(needle)) return null;
            DataType have = ValueTypes.typeOf(needle);
            if (!ValueTypes.sameType(have, set.getType().getElementType())) return null;
            return Value.bool(set.contains(ValueTypes.ordinalOf(needle)));
        }
        if (haystack.getType() == Value.Type.ARRAY) {
            for (Value e : haystack.asArray().elements()) {
                if (e != null && valuesEqual(needle, e.unwrapVariant())) return Value.bool(true);
            }
            return Value.bool(false);
        }
        if (haystack.getType() == Value.Type.STRING && needle.getType() == Value.Type.STRING) {
            return Value.bool(haystack.asString().contains(needle.asString()));
        }
        return null;
    }

    /**
     * Equality shared by '=', 'in', IndexOf and case labels: numeric across
     * Integer and Float, identity for objects and class references, field-wise
     * for records and arrays, member-wise for sets of the same type.
     */
    static boolean valuesEqual(Value a, Value b) {
        a = a.unwrapVariant();
        b = b.unwrapVariant();
        if (a.isNumeric() && b.isNumeric()) {
            if (a.getType() == Value.Type.INTEGER && b.getType() == Value.Type.INTEGER) {
                return a.asInteger() == b.asInteger();
            }
            return a.asNumber() == b.asNumber();
        }
        if (a.isNil() || b.isNil()) {
            return a.isNil() && b.isNil();
        }
        if (a.getType() == Value.Type.OBJECT || a.getType() == Value.Type.INTERFACE) {
            return a.objectOrNull() == b.objectOrNull();
        }
        if (a.getType() != b.getType()) return false;
        switch (a.getType()) {
            case STRING: return a.asString().equals(b.asString());
            case BOOLEAN: return a.asBool() == b.asBool();
            case ENUM: return a.asEnum().equals(b.asEnum());
            case CLASS: return a.asClass() == b.asClass();
            case JSON: return a.asJson().equals(b.asJson());
            case FUNCTION_POINTER: return a.asFunction() == b.asFunction();
            case RECORD: return recordsEqual(a.asRecord(), b.asRecord());
            case ARRAY: return arraysEqual(a.asArray(), b.asArray());
            case SET: return a.asSet().equals(b.asSet());
            default: return Objects.equals(a.value, b.value);
        }
    }

    private static boolean recordsEqual(RecordValue a, RecordValue b) {
        if (!ValueTypes.sameType(a.getType(), b.getType())) return false;
        for (Map.Entry<String, Value> e : a.fields().entrySet()) {
            Value other = b.fields().get(e.getKey());
            if (e.getValue() == null || other == null) {
                if (e.getValue() != other) return false;
            } else if (!valuesEqual(e.getValue(), other)) {
                return false;
            }
        }
        return true;
    }

    private static boolean arraysEqual(ArrayValue a, ArrayValue b) {
        if (a == b) return true;
        if (a.length() != b.length()) return false;
        for (int i = 0; i < a.length(); i++) {
            Value x = a.getPhysical(i);
            Value y = b.getPhysical(i);
            if (x == null || y == null) {
                if (x != y) return false;
            } else if (!valuesEqual(x, y)) {
                return false;
            }
        }
        return true;
    }
}
