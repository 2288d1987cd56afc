package com.delphine.script.builtins;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

import com.delphine.script.runtime.ArrayValue;
import com.delphine.script.runtime.JsonValues;
import com.delphine.script.runtime.SetValue;
import com.delphine.script.runtime.Value;
import com.delphine.script.types.ArrayType;
import com.delphine.script.types.Names;
import com.delphine.script.types.PrimitiveType;
import com.fasterxml.jackson.core.JsonProcessingException;

/** The core builtin library registered into every new engine. */
public final class CoreBuiltins {

    private CoreBuiltins() {}

    public static void registerAll(BuiltinRegistry r) {
        registerOutput(r);
        registerConversions(r);
        registerContainers(r);
        registerHigherOrder(r);
        registerJson(r);

        r.register("UpperCase", (ctx, args) -> {
            Value bad = requireArgs(ctx, "UpperCase", args, 1);
            if (bad != null) return bad;
            Value s = args.get(0).unwrapVariant();
            if (s.getType() != Value.Type.STRING) return typeError(ctx, "UpperCase", "String", s);
            return Value.string(s.asString().toUpperCase(Locale.ROOT));
        });

        r.register("LowerCase", (ctx, args) -> {
            Value bad = requireArgs(ctx, "LowerCase", args, 1);
            if (bad != null) return bad;
            Value s = args.get(0).unwrapVariant();
            if (s.getType() != Value.Type.STRING) return typeError(ctx, "LowerCase", "String", s);
            return Value.string(s.asString().toLowerCase(Locale.ROOT));
        });

        r.register("Assert", (ctx, args) -> {
            if (args.isEmpty() || args.size() > 2) {
                return ctx.error("Assert expects 1 or 2 arguments, got " + args.size());
            }
            Value cond = args.get(0).unwrapVariant();
            if (cond.getType() != Value.Type.BOOLEAN) return typeError(ctx, "Assert", "Boolean", cond);
            if (cond.asBool()) return Value.nil();
            String msg = args.size() == 2 ? args.get(1).unwrapVariant().display() : "Assertion failed";
            return ctx.raise("EAssertionFailed", msg);
        });
    }

    // -------------------------
    // Output
    // -------------------------

    private static void registerOutput(BuiltinRegistry r) {
        r.register("Print", (ctx, args) -> {
            ctx.write(joined(args));
            return Value.nil();
        });
        r.register("PrintLn", (ctx, args) -> {
            ctx.write(joined(args) + "\n");
            return Value.nil();
        });
    }

    private static String joined(List<Value> args) {
        StringBuilder sb = new StringBuilder();
        for (Value v : args) sb.append(v.display());
        return sb.toString();
    }

    // -------------------------
    // Conversions
    // -------------------------

    private static void registerConversions(BuiltinRegistry r) {
        r.register("IntToStr", (ctx, args) -> {
            Value bad = requireArgs(ctx, "IntToStr", args, 1);
            if (bad != null) return bad;
            Value v = args.get(0).unwrapVariant();
            if (v.getType() != Value.Type.INTEGER) return typeError(ctx, "IntToStr", "Integer", v);
            return Value.string(Long.toString(v.asInteger()));
        });

        r.register("StrToInt", (ctx, args) -> {
            Value bad = requireArgs(ctx, "StrToInt", args, 1);
            if (bad != null) return bad;
            Value v = args.get(0).unwrapVariant();
            if (v.getType() != Value.Type.STRING) return typeError(ctx, "StrToInt", "String", v);
            try {
                return Value.integer(Long.parseLong(v.asString().trim()));
            } catch (NumberFormatException e) {
                return ctx.raise("EConvertError", "'" + v.asString() + "' is not a valid integer value");
            }
        });

        r.register("FloatToStr", (ctx, args) -> {
            Value bad = requireArgs(ctx, "FloatToStr", args, 1);
            if (bad != null) return bad;
            Value v = args.get(0).unwrapVariant();
            if (!v.isNumeric()) return typeError(ctx, "FloatToStr", "Float", v);
            return Value.string(Value.formatFloat(v.asNumber()));
        });

        r.register("StrToFloat", (ctx, args) -> {
            Value bad = requireArgs(ctx, "StrToFloat", args, 1);
            if (bad != null) return bad;
            Value v = args.get(0).unwrapVariant();
            if (v.getType() != Value.Type.STRING) return typeError(ctx, "StrToFloat", "String", v);
            try {
                return Value.floating(Double.parseDouble(v.asString().trim()));
            } catch (NumberFormatException e) {
                return ctx.raise("EConvertError", "'" + v.asString() + "' is not a valid floating point value");
            }
        });

        r.register("Ord", (ctx, args) -> {
            Value bad = requireArgs(ctx, "Ord", args, 1);
            if (bad != null) return bad;
            Value v = args.get(0).unwrapVariant();
            switch (v.getType()) {
                case INTEGER: return v;
                case ENUM: return Value.integer(v.asEnum().getOrdinal());
                case BOOLEAN: return Value.integer(v.asBool() ? 1 : 0);
                case STRING:
                    if (v.asString().codePointCount(0, v.asString().length()) == 1) {
                        return Value.integer(v.asString().codePointAt(0));
                    }
                    return ctx.error("Ord expects a single character, got '" + v.asString() + "'");
                default:
                    return typeError(ctx, "Ord", "an ordinal value", v);
            }
        });

        r.register("Chr", (ctx, args) -> {
            Value bad = requireArgs(ctx, "Chr", args, 1);
            if (bad != null) return bad;
            Value v = args.get(0).unwrapVariant();
            if (v.getType() != Value.Type.INTEGER) return typeError(ctx, "Chr", "Integer", v);
            long cp = v.asInteger();
            if (cp < 0 || cp > Character.MAX_CODE_POINT) {
                return ctx.raise("ERangeError", "character code " + cp + " out of range");
            }
            return Value.string(new String(Character.toChars((int) cp)));
        });
    }

    // -------------------------
    // Arrays and strings
    // -------------------------

    private static void registerContainers(BuiltinRegistry r) {
        r.register("Length", (ctx, args) -> {
            Value bad = requireArgs(ctx, "Length", args, 1);
            if (bad != null) return bad;
            Value v = args.get(0).unwrapVariant();
            switch (v.getType()) {
                case STRING: return Value.integer(v.asString().codePointCount(0, v.asString().length()));
                case ARRAY: return Value.integer(v.asArray().length());
                case NIL: return Value.integer(0);
                case JSON:
                    if (v.asJson().isContainerNode()) return Value.integer(v.asJson().size());
                    return typeError(ctx, "Length", "a string, array or JSON container", v);
                default:
                    return typeError(ctx, "Length", "a string, array or JSON container", v);
            }
        });

        r.register("Low", (ctx, args) -> {
            Value bad = requireArgs(ctx, "Low", args, 1);
            if (bad != null) return bad;
            Value v = args.get(0).unwrapVariant();
            if (v.getType() == Value.Type.ARRAY) return Value.integer(v.asArray().low());
            if (v.getType() == Value.Type.STRING) return Value.integer(1);
            return typeError(ctx, "Low", "an array or string", v);
        });

        r.register("High", (ctx, args) -> {
            Value bad = requireArgs(ctx, "High", args, 1);
            if (bad != null) return bad;
            Value v = args.get(0).unwrapVariant();
            if (v.getType() == Value.Type.ARRAY) return Value.integer(v.asArray().high());
            if (v.getType() == Value.Type.STRING) {
                return Value.integer(v.asString().codePointCount(0, v.asString().length()));
            }
            return typeError(ctx, "High", "an array or string", v);
        });

        // dynamic arrays are shared, so resizing the payload is visible through the variable
        r.register("SetLength", (ctx, args) -> {
            Value bad = requireArgs(ctx, "SetLength", args, 2);
            if (bad != null) return bad;
            Value arr = args.get(0).unwrapVariant();
            Value n = args.get(1).unwrapVariant();
            if (arr.getType() != Value.Type.ARRAY) return typeError(ctx, "SetLength", "a dynamic array", arr);
            if (n.getType() != Value.Type.INTEGER) return typeError(ctx, "SetLength", "Integer", n);
            ArrayValue a = arr.asArray();
            if (a.getType().isStatic()) return ctx.error("cannot resize a static array");
            if (n.asInteger() < 0) return ctx.raise("ERangeError", "negative array length " + n.asInteger());
            if (n.asInteger() > ArrayValue.MAX_LENGTH) {
                return ctx.raise("ERangeError", "array length " + n.asInteger() + " exceeds " + ArrayValue.MAX_LENGTH);
            }
            a.setLength((int) n.asInteger(), ctx.zeroOf(a.getType().getElementType()));
            return Value.nil();
        });

        // sets are mutated in place; the variable holds the payload being changed
        r.register("Include", (ctx, args) -> changeSet(ctx, "Include", args, true));
        r.register("Exclude", (ctx, args) -> changeSet(ctx, "Exclude", args, false));
    }

    private static Value changeSet(BuiltinContext ctx, String name, List<Value> args, boolean include) {
        Value bad = requireArgs(ctx, name, args, 2);
        if (bad != null) return bad;
        Value s = args.get(0).unwrapVariant();
        Value e = args.get(1).unwrapVariant();
        if (s.getType() != Value.Type.SET) return typeError(ctx, name, "a set", s);

        SetValue set = s.asSet();
        long ordinal;
        if (set.getType().isEnumSet() && e.getType() == Value.Type.ENUM
                && Names.same(e.asEnum().getType().getName(), set.getType().getElementType().getName())) {
            ordinal = e.asEnum().getOrdinal();
        } else if (!set.getType().isEnumSet() && e.getType() == Value.Type.INTEGER) {
            ordinal = e.asInteger();
        } else {
            return typeError(ctx, name, "a " + set.getType().getElementType().getName() + " element", e);
        }

        if (include) {
            set.include(ordinal);
        } else {
            set.exclude(ordinal);
        }
        return Value.nil();
    }

    // -------------------------
    // Higher-order
    // -------------------------

    private static void registerHigherOrder(BuiltinRegistry r) {
        r.register("Map", (ctx, args) -> {
            Value bad = requireCallable(ctx, "Map", args, 2);
            if (bad != null) return bad;
            List<Value> out = new ArrayList<>();
            for (Value e : elementsOf(args.get(0))) {
                Value m = ctx.call(args.get(1), Collections.singletonList(e));
                if (ctx.aborted(m)) return m;
                out.add(m);
            }
            return Value.array(new ArrayValue(ArrayType.dynamic(PrimitiveType.UNKNOWN), out));
        });

        r.register("Filter", (ctx, args) -> {
            Value bad = requireCallable(ctx, "Filter", args, 2);
            if (bad != null) return bad;
            List<Value> out = new ArrayList<>();
            for (Value e : elementsOf(args.get(0))) {
                Value keep = ctx.call(args.get(1), Collections.singletonList(e));
                if (ctx.aborted(keep)) return keep;
                keep = keep.unwrapVariant();
                if (keep.getType() != Value.Type.BOOLEAN) {
                    return ctx.error("Filter predicate must return Boolean, got " + keep.typeName());
                }
                if (keep.asBool()) out.add(e);
            }
            ArrayType source = args.get(0).unwrapVariant().asArray().getType();
            return Value.array(new ArrayValue(ArrayType.dynamic(source.getElementType()), out));
        });

        r.register("Reduce", (ctx, args) -> {
            Value bad = requireCallable(ctx, "Reduce", args, 3);
            if (bad != null) return bad;
            Value acc = args.get(2);
            for (Value e : elementsOf(args.get(0))) {
                acc = ctx.call(args.get(1), List.of(acc, e));
                if (ctx.aborted(acc)) return acc;
            }
            return acc;
        });

        r.register("ForEach", (ctx, args) -> {
            Value bad = requireCallable(ctx, "ForEach", args, 2);
            if (bad != null) return bad;
            for (Value e : elementsOf(args.get(0))) {
                Value res = ctx.call(args.get(1), Collections.singletonList(e));
                if (ctx.aborted(res)) return res;
            }
            return Value.nil();
        });
    }

    private static Value requireCallable(BuiltinContext ctx, String name, List<Value> args, int count) {
        Value bad = requireArgs(ctx, name, args, count);
        if (bad != null) return bad;
        Value arr = args.get(0).unwrapVariant();
        if (arr.getType() != Value.Type.ARRAY) return typeError(ctx, name, "an array", arr);
        Value fn = args.get(1).unwrapVariant();
        if (fn.getType() != Value.Type.FUNCTION_POINTER) return typeError(ctx, name, "a function", fn);
        return null;
    }

    /** Snapshot of the elements, so callbacks that resize the array do not disturb the loop. */
    private static List<Value> elementsOf(Value arrayValue) {
        List<Value> out = new ArrayList<>();
        for (Value e : arrayValue.unwrapVariant().asArray().elements()) out.add(e == null ? Value.nil() : e);
        return out;
    }

    // -------------------------
    // JSON
    // -------------------------

    private static void registerJson(BuiltinRegistry r) {
        r.register("ParseJSON", (ctx, args) -> {
            Value bad = requireArgs(ctx, "ParseJSON", args, 1);
            if (bad != null) return bad;
            Value s = args.get(0).unwrapVariant();
            if (s.getType() != Value.Type.STRING) return typeError(ctx, "ParseJSON", "String", s);
            try {
                return JsonValues.parse(s.asString());
            } catch (JsonProcessingException e) {
                return ctx.raise("EConvertError", "invalid JSON: " + e.getOriginalMessage());
            }
        });

        r.register("JSONStringify", (ctx, args) -> {
            Value bad = requireArgs(ctx, "JSONStringify", args, 1);
            if (bad != null) return bad;
            try {
                return Value.string(JsonValues.stringify(args.get(0)));
            } catch (JsonProcessingException e) {
                return ctx.error("cannot stringify " + args.get(0).typeName() + ": " + e.getOriginalMessage());
            }
        });
    }

    // -------------------------
    // Helpers
    // -------------------------

    private static Value requireArgs(BuiltinContext ctx, String name, List<Value> args, int count) {
        if (args.size() != count) {
            return ctx.error(name + " expects " + count + " argument(s), got " + args.size());
        }
        return null;
    }

    private static Value typeError(BuiltinContext ctx, String name, String expected, Value got) {
        return ctx.error(name + " expects " + expected + ", got " + got.typeName());
    }
}
