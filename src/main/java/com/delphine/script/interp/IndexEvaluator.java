package com.delphine.script.interp;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.delphine.script.ast.Expr;
import com.delphine.script.ast.Token;
import com.delphine.script.runtime.ArrayValue;
import com.delphine.script.runtime.JsonValues;
import com.delphine.script.runtime.Value;
import com.delphine.script.types.PropertyInfo;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * target[i] reads and writes. Nested index nodes over a member that names an
 * indexed property are flattened into one getter/setter call with every index
 * in source order; any other chain is indexed one level at a time.
 */
final class IndexEvaluator {

    private final Interpreter interp;

    IndexEvaluator(Interpreter interp) {
        this.interp = interp;
    }

    /** Base expression and its index expressions, left to right: obj.Cells[x][y] gives (obj.Cells, [x, y]). */
    private static final class Chain {
        final Expr.ExprInterface base;
        final List<Expr.ExprInterface> indices;

        Chain(Expr.Index expr) {
            List<Expr.ExprInterface> collected = new ArrayList<>();
            Expr.ExprInterface node = expr;
            while (node instanceof Expr.Index) {
                collected.add(((Expr.Index) node).index);
                node = ((Expr.Index) node).target;
            }
            Collections.reverse(collected);
            this.base = node;
            this.indices = collected;
        }
    }

    // -------------------------
    // Reads
    // -------------------------

    Value read(Expr.Index expr) {
        Chain chain = new Chain(expr);

        if (chain.base instanceof Expr.Member) {
            Expr.Member member = (Expr.Member) chain.base;
            Value owner = interp.evaluate(member.target);
            if (interp.aborted(owner)) return owner;
            owner = owner.unwrapVariant();

            PropertyInfo prop = interp.members.findProperty(owner, member.name.lexeme);
            if (prop != null && prop.isIndexed()) {
                List<Value> args = new ArrayList<>();
                Value failed = interp.evalArgs(chain.indices, args, null);
                if (failed != null) return failed;
                return interp.members.readProperty(owner, prop, args, expr.bracket);
            }

            // not an indexed property: one level at a time from the member's value
            Value current = interp.members.readMember(owner, member.name);
            for (Expr.ExprInterface indexExpr : chain.indices) {
                if (interp.aborted(current)) return current;
                Value index = interp.evaluate(indexExpr);
                if (interp.aborted(index)) return index;
                current = indexValue(current, index, expr.bracket);
            }
            return current;
        }

        Value target = interp.evaluate(expr.target);
        if (interp.aborted(target)) return target;
        Value index = interp.evaluate(expr.index);
        if (interp.aborted(index)) return index;
        return indexValue(target, index, expr.bracket);
    }

    /** One level of indexing of an already evaluated container. */
    Value indexValue(Value container, Value rawIndex, Token at) {
        Value target = container.unwrapVariant();
        Value index = rawIndex.unwrapVariant();

        if (target.isNil()) {
            return interp.error(at, "cannot index nil value");
        }
        if (target.getType() == Value.Type.JSON) {
            return jsonGet(target.asJson(), index, at);
        }
        if (target.getType() == Value.Type.OBJECT || target.getType() == Value.Type.INTERFACE
                || target.getType() == Value.Type.RECORD) {
            PropertyInfo dp = interp.members.defaultProperty(target);
            if (dp == null) return interp.error(at, "cannot index type " + target.typeName());
            return interp.members.readProperty(target, dp, Collections.singletonList(index), at);
        }
        if (target.getType() != Value.Type.ARRAY && target.getType() != Value.Type.STRING) {
            return interp.error(at, "cannot index type " + target.typeName());
        }
        if (!ValueTypes.isOrdinal(index)) {
            return interp.error(at, "index must be an ordinal value, got " + index.typeName());
        }
        long i = ValueTypes.ordinalOf(index);

        if (target.getType() == Value.Type.ARRAY) {
            ArrayValue arr = target.asArray();
            int p = arr.toPhysical(i);
            if (p < 0) return outOfBounds(arr, i, at);
            Value e = arr.getPhysical(p);
            return e == null ? interp.zeros.zeroOf(arr.getType().getElementType()) : e;
        }

        String s = target.asString();
        int offset = charOffset(s, i);
        if (offset < 0) {
            return interp.error(at, "string index out of bounds: " + i + " (string length is "
                    + s.codePointCount(0, s.length()) + ")");
        }
        return Value.string(new String(Character.toChars(s.codePointAt(offset))));
    }

    private Value jsonGet(JsonNode node, Value index, Token at) {
        if (node.isObject()) {
            if (index.getType() != Value.Type.STRING) {
                return interp.error(at, "JSON object index must be a String, got " + index.typeName());
            }
            return JsonValues.toValue(node.get(index.asString()));
        }
        if (node.isArray()) {
            if (index.getType() != Value.Type.INTEGER) {
                return interp.error(at, "JSON array index must be an Integer, got " + index.typeName());
            }
            long i = index.asInteger();
            if (i < 0 || i >= node.size()) return Value.nil();
            return JsonValues.toValue(node.get((int) i));
        }
        return interp.error(at, "cannot index type JSONVariant");
    }

    private Value outOfBounds(ArrayValue arr, long i, Token at) {
        if (arr.getType().isStatic()) {
            return interp.error(at, "array index out of bounds: " + i + " (bounds are "
                    + arr.getType().getLow() + ".." + arr.getType().getHigh() + ")");
        }
        return interp.error(at, "array index out of bounds: " + i + " (array length is " + arr.length() + ")");
    }

    /** UTF-16 offset of the 1-based code point index, or -1 when outside the string. */
    private static int charOffset(String s, long index) {
        int length = s.codePointCount(0, s.length());
        if (index < 1 || index > length) return -1;
        return s.offsetByCodePoints(0, (int) index - 1);
    }

    // -------------------------
    // Writes
    // -------------------------

    Value write(Expr.Index expr, Value value, Token at) {
        Chain chain = new Chain(expr);

        if (chain.base instanceof Expr.Member) {
            Expr.Member member = (Expr.Member) chain.base;
            Value owner = interp.evaluate(member.target);
            if (interp.aborted(owner)) return owner;
            owner = owner.unwrapVariant();

            PropertyInfo prop = interp.members.findProperty(owner, member.name.lexeme);
            if (prop != null && prop.isIndexed()) {
                List<Value> args = new ArrayList<>();
                Value failed = interp.evalArgs(chain.indices, args, null);
                if (failed != null) return failed;
                return interp.members.writeProperty(owner, prop, args, value, at);
            }

            if (chain.indices.size() == 1) {
                Value container = interp.members.readMember(owner, member.name);
                if (interp.aborted(container)) return container;
                Value index = interp.evaluate(expr.index);
                if (interp.aborted(index)) return index;
                return store(container, index, value, expr.target, at);
            }
        }

        Value container = interp.evaluate(expr.target);
        if (interp.aborted(container)) return container;
        Value index = interp.evaluate(expr.index);
        if (interp.aborted(index)) return index;
        return store(container, index, value, expr.target, at);
    }

    private Value store(Value containerValue, Value rawIndex, Value value, Expr.ExprInterface containerExpr, Token at) {
        Value target = containerValue.unwrapVariant();
        Value index = rawIndex.unwrapVariant();

        if (target.isNil()) {
            return interp.error(at, "cannot index nil value");
        }
        if (target.getType() == Value.Type.JSON) {
            return jsonSet(target.asJson(), index, value, at);
        }
        if (target.getType() == Value.Type.OBJECT || target.getType() == Value.Type.INTERFACE
                || target.getType() == Value.Type.RECORD) {
            PropertyInfo dp = interp.members.defaultProperty(target);
            if (dp == null) return interp.error(at, "cannot index type " + target.typeName());
            return interp.members.writeProperty(target, dp, Collections.singletonList(index), value, at);
        }
        if (target.getType() != Value.Type.ARRAY && target.getType() != Value.Type.STRING) {
            return interp.error(at, "cannot index type " + target.typeName());
        }
        if (!ValueTypes.isOrdinal(index)) {
            return interp.error(at, "index must be an ordinal value, got " + index.typeName());
        }
        long i = ValueTypes.ordinalOf(index);

        if (target.getType() == Value.Type.ARRAY) {
            ArrayValue arr = target.asArray();
            int p = arr.toPhysical(i);
            if (p < 0) return outOfBounds(arr, i, at);
            Value c = interp.coercion.coerce(value, arr.getType().getElementType(), at);
            if (interp.aborted(c)) return c;
            arr.setPhysical(p, c.copyForAssignment());
            return Value.nil();
        }

        // strings are immutable: build the new string and assign it back to its location
        String s = target.asString();
        int offset = charOffset(s, i);
        if (offset < 0) {
            return interp.error(at, "string index out of bounds: " + i + " (string length is "
                    + s.codePointCount(0, s.length()) + ")");
        }
        Value ch = value.unwrapVariant();
        if (ch.getType() != Value.Type.STRING || ch.asString().isEmpty()) {
            return interp.error(at, "incompatible types: cannot convert " + ch.typeName() + " to Char");
        }
        int cp = ch.asString().codePointAt(0);
        int end = s.offsetByCodePoints(offset, 1);
        String replaced = s.substring(0, offset) + new String(Character.toChars(cp)) + s.substring(end);
        return interp.assignTo(containerExpr, Value.string(replaced), at);
    }

    private Value jsonSet(JsonNode node, Value index, Value value, Token at) {
        if (node.isObject()) {
            if (index.getType() != Value.Type.STRING) {
                return interp.error(at, "JSON object index must be a String, got " + index.typeName());
            }
            ((ObjectNode) node).set(index.asString(), JsonValues.toJson(value));
            return Value.nil();
        }
        if (node.isArray()) {
            if (index.getType() != Value.Type.INTEGER) {
                return interp.error(at, "JSON array index must be an Integer, got " + index.typeName());
            }
            long i = index.asInteger();
            if (i < 0 || i >= node.size()) {
                return interp.error(at, "JSON array index out of bounds: " + i + " (array length is " + node.size() + ")");
            }
            ((ArrayNode) node).set((int) i, JsonValues.toJson(value));
            return Value.nil();
        }
        return interp.error(at, "cannot index type JSONVariant");
    }
}
