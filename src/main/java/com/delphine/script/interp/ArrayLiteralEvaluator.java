package com.delphine.script.interp;

import java.util.ArrayList;
import java.util.List;

import com.delphine.script.ast.Expr;
import com.delphine.script.ast.Token;
import com.delphine.script.ast.TypeRef;
import com.delphine.script.runtime.ArrayValue;
import com.delphine.script.runtime.SetValue;
import com.delphine.script.runtime.Value;
import com.delphine.script.types.ArrayType;
import com.delphine.script.types.ClassInfo;
import com.delphine.script.types.DataType;
import com.delphine.script.types.PrimitiveType;
import com.delphine.script.types.SetType;
import com.delphine.script.types.TypeDeclarationException;
import com.delphine.script.types.TypeKind;

/**
 * Builds array values from [a, b, c]. The array type comes from the literal's
 * annotation, the surrounding context, the semantic side table, or inference
 * over the elements, in that order. Where any of those names a set type the
 * literal builds a set instead.
 */
final class ArrayLiteralEvaluator {

    private final Interpreter interp;

    ArrayLiteralEvaluator(Interpreter interp) {
        this.interp = interp;
    }

    Value evaluate(Expr.ArrayLiteral expr, DataType expected) {
        try {
            return build(expr, expected);
        } catch (TypeDeclarationException e) {
            return interp.error(expr.bracket, e.getMessage());
        }
    }

    private Value build(Expr.ArrayLiteral expr, DataType expected) {
        DataType context = contextType(expr, expected);
        if (context instanceof SetType) return buildSet(expr, (SetType) context);
        ArrayType type = context instanceof ArrayType ? (ArrayType) context : null;

        DataType elementExpected = type == null ? null : type.getElementType();
        List<Value> values = new ArrayList<>(expr.elements.size());
        for (Expr.ExprInterface e : expr.elements) {
            Value v = interp.evaluateWithExpected(e, elementExpected);
            if (interp.aborted(v)) return v;
            values.add(v);
        }

        if (type == null) {
            if (values.isEmpty()) {
                return Value.array(new ArrayValue(ArrayType.dynamic(PrimitiveType.UNKNOWN), null));
            }
            type = ArrayType.fixed(0, values.size() - 1, inferElementType(values));
        }

        if (type.isStatic() && values.size() != type.size()) {
            return interp.error(expr.bracket, "array literal has " + values.size()
                    + " elements, expected " + type.size());
        }

        List<Value> elements = new ArrayList<>(values.size());
        for (int i = 0; i < values.size(); i++) {
            Value c = coerceElement(values.get(i), type.getElementType(), i + 1, expr.bracket);
            if (interp.aborted(c)) return c;
            elements.add(c);
        }
        return Value.array(new ArrayValue(type, elements));
    }

    private DataType contextType(Expr.ArrayLiteral expr, DataType expected) {
        if (expr.annotation != null) {
            DataType t = interp.resolveType(expr.annotation);
            if (t instanceof ArrayType || t instanceof SetType) return t;
        }
        if (expected instanceof ArrayType || expected instanceof SetType) return expected;
        if (interp.semanticInfo != null) {
            TypeRef ref = interp.semanticInfo.typeOf(expr);
            if (ref != null) {
                DataType t = interp.resolveType(ref);
                if (t instanceof ArrayType || t instanceof SetType) return t;
            }
        }
        return null;
    }

    /** Every element must be an ordinal of the set's base type; duplicates collapse. */
    private Value buildSet(Expr.ArrayLiteral expr, SetType type) {
        DataType elemType = type.getElementType();
        SetValue set = new SetValue(type);
        for (int i = 0; i < expr.elements.size(); i++) {
            Value v = interp.evaluateWithExpected(expr.elements.get(i), elemType);
            if (interp.aborted(v)) return v;
            Value src = v.unwrapVariant();
            if (!ValueTypes.isOrdinal(src) || interp.coercion.assignability(src, elemType) == 0) {
                return interp.error(expr.bracket, "set element " + (i + 1) + " has type " + src.typeName()
                        + ", expected " + elemType.getName());
            }
            Value c = interp.coercion.coerce(src, elemType, expr.bracket);
            if (interp.aborted(c)) return c;
            set.include(ValueTypes.ordinalOf(c));
        }
        return Value.set(set);
    }

    /**
     * Common element type: nils are skipped, Integer and Float unify to Float,
     * objects unify to their nearest common class.
     *
     * @throws TypeDeclarationException on a mismatch or when every element is nil
     */
    private DataType inferElementType(List<Value> values) {
        DataType unified = null;
        for (int i = 0; i < values.size(); i++) {
            Value v = values.get(i);
            if (v.isNil()) continue;
            DataType t = ValueTypes.typeOf(v);
            if (t == null) t = PrimitiveType.VARIANT;

            if (unified == null || sameElementType(unified, t)) {
                if (unified == null) unified = t;
                continue;
            }
            if (unified.getKind() == TypeKind.INTEGER && t.getKind() == TypeKind.FLOAT) {
                unified = PrimitiveType.FLOAT;
                continue;
            }
            if (unified.getKind() == TypeKind.FLOAT && t.getKind() == TypeKind.INTEGER) {
                continue;
            }
            if (unified instanceof ClassInfo && t instanceof ClassInfo) {
                ClassInfo common = commonAncestor((ClassInfo) unified, (ClassInfo) t);
                if (common != null) {
                    unified = common;
                    continue;
                }
            }
            throw new TypeDeclarationException("array literal element " + (i + 1) + " has type "
                    + t.getName() + ", incompatible with " + unified.getName());
        }
        if (unified == null) {
            throw new TypeDeclarationException("cannot infer the element type of an array literal of nil values");
        }
        return unified;
    }

    private static boolean sameElementType(DataType a, DataType b) {
        if (a instanceof ArrayType && b instanceof ArrayType) {
            return ((ArrayType) a).isCompatibleWith((ArrayType) b);
        }
        return ValueTypes.sameType(a, b);
    }

    private static ClassInfo commonAncestor(ClassInfo a, ClassInfo b) {
        for (ClassInfo c = a; c != null; c = c.getParent()) {
            if (b.isSubclassOf(c)) return c;
        }
        return null;
    }

    /** Per-element conversion into the resolved element type; position is 1-based. */
    private Value coerceElement(Value v, DataType elemType, int position, Token at) {
        if (elemType == null || elemType.getKind() == TypeKind.UNKNOWN) return v.copyForAssignment();
        if (elemType.getKind() == TypeKind.VARIANT) return Value.variant(v);

        Value src = v.unwrapVariant();
        if (src.isNil()) {
            if (ValueTypes.acceptsNil(elemType)) return src;
            return interp.error(at, "cannot assign nil to " + elemType.getName());
        }

        DataType have = ValueTypes.typeOf(src);
        if (have != null && ValueTypes.sameType(have, elemType)
                && (!(have instanceof ArrayType) || have.equals(elemType))) {
            return src.copyForAssignment();
        }
        if (src.getType() == Value.Type.INTEGER && elemType.getKind() == TypeKind.FLOAT) {
            return Value.floating(src.asInteger());
        }
        if (have instanceof ArrayType && elemType instanceof ArrayType) {
            ArrayType from = (ArrayType) have;
            ArrayType to = (ArrayType) elemType;
            if (from.isCompatibleWith(to) || to.isCompatibleWith(from)) {
                Value c = interp.coercion.coerce(src, elemType, at);
                if (!c.isError()) return c.copyForAssignment();
            }
        } else if (interp.coercion.assignability(src, elemType) > 0) {
            Value c = interp.coercion.coerce(src, elemType, at);
            return interp.aborted(c) ? c : c.copyForAssignment();
        }
        return interp.error(at, "array element " + position + " has incompatible type (got "
                + src.typeName() + ", expected " + elemType.getName() + ")");
    }
}
