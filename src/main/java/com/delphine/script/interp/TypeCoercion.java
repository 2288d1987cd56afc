package com.delphine.script.interp;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.delphine.debug.Debug;
import com.delphine.script.ast.Token;
import com.delphine.script.runtime.ArrayValue;
import com.delphine.script.runtime.InterfaceInstance;
import com.delphine.script.runtime.JsonValues;
import com.delphine.script.runtime.SetValue;
import com.delphine.script.runtime.Value;
import com.delphine.script.types.ArrayType;
import com.delphine.script.types.ClassInfo;
import com.delphine.script.types.ConversionEntry;
import com.delphine.script.types.ConversionRegistry;
import com.delphine.script.types.DataType;
import com.delphine.script.types.InterfaceInfo;
import com.delphine.script.types.SetType;
import com.delphine.script.types.TypeKind;

/**
 * The single value-to-declared-type conversion used by assignments, variable
 * initializers, argument binding, return values, property setters and field
 * initializers. Falls back to the user's implicit conversion chain and fails
 * hard when nothing applies.
 */
final class TypeCoercion {

    private static final String TAG = "Types";

    private final Interpreter interp;

    TypeCoercion(Interpreter interp) {
        this.interp = interp;
    }

    Value coerce(Value v, DataType target, Token at) {
        if (v.isError()) return v;
        if (target == null || target.getKind() == TypeKind.UNKNOWN) return v;
        if (target.getKind() == TypeKind.VARIANT) return Value.variant(v);

        Value src = v.unwrapVariant();

        if (src.isNil()) {
            if (target.getKind() == TypeKind.JSON) return Value.json(JsonValues.toJson(src));
            if (ValueTypes.acceptsNil(target)) return src;
            return incompatible(src, target, at);
        }

        Value direct = direct(src, target);
        if (direct != null) return direct;

        return viaImplicitChain(src, target, at);
    }

    /** Conversions the language applies on its own, without user conversions; null when none fits. */
    private Value direct(Value src, DataType target) {
        switch (target.getKind()) {
            case INTEGER:
                return src.getType() == Value.Type.INTEGER ? src : null;
            case FLOAT:
                if (src.getType() == Value.Type.FLOAT) return src;
                if (src.getType() == Value.Type.INTEGER) return Value.floating(src.asInteger());
                return null;
            case STRING:
                return src.getType() == Value.Type.STRING ? src : null;
            case BOOLEAN:
                return src.getType() == Value.Type.BOOLEAN ? src : null;
            case ENUM:
                return src.getType() == Value.Type.ENUM && ValueTypes.sameType(src.asEnum().getType(), target) ? src : null;
            case RECORD:
                return src.getType() == Value.Type.RECORD && ValueTypes.sameType(src.asRecord().getType(), target) ? src : null;
            case ARRAY:
                return src.getType() == Value.Type.ARRAY ? coerceArray(src.asArray(), (ArrayType) target) : null;
            case SET:
                if (src.getType() == Value.Type.SET) return src.asSet().getType().equals(target) ? src : null;
                return src.getType() == Value.Type.ARRAY ? setOf(src.asArray(), (SetType) target) : null;
            case CLASS: {
                ClassInfo cls = (ClassInfo) target;
                if (src.getType() == Value.Type.OBJECT && src.asObject().isInstanceOf(cls)) return src;
                if (src.getType() == Value.Type.INTERFACE && src.asInterface().getTarget().isInstanceOf(cls)) {
                    return Value.object(src.asInterface().getTarget());
                }
                return null;
            }
            case INTERFACE: {
                InterfaceInfo iface = (InterfaceInfo) target;
                if (src.getType() == Value.Type.OBJECT && src.asObject().getClassInfo().implementsInterface(iface)) {
                    return Value.intf(new InterfaceInstance(iface, src.asObject()));
                }
                if (src.getType() == Value.Type.INTERFACE) {
                    InterfaceInstance ii = src.asInterface();
                    if (ValueTypes.sameType(ii.getInterface(), iface)) return src;
                    if (ii.getInterface().isCompatibleWith(iface)
                            || ii.getTarget().getClassInfo().implementsInterface(iface)) {
                        return Value.intf(new InterfaceInstance(iface, ii.getTarget()));
                    }
                }
                return null;
            }
            case FUNCTION:
                return src.getType() == Value.Type.FUNCTION_POINTER ? src : null;
            case JSON:
                return src.getType() == Value.Type.JSON ? src : Value.json(JsonValues.toJson(src));
            default:
                return null;
        }
    }

    /**
     * Same type keeps the value (dynamic arrays keep aliasing). A compatible
     * array of another type is rebuilt with the target type and its elements
     * converted.
     */
    private Value coerceArray(ArrayValue arr, ArrayType target) {
        ArrayType have = arr.getType();
        if (have.equals(target)) return Value.array(arr);
        if (target.isStatic() && arr.length() != target.size()) return null;

        DataType elemType = target.getElementType();
        boolean elementsAsIs = elemType.getKind() == TypeKind.UNKNOWN || have.isCompatibleWith(target)
                && ValueTypes.sameType(have.getElementType(), elemType);

        List<Value> out = new ArrayList<>(arr.length());
        for (Value e : arr.elements()) {
            if (e == null || elementsAsIs) {
                out.add(e == null ? null : e.copyForAssignment());
                continue;
            }
            Value src = e.unwrapVariant();
            Value c;
            if (elemType.getKind() == TypeKind.VARIANT) {
                c = Value.variant(e);
            } else if (src.isNil()) {
                c = ValueTypes.acceptsNil(elemType) ? src : null;
            } else {
                c = direct(src, elemType);
            }
            if (c == null) return null;
            out.add(c);
        }
        return Value.array(new ArrayValue(target, out));
    }

    /** An array of the set's base type (or an empty array of any type) becomes a set of its elements. */
    private Value setOf(ArrayValue arr, SetType target) {
        SetValue set = new SetValue(target);
        for (Value e : arr.elements()) {
            if (e == null) return null;
            Value c = direct(e.unwrapVariant(), target.getElementType());
            if (c == null) return null;
            set.include(ValueTypes.ordinalOf(c));
        }
        return Value.set(set);
    }

    private Value viaImplicitChain(Value src, DataType target, Token at) {
        ConversionRegistry conversions = interp.types.getConversions();
        if (conversions.hasImplicitConversions()) {
            String from = ValueTypes.typeKey(src);
            List<ConversionEntry> chain = conversions.findImplicitChain(from, target.key());
            if (chain != null) {
                return applyChain(chain, src, at);
            }
            Debug.get().t(TAG, "no implicit chain " + from + " -> " + target.key()
                    + " within " + ConversionRegistry.MAX_CONVERSION_CHAIN_DEPTH + " steps");
        }
        return incompatible(src, target, at);
    }

    /** Applies each conversion's binding function in order. */
    Value applyChain(List<ConversionEntry> chain, Value v, Token at) {
        Value current = v;
        for (ConversionEntry step : chain) {
            current = interp.callUserFunction(step.getBindingName(), Collections.singletonList(current), at);
            if (interp.aborted(current)) return current;
        }
        return current;
    }

    private Value incompatible(Value src, DataType target, Token at) {
        return interp.error(at, "incompatible types: cannot convert " + src.typeName() + " to " + target.getName());
    }

    /**
     * How well a value fits a parameter type: 2 exact, 1 convertible, 0 not at
     * all. Used to rank overloads of equal arity.
     */
    int assignability(Value v, DataType target) {
        if (target == null || target.getKind() == TypeKind.UNKNOWN) return 1;
        if (target.getKind() == TypeKind.VARIANT) return v.getType() == Value.Type.VARIANT ? 2 : 1;

        Value src = v.unwrapVariant();
        if (src.isNil()) return ValueTypes.acceptsNil(target) ? 2 : 0;

        DataType have = ValueTypes.typeOf(src);
        if (have != null && ValueTypes.sameType(have, target)) {
            if (!(have instanceof ArrayType) || have.equals(target)) return 2;
        }
        if (target.getKind() == TypeKind.CLASS && src.getType() == Value.Type.OBJECT) {
            return src.asObject().isInstanceOf((ClassInfo) target) ? 1 : 0;
        }
        if (direct(src, target) != null) return 1;

        ConversionRegistry conversions = interp.types.getConversions();
        if (conversions.hasImplicitConversions()
                && conversions.findImplicitChain(ValueTypes.typeKey(src), target.key()) != null) {
            return 1;
        }
        return 0;
    }
}
