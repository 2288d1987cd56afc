package com.delphine.script.interp;

import com.delphine.script.runtime.Value;
import com.delphine.script.types.DataType;
import com.delphine.script.types.Names;
import com.delphine.script.types.PrimitiveType;
import com.delphine.script.types.TypeKind;

/** Runtime type of a value, as used by coercion, inference and operator keys. */
final class ValueTypes {

    private ValueTypes() {}

    /** @return the value's type, or null for kinds with no declarable type (class refs, errors) */
    static DataType typeOf(Value v) {
        switch (v.getType()) {
            case INTEGER: return PrimitiveType.INTEGER;
            case FLOAT: return PrimitiveType.FLOAT;
            case STRING: return PrimitiveType.STRING;
            case BOOLEAN: return PrimitiveType.BOOLEAN;
            case NIL: return PrimitiveType.NIL;
            case VARIANT: return PrimitiveType.VARIANT;
            case JSON: return PrimitiveType.JSON;
            case ENUM: return v.asEnum().getType();
            case ARRAY: return v.asArray().getType();
            case SET: return v.asSet().getType();
            case RECORD: return v.asRecord().getType();
            case OBJECT: return v.asObject().getClassInfo();
            case INTERFACE: return v.asInterface().getInterface();
            default: return null;
        }
    }

    /** Normalized type name used in operator tuples and conversion keys. */
    static String typeKey(Value v) {
        DataType t = typeOf(v);
        return t == null ? Names.normalize(v.typeName()) : t.key();
    }

    static boolean sameType(DataType a, DataType b) {
        if (a == null || b == null) return false;
        if (a == b) return true;
        return a.getKind() == b.getKind() && Names.same(a.getName(), b.getName());
    }

    static boolean isOrdinal(Value v) {
        return v.getType() == Value.Type.INTEGER || v.getType() == Value.Type.ENUM;
    }

    static long ordinalOf(Value v) {
        return v.getType() == Value.Type.ENUM ? v.asEnum().getOrdinal() : v.asInteger();
    }

    static boolean acceptsNil(DataType t) {
        return t == null || t.isReferenceType() || t.getKind() == TypeKind.VARIANT || t.getKind() == TypeKind.JSON;
    }
}
