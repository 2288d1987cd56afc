package com.delphine.script.ast;

import java.util.Collections;
import java.util.List;

/**
 * Unresolved type expression as written in source: a named type,
 * an array type (static with bounds or dynamic), a set type, or a function
 * pointer type.
 */
public final class TypeRef {

    public enum Kind { NAMED, STATIC_ARRAY, DYNAMIC_ARRAY, SET, FUNCTION }

    public final Kind kind;
    public final String name;
    public final TypeRef elementType;
    public final long low;
    public final long high;
    public final List<TypeRef> paramTypes;
    public final TypeRef returnType;

    private TypeRef(Kind kind, String name, TypeRef elementType, long low, long high,
                    List<TypeRef> paramTypes, TypeRef returnType) {
        this.kind = kind;
        this.name = name;
        this.elementType = elementType;
        this.low = low;
        this.high = high;
        this.paramTypes = paramTypes;
        this.returnType = returnType;
    }

    public static TypeRef named(String name) {
        return new TypeRef(Kind.NAMED, name, null, 0, 0, Collections.emptyList(), null);
    }

    public static TypeRef staticArray(long low, long high, TypeRef elementType) {
        return new TypeRef(Kind.STATIC_ARRAY, null, elementType, low, high, Collections.emptyList(), null);
    }

    public static TypeRef dynamicArray(TypeRef elementType) {
        return new TypeRef(Kind.DYNAMIC_ARRAY, null, elementType, 0, 0, Collections.emptyList(), null);
    }

    public static TypeRef set(TypeRef elementType) {
        return new TypeRef(Kind.SET, null, elementType, 0, 0, Collections.emptyList(), null);
    }

    /** returnType may be null for procedure pointers. */
    public static TypeRef function(List<TypeRef> paramTypes, TypeRef returnType) {
        return new TypeRef(Kind.FUNCTION, null, null, 0, 0,
                paramTypes == null ? Collections.emptyList() : paramTypes, returnType);
    }

    @Override
    public String toString() {
        switch (kind) {
            case NAMED:
                return name;
            case STATIC_ARRAY:
                return "array[" + low + ".." + high + "] of " + elementType;
            case DYNAMIC_ARRAY:
                return "array of " + elementType;
            case SET:
                return "set of " + elementType;
            default:
                StringBuilder sb = new StringBuilder(returnType == null ? "procedure(" : "function(");
                for (int i = 0; i < paramTypes.size(); i++) {
                    if (i > 0) sb.append(", ");
                    sb.append(paramTypes.get(i));
                }
                sb.append(")");
                if (returnType != null) sb.append(": ").append(returnType);
                return sb.toString();
        }
    }
}
