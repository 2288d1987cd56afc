package com.delphine.script.types;

/** Resolved runtime type descriptor. */
public interface DataType {

    TypeKind getKind();

    /** Display name as declared, e.g. "Integer", "TPoint", "array[1..5] of Integer". */
    String getName();

    /** Slots of reference types accept nil. */
    default boolean isReferenceType() {
        TypeKind k = getKind();
        return k == TypeKind.CLASS || k == TypeKind.INTERFACE || k == TypeKind.ARRAY || k == TypeKind.FUNCTION;
    }

    /** Registry key for operator and conversion lookups. */
    default String key() {
        return Names.normalize(getName());
    }
}
