package com.delphine.script.types;

import java.util.Objects;

/**
 * Static arrays have inclusive [low..high] bounds and value semantics;
 * dynamic arrays are zero-based, growable and shared by reference.
 */
public final class ArrayType implements DataType {

    private final DataType elementType;
    private final boolean dynamic;
    private final long low;
    private final long high;

    private ArrayType(DataType elementType, boolean dynamic, long low, long high) {
        this.elementType = elementType;
        this.dynamic = dynamic;
        this.low = low;
        this.high = high;
    }

    public static ArrayType dynamic(DataType elementType) {
        return new ArrayType(elementType, true, 0, -1);
    }

    public static ArrayType fixed(long low, long high, DataType elementType) {
        if (high < low - 1) {
            throw new TypeDeclarationException("invalid array bounds " + low + ".." + high);
        }
        return new ArrayType(elementType, false, low, high);
    }

    public DataType getElementType() { return elementType; }
    public boolean isDynamic() { return dynamic; }
    public boolean isStatic() { return !dynamic; }
    public long getLow() { return low; }
    public long getHigh() { return high; }

    /** Declared element count of a static array. */
    public int size() {
        return dynamic ? 0 : (int) (high - low + 1);
    }

    /**
     * Arrays are assignable when their element types match (or either side's
     * element type is still unknown) and, for static targets, the sizes agree.
     */
    public boolean isCompatibleWith(ArrayType other) {
        if (other == null) return false;
        if (!elementCompatible(elementType, other.elementType)) return false;
        if (isStatic() && other.isStatic()) return size() == other.size();
        return true;
    }

    private static boolean elementCompatible(DataType a, DataType b) {
        if (a.getKind() == TypeKind.UNKNOWN || b.getKind() == TypeKind.UNKNOWN) return true;
        if (a instanceof ArrayType && b instanceof ArrayType) {
            return ((ArrayType) a).isCompatibleWith((ArrayType) b);
        }
        return a.equals(b) || Names.same(a.getName(), b.getName());
    }

    @Override
    public TypeKind getKind() {
        return TypeKind.ARRAY;
    }

    @Override
    public String getName() {
        if (dynamic) return "array of " + elementType.getName();
        return "array[" + low + ".." + high + "] of " + elementType.getName();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ArrayType)) return false;
        ArrayType that = (ArrayType) o;
        return dynamic == that.dynamic && low == that.low && high == that.high
                && Names.same(elementType.getName(), that.elementType.getName());
    }

    @Override
    public int hashCode() {
        return Objects.hash(dynamic, low, high, Names.normalize(elementType.getName()));
    }

    @Override
    public String toString() {
        return getName();
    }
}
