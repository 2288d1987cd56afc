package com.delphine.script.types;

/**
 * Set of an ordinal base type: an enumeration or Integer. Sets are values;
 * two set types are the same when their base types are.
 */
public final class SetType implements DataType {

    private final DataType elementType;

    private SetType(DataType elementType) {
        this.elementType = elementType;
    }

    /** @throws TypeDeclarationException when the base type is not ordinal */
    public static SetType of(DataType elementType) {
        if (elementType == null) {
            throw new TypeDeclarationException("set type needs an element type");
        }
        TypeKind k = elementType.getKind();
        if (k != TypeKind.ENUM && k != TypeKind.INTEGER) {
            throw new TypeDeclarationException("set element type must be an enumeration or Integer, got "
                    + elementType.getName());
        }
        return new SetType(elementType);
    }

    public DataType getElementType() {
        return elementType;
    }

    public boolean isEnumSet() {
        return elementType.getKind() == TypeKind.ENUM;
    }

    @Override
    public TypeKind getKind() {
        return TypeKind.SET;
    }

    @Override
    public String getName() {
        return "set of " + elementType.getName();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SetType)) return false;
        return Names.same(elementType.getName(), ((SetType) o).elementType.getName());
    }

    @Override
    public int hashCode() {
        return Names.normalize(elementType.getName()).hashCode();
    }

    @Override
    public String toString() {
        return getName();
    }
}
