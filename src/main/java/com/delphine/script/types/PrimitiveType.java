package com.delphine.script.types;

public final class PrimitiveType implements DataType {

    public static final PrimitiveType INTEGER = new PrimitiveType(TypeKind.INTEGER, "Integer");
    public static final PrimitiveType FLOAT = new PrimitiveType(TypeKind.FLOAT, "Float");
    public static final PrimitiveType STRING = new PrimitiveType(TypeKind.STRING, "String");
    public static final PrimitiveType BOOLEAN = new PrimitiveType(TypeKind.BOOLEAN, "Boolean");
    public static final PrimitiveType VARIANT = new PrimitiveType(TypeKind.VARIANT, "Variant");
    public static final PrimitiveType NIL = new PrimitiveType(TypeKind.NIL, "Nil");
    public static final PrimitiveType JSON = new PrimitiveType(TypeKind.JSON, "JSONVariant");
    public static final PrimitiveType UNKNOWN = new PrimitiveType(TypeKind.UNKNOWN, "Unknown");

    private final TypeKind kind;
    private final String name;

    private PrimitiveType(TypeKind kind, String name) {
        this.kind = kind;
        this.name = name;
    }

    @Override
    public TypeKind getKind() {
        return kind;
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public String toString() {
        return name;
    }
}
