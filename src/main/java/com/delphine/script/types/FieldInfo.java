package com.delphine.script.types;

import com.delphine.script.ast.Expr;

public final class FieldInfo {

    private final String name;
    private final DataType type;
    private final Expr.ExprInterface initializer;
    private final String ownerName;

    public FieldInfo(String name, DataType type, Expr.ExprInterface initializer, String ownerName) {
        this.name = name;
        this.type = type;
        this.initializer = initializer;
        this.ownerName = ownerName;
    }

    public String getName() { return name; }
    public DataType getType() { return type; }
    public Expr.ExprInterface getInitializer() { return initializer; }
    public String getOwnerName() { return ownerName; }
}
