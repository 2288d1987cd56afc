package com.delphine.script.types;

import java.util.Collections;
import java.util.List;

/** Function pointer type; returnType null for procedures. */
public final class FunctionType implements DataType {

    private final String name;
    private final List<DataType> paramTypes;
    private final DataType returnType;

    public FunctionType(String name, List<DataType> paramTypes, DataType returnType) {
        this.name = name;
        this.paramTypes = paramTypes == null ? Collections.emptyList() : paramTypes;
        this.returnType = returnType;
    }

    public List<DataType> getParamTypes() { return paramTypes; }
    public DataType getReturnType() { return returnType; }

    @Override
    public TypeKind getKind() {
        return TypeKind.FUNCTION;
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
