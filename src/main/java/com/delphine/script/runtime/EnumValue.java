package com.delphine.script.runtime;

import com.delphine.script.types.EnumType;

public final class EnumValue {

    private final EnumType type;
    private final String name;
    private final long ordinal;

    public EnumValue(EnumType type, String name, long ordinal) {
        this.type = type;
        this.name = name;
        this.ordinal = ordinal;
    }

    public EnumType getType() { return type; }
    public String getName() { return name; }
    public long getOrdinal() { return ordinal; }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof EnumValue)) return false;
        EnumValue other = (EnumValue) o;
        return other.type == type && other.ordinal == ordinal;
    }

    @Override
    public int hashCode() {
        return type.hashCode() * 31 + Long.hashCode(ordinal);
    }
}
