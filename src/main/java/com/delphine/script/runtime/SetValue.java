package com.delphine.script.runtime;

import java.util.ArrayList;
import java.util.List;
import java.util.TreeSet;

import com.delphine.script.types.EnumType;
import com.delphine.script.types.SetType;

/**
 * Set payload: the ordinals of its members in ascending order. Union,
 * difference and intersection return new sets; include and exclude mutate.
 */
public final class SetValue {

    private final SetType type;
    private final TreeSet<Long> ordinals;

    public SetValue(SetType type) {
        this(type, new TreeSet<>());
    }

    private SetValue(SetType type, TreeSet<Long> ordinals) {
        this.type = type;
        this.ordinals = ordinals;
    }

    public SetType getType() {
        return type;
    }

    public boolean contains(long ordinal) {
        return ordinals.contains(ordinal);
    }

    public void include(long ordinal) {
        ordinals.add(ordinal);
    }

    public void exclude(long ordinal) {
        ordinals.remove(ordinal);
    }

    public int size() {
        return ordinals.size();
    }

    public boolean isEmpty() {
        return ordinals.isEmpty();
    }

    public SetValue union(SetValue other) {
        TreeSet<Long> out = new TreeSet<>(ordinals);
        out.addAll(other.ordinals);
        return new SetValue(type, out);
    }

    public SetValue difference(SetValue other) {
        TreeSet<Long> out = new TreeSet<>(ordinals);
        out.removeAll(other.ordinals);
        return new SetValue(type, out);
    }

    public SetValue intersection(SetValue other) {
        TreeSet<Long> out = new TreeSet<>(ordinals);
        out.retainAll(other.ordinals);
        return new SetValue(type, out);
    }

    public boolean isSubsetOf(SetValue other) {
        return other.ordinals.containsAll(ordinals);
    }

    public SetValue copy() {
        return new SetValue(type, new TreeSet<>(ordinals));
    }

    /** Members as element values, in ordinal order. */
    public List<Value> elements() {
        List<Value> out = new ArrayList<>(ordinals.size());
        for (long o : ordinals) out.add(elementValue(o));
        return out;
    }

    private Value elementValue(long ordinal) {
        if (!type.isEnumSet()) return Value.integer(ordinal);
        EnumType et = (EnumType) type.getElementType();
        String name = et.nameOf(ordinal);
        return Value.enumValue(new EnumValue(et, name == null ? Long.toString(ordinal) : name, ordinal));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SetValue)) return false;
        SetValue other = (SetValue) o;
        return type.equals(other.type) && ordinals.equals(other.ordinals);
    }

    @Override
    public int hashCode() {
        return type.hashCode() * 31 + ordinals.hashCode();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("[");
        boolean first = true;
        for (Value e : elements()) {
            if (!first) sb.append(", ");
            sb.append(e.display());
            first = false;
        }
        return sb.append(']').toString();
    }
}
