package com.delphine.script.runtime;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.delphine.script.types.ArrayType;

/**
 * Array payload. Elements are stored by physical position; logical indices of
 * static arrays are offset by the type's low bound.
 */
public final class ArrayValue {

    /** Largest length a dynamic array can be resized to. */
    public static final int MAX_LENGTH = Integer.MAX_VALUE - 8;

    private final ArrayType type;
    private final List<Value> elements;

    public ArrayValue(ArrayType type, List<Value> elements) {
        this.type = type;
        this.elements = (elements == null) ? new ArrayList<>() : new ArrayList<>(elements);
    }

    public ArrayType getType() { return type; }

    public int length() {
        return elements.size();
    }

    public long low() {
        return type.isStatic() ? type.getLow() : 0;
    }

    public long high() {
        return type.isStatic() ? type.getHigh() : elements.size() - 1;
    }

    /** Raw slot; may be null for a never-written dynamic slot. */
    public Value getPhysical(int index) {
        return elements.get(index);
    }

    public void setPhysical(int index, Value v) {
        elements.set(index, v);
    }

    /** Physical position of a logical index, or -1 when out of bounds. */
    public int toPhysical(long index) {
        long offset = index - low();
        if (offset < 0 || offset >= elements.size()) return -1;
        return (int) offset;
    }

    public List<Value> elements() {
        return Collections.unmodifiableList(elements);
    }

    public void add(Value v) {
        requireDynamic("add to");
        elements.add(v);
    }

    public Value removeAt(int index) {
        requireDynamic("delete from");
        return elements.remove(index);
    }

    /** Grows with copies of zero or truncates. */
    public void setLength(int newLength, Value zero) {
        requireDynamic("resize");
        if (newLength < 0 || newLength > MAX_LENGTH) {
            throw new IllegalArgumentException("array length out of range: " + newLength);
        }
        while (elements.size() > newLength) elements.remove(elements.size() - 1);
        while (elements.size() < newLength) elements.add(zero == null ? null : zero.copyForAssignment());
    }

    private void requireDynamic(String what) {
        if (type.isStatic()) {
            throw new IllegalStateException("cannot " + what + " a static array");
        }
    }

    /** Deep copy for value semantics: nested static arrays and records are copied too. */
    public ArrayValue copy() {
        List<Value> out = new ArrayList<>(elements.size());
        for (Value e : elements) out.add(e == null ? null : e.copyForAssignment());
        return new ArrayValue(type, out);
    }
}
