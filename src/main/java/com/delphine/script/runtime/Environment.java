package com.delphine.script.runtime;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.delphine.script.types.DataType;
import com.delphine.script.types.Names;

/**
 * One scope frame. Lookups fall through to the parent; define always binds in
 * this frame; assign mutates the nearest frame that already binds the name.
 * Closures hold the frame itself, so later mutations stay visible to them.
 */
public class Environment {

    private static final class Binding {
        final String name;
        Value value;
        final DataType declaredType;

        Binding(String name, Value value, DataType declaredType) {
            this.name = name;
            this.value = value;
            this.declaredType = declaredType;
        }
    }

    public final Environment parent;

    private final Map<String, Binding> vars = new LinkedHashMap<>();

    public Environment() {
        this.parent = null;
    }

    private Environment(Environment parent) {
        this.parent = parent;
    }

    public Environment childScope() {
        return new Environment(this);
    }

    // -------------------------
    // Vars API
    // -------------------------

    public void define(String name, Value value) {
        define(name, value, null);
    }

    /** Binds in this frame, replacing any binding of the same name here. */
    public void define(String name, Value value, DataType declaredType) {
        vars.put(Names.normalize(name), new Binding(name, value, declaredType));
    }

    /** @return the nearest binding's value, or null if the name is unbound */
    public Value lookup(String name) {
        Binding b = find(name);
        return b == null ? null : b.value;
    }

    /** Declared type of the nearest binding; null when unbound or untyped. */
    public DataType declaredType(String name) {
        Binding b = find(name);
        return b == null ? null : b.declaredType;
    }

    public boolean exists(String name) {
        return find(name) != null;
    }

    public boolean existsInCurrentScope(String name) {
        return vars.containsKey(Names.normalize(name));
    }

    /** @return false when no frame binds the name */
    public boolean assign(String name, Value value) {
        Binding b = find(name);
        if (b == null) return false;
        b.value = value;
        return true;
    }

    private Binding find(String name) {
        String key = Names.normalize(name);
        for (Environment e = this; e != null; e = e.parent) {
            Binding b = e.vars.get(key);
            if (b != null) return b;
        }
        return null;
    }

    /** Visible bindings, inner frames shadowing outer ones, keyed by declared spelling. */
    public Map<String, Value> snapshot() {
        List<Environment> chain = new ArrayList<>();
        for (Environment e = this; e != null; e = e.parent) chain.add(e);
        Collections.reverse(chain);

        Map<String, Binding> merged = new LinkedHashMap<>();
        for (Environment e : chain) merged.putAll(e.vars);

        Map<String, Value> out = new LinkedHashMap<>();
        for (Binding b : merged.values()) out.put(b.name, b.value);
        return out;
    }

    public Environment root() {
        Environment e = this;
        while (e.parent != null) e = e.parent;
        return e;
    }
}
