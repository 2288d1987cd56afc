package com.delphine.script.builtins;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

import com.delphine.script.types.Names;

/** Case-insensitive name to builtin. Later registrations replace earlier ones. */
public final class BuiltinRegistry {

    private final Map<String, BuiltinFunction> functions = new LinkedHashMap<>();
    private final Map<String, String> displayNames = new LinkedHashMap<>();

    public static BuiltinRegistry withCoreLibrary() {
        BuiltinRegistry r = new BuiltinRegistry();
        CoreBuiltins.registerAll(r);
        return r;
    }

    public void register(String name, BuiltinFunction fn) {
        if (name == null || name.trim().isEmpty()) throw new IllegalArgumentException("builtin name must not be empty");
        if (fn == null) throw new IllegalArgumentException("builtin " + name + " has no implementation");
        functions.put(Names.normalize(name), fn);
        displayNames.put(Names.normalize(name), name);
    }

    public BuiltinFunction find(String name) {
        return functions.get(Names.normalize(name));
    }

    public boolean has(String name) {
        return functions.containsKey(Names.normalize(name));
    }

    public Set<String> names() {
        return Collections.unmodifiableSet(new LinkedHashSet<>(displayNames.values()));
    }

    /** Copy that can be extended per run without touching this registry. */
    public BuiltinRegistry copy() {
        BuiltinRegistry r = new BuiltinRegistry();
        r.functions.putAll(functions);
        r.displayNames.putAll(displayNames);
        return r;
    }
}
