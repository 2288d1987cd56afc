package com.delphine.script.host;

import java.lang.reflect.Method;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import com.delphine.debug.Debug;
import com.delphine.script.types.Names;

/** Case-insensitive name to host function. Duplicate names are rejected. */
public final class HostFunctionRegistry {

    private static final String TAG = "HostBridge";

    public static final class Entry {
        private final HostSignature signature;
        private final HostFunction function;

        Entry(HostSignature signature, HostFunction function) {
            this.signature = signature;
            this.function = function;
        }

        public HostSignature getSignature() { return signature; }
        public HostFunction getFunction() { return function; }
    }

    private final Map<String, Entry> entries = new LinkedHashMap<>();

    public void register(HostSignature signature, HostFunction function) {
        if (function == null) throw new IllegalArgumentException("host function " + signature.getName() + " is null");
        String key = Names.normalize(signature.getName());
        if (entries.containsKey(key)) {
            throw new IllegalArgumentException("host function " + signature.getName() + " already registered");
        }
        entries.put(key, new Entry(signature, function));
        Debug.get().d(TAG, "registered host function " + signature);
    }

    /** Untyped fixed-arity function: arguments arrive in their natural Java form. */
    public void register(String name, int arity, HostFunction function) {
        register(HostSignature.untyped(name, arity), function);
    }

    /**
     * Registers every public method of the target annotated with {@link HostExport}.
     *
     * @return how many functions were registered
     */
    public int registerMethods(Object target) {
        if (target == null) throw new IllegalArgumentException("target must not be null");
        int count = 0;
        for (Method m : target.getClass().getMethods()) {
            HostExport export = m.getAnnotation(HostExport.class);
            if (export == null) continue;
            String name = export.value().isEmpty() ? m.getName() : export.value();
            ReflectiveHostFunction fn = new ReflectiveHostFunction(name, target, m);
            register(fn.signature(), fn);
            count++;
        }
        return count;
    }

    public Entry find(String name) {
        return entries.get(Names.normalize(name));
    }

    public boolean has(String name) {
        return entries.containsKey(Names.normalize(name));
    }

    public Map<String, Entry> entries() {
        return Collections.unmodifiableMap(entries);
    }

    public HostFunctionRegistry copy() {
        HostFunctionRegistry r = new HostFunctionRegistry();
        r.entries.putAll(entries);
        return r;
    }
}
