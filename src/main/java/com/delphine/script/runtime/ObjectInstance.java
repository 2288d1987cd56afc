package com.delphine.script.runtime;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

import com.delphine.script.types.ClassInfo;
import com.delphine.script.types.Names;

/** A class instance. Shared by reference; fields mutate in place. */
public final class ObjectInstance {

    private static final AtomicLong IDS = new AtomicLong();

    private final ClassInfo classInfo;
    private final long id;
    private final LinkedHashMap<String, Value> fields = new LinkedHashMap<>();

    public ObjectInstance(ClassInfo classInfo) {
        this.classInfo = classInfo;
        this.id = IDS.incrementAndGet();
    }

    public ClassInfo getClassInfo() { return classInfo; }
    public long getId() { return id; }

    public boolean hasField(String name) {
        return fields.containsKey(Names.normalize(name));
    }

    public Value getField(String name) {
        return fields.get(Names.normalize(name));
    }

    public void setField(String name, Value value) {
        fields.put(Names.normalize(name), value);
    }

    public Map<String, Value> fields() {
        return Collections.unmodifiableMap(fields);
    }

    public boolean isInstanceOf(ClassInfo other) {
        return classInfo.isSubclassOf(other);
    }

    @Override
    public String toString() {
        return classInfo.getName() + "#" + id;
    }
}
