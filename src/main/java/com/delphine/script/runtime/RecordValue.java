package com.delphine.script.runtime;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import com.delphine.script.types.FieldInfo;
import com.delphine.script.types.Names;
import com.delphine.script.types.RecordType;

public final class RecordValue {

    private final RecordType type;
    private final LinkedHashMap<String, Value> fields = new LinkedHashMap<>();

    public RecordValue(RecordType type) {
        this.type = type;
    }

    public RecordType getType() { return type; }

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

    public RecordValue copy() {
        RecordValue out = new RecordValue(type);
        for (Map.Entry<String, Value> e : fields.entrySet()) {
            Value v = e.getValue();
            out.fields.put(e.getKey(), v == null ? null : v.copyForAssignment());
        }
        return out;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("(");
        boolean first = true;
        for (FieldInfo f : type.getFields().values()) {
            if (!first) sb.append("; ");
            first = false;
            Value v = getField(f.getName());
            sb.append(f.getName()).append(": ").append(v == null ? "nil" : v.display());
        }
        return sb.append(')').toString();
    }
}
