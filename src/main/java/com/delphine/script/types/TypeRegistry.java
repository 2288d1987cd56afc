package com.delphine.script.types;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.delphine.debug.Debug;
import com.delphine.script.ast.TypeRef;

/**
 * Owns every type descriptor declared during one interpreter's lifetime,
 * plus the global operator table and the conversion registry.
 */
public final class TypeRegistry {

    private static final String TAG = "Types";

    private final Map<String, DataType> primitives = new LinkedHashMap<>();
    private final Map<String, ClassInfo> classes = new LinkedHashMap<>();
    private final Map<String, RecordType> records = new LinkedHashMap<>();
    private final Map<String, InterfaceInfo> interfaces = new LinkedHashMap<>();
    private final Map<String, EnumType> enums = new LinkedHashMap<>();
    private final Map<String, DataType> aliases = new LinkedHashMap<>();

    private final OperatorRegistry globalOperators = new OperatorRegistry();
    private final ConversionRegistry conversions = new ConversionRegistry();

    public TypeRegistry() {
        primitives.put("integer", PrimitiveType.INTEGER);
        primitives.put("int64", PrimitiveType.INTEGER);
        primitives.put("float", PrimitiveType.FLOAT);
        primitives.put("double", PrimitiveType.FLOAT);
        primitives.put("string", PrimitiveType.STRING);
        primitives.put("boolean", PrimitiveType.BOOLEAN);
        primitives.put("variant", PrimitiveType.VARIANT);
        primitives.put("jsonvariant", PrimitiveType.JSON);
    }

    public OperatorRegistry getGlobalOperators() { return globalOperators; }
    public ConversionRegistry getConversions() { return conversions; }

    // -------------------------
    // Registration
    // -------------------------

    private void checkNameFree(String name) {
        if (lookup(name) != null) {
            throw new TypeDeclarationException("type " + name + " already declared");
        }
    }

    public void registerClass(ClassInfo info) {
        checkNameFree(info.getName());
        classes.put(Names.normalize(info.getName()), info);
        Debug.get().d(TAG, "registered class " + info.getName()
                + (info.getParent() == null ? "" : " extends " + info.getParent().getName()));
    }

    public void registerRecord(RecordType type) {
        checkNameFree(type.getName());
        records.put(Names.normalize(type.getName()), type);
        Debug.get().d(TAG, "registered record " + type.getName());
    }

    public void registerInterface(InterfaceInfo info) {
        checkNameFree(info.getName());
        interfaces.put(Names.normalize(info.getName()), info);
        Debug.get().d(TAG, "registered interface " + info.getName());
    }

    public void registerEnum(EnumType type) {
        checkNameFree(type.getName());
        enums.put(Names.normalize(type.getName()), type);
    }

    public void registerAlias(String name, DataType target) {
        checkNameFree(name);
        aliases.put(Names.normalize(name), target);
    }

    // -------------------------
    // Lookup
    // -------------------------

    /** @return the named type, or null */
    public DataType lookup(String name) {
        String key = Names.normalize(name);
        DataType t = primitives.get(key);
        if (t != null) return t;
        t = aliases.get(key);
        if (t != null) return t;
        t = classes.get(key);
        if (t != null) return t;
        t = records.get(key);
        if (t != null) return t;
        t = interfaces.get(key);
        if (t != null) return t;
        return enums.get(key);
    }

    public ClassInfo findClass(String name) {
        return classes.get(Names.normalize(name));
    }

    public RecordType findRecord(String name) {
        return records.get(Names.normalize(name));
    }

    public InterfaceInfo findInterface(String name) {
        return interfaces.get(Names.normalize(name));
    }

    public Collection<EnumType> getEnums() {
        return Collections.unmodifiableCollection(enums.values());
    }

    /** Enum type declaring the member name, or null. */
    public EnumType findEnumByMember(String member) {
        for (EnumType e : enums.values()) {
            if (e.hasMember(member)) return e;
        }
        return null;
    }

    /**
     * Resolves a source type expression.
     *
     * @throws TypeDeclarationException when a named type is unknown
     */
    public DataType resolve(TypeRef ref) {
        if (ref == null) return null;
        switch (ref.kind) {
            case NAMED: {
                DataType t = lookup(ref.name);
                if (t == null) throw new TypeDeclarationException("unknown type " + ref.name);
                return t;
            }
            case STATIC_ARRAY:
                return ArrayType.fixed(ref.low, ref.high, resolve(ref.elementType));
            case DYNAMIC_ARRAY:
                return ArrayType.dynamic(resolve(ref.elementType));
            case SET:
                return SetType.of(resolve(ref.elementType));
            default: {
                List<DataType> params = new ArrayList<>();
                for (TypeRef p : ref.paramTypes) params.add(resolve(p));
                return new FunctionType(ref.toString(), params, resolve(ref.returnType));
            }
        }
    }
}
