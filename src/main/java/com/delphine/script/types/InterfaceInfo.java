package com.delphine.script.types;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Interface metadata. Compatibility is decided by method names only: a class
 * implements an interface when it has a method of every name the interface
 * (with its ancestors) declares.
 */
public final class InterfaceInfo implements DataType {

    private final String name;
    private final InterfaceInfo parent;
    private final LinkedHashMap<String, MethodInfo> methods = new LinkedHashMap<>();
    private final LinkedHashMap<String, PropertyInfo> properties = new LinkedHashMap<>();

    public InterfaceInfo(String name, InterfaceInfo parent) {
        this.name = name;
        this.parent = parent;
    }

    public InterfaceInfo getParent() { return parent; }

    public void addMethod(MethodInfo method) {
        methods.put(Names.normalize(method.getName()), method);
    }

    public void addProperty(PropertyInfo property) {
        properties.put(Names.normalize(property.getName()), property);
    }

    /** Own methods plus every inherited one, keyed by normalized name. */
    public Map<String, MethodInfo> allMethods() {
        Map<String, MethodInfo> out = new LinkedHashMap<>();
        if (parent != null) out.putAll(parent.allMethods());
        out.putAll(methods);
        return Collections.unmodifiableMap(out);
    }

    public boolean hasMethod(String methodName) {
        return allMethods().containsKey(Names.normalize(methodName));
    }

    public PropertyInfo findProperty(String propName) {
        String key = Names.normalize(propName);
        for (InterfaceInfo i = this; i != null; i = i.parent) {
            PropertyInfo p = i.properties.get(key);
            if (p != null) return p;
        }
        return null;
    }

    public PropertyInfo getDefaultProperty() {
        for (InterfaceInfo i = this; i != null; i = i.parent) {
            for (PropertyInfo p : i.properties.values()) {
                if (p.isDefault()) return p;
            }
        }
        return null;
    }

    /** This interface can stand in for the other when its method set is a superset. */
    public boolean isCompatibleWith(InterfaceInfo other) {
        return allMethods().keySet().containsAll(other.allMethods().keySet());
    }

    public boolean inheritsFrom(InterfaceInfo other) {
        for (InterfaceInfo i = this; i != null; i = i.parent) {
            if (Names.same(i.name, other.name)) return true;
        }
        return false;
    }

    @Override
    public TypeKind getKind() {
        return TypeKind.INTERFACE;
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
