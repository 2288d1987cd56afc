package com.delphine.script.types;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.delphine.debug.Debug;
import com.delphine.script.runtime.Value;

/**
 * Class metadata. Mutable while its declaration is processed; frozen once the
 * virtual method table is built. Only class variable values change afterwards.
 */
public final class ClassInfo implements DataType {

    private static final String TAG = "Types";

    private final String name;
    private final ClassInfo parent;
    private final boolean isAbstract;

    // instance fields, parent's copied down first so declaration order is preserved
    private final LinkedHashMap<String, FieldInfo> fields = new LinkedHashMap<>();
    private final LinkedHashMap<String, FieldInfo> classVars = new LinkedHashMap<>();
    private final Map<String, Value> classVarValues = new LinkedHashMap<>();

    private final Map<String, List<MethodInfo>> methods = new LinkedHashMap<>();
    private final Map<String, List<MethodInfo>> classMethods = new LinkedHashMap<>();
    private final Map<String, List<MethodInfo>> constructors = new LinkedHashMap<>();
    private MethodInfo destructor;

    private final LinkedHashMap<String, PropertyInfo> properties = new LinkedHashMap<>();
    private final OperatorRegistry operators = new OperatorRegistry();
    private final List<InterfaceInfo> interfaces = new ArrayList<>();

    private final Map<String, MethodInfo> vmt = new LinkedHashMap<>();
    // base slot key -> slot opened by the nearest reintroduce
    private final Map<String, String> hiddenSlots = new HashMap<>();
    private boolean frozen;

    public ClassInfo(String name, ClassInfo parent, boolean isAbstract) {
        this.name = name;
        this.parent = parent;
        this.isAbstract = isAbstract;
        if (parent != null) {
            fields.putAll(parent.fields);
        }
    }

    public ClassInfo getParent() { return parent; }
    public boolean isAbstract() { return isAbstract; }
    public boolean isFrozen() { return frozen; }

    private void checkMutable() {
        if (frozen) {
            throw new IllegalStateException("class " + name + " is frozen; its virtual method table is already built");
        }
    }

    // -------------------------
    // Declaration-time registration
    // -------------------------

    public void addField(FieldInfo field) {
        checkMutable();
        String key = Names.normalize(field.getName());
        if (fields.containsKey(key)) {
            throw new TypeDeclarationException("duplicate field " + field.getName() + " in class " + name);
        }
        fields.put(key, field);
    }

    public void addClassVar(FieldInfo field, Value initial) {
        checkMutable();
        String key = Names.normalize(field.getName());
        if (classVars.containsKey(key)) {
            throw new TypeDeclarationException("duplicate class variable " + field.getName() + " in class " + name);
        }
        classVars.put(key, field);
        classVarValues.put(key, initial);
    }

    public void addMethod(MethodInfo method) {
        checkMutable();
        if (method.isDestructor()) {
            destructor = method;
        }
        Map<String, List<MethodInfo>> table;
        if (method.isConstructor()) {
            table = constructors;
        } else if (method.isClassMethod()) {
            table = classMethods;
        } else {
            table = methods;
        }
        List<MethodInfo> overloads = table.computeIfAbsent(Names.normalize(method.getName()), k -> new ArrayList<>());
        checkOverload(overloads, method);
        overloads.add(method);
    }

    /**
     * A name declared twice in one class needs the overload directive on both
     * declarations, and the parameter type lists must differ.
     */
    static void checkOverload(List<MethodInfo> overloads, MethodInfo method) {
        for (MethodInfo existing : overloads) {
            if (existing.parameterSignature().equals(method.parameterSignature())) {
                throw new TypeDeclarationException("method " + method.qualifiedName()
                        + " already declared with the same parameter list");
            }
            if (!existing.isNative() && !(existing.isOverload() && method.isOverload())) {
                throw new TypeDeclarationException("method " + method.qualifiedName()
                        + " is declared more than once and must be marked overload");
            }
        }
    }

    public void addProperty(PropertyInfo property) {
        checkMutable();
        String key = Names.normalize(property.getName());
        if (properties.containsKey(key)) {
            throw new TypeDeclarationException("duplicate property " + property.getName() + " in class " + name);
        }
        properties.put(key, property);
    }

    public void addInterface(InterfaceInfo iface) {
        checkMutable();
        interfaces.add(iface);
    }

    public void registerOperator(OperatorEntry entry) {
        checkMutable();
        if (operators.lookup(entry.getOperator(), entry.getOperandTypes()) != null) {
            throw new TypeDeclarationException("class operator '" + entry.getOperator()
                    + "' already defined for operand types (" + String.join(", ", entry.getOperandTypes()) + ")");
        }
        operators.register(entry);
    }

    /**
     * Builds the virtual method table from the parent's and freezes the class.
     * virtual and abstract open a slot, override replaces the nearest inherited
     * slot of the same name and arity, reintroduce opens a fresh slot that
     * later overrides in descendants chain from.
     */
    public void buildVirtualMethodTable() {
        checkMutable();
        if (parent != null) {
            vmt.putAll(parent.vmt);
            hiddenSlots.putAll(parent.hiddenSlots);
        }
        for (List<MethodInfo> overloads : methods.values()) {
            for (MethodInfo m : overloads) {
                String base = m.baseSlotKey();
                if (m.isOverride()) {
                    String slot = hiddenSlots.getOrDefault(base, base);
                    if (!vmt.containsKey(slot)) {
                        throw new TypeDeclarationException("method " + m.qualifiedName()
                                + " is marked override but no virtual ancestor method exists");
                    }
                    m.assignSlot(slot);
                    vmt.put(slot, m);
                } else if (m.isReintroduce()) {
                    String slot = base + "@" + Names.normalize(name);
                    m.assignSlot(slot);
                    hiddenSlots.put(base, slot);
                    vmt.put(slot, m);
                } else if (m.isVirtual() || m.isAbstract()) {
                    hiddenSlots.remove(base);
                    vmt.put(base, m);
                }
            }
        }
        frozen = true;
        Debug.get().d(TAG, "class " + name + " frozen with " + vmt.size() + " virtual slot(s)");
    }

    // -------------------------
    // Lookups (walk the parent chain)
    // -------------------------

    public FieldInfo findField(String fieldName) {
        return fields.get(Names.normalize(fieldName));
    }

    public Map<String, FieldInfo> getFields() {
        return Collections.unmodifiableMap(fields);
    }

    /** @return the class in the hierarchy declaring the class variable, or null */
    public ClassInfo findClassVarOwner(String varName) {
        String key = Names.normalize(varName);
        for (ClassInfo c = this; c != null; c = c.parent) {
            if (c.classVars.containsKey(key)) return c;
        }
        return null;
    }

    public FieldInfo getClassVar(String varName) {
        return classVars.get(Names.normalize(varName));
    }

    public Value getClassVarValue(String varName) {
        return classVarValues.get(Names.normalize(varName));
    }

    public void setClassVarValue(String varName, Value value) {
        String key = Names.normalize(varName);
        if (!classVars.containsKey(key)) {
            throw new IllegalArgumentException("no class variable " + varName + " in " + name);
        }
        classVarValues.put(key, value);
    }

    /** Instance method overloads declared nearest to this class, or an empty list. */
    public List<MethodInfo> findMethods(String methodName) {
        return findIn(methodName, 0);
    }

    public List<MethodInfo> findClassMethods(String methodName) {
        return findIn(methodName, 1);
    }

    public List<MethodInfo> findConstructors(String ctorName) {
        return findIn(ctorName, 2);
    }

    /**
     * Nearest declarations of the name up the parent chain. When every one of
     * them is marked overload, the ancestors' overloads with other parameter
     * lists stay visible too.
     */
    private List<MethodInfo> findIn(String methodName, int table) {
        String key = Names.normalize(methodName);
        List<MethodInfo> out = null;
        Set<String> seen = new HashSet<>();
        for (ClassInfo c = this; c != null; c = c.parent) {
            Map<String, List<MethodInfo>> t = (table == 0) ? c.methods : (table == 1) ? c.classMethods : c.constructors;
            List<MethodInfo> found = t.get(key);
            if (found == null || found.isEmpty()) continue;
            if (out == null) out = new ArrayList<>();
            boolean allOverload = true;
            for (MethodInfo m : found) {
                if (seen.add(m.parameterSignature())) out.add(m);
                allOverload &= m.isOverload();
            }
            if (!allOverload) break;
        }
        return out == null ? Collections.<MethodInfo>emptyList() : out;
    }

    public MethodInfo getDestructor() {
        for (ClassInfo c = this; c != null; c = c.parent) {
            if (c.destructor != null) return c.destructor;
        }
        return null;
    }

    /** Instance method, class method or constructor with the given name. */
    public boolean hasMethodNamed(String methodName) {
        return !findMethods(methodName).isEmpty()
                || !findClassMethods(methodName).isEmpty()
                || !findConstructors(methodName).isEmpty();
    }

    public PropertyInfo findProperty(String propName) {
        String key = Names.normalize(propName);
        for (ClassInfo c = this; c != null; c = c.parent) {
            PropertyInfo p = c.properties.get(key);
            if (p != null) return p;
        }
        return null;
    }

    public PropertyInfo getDefaultProperty() {
        for (ClassInfo c = this; c != null; c = c.parent) {
            for (PropertyInfo p : c.properties.values()) {
                if (p.isDefault()) return p;
            }
        }
        return null;
    }

    public OperatorEntry lookupOperator(String operator, List<String> operandTypes) {
        for (ClassInfo c = this; c != null; c = c.parent) {
            OperatorEntry e = c.operators.lookup(operator, operandTypes);
            if (e != null) return e;
        }
        return null;
    }

    /** All operator entries for the symbol, most-derived class first. */
    public List<OperatorEntry> operatorCandidates(String operator) {
        List<OperatorEntry> out = new ArrayList<>();
        for (ClassInfo c = this; c != null; c = c.parent) {
            out.addAll(c.operators.candidates(operator));
        }
        return out;
    }

    /** Most-derived implementation occupying the method's virtual slot, or the method itself if it has none. */
    public MethodInfo resolveVirtual(MethodInfo method) {
        if (!(method.isVirtual() || method.isOverride() || method.isAbstract() || method.isReintroduce())) {
            return method;
        }
        MethodInfo impl = vmt.get(method.slotKey());
        return impl == null ? method : impl;
    }

    public Map<String, MethodInfo> getVirtualMethodTable() {
        return Collections.unmodifiableMap(vmt);
    }

    /** Inclusive: a class is a subclass of itself. */
    public boolean isSubclassOf(ClassInfo other) {
        if (other == null) return false;
        for (ClassInfo c = this; c != null; c = c.parent) {
            if (c == other || Names.same(c.name, other.name)) return true;
        }
        return false;
    }

    public boolean inheritsFromName(String className) {
        for (ClassInfo c = this; c != null; c = c.parent) {
            if (Names.same(c.name, className)) return true;
        }
        return false;
    }

    /** Name-based: every method the interface (and its ancestors) declares exists on this class. */
    public boolean implementsInterface(InterfaceInfo iface) {
        for (String m : iface.allMethods().keySet()) {
            if (!hasMethodNamed(m)) return false;
        }
        return true;
    }

    public List<InterfaceInfo> getInterfaces() {
        List<InterfaceInfo> out = new ArrayList<>();
        for (ClassInfo c = this; c != null; c = c.parent) {
            out.addAll(c.interfaces);
        }
        return out;
    }

    @Override
    public TypeKind getKind() {
        return TypeKind.CLASS;
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
