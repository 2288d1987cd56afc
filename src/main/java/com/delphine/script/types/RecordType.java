package com.delphine.script.types;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Value-type analog of a class: no inheritance, no virtual dispatch. */
public final class RecordType implements DataType {

    private final String name;
    private final LinkedHashMap<String, FieldInfo> fields = new LinkedHashMap<>();
    private final Map<String, List<MethodInfo>> methods = new LinkedHashMap<>();
    private final Map<String, List<MethodInfo>> staticMethods = new LinkedHashMap<>();
    private final LinkedHashMap<String, PropertyInfo> properties = new LinkedHashMap<>();
    private final OperatorRegistry operators = new OperatorRegistry();

    public RecordType(String name) {
        this.name = name;
    }

    public void addField(FieldInfo field) {
        String key = Names.normalize(field.getName());
        if (fields.containsKey(key)) {
            throw new TypeDeclarationException("duplicate field " + field.getName() + " in record " + name);
        }
        fields.put(key, field);
    }

    public void addMethod(MethodInfo method) {
        Map<String, List<MethodInfo>> table = method.isClassMethod() ? staticMethods : methods;
        List<MethodInfo> overloads = table.computeIfAbsent(Names.normalize(method.getName()), k -> new ArrayList<>());
        ClassInfo.checkOverload(overloads, method);
        overloads.add(method);
    }

    public void addProperty(PropertyInfo property) {
        String key = Names.normalize(property.getName());
        if (properties.containsKey(key)) {
            throw new TypeDeclarationException("duplicate property " + property.getName() + " in record " + name);
        }
        properties.put(key, property);
    }

    public void registerOperator(OperatorEntry entry) {
        if (operators.lookup(entry.getOperator(), entry.getOperandTypes()) != null) {
            throw new TypeDeclarationException("class operator '" + entry.getOperator()
                    + "' already defined for operand types (" + String.join(", ", entry.getOperandTypes()) + ")");
        }
        operators.register(entry);
    }

    public Map<String, FieldInfo> getFields() {
        return Collections.unmodifiableMap(fields);
    }

    public FieldInfo findField(String fieldName) {
        return fields.get(Names.normalize(fieldName));
    }

    public List<MethodInfo> findMethods(String methodName) {
        List<MethodInfo> m = methods.get(Names.normalize(methodName));
        return m == null ? Collections.emptyList() : m;
    }

    public List<MethodInfo> findStaticMethods(String methodName) {
        List<MethodInfo> m = staticMethods.get(Names.normalize(methodName));
        return m == null ? Collections.emptyList() : m;
    }

    public PropertyInfo findProperty(String propName) {
        return properties.get(Names.normalize(propName));
    }

    public PropertyInfo getDefaultProperty() {
        for (PropertyInfo p : properties.values()) {
            if (p.isDefault()) return p;
        }
        return null;
    }

    public OperatorEntry lookupOperator(String operator, List<String> operandTypes) {
        return operators.lookup(operator, operandTypes);
    }

    public List<OperatorEntry> operatorCandidates(String operator) {
        return operators.candidates(operator);
    }

    @Override
    public TypeKind getKind() {
        return TypeKind.RECORD;
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
