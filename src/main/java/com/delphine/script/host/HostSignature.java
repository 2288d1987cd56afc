package com.delphine.script.host;

import java.util.Collections;
import java.util.List;

/**
 * Declared Java shape of a host function. Parameter types drive argument
 * marshalling; a variadic signature takes any number of trailing arguments
 * of its last parameter type.
 */
public final class HostSignature {

    private final String name;
    private final List<Class<?>> paramTypes;
    private final Class<?> returnType;
    private final boolean variadic;

    public HostSignature(String name, List<Class<?>> paramTypes, Class<?> returnType, boolean variadic) {
        if (name == null || name.trim().isEmpty()) {
            throw new IllegalArgumentException("host function name must not be empty");
        }
        if (variadic && (paramTypes == null || paramTypes.isEmpty())) {
            throw new IllegalArgumentException("variadic host function " + name + " needs at least one parameter type");
        }
        this.name = name;
        this.paramTypes = paramTypes == null ? Collections.emptyList() : List.copyOf(paramTypes);
        this.returnType = returnType == null ? Object.class : returnType;
        this.variadic = variadic;
    }

    /** Untyped signature: every argument is marshalled to its natural Java form. */
    public static HostSignature untyped(String name, int arity) {
        return new HostSignature(name, Collections.nCopies(arity, Object.class), Object.class, false);
    }

    public static HostSignature variadic(String name) {
        return new HostSignature(name, List.of(Object.class), Object.class, true);
    }

    public String getName() { return name; }
    public List<Class<?>> getParamTypes() { return paramTypes; }
    public Class<?> getReturnType() { return returnType; }
    public boolean isVariadic() { return variadic; }

    public boolean accepts(int argCount) {
        if (variadic) return argCount >= paramTypes.size() - 1;
        return argCount == paramTypes.size();
    }

    /** Java type the i-th script argument is marshalled to. */
    public Class<?> paramType(int index) {
        if (variadic && index >= paramTypes.size() - 1) return paramTypes.get(paramTypes.size() - 1);
        return paramTypes.get(index);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(name).append('(');
        for (int i = 0; i < paramTypes.size(); i++) {
            if (i > 0) sb.append(", ");
            sb.append(paramTypes.get(i).getSimpleName());
            if (variadic && i == paramTypes.size() - 1) sb.append("...");
        }
        return sb.append("): ").append(returnType.getSimpleName()).toString();
    }
}
