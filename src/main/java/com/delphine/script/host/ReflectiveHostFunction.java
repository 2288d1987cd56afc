package com.delphine.script.host;

import java.lang.reflect.Array;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * A public Java method exposed as a host function. Varargs methods become
 * variadic signatures whose trailing arguments are packed into the array.
 */
final class ReflectiveHostFunction implements HostFunction {

    private final Object target;
    private final Method method;
    private final HostSignature signature;

    ReflectiveHostFunction(String name, Object target, Method method) {
        if (!Modifier.isPublic(method.getModifiers())) {
            throw new IllegalArgumentException("host method " + method.getName() + " must be public");
        }
        if (target == null && !Modifier.isStatic(method.getModifiers())) {
            throw new IllegalArgumentException("host method " + method.getName() + " needs a target instance");
        }
        this.target = target;
        this.method = method;
        this.signature = signatureOf(name, method);
    }

    private static HostSignature signatureOf(String name, Method method) {
        Class<?>[] raw = method.getParameterTypes();
        List<Class<?>> types = new ArrayList<>(Arrays.asList(raw));
        if (method.isVarArgs()) {
            types.set(types.size() - 1, raw[raw.length - 1].getComponentType());
        }
        for (Class<?> t : types) {
            if (!HostMarshaller.isSupportedParameter(t)) {
                throw new IllegalArgumentException("host method " + method.getName()
                        + " has unsupported parameter type " + t.getName());
            }
        }
        return new HostSignature(name, types, method.getReturnType(), method.isVarArgs());
    }

    HostSignature signature() {
        return signature;
    }

    @Override
    public Object invoke(List<Object> args) throws Exception {
        Object[] callArgs = packArguments(args);
        try {
            return method.invoke(target, callArgs);
        } catch (InvocationTargetException e) {
            Throwable cause = e.getTargetException();
            if (cause instanceof Exception) throw (Exception) cause;
            if (cause instanceof Error) throw (Error) cause;
            throw e;
        }
    }

    private Object[] packArguments(List<Object> args) {
        if (!method.isVarArgs()) return args.toArray();

        int fixed = method.getParameterCount() - 1;
        Object[] out = new Object[fixed + 1];
        for (int i = 0; i < fixed; i++) out[i] = args.get(i);

        Class<?> component = method.getParameterTypes()[fixed].getComponentType();
        Object rest = Array.newInstance(component, args.size() - fixed);
        for (int i = fixed, j = 0; i < args.size(); i++, j++) {
            Array.set(rest, j, args.get(i));
        }
        out[fixed] = rest;
        return out;
    }
}
