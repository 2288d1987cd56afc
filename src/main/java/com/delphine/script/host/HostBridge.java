package com.delphine.script.host;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import com.delphine.debug.Debug;
import com.delphine.script.ast.Token;
import com.delphine.script.builtins.BuiltinContext;
import com.delphine.script.runtime.ExceptionValue;
import com.delphine.script.runtime.Value;

/**
 * The one place host code runs. Arguments are marshalled, the external call is
 * wrapped so that anything it throws becomes an EHost language exception, and
 * the interpreter's current node is restored afterwards.
 */
public final class HostBridge {

    private static final String TAG = "HostBridge";

    private final BuiltinContext ctx;
    private final HostMarshaller marshaller;

    public HostBridge(BuiltinContext ctx) {
        this.ctx = ctx;
        this.marshaller = new HostMarshaller(this::callbackFor);
    }

    public HostMarshaller marshaller() {
        return marshaller;
    }

    public Value invoke(HostFunctionRegistry.Entry entry, List<Value> args) {
        HostSignature sig = entry.getSignature();
        if (!sig.accepts(args.size())) {
            return ctx.error("host function " + sig.getName() + " expects "
                    + (sig.isVariadic() ? "at least " + (sig.getParamTypes().size() - 1) : sig.getParamTypes().size())
                    + " argument(s), got " + args.size());
        }

        List<Object> javaArgs = new ArrayList<>(args.size());
        try {
            for (int i = 0; i < args.size(); i++) {
                javaArgs.add(marshaller.toJava(args.get(i), sig.paramType(i)));
            }
        } catch (IllegalArgumentException e) {
            return ctx.error("host function " + sig.getName() + ": " + e.getMessage());
        }

        Token saved = ctx.currentNode();
        Object result;
        try {
            result = entry.getFunction().invoke(javaArgs);
        } catch (ScriptCallbackException e) {
            if (e.getException() != null) {
                ctx.resume(e.getException());
                return Value.nil();
            }
            return ctx.error(e.getMessage());
        } catch (VirtualMachineError e) {
            throw e;
        } catch (Exception | Error e) {
            return raiseHost(sig.getName(), e);
        } finally {
            ctx.setCurrentNode(saved);
        }

        if (sig.getReturnType() == void.class) return Value.nil();
        try {
            return marshaller.toValue(result);
        } catch (IllegalArgumentException e) {
            return ctx.error("host function " + sig.getName() + ": " + e.getMessage());
        }
    }

    private Value raiseHost(String function, Throwable t) {
        String message = t.getMessage() == null ? t.getClass().getSimpleName() : t.getMessage();
        Debug.get().w(TAG, "host function " + function + " failed: " + t.getClass().getName() + ": " + message, t);
        return ctx.raise("EHost", message, Map.of("ExceptionClass", Value.string(t.getClass().getName())));
    }

    /** Re-enters the interpreter; a script failure leaves host code as a {@link ScriptCallbackException}. */
    private HostCallback callbackFor(Value function) {
        return args -> {
            List<Value> scriptArgs = new ArrayList<>();
            for (Object a : args == null ? Collections.emptyList() : args) scriptArgs.add(marshaller.toValue(a));

            Token saved = ctx.currentNode();
            Value r;
            try {
                r = ctx.call(function, scriptArgs);
            } finally {
                ctx.setCurrentNode(saved);
            }

            ExceptionValue raised = ctx.takeException();
            if (raised != null) throw new ScriptCallbackException(raised);
            if (r.isError()) throw new ScriptCallbackException(r.errorMessage());
            return marshaller.toJava(r);
        };
    }
}
