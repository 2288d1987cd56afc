package com.delphine.script.interp;

import java.util.List;
import java.util.Map;

import com.delphine.debug.Debug;
import com.delphine.script.ast.Statement;
import com.delphine.script.ast.Token;
import com.delphine.script.runtime.Environment;
import com.delphine.script.runtime.ExceptionValue;
import com.delphine.script.runtime.ObjectInstance;
import com.delphine.script.runtime.Value;
import com.delphine.script.types.ClassInfo;
import com.delphine.script.types.Names;

/**
 * Language-level exceptions. Nothing here throws Java exceptions: raising sets
 * the active exception, and every statement loop checks {@link #isActive()}
 * after each statement and returns early while it is set.
 */
public final class ExceptionEngine {

    private static final String TAG = "Exceptions";

    public enum State { RUNNING, EXCEPTION_ACTIVE, HANDLING_EXCEPTION, UNWOUND }

    private final Interpreter interp;

    private ExceptionValue active;
    // exception owned by the innermost running handler; target of bare raise
    private ExceptionValue handling;
    private int handlerDepth = -1;
    private Value exceptObject;
    private boolean unwound;

    ExceptionEngine(Interpreter interp) {
        this.interp = interp;
    }

    public State getState() {
        if (unwound) return State.UNWOUND;
        if (active != null) return State.EXCEPTION_ACTIVE;
        if (handling != null) return State.HANDLING_EXCEPTION;
        return State.RUNNING;
    }

    public boolean isActive() {
        return active != null;
    }

    public ExceptionValue getActive() {
        return active;
    }

    public ExceptionValue getHandling() {
        return handling;
    }

    /** Call-stack depth at which the innermost running handler was entered, -1 outside handlers. */
    public int getHandlerDepth() {
        return handlerDepth;
    }

    /** ExceptObject binding: the handled exception's object inside handlers and finally blocks, else nil. */
    Value exceptObject() {
        return exceptObject == null ? Value.nil() : exceptObject;
    }

    void raise(ExceptionValue exc) {
        active = exc;
        Debug.get().d(TAG, "raised " + exc);
    }

    /** Clears and returns the active exception. */
    ExceptionValue clear() {
        ExceptionValue e = active;
        active = null;
        return e;
    }

    void markUnwound() {
        unwound = true;
    }

    // -------------------------
    // raise
    // -------------------------

    Value executeRaise(Statement.Raise stmt) {
        if (stmt.exception == null) {
            if (handling == null) {
                return interp.error(stmt.keyword, "bare raise with no active exception");
            }
            raise(handling);
            return Value.nil();
        }

        Value v = interp.evaluate(stmt.exception);
        if (interp.aborted(v)) return v;

        v = v.unwrapVariant();
        ObjectInstance obj = v.objectOrNull();
        if (obj == null) {
            return interp.error(stmt.keyword, "raise requires an exception object, got " + v.typeName());
        }

        raise(new ExceptionValue(obj.getClassInfo(), obj, messageOf(obj), stmt.keyword,
                interp.state.callStack.snapshot()));
        return Value.nil();
    }

    private static String messageOf(ObjectInstance obj) {
        Value m = obj.getField("Message");
        if (m == null || m.isNil()) return "";
        return m.getType() == Value.Type.STRING ? m.asString() : m.display();
    }

    /**
     * Raises an instance of a standard exception class built by the runtime
     * (stack overflow, host failures, failed casts, builtin conversion errors).
     */
    Value raiseNative(String className, String message, Token at, Map<String, Value> extraFields) {
        ClassInfo cls = interp.types.findClass(className);
        if (cls == null) {
            return interp.error(at, "unknown exception class " + className);
        }
        ObjectInstance obj = interp.zeros.blank(cls);
        obj.setField("Message", Value.string(message));
        if (extraFields != null) {
            for (Map.Entry<String, Value> e : extraFields.entrySet()) obj.setField(e.getKey(), e.getValue());
        }
        raise(new ExceptionValue(cls, obj, message, at, interp.state.callStack.snapshot()));
        return Value.nil();
    }

    // -------------------------
    // try / except / finally
    // -------------------------

    Value executeTry(Statement.Try stmt) {
        Value result = interp.executeBlock(stmt.body, interp.env.childScope());

        if (!result.isError() && isActive() && stmt.except != null) {
            result = handle(stmt.except);
        }

        if (stmt.finallyBlock != null) {
            Value fin = runFinally(stmt.finallyBlock);
            if (fin.isError()) return fin;
        }
        return result;
    }

    private Value handle(Statement.ExceptClause clause) {
        ExceptionValue exc = active;

        if (clause.handlers.isEmpty()) {
            if (clause.elseBlock == null) {
                clear();
                return Value.nil();
            }
            return runHandler(exc, null, null, clause.elseBlock);
        }

        for (Statement.ExceptHandler h : clause.handlers) {
            if (h.exceptionType == null) {
                return runHandler(exc, h.variable, h.body, null);
            }
            ClassInfo handlerClass = interp.types.findClass(h.exceptionType.name);
            if (handlerClass == null) {
                return interp.error(h.variable, "unknown exception type " + h.exceptionType.name);
            }
            if (matches(exc.getClassInfo(), handlerClass)) {
                return runHandler(exc, h.variable, h.body, null);
            }
        }

        if (clause.elseBlock != null) {
            return runHandler(exc, null, null, clause.elseBlock);
        }
        // no handler: leave the exception active so it keeps unwinding
        return Value.nil();
    }

    /** The raised class or one of its ancestors carries the handler's class name. */
    static boolean matches(ClassInfo raised, ClassInfo handlerClass) {
        for (ClassInfo c = raised; c != null; c = c.getParent()) {
            if (Names.same(c.getName(), handlerClass.getName())) return true;
        }
        return false;
    }

    private Value runHandler(ExceptionValue exc, Token variable, Statement.Stmt body, List<Statement.Stmt> block) {
        Environment handlerEnv = interp.env.childScope();
        if (variable != null) {
            handlerEnv.define(variable.lexeme, Value.object(exc.getInstance()), exc.getClassInfo());
        }

        ExceptionValue savedHandling = handling;
        int savedDepth = handlerDepth;
        Value savedExceptObject = exceptObject;

        handling = exc;
        handlerDepth = interp.state.callStack.depth();
        exceptObject = Value.object(exc.getInstance());
        // the handler runs clean; whatever it raises replaces the original
        active = null;

        Debug.get().t(TAG, "handling " + exc);
        try {
            if (block != null) {
                return interp.executeBlock(block, handlerEnv);
            }
            Environment previous = interp.env;
            interp.env = handlerEnv;
            try {
                return interp.execute(body);
            } finally {
                interp.env = previous;
            }
        } finally {
            handling = savedHandling;
            handlerDepth = savedDepth;
            exceptObject = savedExceptObject;
        }
    }

    /**
     * Runs a finally block with a clean exception state and no pending control
     * transfer. The prior exception (or transfer) is restored afterwards unless
     * the block raised its own, which then wins.
     */
    private Value runFinally(List<Statement.Stmt> block) {
        ExceptionValue saved = active;
        ControlSignal savedSignal = interp.state.signal;
        Value savedExceptObject = exceptObject;

        active = null;
        interp.state.signal = ControlSignal.NONE;
        exceptObject = (saved == null) ? Value.nil() : Value.object(saved.getInstance());

        Value result;
        try {
            result = interp.executeBlock(block, interp.env.childScope());
        } finally {
            exceptObject = savedExceptObject;
        }

        if (active == null) {
            active = saved;
            if (interp.state.signal == ControlSignal.NONE) {
                interp.state.signal = savedSignal;
            }
        }
        return result;
    }
}
