package com.delphine.script;

import java.util.Collections;
import java.util.List;

import com.delphine.script.runtime.ExceptionValue;

/** A language exception that escaped every handler. */
public class UncaughtScriptException extends ScriptRuntimeException {

    private static final long serialVersionUID = 1L;

    private final String exceptionClass;
    private final String scriptMessage;
    private final List<String> scriptStack;

    public UncaughtScriptException(ExceptionValue exception) {
        super(describe(exception));
        this.exceptionClass = exception.getClassName();
        this.scriptMessage = exception.getMessage();
        this.scriptStack = exception.getCallStack() == null
                ? Collections.emptyList()
                : Collections.unmodifiableList(exception.getCallStack());
    }

    private static String describe(ExceptionValue e) {
        StringBuilder sb = new StringBuilder("uncaught ").append(e.getClassName()).append(": ").append(e.getMessage());
        if (e.getPosition() != null && e.getPosition().hasPosition()) {
            sb.append(" at ").append(e.getPosition().position());
        }
        return sb.toString();
    }

    /** Class name of the script exception object, e.g. EConvertError. */
    public String getExceptionClass() {
        return exceptionClass;
    }

    public String getScriptMessage() {
        return scriptMessage;
    }

    /** Script call stack captured when the exception was raised, innermost frame first. */
    public List<String> getScriptStack() {
        return scriptStack;
    }
}
