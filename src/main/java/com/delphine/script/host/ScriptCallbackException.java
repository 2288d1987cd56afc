package com.delphine.script.host;

import com.delphine.script.runtime.ExceptionValue;

/**
 * Thrown out of a {@link HostCallback} when the script side failed. The host
 * bridge turns it back into the original language exception (or error) once
 * it leaves host code, so host code should let it propagate.
 */
public class ScriptCallbackException extends RuntimeException {

    private final transient ExceptionValue exception;

    public ScriptCallbackException(ExceptionValue exception) {
        super(exception.getClassName() + ": " + exception.getMessage());
        this.exception = exception;
    }

    public ScriptCallbackException(String errorMessage) {
        super(errorMessage);
        this.exception = null;
    }

    /** The language exception raised inside the callback, or null for an evaluator error. */
    public ExceptionValue getException() {
        return exception;
    }
}
