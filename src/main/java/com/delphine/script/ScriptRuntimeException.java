package com.delphine.script;

/**
 * A run that failed with an evaluator-internal error (the ERROR sentinel reached
 * top level), or with an internal failure of the engine itself.
 */
public class ScriptRuntimeException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public ScriptRuntimeException(String message) {
        super(message);
    }

    public ScriptRuntimeException(String message, Throwable cause) {
        super(message, cause);
    }
}
