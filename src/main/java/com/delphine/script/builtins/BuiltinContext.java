package com.delphine.script.builtins;

import java.util.List;
import java.util.Map;

import com.delphine.script.ast.Token;
import com.delphine.script.runtime.ExceptionValue;
import com.delphine.script.runtime.Value;
import com.delphine.script.types.DataType;

/**
 * What the interpreter lends to builtins and host bridges: callbacks into
 * script code, raising language exceptions, output and diagnostic context.
 */
public interface BuiltinContext {

    /** Node being evaluated; errors and raised exceptions are positioned here. */
    Token currentNode();

    void setCurrentNode(Token node);

    /** Evaluator-internal error at the current node. */
    Value error(String message);

    /**
     * Raises an instance of a runtime exception class (EConvertError, EHost, ...).
     * Returns nil; the caller should return straight away.
     */
    Value raise(String className, String message, Map<String, Value> extraFields);

    default Value raise(String className, String message) {
        return raise(className, message, null);
    }

    /** True for an ERROR value or while a language exception is active. */
    boolean aborted(Value v);

    /** Synchronously calls a function pointer value. */
    Value call(Value callable, List<Value> args);

    /** Clears and returns the active language exception, or null. */
    ExceptionValue takeException();

    /** Makes a previously taken exception active again. */
    void resume(ExceptionValue exception);

    Value zeroOf(DataType type);

    void write(String text);
}
