package com.delphine.script;

import java.util.Collections;
import java.util.List;

import com.delphine.debug.Debug;
import com.delphine.script.ast.Expr;
import com.delphine.script.ast.SemanticInfo;
import com.delphine.script.ast.Statement;
import com.delphine.script.builtins.BuiltinFunction;
import com.delphine.script.builtins.BuiltinRegistry;
import com.delphine.script.host.HostFunction;
import com.delphine.script.host.HostFunctionRegistry;
import com.delphine.script.host.HostSignature;
import com.delphine.script.interp.ExceptionEngine;
import com.delphine.script.interp.Interpreter;
import com.delphine.script.runtime.ExceptionValue;
import com.delphine.script.runtime.Value;

/**
 * Engine entry point. Holds configuration and registered builtins/host
 * functions; every run gets a fresh {@link Interpreter}.
 */
public class DelphineScript {

    private static final String TAG = "DelphineScript";

    public static final int DEFAULT_MAX_RECURSION_DEPTH = 256;

    /** Receives failures instead of having them thrown to the host. */
    public interface ErrorReporter {
        /**
         * @param failure the failure; an {@link UncaughtScriptException} for language exceptions
         * @param kind    "error", "exception" or "internal"
         * @param entry   entry function name, or null for top-level code
         */
        void report(ScriptRuntimeException failure, String kind, String entry);
    }

    private final BuiltinRegistry builtins = BuiltinRegistry.withCoreLibrary();
    private final HostFunctionRegistry hostFunctions = new HostFunctionRegistry();
    private int maxRecursionDepth = DEFAULT_MAX_RECURSION_DEPTH;
    private Appendable output;
    private SemanticInfo semanticInfo;

    /*
     * ERROR HANDLING CONTRACT:
     *
     * - no reporter: failures THROW to the host (ScriptRuntimeException or
     *   UncaughtScriptException);
     * - reporter installed: failures go to the reporter, nothing is thrown, and
     *   the run result carries the failure.
     */
    private ErrorReporter errorReporter;

    public DelphineScript setMaxRecursionDepth(int depth) {
        if (depth < 1) throw new IllegalArgumentException("max recursion depth must be positive: " + depth);
        this.maxRecursionDepth = depth;
        return this;
    }

    public int getMaxRecursionDepth() {
        return maxRecursionDepth;
    }

    /** Target for Print/PrintLn; null restores the per-run buffer returned in the result. */
    public DelphineScript setOutput(Appendable output) {
        this.output = output;
        return this;
    }

    public DelphineScript setSemanticInfo(SemanticInfo semanticInfo) {
        this.semanticInfo = semanticInfo;
        return this;
    }

    public DelphineScript setErrorReporter(ErrorReporter errorReporter) {
        this.errorReporter = errorReporter;
        return this;
    }

    public DelphineScript registerBuiltin(String name, BuiltinFunction fn) {
        builtins.register(name, fn);
        return this;
    }

    public DelphineScript registerHostFunction(HostSignature signature, HostFunction fn) {
        hostFunctions.register(signature, fn);
        return this;
    }

    public DelphineScript registerHostFunction(String name, int arity, HostFunction fn) {
        hostFunctions.register(name, arity, fn);
        return this;
    }

    /** Registers every {@code @HostExport} method of the target. */
    public DelphineScript registerHostMethods(Object target) {
        int n = hostFunctions.registerMethods(target);
        Debug.get().d(TAG, "registered " + n + " host method(s) from " + target.getClass().getName());
        return this;
    }

    public BuiltinRegistry builtins() {
        return builtins;
    }

    public HostFunctionRegistry hostFunctions() {
        return hostFunctions;
    }

    // ===================== RUN =====================

    public RunResult run(List<Statement.Stmt> program) {
        if (program == null) throw new IllegalArgumentException("program must not be null");

        StringBuilder buffer = output == null ? new StringBuilder() : null;
        Interpreter interpreter = newInterpreter(buffer);

        Debug.get().i(TAG, "run start (" + program.size() + " statement(s))");
        ScriptRuntimeException failure = runProgram(interpreter, program);
        Debug.get().i(TAG, "run finished" + (failure == null ? "" : " with failure"));

        return new RunResult(textOf(buffer), interpreter.getGlobals().snapshot(), failure);
    }

    /**
     * Runs the top-level statements, then calls the entry function with the
     * given arguments.
     */
    public EntryRunResult run(List<Statement.Stmt> program, String entryFunction, List<Value> args) {
        if (program == null) throw new IllegalArgumentException("program must not be null");
        if (entryFunction == null || entryFunction.trim().isEmpty()) {
            throw new IllegalArgumentException("entryFunction must not be empty");
        }

        StringBuilder buffer = output == null ? new StringBuilder() : null;
        Interpreter interpreter = newInterpreter(buffer);

        Debug.get().i(TAG, "run start (" + program.size() + " statement(s), entry " + entryFunction + ")");
        ScriptRuntimeException failure = runProgram(interpreter, program);
        Value value = Value.nil();
        if (failure == null) {
            List<Value> entryArgs = args == null ? Collections.emptyList() : args;
            Value r;
            try {
                r = interpreter.callEntry(entryFunction, entryArgs);
            } catch (StackOverflowError e) {
                r = null;
                failure = internal(e, entryFunction);
            }
            if (r != null) {
                failure = outcome(interpreter, r, entryFunction);
                if (failure == null) value = r;
            }
        }
        Debug.get().i(TAG, "run finished" + (failure == null ? "" : " with failure"));

        return new EntryRunResult(textOf(buffer), interpreter.getGlobals().snapshot(), value, failure);
    }

    /**
     * Evaluates one expression in a fresh interpreter.
     *
     * @return the value, or nil when a failure was reported to the error reporter
     */
    public Value evaluate(Expr.ExprInterface expr) {
        if (expr == null) throw new IllegalArgumentException("expression must not be null");
        Interpreter interpreter = newInterpreter(output == null ? new StringBuilder() : null);
        Value r;
        try {
            r = interpreter.evaluateExpression(expr);
        } catch (StackOverflowError e) {
            internal(e, null);
            return Value.nil();
        }
        ScriptRuntimeException failure = outcome(interpreter, r, null);
        return failure == null ? r : Value.nil();
    }

    private Interpreter newInterpreter(StringBuilder buffer) {
        return new Interpreter(maxRecursionDepth, builtins, hostFunctions, semanticInfo,
                buffer != null ? buffer : output);
    }

    private ScriptRuntimeException runProgram(Interpreter interpreter, List<Statement.Stmt> program) {
        Value r;
        try {
            r = interpreter.executeProgram(program);
        } catch (StackOverflowError e) {
            return internal(e, null);
        }
        return outcome(interpreter, r, null);
    }

    private static String textOf(StringBuilder buffer) {
        return buffer == null ? null : buffer.toString();
    }

    // ===================== FAILURES =====================

    /** Turns an ERROR result or an unwound exception into a failure, then throws or reports it. */
    private ScriptRuntimeException outcome(Interpreter interpreter, Value r, String entry) {
        if (r.isError()) {
            Debug.get().e(TAG, "script error: " + r.errorMessage());
            return fail(new ScriptRuntimeException(r.errorMessage()), "error", entry);
        }
        ExceptionEngine exceptions = interpreter.getExceptions();
        if (exceptions.getState() == ExceptionEngine.State.UNWOUND && exceptions.isActive()) {
            ExceptionValue exc = exceptions.getActive();
            Debug.get().w(TAG, "uncaught " + exc.getClassName() + ": " + exc.getMessage()
                    + " stack=" + exc.getCallStack());
            return fail(new UncaughtScriptException(exc), "exception", entry);
        }
        return null;
    }

    private ScriptRuntimeException internal(StackOverflowError e, String entry) {
        Debug.get().e(TAG, "internal error: host stack exhausted", e);
        return fail(new ScriptRuntimeException("internal error: host stack exhausted", e), "internal", entry);
    }

    private ScriptRuntimeException fail(ScriptRuntimeException failure, String kind, String entry) {
        if (errorReporter == null) throw failure;
        errorReporter.report(failure, kind, entry);
        return failure;
    }
}
