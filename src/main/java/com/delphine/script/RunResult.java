package com.delphine.script;

import java.util.Map;

import com.delphine.script.runtime.Value;

public class RunResult {
    private final String output;
    private final Map<String, Value> globals;
    private final ScriptRuntimeException failure;

    public RunResult(String output, Map<String, Value> globals, ScriptRuntimeException failure) {
        this.output = output;
        this.globals = globals;
        this.failure = failure;
    }

    /** Text written by Print/PrintLn; null when the host supplied its own output target. */
    public String output() { return output; }

    /** Global bindings after the run. */
    public Map<String, Value> globals() { return globals; }

    public Value global(String name) {
        for (Map.Entry<String, Value> e : globals.entrySet()) {
            if (e.getKey().equalsIgnoreCase(name)) return e.getValue();
        }
        return null;
    }

    /** The reported failure, or null. Only set when an error reporter is installed. */
    public ScriptRuntimeException failure() { return failure; }

    public boolean succeeded() { return failure == null; }
}
