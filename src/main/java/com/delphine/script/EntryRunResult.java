package com.delphine.script;

import java.util.Map;

import com.delphine.script.runtime.Value;

public class EntryRunResult extends RunResult {
    private final Value value;

    public EntryRunResult(String output, Map<String, Value> globals, Value value, ScriptRuntimeException failure) {
        super(output, globals, failure);
        this.value = value;
    }

    /** What the entry function returned; nil for procedures and failed runs. */
    public Value value() { return value; }
}
