package com.delphine.script.builtins;

import java.util.List;

import com.delphine.script.runtime.Value;

/** Functional interface for built-in functions. */
public interface BuiltinFunction {
    Value call(BuiltinContext ctx, List<Value> args);
}
