package com.delphine.script.interp;

import com.delphine.script.ast.Token;
import com.delphine.script.runtime.Environment;

/**
 * Mutable state of one run: global frame, call stack, pending control transfer
 * and the node being evaluated (for diagnostics). Passed around through the
 * interpreter instead of living in statics.
 */
public final class ExecutionState {

    final Environment globals = new Environment();
    final CallStack callStack;
    ControlSignal signal = ControlSignal.NONE;
    Token currentNode;

    ExecutionState(int maxRecursionDepth) {
        this.callStack = new CallStack(maxRecursionDepth);
    }

    public Environment getGlobals() {
        return globals;
    }

    public CallStack getCallStack() {
        return callStack;
    }

    public Token getCurrentNode() {
        return currentNode;
    }
}
