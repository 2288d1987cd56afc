package com.delphine.script.interp;

import com.delphine.script.ast.Token;
import com.delphine.script.types.MethodInfo;

public class CallFrame {
    final String functionName;
    final Token position;
    // name that aliases Result inside the routine body (Pascal "FuncName := x"); null for lambdas
    final String resultAlias;
    final MethodInfo method;

    CallFrame(String functionName, Token position, String resultAlias, MethodInfo method) {
        this.functionName = functionName;
        this.position = position;
        this.resultAlias = resultAlias;
        this.method = method;
    }

    public String getFunctionName() {
        return functionName;
    }

    @Override
    public String toString() {
        if (position == null || !position.hasPosition()) return functionName;
        return functionName + " [" + position.position() + "]";
    }
}
