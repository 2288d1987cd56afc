package com.delphine.script.interp;

import com.delphine.script.ast.Statement;
import com.delphine.script.runtime.Environment;

/** A declared global (or nested) routine and the frame it was declared in. */
public class UserFunction {
    final Statement.FunctionDecl decl;
    final Environment closure;

    UserFunction(Statement.FunctionDecl decl, Environment closure) {
        this.decl = decl;
        this.closure = closure;
    }

    String name() {
        return decl.name.lexeme;
    }

    int minParams() {
        int min = 0;
        for (Statement.Param p : decl.params) {
            if (p.defaultValue == null) min++;
        }
        return min;
    }

    boolean accepts(int argCount) {
        return argCount >= minParams() && argCount <= decl.params.size();
    }
}
