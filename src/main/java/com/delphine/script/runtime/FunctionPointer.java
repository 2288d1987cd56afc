package com.delphine.script.runtime;

import com.delphine.script.ast.Expr;
import com.delphine.script.ast.Statement;
import com.delphine.script.types.MethodInfo;

/**
 * Callable value: a global function, a method bound to its receiver, or a
 * lambda holding the frame it was created in (shared, not copied).
 */
public final class FunctionPointer {

    public enum Kind { FUNCTION, METHOD, LAMBDA }

    private final Kind kind;
    private final String name;
    private final Statement.FunctionDecl function;
    private final MethodInfo method;
    private final Value self;
    private final Expr.Lambda lambda;
    private final Environment closure;

    private FunctionPointer(Kind kind, String name, Statement.FunctionDecl function, MethodInfo method,
                            Value self, Expr.Lambda lambda, Environment closure) {
        this.kind = kind;
        this.name = name;
        this.function = function;
        this.method = method;
        this.self = self;
        this.lambda = lambda;
        this.closure = closure;
    }

    public static FunctionPointer ofFunction(Statement.FunctionDecl decl, Environment closure) {
        return new FunctionPointer(Kind.FUNCTION, decl.name.lexeme, decl, null, null, null, closure);
    }

    public static FunctionPointer ofMethod(MethodInfo method, Value self) {
        return new FunctionPointer(Kind.METHOD, method.qualifiedName(), null, method, self, null, null);
    }

    public static FunctionPointer ofLambda(Expr.Lambda lambda, Environment closure) {
        return new FunctionPointer(Kind.LAMBDA, "<lambda>", null, null, null, lambda, closure);
    }

    public Kind getKind() { return kind; }
    public String getName() { return name; }
    public Statement.FunctionDecl getFunction() { return function; }
    public MethodInfo getMethod() { return method; }
    public Value getSelf() { return self; }
    public Expr.Lambda getLambda() { return lambda; }
    public Environment getClosure() { return closure; }

    public int paramCount() {
        switch (kind) {
            case FUNCTION: return function.params.size();
            case METHOD: return method.getMaxParams();
            default: return lambda.params.size();
        }
    }
}
