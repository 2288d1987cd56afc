package com.delphine.script.interp;

import java.util.List;

import com.delphine.script.ast.Expr;
import com.delphine.script.ast.Statement;
import com.delphine.script.ast.Token;
import com.delphine.script.ast.TypeRef;
import com.delphine.script.runtime.Environment;
import com.delphine.script.runtime.ExceptionValue;
import com.delphine.script.runtime.FunctionPointer;
import com.delphine.script.runtime.ObjectInstance;
import com.delphine.script.runtime.Value;
import com.delphine.script.types.ClassInfo;
import com.delphine.script.types.DataType;
import com.delphine.script.types.MethodInfo;
import com.delphine.script.types.TypeDeclarationException;

/**
 * Runs script routines: global functions, methods, constructors, lambdas and
 * function pointers. Every routine goes through {@link #executeRoutine}, which
 * checks the recursion limit, pushes a call frame and always pops it.
 */
final class Invoker {

    private final Interpreter interp;

    Invoker(Interpreter interp) {
        this.interp = interp;
    }

    // -------------------------
    // Overload selection
    // -------------------------

    /** Arity first, then the best argument fit; null when no overload takes that many arguments. */
    MethodInfo selectMethod(List<MethodInfo> overloads, List<Value> args) {
        MethodInfo best = null;
        int bestScore = -1;
        for (MethodInfo m : overloads) {
            if (!m.accepts(args.size())) continue;
            int score = m.isNative() ? args.size() : score(m.getDecl().params, args);
            if (best == null || score > bestScore) {
                best = m;
                bestScore = score;
            }
        }
        return best;
    }

    UserFunction selectFunction(List<UserFunction> overloads, List<Value> args) {
        UserFunction best = null;
        int bestScore = -1;
        for (UserFunction f : overloads) {
            if (!f.accepts(args.size())) continue;
            int score = score(f.decl.params, args);
            if (best == null || score > bestScore) {
                best = f;
                bestScore = score;
            }
        }
        return best;
    }

    /** Sum of per-argument fit; 0 for a candidate that some argument cannot convert to. */
    private int score(List<Statement.Param> params, List<Value> args) {
        int total = 0;
        for (int i = 0; i < args.size(); i++) {
            int s = interp.coercion.assignability(args.get(i), resolveQuietly(params.get(i).type));
            if (s == 0) return 0;
            total += s;
        }
        return total;
    }

    private DataType resolveQuietly(TypeRef ref) {
        try {
            return interp.types.resolve(ref);
        } catch (TypeDeclarationException e) {
            return null;
        }
    }

    // -------------------------
    // Entry points
    // -------------------------

    Value callFunction(UserFunction fn, List<Value> args, List<Expr.ExprInterface> argExprs, Token at) {
        Statement.FunctionDecl d = fn.decl;
        return executeRoutine(fn.name(), d.params, d.returnType, d.body, fn.closure, null, fn.name(), null,
                args, argExprs, at);
    }

    /** Calls a resolved method body with the given Self; null self means no Self binding (record statics). */
    Value callMethod(MethodInfo m, Value self, List<Value> args, List<Expr.ExprInterface> argExprs, Token at) {
        if (m.isNative()) {
            if (!m.accepts(args.size())) {
                return interp.error(at, "method " + m.qualifiedName() + " expects " + arity(m) + " argument(s), got "
                        + args.size());
            }
            return m.getNativeBody().invoke(self, args);
        }
        if (m.isAbstract()) {
            return interp.error(at, "abstract method " + m.qualifiedName() + " called");
        }
        Statement.FunctionDecl d = m.getDecl();
        return executeRoutine(m.qualifiedName(), d.params, d.returnType, d.body, interp.state.globals, self,
                d.name.lexeme, m, args, argExprs, at);
    }

    private static String arity(MethodInfo m) {
        return m.getMinParams() == m.getMaxParams()
                ? Integer.toString(m.getMaxParams())
                : m.getMinParams() + ".." + m.getMaxParams();
    }

    /** Lambdas check arity strictly and run in a child of the captured frame. */
    Value callLambda(FunctionPointer fp, List<Value> args, Token at) {
        Expr.Lambda lambda = fp.getLambda();
        if (args.size() != lambda.params.size()) {
            return interp.error(at, "lambda expects " + lambda.params.size() + " argument(s), got " + args.size());
        }
        return executeRoutine(fp.getName(), lambda.params, lambda.returnType, lambda.body, fp.getClosure(),
                null, null, null, args, null, at);
    }

    Value callPointer(FunctionPointer fp, List<Value> args, List<Expr.ExprInterface> argExprs, Token at) {
        switch (fp.getKind()) {
            case FUNCTION: {
                Statement.FunctionDecl d = fp.getFunction();
                return executeRoutine(fp.getName(), d.params, d.returnType, d.body, fp.getClosure(), null,
                        fp.getName(), null, args, argExprs, at);
            }
            case METHOD: {
                MethodInfo m = fp.getMethod();
                ObjectInstance obj = fp.getSelf() == null ? null : fp.getSelf().objectOrNull();
                if (obj != null) m = obj.getClassInfo().resolveVirtual(m);
                return callMethod(m, fp.getSelf(), args, argExprs, at);
            }
            default:
                return callLambda(fp, args, at);
        }
    }

    /** Creates an instance, runs the selected constructor overload on it and returns it. */
    Value construct(ClassInfo cls, String ctorName, List<Value> args, List<Expr.ExprInterface> argExprs, Token at) {
        if (cls.isAbstract()) {
            return interp.error(at, "cannot create instance of abstract class " + cls.getName());
        }
        List<MethodInfo> ctors = cls.findConstructors(ctorName);
        if (ctors.isEmpty()) {
            return interp.error(at, "constructor " + ctorName + " not found in class " + cls.getName());
        }
        MethodInfo ctor = selectMethod(ctors, args);
        if (ctor == null) {
            return interp.error(at, "no overload of " + cls.getName() + "." + ctorName + " accepts "
                    + args.size() + " argument(s)");
        }

        Value instance = interp.zeros.instantiate(cls, at);
        if (interp.aborted(instance)) return instance;

        Value r = callMethod(ctor, instance, args, argExprs, at);
        if (interp.aborted(r)) return r;
        return instance;
    }

    // -------------------------
    // Frame discipline
    // -------------------------

    /**
     * Binds parameters in a fresh child of parentEnv, pre-initializes Result,
     * runs the body and copies var parameters back to their argument
     * locations. Returns nil while a language exception is unwinding.
     */
    Value executeRoutine(String frameName, List<Statement.Param> params, TypeRef returnType,
                         List<Statement.Stmt> body, Environment parentEnv, Value self, String resultAlias,
                         MethodInfo method, List<Value> args, List<Expr.ExprInterface> argExprs, Token at) {
        CallStack stack = interp.state.callStack;
        if (stack.isFull()) {
            return interp.exceptions.raiseNative("EScriptStackOverflow",
                    "Maximal recursion exceeded (" + stack.getMaxDepth() + ")", at, null);
        }

        int required = 0;
        for (Statement.Param p : params) {
            if (p.defaultValue == null) required++;
        }
        if (args.size() < required || args.size() > params.size()) {
            return interp.error(at, frameName + " expects " + params.size() + " argument(s), got " + args.size());
        }

        stack.push(new CallFrame(frameName, at, resultAlias, method));
        Environment previous = interp.env;
        try {
            Environment local = parentEnv.childScope();
            if (self != null) local.define("Self", self);

            for (int i = 0; i < params.size(); i++) {
                Statement.Param p = params.get(i);
                DataType pt = interp.resolveType(p.type);

                Value arg;
                if (i < args.size()) {
                    arg = args.get(i);
                } else {
                    interp.env = local;
                    arg = interp.evaluateWithExpected(p.defaultValue, pt);
                    interp.env = previous;
                }
                if (interp.aborted(arg)) return arg;

                Value bound = interp.coercion.coerce(arg, pt, p.name);
                if (bound.isError()) return bound;
                local.define(p.name.lexeme, p.byRef ? bound : bound.copyForAssignment(), pt);
            }

            DataType rt = interp.resolveType(returnType);
            if (rt != null) {
                Value zero = interp.zeros.zeroOf(rt);
                if (zero.isError()) return zero;
                local.define("Result", zero, rt);
            }

            Value r = interp.executeBlock(body, local);
            ControlSignal escaped = interp.state.signal;
            interp.state.signal = ControlSignal.NONE;
            if (r.isError()) return r;
            if (escaped == ControlSignal.BREAK || escaped == ControlSignal.CONTINUE) {
                return interp.error(at, (escaped == ControlSignal.BREAK ? "break" : "continue")
                        + " outside of a loop in " + frameName);
            }

            // var parameters are written back even while an exception unwinds
            ExceptionValue pending = interp.exceptions.clear();
            Value w = copyBack(params, argExprs, local);
            if (interp.aborted(w)) return w;
            if (pending != null) {
                interp.exceptions.raise(pending);
                return Value.nil();
            }

            if (rt == null) return Value.nil();
            return interp.coercion.coerce(local.lookup("Result"), rt, at);
        } catch (TypeDeclarationException e) {
            return interp.error(at, e.getMessage());
        } finally {
            interp.env = previous;
            stack.pop();
        }
    }

    private Value copyBack(List<Statement.Param> params, List<Expr.ExprInterface> argExprs, Environment local) {
        if (argExprs == null) return Value.nil();
        for (int i = 0; i < params.size() && i < argExprs.size(); i++) {
            Statement.Param p = params.get(i);
            if (!p.byRef) continue;
            Value w = interp.assignTo(argExprs.get(i), local.lookup(p.name.lexeme), p.name);
            if (interp.aborted(w)) return w;
        }
        return Value.nil();
    }
}
