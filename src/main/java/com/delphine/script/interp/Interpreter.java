package com.delphine.script.interp;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.delphine.debug.Debug;
import com.delphine.script.ast.Expr;
import com.delphine.script.ast.Expr.ExprInterface;
import com.delphine.script.ast.SemanticInfo;
import com.delphine.script.ast.Statement;
import com.delphine.script.ast.Statement.Stmt;
import com.delphine.script.ast.Token;
import com.delphine.script.ast.TypeRef;
import com.delphine.script.builtins.BuiltinContext;
import com.delphine.script.builtins.BuiltinRegistry;
import com.delphine.script.host.HostBridge;
import com.delphine.script.host.HostFunctionRegistry;
import com.delphine.script.runtime.EnumValue;
import com.delphine.script.runtime.Environment;
import com.delphine.script.runtime.ExceptionValue;
import com.delphine.script.runtime.FunctionPointer;
import com.delphine.script.runtime.JsonValues;
import com.delphine.script.runtime.ObjectInstance;
import com.delphine.script.runtime.Value;
import com.delphine.script.types.ArrayType;
import com.delphine.script.types.ClassInfo;
import com.delphine.script.types.DataType;
import com.delphine.script.types.EnumType;
import com.delphine.script.types.FieldInfo;
import com.delphine.script.types.InterfaceInfo;
import com.delphine.script.types.MethodInfo;
import com.delphine.script.types.Names;
import com.delphine.script.types.PrimitiveType;
import com.delphine.script.types.RecordType;
import com.delphine.script.types.TypeDeclarationException;
import com.delphine.script.types.TypeRegistry;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * Tree-walking evaluator. Expressions and statements both return a {@link Value};
 * an ERROR value or an active language exception (see {@link ExceptionEngine})
 * stops evaluation, and callers check {@link #aborted(Value)} after every
 * sub-evaluation.
 */
public class Interpreter implements Expr.ExprVisitor<Value>, Statement.StmtVisitor<Value>, BuiltinContext {

    private static final String TAG = "Interpreter";

    final TypeRegistry types = new TypeRegistry();
    final ExecutionState state;
    Environment env;

    final Map<String, List<UserFunction>> functions = new LinkedHashMap<>();

    final ExceptionEngine exceptions = new ExceptionEngine(this);
    final ZeroValues zeros = new ZeroValues(this);
    final TypeCoercion coercion = new TypeCoercion(this);
    final OperatorResolver operators = new OperatorResolver(this);
    final IndexEvaluator indexer = new IndexEvaluator(this);
    final ArrayLiteralEvaluator arrays = new ArrayLiteralEvaluator(this);
    final MemberAccess members = new MemberAccess(this);
    final Invoker invoker = new Invoker(this);
    final CallDispatcher calls = new CallDispatcher(this);
    final Declarations declarations = new Declarations(this);

    final BuiltinRegistry builtins;
    final HostFunctionRegistry hostFunctions;
    final HostBridge hostBridge;
    final SemanticInfo semanticInfo;
    private final Appendable output;

    public Interpreter(int maxRecursionDepth, BuiltinRegistry builtins, HostFunctionRegistry hostFunctions,
                       SemanticInfo semanticInfo, Appendable output) {
        this.state = new ExecutionState(maxRecursionDepth);
        this.env = state.globals;
        this.builtins = builtins == null ? BuiltinRegistry.withCoreLibrary() : builtins;
        this.hostFunctions = hostFunctions == null ? new HostFunctionRegistry() : hostFunctions;
        this.hostBridge = new HostBridge(this);
        this.semanticInfo = semanticInfo;
        this.output = output == null ? new StringBuilder() : output;
        new StandardClasses(this).register(types);
    }

    // ===================== PUBLIC API =====================

    public ExecutionState getState() {
        return state;
    }

    public ExceptionEngine getExceptions() {
        return exceptions;
    }

    public TypeRegistry getTypes() {
        return types;
    }

    public Environment getGlobals() {
        return state.globals;
    }

    /**
     * Runs top-level statements in the global frame. Returns the first ERROR, or
     * nil; an exception still active afterwards has escaped every handler.
     */
    public Value executeProgram(List<Stmt> program) {
        env = state.globals;
        for (Stmt s : program) {
            Value r = execute(s);
            if (r.isError()) return r;
            if (exceptions.isActive()) {
                exceptions.markUnwound();
                return Value.nil();
            }
            if (state.signal == ControlSignal.EXIT) {
                state.signal = ControlSignal.NONE;
                break;
            }
            if (state.signal != ControlSignal.NONE) {
                String what = state.signal == ControlSignal.BREAK ? "break" : "continue";
                state.signal = ControlSignal.NONE;
                return error(s.token(), what + " outside of a loop");
            }
        }
        return Value.nil();
    }

    /** Calls a declared global routine by name, as an entry point. */
    public Value callEntry(String name, List<Value> args) {
        env = state.globals;
        Value r = callUserFunction(name, args, new Token(name));
        if (!r.isError() && exceptions.isActive()) exceptions.markUnwound();
        return r;
    }

    /** Evaluates one expression in the global frame. */
    public Value evaluateExpression(ExprInterface expr) {
        env = state.globals;
        Value r = evaluate(expr);
        if (!r.isError() && exceptions.isActive()) exceptions.markUnwound();
        return r;
    }

    // ===================== CORE EVALUATION =====================

    Value evaluate(ExprInterface expr) {
        if (expr.token() != null) state.currentNode = expr.token();
        try {
            return expr.accept(this);
        } catch (TypeDeclarationException e) {
            return error(expr.token(), e.getMessage());
        }
    }

    /** Evaluates with a context type; array literals take their type from it. */
    Value evaluateWithExpected(ExprInterface expr, DataType expected) {
        if (expr instanceof Expr.ArrayLiteral) {
            if (expr.token() != null) state.currentNode = expr.token();
            try {
                return arrays.evaluate((Expr.ArrayLiteral) expr, expected);
            } catch (TypeDeclarationException e) {
                return error(expr.token(), e.getMessage());
            }
        }
        return evaluate(expr);
    }

    Value execute(Stmt stmt) {
        if (stmt.token() != null) state.currentNode = stmt.token();
        try {
            return stmt.accept(this);
        } catch (TypeDeclarationException e) {
            return error(stmt.token(), e.getMessage());
        }
    }

    /**
     * Runs statements in the given scope. Stops at the first ERROR, while an
     * exception is active, or when a control transfer is pending.
     */
    Value executeBlock(List<Stmt> statements, Environment scope) {
        if (statements == null) return Value.nil();
        Environment previous = env;
        env = scope;
        try {
            for (Stmt s : statements) {
                Value r = execute(s);
                if (r.isError()) return r;
                if (exceptions.isActive() || state.signal != ControlSignal.NONE) break;
            }
            return Value.nil();
        } finally {
            env = previous;
        }
    }

    @Override
    public boolean aborted(Value v) {
        return v.isError() || exceptions.isActive();
    }

    Value error(Token at, String message) {
        return Value.error(errorAt(at, message));
    }

    static String errorAt(Token at, String message) {
        if (at == null || !at.hasPosition()) return message;
        return message + " at line " + at.line + ", column " + at.column;
    }

    /**
     * Instance methods named {@code name} as seen by a call on {@code receiver}.
     * When the receiver is Self of the running method, lookup starts at that
     * method's class, so a descendant's reintroduced method stays hidden from
     * ancestor code. Dispatch through the VMT still uses the dynamic class.
     */
    List<MethodInfo> visibleMethods(ObjectInstance receiver, String name) {
        ClassInfo dynamic = receiver.getClassInfo();
        CallFrame frame = state.callStack.current();
        if (frame != null && frame.method != null && frame.method.getOwner() instanceof ClassInfo) {
            ClassInfo owner = (ClassInfo) frame.method.getOwner();
            Value self = env.lookup("Self");
            if (owner != dynamic && self != null && self.unwrapVariant().objectOrNull() == receiver
                    && dynamic.isSubclassOf(owner)) {
                List<MethodInfo> scoped = owner.findMethods(name);
                if (!scoped.isEmpty()) return scoped;
            }
        }
        return dynamic.findMethods(name);
    }

    DataType resolveType(TypeRef ref) {
        if (ref == null) return null;
        return types.resolve(ref);
    }

    /** Evaluates arguments in order into out; returns the aborting value, or null when all succeeded. */
    Value evalArgs(List<ExprInterface> exprs, List<Value> out, List<DataType> expected) {
        for (int i = 0; i < exprs.size(); i++) {
            DataType t = (expected == null || i >= expected.size()) ? null : expected.get(i);
            Value v = evaluateWithExpected(exprs.get(i), t);
            if (aborted(v)) return v;
            out.add(v);
        }
        return null;
    }

    Value callUserFunction(String name, List<Value> args, Token at) {
        List<UserFunction> overloads = functions.get(Names.normalize(name));
        if (overloads == null || overloads.isEmpty()) {
            return error(at, "function '" + name + "' not found");
        }
        UserFunction fn = invoker.selectFunction(overloads, args);
        if (fn == null) {
            return error(at, "no overload of " + name + " accepts " + args.size() + " argument(s)");
        }
        return invoker.callFunction(fn, args, null, at);
    }

    // ===================== ASSIGNMENT =====================

    /**
     * Stores into an identifier, member or index location, coercing to the
     * location's declared type. Inside a function its own name aliases Result.
     */
    Value assignTo(ExprInterface target, Value value, Token at) {
        if (target instanceof Expr.Identifier) {
            return assignVariable(((Expr.Identifier) target).name, value, at);
        }
        if (target instanceof Expr.Member) return members.write((Expr.Member) target, value, at);
        if (target instanceof Expr.Index) return indexer.write((Expr.Index) target, value, at);
        return error(at, "cannot assign to this expression");
    }

    private Value assignVariable(Token name, Value value, Token at) {
        String n = name.lexeme;
        CallFrame frame = state.callStack.current();
        if (frame != null && frame.resultAlias != null && Names.same(frame.resultAlias, n) && env.exists("Result")) {
            n = "Result";
        }

        if (env.exists(n)) {
            Value c = coercion.coerce(value, env.declaredType(n), at);
            if (aborted(c)) return c;
            env.assign(n, c.copyForAssignment());
            return Value.nil();
        }

        Value self = env.lookup("Self");
        if (self != null) {
            Value done = members.tryWriteMember(self.unwrapVariant(), name, value, at);
            if (done != null) return done;
        }
        return error(name, "undefined identifier: " + n);
    }

    // ===================== EXPRESSIONS =====================

    @Override
    public Value visitLiteralExpr(Expr.Literal expr) {
        Object v = expr.value;
        if (v == null) return Value.nil();
        if (v instanceof Long || v instanceof Integer) return Value.integer(((Number) v).longValue());
        if (v instanceof Double) return Value.floating((Double) v);
        if (v instanceof String) return Value.string((String) v);
        if (v instanceof Boolean) return Value.bool((Boolean) v);
        return error(expr.token, "unsupported literal " + v);
    }

    @Override
    public Value visitIdentifierExpr(Expr.Identifier expr) {
        Token name = expr.name;
        String n = name.lexeme;

        Value v = env.lookup(n);
        if (v != null) return v;

        if (Names.same(n, "ExceptObject")) return exceptions.exceptObject();

        Value self = env.lookup("Self");
        if (self != null) {
            Value member = members.tryReadMember(self.unwrapVariant(), name);
            if (member != null) return member;
        }

        EnumType et = types.findEnumByMember(n);
        if (et != null) {
            long ordinal = et.ordinalOf(n);
            return Value.enumValue(new EnumValue(et, et.nameOf(ordinal), ordinal));
        }

        List<UserFunction> overloads = functions.get(Names.normalize(n));
        if (overloads != null) {
            UserFunction fn = invoker.selectFunction(overloads, Collections.emptyList());
            if (fn != null) return invoker.callFunction(fn, Collections.emptyList(), null, name);
        }

        ClassInfo cls = types.findClass(n);
        if (cls != null) return Value.classRef(cls);

        return error(name, "undefined identifier: " + n);
    }

    @Override
    public Value visitBinaryExpr(Expr.Binary expr) {
        String op = Names.normalize(expr.operator.lexeme);

        Value left = evaluate(expr.left);
        if (aborted(left)) return left;

        if ((op.equals("and") || op.equals("or")) && left.unwrapVariant().getType() == Value.Type.BOOLEAN) {
            boolean l = left.unwrapVariant().asBool();
            if (op.equals("and") && !l) return Value.bool(false);
            if (op.equals("or") && l) return Value.bool(true);
        }

        Value right = evaluate(expr.right);
        if (aborted(right)) return right;

        return binary(op, left, right, expr.operator);
    }

    /** Shared by binary expressions and compound assignment. */
    private Value binary(String op, Value left, Value right, Token at) {
        // [a, b] next to a set is read as a set of the same type
        if (left.getType() == Value.Type.SET && right.getType() == Value.Type.ARRAY) {
            right = coercion.coerce(right, left.asSet().getType(), at);
            if (aborted(right)) return right;
        } else if (right.getType() == Value.Type.SET && left.getType() == Value.Type.ARRAY && !op.equals("in")) {
            left = coercion.coerce(left, right.asSet().getType(), at);
            if (aborted(left)) return left;
        }

        boolean userOperands = hasUserOperators(left) || hasUserOperators(right);
        if (userOperands) {
            Value r = operators.tryBinary(op, left, right, at);
            if (r != null) return r;
        }

        Value r = PrimitiveOperators.binary(op, left, right, at);
        if (r != null) return r;

        if (!userOperands) {
            r = operators.tryBinary(op, left, right, at);
            if (r != null) return r;
        }
        return error(at, "operator " + op + " not applicable to " + left.typeName() + " and " + right.typeName());
    }

    private static boolean hasUserOperators(Value v) {
        Value.Type t = v.unwrapVariant().getType();
        return t == Value.Type.OBJECT || t == Value.Type.RECORD || t == Value.Type.INTERFACE;
    }

    @Override
    public Value visitUnaryExpr(Expr.Unary expr) {
        String op = Names.normalize(expr.operator.lexeme);
        Value v = evaluate(expr.operand);
        if (aborted(v)) return v;

        if (hasUserOperators(v)) {
            Value r = operators.tryUnary(op, v, expr.operator);
            if (r != null) return r;
        }
        Value r = PrimitiveOperators.unary(op, v);
        if (r != null) return r;
        r = operators.tryUnary(op, v, expr.operator);
        if (r != null) return r;
        return error(expr.operator, "operator " + op + " not applicable to " + v.typeName());
    }

    @Override
    public Value visitMemberExpr(Expr.Member expr) {
        return members.read(expr);
    }

    @Override
    public Value visitIndexExpr(Expr.Index expr) {
        return indexer.read(expr);
    }

    @Override
    public Value visitCallExpr(Expr.Call expr) {
        return calls.call(expr);
    }

    @Override
    public Value visitArrayLiteralExpr(Expr.ArrayLiteral expr) {
        return arrays.evaluate(expr, null);
    }

    @Override
    public Value visitRecordLiteralExpr(Expr.RecordLiteral expr) {
        RecordType rt = types.findRecord(expr.typeName.lexeme);
        if (rt == null) return error(expr.typeName, "unknown record type " + expr.typeName.lexeme);

        Value rec = zeros.newRecord(rt, expr.typeName);
        if (aborted(rec)) return rec;

        for (Map.Entry<String, ExprInterface> e : expr.fields.entrySet()) {
            FieldInfo f = rt.findField(e.getKey());
            if (f == null) return error(expr.typeName, "record " + rt.getName() + " has no field " + e.getKey());
            Value v = evaluateWithExpected(e.getValue(), f.getType());
            if (aborted(v)) return v;
            Value c = coercion.coerce(v, f.getType(), expr.typeName);
            if (aborted(c)) return c;
            rec.asRecord().setField(f.getName(), c.copyForAssignment());
        }
        return rec;
    }

    @Override
    public Value visitLambdaExpr(Expr.Lambda expr) {
        return Value.function(FunctionPointer.ofLambda(expr, env));
    }

    @Override
    public Value visitAddressOfExpr(Expr.AddressOf expr) {
        if (expr.target instanceof Expr.Identifier) {
            String n = ((Expr.Identifier) expr.target).name.lexeme;
            Value bound = env.lookup(n);
            if (bound != null && bound.unwrapVariant().getType() == Value.Type.FUNCTION_POINTER) {
                return bound.unwrapVariant();
            }
            List<UserFunction> overloads = functions.get(Names.normalize(n));
            if (overloads != null && !overloads.isEmpty()) {
                UserFunction fn = overloads.get(0);
                return Value.function(FunctionPointer.ofFunction(fn.decl, fn.closure));
            }
            Value self = env.lookup("Self");
            if (self != null && self.getType() == Value.Type.OBJECT) {
                List<MethodInfo> methods = self.asObject().getClassInfo().findMethods(n);
                if (!methods.isEmpty()) return Value.function(FunctionPointer.ofMethod(methods.get(0), self));
            }
            return error(expr.at, "cannot take the address of " + n);
        }
        if (expr.target instanceof Expr.Member) {
            Expr.Member m = (Expr.Member) expr.target;
            Value owner = evaluate(m.target);
            if (aborted(owner)) return owner;
            ObjectInstance obj = owner.unwrapVariant().objectOrNull();
            if (obj != null) {
                List<MethodInfo> methods = obj.getClassInfo().findMethods(m.name.lexeme);
                if (!methods.isEmpty()) {
                    return Value.function(FunctionPointer.ofMethod(methods.get(0), Value.object(obj)));
                }
            }
            return error(m.name, "cannot take the address of " + m.name.lexeme);
        }
        return error(expr.at, "cannot take the address of this expression");
    }

    @Override
    public Value visitIsExpr(Expr.Is expr) {
        Value v = evaluate(expr.operand);
        if (aborted(v)) return v;
        Value src = v.unwrapVariant();
        if (src.isNil()) return Value.bool(false);

        DataType t = resolveType(expr.type);
        if (t instanceof ClassInfo) {
            ObjectInstance obj = src.objectOrNull();
            return Value.bool(obj != null && obj.isInstanceOf((ClassInfo) t));
        }
        if (t instanceof InterfaceInfo) {
            ObjectInstance obj = src.objectOrNull();
            return Value.bool(obj != null && obj.getClassInfo().implementsInterface((InterfaceInfo) t));
        }
        return Value.bool(ValueTypes.sameType(ValueTypes.typeOf(src), t));
    }

    @Override
    public Value visitAsExpr(Expr.As expr) {
        Value v = evaluate(expr.operand);
        if (aborted(v)) return v;
        Value src = v.unwrapVariant();
        if (src.isNil()) return src;

        DataType t = resolveType(expr.type);
        if (t instanceof ClassInfo) {
            ObjectInstance obj = src.objectOrNull();
            if (obj != null && obj.isInstanceOf((ClassInfo) t)) return Value.object(obj);
            return exceptions.raiseNative("EInvalidCast", "invalid class typecast", expr.keyword, null);
        }
        if (t instanceof InterfaceInfo) return calls.toInterface(src, (InterfaceInfo) t, expr.keyword);
        return coercion.coerce(src, t, expr.keyword);
    }

    /**
     * inherited [Name[(args)]]: the parent class's implementation, bound
     * statically. Bare inherited passes the current parameters along and is a
     * no-op when no ancestor declares the method.
     */
    @Override
    public Value visitInheritedExpr(Expr.Inherited expr) {
        CallFrame frame = state.callStack.current();
        MethodInfo current = frame == null ? null : frame.method;
        Value self = env.lookup("Self");
        if (current == null || self == null || !(current.getOwner() instanceof ClassInfo)) {
            return error(expr.keyword, "inherited used outside of a method");
        }
        ClassInfo parent = ((ClassInfo) current.getOwner()).getParent();
        String name = expr.method != null ? expr.method.lexeme : current.getName();

        List<Value> args = new ArrayList<>();
        List<ExprInterface> argExprs = null;
        if (expr.explicitArguments || expr.method != null) {
            Value failed = evalArgs(expr.arguments, args, null);
            if (failed != null) return failed;
            argExprs = expr.arguments;
        } else if (!current.isNative()) {
            for (Statement.Param p : current.getDecl().params) args.add(env.lookup(p.name.lexeme));
        }

        List<MethodInfo> candidates = Collections.emptyList();
        if (parent != null) {
            candidates = current.isConstructor() ? parent.findConstructors(name) : parent.findMethods(name);
            if (candidates.isEmpty()) candidates = parent.findMethods(name);
            if (candidates.isEmpty()) candidates = parent.findClassMethods(name);
        }
        if (candidates.isEmpty()) {
            if (expr.method == null) return Value.nil();
            return error(expr.keyword, "inherited method " + name + " not found");
        }
        MethodInfo m = invoker.selectMethod(candidates, args);
        if (m == null) {
            return error(expr.keyword, "no overload of inherited " + name + " accepts " + args.size() + " argument(s)");
        }
        return invoker.callMethod(m, m.isClassMethod() ? Value.classRef(parent) : self, args, argExprs, expr.keyword);
    }

    @Override
    public Value visitRangeExpr(Expr.Range expr) {
        return error(expr.dots, "a range is only valid as a case label");
    }

    // ===================== STATEMENTS =====================

    @Override
    public Value visitExprStmt(Statement.ExprStmt stmt) {
        Value v = evaluate(stmt.expression);
        return v.isError() ? v : Value.nil();
    }

    @Override
    public Value visitVarStmt(Statement.VarStmt stmt) {
        DataType declared = resolveType(stmt.type);

        Value initial = null;
        if (stmt.initializer != null) {
            initial = evaluateWithExpected(stmt.initializer, declared);
            if (aborted(initial)) return initial;
            initial = coercion.coerce(initial, declared, stmt.names.get(0));
            if (aborted(initial)) return initial;
        }

        for (Token name : stmt.names) {
            Value v;
            DataType t = declared;
            if (initial != null) {
                v = initial.copyForAssignment();
                if (t == null && !initial.unwrapVariant().isNil()) t = ValueTypes.typeOf(initial);
            } else {
                v = zeros.zeroOf(declared);
                if (v.isError()) return v;
            }
            env.define(name.lexeme, v, t);
        }
        return Value.nil();
    }

    @Override
    public Value visitAssignStmt(Statement.Assign stmt) {
        if (!stmt.isCompound()) {
            Value v = evaluateWithExpected(stmt.value, expectedTypeOf(stmt.target));
            if (aborted(v)) return v;
            return assignTo(stmt.target, v, stmt.operator);
        }

        Value current = evaluate(stmt.target);
        if (aborted(current)) return current;
        Value rhs = evaluate(stmt.value);
        if (aborted(rhs)) return rhs;

        String lexeme = stmt.operator.lexeme;
        Value r = null;
        if (hasUserOperators(current) || hasUserOperators(rhs)) {
            r = operators.tryBinary(lexeme, current, rhs, stmt.operator);
        }
        if (r == null) {
            r = binary(lexeme.substring(0, lexeme.length() - 1), current, rhs, stmt.operator);
        }
        if (aborted(r)) return r;
        return assignTo(stmt.target, r, stmt.operator);
    }

    private DataType expectedTypeOf(ExprInterface target) {
        if (target instanceof Expr.Identifier) return env.declaredType(((Expr.Identifier) target).name.lexeme);
        return null;
    }

    @Override
    public Value visitBlockStmt(Statement.Block stmt) {
        return executeBlock(stmt.statements, env.childScope());
    }

    @Override
    public Value visitIfStmt(Statement.If stmt) {
        Value cond = condition(stmt.condition, stmt.keyword);
        if (aborted(cond)) return cond;
        if (cond.asBool()) return execute(stmt.thenBranch);
        if (stmt.elseBranch != null) return execute(stmt.elseBranch);
        return Value.nil();
    }

    private Value condition(ExprInterface expr, Token at) {
        Value v = evaluate(expr);
        if (aborted(v)) return v;
        Value b = v.unwrapVariant();
        if (b.getType() != Value.Type.BOOLEAN) return error(at, "condition must be Boolean, got " + b.typeName());
        return b;
    }

    /**
     * After a loop body: consumes break and continue.
     *
     * @return true when the loop must stop
     */
    private boolean leaveLoop() {
        if (state.signal == ControlSignal.BREAK) {
            state.signal = ControlSignal.NONE;
            return true;
        }
        if (state.signal == ControlSignal.CONTINUE) {
            state.signal = ControlSignal.NONE;
        }
        return state.signal == ControlSignal.EXIT || exceptions.isActive();
    }

    @Override
    public Value visitWhileStmt(Statement.While stmt) {
        while (true) {
            Value cond = condition(stmt.condition, stmt.keyword);
            if (aborted(cond)) return cond;
            if (!cond.asBool()) break;

            Value r = execute(stmt.body);
            if (r.isError()) return r;
            if (leaveLoop()) break;
        }
        return Value.nil();
    }

    @Override
    public Value visitRepeatStmt(Statement.Repeat stmt) {
        while (true) {
            Value r = executeBlock(stmt.body, env.childScope());
            if (r.isError()) return r;
            if (leaveLoop()) break;

            Value cond = condition(stmt.until, stmt.keyword);
            if (aborted(cond)) return cond;
            if (cond.asBool()) break;
        }
        return Value.nil();
    }

    @Override
    public Value visitForStmt(Statement.For stmt) {
        Value start = evaluate(stmt.start);
        if (aborted(start)) return start;
        Value end = evaluate(stmt.end);
        if (aborted(end)) return end;
        start = start.unwrapVariant();
        end = end.unwrapVariant();

        if (!ValueTypes.isOrdinal(start) || !ValueTypes.isOrdinal(end)) {
            return error(stmt.variable, "for loop bounds must be ordinal values");
        }
        EnumType et = start.getType() == Value.Type.ENUM ? start.asEnum().getType() : null;
        String var = stmt.variable.lexeme;
        if (!env.exists(var)) {
            env.define(var, start, et == null ? PrimitiveType.INTEGER : et);
        }

        long from = ValueTypes.ordinalOf(start);
        long to = ValueTypes.ordinalOf(end);
        long step = stmt.downto ? -1 : 1;
        for (long i = from; stmt.downto ? i >= to : i <= to; i += step) {
            Value current;
            if (et != null) {
                String member = et.nameOf(i);
                if (member == null) continue;
                current = Value.enumValue(new EnumValue(et, member, i));
            } else {
                current = Value.integer(i);
            }
            Value w = assignVariable(stmt.variable, current, stmt.variable);
            if (aborted(w)) return w;

            Value r = execute(stmt.body);
            if (r.isError()) return r;
            if (leaveLoop()) break;
        }
        return Value.nil();
    }

    @Override
    public Value visitForInStmt(Statement.ForIn stmt) {
        Value container = evaluate(stmt.iterable);
        if (aborted(container)) return container;
        Value c = container.unwrapVariant();

        List<Value> items = new ArrayList<>();
        DataType itemType = null;
        switch (c.getType()) {
            case ARRAY: {
                ArrayType at = c.asArray().getType();
                itemType = at.getElementType();
                for (Value e : c.asArray().elements()) items.add(e == null ? zeros.zeroOf(itemType) : e);
                break;
            }
            case STRING: {
                itemType = PrimitiveType.STRING;
                String s = c.asString();
                s.codePoints().forEach(cp -> items.add(Value.string(new String(Character.toChars(cp)))));
                break;
            }
            case SET:
                itemType = c.asSet().getType().getElementType();
                items.addAll(c.asSet().elements());
                break;
            case JSON: {
                JsonNode node = c.asJson();
                if (node.isArray()) {
                    for (JsonNode e : node) items.add(JsonValues.toValue(e));
                } else if (node.isObject()) {
                    itemType = PrimitiveType.STRING;
                    Iterator<String> names = node.fieldNames();
                    while (names.hasNext()) items.add(Value.string(names.next()));
                } else {
                    return error(stmt.variable, "cannot iterate over JSON scalar");
                }
                break;
            }
            default:
                return error(stmt.variable, "cannot iterate over " + c.typeName());
        }

        String var = stmt.variable.lexeme;
        if (!env.exists(var)) {
            env.define(var, zeros.zeroOf(itemType), itemType);
        }
        for (Value item : items) {
            Value w = assignVariable(stmt.variable, item, stmt.variable);
            if (aborted(w)) return w;

            Value r = execute(stmt.body);
            if (r.isError()) return r;
            if (leaveLoop()) break;
        }
        return Value.nil();
    }

    @Override
    public Value visitCaseStmt(Statement.Case stmt) {
        Value selector = evaluate(stmt.selector);
        if (aborted(selector)) return selector;
        selector = selector.unwrapVariant();

        for (Statement.CaseBranch branch : stmt.branches) {
            for (ExprInterface label : branch.labels) {
                Value m = caseMatches(selector, label, stmt.keyword);
                if (aborted(m)) return m;
                if (m.asBool()) return execute(branch.body);
            }
        }
        if (stmt.elseBranch != null) return execute(stmt.elseBranch);
        return Value.nil();
    }

    private Value caseMatches(Value selector, ExprInterface label, Token at) {
        if (!(label instanceof Expr.Range)) {
            Value v = evaluate(label);
            if (aborted(v)) return v;
            return Value.bool(PrimitiveOperators.valuesEqual(selector, v.unwrapVariant()));
        }
        Expr.Range range = (Expr.Range) label;
        Value low = evaluate(range.low);
        if (aborted(low)) return low;
        Value high = evaluate(range.high);
        if (aborted(high)) return high;
        low = low.unwrapVariant();
        high = high.unwrapVariant();

        if (ValueTypes.isOrdinal(selector) && ValueTypes.isOrdinal(low) && ValueTypes.isOrdinal(high)) {
            long s = ValueTypes.ordinalOf(selector);
            return Value.bool(s >= ValueTypes.ordinalOf(low) && s <= ValueTypes.ordinalOf(high));
        }
        if (selector.getType() == Value.Type.STRING && low.getType() == Value.Type.STRING
                && high.getType() == Value.Type.STRING) {
            String s = selector.asString();
            return Value.bool(s.compareTo(low.asString()) >= 0 && s.compareTo(high.asString()) <= 0);
        }
        return error(at, "case range needs ordinal or string values, got " + selector.typeName());
    }

    @Override
    public Value visitBreakStmt(Statement.Break stmt) {
        state.signal = ControlSignal.BREAK;
        return Value.nil();
    }

    @Override
    public Value visitContinueStmt(Statement.Continue stmt) {
        state.signal = ControlSignal.CONTINUE;
        return Value.nil();
    }

    @Override
    public Value visitExitStmt(Statement.Exit stmt) {
        if (stmt.value != null) {
            if (!env.exists("Result")) return error(stmt.keyword, "Exit with a value outside of a function");
            Value v = evaluateWithExpected(stmt.value, env.declaredType("Result"));
            if (aborted(v)) return v;
            Value c = coercion.coerce(v, env.declaredType("Result"), stmt.keyword);
            if (aborted(c)) return c;
            env.assign("Result", c.copyForAssignment());
        }
        state.signal = ControlSignal.EXIT;
        return Value.nil();
    }

    @Override
    public Value visitTryStmt(Statement.Try stmt) {
        return exceptions.executeTry(stmt);
    }

    @Override
    public Value visitRaiseStmt(Statement.Raise stmt) {
        return exceptions.executeRaise(stmt);
    }

    @Override
    public Value visitFunctionStmt(Statement.FunctionDecl stmt) {
        return declarations.declareFunction(stmt);
    }

    @Override
    public Value visitClassStmt(Statement.ClassDecl stmt) {
        Debug.get().t(TAG, "declare class " + stmt.name.lexeme);
        return declarations.declareClass(stmt);
    }

    @Override
    public Value visitRecordStmt(Statement.RecordDecl stmt) {
        return declarations.declareRecord(stmt);
    }

    @Override
    public Value visitInterfaceStmt(Statement.InterfaceDecl stmt) {
        return declarations.declareInterface(stmt);
    }

    @Override
    public Value visitEnumStmt(Statement.EnumDecl stmt) {
        return declarations.declareEnum(stmt);
    }

    @Override
    public Value visitTypeAliasStmt(Statement.TypeAlias stmt) {
        return declarations.declareAlias(stmt);
    }

    @Override
    public Value visitOperatorStmt(Statement.OperatorDecl stmt) {
        return declarations.declareOperator(stmt);
    }

    // ===================== BuiltinContext =====================

    @Override
    public Token currentNode() {
        return state.currentNode;
    }

    @Override
    public void setCurrentNode(Token node) {
        state.currentNode = node;
    }

    @Override
    public Value error(String message) {
        return error(state.currentNode, message);
    }

    @Override
    public Value raise(String className, String message, Map<String, Value> extraFields) {
        return exceptions.raiseNative(className, message, state.currentNode, extraFields);
    }

    @Override
    public Value call(Value callable, List<Value> args) {
        Value c = callable.unwrapVariant();
        if (c.getType() != Value.Type.FUNCTION_POINTER) {
            return error("value of type " + c.typeName() + " is not callable");
        }
        return invoker.callPointer(c.asFunction(), args, null, state.currentNode);
    }

    @Override
    public ExceptionValue takeException() {
        return exceptions.clear();
    }

    @Override
    public void resume(ExceptionValue exception) {
        exceptions.raise(exception);
    }

    @Override
    public Value zeroOf(DataType type) {
        return zeros.zeroOf(type);
    }

    @Override
    public void write(String text) {
        try {
            output.append(text);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
