package com.delphine.script;

import com.delphine.script.ast.Expr;
import com.delphine.script.ast.Expr.ExprInterface;
import com.delphine.script.ast.Statement;
import com.delphine.script.ast.Statement.Directive;
import com.delphine.script.ast.Statement.Stmt;
import com.delphine.script.ast.Token;
import com.delphine.script.ast.TypeRef;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;

/**
 * Test-side AST builder. Programs are assembled from these helpers instead of
 * being parsed, since the engine consumes a parsed tree.
 */
public final class Ast {

    private static int line = 1;

    private Ast() {}

    /** Every token gets its own line so diagnostics carry a position. */
    public static Token tok(String lexeme) {
        return new Token(lexeme, line++, 1);
    }

    public static List<Stmt> program(Stmt... stmts) {
        return new ArrayList<>(Arrays.asList(stmts));
    }

    // -------------------------
    // Types
    // -------------------------

    public static TypeRef t(String name) {
        return TypeRef.named(name);
    }

    public static TypeRef dynArr(TypeRef element) {
        return TypeRef.dynamicArray(element);
    }

    public static TypeRef statArr(long low, long high, TypeRef element) {
        return TypeRef.staticArray(low, high, element);
    }

    public static TypeRef setOf(TypeRef element) {
        return TypeRef.set(element);
    }

    public static TypeRef fnType(TypeRef result, TypeRef... params) {
        return TypeRef.function(Arrays.asList(params), result);
    }

    // -------------------------
    // Expressions
    // -------------------------

    public static Expr.Literal lit(Object value) {
        if (value instanceof Integer) value = ((Integer) value).longValue();
        return new Expr.Literal(value, tok(String.valueOf(value)));
    }

    public static Expr.Literal nil() {
        return new Expr.Literal(null, tok("nil"));
    }

    public static Expr.Identifier id(String name) {
        return new Expr.Identifier(tok(name));
    }

    public static Expr.Binary bin(ExprInterface left, String op, ExprInterface right) {
        return new Expr.Binary(left, tok(op), right);
    }

    public static Expr.Unary un(String op, ExprInterface operand) {
        return new Expr.Unary(tok(op), operand);
    }

    public static Expr.Member mem(ExprInterface target, String name) {
        return new Expr.Member(target, tok(name));
    }

    public static Expr.Index idx(ExprInterface target, ExprInterface index) {
        return new Expr.Index(target, index, tok("["));
    }

    /** a[i, j] is a[i][j]. */
    public static Expr.Index idx(ExprInterface target, ExprInterface first, ExprInterface second) {
        return idx(idx(target, first), second);
    }

    public static Expr.Call call(String name, ExprInterface... args) {
        return new Expr.Call(id(name), tok("("), Arrays.asList(args));
    }

    public static Expr.Call callExpr(ExprInterface callee, ExprInterface... args) {
        return new Expr.Call(callee, tok("("), Arrays.asList(args));
    }

    public static Expr.Call mcall(ExprInterface target, String method, ExprInterface... args) {
        return new Expr.Call(mem(target, method), tok("("), Arrays.asList(args));
    }

    public static Expr.Call create(String className, ExprInterface... args) {
        return mcall(id(className), "Create", args);
    }

    public static Expr.ArrayLiteral arr(ExprInterface... elements) {
        return new Expr.ArrayLiteral(Arrays.asList(elements), null, tok("["));
    }

    public static Expr.ArrayLiteral arrOf(TypeRef type, ExprInterface... elements) {
        return new Expr.ArrayLiteral(Arrays.asList(elements), type, tok("["));
    }

    /** rec("TPoint", "X", lit(1), "Y", lit(2)) */
    public static Expr.RecordLiteral rec(String type, Object... fieldsAndValues) {
        LinkedHashMap<String, ExprInterface> fields = new LinkedHashMap<>();
        for (int i = 0; i < fieldsAndValues.length; i += 2) {
            fields.put((String) fieldsAndValues[i], (ExprInterface) fieldsAndValues[i + 1]);
        }
        return new Expr.RecordLiteral(tok(type), fields);
    }

    public static Expr.Lambda lambda(List<Statement.Param> params, TypeRef returnType, Stmt... body) {
        return new Expr.Lambda(tok("lambda"), params, returnType, Arrays.asList(body));
    }

    public static Expr.AddressOf addr(ExprInterface target) {
        return new Expr.AddressOf(tok("@"), target);
    }

    public static Expr.Is is(ExprInterface operand, String type) {
        return new Expr.Is(operand, t(type), tok("is"));
    }

    public static Expr.As as(ExprInterface operand, String type) {
        return new Expr.As(operand, t(type), tok("as"));
    }

    public static Expr.Inherited inherited(String method, ExprInterface... args) {
        return new Expr.Inherited(tok("inherited"), tok(method), Arrays.asList(args), true);
    }

    public static Expr.Inherited inheritedBare() {
        return new Expr.Inherited(tok("inherited"), null, Collections.emptyList(), false);
    }

    public static Expr.Range range(ExprInterface low, ExprInterface high) {
        return new Expr.Range(low, high, tok(".."));
    }

    // -------------------------
    // Statements
    // -------------------------

    public static Stmt expr(ExprInterface e) {
        return new Statement.ExprStmt(e);
    }

    public static Stmt println(ExprInterface... args) {
        return expr(call("PrintLn", args));
    }

    public static Stmt var(String name, TypeRef type) {
        return new Statement.VarStmt(Collections.singletonList(tok(name)), type, null);
    }

    public static Stmt var(String name, TypeRef type, ExprInterface init) {
        return new Statement.VarStmt(Collections.singletonList(tok(name)), type, init);
    }

    public static Stmt var(String name, ExprInterface init) {
        return var(name, null, init);
    }

    public static Stmt vars(TypeRef type, String... names) {
        List<Token> tokens = new ArrayList<>();
        for (String n : names) tokens.add(tok(n));
        return new Statement.VarStmt(tokens, type, null);
    }

    public static Stmt assign(ExprInterface target, ExprInterface value) {
        return new Statement.Assign(target, tok(":="), value);
    }

    public static Stmt assign(String name, ExprInterface value) {
        return assign(id(name), value);
    }

    public static Stmt compound(ExprInterface target, String op, ExprInterface value) {
        return new Statement.Assign(target, tok(op), value);
    }

    public static Statement.Block block(Stmt... stmts) {
        return new Statement.Block(tok("begin"), Arrays.asList(stmts));
    }

    public static Stmt ifThen(ExprInterface cond, Stmt then) {
        return new Statement.If(tok("if"), cond, then, null);
    }

    public static Stmt ifElse(ExprInterface cond, Stmt then, Stmt otherwise) {
        return new Statement.If(tok("if"), cond, then, otherwise);
    }

    public static Stmt whileDo(ExprInterface cond, Stmt body) {
        return new Statement.While(tok("while"), cond, body);
    }

    public static Stmt repeat(ExprInterface until, Stmt... body) {
        return new Statement.Repeat(tok("repeat"), Arrays.asList(body), until);
    }

    public static Stmt forTo(String variable, ExprInterface start, ExprInterface end, Stmt body) {
        return new Statement.For(tok(variable), start, end, false, body);
    }

    public static Stmt forDownto(String variable, ExprInterface start, ExprInterface end, Stmt body) {
        return new Statement.For(tok(variable), start, end, true, body);
    }

    public static Stmt forIn(String variable, ExprInterface iterable, Stmt body) {
        return new Statement.ForIn(tok(variable), iterable, body);
    }

    public static Statement.CaseBranch branch(Stmt body, ExprInterface... labels) {
        return new Statement.CaseBranch(Arrays.asList(labels), body);
    }

    public static Stmt caseOf(ExprInterface selector, Stmt otherwise, Statement.CaseBranch... branches) {
        return new Statement.Case(tok("case"), selector, Arrays.asList(branches), otherwise);
    }

    public static Stmt brk() {
        return new Statement.Break(tok("break"));
    }

    public static Stmt cont() {
        return new Statement.Continue(tok("continue"));
    }

    public static Stmt exit() {
        return new Statement.Exit(tok("exit"), null);
    }

    public static Stmt exit(ExprInterface value) {
        return new Statement.Exit(tok("exit"), value);
    }

    public static Statement.ExceptHandler on(String variable, String type, Stmt body) {
        return new Statement.ExceptHandler(variable == null ? null : tok(variable),
                type == null ? null : t(type), body);
    }

    public static Stmt tryExcept(List<Stmt> body, Statement.ExceptHandler... handlers) {
        return new Statement.Try(tok("try"), body,
                new Statement.ExceptClause(Arrays.asList(handlers), null), null);
    }

    public static Stmt tryExceptElse(List<Stmt> body, List<Stmt> elseBlock, Statement.ExceptHandler... handlers) {
        return new Statement.Try(tok("try"), body,
                new Statement.ExceptClause(Arrays.asList(handlers), elseBlock), null);
    }

    /** try ... except (catch-all block) end */
    public static Stmt tryCatchAll(List<Stmt> body, List<Stmt> handlerBlock) {
        return new Statement.Try(tok("try"), body,
                new Statement.ExceptClause(Collections.emptyList(), handlerBlock), null);
    }

    public static Stmt tryFinally(List<Stmt> body, List<Stmt> finallyBlock) {
        return new Statement.Try(tok("try"), body, null, finallyBlock);
    }

    public static Stmt raise(ExprInterface exception) {
        return new Statement.Raise(tok("raise"), exception);
    }

    public static Stmt reraise() {
        return new Statement.Raise(tok("raise"), null);
    }

    public static List<Stmt> stmts(Stmt... stmts) {
        return Arrays.asList(stmts);
    }

    // -------------------------
    // Declarations
    // -------------------------

    public static Statement.Param param(String name, String type) {
        return new Statement.Param(tok(name), t(type));
    }

    public static Statement.Param param(String name, TypeRef type) {
        return new Statement.Param(tok(name), type);
    }

    public static Statement.Param varParam(String name, String type) {
        return new Statement.Param(tok(name), t(type), true, null);
    }

    public static Statement.Param optParam(String name, String type, ExprInterface defaultValue) {
        return new Statement.Param(tok(name), t(type), false, defaultValue);
    }

    public static List<Statement.Param> params(Statement.Param... params) {
        return Arrays.asList(params);
    }

    public static List<Statement.Param> noParams() {
        return Collections.emptyList();
    }

    public static Statement.FunctionDecl func(String name, List<Statement.Param> params, String returnType, Stmt... body) {
        return new Statement.FunctionDecl(tok(name), params, returnType == null ? null : t(returnType),
                Arrays.asList(body));
    }

    public static Statement.FunctionDecl proc(String name, List<Statement.Param> params, Stmt... body) {
        return func(name, params, null, body);
    }

    public static Statement.FunctionDecl method(String name, List<Statement.Param> params, String returnType,
                                         EnumSet<Directive> directives, Stmt... body) {
        return new Statement.FunctionDecl(tok(name), params, returnType == null ? null : t(returnType),
                Arrays.asList(body), directives);
    }

    public static Statement.FunctionDecl ctor(String name, List<Statement.Param> params, Stmt... body) {
        return method(name, params, null, EnumSet.of(Directive.CONSTRUCTOR), body);
    }

    public static Statement.FunctionDecl abstractMethod(String name, List<Statement.Param> params, String returnType) {
        return new Statement.FunctionDecl(tok(name), params, returnType == null ? null : t(returnType), null,
                EnumSet.of(Directive.VIRTUAL, Directive.ABSTRACT));
    }

    /** Interface method signature. */
    public static Statement.FunctionDecl signature(String name, List<Statement.Param> params, String returnType) {
        return new Statement.FunctionDecl(tok(name), params, returnType == null ? null : t(returnType), null);
    }

    public static Statement.FieldDecl field(String name, String type) {
        return new Statement.FieldDecl(tok(name), t(type));
    }

    public static Statement.FieldDecl field(String name, TypeRef type, ExprInterface init) {
        return new Statement.FieldDecl(tok(name), type, init, false);
    }

    public static Statement.FieldDecl classVar(String name, String type, ExprInterface init) {
        return new Statement.FieldDecl(tok(name), t(type), init, true);
    }

    public static Statement.PropertyDecl property(String name, String type, String read, String write) {
        return new Statement.PropertyDecl(tok(name), t(type), null, read, write, false);
    }

    public static Statement.PropertyDecl indexedProperty(String name, String type, List<Statement.Param> indexParams,
                                                  String read, String write, boolean isDefault) {
        return new Statement.PropertyDecl(tok(name), t(type), indexParams, read, write, isDefault);
    }

    public static Statement.OperatorDecl operator(String op, String binding, String resultType, String... operandTypes) {
        return new Statement.OperatorDecl(tok(op), Statement.OperatorKind.OPERATOR, typeRefs(operandTypes),
                resultType == null ? null : t(resultType), tok(binding));
    }

    public static Statement.OperatorDecl implicit(String from, String to, String binding) {
        return new Statement.OperatorDecl(tok("implicit"), Statement.OperatorKind.IMPLICIT,
                Collections.singletonList(t(from)), t(to), tok(binding));
    }

    public static Statement.OperatorDecl explicit(String from, String to, String binding) {
        return new Statement.OperatorDecl(tok("explicit"), Statement.OperatorKind.EXPLICIT,
                Collections.singletonList(t(from)), t(to), tok(binding));
    }

    private static List<TypeRef> typeRefs(String... names) {
        List<TypeRef> out = new ArrayList<>();
        for (String n : names) out.add(t(n));
        return out;
    }

    public static ClassBuilder cls(String name) {
        return new ClassBuilder(name);
    }

    public static RecordBuilder record(String name) {
        return new RecordBuilder(name);
    }

    public static Stmt iface(String name, String parent, Statement.FunctionDecl... methods) {
        return new Statement.InterfaceDecl(tok(name), parent == null ? null : tok(parent),
                Arrays.asList(methods), null);
    }

    public static Stmt enumOf(String name, String... members) {
        List<Token> tokens = new ArrayList<>();
        for (String m : members) tokens.add(tok(m));
        return new Statement.EnumDecl(tok(name), tokens, null);
    }

    public static Stmt enumOf(String name, List<String> members, List<Long> ordinals) {
        List<Token> tokens = new ArrayList<>();
        for (String m : members) tokens.add(tok(m));
        return new Statement.EnumDecl(tok(name), tokens, ordinals);
    }

    public static Stmt alias(String name, TypeRef target) {
        return new Statement.TypeAlias(tok(name), target);
    }

    public static final class ClassBuilder {
        private final String name;
        private String parent;
        private final List<Token> interfaces = new ArrayList<>();
        private final List<Statement.FieldDecl> fields = new ArrayList<>();
        private final List<Statement.FunctionDecl> methods = new ArrayList<>();
        private final List<Statement.PropertyDecl> properties = new ArrayList<>();
        private final List<Statement.OperatorDecl> operators = new ArrayList<>();
        private boolean isAbstract;

        private ClassBuilder(String name) {
            this.name = name;
        }

        public ClassBuilder parent(String parent) {
            this.parent = parent;
            return this;
        }

        public ClassBuilder implement(String iface) {
            interfaces.add(tok(iface));
            return this;
        }

        public ClassBuilder field(Statement.FieldDecl f) {
            fields.add(f);
            return this;
        }

        public ClassBuilder field(String fieldName, String type) {
            return field(Ast.field(fieldName, type));
        }

        public ClassBuilder method(Statement.FunctionDecl m) {
            methods.add(m);
            return this;
        }

        public ClassBuilder property(Statement.PropertyDecl p) {
            properties.add(p);
            return this;
        }

        public ClassBuilder operator(Statement.OperatorDecl op) {
            operators.add(op);
            return this;
        }

        public ClassBuilder makeAbstract() {
            isAbstract = true;
            return this;
        }

        public Stmt build() {
            return new Statement.ClassDecl(tok(name), parent == null ? null : tok(parent), interfaces, fields,
                    methods, properties, operators, isAbstract);
        }
    }

    public static final class RecordBuilder {
        private final String name;
        private final List<Statement.FieldDecl> fields = new ArrayList<>();
        private final List<Statement.FunctionDecl> methods = new ArrayList<>();
        private final List<Statement.PropertyDecl> properties = new ArrayList<>();
        private final List<Statement.OperatorDecl> operators = new ArrayList<>();

        private RecordBuilder(String name) {
            this.name = name;
        }

        public RecordBuilder field(String fieldName, String type) {
            fields.add(Ast.field(fieldName, type));
            return this;
        }

        public RecordBuilder method(Statement.FunctionDecl m) {
            methods.add(m);
            return this;
        }

        public RecordBuilder property(Statement.PropertyDecl p) {
            properties.add(p);
            return this;
        }

        public RecordBuilder operator(Statement.OperatorDecl op) {
            operators.add(op);
            return this;
        }

        public Stmt build() {
            return new Statement.RecordDecl(tok(name), fields, methods, properties, operators);
        }
    }
}
