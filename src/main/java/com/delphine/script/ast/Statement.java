package com.delphine.script.ast;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

public class Statement {

    public interface Stmt {
        <R> R accept(StmtVisitor<R> visitor);

        Token token();
    }

    public interface StmtVisitor<R> {
        R visitExprStmt(ExprStmt stmt);
        R visitVarStmt(VarStmt stmt);
        R visitAssignStmt(Assign stmt);
        R visitBlockStmt(Block stmt);
        R visitIfStmt(If stmt);
        R visitWhileStmt(While stmt);
        R visitRepeatStmt(Repeat stmt);
        R visitForStmt(For stmt);
        R visitForInStmt(ForIn stmt);
        R visitCaseStmt(Case stmt);
        R visitBreakStmt(Break stmt);
        R visitContinueStmt(Continue stmt);
        R visitExitStmt(Exit stmt);
        R visitTryStmt(Try stmt);
        R visitRaiseStmt(Raise stmt);
        R visitFunctionStmt(FunctionDecl stmt);
        R visitClassStmt(ClassDecl stmt);
        R visitRecordStmt(RecordDecl stmt);
        R visitInterfaceStmt(InterfaceDecl stmt);
        R visitEnumStmt(EnumDecl stmt);
        R visitTypeAliasStmt(TypeAlias stmt);
        R visitOperatorStmt(OperatorDecl stmt);
    }

    private static <T> List<T> orEmpty(List<T> list) {
        return list == null ? new ArrayList<>() : list;
    }

    // -------------------------
    // Simple statements
    // -------------------------

    public static final class ExprStmt implements Stmt {
        public final Expr.ExprInterface expression;

        public ExprStmt(Expr.ExprInterface expression) { this.expression = expression; }

        public Token token() { return expression.token(); }
        public <R> R accept(StmtVisitor<R> visitor) { return visitor.visitExprStmt(this); }
    }

    /** var a, b: T := init; type and initializer are each optional, not both. */
    public static final class VarStmt implements Stmt {
        public final List<Token> names;
        public final TypeRef type;
        public final Expr.ExprInterface initializer;

        public VarStmt(List<Token> names, TypeRef type, Expr.ExprInterface initializer) {
            this.names = names;
            this.type = type;
            this.initializer = initializer;
        }

        public Token token() { return names.get(0); }
        public <R> R accept(StmtVisitor<R> visitor) { return visitor.visitVarStmt(this); }
    }

    /** target := value, or a compound form (+=, -=, *=, /=) named by the operator lexeme. */
    public static final class Assign implements Stmt {
        public final Expr.ExprInterface target;
        public final Token operator;
        public final Expr.ExprInterface value;

        public Assign(Expr.ExprInterface target, Token operator, Expr.ExprInterface value) {
            this.target = target;
            this.operator = operator;
            this.value = value;
        }

        public boolean isCompound() {
            return !":=".equals(operator.lexeme);
        }

        public Token token() { return operator; }
        public <R> R accept(StmtVisitor<R> visitor) { return visitor.visitAssignStmt(this); }
    }

    public static final class Block implements Stmt {
        public final Token begin;
        public final List<Stmt> statements;

        public Block(Token begin, List<Stmt> statements) {
            this.begin = begin;
            this.statements = orEmpty(statements);
        }

        public Token token() { return begin; }
        public <R> R accept(StmtVisitor<R> visitor) { return visitor.visitBlockStmt(this); }
    }

    public static final class If implements Stmt {
        public final Token keyword;
        public final Expr.ExprInterface condition;
        public final Stmt thenBranch;
        public final Stmt elseBranch;

        public If(Token keyword, Expr.ExprInterface condition, Stmt thenBranch, Stmt elseBranch) {
            this.keyword = keyword;
            this.condition = condition;
            this.thenBranch = thenBranch;
            this.elseBranch = elseBranch;
        }

        public Token token() { return keyword; }
        public <R> R accept(StmtVisitor<R> visitor) { return visitor.visitIfStmt(this); }
    }

    public static final class While implements Stmt {
        public final Token keyword;
        public final Expr.ExprInterface condition;
        public final Stmt body;

        public While(Token keyword, Expr.ExprInterface condition, Stmt body) {
            this.keyword = keyword;
            this.condition = condition;
            this.body = body;
        }

        public Token token() { return keyword; }
        public <R> R accept(StmtVisitor<R> visitor) { return visitor.visitWhileStmt(this); }
    }

    public static final class Repeat implements Stmt {
        public final Token keyword;
        public final List<Stmt> body;
        public final Expr.ExprInterface until;

        public Repeat(Token keyword, List<Stmt> body, Expr.ExprInterface until) {
            this.keyword = keyword;
            this.body = orEmpty(body);
            this.until = until;
        }

        public Token token() { return keyword; }
        public <R> R accept(StmtVisitor<R> visitor) { return visitor.visitRepeatStmt(this); }
    }

    public static final class For implements Stmt {
        public final Token variable;
        public final Expr.ExprInterface start;
        public final Expr.ExprInterface end;
        public final boolean downto;
        public final Stmt body;

        public For(Token variable, Expr.ExprInterface start, Expr.ExprInterface end, boolean downto, Stmt body) {
            this.variable = variable;
            this.start = start;
            this.end = end;
            this.downto = downto;
            this.body = body;
        }

        public Token token() { return variable; }
        public <R> R accept(StmtVisitor<R> visitor) { return visitor.visitForStmt(this); }
    }

    public static final class ForIn implements Stmt {
        public final Token variable;
        public final Expr.ExprInterface iterable;
        public final Stmt body;

        public ForIn(Token variable, Expr.ExprInterface iterable, Stmt body) {
            this.variable = variable;
            this.iterable = iterable;
            this.body = body;
        }

        public Token token() { return variable; }
        public <R> R accept(StmtVisitor<R> visitor) { return visitor.visitForInStmt(this); }
    }

    /** Labels are plain expressions or Expr.Range nodes. */
    public static final class CaseBranch {
        public final List<Expr.ExprInterface> labels;
        public final Stmt body;

        public CaseBranch(List<Expr.ExprInterface> labels, Stmt body) {
            this.labels = orEmpty(labels);
            this.body = body;
        }
    }

    public static final class Case implements Stmt {
        public final Token keyword;
        public final Expr.ExprInterface selector;
        public final List<CaseBranch> branches;
        public final Stmt elseBranch;

        public Case(Token keyword, Expr.ExprInterface selector, List<CaseBranch> branches, Stmt elseBranch) {
            this.keyword = keyword;
            this.selector = selector;
            this.branches = orEmpty(branches);
            this.elseBranch = elseBranch;
        }

        public Token token() { return keyword; }
        public <R> R accept(StmtVisitor<R> visitor) { return visitor.visitCaseStmt(this); }
    }

    public static final class Break implements Stmt {
        public final Token keyword;

        public Break(Token keyword) { this.keyword = keyword; }

        public Token token() { return keyword; }
        public <R> R accept(StmtVisitor<R> visitor) { return visitor.visitBreakStmt(this); }
    }

    public static final class Continue implements Stmt {
        public final Token keyword;

        public Continue(Token keyword) { this.keyword = keyword; }

        public Token token() { return keyword; }
        public <R> R accept(StmtVisitor<R> visitor) { return visitor.visitContinueStmt(this); }
    }

    /** Exit or Exit(value). */
    public static final class Exit implements Stmt {
        public final Token keyword;
        public final Expr.ExprInterface value;

        public Exit(Token keyword, Expr.ExprInterface value) {
            this.keyword = keyword;
            this.value = value;
        }

        public Token token() { return keyword; }
        public <R> R accept(StmtVisitor<R> visitor) { return visitor.visitExitStmt(this); }
    }

    // -------------------------
    // Exceptions
    // -------------------------

    /** on [variable:] Type do body; a null type catches everything. */
    public static final class ExceptHandler {
        public final Token variable;
        public final TypeRef exceptionType;
        public final Stmt body;

        public ExceptHandler(Token variable, TypeRef exceptionType, Stmt body) {
            this.variable = variable;
            this.exceptionType = exceptionType;
            this.body = body;
        }
    }

    /**
     * except section. With no handlers the else block is the catch-all body
     * (except Stmts end); with handlers it runs when none of them match.
     */
    public static final class ExceptClause {
        public final List<ExceptHandler> handlers;
        public final List<Stmt> elseBlock;

        public ExceptClause(List<ExceptHandler> handlers, List<Stmt> elseBlock) {
            this.handlers = orEmpty(handlers);
            this.elseBlock = elseBlock;
        }
    }

    public static final class Try implements Stmt {
        public final Token keyword;
        public final List<Stmt> body;
        public final ExceptClause except;
        public final List<Stmt> finallyBlock;

        public Try(Token keyword, List<Stmt> body, ExceptClause except, List<Stmt> finallyBlock) {
            this.keyword = keyword;
            this.body = orEmpty(body);
            this.except = except;
            this.finallyBlock = finallyBlock;
        }

        public Token token() { return keyword; }
        public <R> R accept(StmtVisitor<R> visitor) { return visitor.visitTryStmt(this); }
    }

    /** raise expr, or bare raise when exception is null. */
    public static final class Raise implements Stmt {
        public final Token keyword;
        public final Expr.ExprInterface exception;

        public Raise(Token keyword, Expr.ExprInterface exception) {
            this.keyword = keyword;
            this.exception = exception;
        }

        public Token token() { return keyword; }
        public <R> R accept(StmtVisitor<R> visitor) { return visitor.visitRaiseStmt(this); }
    }

    // -------------------------
    // Declarations
    // -------------------------

    public static final class Param {
        public final Token name;
        public final TypeRef type;
        public final boolean byRef;
        public final Expr.ExprInterface defaultValue;

        public Param(Token name, TypeRef type, boolean byRef, Expr.ExprInterface defaultValue) {
            this.name = name;
            this.type = type;
            this.byRef = byRef;
            this.defaultValue = defaultValue;
        }

        public Param(Token name, TypeRef type) {
            this(name, type, false, null);
        }
    }

    public enum Directive {
        CLASS_METHOD, CONSTRUCTOR, DESTRUCTOR, VIRTUAL, OVERRIDE, REINTRODUCE, ABSTRACT, OVERLOAD
    }

    /**
     * Function, procedure or method. A null returnType is a procedure.
     * Abstract methods carry a null body.
     */
    public static final class FunctionDecl implements Stmt {
        public final Token name;
        public final List<Param> params;
        public final TypeRef returnType;
        public final List<Stmt> body;
        public final Set<Directive> directives;

        public FunctionDecl(Token name, List<Param> params, TypeRef returnType, List<Stmt> body, Set<Directive> directives) {
            this.name = name;
            this.params = orEmpty(params);
            this.returnType = returnType;
            this.body = body;
            this.directives = (directives == null || directives.isEmpty())
                    ? EnumSet.noneOf(Directive.class) : EnumSet.copyOf(directives);
        }

        public FunctionDecl(Token name, List<Param> params, TypeRef returnType, List<Stmt> body) {
            this(name, params, returnType, body, null);
        }

        public boolean has(Directive d) {
            return directives.contains(d);
        }

        public Token token() { return name; }
        public <R> R accept(StmtVisitor<R> visitor) { return visitor.visitFunctionStmt(this); }
    }

    public static final class FieldDecl {
        public final Token name;
        public final TypeRef type;
        public final Expr.ExprInterface initializer;
        public final boolean classVar;

        public FieldDecl(Token name, TypeRef type, Expr.ExprInterface initializer, boolean classVar) {
            this.name = name;
            this.type = type;
            this.initializer = initializer;
            this.classVar = classVar;
        }

        public FieldDecl(Token name, TypeRef type) {
            this(name, type, null, false);
        }
    }

    /**
     * property Name[indexParams]: Type read readSpec write writeSpec [default];
     * specs name a field or a method, either may be null.
     */
    public static final class PropertyDecl {
        public final Token name;
        public final TypeRef type;
        public final List<Param> indexParams;
        public final String readSpec;
        public final String writeSpec;
        public final boolean isDefault;

        public PropertyDecl(Token name, TypeRef type, List<Param> indexParams,
                            String readSpec, String writeSpec, boolean isDefault) {
            this.name = name;
            this.type = type;
            this.indexParams = orEmpty(indexParams);
            this.readSpec = readSpec;
            this.writeSpec = writeSpec;
            this.isDefault = isDefault;
        }
    }

    public enum OperatorKind { OPERATOR, IMPLICIT, EXPLICIT }

    /**
     * operator + (TA, TB): TC uses Binding;
     * operator implicit (TA): TB uses Binding;
     * Inside a class declaration the binding names a member of that class.
     */
    public static final class OperatorDecl implements Stmt {
        public final Token operator;
        public final OperatorKind kind;
        public final List<TypeRef> operandTypes;
        public final TypeRef resultType;
        public final Token binding;

        public OperatorDecl(Token operator, OperatorKind kind, List<TypeRef> operandTypes, TypeRef resultType, Token binding) {
            this.operator = operator;
            this.kind = kind;
            this.operandTypes = orEmpty(operandTypes);
            this.resultType = resultType;
            this.binding = binding;
        }

        public Token token() { return operator; }
        public <R> R accept(StmtVisitor<R> visitor) { return visitor.visitOperatorStmt(this); }
    }

    public static final class ClassDecl implements Stmt {
        public final Token name;
        public final Token parent;
        public final List<Token> interfaces;
        public final List<FieldDecl> fields;
        public final List<FunctionDecl> methods;
        public final List<PropertyDecl> properties;
        public final List<OperatorDecl> operators;
        public final boolean isAbstract;

        public ClassDecl(Token name, Token parent, List<Token> interfaces, List<FieldDecl> fields,
                         List<FunctionDecl> methods, List<PropertyDecl> properties,
                         List<OperatorDecl> operators, boolean isAbstract) {
            this.name = name;
            this.parent = parent;
            this.interfaces = orEmpty(interfaces);
            this.fields = orEmpty(fields);
            this.methods = orEmpty(methods);
            this.properties = orEmpty(properties);
            this.operators = orEmpty(operators);
            this.isAbstract = isAbstract;
        }

        public Token token() { return name; }
        public <R> R accept(StmtVisitor<R> visitor) { return visitor.visitClassStmt(this); }
    }

    public static final class RecordDecl implements Stmt {
        public final Token name;
        public final List<FieldDecl> fields;
        public final List<FunctionDecl> methods;
        public final List<PropertyDecl> properties;
        public final List<OperatorDecl> operators;

        public RecordDecl(Token name, List<FieldDecl> fields, List<FunctionDecl> methods,
                          List<PropertyDecl> properties, List<OperatorDecl> operators) {
            this.name = name;
            this.fields = orEmpty(fields);
            this.methods = orEmpty(methods);
            this.properties = orEmpty(properties);
            this.operators = orEmpty(operators);
        }

        public Token token() { return name; }
        public <R> R accept(StmtVisitor<R> visitor) { return visitor.visitRecordStmt(this); }
    }

    public static final class InterfaceDecl implements Stmt {
        public final Token name;
        public final Token parent;
        public final List<FunctionDecl> methods;
        public final List<PropertyDecl> properties;

        public InterfaceDecl(Token name, Token parent, List<FunctionDecl> methods, List<PropertyDecl> properties) {
            this.name = name;
            this.parent = parent;
            this.methods = orEmpty(methods);
            this.properties = orEmpty(properties);
        }

        public Token token() { return name; }
        public <R> R accept(StmtVisitor<R> visitor) { return visitor.visitInterfaceStmt(this); }
    }

    /** type TColor = (Red, Green = 5, Blue); ordinals entries may be null for implicit values. */
    public static final class EnumDecl implements Stmt {
        public final Token name;
        public final List<Token> members;
        public final List<Long> ordinals;

        public EnumDecl(Token name, List<Token> members, List<Long> ordinals) {
            this.name = name;
            this.members = orEmpty(members);
            this.ordinals = (ordinals == null) ? Collections.emptyList() : ordinals;
        }

        public Token token() { return name; }
        public <R> R accept(StmtVisitor<R> visitor) { return visitor.visitEnumStmt(this); }
    }

    public static final class TypeAlias implements Stmt {
        public final Token name;
        public final TypeRef target;

        public TypeAlias(Token name, TypeRef target) {
            this.name = name;
            this.target = target;
        }

        public Token token() { return name; }
        public <R> R accept(StmtVisitor<R> visitor) { return visitor.visitTypeAliasStmt(this); }
    }
}
