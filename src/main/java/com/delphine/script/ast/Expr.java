package com.delphine.script.ast;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;

public class Expr {

    public interface ExprInterface {
        <R> R accept(ExprVisitor<R> visitor);

        /** Position used for diagnostics; may be null for synthesized nodes. */
        Token token();
    }

    public interface ExprVisitor<R> {
        R visitLiteralExpr(Literal expr);
        R visitIdentifierExpr(Identifier expr);
        R visitBinaryExpr(Binary expr);
        R visitUnaryExpr(Unary expr);
        R visitMemberExpr(Member expr);
        R visitIndexExpr(Index expr);
        R visitCallExpr(Call expr);
        R visitArrayLiteralExpr(ArrayLiteral expr);
        R visitRecordLiteralExpr(RecordLiteral expr);
        R visitLambdaExpr(Lambda expr);
        R visitAddressOfExpr(AddressOf expr);
        R visitIsExpr(Is expr);
        R visitAsExpr(As expr);
        R visitInheritedExpr(Inherited expr);
        R visitRangeExpr(Range expr);
    }

    // -------------------------
    // Core expression nodes
    // -------------------------

    /** Literal payload is a Long, Double, String, Boolean or null (nil). */
    public static final class Literal implements ExprInterface {
        public final Object value;
        public final Token token;

        public Literal(Object value, Token token) {
            this.value = value;
            this.token = token;
        }

        @Override
        public Token token() { return token; }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitLiteralExpr(this);
        }
    }

    public static final class Identifier implements ExprInterface {
        public final Token name;

        public Identifier(Token name) {
            this.name = name;
        }

        @Override
        public Token token() { return name; }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitIdentifierExpr(this);
        }
    }

    public static final class Binary implements ExprInterface {
        public final ExprInterface left;
        public final Token operator;
        public final ExprInterface right;

        public Binary(ExprInterface left, Token operator, ExprInterface right) {
            this.left = left;
            this.operator = operator;
            this.right = right;
        }

        @Override
        public Token token() { return operator; }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitBinaryExpr(this);
        }
    }

    public static final class Unary implements ExprInterface {
        public final Token operator;
        public final ExprInterface operand;

        public Unary(Token operator, ExprInterface operand) {
            this.operator = operator;
            this.operand = operand;
        }

        @Override
        public Token token() { return operator; }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitUnaryExpr(this);
        }
    }

    /** target.name: field, property, method, class member, or JSON key. */
    public static final class Member implements ExprInterface {
        public final ExprInterface target;
        public final Token name;

        public Member(ExprInterface target, Token name) {
            this.target = target;
            this.name = name;
        }

        @Override
        public Token token() { return name; }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitMemberExpr(this);
        }
    }

    /**
     * One index level. Parsers emit a[i, j] as nested nodes ((a)[i])[j];
     * the evaluator decides whether to flatten them.
     */
    public static final class Index implements ExprInterface {
        public final ExprInterface target;
        public final ExprInterface index;
        public final Token bracket;

        public Index(ExprInterface target, ExprInterface index, Token bracket) {
            this.target = target;
            this.index = index;
            this.bracket = bracket;
        }

        @Override
        public Token token() { return bracket; }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitIndexExpr(this);
        }
    }

    // -------------------------
    // Calls
    // -------------------------

    public static final class Call implements ExprInterface {
        public final ExprInterface callee;
        public final Token paren;
        public final List<ExprInterface> arguments;

        public Call(ExprInterface callee, Token paren, List<ExprInterface> arguments) {
            this.callee = callee;
            this.paren = paren;
            this.arguments = (arguments == null) ? new ArrayList<>() : arguments;
        }

        @Override
        public Token token() { return paren; }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitCallExpr(this);
        }
    }

    /** inherited [Name[(args)]]; a null method means "same method as the caller". */
    public static final class Inherited implements ExprInterface {
        public final Token keyword;
        public final Token method;
        public final List<ExprInterface> arguments;
        public final boolean explicitArguments;

        public Inherited(Token keyword, Token method, List<ExprInterface> arguments, boolean explicitArguments) {
            this.keyword = keyword;
            this.method = method;
            this.arguments = (arguments == null) ? new ArrayList<>() : arguments;
            this.explicitArguments = explicitArguments;
        }

        @Override
        public Token token() { return keyword; }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitInheritedExpr(this);
        }
    }

    // -------------------------
    // Literals and constructors of values
    // -------------------------

    /** [e1, e2, ...] with an optional explicit type annotation. */
    public static final class ArrayLiteral implements ExprInterface {
        public final List<ExprInterface> elements;
        public final TypeRef annotation;
        public final Token bracket;

        public ArrayLiteral(List<ExprInterface> elements, TypeRef annotation, Token bracket) {
            this.elements = (elements == null) ? new ArrayList<>() : elements;
            this.annotation = annotation;
            this.bracket = bracket;
        }

        @Override
        public Token token() { return bracket; }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitArrayLiteralExpr(this);
        }
    }

    /** TPoint(X: 1; Y: 2) */
    public static final class RecordLiteral implements ExprInterface {
        public final Token typeName;
        public final LinkedHashMap<String, ExprInterface> fields; // deterministic order

        public RecordLiteral(Token typeName, LinkedHashMap<String, ExprInterface> fields) {
            this.typeName = typeName;
            this.fields = (fields == null) ? new LinkedHashMap<>() : fields;
        }

        @Override
        public Token token() { return typeName; }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitRecordLiteralExpr(this);
        }
    }

    /** Anonymous function; returnType null means procedure. */
    public static final class Lambda implements ExprInterface {
        public final Token keyword;
        public final List<Statement.Param> params;
        public final TypeRef returnType;
        public final List<Statement.Stmt> body;

        public Lambda(Token keyword, List<Statement.Param> params, TypeRef returnType, List<Statement.Stmt> body) {
            this.keyword = keyword;
            this.params = (params == null) ? new ArrayList<>() : params;
            this.returnType = returnType;
            this.body = (body == null) ? new ArrayList<>() : body;
        }

        @Override
        public Token token() { return keyword; }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitLambdaExpr(this);
        }
    }

    /** @Func or @obj.Method */
    public static final class AddressOf implements ExprInterface {
        public final Token at;
        public final ExprInterface target;

        public AddressOf(Token at, ExprInterface target) {
            this.at = at;
            this.target = target;
        }

        @Override
        public Token token() { return at; }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitAddressOfExpr(this);
        }
    }

    // -------------------------
    // Type tests
    // -------------------------

    public static final class Is implements ExprInterface {
        public final ExprInterface operand;
        public final TypeRef type;
        public final Token keyword;

        public Is(ExprInterface operand, TypeRef type, Token keyword) {
            this.operand = operand;
            this.type = type;
            this.keyword = keyword;
        }

        @Override
        public Token token() { return keyword; }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitIsExpr(this);
        }
    }

    public static final class As implements ExprInterface {
        public final ExprInterface operand;
        public final TypeRef type;
        public final Token keyword;

        public As(ExprInterface operand, TypeRef type, Token keyword) {
            this.operand = operand;
            this.type = type;
            this.keyword = keyword;
        }

        @Override
        public Token token() { return keyword; }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitAsExpr(this);
        }
    }

    /** low..high, only meaningful as a case label. */
    public static final class Range implements ExprInterface {
        public final ExprInterface low;
        public final ExprInterface high;
        public final Token dots;

        public Range(ExprInterface low, ExprInterface high, Token dots) {
            this.low = low;
            this.high = high;
            this.dots = dots;
        }

        @Override
        public Token token() { return dots; }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitRangeExpr(this);
        }
    }
}
