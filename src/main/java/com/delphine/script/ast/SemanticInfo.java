package com.delphine.script.ast;

/**
 * Read-only view of what the semantic analyzer resolved for expression nodes.
 * Implementations may know nothing; callers fall back to runtime inference.
 */
public interface SemanticInfo {

    /** @return the resolved type of the node, or null if the analyzer recorded none */
    TypeRef typeOf(Expr.ExprInterface node);
}
