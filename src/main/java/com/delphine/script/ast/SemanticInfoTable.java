package com.delphine.script.ast;

import java.util.IdentityHashMap;
import java.util.Map;

/** Identity-keyed node to type table filled by an analyzer pass (or by tests). */
public final class SemanticInfoTable implements SemanticInfo {

    private final Map<Expr.ExprInterface, TypeRef> types = new IdentityHashMap<>();

    public SemanticInfoTable annotate(Expr.ExprInterface node, TypeRef type) {
        types.put(node, type);
        return this;
    }

    @Override
    public TypeRef typeOf(Expr.ExprInterface node) {
        return types.get(node);
    }

    public int size() {
        return types.size();
    }
}
