package com.delphine.script.ast;

/**
 * Source position carried by AST nodes for diagnostics. The lexeme is the
 * text the parser saw (identifier name, operator symbol, keyword).
 */
public class Token {
    public final String lexeme;
    public final int line;
    public final int column;

    public Token(String lexeme, int line, int column) {
        this.lexeme = lexeme;
        this.line = line;
        this.column = column;
    }

    public Token(String lexeme) {
        this(lexeme, 0, 0);
    }

    public boolean hasPosition() {
        return line > 0;
    }

    public String position() {
        return "line " + line + ", column " + column;
    }

    @Override
    public String toString() {
        return hasPosition() ? lexeme + " [" + position() + "]" : lexeme;
    }
}
