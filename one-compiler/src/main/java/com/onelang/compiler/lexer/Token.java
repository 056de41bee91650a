package com.onelang.compiler.lexer;

/**
 * 词法单元
 */
public final class Token {
    private final TokenType type;
    private final String lexeme;
    private final Object literal;
    private final SourceLocation location;

    public Token(TokenType type, String lexeme, Object literal, SourceLocation location) {
        this.type = type;
        this.lexeme = lexeme;
        this.literal = literal;
        this.location = location;
    }

    public TokenType getType() {
        return type;
    }

    public String getLexeme() {
        return lexeme;
    }

    /** 解码后的字面量值（Long / Double / String / Boolean），无则为 null */
    public Object getLiteral() {
        return literal;
    }

    public SourceLocation getLocation() {
        return location;
    }

    public int getLine() {
        return location.getLine();
    }

    public int getColumn() {
        return location.getColumn();
    }

    public boolean is(TokenType type) {
        return this.type == type;
    }

    public boolean isOneOf(TokenType... types) {
        for (TokenType t : types) {
            if (this.type == t) {
                return true;
            }
        }
        return false;
    }

    @Override
    public String toString() {
        if (literal != null) {
            return String.format("%s(%s, %s) at %s", type, lexeme, literal, location);
        }
        return String.format("%s(%s) at %s", type, lexeme, location);
    }
}
